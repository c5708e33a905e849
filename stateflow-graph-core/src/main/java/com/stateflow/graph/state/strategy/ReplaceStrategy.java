/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.stateflow.graph.state.strategy;

import com.stateflow.graph.KeyStrategy;

// 覆盖策略：新值直接替换旧值
public final class ReplaceStrategy implements KeyStrategy {

	public static final ReplaceStrategy INSTANCE = new ReplaceStrategy();

	private ReplaceStrategy() {
	}

	@Override
	public Object apply(Object oldValue, Object newValue) {
		return newValue;
	}

	@Override
	public String toString() {
		return "replace";
	}

}
