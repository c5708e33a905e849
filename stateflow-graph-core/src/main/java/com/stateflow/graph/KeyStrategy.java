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
package com.stateflow.graph;

import com.stateflow.graph.state.strategy.AppendStrategy;
import com.stateflow.graph.state.strategy.ReplaceStrategy;

/**
 * Reducer of a single state field: combines the current value with the value written by
 * a node.
 */
@FunctionalInterface
public interface KeyStrategy {

	/**
	 * @param oldValue the current value, may be {@code null}
	 * @param newValue the value written by a node, may be {@code null}
	 * @return the merged value
	 * @throws IllegalArgumentException when a value has the wrong shape for this reducer
	 */
	Object apply(Object oldValue, Object newValue);

	// 字段初始值
	default Object defaultValue() {
		return null;
	}

	static KeyStrategy replace() {
		return ReplaceStrategy.INSTANCE;
	}

	static KeyStrategy append() {
		return AppendStrategy.INSTANCE;
	}

}
