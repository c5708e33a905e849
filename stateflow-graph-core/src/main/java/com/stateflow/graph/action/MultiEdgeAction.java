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
package com.stateflow.graph.action;

import com.stateflow.graph.OverAllState;

import java.util.List;

/**
 * Branch function that may select several mapping keys at once, resolving to a
 * fan-out of next nodes. An empty list selects no node.
 */
@FunctionalInterface
public interface MultiEdgeAction {

	List<String> apply(OverAllState state) throws Exception;

	// 单键分支函数适配为多键形式
	static MultiEdgeAction of(EdgeAction action) {
		return state -> List.of(action.apply(state));
	}

}
