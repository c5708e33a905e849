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

import java.util.Map;

/**
 * The step function of a node. Receives a read-only snapshot of the state and returns
 * the partial update to merge into it.
 */
@FunctionalInterface
public interface NodeAction {

	/**
	 * Computes the partial state update of this node.
	 * @param state the current state snapshot, never mutated by the engine
	 * @return the keys to update; {@code null} or an empty map means no change
	 * @throws Exception any failure, reported by the runner as a node execution error
	 */
	Map<String, Object> apply(OverAllState state) throws Exception;

}
