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
package com.stateflow.graph.internal.node;

import com.stateflow.graph.action.NodeActionWithConfig;

import java.util.Objects;

/**
 * A registered node: its unique id and step function.
 *
 * @param id the node id
 * @param action the step function
 */
public record Node(String id, NodeActionWithConfig action) {

	public Node {
		Objects.requireNonNull(id, "id cannot be null");
		Objects.requireNonNull(action, "action cannot be null");
	}

}
