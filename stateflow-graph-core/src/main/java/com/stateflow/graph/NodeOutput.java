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

import java.util.Objects;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

/**
 * Output emitted by the runner after a node has been executed and its update merged.
 */
public class NodeOutput {

	// 节点ID
	private final String node;

	// 合并后的状态
	private final OverAllState state;

	public static NodeOutput of(String node, OverAllState state) {
		return new NodeOutput(node, state);
	}

	protected NodeOutput(String node, OverAllState state) {
		this.node = Objects.requireNonNull(node, "node cannot be null");
		this.state = Objects.requireNonNull(state, "state cannot be null");
	}

	public String node() {
		return node;
	}

	public OverAllState state() {
		return state;
	}

	public boolean isSTART() {
		return START.equals(node);
	}

	public boolean isEND() {
		return END.equals(node);
	}

	@Override
	public String toString() {
		return String.format("NodeOutput{node=%s, state=%s}", node, state);
	}

}
