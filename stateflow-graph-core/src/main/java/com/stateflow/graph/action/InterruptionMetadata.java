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

import com.stateflow.graph.NodeOutput;
import com.stateflow.graph.OverAllState;

import java.util.List;

/**
 * Emitted when a run pauses before an interruption node. The state is the one persisted
 * in the paused checkpoint and {@link #next()} lists the nodes that will run on resume.
 */
public final class InterruptionMetadata extends NodeOutput {

	// 线程ID
	private final String threadId;

	// 恢复后将执行的节点
	private final List<String> next;

	public InterruptionMetadata(String nodeId, OverAllState state, String threadId, List<String> next) {
		super(nodeId, state);
		this.threadId = threadId;
		this.next = List.copyOf(next);
	}

	public String threadId() {
		return threadId;
	}

	public List<String> next() {
		return next;
	}

	@Override
	public String toString() {
		return String.format("""
				InterruptionMetadata{
				\tnodeId='%s',
				\tthreadId='%s',
				\tnext=%s,
				\tstate=%s
				}""", node(), threadId, next, state());
	}

}
