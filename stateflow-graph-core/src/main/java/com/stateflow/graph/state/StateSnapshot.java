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
package com.stateflow.graph.state;

import com.stateflow.graph.OverAllState;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of a thread's checkpoint.
 *
 * @param threadId the thread id
 * @param state the persisted state
 * @param next the nodes that run on the next invocation, empty when completed
 * @param interrupted whether the thread is paused at an interruption boundary
 * @param checkpointId the id of the underlying checkpoint
 */
public record StateSnapshot(String threadId, OverAllState state, List<String> next, boolean interrupted,
		String checkpointId) {

	public StateSnapshot {
		next = List.copyOf(next);
	}

	public Map<String, Object> values() {
		return state.data();
	}

	public boolean isCompleted() {
		return next.isEmpty();
	}

}
