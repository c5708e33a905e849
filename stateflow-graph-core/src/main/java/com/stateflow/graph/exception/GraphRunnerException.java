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
package com.stateflow.graph.exception;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Base class of every failure raised while a compiled graph runs.
 * <p>
 * Once the runner has seen the exception it carries the id of the node that was
 * running and the state as of the last persisted checkpoint, so callers never have to
 * deal with a half merged state.
 */
public class GraphRunnerException extends RuntimeException {

	// 出错时正在执行的节点ID
	private String nodeId;

	// 最近一次成功持久化的状态
	private Map<String, Object> lastCheckpointState;

	public GraphRunnerException(String errorMessage) {
		super(errorMessage);
	}

	public GraphRunnerException(String errorMessage, Throwable cause) {
		super(errorMessage, cause);
	}

	/**
	 * Attaches run context. Values already set are kept, so the innermost caller wins.
	 * @param nodeId the node being processed when the failure occurred
	 * @param state the state as of the last successful checkpoint
	 * @return this exception
	 */
	public GraphRunnerException withContext(String nodeId, Map<String, Object> state) {
		if (this.nodeId == null) {
			this.nodeId = nodeId;
		}
		if (this.lastCheckpointState == null && state != null) {
			this.lastCheckpointState = Collections.unmodifiableMap(state);
		}
		return this;
	}

	public Optional<String> nodeId() {
		return Optional.ofNullable(nodeId);
	}

	public Map<String, Object> lastCheckpointState() {
		return lastCheckpointState != null ? lastCheckpointState : Map.of();
	}

}
