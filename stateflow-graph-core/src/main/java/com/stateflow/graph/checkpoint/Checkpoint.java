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
package com.stateflow.graph.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.stateflow.graph.StateGraph.END;

/**
 * Persisted continuation of a thread: the full state plus the nodes to run next. The
 * pending node list is the entire continuation, so a run can be resumed by any process
 * that can read the checkpoint.
 */
public final class Checkpoint {

	// 检查点ID
	private final String id;

	// 所属线程ID
	private final String threadId;

	// 完整状态
	private final Map<String, Object> state;

	// 待执行节点，已完成时为空
	private final List<String> nextNodes;

	// 是否停在中断边界
	private final boolean interrupted;

	// 创建时间（毫秒）
	private final long createdAt;

	@JsonCreator
	public Checkpoint(@JsonProperty("id") String id, @JsonProperty("threadId") String threadId,
			@JsonProperty("state") Map<String, Object> state, @JsonProperty("nextNodes") List<String> nextNodes,
			@JsonProperty("interrupted") boolean interrupted, @JsonProperty("createdAt") long createdAt) {
		this.id = Objects.requireNonNull(id, "id cannot be null");
		this.threadId = Objects.requireNonNull(threadId, "threadId cannot be null");
		this.state = Collections
			.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(state, "state cannot be null")));
		this.nextNodes = nextNodes == null ? List.of() : nextNodes.stream().filter(n -> !END.equals(n)).toList();
		this.interrupted = interrupted;
		this.createdAt = createdAt;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getId() {
		return id;
	}

	public String getThreadId() {
		return threadId;
	}

	public Map<String, Object> getState() {
		return state;
	}

	public List<String> getNextNodes() {
		return nextNodes;
	}

	public boolean isInterrupted() {
		return interrupted;
	}

	public long getCreatedAt() {
		return createdAt;
	}

	public boolean hasPendingNodes() {
		return !nextNodes.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Checkpoint that)) {
			return false;
		}
		return interrupted == that.interrupted && createdAt == that.createdAt && id.equals(that.id)
				&& threadId.equals(that.threadId) && state.equals(that.state) && nextNodes.equals(that.nextNodes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, threadId, state, nextNodes, interrupted, createdAt);
	}

	@Override
	public String toString() {
		return String.format("Checkpoint{id=%s, threadId=%s, nextNodes=%s, interrupted=%s, state=%s}", id, threadId,
				nextNodes, interrupted, state);
	}

	public static class Builder {

		private String id = UUID.randomUUID().toString();

		private String threadId;

		private Map<String, Object> state = Map.of();

		private List<String> nextNodes = List.of();

		private boolean interrupted;

		private long createdAt = System.currentTimeMillis();

		public Builder id(String id) {
			this.id = id;
			return this;
		}

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder state(Map<String, Object> state) {
			this.state = state;
			return this;
		}

		public Builder nextNodes(List<String> nextNodes) {
			this.nextNodes = nextNodes;
			return this;
		}

		public Builder interrupted(boolean interrupted) {
			this.interrupted = interrupted;
			return this;
		}

		public Builder createdAt(long createdAt) {
			this.createdAt = createdAt;
			return this;
		}

		public Checkpoint build() {
			return new Checkpoint(id, threadId, state, nextNodes, interrupted, createdAt);
		}

	}

}
