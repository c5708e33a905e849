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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-invocation configuration: the conversation thread and free-form metadata handed to
 * nodes that implement {@code NodeActionWithConfig}.
 */
public final class RunnableConfig {

	// 线程ID，为空时使用默认线程
	private final String threadId;

	// 调用方元数据
	private final Map<String, Object> metadata;

	private RunnableConfig(Builder builder) {
		this.threadId = builder.threadId;
		this.metadata = Collections.unmodifiableMap(new HashMap<>(builder.metadata));
	}

	public static Builder builder() {
		return new Builder();
	}

	public static Builder builder(RunnableConfig config) {
		return new Builder().threadId(config.threadId).metadata(config.metadata);
	}

	public Optional<String> threadId() {
		return Optional.ofNullable(threadId);
	}

	public Map<String, Object> metadata() {
		return metadata;
	}

	public Optional<Object> metadata(String key) {
		return Optional.ofNullable(metadata.get(key));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RunnableConfig that)) {
			return false;
		}
		return Objects.equals(threadId, that.threadId) && metadata.equals(that.metadata);
	}

	@Override
	public int hashCode() {
		return Objects.hash(threadId, metadata);
	}

	@Override
	public String toString() {
		return String.format("RunnableConfig{threadId=%s, metadata=%s}", threadId, metadata);
	}

	public static class Builder {

		private String threadId;

		private final Map<String, Object> metadata = new HashMap<>();

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder addMetadata(String key, Object value) {
			metadata.put(Objects.requireNonNull(key, "key cannot be null"), value);
			return this;
		}

		public Builder metadata(Map<String, Object> metadata) {
			this.metadata.putAll(metadata);
			return this;
		}

		public RunnableConfig build() {
			return new RunnableConfig(this);
		}

	}

}
