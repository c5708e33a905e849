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

import com.stateflow.graph.checkpoint.BaseCheckpointSaver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Options applied when a {@link StateGraph} is compiled. Immutable once built.
 */
public final class CompileConfig {

	public static final int DEFAULT_RECURSION_LIMIT = 25;

	// 检查点保存器，未配置时每次调用使用临时内存存储
	private final BaseCheckpointSaver checkpointSaver;

	// 执行前需要中断的节点
	private final Set<String> interruptsBefore;

	// 单次调用最多执行的步数
	private final int recursionLimit;

	// 并行分支使用的线程池
	private final Executor executor;

	private final List<GraphLifecycleListener> lifecycleListeners;

	private CompileConfig(Builder builder) {
		this.checkpointSaver = builder.checkpointSaver;
		this.interruptsBefore = Collections.unmodifiableSet(new LinkedHashSet<>(builder.interruptsBefore));
		this.recursionLimit = builder.recursionLimit;
		this.executor = builder.executor;
		this.lifecycleListeners = List.copyOf(builder.lifecycleListeners);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<BaseCheckpointSaver> checkpointSaver() {
		return Optional.ofNullable(checkpointSaver);
	}

	public Set<String> interruptsBefore() {
		return interruptsBefore;
	}

	public int recursionLimit() {
		return recursionLimit;
	}

	public Optional<Executor> executor() {
		return Optional.ofNullable(executor);
	}

	public List<GraphLifecycleListener> lifecycleListeners() {
		return lifecycleListeners;
	}

	public static class Builder {

		private BaseCheckpointSaver checkpointSaver;

		private final Set<String> interruptsBefore = new LinkedHashSet<>();

		private int recursionLimit = DEFAULT_RECURSION_LIMIT;

		private Executor executor;

		private final List<GraphLifecycleListener> lifecycleListeners = new ArrayList<>();

		public Builder checkpointSaver(BaseCheckpointSaver checkpointSaver) {
			this.checkpointSaver = checkpointSaver;
			return this;
		}

		public Builder interruptBefore(String... nodeIds) {
			interruptsBefore.addAll(Arrays.asList(nodeIds));
			return this;
		}

		public Builder interruptBefore(Set<String> nodeIds) {
			interruptsBefore.addAll(nodeIds);
			return this;
		}

		public Builder recursionLimit(int recursionLimit) {
			if (recursionLimit < 1) {
				throw new IllegalArgumentException("recursionLimit must be positive");
			}
			this.recursionLimit = recursionLimit;
			return this;
		}

		public Builder executor(Executor executor) {
			this.executor = executor;
			return this;
		}

		public Builder withLifecycleListener(GraphLifecycleListener listener) {
			lifecycleListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
			return this;
		}

		public CompileConfig build() {
			return new CompileConfig(this);
		}

	}

}
