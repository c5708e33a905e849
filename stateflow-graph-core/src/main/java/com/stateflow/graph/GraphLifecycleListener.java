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

import java.util.Map;

/**
 * Callbacks fired by the runner around a graph run and each node execution. Listener
 * failures are logged and never affect the run.
 */
public interface GraphLifecycleListener {

	// 一次调用开始时触发，state 为加载或初始化后的状态
	default void onStart(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

	// 节点执行前
	default void before(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

	// 节点执行后，state 为节点返回的部分更新
	default void after(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

	default void onError(String nodeId, Map<String, Object> state, Throwable ex, RunnableConfig config) {
	}

	default void onComplete(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

	// 在中断边界暂停时触发
	default void onInterrupt(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

}
