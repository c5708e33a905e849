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
import com.stateflow.graph.RunnableConfig;

import java.util.Map;

// 带运行配置的节点动作，可读取线程ID和元数据
@FunctionalInterface
public interface NodeActionWithConfig {

	Map<String, Object> apply(OverAllState state, RunnableConfig config) throws Exception;

	// 将普通节点动作适配为带配置的节点动作
	static NodeActionWithConfig of(NodeAction action) {
		return (state, config) -> action.apply(state);
	}

}
