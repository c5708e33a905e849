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

import java.util.Set;

// 条件边返回的分支键不在映射表中时抛出
public class RoutingException extends GraphRunnerException {

	// 条件边的源节点
	private final String sourceId;

	// 分支函数返回的键
	private final String branchKey;

	// 映射表中合法的键
	private final Set<String> validKeys;

	public RoutingException(String errorMessage, String sourceId, String branchKey, Set<String> validKeys) {
		super(errorMessage);
		this.sourceId = sourceId;
		this.branchKey = branchKey;
		this.validKeys = Set.copyOf(validKeys);
	}

	public RoutingException(String errorMessage, String sourceId, Throwable cause) {
		super(errorMessage, cause);
		this.sourceId = sourceId;
		this.branchKey = null;
		this.validKeys = Set.of();
	}

	public String sourceId() {
		return sourceId;
	}

	public String branchKey() {
		return branchKey;
	}

	public Set<String> validKeys() {
		return validKeys;
	}

}
