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

import java.util.function.Function;

import static java.lang.String.format;

/**
 * Run-time error catalogue. Each entry knows which {@link GraphRunnerException} subtype
 * it produces.
 */
public enum RunnableErrors {

	missingNode("node '%s' not found!", GraphRunnerException::new),

	missingEdge("node '%s' has no outgoing edge!", GraphRunnerException::new),

	missingInput("thread '%s' has no checkpoint: an initial state is required!", SchemaException::new),

	unknownStateKey("state update contains undeclared key(s) %s, declared keys are %s", SchemaException::new),

	recursionLimitReached("recursion limit of %d steps reached on thread '%s'!", GraphRunnerException::new),

	cancelled("run on thread '%s' was cancelled", GraphCancelledException::new);

	private final String errorMessage;

	// 根据格式化后的消息创建具体异常类型
	private final Function<String, GraphRunnerException> factory;

	RunnableErrors(String errorMessage, Function<String, GraphRunnerException> factory) {
		this.errorMessage = errorMessage;
		this.factory = factory;
	}

	public GraphRunnerException exception(Object... args) {
		return factory.apply(format(errorMessage, args));
	}

}
