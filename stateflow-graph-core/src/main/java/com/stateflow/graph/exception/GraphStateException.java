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

/**
 * Raised while a graph is being defined or compiled. Configuration mistakes never
 * reach run time.
 */
public class GraphStateException extends Exception {

	public GraphStateException(String errorMessage) {
		super(errorMessage);
	}

	public GraphStateException(String errorMessage, Throwable cause) {
		super(errorMessage, cause);
	}

}
