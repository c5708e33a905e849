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
package com.stateflow.graph.observation;

import io.micrometer.common.docs.KeyName;

/**
 * Observation names and key names used by {@link GraphObservationLifecycleListener}.
 */
public final class GraphObservationDocumentation {

	/** 图运行观察名称 */
	public static final String GRAPH_OBSERVATION = "stateflow.graph";

	/** 节点执行观察名称 */
	public static final String NODE_OBSERVATION = "stateflow.graph.node";

	private GraphObservationDocumentation() {
	}

	/**
	 * Low cardinality key names, suitable for grouping and filtering.
	 */
	public enum LowCardinalityKeyNames implements KeyName {

		/**
		 * Name of the compiled graph.
		 */
		GRAPH_NAME {
			@Override
			public String asString() {
				return "stateflow.graph.name";
			}
		},

		/**
		 * Id of the executed node.
		 */
		NODE_ID {
			@Override
			public String asString() {
				return "stateflow.graph.node.id";
			}
		},

		/**
		 * How the run ended: completed, interrupted or error.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "stateflow.graph.outcome";
			}
		}

	}

	/**
	 * High cardinality key names, one value per conversation.
	 */
	public enum HighCardinalityKeyNames implements KeyName {

		THREAD_ID {
			@Override
			public String asString() {
				return "stateflow.graph.thread.id";
			}
		}

	}

}
