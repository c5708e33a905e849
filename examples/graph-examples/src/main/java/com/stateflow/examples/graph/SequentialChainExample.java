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
package com.stateflow.examples.graph;

import com.stateflow.graph.KeyStrategy;
import com.stateflow.graph.OverAllState;
import com.stateflow.graph.StateGraph;
import com.stateflow.graph.StateSchema;
import com.stateflow.graph.exception.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

// 顺序链：每个节点处理数据后交给下一个节点
public class SequentialChainExample {

	private static final Logger logger = LoggerFactory.getLogger(SequentialChainExample.class);

	public static OverAllState run(String input) throws GraphStateException {
		var schema = StateSchema.builder()
			.field("input", KeyStrategy.replace())
			.field("processed", KeyStrategy.replace(), () -> "")
			.field("output", KeyStrategy.replace(), () -> "")
			.build();

		var app = new StateGraph("sequential_chain", schema).addNode("process", state -> {
			var text = state.value("input", "");
			var processed = "Processed: " + text.toUpperCase(Locale.ROOT);
			logger.info("Step 1: {} -> {}", text, processed);
			return Map.of("processed", processed);
		}).addNode("generate", state -> {
			var output = "Final: " + state.value("processed", "") + " + extra transformation";
			logger.info("Step 2: {}", output);
			return Map.of("output", output);
		}).addEdge(START, "process").addEdge("process", "generate").addEdge("generate", END).compile();

		logger.info("graph:\n{}", app.getGraph().content());
		return app.invoke(Map.of("input", input));
	}

	public static void main(String[] args) throws Exception {
		var result = run("Hello Stateflow!");
		logger.info("=== Result === {}", result.data());
	}

}
