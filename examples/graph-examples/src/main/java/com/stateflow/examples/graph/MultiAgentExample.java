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

import com.stateflow.graph.CompiledGraph;
import com.stateflow.graph.KeyStrategy;
import com.stateflow.graph.StateGraph;
import com.stateflow.graph.StateSchema;
import com.stateflow.graph.action.NodeAction;
import com.stateflow.graph.agent.AgentMessages;
import com.stateflow.graph.agent.KeywordRouter;
import com.stateflow.graph.exception.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;
import java.util.Map;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

/**
 * Router over specialised agents: a keyword branch out of START picks exactly one of
 * researcher, coder or writer.
 */
public class MultiAgentExample {

	private static final Logger logger = LoggerFactory.getLogger(MultiAgentExample.class);

	public static final String RESEARCHER = "researcher";

	public static final String CODER = "coder";

	public static final String WRITER = "writer";

	// 把角色提示词原样回显，便于观察路由结果
	static ScriptedChatModel echoModel() {
		return new ScriptedChatModel(messages -> new AssistantMessage(ScriptedChatModel.last(messages).getText()));
	}

	static NodeAction specialist(ChatModel model, String role, String prefix) {
		return state -> {
			var query = AgentMessages.last(state, AgentMessages.MESSAGES).map(Message::getText).orElse("");
			logger.info("[{}] Processing: {}", role, query);
			var response = model.call(new Prompt("You are a " + role + " agent. Query: " + query));
			return Map.of("result", prefix + response.getResult().getOutput().getText());
		};
	}

	static CompiledGraph build(ChatModel model) throws GraphStateException {
		var schema = StateSchema.builder()
			.field(AgentMessages.MESSAGES, KeyStrategy.append())
			.field("result", KeyStrategy.replace())
			.build();

		var router = KeywordRouter.builder()
			.route("code", CODER)
			.route("function", CODER)
			.route("api", CODER)
			.route("implement", CODER)
			.route("debug", CODER)
			.route("write", WRITER)
			.route("article", WRITER)
			.route("blog", WRITER)
			.route("story", WRITER)
			.defaultRoute(RESEARCHER)
			.build();

		return new StateGraph("multi_agent", schema).addNode(RESEARCHER, specialist(model, RESEARCHER, "RESEARCH: "))
			.addNode(CODER, specialist(model, CODER, "CODE: "))
			.addNode(WRITER, specialist(model, WRITER, "CONTENT: "))
			.addConditionalEdges(START, router, Map.of(RESEARCHER, RESEARCHER, CODER, CODER, WRITER, WRITER))
			.addEdge(RESEARCHER, END)
			.addEdge(CODER, END)
			.addEdge(WRITER, END)
			.compile();
	}

	public static String run(String query) throws GraphStateException {
		var state = build(echoModel()).invoke(Map.of(AgentMessages.MESSAGES, List.of(query)));
		return state.value("result", "");
	}

	public static void main(String[] args) throws Exception {
		for (String query : List.of("Implement a binary search function", "Write a blog post about graphs",
				"Explain how transformers work")) {
			logger.info("{} -> {}", query, run(query));
		}
	}

}
