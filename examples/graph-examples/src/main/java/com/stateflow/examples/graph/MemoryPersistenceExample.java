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

import com.stateflow.graph.CompileConfig;
import com.stateflow.graph.CompiledGraph;
import com.stateflow.graph.KeyStrategy;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.StateGraph;
import com.stateflow.graph.StateSchema;
import com.stateflow.graph.agent.AgentMessages;
import com.stateflow.graph.agent.node.LlmNode;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import com.stateflow.graph.exception.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.List;
import java.util.Map;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

/**
 * Chat memory through checkpoints: each thread id keeps its own conversation and a later
 * call on the same thread sees the earlier turns.
 */
public class MemoryPersistenceExample {

	private static final Logger logger = LoggerFactory.getLogger(MemoryPersistenceExample.class);

	// 根据历史中的第一条用户消息作答
	static ScriptedChatModel rememberingModel() {
		return new ScriptedChatModel(messages -> {
			var userTurns = messages.stream().filter(m -> m.getMessageType() == MessageType.USER).toList();
			var first = userTurns.get(0).getText();
			if (userTurns.size() == 1) {
				return new AssistantMessage("Nice to meet you. You said: " + first);
			}
			return new AssistantMessage("Earlier you told me: " + first);
		});
	}

	static CompiledGraph chatbot() throws GraphStateException {
		var schema = StateSchema.builder().field(AgentMessages.MESSAGES, KeyStrategy.append()).build();
		return new StateGraph("chatbot", schema)
			.addNode("chatbot", LlmNode.builder().chatModel(rememberingModel()).build())
			.addEdge(START, "chatbot")
			.addEdge("chatbot", END)
			.compile(CompileConfig.builder().checkpointSaver(new MemorySaver()).build());
	}

	static String say(CompiledGraph app, String threadId, String text) {
		var config = RunnableConfig.builder().threadId(threadId).build();
		List<Message> input = List.of(new UserMessage(text));
		var state = app.invoke(Map.of(AgentMessages.MESSAGES, input), config);
		return AgentMessages.last(state, AgentMessages.MESSAGES).map(Message::getText).orElse("");
	}

	public static void main(String[] args) throws Exception {
		var app = chatbot();
		logger.info("thread-1: {}", say(app, "thread-1", "Hi, my name is Alice"));
		logger.info("thread-1: {}", say(app, "thread-1", "What's my name?"));
		logger.info("thread-2: {}", say(app, "thread-2", "What's my name?"));
	}

}
