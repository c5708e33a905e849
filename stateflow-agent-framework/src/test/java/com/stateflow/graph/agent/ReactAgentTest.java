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
package com.stateflow.graph.agent;

import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.agent.node.ToolNode;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import com.stateflow.graph.exception.GraphRunnerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReactAgentTest {

	@Mock
	private ChatModel chatModel;

	@Mock
	private ToolCallback weatherTool;

	@Mock
	private ToolDefinition weatherDefinition;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		when(weatherDefinition.name()).thenReturn("weather");
		when(weatherTool.getToolDefinition()).thenReturn(weatherDefinition);
		when(weatherTool.call(anyString())).thenReturn("sunny, 24C");
	}

	private static ChatResponse reply(AssistantMessage message) {
		return new ChatResponse(List.of(new Generation(message)));
	}

	private static AssistantMessage weatherCall(String id) {
		return new AssistantMessage("", Map.of(),
				List.of(new AssistantMessage.ToolCall(id, "function", "weather", "{\"city\":\"Rome\"}")));
	}

	@SuppressWarnings("unchecked")
	private static List<Message> messages(ReactAgent agent, RunnableConfig config) {
		return (List<Message>) agent.getState(config).values().get(AgentMessages.MESSAGES);
	}

	@Test
	void cyclesThroughToolsUntilFinalAnswer() throws Exception {
		when(chatModel.call(any(Prompt.class))).thenReturn(reply(weatherCall("c1")),
				reply(new AssistantMessage("It is sunny in Rome.")));
		var agent = ReactAgent.builder().model(chatModel).tools(weatherTool).saver(new MemorySaver()).build();
		var config = RunnableConfig.builder().threadId("rome").build();

		var answer = agent.call("What is the weather in Rome?", config);

		assertEquals("It is sunny in Rome.", answer.getText());
		var history = messages(agent, config);
		assertEquals(4, history.size());
		var toolResponse = assertInstanceOf(ToolResponseMessage.class, history.get(2));
		assertEquals("c1", toolResponse.getResponses().get(0).id());
		assertEquals("sunny, 24C", toolResponse.getResponses().get(0).responseData());
		verify(chatModel, times(2)).call(any(Prompt.class));
	}

	@Test
	void pausesBeforeToolsAndResumes() throws Exception {
		when(chatModel.call(any(Prompt.class))).thenReturn(reply(weatherCall("c1")),
				reply(new AssistantMessage("Rome is sunny.")));
		var agent = ReactAgent.builder()
			.model(chatModel)
			.tools(weatherTool)
			.saver(new MemorySaver())
			.interruptBeforeTools(true)
			.build();
		var config = RunnableConfig.builder().threadId("approval").build();

		var pending = agent.call("Weather in Rome?", config);

		assertTrue(pending.hasToolCalls());
		var snapshot = agent.getState(config);
		assertTrue(snapshot.interrupted());
		assertEquals(List.of(ToolNode.TOOL_NODE_NAME), snapshot.next());
		verify(weatherTool, never()).call(anyString());

		var answer = agent.resume(config);

		assertEquals("Rome is sunny.", answer.getText());
		assertTrue(agent.getState(config).isCompleted());
		verify(weatherTool).call(anyString());
	}

	@Test
	void conversationContinuesOnSameThread() throws Exception {
		when(chatModel.call(any(Prompt.class))).thenReturn(reply(new AssistantMessage("Hi Bob.")),
				reply(new AssistantMessage("Your name is Bob.")));
		var agent = ReactAgent.builder().model(chatModel).saver(new MemorySaver()).build();
		var config = RunnableConfig.builder().threadId("memory").build();

		agent.call("I am Bob", config);
		var answer = agent.call("What is my name?", config);

		assertEquals("Your name is Bob.", answer.getText());
		assertEquals(4, messages(agent, config).size());
	}

	@Test
	void endlessToolUseHitsIterationLimit() throws Exception {
		when(chatModel.call(any(Prompt.class))).thenReturn(reply(weatherCall("loop")));
		var agent = ReactAgent.builder().model(chatModel).tools(weatherTool).maxIterations(3).build();

		var ex = assertThrows(GraphRunnerException.class, () -> agent.call("loop forever"));

		assertTrue(ex.getMessage().contains("recursion limit of 6"));
		verify(chatModel, times(3)).call(any(Prompt.class));
	}

	@Test
	void requiresModel() {
		assertThrows(NullPointerException.class, () -> ReactAgent.builder().build());
	}

}
