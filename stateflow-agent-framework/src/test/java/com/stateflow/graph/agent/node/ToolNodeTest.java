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
package com.stateflow.graph.agent.node;

import com.stateflow.graph.OverAllState;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.agent.AgentMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolNodeTest {

	@Mock
	private ToolCallback weatherTool;

	@Mock
	private ToolDefinition weatherDefinition;

	@Mock
	private ToolCallback timeTool;

	@Mock
	private ToolDefinition timeDefinition;

	private final RunnableConfig config = RunnableConfig.builder().threadId("tools-thread").build();

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		when(weatherDefinition.name()).thenReturn("weather");
		when(weatherTool.getToolDefinition()).thenReturn(weatherDefinition);
		when(timeDefinition.name()).thenReturn("time");
		when(timeTool.getToolDefinition()).thenReturn(timeDefinition);
	}

	private static OverAllState stateWith(AssistantMessage message) {
		return new OverAllState(Map.of(AgentMessages.MESSAGES, List.of(new UserMessage("hi"), message)));
	}

	private static AssistantMessage toolCalls(AssistantMessage.ToolCall... calls) {
		return new AssistantMessage("", Map.of(), List.of(calls));
	}

	@SuppressWarnings("unchecked")
	private static ToolResponseMessage responseOf(Map<String, Object> update) {
		var messages = (List<Object>) update.get(AgentMessages.MESSAGES);
		assertEquals(1, messages.size());
		return (ToolResponseMessage) messages.get(0);
	}

	@Test
	void respondsToEveryCallInCallOrder() throws Exception {
		when(weatherTool.call("{\"city\":\"Paris\"}")).thenReturn("sunny");
		when(timeTool.call("{}")).thenReturn("noon");
		var node = ToolNode.builder().toolCallbacks(List.of(weatherTool, timeTool)).build();

		var update = node.apply(stateWith(toolCalls(new AssistantMessage.ToolCall("c1", "function", "time", "{}"),
				new AssistantMessage.ToolCall("c2", "function", "weather", "{\"city\":\"Paris\"}"))), config);

		var responses = responseOf(update).getResponses();
		assertEquals(2, responses.size());
		assertEquals("c1", responses.get(0).id());
		assertEquals("noon", responses.get(0).responseData());
		assertEquals("c2", responses.get(1).id());
		assertEquals("weather", responses.get(1).name());
		assertEquals("sunny", responses.get(1).responseData());
	}

	@Test
	void failingOrMissingToolBecomesErrorResponse() throws Exception {
		when(weatherTool.call(anyString())).thenThrow(new IllegalStateException("service down"));
		when(timeTool.call(anyString())).thenReturn("noon");
		var node = ToolNode.builder().toolCallbacks(List.of(weatherTool, timeTool)).build();

		var update = node.apply(stateWith(toolCalls(new AssistantMessage.ToolCall("c1", "function", "weather", "{}"),
				new AssistantMessage.ToolCall("c2", "function", "stocks", "{}"),
				new AssistantMessage.ToolCall("c3", "function", "time", "{}"))), config);

		var responses = responseOf(update).getResponses();
		assertEquals(3, responses.size());
		assertEquals("Error: service down", responses.get(0).responseData());
		assertEquals("Error: tool 'stocks' not found", responses.get(1).responseData());
		assertEquals("noon", responses.get(2).responseData());
	}

	@Test
	void parallelCallsKeepCallOrder() throws Exception {
		when(weatherTool.call(anyString())).thenAnswer(invocation -> {
			Thread.sleep(100);
			return "sunny";
		});
		when(timeTool.call(anyString())).thenReturn("noon");
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			var node = ToolNode.builder().toolCallbacks(List.of(weatherTool, timeTool)).executor(executor).build();

			var update = node.apply(
					stateWith(toolCalls(new AssistantMessage.ToolCall("c1", "function", "weather", "{}"),
							new AssistantMessage.ToolCall("c2", "function", "time", "{}"))),
					config);

			var responses = responseOf(update).getResponses();
			assertEquals(List.of("c1", "c2"), responses.stream().map(ToolResponseMessage.ToolResponse::id).toList());
			assertEquals("sunny", responses.get(0).responseData());
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void rejectsStateWithoutPendingToolCalls() {
		var node = ToolNode.builder().toolCallbacks(List.of(weatherTool)).build();
		var state = stateWith(new AssistantMessage("just text"));

		assertThrows(IllegalStateException.class, () -> node.apply(state, config));
		verify(weatherTool, never()).call(anyString());
	}

	record CityRequest(String city) {
	}

	@Test
	void functionToolReceivesStateAndConfig() throws Exception {
		var seenThread = new AtomicReference<Object>();
		BiFunction<CityRequest, ToolContext, String> lookup = (request, context) -> {
			var runConfig = (RunnableConfig) context.getContext().get(ToolNode.CONFIG_CONTEXT_KEY);
			seenThread.set(runConfig.threadId().orElse(null));
			assertNotNull(context.getContext().get(ToolNode.STATE_CONTEXT_KEY));
			return "rain in " + request.city();
		};
		ToolCallback callback = FunctionToolCallback.builder("forecast", lookup)
			.description("Weather forecast for a city")
			.inputType(CityRequest.class)
			.build();
		var node = ToolNode.builder().toolCallbacks(List.of(callback)).build();

		var update = node.apply(
				stateWith(toolCalls(new AssistantMessage.ToolCall("c1", "function", "forecast", "{\"city\":\"Oslo\"}"))),
				config);

		assertEquals("tools-thread", seenThread.get());
		assertTrue(responseOf(update).getResponses().get(0).responseData().contains("rain in Oslo"));
	}

}
