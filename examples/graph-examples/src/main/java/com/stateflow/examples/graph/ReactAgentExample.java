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

import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.agent.ReactAgent;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import com.stateflow.graph.exception.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Tool-using agent: the model asks for the weather tool once, then answers from the tool
 * result.
 */
public class ReactAgentExample {

	private static final Logger logger = LoggerFactory.getLogger(ReactAgentExample.class);

	// 天气查询工具
	static class WeatherTool implements BiFunction<String, ToolContext, String> {

		@Override
		public String apply(String city, ToolContext toolContext) {
			return "It's always sunny in " + city + "!";
		}

	}

	static ScriptedChatModel weatherModel() {
		return new ScriptedChatModel(messages -> {
			if (ScriptedChatModel.last(messages) instanceof ToolResponseMessage toolResponse) {
				return new AssistantMessage("The forecast says: " + toolResponse.getResponses().get(0).responseData());
			}
			return new AssistantMessage("", Map.of(),
					List.of(new AssistantMessage.ToolCall("call-1", "function", "get_weather", "\"San Francisco\"")));
		});
	}

	static ToolCallback weatherTool() {
		return FunctionToolCallback.builder("get_weather", new WeatherTool())
			.description("Get weather for a given city")
			.inputType(String.class)
			.build();
	}

	public static AssistantMessage run() throws GraphStateException {
		var agent = ReactAgent.builder()
			.name("weather_agent")
			.model(weatherModel())
			.tools(weatherTool())
			.systemPrompt("You are a helpful assistant")
			.saver(new MemorySaver())
			.build();

		return agent.call("what is the weather in San Francisco", RunnableConfig.builder().threadId("weather").build());
	}

	public static void main(String[] args) throws Exception {
		logger.info("{}", run().getText());
	}

}
