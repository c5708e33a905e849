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
import com.stateflow.graph.action.NodeActionWithConfig;
import com.stateflow.graph.agent.AgentMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.stateflow.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Step adapter over a Spring AI {@link ChatModel}: sends the message history and appends
 * the model's reply. Tool execution is left to the graph, so the model only proposes
 * tool calls and a {@link ToolNode} runs them.
 */
public class LlmNode implements NodeActionWithConfig {

	private static final Logger logger = LoggerFactory.getLogger(LlmNode.class);

	private final ChatModel chatModel;

	private final List<ToolCallback> toolCallbacks;

	private final String systemPrompt;

	private final String messagesKey;

	private LlmNode(Builder builder) {
		this.chatModel = Objects.requireNonNull(builder.chatModel, "chatModel cannot be null");
		this.toolCallbacks = List.copyOf(builder.toolCallbacks);
		this.systemPrompt = builder.systemPrompt;
		this.messagesKey = builder.messagesKey;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Map<String, Object> apply(OverAllState state, RunnableConfig config) throws Exception {
		List<Message> messages = new ArrayList<>();
		if (systemPrompt != null) {
			messages.add(new SystemMessage(systemPrompt));
		}
		messages.addAll(AgentMessages.of(state, messagesKey));

		// 关闭框架内部的工具执行，由图中的工具节点负责
		var options = ToolCallingChatOptions.builder()
			.toolCallbacks(toolCallbacks)
			.internalToolExecutionEnabled(false)
			.build();

		var output = chatModel.call(new Prompt(messages, options)).getResult().getOutput();
		logger.debug("[ThreadId {}] model replied with {} tool call(s)", config.threadId().orElse(THREAD_ID_DEFAULT),
				output.getToolCalls().size());
		return Map.of(messagesKey, List.of(output));
	}

	public static class Builder {

		private ChatModel chatModel;

		private List<ToolCallback> toolCallbacks = new ArrayList<>();

		private String systemPrompt;

		private String messagesKey = AgentMessages.MESSAGES;

		private Builder() {
		}

		public Builder chatModel(ChatModel chatModel) {
			this.chatModel = chatModel;
			return this;
		}

		public Builder toolCallbacks(List<ToolCallback> toolCallbacks) {
			this.toolCallbacks = new ArrayList<>(toolCallbacks);
			return this;
		}

		public Builder systemPrompt(String systemPrompt) {
			this.systemPrompt = systemPrompt;
			return this;
		}

		public Builder messagesKey(String messagesKey) {
			this.messagesKey = messagesKey;
			return this;
		}

		public LlmNode build() {
			return new LlmNode(this);
		}

	}

}
