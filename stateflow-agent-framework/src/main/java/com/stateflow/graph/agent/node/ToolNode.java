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
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.stateflow.graph.checkpoint.BaseCheckpointSaver.THREAD_ID_DEFAULT;

/**
 * Dispatches the tool calls of the last {@link AssistantMessage} to their
 * {@link ToolCallback}s.
 * <p>
 * Every call yields exactly one {@link ToolResponseMessage.ToolResponse} tagged with the
 * call id, in call order, so call/response pairs stay aligned. A missing tool or a
 * failing tool produces an error payload instead of an exception, which lets the agent
 * see the failure and choose a recovery path; sibling calls are never aborted.
 */
public class ToolNode implements NodeActionWithConfig {

	public static final String TOOL_NODE_NAME = "tools";

	/** 传给工具的上下文键：当前状态 */
	public static final String STATE_CONTEXT_KEY = "_STATE_";

	/** 传给工具的上下文键：运行配置 */
	public static final String CONFIG_CONTEXT_KEY = "_CONFIG_";

	private static final Logger logger = LoggerFactory.getLogger(ToolNode.class);

	private final List<ToolCallback> toolCallbacks;

	private final String messagesKey;

	// 可选线程池，同一条消息中的多个调用并行执行
	private final Executor executor;

	private final boolean enableActingLog;

	private ToolNode(Builder builder) {
		this.toolCallbacks = List.copyOf(builder.toolCallbacks);
		this.messagesKey = builder.messagesKey;
		this.executor = builder.executor;
		this.enableActingLog = builder.enableActingLog;
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<ToolCallback> getToolCallbacks() {
		return toolCallbacks;
	}

	@Override
	public Map<String, Object> apply(OverAllState state, RunnableConfig config) throws Exception {
		var threadId = config.threadId().orElse(THREAD_ID_DEFAULT);
		var lastMessage = AgentMessages.last(state, messagesKey)
			.orElseThrow(() -> new IllegalStateException("no message to act on"));
		if (!(lastMessage instanceof AssistantMessage assistantMessage) || !assistantMessage.hasToolCalls()) {
			throw new IllegalStateException("Last message is not an AssistantMessage with tool calls");
		}

		var toolCalls = assistantMessage.getToolCalls();
		if (enableActingLog) {
			logger.info("[ThreadId {}] acting with {} tool call(s).", threadId, toolCalls.size());
		}

		List<ToolResponseMessage.ToolResponse> responses;
		if (executor != null && toolCalls.size() > 1) {
			var futures = toolCalls.stream()
				.map(call -> CompletableFuture.supplyAsync(() -> execute(call, state, config, threadId), executor))
				.toList();
			responses = futures.stream().map(CompletableFuture::join).toList();
		}
		else {
			responses = new ArrayList<>();
			for (AssistantMessage.ToolCall toolCall : toolCalls) {
				responses.add(execute(toolCall, state, config, threadId));
			}
		}

		var toolResponseMessage = new ToolResponseMessage(responses, Map.of());
		if (enableActingLog && logger.isDebugEnabled()) {
			logger.debug("[ThreadId {}] acting returned: {}", threadId, toolResponseMessage);
		}
		return Map.of(messagesKey, List.of(toolResponseMessage));
	}

	private ToolResponseMessage.ToolResponse execute(AssistantMessage.ToolCall toolCall, OverAllState state,
			RunnableConfig config, String threadId) {
		var toolCallback = resolve(toolCall.name());
		if (toolCallback == null) {
			logger.warn("[ThreadId {}] tool {} not found.", threadId, toolCall.name());
			return new ToolResponseMessage.ToolResponse(toolCall.id(), toolCall.name(),
					"Error: tool '" + toolCall.name() + "' not found");
		}

		try {
			String result;
			if (toolCallback instanceof FunctionToolCallback<?, ?>) {
				result = toolCallback.call(toolCall.arguments(),
						new ToolContext(Map.of(STATE_CONTEXT_KEY, state, CONFIG_CONTEXT_KEY, config)));
			}
			else {
				result = toolCallback.call(toolCall.arguments());
			}
			if (enableActingLog) {
				logger.info("[ThreadId {}] tool {} finished.", threadId, toolCall.name());
			}
			return new ToolResponseMessage.ToolResponse(toolCall.id(), toolCall.name(), result);
		}
		catch (Exception e) {
			logger.warn("[ThreadId {}] tool {} execution failed: {}", threadId, toolCall.name(), e.getMessage());
			return new ToolResponseMessage.ToolResponse(toolCall.id(), toolCall.name(), "Error: " + e.getMessage());
		}
	}

	private ToolCallback resolve(String toolName) {
		return toolCallbacks.stream()
			.filter(callback -> callback.getToolDefinition().name().equals(toolName))
			.findFirst()
			.orElse(null);
	}

	public static class Builder {

		private List<ToolCallback> toolCallbacks = new ArrayList<>();

		private String messagesKey = AgentMessages.MESSAGES;

		private Executor executor;

		private boolean enableActingLog = true;

		private Builder() {
		}

		public Builder toolCallbacks(List<ToolCallback> toolCallbacks) {
			this.toolCallbacks = new ArrayList<>(Objects.requireNonNull(toolCallbacks, "toolCallbacks cannot be null"));
			return this;
		}

		public Builder messagesKey(String messagesKey) {
			this.messagesKey = Objects.requireNonNull(messagesKey, "messagesKey cannot be null");
			return this;
		}

		public Builder executor(Executor executor) {
			this.executor = executor;
			return this;
		}

		public Builder enableActingLog(boolean enableActingLog) {
			this.enableActingLog = enableActingLog;
			return this;
		}

		public ToolNode build() {
			return new ToolNode(this);
		}

	}

}
