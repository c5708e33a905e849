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

import com.stateflow.graph.CompileConfig;
import com.stateflow.graph.CompiledGraph;
import com.stateflow.graph.GraphLifecycleListener;
import com.stateflow.graph.KeyStrategy;
import com.stateflow.graph.OverAllState;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.StateGraph;
import com.stateflow.graph.StateSchema;
import com.stateflow.graph.agent.node.LlmNode;
import com.stateflow.graph.agent.node.ToolNode;
import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.exception.GraphStateException;
import com.stateflow.graph.state.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.tool.ToolCallback;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

/**
 * Prebuilt reasoning-and-acting agent: a model node and a tool node joined in a cycle.
 * The model node runs first; while its reply requests tools the graph visits the tool
 * node and returns to the model, otherwise it ends.
 *
 * <pre>
 * START -&gt; agent -&gt; (tools -&gt; agent)* -&gt; END
 * </pre>
 */
public class ReactAgent {

	private static final Logger logger = LoggerFactory.getLogger(ReactAgent.class);

	public static final String AGENT_NODE_NAME = "agent";

	private final String name;

	private final StateGraph stateGraph;

	private final CompiledGraph compiledGraph;

	private ReactAgent(Builder builder) throws GraphStateException {
		this.name = builder.name;

		var schema = StateSchema.builder().field(AgentMessages.MESSAGES, KeyStrategy.append()).build();

		var llmNode = LlmNode.builder()
			.chatModel(builder.model)
			.toolCallbacks(builder.tools)
			.systemPrompt(builder.systemPrompt)
			.build();
		var toolNode = ToolNode.builder()
			.toolCallbacks(builder.tools)
			.executor(builder.executor)
			.enableActingLog(builder.enableLogging)
			.build();

		this.stateGraph = new StateGraph(name, schema).addNode(AGENT_NODE_NAME, llmNode)
			.addNode(ToolNode.TOOL_NODE_NAME, toolNode)
			.addEdge(START, AGENT_NODE_NAME)
			.addConditionalEdges(AGENT_NODE_NAME, new ToolsCondition(),
					Map.of(ToolsCondition.TOOLS, ToolNode.TOOL_NODE_NAME, ToolsCondition.END, END))
			.addEdge(ToolNode.TOOL_NODE_NAME, AGENT_NODE_NAME);

		var config = CompileConfig.builder().recursionLimit(builder.recursionLimit);
		if (builder.saver != null) {
			config.checkpointSaver(builder.saver);
		}
		if (builder.interruptBeforeTools) {
			config.interruptBefore(ToolNode.TOOL_NODE_NAME);
		}
		builder.listeners.forEach(config::withLifecycleListener);
		this.compiledGraph = stateGraph.compile(config.build());
	}

	public static Builder builder() {
		return new Builder();
	}

	public String name() {
		return name;
	}

	public StateGraph getStateGraph() {
		return stateGraph;
	}

	public CompiledGraph getCompiledGraph() {
		return compiledGraph;
	}

	public AssistantMessage call(String message) {
		return call(message, RunnableConfig.builder().build());
	}

	/**
	 * Appends a user message to the thread's conversation and runs the agent.
	 * @return the last assistant message of the resulting state; when the run paused
	 * before the tool node this is the message carrying the pending tool calls
	 */
	public AssistantMessage call(String message, RunnableConfig config) {
		List<Message> input = List.of(new UserMessage(message));
		return lastAssistantMessage(invoke(Map.of(AgentMessages.MESSAGES, input), config));
	}

	public OverAllState invoke(Map<String, Object> input, RunnableConfig config) {
		logger.debug("agent '{}' invoked on thread {}", name, config.threadId().orElse(BaseCheckpointSaver.THREAD_ID_DEFAULT));
		return compiledGraph.invoke(input, config);
	}

	/**
	 * Continues a thread paused before the tool node.
	 */
	public AssistantMessage resume(RunnableConfig config) {
		return lastAssistantMessage(compiledGraph.invoke(null, config));
	}

	public StateSnapshot getState(RunnableConfig config) {
		return compiledGraph.getState(config);
	}

	private AssistantMessage lastAssistantMessage(OverAllState state) {
		var messages = AgentMessages.of(state, AgentMessages.MESSAGES);
		for (int i = messages.size() - 1; i >= 0; i--) {
			if (messages.get(i) instanceof AssistantMessage assistantMessage) {
				return assistantMessage;
			}
		}
		throw new IllegalStateException("No AssistantMessage found in 'messages' state");
	}

	public static class Builder {

		private String name = "react_agent";

		private ChatModel model;

		private List<ToolCallback> tools = new ArrayList<>();

		private String systemPrompt;

		private BaseCheckpointSaver saver;

		private boolean interruptBeforeTools;

		private Executor executor;

		private int recursionLimit = CompileConfig.DEFAULT_RECURSION_LIMIT;

		private boolean enableLogging = true;

		private final List<GraphLifecycleListener> listeners = new ArrayList<>();

		private Builder() {
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder model(ChatModel model) {
			this.model = model;
			return this;
		}

		public Builder tools(List<ToolCallback> tools) {
			this.tools = new ArrayList<>(tools);
			return this;
		}

		public Builder tools(ToolCallback... tools) {
			return tools(List.of(tools));
		}

		public Builder systemPrompt(String systemPrompt) {
			this.systemPrompt = systemPrompt;
			return this;
		}

		public Builder saver(BaseCheckpointSaver saver) {
			this.saver = saver;
			return this;
		}

		public Builder interruptBeforeTools(boolean interruptBeforeTools) {
			this.interruptBeforeTools = interruptBeforeTools;
			return this;
		}

		public Builder executor(Executor executor) {
			this.executor = executor;
			return this;
		}

		/**
		 * Caps the number of model turns. Each turn with tool use costs two steps.
		 */
		public Builder maxIterations(int maxIterations) {
			if (maxIterations < 1) {
				throw new IllegalArgumentException("maxIterations must be positive");
			}
			this.recursionLimit = maxIterations * 2;
			return this;
		}

		public Builder recursionLimit(int recursionLimit) {
			this.recursionLimit = recursionLimit;
			return this;
		}

		public Builder enableLogging(boolean enableLogging) {
			this.enableLogging = enableLogging;
			return this;
		}

		public Builder withLifecycleListener(GraphLifecycleListener listener) {
			this.listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
			return this;
		}

		public ReactAgent build() throws GraphStateException {
			Objects.requireNonNull(model, "model cannot be null");
			return new ReactAgent(this);
		}

	}

}
