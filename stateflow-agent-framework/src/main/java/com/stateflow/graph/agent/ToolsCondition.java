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

import com.stateflow.graph.OverAllState;
import com.stateflow.graph.action.EdgeAction;
import org.springframework.ai.chat.messages.AssistantMessage;

/**
 * Routes to the tool node while the model keeps requesting tools, and to the end
 * otherwise.
 */
public class ToolsCondition implements EdgeAction {

	public static final String TOOLS = "tools";

	public static final String END = "end";

	private final String messagesKey;

	public ToolsCondition() {
		this(AgentMessages.MESSAGES);
	}

	public ToolsCondition(String messagesKey) {
		this.messagesKey = messagesKey;
	}

	@Override
	public String apply(OverAllState state) {
		return AgentMessages.last(state, messagesKey)
			.filter(AssistantMessage.class::isInstance)
			.map(AssistantMessage.class::cast)
			.filter(AssistantMessage::hasToolCalls)
			.map(message -> TOOLS)
			.orElse(END);
	}

}
