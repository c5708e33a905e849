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
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Reads the message history of an agent state. Plain strings are accepted as user
 * messages so callers can seed a conversation without Spring AI types.
 */
public final class AgentMessages {

	public static final String MESSAGES = "messages";

	private AgentMessages() {
	}

	public static List<Message> of(OverAllState state, String key) {
		var raw = state.value(key).orElse(List.of());
		if (!(raw instanceof List<?> items)) {
			throw new IllegalStateException(format("state key '%s' must hold a list of messages", key));
		}
		List<Message> messages = new ArrayList<>(items.size());
		for (Object item : items) {
			if (item instanceof Message message) {
				messages.add(message);
			}
			else if (item instanceof String text) {
				messages.add(new UserMessage(text));
			}
			else {
				throw new IllegalStateException(format("unsupported message type %s in '%s'",
						item == null ? "null" : item.getClass().getName(), key));
			}
		}
		return messages;
	}

	public static Optional<Message> last(OverAllState state, String key) {
		var messages = of(state, key);
		return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
	}

}
