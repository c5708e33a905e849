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

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Offline stand-in for a hosted chat model: the reply is computed from the prompt's
 * messages, so the examples run without credentials and always produce the same output.
 */
public class ScriptedChatModel implements ChatModel {

	private final Function<List<Message>, AssistantMessage> script;

	public ScriptedChatModel(Function<List<Message>, AssistantMessage> script) {
		this.script = Objects.requireNonNull(script, "script cannot be null");
	}

	@Override
	public ChatResponse call(Prompt prompt) {
		var reply = script.apply(prompt.getInstructions());
		return new ChatResponse(List.of(new Generation(reply)));
	}

	static Message last(List<Message> messages) {
		return messages.get(messages.size() - 1);
	}

}
