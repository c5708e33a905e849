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
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Human approval before tools run: the agent pauses before its tool node, a reviewer
 * inspects the pending calls, and the thread resumes only when approved.
 */
public class HumanInTheLoopExample {

	private static final Logger logger = LoggerFactory.getLogger(HumanInTheLoopExample.class);

	record Email(String to, String subject, String body) {
	}

	static ToolCallback sendEmailTool() {
		Function<Email, String> sendEmail = email -> "Email sent to " + email.to() + " with subject '"
				+ email.subject() + "'";
		return FunctionToolCallback.builder("send_email", sendEmail)
			.description("Send an email to a recipient.")
			.inputType(Email.class)
			.build();
	}

	static ScriptedChatModel emailModel() {
		return new ScriptedChatModel(messages -> {
			if (ScriptedChatModel.last(messages) instanceof ToolResponseMessage toolResponse) {
				return new AssistantMessage("Done: " + toolResponse.getResponses().get(0).responseData());
			}
			return new AssistantMessage("", Map.of(), List.of(new AssistantMessage.ToolCall("call-1", "function",
					"send_email", "{\"to\":\"alice@example.com\",\"subject\":\"Meeting\",\"body\":\"See you at 10\"}")));
		});
	}

	/**
	 * @param approve the reviewer's decision
	 * @return the agent's final answer, or the pending request when rejected
	 */
	public static String run(boolean approve) throws GraphStateException {
		var agent = ReactAgent.builder()
			.name("email_agent")
			.model(emailModel())
			.tools(sendEmailTool())
			.saver(new MemorySaver())
			.interruptBeforeTools(true)
			.build();
		var config = RunnableConfig.builder().threadId("approval-thread").build();

		logger.info("=== Step 1: Initial Request ===");
		var pending = agent.call("Send an email to alice@example.com about meeting", config);
		var snapshot = agent.getState(config);
		logger.info("Next: {}", snapshot.next());

		logger.info("=== Step 2: Human Review ===");
		for (AssistantMessage.ToolCall toolCall : pending.getToolCalls()) {
			logger.info("Tool: {} Arguments: {}", toolCall.name(), toolCall.arguments());
		}

		if (!approve) {
			logger.info("=== Request Rejected ===");
			return "Workflow terminated by user";
		}
		logger.info("=== Step 3: Resuming with Approval ===");
		return agent.resume(config).getText();
	}

	public static void main(String[] args) throws Exception {
		logger.info("Final result: {}", run(true));
	}

}
