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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphExamplesTest {

	@Test
	void sequentialChainRunsBothSteps() throws Exception {
		var result = SequentialChainExample.run("Hello Stateflow!");

		assertEquals("Processed: HELLO STATEFLOW!", result.value("processed", ""));
		assertEquals("Final: Processed: HELLO STATEFLOW! + extra transformation", result.value("output", ""));
	}

	@Test
	void reactAgentAnswersFromToolResult() throws Exception {
		var answer = ReactAgentExample.run();

		assertFalse(answer.hasToolCalls());
		assertTrue(answer.getText().contains("It's always sunny in San Francisco!"));
	}

	@Test
	void memoryIsKeptPerThread() throws Exception {
		var app = MemoryPersistenceExample.chatbot();

		MemoryPersistenceExample.say(app, "thread-1", "Hi, my name is Alice");
		var remembered = MemoryPersistenceExample.say(app, "thread-1", "What's my name?");
		var fresh = MemoryPersistenceExample.say(app, "thread-2", "What's my name?");

		assertEquals("Earlier you told me: Hi, my name is Alice", remembered);
		assertEquals("Nice to meet you. You said: What's my name?", fresh);
	}

	@Test
	void approvedEmailIsSent() throws Exception {
		var answer = HumanInTheLoopExample.run(true);

		assertTrue(answer.startsWith("Done: "));
		assertTrue(answer.contains("Email sent to alice@example.com with subject 'Meeting'"));
	}

	@Test
	void rejectedEmailStaysPending() throws Exception {
		assertEquals("Workflow terminated by user", HumanInTheLoopExample.run(false));
	}

	@Test
	void routerPicksOneSpecialist() throws Exception {
		assertTrue(MultiAgentExample.run("Implement a binary search function").startsWith("CODE: "));
		assertTrue(MultiAgentExample.run("Write a blog post about graphs").startsWith("CONTENT: "));
		assertTrue(MultiAgentExample.run("Explain how transformers work").startsWith("RESEARCH: "));
	}

}
