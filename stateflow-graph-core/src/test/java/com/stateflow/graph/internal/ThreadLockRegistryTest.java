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
package com.stateflow.graph.internal;

import com.stateflow.graph.CompileConfig;
import com.stateflow.graph.KeyStrategy;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.StateGraph;
import com.stateflow.graph.StateSchema;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ThreadLockRegistryTest {

	@Test
	void idleLockIsDropped() throws Exception {
		var registry = new ThreadLockRegistry();

		var lock = registry.acquire("t1");
		registry.release("t1");
		assertEquals(1, registry.size());

		lock.unlock();
		registry.release("t1");
		assertEquals(0, registry.size());
	}

	@Test
	void waiterGetsLockAfterOwnerReleases() throws Exception {
		var registry = new ThreadLockRegistry();
		var lock = registry.acquire("t1");

		var waiter = CompletableFuture.supplyAsync(() -> {
			try {
				var acquired = registry.acquire("t1");
				acquired.unlock();
				registry.release("t1");
				return true;
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				return false;
			}
		});

		// 等待第二个线程进入排队
		while (!lock.hasQueuedThreads()) {
			Thread.sleep(5);
		}
		assertFalse(waiter.isDone());

		lock.unlock();
		registry.release("t1");

		assertTrue(waiter.get(5, TimeUnit.SECONDS));
		assertEquals(0, registry.size());
	}

	@Test
	void finishedRunsLeaveNoLocks() throws Exception {
		var saver = new MemorySaver();
		var graph = new StateGraph(StateSchema.builder().field("messages", KeyStrategy.append()).build())
			.addNode("a", state -> Map.of("messages", List.of("a")))
			.addEdge(START, "a")
			.addEdge("a", END)
			.compile(CompileConfig.builder().checkpointSaver(saver).build());

		for (int i = 0; i < 10; i++) {
			graph.invoke(Map.of("messages", List.of("hi")), RunnableConfig.builder().threadId("thread-" + i).build());
		}
		assertTrue(graph.clearState(RunnableConfig.builder().threadId("thread-0").build()));

		assertEquals(0, ThreadLockRegistry.forSaver(saver).size());
		assertTrue(saver.load("thread-0").isEmpty());
		assertTrue(saver.load("thread-1").isPresent());
	}

}
