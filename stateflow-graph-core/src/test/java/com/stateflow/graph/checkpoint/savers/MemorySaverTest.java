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
package com.stateflow.graph.checkpoint.savers;

import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.checkpoint.Checkpoint;
import com.stateflow.graph.exception.CheckpointException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.stateflow.graph.StateGraph.END;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MemorySaverTest {

	private static Checkpoint checkpoint(String threadId, String value) {
		return Checkpoint.builder().threadId(threadId).state(Map.of("value", value)).nextNodes(List.of("a")).build();
	}

	@Test
	void lastWriteWinsPerThread() {
		var saver = new MemorySaver();
		var first = checkpoint("t1", "one");
		var second = checkpoint("t1", "two");

		saver.save("t1", first);
		saver.save("t1", second);

		assertSame(second, saver.load("t1").orElseThrow());
		assertTrue(saver.load("t2").isEmpty());
	}

	@Test
	void missingThreadIdUsesDefaultThread() {
		var saver = new MemorySaver();
		saver.put(RunnableConfig.builder().build(), checkpoint(MemorySaver.THREAD_ID_DEFAULT, "x"));

		assertTrue(saver.load(MemorySaver.THREAD_ID_DEFAULT).isPresent());
	}

	@Test
	void clearRemovesCheckpoint() {
		var saver = new MemorySaver();
		var config = RunnableConfig.builder().threadId("t1").build();
		saver.put(config, checkpoint("t1", "x"));

		assertTrue(saver.clear(config));
		assertFalse(saver.clear(config));
		assertTrue(saver.get(config).isEmpty());
	}

	@Test
	void failedWriteKeepsPreviousCheckpoint() {
		var saver = new MemorySaver() {
			@Override
			protected void insertedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
				if ("broken".equals(checkpoint.getState().get("value"))) {
					throw new IOException("disk full");
				}
			}
		};
		var good = checkpoint("t1", "good");
		saver.save("t1", good);

		var ex = assertThrows(CheckpointException.class, () -> saver.save("t1", checkpoint("t1", "broken")));

		assertTrue(ex.getCause() instanceof IOException);
		assertSame(good, saver.load("t1").orElseThrow());
	}

	@Test
	void endIsNotStoredAsPendingNode() {
		var checkpoint = Checkpoint.builder().threadId("t1").state(Map.of()).nextNodes(List.of(END)).build();

		assertEquals(List.of(), checkpoint.getNextNodes());
		assertFalse(checkpoint.hasPendingNodes());
	}

}
