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
package com.stateflow.graph;

import com.stateflow.graph.checkpoint.Checkpoint;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import com.stateflow.graph.exception.CheckpointException;
import com.stateflow.graph.exception.GraphRunnerException;
import com.stateflow.graph.exception.NodeExecutionException;
import com.stateflow.graph.exception.RoutingException;
import com.stateflow.graph.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CompiledGraphTest {

	private static StateSchema schema() {
		return StateSchema.builder().field("messages", KeyStrategy.append()).field("task").build();
	}

	private static RunnableConfig thread(String threadId) {
		return RunnableConfig.builder().threadId(threadId).build();
	}

	@SuppressWarnings("unchecked")
	private static List<Object> messages(OverAllState state) {
		return (List<Object>) state.value("messages").orElseThrow();
	}

	private static Map<String, Object> append(Object value) {
		return Map.of("messages", List.of(value));
	}

	@Test
	void sequentialNodesAppendInOrder() throws Exception {
		var graph = new StateGraph(schema()).addNode("a", state -> append("a"))
			.addNode("b", state -> append("b"))
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", END)
			.compile();

		var result = graph.invoke(Map.of("messages", List.of("input")));

		assertEquals(List.of("input", "a", "b"), messages(result));
	}

	// 路由：分支键决定下一个节点
	private static StateGraph routerGraph(AtomicInteger coderRuns, AtomicInteger writerRuns) throws Exception {
		return new StateGraph(schema()).addNode("coder_node", state -> {
			coderRuns.incrementAndGet();
			return append("code");
		})
			.addNode("writer_node", state -> {
				writerRuns.incrementAndGet();
				return append("text");
			})
			.addConditionalEdges(START, state -> state.value("task", String.class).orElse("unknown"),
					Map.of("coder", "coder_node", "writer", "writer_node"))
			.addEdge("coder_node", END)
			.addEdge("writer_node", END);
	}

	@Test
	void branchKeySelectsMappedNode() throws Exception {
		var coderRuns = new AtomicInteger();
		var writerRuns = new AtomicInteger();
		var graph = routerGraph(coderRuns, writerRuns).compile();

		var result = graph.invoke(Map.of("task", "coder"));

		assertEquals(List.of("code"), messages(result));
		assertEquals(1, coderRuns.get());
		assertEquals(0, writerRuns.get());
	}

	@Test
	void unknownBranchKeyFailsWithoutRunningAnyNode() throws Exception {
		var coderRuns = new AtomicInteger();
		var writerRuns = new AtomicInteger();
		var graph = routerGraph(coderRuns, writerRuns).compile();

		var ex = assertThrows(RoutingException.class, () -> graph.invoke(Map.of("task", "painter")));

		assertEquals("painter", ex.branchKey());
		assertEquals(Set.of("coder", "writer"), ex.validKeys());
		assertTrue(ex.getMessage().contains("coder"));
		assertEquals(0, coderRuns.get());
		assertEquals(0, writerRuns.get());
	}

	@Test
	void routingFailureKeepsLastGoodCheckpoint() throws Exception {
		var saver = new MemorySaver();
		var graph = new StateGraph(schema()).addNode("prepare", state -> append("prepared"))
			.addNode("done", state -> Map.of())
			.addEdge(START, "prepare")
			.addConditionalEdges("prepare", state -> "nowhere", Map.of("done", "done"))
			.addEdge("done", END)
			.compile(CompileConfig.builder().checkpointSaver(saver).build());
		var config = thread("routing");

		var ex = assertThrows(RoutingException.class, () -> graph.invoke(Map.of("messages", List.of("hi")), config));

		var snapshot = graph.getState(config);
		assertEquals(List.of("prepare"), snapshot.next());
		assertEquals(List.of("hi"), snapshot.values().get("messages"));
		assertEquals(snapshot.values(), ex.lastCheckpointState());
	}

	@Test
	void fanOutMergesInDeclarationOrder() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			var graph = new StateGraph(schema()).addNode("slow", state -> {
				Thread.sleep(100);
				return append("slow");
			})
				.addNode("fast", state -> append("fast"))
				.addNode("join", state -> append("join"))
				.addEdge(START, "fast")
				.addEdge(START, "slow")
				.addEdge("fast", "join")
				.addEdge("slow", "join")
				.addEdge("join", END)
				.compile(CompileConfig.builder().executor(executor).build());

			var result = graph.invoke(Map.of());

			assertEquals(List.of("slow", "fast", "join"), messages(result));
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void conditionalFanOutRunsEverySelectedBranch() throws Exception {
		var graph = new StateGraph(schema()).addNode("search", state -> append("search"))
			.addNode("calc", state -> append("calc"))
			.addNode("mail", state -> append("mail"))
			.addParallelConditionalEdges(START, state -> List.of("calc", "search"),
					Map.of("search", "search", "calc", "calc", "mail", "mail"))
			.addEdge("search", END)
			.addEdge("calc", END)
			.addEdge("mail", END)
			.compile();

		assertEquals(List.of("search", "calc"), messages(graph.invoke(Map.of())));
	}

	// agent ⇄ tools 循环
	private static StateGraph agentGraph(AtomicInteger toolRuns) throws Exception {
		return new StateGraph(schema()).addNode("agent", state -> {
			var history = messages(state);
			return append(history.contains("tool-result") ? "final" : "call");
		}).addNode("tools", state -> {
			toolRuns.incrementAndGet();
			return append("tool-result");
		})
			.addEdge(START, "agent")
			.addConditionalEdges("agent", state -> {
				var history = messages(state);
				return "call".equals(history.get(history.size() - 1)) ? "tools" : "end";
			}, Map.of("tools", "tools", "end", END))
			.addEdge("tools", "agent");
	}

	@Test
	void interruptPausesBeforeNodeAndResumes() throws Exception {
		var toolRuns = new AtomicInteger();
		var graph = agentGraph(toolRuns).compile(
				CompileConfig.builder().checkpointSaver(new MemorySaver()).interruptBefore("tools").build());
		var config = thread("hitl");

		var paused = graph.invoke(Map.of("messages", List.of("hi")), config);

		assertEquals(List.of("hi", "call"), messages(paused));
		var snapshot = graph.getState(config);
		assertEquals(List.of("tools"), snapshot.next());
		assertTrue(snapshot.interrupted());
		assertEquals(0, toolRuns.get());

		var resumed = graph.invoke(null, config);

		var reference = agentGraph(new AtomicInteger()).compile().invoke(Map.of("messages", List.of("hi")));
		assertEquals(reference, resumed);
		assertEquals(1, toolRuns.get());
		assertTrue(graph.getState(config).isCompleted());
	}

	@Test
	void updateStateEditsPausedThread() throws Exception {
		var graph = agentGraph(new AtomicInteger()).compile(
				CompileConfig.builder().checkpointSaver(new MemorySaver()).interruptBefore("tools").build());
		var config = thread("edit");
		graph.invoke(Map.of("messages", List.of("hi")), config);

		graph.updateState(config, Map.of("task", "approved"));

		var snapshot = graph.getState(config);
		assertEquals("approved", snapshot.values().get("task"));
		assertEquals(List.of("tools"), snapshot.next());
		assertTrue(snapshot.interrupted());
		assertEquals("approved", graph.invoke(null, config).value("task").orElseThrow());
	}

	@Test
	void getStateIsIdempotent() throws Exception {
		var graph = agentGraph(new AtomicInteger()).compile(
				CompileConfig.builder().checkpointSaver(new MemorySaver()).interruptBefore("tools").build());
		var config = thread("idempotent");
		graph.invoke(Map.of("messages", List.of("hi")), config);

		assertEquals(graph.getState(config), graph.getState(config));
	}

	@Test
	void completedRunResumesFromSharedSaver() throws Exception {
		var saver = new MemorySaver();
		var config = thread("restart");
		var first = agentGraph(new AtomicInteger())
			.compile(CompileConfig.builder().checkpointSaver(saver).build())
			.invoke(Map.of("messages", List.of("hi")), config);

		// 模拟进程重启：只保留检查点存储
		var restarted = agentGraph(new AtomicInteger()).compile(CompileConfig.builder().checkpointSaver(saver).build());

		assertEquals(first, restarted.invoke(null, config));
	}

	@Test
	void failedNodeKeepsCheckpointAndRetrySucceeds() throws Exception {
		var saver = new MemorySaver();
		var failOnce = new AtomicBoolean(true);
		var config = thread("retry");
		var graph = new StateGraph(schema()).addNode("a", state -> append("a")).addNode("b", state -> {
			if (failOnce.getAndSet(false)) {
				throw new IllegalStateException("backend unavailable");
			}
			return append("b");
		}).addEdge(START, "a").addEdge("a", "b").addEdge("b", END);

		var ex = assertThrows(NodeExecutionException.class,
				() -> graph.compile(CompileConfig.builder().checkpointSaver(saver).build())
					.invoke(Map.of("messages", List.of("hi")), config));

		assertEquals("b", ex.nodeId().orElseThrow());
		assertInstanceOf(IllegalStateException.class, ex.getCause());
		assertEquals(List.of("hi", "a"), ex.lastCheckpointState().get("messages"));

		var restarted = graph.compile(CompileConfig.builder().checkpointSaver(saver).build());
		assertEquals(List.of("b"), restarted.getState(config).next());

		var result = restarted.invoke(null, config);
		assertEquals(List.of("hi", "a", "b"), messages(result));
	}

	@Test
	void nodeWritingUndeclaredKeyFails() throws Exception {
		var graph = new StateGraph(schema()).addNode("bad", state -> Map.of("mood", "happy"))
			.addEdge(START, "bad")
			.addEdge("bad", END)
			.compile();

		var ex = assertThrows(SchemaException.class, () -> graph.invoke(Map.of()));
		assertEquals("bad", ex.nodeId().orElseThrow());
	}

	@Test
	void newInputOnCompletedThreadStartsNewPass() throws Exception {
		var replies = new AtomicInteger();
		var graph = new StateGraph(schema()).addNode("chatbot", state -> append("reply-" + replies.incrementAndGet()))
			.addEdge(START, "chatbot")
			.addEdge("chatbot", END)
			.compile(CompileConfig.builder().checkpointSaver(new MemorySaver()).build());
		var config = thread("memory");

		graph.invoke(Map.of("messages", List.of("hi")), config);
		var result = graph.invoke(Map.of("messages", List.of("again")), config);

		assertEquals(List.of("hi", "reply-1", "again", "reply-2"), messages(result));
	}

	@Test
	void recursionLimitStopsEndlessLoop() throws Exception {
		var graph = new StateGraph(schema()).addNode("loop", state -> append("tick"))
			.addEdge(START, "loop")
			.addConditionalEdges("loop", state -> "again", Map.of("again", "loop", "done", END))
			.compile(CompileConfig.builder().recursionLimit(5).build());

		var ex = assertThrows(GraphRunnerException.class, () -> graph.invoke(Map.of()));
		assertTrue(ex.getMessage().contains("recursion limit"));
	}

	@Test
	void invocationWithoutSaver() throws Exception {
		var graph = new StateGraph(schema()).addNode("a", state -> append("a"))
			.addEdge(START, "a")
			.addEdge("a", END)
			.compile();

		assertEquals(List.of("a"), messages(graph.invoke(Map.of(), thread("t1"))));
		assertThrows(SchemaException.class, () -> graph.invoke(null, thread("t1")));
		assertThrows(IllegalStateException.class, () -> graph.getState(thread("t1")));
	}

	@Test
	void listenersSeeNodeLifecycle() throws Exception {
		List<String> events = new ArrayList<>();
		var graph = new StateGraph(schema()).addNode("a", state -> append("a"))
			.addEdge(START, "a")
			.addEdge("a", END)
			.compile(CompileConfig.builder().withLifecycleListener(new GraphLifecycleListener() {
				@Override
				public void onStart(String nodeId, Map<String, Object> state, RunnableConfig config) {
					events.add("start");
				}

				@Override
				public void before(String nodeId, Map<String, Object> state, RunnableConfig config) {
					events.add("before:" + nodeId);
				}

				@Override
				public void after(String nodeId, Map<String, Object> state, RunnableConfig config) {
					events.add("after:" + nodeId);
					throw new IllegalStateException("listener failures are ignored");
				}

				@Override
				public void onComplete(String nodeId, Map<String, Object> state, RunnableConfig config) {
					events.add("complete");
				}
			}).build());

		graph.invoke(Map.of());

		assertEquals(List.of("start", "before:a", "after:a", "complete"), events);
		assertFalse(events.contains("error"));
	}

	// 第 N 次写入失败的保存器
	private static class FailingSaver extends MemorySaver {

		private final AtomicInteger writes = new AtomicInteger();

		private final int failOnWrite;

		FailingSaver(int failOnWrite) {
			this.failOnWrite = failOnWrite;
		}

		@Override
		protected void insertedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
			if (writes.incrementAndGet() == failOnWrite) {
				throw new IOException("disk full");
			}
		}

	}

	@Test
	void checkpointWriteFailureStopsRun() throws Exception {
		var cRuns = new AtomicInteger();
		// 写入顺序：初始状态、a 之后、b 之后
		var saver = new FailingSaver(3);
		var graph = new StateGraph(schema()).addNode("a", state -> append("a"))
			.addNode("b", state -> append("b"))
			.addNode("c", state -> {
				cRuns.incrementAndGet();
				return append("c");
			})
			.addEdge(START, "a")
			.addEdge("a", "b")
			.addEdge("b", "c")
			.addEdge("c", END)
			.compile(CompileConfig.builder().checkpointSaver(saver).build());
		var config = thread("disk");

		var ex = assertThrows(CheckpointException.class,
				() -> graph.invoke(Map.of("messages", List.of("input")), config));

		assertInstanceOf(IOException.class, ex.getCause());
		assertEquals(List.of("input", "a"), ex.lastCheckpointState().get("messages"));
		assertEquals(0, cRuns.get());

		var snapshot = graph.getState(config);
		assertEquals(List.of("input", "a"), snapshot.values().get("messages"));
		assertEquals(List.of("b"), snapshot.next());
		assertFalse(snapshot.interrupted());
	}

}
