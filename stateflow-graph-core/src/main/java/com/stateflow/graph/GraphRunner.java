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

import com.stateflow.graph.action.InterruptionMetadata;
import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.checkpoint.Checkpoint;
import com.stateflow.graph.exception.GraphRunnerException;
import com.stateflow.graph.exception.NodeExecutionException;
import com.stateflow.graph.exception.RunnableErrors;
import com.stateflow.graph.internal.ThreadLockRegistry;
import com.stateflow.graph.internal.node.Node;
import com.stateflow.graph.internal.node.ParallelNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;

/**
 * Drives one invocation of a compiled graph on one thread.
 * <p>
 * Each step resolves the scheduled nodes, executes them against the same state
 * snapshot, merges their updates in schedule order, resolves the following nodes and
 * persists the result. A step is only persisted once fully merged, so a failure or a
 * cancellation leaves the thread at its previous checkpoint.
 */
public final class GraphRunner {

	private static final Logger log = LoggerFactory.getLogger(GraphRunner.class);

	public enum Status {

		IDLE, RUNNING, PAUSED, COMPLETED, FAILED

	}

	private final CompiledGraph graph;

	private final BaseCheckpointSaver saver;

	private final ThreadLockRegistry locks;

	private final RunnableConfig config;

	private final String threadId;

	// 每个节点完成后的输出回调
	private final Consumer<NodeOutput> emitter;

	// 调用方取消标记
	private final BooleanSupplier cancelled;

	private Status status = Status.IDLE;

	// 最近一次持久化的状态
	private OverAllState lastCheckpointState;

	GraphRunner(CompiledGraph graph, BaseCheckpointSaver saver, ThreadLockRegistry locks, RunnableConfig config,
			Consumer<NodeOutput> emitter, BooleanSupplier cancelled) {
		this.graph = graph;
		this.saver = saver;
		this.locks = locks;
		this.config = config;
		this.threadId = BaseCheckpointSaver.threadId(config);
		this.emitter = emitter;
		this.cancelled = cancelled;
	}

	public Status status() {
		return status;
	}

	/**
	 * Runs the thread until it completes, pauses or fails. The thread's advisory lock is
	 * held for the whole call.
	 * @param input the initial state for a new thread, an update to merge for an existing
	 * one, or {@code null} to resume
	 * @return the final or paused state
	 */
	public OverAllState run(Map<String, Object> input) {
		var lock = acquireLock();
		try {
			return doRun(input);
		}
		finally {
			unlock(lock);
		}
	}

	private OverAllState doRun(Map<String, Object> input) {
		status = Status.RUNNING;
		var schema = graph.getSchema();
		String currentNode = START;
		OverAllState state = null;
		try {
			List<String> next;
			boolean resumed = false;

			Optional<Checkpoint> checkpoint = saver.get(config);
			if (checkpoint.isEmpty()) {
				if (input == null) {
					throw RunnableErrors.missingInput.exception(threadId);
				}
				state = new OverAllState(schema.initialize(input));
				next = graph.getEdgeTable().resolveNext(START, state);
				save(state, next, false);
			}
			else {
				var loaded = checkpoint.get();
				state = new OverAllState(loaded.getState());
				lastCheckpointState = state;
				if (input != null) {
					state = new OverAllState(schema.merge(state.data(), input));
				}
				if (loaded.hasPendingNodes()) {
					// 从中断恢复时跳过该边界
					next = loaded.getNextNodes();
					resumed = loaded.isInterrupted();
				}
				else if (input != null) {
					next = graph.getEdgeTable().resolveNext(START, state);
				}
				else {
					next = List.of();
				}
				if (input != null) {
					save(state, next, loaded.isInterrupted() && loaded.hasPendingNodes());
				}
			}

			log.info("[ThreadId {}] run started, next nodes {}", threadId, next);
			var startState = state;
			notifyListeners("onStart", l -> l.onStart(START, startState.data(), config));

			int steps = 0;
			while (true) {
				var scheduled = next.stream().filter(nodeId -> !END.equals(nodeId)).toList();
				if (scheduled.isEmpty()) {
					status = Status.COMPLETED;
					log.info("[ThreadId {}] run completed after {} step(s)", threadId, steps);
					var finalState = state;
					notifyListeners("onComplete", l -> l.onComplete(END, finalState.data(), config));
					emitter.accept(NodeOutput.of(END, state));
					return state;
				}

				if (!resumed) {
					var interruption = scheduled.stream()
						.filter(graph.getCompileConfig().interruptsBefore()::contains)
						.findFirst();
					if (interruption.isPresent()) {
						save(state, scheduled, true);
						status = Status.PAUSED;
						log.info("[ThreadId {}] paused before node '{}'", threadId, interruption.get());
						var pausedState = state;
						notifyListeners("onInterrupt",
								l -> l.onInterrupt(interruption.get(), pausedState.data(), config));
						emitter.accept(new InterruptionMetadata(interruption.get(), state, threadId, scheduled));
						return state;
					}
				}
				resumed = false;

				if (++steps > graph.getCompileConfig().recursionLimit()) {
					throw RunnableErrors.recursionLimitReached.exception(graph.getCompileConfig().recursionLimit(),
							threadId);
				}
				checkCancelled();

				currentNode = String.join(",", scheduled);
				log.debug("[ThreadId {}] step {} executing {}", threadId, steps, scheduled);
				var updates = execute(scheduled, state);

				var merged = state.data();
				for (int i = 0; i < scheduled.size(); i++) {
					try {
						merged = schema.merge(merged, updates.get(i));
					}
					catch (GraphRunnerException ex) {
						throw ex.withContext(scheduled.get(i), null);
					}
				}
				var mergedState = new OverAllState(merged);
				var resolved = graph.getEdgeTable().resolveNext(scheduled, mergedState);

				// 合并完成后、持久化之前再次检查取消
				checkCancelled();
				save(mergedState, resolved, false);

				state = mergedState;
				next = resolved;
				for (String nodeId : scheduled) {
					emitter.accept(NodeOutput.of(nodeId, state));
				}
			}
		}
		catch (GraphRunnerException ex) {
			throw fail(ex, currentNode);
		}
		catch (RuntimeException ex) {
			fail(ex, currentNode);
			throw ex;
		}
	}

	private RuntimeException fail(RuntimeException ex, String currentNode) {
		status = Status.FAILED;
		var lastGood = lastCheckpointState != null ? lastCheckpointState.data() : Map.<String, Object>of();
		log.error("[ThreadId {}] run failed at '{}': {}", threadId, currentNode, ex.getMessage());
		notifyListeners("onError", l -> l.onError(currentNode, lastGood, ex, config));
		if (ex instanceof GraphRunnerException runnerException) {
			return runnerException.withContext(currentNode, lastGood);
		}
		return ex;
	}

	private List<Map<String, Object>> execute(List<String> scheduled, OverAllState state) {
		List<Node> nodes = new ArrayList<>();
		for (String nodeId : scheduled) {
			nodes.add(graph.node(nodeId).orElseThrow(() -> RunnableErrors.missingNode.exception(nodeId)));
		}

		var executor = graph.getCompileConfig().executor();
		if (nodes.size() > 1 && executor.isPresent()) {
			return new ParallelNode(nodes, executor.get()).apply(node -> executeNode(node, state));
		}

		List<Map<String, Object>> results = new ArrayList<>();
		for (Node node : nodes) {
			results.add(executeNode(node, state));
		}
		return results;
	}

	private Map<String, Object> executeNode(Node node, OverAllState state) {
		notifyListeners("before", l -> l.before(node.id(), state.data(), config));
		Map<String, Object> result;
		try {
			result = node.action().apply(state, config);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw RunnableErrors.cancelled.exception(threadId).withContext(node.id(), null);
		}
		catch (Exception ex) {
			log.warn("[ThreadId {}] node '{}' failed", threadId, node.id(), ex);
			throw new NodeExecutionException(node.id(), ex);
		}
		var update = result != null ? result : Map.<String, Object>of();
		notifyListeners("after", l -> l.after(node.id(), update, config));
		return update;
	}

	private void checkCancelled() {
		if (Thread.currentThread().isInterrupted() || cancelled.getAsBoolean()) {
			throw RunnableErrors.cancelled.exception(threadId);
		}
	}

	private void save(OverAllState state, List<String> next, boolean interrupted) {
		var checkpoint = Checkpoint.builder()
			.threadId(threadId)
			.state(state.data())
			.nextNodes(next)
			.interrupted(interrupted)
			.build();
		saver.put(config, checkpoint);
		lastCheckpointState = state;
		log.debug("[ThreadId {}] checkpoint {} saved, next {}", threadId, checkpoint.getId(),
				checkpoint.getNextNodes());
	}

	/**
	 * Merges values into the thread's checkpoint without running any node. Pending nodes
	 * and the interruption flag are kept.
	 */
	RunnableConfig update(Map<String, Object> values) {
		Objects.requireNonNull(values, "values cannot be null");
		var lock = acquireLock();
		try {
			var checkpoint = saver.get(config).orElseThrow(() -> RunnableErrors.missingInput.exception(threadId));
			var merged = graph.getSchema().merge(checkpoint.getState(), values);
			save(new OverAllState(merged), checkpoint.getNextNodes(), checkpoint.isInterrupted());
			log.info("[ThreadId {}] state updated with keys {}", threadId, values.keySet());
			return config;
		}
		finally {
			unlock(lock);
		}
	}

	/**
	 * Deletes the thread's checkpoint under the thread lock.
	 */
	boolean clear() {
		var lock = acquireLock();
		try {
			var existed = saver.clear(config);
			log.info("[ThreadId {}] checkpoint cleared", threadId);
			return existed;
		}
		finally {
			unlock(lock);
		}
	}

	private ReentrantLock acquireLock() {
		try {
			return locks.acquire(threadId);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw RunnableErrors.cancelled.exception(threadId);
		}
	}

	private void unlock(ReentrantLock lock) {
		lock.unlock();
		locks.release(threadId);
	}

	private void notifyListeners(String event, Consumer<GraphLifecycleListener> callback) {
		for (GraphLifecycleListener listener : graph.getCompileConfig().lifecycleListeners()) {
			try {
				callback.accept(listener);
			}
			catch (RuntimeException ex) {
				log.warn("[ThreadId {}] lifecycle listener {} failed on {}", threadId, listener, event, ex);
			}
		}
	}

}
