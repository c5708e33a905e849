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

import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.checkpoint.savers.MemorySaver;
import com.stateflow.graph.diagram.MermaidGenerator;
import com.stateflow.graph.exception.GraphCancelledException;
import com.stateflow.graph.internal.ThreadLockRegistry;
import com.stateflow.graph.internal.node.Node;
import com.stateflow.graph.state.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runnable form of a {@link StateGraph}. Node registry and adjacency are fixed at
 * compile time; a compiled graph holds no per-run state and can be shared by any number
 * of callers.
 * <p>
 * Without a configured checkpoint saver every invocation runs on a private in-memory
 * store that is discarded when the call returns.
 */
public class CompiledGraph {

	private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

	private final StateGraph stateGraph;

	private final CompileConfig compileConfig;

	private final EdgeTable edgeTable;

	// 编译时固定的节点表
	private final Map<String, Node> nodes;

	// 未配置保存器时使用的锁注册表
	private final ThreadLockRegistry localLocks = new ThreadLockRegistry();

	CompiledGraph(StateGraph stateGraph, CompileConfig compileConfig, EdgeTable edgeTable) {
		this.stateGraph = stateGraph;
		this.compileConfig = compileConfig;
		this.edgeTable = edgeTable;
		this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(stateGraph.nodes()));
	}

	public String getName() {
		return stateGraph.getName();
	}

	public StateSchema getSchema() {
		return stateGraph.getSchema();
	}

	public CompileConfig getCompileConfig() {
		return compileConfig;
	}

	public EdgeTable getEdgeTable() {
		return edgeTable;
	}

	Optional<Node> node(String nodeId) {
		return Optional.ofNullable(nodes.get(nodeId));
	}

	private GraphRunner runner(RunnableConfig config, Consumer<NodeOutput> emitter,
			BooleanSupplier cancelled) {
		Objects.requireNonNull(config, "config cannot be null");
		var saver = compileConfig.checkpointSaver();
		if (saver.isPresent()) {
			return new GraphRunner(this, saver.get(), ThreadLockRegistry.forSaver(saver.get()), config, emitter,
					cancelled);
		}
		return new GraphRunner(this, new MemorySaver(), localLocks, config, emitter, cancelled);
	}

	public OverAllState invoke(Map<String, Object> input) {
		return invoke(input, RunnableConfig.builder().build());
	}

	/**
	 * Runs the graph on the config's thread until it completes or pauses.
	 * @param input the initial state for a new thread, an update merged before
	 * continuing an existing one, or {@code null} to resume
	 * @param config the run configuration
	 * @return the final state, or the state at the interruption boundary
	 * @throws com.stateflow.graph.exception.GraphRunnerException when the run fails; the
	 * exception carries the failing node and the last checkpointed state
	 */
	public OverAllState invoke(Map<String, Object> input, RunnableConfig config) {
		return runner(config, output -> {
		}, () -> false).run(input);
	}

	public Flux<NodeOutput> stream(Map<String, Object> input) {
		return stream(input, RunnableConfig.builder().build());
	}

	/**
	 * Runs the graph and emits one {@link NodeOutput} per executed node, followed by an
	 * {@code END} output or an
	 * {@link com.stateflow.graph.action.InterruptionMetadata}. Cancelling the
	 * subscription cancels the run before its next checkpoint.
	 */
	public Flux<NodeOutput> stream(Map<String, Object> input, RunnableConfig config) {
		return Flux.<NodeOutput>create(sink -> {
			var cancelled = new AtomicBoolean();
			sink.onCancel(() -> cancelled.set(true));
			try {
				runner(config, sink::next, cancelled::get).run(input);
				sink.complete();
			}
			catch (GraphCancelledException ex) {
				if (cancelled.get()) {
					log.debug("stream on thread {} cancelled by subscriber", config.threadId().orElse(null));
				}
				else {
					sink.error(ex);
				}
			}
			catch (RuntimeException ex) {
				sink.error(ex);
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private BaseCheckpointSaver requireSaver() {
		return compileConfig.checkpointSaver()
			.orElseThrow(() -> new IllegalStateException("Missing CheckpointSaver!"));
	}

	/**
	 * Returns the persisted state of a thread.
	 * @throws IllegalStateException if no saver is configured or the thread has no
	 * checkpoint
	 */
	public StateSnapshot getState(RunnableConfig config) {
		return stateOf(config).orElseThrow(() -> new IllegalStateException("Missing Checkpoint!"));
	}

	public Optional<StateSnapshot> stateOf(RunnableConfig config) {
		var threadId = BaseCheckpointSaver.threadId(config);
		return requireSaver().get(config)
			.map(checkpoint -> new StateSnapshot(threadId, new OverAllState(checkpoint.getState()),
					checkpoint.getNextNodes(), checkpoint.isInterrupted(), checkpoint.getId()));
	}

	/**
	 * Merges values into a paused or completed thread through the schema reducers, without
	 * executing any node.
	 * @return the config to resume with
	 */
	public RunnableConfig updateState(RunnableConfig config, Map<String, Object> values) {
		var saver = requireSaver();
		return new GraphRunner(this, saver, ThreadLockRegistry.forSaver(saver), config, output -> {
		}, () -> false).update(values);
	}

	/**
	 * Deletes the thread's checkpoint, waiting for any run on the thread to finish.
	 * @return {@code true} if a checkpoint existed
	 */
	public boolean clearState(RunnableConfig config) {
		var saver = requireSaver();
		return new GraphRunner(this, saver, ThreadLockRegistry.forSaver(saver), config, output -> {
		}, () -> false).clear();
	}

	public GraphRepresentation getGraph() {
		return getGraph(getName());
	}

	public GraphRepresentation getGraph(String title) {
		var content = new MermaidGenerator().generate(title, nodes.keySet(), edgeTable.edges());
		return new GraphRepresentation(GraphRepresentation.Type.MERMAID, content);
	}

}
