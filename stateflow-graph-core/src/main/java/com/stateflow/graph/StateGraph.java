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

import com.stateflow.graph.action.EdgeAction;
import com.stateflow.graph.action.MultiEdgeAction;
import com.stateflow.graph.action.NodeAction;
import com.stateflow.graph.action.NodeActionWithConfig;
import com.stateflow.graph.exception.Errors;
import com.stateflow.graph.exception.GraphStateException;
import com.stateflow.graph.internal.edge.Edge;
import com.stateflow.graph.internal.edge.EdgeCondition;
import com.stateflow.graph.internal.edge.EdgeValue;
import com.stateflow.graph.internal.node.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Build-time definition of a graph: nodes, edges and the state schema they share.
 * <p>
 * Definition errors that concern a single call (reserved ids, duplicates) are reported
 * immediately; the topology as a whole is checked by {@link #compile(CompileConfig)}.
 *
 * <pre>{@code
 * var graph = new StateGraph(schema)
 * 	.addNode("agent", agent)
 * 	.addNode("tools", tools)
 * 	.addEdge(START, "agent")
 * 	.addConditionalEdges("agent", router, Map.of("tools", "tools", "end", END))
 * 	.addEdge("tools", "agent")
 * 	.compile();
 * }</pre>
 */
public class StateGraph {

	/**
	 * Virtual entry point, never executed.
	 */
	public static final String START = "__START__";

	/**
	 * Virtual terminal: reaching it ends the run.
	 */
	public static final String END = "__END__";

	// 保留的节点ID前缀
	private static final String RESERVED_PREFIX = "__";

	private final String name;

	private final StateSchema schema;

	// 按声明顺序保存的节点
	private final Map<String, Node> nodes = new LinkedHashMap<>();

	// 源节点 -> 出边
	private final Map<String, Edge> edges = new LinkedHashMap<>();

	public StateGraph(StateSchema schema) {
		this("StateGraph", schema);
	}

	public StateGraph(String name, StateSchema schema) {
		this.name = Objects.requireNonNull(name, "name cannot be null");
		this.schema = Objects.requireNonNull(schema, "schema cannot be null");
	}

	public String getName() {
		return name;
	}

	public StateSchema getSchema() {
		return schema;
	}

	Map<String, Node> nodes() {
		return Collections.unmodifiableMap(nodes);
	}

	public StateGraph addNode(String id, NodeAction action) throws GraphStateException {
		return addNode(id, NodeActionWithConfig.of(Objects.requireNonNull(action, "action cannot be null")));
	}

	/**
	 * Registers a node.
	 * @param id the unique node id; {@code END} and ids starting with {@code __} are
	 * reserved
	 * @param action the step function
	 * @return this graph
	 * @throws GraphStateException if the id is invalid or already registered
	 */
	public StateGraph addNode(String id, NodeActionWithConfig action) throws GraphStateException {
		if (id == null || id.isBlank()) {
			throw Errors.blankNodeIdentifier.exception();
		}
		if (Objects.equals(id, END)) {
			throw Errors.invalidNodeIdentifier.exception();
		}
		if (id.startsWith(RESERVED_PREFIX)) {
			throw Errors.reservedNodeIdentifier.exception(id);
		}
		if (nodes.containsKey(id)) {
			throw Errors.duplicateNodeError.exception(id);
		}
		nodes.put(id, new Node(id, Objects.requireNonNull(action, "action cannot be null")));
		return this;
	}

	/**
	 * Adds an unconditional edge. Calling it several times with the same source declares
	 * a fan-out: all targets run in the same step.
	 * @param sourceId the source node id or {@code START}
	 * @param targetId the target node id or {@code END}
	 * @return this graph
	 * @throws GraphStateException if the edge is invalid
	 */
	public StateGraph addEdge(String sourceId, String targetId) throws GraphStateException {
		if (sourceId == null || Objects.equals(sourceId, END)) {
			throw Errors.invalidEdgeIdentifier.exception();
		}
		if (targetId == null || targetId.isBlank()) {
			throw Errors.blankNodeIdentifier.exception();
		}
		if (Objects.equals(targetId, START)) {
			throw Errors.invalidEdgeTarget.exception(sourceId);
		}

		var existing = edges.get(sourceId);
		if (existing == null) {
			edges.put(sourceId, new Edge(sourceId, new EdgeValue(targetId)));
			return this;
		}
		if (existing.isConditional()) {
			throw Errors.duplicateConditionalEdgeError.exception(sourceId);
		}
		if (existing.anyMatchByTargetId(targetId)) {
			throw Errors.duplicateEdgeTargetError.exception(sourceId, targetId);
		}
		edges.put(sourceId, existing.withTarget(new EdgeValue(targetId)));
		return this;
	}

	/**
	 * Adds a conditional edge: after {@code sourceId} runs, {@code condition} selects a
	 * key of {@code mappings} and the mapped node runs next.
	 */
	public StateGraph addConditionalEdges(String sourceId, EdgeAction condition, Map<String, String> mappings)
			throws GraphStateException {
		Objects.requireNonNull(condition, "condition cannot be null");
		return addParallelConditionalEdges(sourceId, MultiEdgeAction.of(condition), mappings);
	}

	/**
	 * Adds a conditional edge whose branch function may select several keys, resolving to
	 * a fan-out of the mapped nodes.
	 */
	public StateGraph addParallelConditionalEdges(String sourceId, MultiEdgeAction condition,
			Map<String, String> mappings) throws GraphStateException {
		if (sourceId == null || Objects.equals(sourceId, END)) {
			throw Errors.invalidEdgeIdentifier.exception();
		}
		Objects.requireNonNull(condition, "condition cannot be null");
		if (mappings == null || mappings.isEmpty()) {
			throw Errors.edgeMappingIsEmpty.exception(sourceId);
		}
		// 不可变 Map 不支持 containsKey(null)，逐项检查
		if (mappings.keySet().stream().anyMatch(Objects::isNull)
				|| mappings.values().stream().anyMatch(Objects::isNull)) {
			throw Errors.edgeMappingIsEmpty.exception(sourceId);
		}
		if (mappings.containsValue(START)) {
			throw Errors.invalidEdgeTarget.exception(sourceId);
		}
		var existing = edges.get(sourceId);
		if (existing != null) {
			throw existing.isConditional() ? Errors.duplicateConditionalEdgeError.exception(sourceId)
					: Errors.duplicateEdgeError.exception(sourceId);
		}
		edges.put(sourceId, new Edge(sourceId, new EdgeValue(new EdgeCondition(condition, mappings))));
		return this;
	}

	public CompiledGraph compile() throws GraphStateException {
		return compile(CompileConfig.builder().build());
	}

	/**
	 * Validates the topology and produces a runnable graph.
	 * @param config the compile options
	 * @return the compiled graph
	 * @throws GraphStateException a {@code GraphIntegrityException} when the topology is
	 * malformed, or a plain {@code GraphStateException} for invalid options
	 */
	public CompiledGraph compile(CompileConfig config) throws GraphStateException {
		Objects.requireNonNull(config, "config cannot be null");

		var edgeTable = new EdgeTable(edges, nodes.keySet());
		edgeTable.validate();

		for (String interruption : config.interruptsBefore()) {
			if (!nodes.containsKey(interruption)) {
				throw Errors.interruptionNodeNotExist.exception(interruption);
			}
		}
		if (!config.interruptsBefore().isEmpty() && config.checkpointSaver().isEmpty()) {
			throw Errors.interruptionWithoutSaver.exception(config.interruptsBefore());
		}

		return new CompiledGraph(this, config, edgeTable);
	}

}
