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

import com.stateflow.graph.exception.Errors;
import com.stateflow.graph.exception.GraphRunnerException;
import com.stateflow.graph.exception.GraphStateException;
import com.stateflow.graph.exception.RoutingException;
import com.stateflow.graph.exception.RunnableErrors;
import com.stateflow.graph.internal.edge.Edge;
import com.stateflow.graph.internal.edge.EdgeValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;
import static java.lang.String.format;

/**
 * Fixed adjacency structure of a compiled graph.
 * <p>
 * Resolution returns the next nodes in declaration order, so fan-out branches are
 * executed and merged deterministically. {@code END} sorts last and is a plain reserved
 * node id: a branch mapping may target it like any other node.
 */
public final class EdgeTable {

	// 源节点 -> 出边
	private final Map<String, Edge> edgesBySource;

	// 节点ID -> 声明顺序
	private final Map<String, Integer> declarationOrder;

	EdgeTable(Map<String, Edge> edges, Collection<String> nodeIds) {
		this.edgesBySource = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
		Map<String, Integer> order = new HashMap<>();
		for (String nodeId : nodeIds) {
			order.put(nodeId, order.size());
		}
		this.declarationOrder = Collections.unmodifiableMap(order);
	}

	public Optional<Edge> edge(String sourceId) {
		return Optional.ofNullable(edgesBySource.get(sourceId));
	}

	public Collection<Edge> edges() {
		return edgesBySource.values();
	}

	/**
	 * Static integrity check: an entry point exists, every referenced node exists, every
	 * node has an outgoing edge, every node is reachable from START and every node has a
	 * path to END.
	 * @throws GraphStateException a {@code GraphIntegrityException} for a malformed
	 * topology
	 */
	void validate() throws GraphStateException {
		if (!edgesBySource.containsKey(START)) {
			throw Errors.missingEntryPoint.exception();
		}

		for (Edge edge : edgesBySource.values()) {
			if (!START.equals(edge.sourceId()) && !declarationOrder.containsKey(edge.sourceId())) {
				throw Errors.missingNodeReferencedByEdge.exception(edge.sourceId());
			}
			for (EdgeValue target : edge.targets()) {
				validate(edge.sourceId(), target);
			}
		}

		for (String nodeId : declarationOrder.keySet()) {
			if (!edgesBySource.containsKey(nodeId)) {
				throw Errors.missingOutgoingEdge.exception(nodeId);
			}
		}

		// 从START正向可达
		Set<String> reachable = new HashSet<>();
		var queue = new ArrayDeque<String>();
		queue.add(START);
		while (!queue.isEmpty()) {
			var current = queue.poll();
			edge(current).ifPresent(edge -> edge.possibleTargets()
				.filter(target -> !END.equals(target) && reachable.add(target))
				.forEach(queue::add));
		}
		for (String nodeId : sortedNodeIds()) {
			if (!reachable.contains(nodeId)) {
				throw Errors.unreachableNode.exception(nodeId);
			}
		}

		// 反向：能够到达END的节点，迭代到不动点
		Set<String> reachesEnd = new HashSet<>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Edge edge : edgesBySource.values()) {
				if (!reachesEnd.contains(edge.sourceId())
						&& edge.possibleTargets().anyMatch(t -> END.equals(t) || reachesEnd.contains(t))) {
					reachesEnd.add(edge.sourceId());
					changed = true;
				}
			}
		}
		for (String nodeId : sortedNodeIds()) {
			if (!reachesEnd.contains(nodeId)) {
				throw Errors.noPathToEnd.exception(nodeId);
			}
		}
	}

	private void validate(String sourceId, EdgeValue target) throws GraphStateException {
		if (target.id() != null) {
			if (!END.equals(target.id()) && !declarationOrder.containsKey(target.id())) {
				throw Errors.missingNodeReferencedByEdge.exception(target.id());
			}
			return;
		}
		for (String nodeId : target.value().mappings().values()) {
			if (!END.equals(nodeId) && !declarationOrder.containsKey(nodeId)) {
				throw Errors.missingNodeInEdgeMapping.exception(sourceId, nodeId);
			}
		}
	}

	private List<String> sortedNodeIds() {
		return declarationOrder.entrySet()
			.stream()
			.sorted(Map.Entry.comparingByValue())
			.map(Map.Entry::getKey)
			.toList();
	}

	/**
	 * Resolves the nodes following {@code nodeId}. Branch functions are invoked once
	 * with the given state.
	 * @param nodeId the node that has just run, or {@code START}
	 * @param state the merged state
	 * @return the next node ids, possibly empty, in declaration order
	 * @throws RoutingException when a branch function returns a key with no mapping
	 */
	public List<String> resolveNext(String nodeId, OverAllState state) {
		return resolveNext(List.of(nodeId), state);
	}

	/**
	 * Resolves the union of the successors of every node of a step.
	 */
	public List<String> resolveNext(Collection<String> nodeIds, OverAllState state) {
		Set<String> result = new LinkedHashSet<>();
		for (String nodeId : nodeIds) {
			var edge = edgesBySource.get(nodeId);
			if (edge == null) {
				throw RunnableErrors.missingEdge.exception(nodeId);
			}
			for (EdgeValue target : edge.targets()) {
				if (target.id() != null) {
					result.add(target.id());
				}
				else {
					result.addAll(evaluate(nodeId, target, state));
				}
			}
		}
		return sort(result);
	}

	private List<String> evaluate(String sourceId, EdgeValue target, OverAllState state) {
		List<String> keys;
		try {
			keys = target.value().action().apply(state);
		}
		catch (GraphRunnerException ex) {
			throw ex;
		}
		catch (Exception ex) {
			throw new RoutingException(format("branch function of '%s' failed: %s", sourceId, ex.getMessage()),
					sourceId, ex);
		}
		var mappings = target.value().mappings();
		List<String> targets = new ArrayList<>();
		for (String key : Objects.requireNonNullElse(keys, List.<String>of())) {
			var nodeId = key == null ? null : mappings.get(key);
			if (nodeId == null) {
				throw new RoutingException(format("branch key '%s' returned by '%s' has no mapping, valid keys are %s",
						key, sourceId, mappings.keySet()), sourceId, key, mappings.keySet());
			}
			targets.add(nodeId);
		}
		return targets;
	}

	List<String> sort(Collection<String> nodeIds) {
		return nodeIds.stream()
			.distinct()
			.sorted(Comparator.comparingInt(id -> END.equals(id) ? Integer.MAX_VALUE
					: declarationOrder.getOrDefault(id, Integer.MAX_VALUE - 1)))
			.toList();
	}

}
