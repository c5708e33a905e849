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
package com.stateflow.graph.internal.edge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * All outgoing targets of one source node. Several fixed targets form a fan-out.
 *
 * @param sourceId The ID of the source node.
 * @param targets The targets value associated with the edge.
 */
public record Edge(String sourceId, List<EdgeValue> targets) {

	public Edge {
		Objects.requireNonNull(sourceId, "sourceId cannot be null");
		targets = List.copyOf(targets);
	}

	public Edge(String sourceId, EdgeValue target) {
		this(sourceId, List.of(target));
	}

	// 追加一个目标，返回新的Edge实例
	public Edge withTarget(EdgeValue target) {
		var newTargets = new ArrayList<>(targets);
		newTargets.add(target);
		return new Edge(sourceId, newTargets);
	}

	public boolean isConditional() {
		return targets.stream().anyMatch(EdgeValue::isConditional);
	}

	// 检查是否已存在指向给定节点的固定目标
	public boolean anyMatchByTargetId(String targetId) {
		return targets.stream().anyMatch(v -> Objects.equals(v.id(), targetId));
	}

	/**
	 * Every node id this edge can lead to: fixed targets and all mapping values.
	 */
	public Stream<String> possibleTargets() {
		return targets.stream()
			.flatMap(v -> v.isConditional() ? v.value().mappings().values().stream() : Stream.of(v.id()))
			.distinct();
	}

}
