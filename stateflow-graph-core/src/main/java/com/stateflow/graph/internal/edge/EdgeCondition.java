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

import com.stateflow.graph.action.MultiEdgeAction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Branch function of a conditional edge and its branch key to node id mapping.
 *
 * @param action the branch function
 * @param mappings branch key to target node id, {@code END} allowed
 */
public record EdgeCondition(MultiEdgeAction action, Map<String, String> mappings) {

	public EdgeCondition {
		mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
	}

	@Override
	public String toString() {
		return String.format("EdgeCondition[ mappings=%s ]", mappings);
	}

}
