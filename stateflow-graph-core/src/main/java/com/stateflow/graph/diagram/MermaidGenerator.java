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
package com.stateflow.graph.diagram;

import com.stateflow.graph.internal.edge.Edge;
import com.stateflow.graph.internal.edge.EdgeValue;

import java.util.Collection;
import java.util.Map;

import static com.stateflow.graph.StateGraph.END;
import static com.stateflow.graph.StateGraph.START;
import static java.lang.String.format;
import static java.util.Optional.ofNullable;

/**
 * Generates a Mermaid flowchart of a graph. Conditional edges are drawn dotted and
 * labelled with their branch key.
 */
public class MermaidGenerator {

	public String generate(String title, Collection<String> nodeIds, Collection<Edge> edges) {
		var sb = new StringBuilder();
		ofNullable(title).ifPresent(t -> sb.append(format("---\ntitle: %s\n---\n", t)));
		sb.append("flowchart TD\n")
			.append(format("\t%s((start))\n", START))
			.append(format("\t%s((stop))\n", END));

		for (String nodeId : nodeIds) {
			sb.append(format("\t%s(\"%s\")\n", nodeId, nodeId));
		}

		for (Edge edge : edges) {
			for (EdgeValue target : edge.targets()) {
				if (target.id() != null) {
					sb.append(format("\t%s --> %s\n", edge.sourceId(), target.id()));
					continue;
				}
				for (Map.Entry<String, String> mapping : target.value().mappings().entrySet()) {
					sb.append(format("\t%s -.->|%s| %s\n", edge.sourceId(), mapping.getKey(), mapping.getValue()));
				}
			}
		}

		sb.append('\n')
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", START))
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", END));
		return sb.toString();
	}

}
