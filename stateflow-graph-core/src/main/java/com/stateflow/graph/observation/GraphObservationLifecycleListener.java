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
package com.stateflow.graph.observation;

import com.stateflow.graph.GraphLifecycleListener;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.observation.GraphObservationDocumentation.HighCardinalityKeyNames;
import com.stateflow.graph.observation.GraphObservationDocumentation.LowCardinalityKeyNames;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges runner callbacks to Micrometer: one observation per graph run and one child
 * observation per node execution.
 */
public class GraphObservationLifecycleListener implements GraphLifecycleListener {

	private final ObservationRegistry observationRegistry;

	private final String graphName;

	// 线程ID -> 图运行观察
	private final Map<String, Observation> graphObservations = new ConcurrentHashMap<>();

	// 线程ID/节点ID -> 节点观察
	private final Map<String, Observation> nodeObservations = new ConcurrentHashMap<>();

	public GraphObservationLifecycleListener(ObservationRegistry observationRegistry, String graphName) {
		this.observationRegistry = Objects.requireNonNull(observationRegistry, "observationRegistry cannot be null");
		this.graphName = Objects.requireNonNull(graphName, "graphName cannot be null");
	}

	private static String threadId(RunnableConfig config) {
		return BaseCheckpointSaver.threadId(config);
	}

	private static String nodeKey(RunnableConfig config, String nodeId) {
		return threadId(config) + "/" + nodeId;
	}

	@Override
	public void onStart(String nodeId, Map<String, Object> state, RunnableConfig config) {
		var observation = Observation.createNotStarted(GraphObservationDocumentation.GRAPH_OBSERVATION, observationRegistry)
			.contextualName(GraphObservationDocumentation.GRAPH_OBSERVATION + "." + graphName)
			.lowCardinalityKeyValue(LowCardinalityKeyNames.GRAPH_NAME.asString(), graphName)
			.highCardinalityKeyValue(HighCardinalityKeyNames.THREAD_ID.asString(), threadId(config))
			.start();
		graphObservations.put(threadId(config), observation);
	}

	@Override
	public void before(String nodeId, Map<String, Object> state, RunnableConfig config) {
		var observation = Observation.createNotStarted(GraphObservationDocumentation.NODE_OBSERVATION, observationRegistry)
			.parentObservation(graphObservations.get(threadId(config)))
			.lowCardinalityKeyValue(LowCardinalityKeyNames.GRAPH_NAME.asString(), graphName)
			.lowCardinalityKeyValue(LowCardinalityKeyNames.NODE_ID.asString(), nodeId)
			.highCardinalityKeyValue(HighCardinalityKeyNames.THREAD_ID.asString(), threadId(config))
			.start();
		nodeObservations.put(nodeKey(config, nodeId), observation);
	}

	@Override
	public void after(String nodeId, Map<String, Object> state, RunnableConfig config) {
		var observation = nodeObservations.remove(nodeKey(config, nodeId));
		if (observation != null) {
			observation.stop();
		}
	}

	@Override
	public void onError(String nodeId, Map<String, Object> state, Throwable ex, RunnableConfig config) {
		// 失败节点的观察未经过 after 回调
		nodeObservations.entrySet().removeIf(entry -> {
			if (!entry.getKey().startsWith(threadId(config) + "/")) {
				return false;
			}
			entry.getValue().error(ex);
			entry.getValue().stop();
			return true;
		});
		stopGraph(config, "error", ex);
	}

	@Override
	public void onComplete(String nodeId, Map<String, Object> state, RunnableConfig config) {
		stopGraph(config, "completed", null);
	}

	@Override
	public void onInterrupt(String nodeId, Map<String, Object> state, RunnableConfig config) {
		stopGraph(config, "interrupted", null);
	}

	private void stopGraph(RunnableConfig config, String outcome, Throwable ex) {
		var observation = graphObservations.remove(threadId(config));
		if (observation == null) {
			return;
		}
		observation.lowCardinalityKeyValue(LowCardinalityKeyNames.OUTCOME.asString(), outcome);
		if (ex != null) {
			observation.error(ex);
		}
		observation.stop();
	}

}
