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
package com.stateflow.graph.exception;

import static java.lang.String.format;

/**
 * Build-time error catalogue. Structural problems of the topology produce a
 * {@link GraphIntegrityException}, everything else a plain {@link GraphStateException}.
 */
public enum Errors {

	invalidNodeIdentifier("END is not a valid node id!"),

	reservedNodeIdentifier("node id '%s' is reserved: ids cannot start with '__'"),

	blankNodeIdentifier("node id cannot be blank!"),

	duplicateNodeError("node with id: %s already exist!"),

	invalidEdgeIdentifier("END is not a valid edge sourceId!"),

	invalidEdgeTarget("START is not a valid edge target (source: '%s')!", true),

	duplicateEdgeError("edge from '%s' already exist!"),

	duplicateConditionalEdgeError("conditional edge from '%s' already exist!"),

	duplicateEdgeTargetError("edge [%s] has duplicate targets %s!"),

	edgeMappingIsEmpty("edge mapping for sourceId: %s cannot be null or empty!"),

	missingEntryPoint("missing Entry Point", true),

	missingNodeReferencedByEdge("edge sourceId '%s' refers to undefined node!", true),

	missingNodeInEdgeMapping("edge mapping for sourceId: %s contains a not existent nodeId %s!", true),

	missingOutgoingEdge("node '%s' has no outgoing edge!", true),

	unreachableNode("node '%s' is not reachable from START!", true),

	noPathToEnd("node '%s' has no path to END!", true),

	interruptionNodeNotExist("node '%s' configured as interruption doesn't exist!"),

	interruptionWithoutSaver("interruptions %s require a checkpoint saver!");

	private final String errorMessage;

	private final boolean integrity;

	Errors(String errorMessage) {
		this(errorMessage, false);
	}

	Errors(String errorMessage, boolean integrity) {
		this.errorMessage = errorMessage;
		this.integrity = integrity;
	}

	public GraphStateException exception(Object... args) {
		var message = format(errorMessage, args);
		return integrity ? new GraphIntegrityException(message) : new GraphStateException(message);
	}

}
