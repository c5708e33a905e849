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
package com.stateflow.graph.internal.node;

import com.stateflow.graph.exception.GraphCancelledException;
import com.stateflow.graph.exception.GraphRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs the nodes of a fan-out step concurrently and waits for all of them before
 * returning, so merging starts only after every branch has finished.
 */
public final class ParallelNode {

	private static final Logger log = LoggerFactory.getLogger(ParallelNode.class);

	private final List<Node> nodes;

	private final Executor executor;

	public ParallelNode(List<Node> nodes, Executor executor) {
		this.nodes = List.copyOf(nodes);
		this.executor = Objects.requireNonNull(executor, "executor cannot be null");
	}

	/**
	 * Executes every node with the given invoker.
	 * @param invoker runs one node and returns its partial update
	 * @return the updates in the order of the scheduled nodes
	 * @throws GraphRunnerException the failure of the first failing node in schedule order
	 */
	public List<Map<String, Object>> apply(Function<Node, Map<String, Object>> invoker) {
		List<CompletableFuture<Map<String, Object>>> futures = new ArrayList<>();
		for (Node node : nodes) {
			futures.add(CompletableFuture.supplyAsync(() -> invoker.apply(node), executor));
		}

		// 屏障：等待所有分支结束
		try {
			CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
		}
		catch (InterruptedException ex) {
			futures.forEach(future -> future.cancel(true));
			Thread.currentThread().interrupt();
			throw new GraphCancelledException("parallel execution interrupted");
		}
		catch (ExecutionException ex) {
			// 失败分支按调度顺序在下面报告
			log.debug("fan-out step finished with failures: {}", ex.getCause().getMessage());
		}

		List<Map<String, Object>> results = new ArrayList<>();
		for (CompletableFuture<Map<String, Object>> future : futures) {
			try {
				results.add(future.join());
			}
			catch (CompletionException ex) {
				if (ex.getCause() instanceof GraphRunnerException cause) {
					throw cause;
				}
				throw new GraphRunnerException("parallel execution failed", ex.getCause());
			}
		}
		return results;
	}

}
