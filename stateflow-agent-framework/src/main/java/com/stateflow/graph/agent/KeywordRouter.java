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
package com.stateflow.graph.agent;

import com.stateflow.graph.OverAllState;
import com.stateflow.graph.action.EdgeAction;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Branch function for router graphs: picks the first route whose keyword occurs in the
 * text of the last message, ignoring case. Routes are tried in declaration order.
 */
public class KeywordRouter implements EdgeAction {

	// 关键字 -> 分支键
	private final Map<String, String> routes;

	private final String defaultRoute;

	private final String messagesKey;

	private KeywordRouter(Builder builder) {
		this.routes = new LinkedHashMap<>(builder.routes);
		this.defaultRoute = Objects.requireNonNull(builder.defaultRoute, "defaultRoute cannot be null");
		this.messagesKey = builder.messagesKey;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String apply(OverAllState state) {
		var text = AgentMessages.last(state, messagesKey)
			.map(message -> message.getText())
			.map(value -> value.toLowerCase(Locale.ROOT))
			.orElse("");
		return routes.entrySet()
			.stream()
			.filter(route -> text.contains(route.getKey()))
			.map(Map.Entry::getValue)
			.findFirst()
			.orElse(defaultRoute);
	}

	public static class Builder {

		private final Map<String, String> routes = new LinkedHashMap<>();

		private String defaultRoute;

		private String messagesKey = AgentMessages.MESSAGES;

		private Builder() {
		}

		public Builder route(String keyword, String branchKey) {
			routes.put(keyword.toLowerCase(Locale.ROOT), Objects.requireNonNull(branchKey, "branchKey cannot be null"));
			return this;
		}

		public Builder defaultRoute(String defaultRoute) {
			this.defaultRoute = defaultRoute;
			return this;
		}

		public Builder messagesKey(String messagesKey) {
			this.messagesKey = messagesKey;
			return this;
		}

		public KeywordRouter build() {
			return new KeywordRouter(this);
		}

	}

}
