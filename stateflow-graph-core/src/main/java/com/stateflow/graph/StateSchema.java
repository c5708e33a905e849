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

import com.stateflow.graph.exception.RunnableErrors;
import com.stateflow.graph.exception.StateTypeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import static java.lang.String.format;

/**
 * Declares the fields of the graph state and the reducer of each field.
 * <p>
 * {@link #merge(Map, Map)} is the only way state evolves: every key of a partial update
 * is combined with the current value through its {@link KeyStrategy}; keys that are not
 * declared are rejected with a {@code SchemaException} and nothing is merged.
 */
public final class StateSchema {

	// 字段名 -> 合并策略，按声明顺序保存
	private final Map<String, KeyStrategy> strategies;

	// 字段名 -> 默认值提供者
	private final Map<String, Supplier<Object>> defaults;

	private StateSchema(Builder builder) {
		this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.strategies));
		this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
	}

	public static Builder builder() {
		return new Builder();
	}

	public Set<String> keys() {
		return strategies.keySet();
	}

	public Map<String, KeyStrategy> strategies() {
		return strategies;
	}

	public KeyStrategy strategy(String key) {
		return strategies.get(key);
	}

	/**
	 * Builds the first state of a thread: every declared field gets its default value,
	 * then the input is merged on top through the reducers.
	 * @param input the initial values
	 * @return the initial state
	 */
	public Map<String, Object> initialize(Map<String, Object> input) {
		return merge(defaults(), input);
	}

	// 所有字段的默认值
	private Map<String, Object> defaults() {
		Map<String, Object> result = new LinkedHashMap<>();
		strategies.forEach((key, strategy) -> result.put(key, defaultValue(key)));
		return result;
	}

	private Object defaultValue(String key) {
		var supplier = defaults.get(key);
		return supplier != null ? supplier.get() : strategies.get(key).defaultValue();
	}

	/**
	 * Merges a partial update into the current state and returns the new state. The
	 * current map is never modified.
	 * @param current the current state
	 * @param update the partial update, may be {@code null}
	 * @return the merged state, containing every declared field
	 */
	public Map<String, Object> merge(Map<String, Object> current, Map<String, Object> update) {
		Objects.requireNonNull(current, "current state cannot be null");
		validateKeys(update);

		Map<String, Object> result = new LinkedHashMap<>();
		for (var key : strategies.keySet()) {
			result.put(key, current.containsKey(key) ? current.get(key) : defaultValue(key));
		}
		if (update == null) {
			return Collections.unmodifiableMap(result);
		}
		for (var entry : update.entrySet()) {
			var key = entry.getKey();
			try {
				result.put(key, strategies.get(key).apply(result.get(key), entry.getValue()));
			}
			catch (IllegalArgumentException | ClassCastException ex) {
				throw new StateTypeException(format("cannot merge key '%s': %s", key, ex.getMessage()), ex);
			}
		}
		return Collections.unmodifiableMap(result);
	}

	// 先整体校验，避免部分合并
	private void validateKeys(Map<String, Object> update) {
		if (update == null || update.isEmpty()) {
			return;
		}
		List<String> unknown = update.keySet().stream().filter(key -> !strategies.containsKey(key)).toList();
		if (!unknown.isEmpty()) {
			throw RunnableErrors.unknownStateKey.exception(unknown, strategies.keySet());
		}
	}

	@Override
	public String toString() {
		return "StateSchema" + strategies;
	}

	public static class Builder {

		private final Map<String, KeyStrategy> strategies = new LinkedHashMap<>();

		private final Map<String, Supplier<Object>> defaults = new LinkedHashMap<>();

		/**
		 * Declares a field with the {@code replace} reducer.
		 */
		public Builder field(String name) {
			return field(name, KeyStrategy.replace());
		}

		public Builder field(String name, KeyStrategy strategy) {
			Objects.requireNonNull(name, "field name cannot be null");
			Objects.requireNonNull(strategy, "strategy cannot be null");
			if (strategies.containsKey(name)) {
				throw new IllegalArgumentException(format("field '%s' already declared", name));
			}
			strategies.put(name, strategy);
			return this;
		}

		// 声明字段并指定默认值
		public Builder field(String name, KeyStrategy strategy, Supplier<Object> defaultValue) {
			field(name, strategy);
			defaults.put(name, Objects.requireNonNull(defaultValue, "defaultValue cannot be null"));
			return this;
		}

		public StateSchema build() {
			if (strategies.isEmpty()) {
				throw new IllegalArgumentException("a state schema must declare at least one field");
			}
			return new StateSchema(this);
		}

	}

}
