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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the shared graph state. Nodes read it and return partial
 * updates; only the {@link StateSchema} merge produces a new snapshot.
 */
public final class OverAllState {

	// 状态数据，保持字段声明顺序，允许null值
	private final Map<String, Object> data;

	public OverAllState(Map<String, Object> data) {
		this.data = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(data, "data cannot be null")));
	}

	public static OverAllState empty() {
		return new OverAllState(Map.of());
	}

	/**
	 * Returns the state data as an unmodifiable map.
	 * @return the state data
	 */
	public Map<String, Object> data() {
		return data;
	}

	public Optional<Object> value(String key) {
		return Optional.ofNullable(data.get(key));
	}

	// 按类型读取，类型不匹配时返回空
	public <T> Optional<T> value(String key, Class<T> type) {
		return value(key).filter(type::isInstance).map(type::cast);
	}

	@SuppressWarnings("unchecked")
	public <T> T value(String key, T defaultValue) {
		return (T) value(key).orElse(defaultValue);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof OverAllState that)) {
			return false;
		}
		return data.equals(that.data);
	}

	@Override
	public int hashCode() {
		return data.hashCode();
	}

	@Override
	public String toString() {
		return "OverAllState{data=" + data + '}';
	}

}
