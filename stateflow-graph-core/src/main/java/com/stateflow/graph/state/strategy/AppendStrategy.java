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
package com.stateflow.graph.state.strategy;

import com.stateflow.graph.KeyStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

/**
 * Concatenates the written elements onto the current sequence, preserving order. Both
 * sides must be collections; a missing current value counts as empty.
 */
public final class AppendStrategy implements KeyStrategy {

	public static final AppendStrategy INSTANCE = new AppendStrategy();

	private AppendStrategy() {
	}

	@Override
	public Object apply(Object oldValue, Object newValue) {
		if (!(newValue instanceof Collection<?> additions)) {
			throw new IllegalArgumentException(
					format("append requires a collection value but got %s", typeName(newValue)));
		}
		// 旧值为空时视为空列表
		if (oldValue != null && !(oldValue instanceof Collection)) {
			throw new IllegalArgumentException(
					format("append requires the current value to be a collection but got %s", typeName(oldValue)));
		}
		List<Object> result = new ArrayList<>();
		if (oldValue != null) {
			result.addAll((Collection<?>) oldValue);
		}
		result.addAll(additions);
		return Collections.unmodifiableList(result);
	}

	@Override
	public Object defaultValue() {
		return List.of();
	}

	private static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getName();
	}

	@Override
	public String toString() {
		return "append";
	}

}
