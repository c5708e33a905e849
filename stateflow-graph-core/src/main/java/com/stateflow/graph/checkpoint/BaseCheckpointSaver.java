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
package com.stateflow.graph.checkpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.stateflow.graph.RunnableConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Persistence contract of the engine. One checkpoint is kept per thread id with
 * last-write-wins semantics, and a {@link #put} that returned normally must be visible
 * to every later {@link #get} on the same thread id.
 * <p>
 * Implementations report storage failures as
 * {@link com.stateflow.graph.exception.CheckpointException}.
 */
public interface BaseCheckpointSaver {

	String THREAD_ID_DEFAULT = "$default";

	/**
	 * Configures an ObjectMapper for checkpoint serialization. Durable savers share this
	 * configuration so their files stay readable across implementations.
	 * @param objectMapper the ObjectMapper to configure
	 * @return the configured ObjectMapper
	 */
	static ObjectMapper configureObjectMapper(ObjectMapper objectMapper) {
		ObjectMapper mapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
		// 注册JDK8模块以支持Optional
		mapper.registerModule(new Jdk8Module());
		mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
		return mapper;
	}

	// 从配置中解析线程ID
	static String threadId(RunnableConfig config) {
		return config.threadId().orElse(THREAD_ID_DEFAULT);
	}

	Optional<Checkpoint> get(RunnableConfig config);

	void put(RunnableConfig config, Checkpoint checkpoint);

	/**
	 * Removes the checkpoint of the config's thread.
	 * @return {@code true} if a checkpoint existed
	 */
	boolean clear(RunnableConfig config);

	/**
	 * Identity of the storage behind this saver. Runs on the same thread id are serialized
	 * across all savers returning an equal scope, so savers sharing one physical store
	 * must return the same value.
	 */
	default Object lockScope() {
		return this;
	}

	default Optional<Checkpoint> load(String threadId) {
		return get(RunnableConfig.builder().threadId(threadId).build());
	}

	default void save(String threadId, Checkpoint checkpoint) {
		put(RunnableConfig.builder().threadId(threadId).build(), checkpoint);
	}

}
