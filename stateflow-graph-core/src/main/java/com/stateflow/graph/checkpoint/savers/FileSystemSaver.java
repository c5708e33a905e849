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
package com.stateflow.graph.checkpoint.savers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;

/**
 * A CheckpointSaver that stores Checkpoints in the filesystem as JSON.
 * <p>
 * Each thread is associated with a file in the provided targetFolder. The file is named
 * "thread-<i>threadId</i>.saver", or "thread-$default.saver" when the RunnableConfig has
 * no thread id. Files are written to a temporary sibling and moved into place, so a
 * reader never observes a partially written checkpoint.
 * </p>
 * <p>
 * The file is authoritative: every read goes to disk, so several savers on the same
 * folder observe each other's writes. They also share one lock scope, the folder's real
 * path, so runs of the same thread id are serialized across them.
 * </p>
 */
public class FileSystemSaver extends MemorySaver {

	private static final Logger log = LoggerFactory.getLogger(FileSystemSaver.class);

	public static final String EXTENSION = ".saver";

	// 目录真实路径 -> 唯一实例，作为跨保存器共享的锁范围
	private static final ConcurrentHashMap<Path, Path> LOCK_SCOPES = new ConcurrentHashMap<>();

	private final Path targetFolder;

	private final ObjectMapper objectMapper;

	private final Path lockScope;

	public FileSystemSaver(Path targetFolder) {
		this(targetFolder, new ObjectMapper());
	}

	public FileSystemSaver(Path targetFolder, ObjectMapper objectMapper) {
		this.targetFolder = Objects.requireNonNull(targetFolder, "targetFolder cannot be null");
		this.objectMapper = BaseCheckpointSaver
			.configureObjectMapper(Objects.requireNonNull(objectMapper, "objectMapper cannot be null"));

		try {
			if (Files.exists(targetFolder) && !Files.isDirectory(targetFolder)) {
				throw new IllegalArgumentException(format("targetFolder '%s' must be a directory", targetFolder));
			}
			Files.createDirectories(targetFolder);
			this.lockScope = LOCK_SCOPES.computeIfAbsent(targetFolder.toRealPath(), path -> path);
		}
		catch (IOException ex) {
			throw new IllegalArgumentException(format("targetFolder '%s' cannot be created", targetFolder), ex);
		}
	}

	// 线程ID做URL编码，避免路径分隔符
	private Path getPath(RunnableConfig config) {
		var threadId = URLEncoder.encode(BaseCheckpointSaver.threadId(config), StandardCharsets.UTF_8);
		return targetFolder.resolve(format("thread-%s%s", threadId, EXTENSION));
	}

	@Override
	protected Checkpoint loadedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
		var path = getPath(config);
		if (!Files.exists(path)) {
			return null;
		}
		log.debug("loading checkpoint from {}", path);
		return objectMapper.readValue(path.toFile(), Checkpoint.class);
	}

	@Override
	protected void insertedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
		var path = getPath(config);
		var tmp = Files.createTempFile(targetFolder, "thread-", ".tmp");
		try {
			objectMapper.writeValue(tmp.toFile(), checkpoint);
			try {
				Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException ex) {
				log.warn("atomic move not supported in {}, falling back to replace", targetFolder);
				Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(tmp);
		}
	}

	@Override
	protected void releasedCheckpoint(RunnableConfig config) throws Exception {
		var path = getPath(config);
		if (Files.deleteIfExists(path)) {
			log.debug("deleted checkpoint file {}", path);
		}
	}

	@Override
	public Object lockScope() {
		return lockScope;
	}

	public Path getTargetFolder() {
		return targetFolder;
	}

}
