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

import com.stateflow.graph.RunnableConfig;
import com.stateflow.graph.checkpoint.BaseCheckpointSaver;
import com.stateflow.graph.checkpoint.Checkpoint;
import com.stateflow.graph.exception.CheckpointException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;

// 内存检查点保存器，每个线程只保留最新的检查点
public class MemorySaver implements BaseCheckpointSaver {

	// 按线程ID存储检查点的映射表
	private final Map<String, Checkpoint> checkpointsByThread = new HashMap<>();

	// 可重入锁，保证读写的可见性
	private final ReentrantLock lock = new ReentrantLock();

	public MemorySaver() {
	}

	// 加载检查点的钩子，子类可从外部存储刷新内存中的检查点；返回 null 表示不存在
	protected Checkpoint loadedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
		return checkpoint;
	}

	// 写入检查点的钩子，在更新内存之前调用；抛出异常时内存保持原值
	protected void insertedCheckpoint(RunnableConfig config, Checkpoint checkpoint) throws Exception {
	}

	// 清除检查点的钩子
	protected void releasedCheckpoint(RunnableConfig config) throws Exception {
	}

	@Override
	public final Optional<Checkpoint> get(RunnableConfig config) {
		var threadId = BaseCheckpointSaver.threadId(config);
		lock.lock();
		try {
			var current = checkpointsByThread.get(threadId);
			var loaded = loadedCheckpoint(config, current);
			if (loaded == null) {
				checkpointsByThread.remove(threadId);
			}
			else if (loaded != current) {
				checkpointsByThread.put(threadId, loaded);
			}
			return Optional.ofNullable(loaded);
		}
		catch (CheckpointException ex) {
			throw ex;
		}
		catch (Exception ex) {
			throw new CheckpointException(format("cannot load checkpoint of thread '%s'", threadId), ex);
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public final void put(RunnableConfig config, Checkpoint checkpoint) {
		var threadId = BaseCheckpointSaver.threadId(config);
		lock.lock();
		try {
			insertedCheckpoint(config, checkpoint);
			checkpointsByThread.put(threadId, checkpoint);
		}
		catch (CheckpointException ex) {
			throw ex;
		}
		catch (Exception ex) {
			throw new CheckpointException(format("cannot save checkpoint of thread '%s'", threadId), ex);
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public final boolean clear(RunnableConfig config) {
		var threadId = BaseCheckpointSaver.threadId(config);
		lock.lock();
		try {
			var current = loadedCheckpoint(config, checkpointsByThread.get(threadId));
			releasedCheckpoint(config);
			checkpointsByThread.remove(threadId);
			return current != null;
		}
		catch (CheckpointException ex) {
			throw ex;
		}
		catch (Exception ex) {
			throw new CheckpointException(format("cannot clear checkpoint of thread '%s'", threadId), ex);
		}
		finally {
			lock.unlock();
		}
	}

}
