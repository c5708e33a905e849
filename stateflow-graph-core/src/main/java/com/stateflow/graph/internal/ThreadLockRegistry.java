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
package com.stateflow.graph.internal;

import com.stateflow.graph.checkpoint.BaseCheckpointSaver;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory locks keyed by thread id. Registries are shared per storage scope (see
 * {@link BaseCheckpointSaver#lockScope()}), so compiled graphs writing to the same store
 * serialize runs of the same thread.
 * <p>
 * A lock only stays registered while it is held or awaited: {@link #release} drops idle
 * entries, and {@link #acquire} retries when it locked an entry that was dropped in the
 * meantime.
 */
public final class ThreadLockRegistry {

	// 存储范围 -> 锁注册表
	private static final Map<Object, ThreadLockRegistry> REGISTRIES = Collections
		.synchronizedMap(new WeakHashMap<>());

	private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

	public ThreadLockRegistry() {
	}

	public static ThreadLockRegistry forSaver(BaseCheckpointSaver saver) {
		Objects.requireNonNull(saver, "saver cannot be null");
		return forOwner(saver.lockScope());
	}

	private static ThreadLockRegistry forOwner(Object owner) {
		Objects.requireNonNull(owner, "owner cannot be null");
		return REGISTRIES.computeIfAbsent(owner, key -> new ThreadLockRegistry());
	}

	/**
	 * Locks the thread id, waiting interruptibly.
	 * @return the held lock, to be unlocked and then passed to {@link #release}
	 */
	public ReentrantLock acquire(String threadId) throws InterruptedException {
		Objects.requireNonNull(threadId, "threadId cannot be null");
		while (true) {
			var lock = locks.computeIfAbsent(threadId, key -> new ReentrantLock());
			lock.lockInterruptibly();
			if (locks.get(threadId) == lock) {
				return lock;
			}
			// 锁在等待期间已被移除，重新获取
			lock.unlock();
		}
	}

	/**
	 * Drops the thread's lock when nobody holds or waits for it.
	 */
	public void release(String threadId) {
		locks.computeIfPresent(threadId, (key, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
	}

	int size() {
		return locks.size();
	}

}
