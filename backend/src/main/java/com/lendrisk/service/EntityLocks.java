package com.lendrisk.service;

import com.lendrisk.exception.ErrorCode;
import com.lendrisk.exception.LendingException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per entity key ("pool:ETH", "user:…", "loan:…").
 *
 * <p>Keys are always taken in natural order, so two operations sharing entities cannot deadlock.
 * A lock that cannot be taken within the timeout fails the operation with RESOURCE_BUSY.
 */
public class EntityLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public EntityLocks(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                if (!tryLock(lock)) {
                    throw new LendingException(ErrorCode.RESOURCE_BUSY, "Timed out waiting for " + key);
                }
                held.push(lock);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) held.pop().unlock();
        }
    }

    private boolean tryLock(ReentrantLock lock) {
        try {
            return lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LendingException(ErrorCode.RESOURCE_BUSY, "Interrupted while waiting for a lock", e);
        }
    }
}
