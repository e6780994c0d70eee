package com.driftwatch.service.window;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock per project. Row-id assignment and window updates for one project
 * run under its lock; different projects proceed in parallel.
 */
@Component
public class ProjectLocks {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long projectId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(projectId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isHeld(long projectId) {
        ReentrantLock lock = locks.get(projectId);
        return lock != null && lock.isLocked();
    }
}
