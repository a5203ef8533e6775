package com.example.shiftrota.schedule;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * At most one writer per team's stored schedule. Teams do not block each other.
 */
@Component
public class TeamScheduleLocks {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long teamId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(teamId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isLocked(Long teamId) {
        ReentrantLock lock = locks.get(teamId);
        return lock != null && lock.isLocked();
    }
}
