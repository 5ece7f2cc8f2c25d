package com.example.clusteragent.session;

import com.example.clusteragent.error.AgentException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session id. Transitions of the same session are serialized; reads never
 * take the lock.
 */
@Component
public class SessionLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Duration wait, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AgentException.conflict("Interrupted while waiting for session " + sessionId);
        }
        if (!acquired) {
            throw AgentException.conflict("Session " + sessionId + " is busy with another transition");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void release(String sessionId) {
        locks.remove(sessionId);
    }
}
