package org.caureq.caureqsensorhub.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** One lock per sensor id, created lazily and kept for the sensor's lifetime. */
final class SensorLocks {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    <T> T withLock(String sensorId, Supplier<T> action) {
        var lock = locks.computeIfAbsent(sensorId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
