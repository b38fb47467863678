package com.dingdangmaoup.dock.coordination;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.lang.ref.Reference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-process lock tables keyed by string. Entries are weakly held, so a key
 * nobody is locking is collected instead of accumulating.
 * <p>
 * Locks are thread-bound: only use them inside a single blocking callable,
 * never across reactive operators.
 */
@Component
public class KeyedLocks {

    private final LoadingCache<String, Lock> exclusiveLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    private final LoadingCache<String, ReadWriteLock> readWriteLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantReadWriteLock());

    public Lock exclusive(String key) {
        return exclusiveLocks.get(key);
    }

    public ReadWriteLock readWrite(String key) {
        return readWriteLocks.get(key);
    }

    public <T> T withExclusive(String key, Supplier<T> action) {
        Lock lock = exclusive(key);
        return withLock(lock, lock, action);
    }

    public <T> T withRead(String key, Supplier<T> action) {
        ReadWriteLock lock = readWrite(key);
        return withLock(lock, lock.readLock(), action);
    }

    public <T> T withWrite(String key, Supplier<T> action) {
        ReadWriteLock lock = readWrite(key);
        return withLock(lock, lock.writeLock(), action);
    }

    /**
     * Read side of {@code outerKey}, then the exclusive lock of {@code innerKey}.
     */
    public <T> T withReadThenExclusive(String outerKey, String innerKey, Supplier<T> action) {
        return withRead(outerKey, () -> withExclusive(innerKey, action));
    }

    /**
     * The read and write views of a {@link ReentrantReadWriteLock} do not reference
     * the lock itself, so {@code owner} is kept reachable until the unlock. Otherwise
     * the weak table entry can be collected while the lock is held and the next
     * caller would get a fresh, unlocked instance.
     */
    private static <T> T withLock(Object owner, Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            Reference.reachabilityFence(owner);
        }
    }
}
