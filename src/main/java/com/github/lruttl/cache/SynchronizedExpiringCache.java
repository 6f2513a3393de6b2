package com.github.lruttl.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.StampedLock;
import java.util.function.BiConsumer;

/**
 * 线程安全装饰器
 *
 * 锁策略：
 * - add/remove/clear/get：写锁（get 会调整LRU顺序，不能降级为读锁）
 * - peek/ttl/size/keys/stats：读锁
 * - forEach：读锁内拷贝快照，释放锁后再回调 visitor
 *
 * 警告：EvictionListener 在写锁内同步执行，StampedLock 不可重入，
 * 回调中不能再访问同一个缓存实例，否则死锁。
 */
public final class SynchronizedExpiringCache<K, V> implements ExpiringCache<K, V> {
    private final ExpiringCache<K, V> delegate;
    private final StampedLock lock = new StampedLock();

    public SynchronizedExpiringCache(ExpiringCache<K, V> delegate) {
        if (delegate instanceof SynchronizedExpiringCache) {
            throw new IllegalArgumentException("delegate is already synchronized");
        }
        this.delegate = delegate;
    }

    @Override
    public void add(K key, V value) {
        long stamp = lock.writeLock();
        try {
            delegate.add(key, value);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void add(K key, V value, Duration ttl) {
        long stamp = lock.writeLock();
        try {
            delegate.add(key, value, ttl);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Lookup<V> get(K key) {
        long stamp = lock.writeLock();
        try {
            return delegate.get(key);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Lookup<V> peek(K key) {
        long stamp = lock.readLock();
        try {
            return delegate.peek(key);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public Duration ttl(K key) {
        long stamp = lock.readLock();
        try {
            return delegate.ttl(key);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public boolean remove(K key) {
        long stamp = lock.writeLock();
        try {
            return delegate.remove(key);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void clear() {
        long stamp = lock.writeLock();
        try {
            delegate.clear();
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public int size() {
        long stamp = lock.readLock();
        try {
            return delegate.size();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public List<K> keys() {
        long stamp = lock.readLock();
        try {
            return delegate.keys();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super V> visitor) {
        List<Map.Entry<K, V>> snapshot;
        long stamp = lock.readLock();
        try {
            List<Map.Entry<K, V>> entries = new ArrayList<>();
            delegate.forEach((k, v) -> entries.add(Map.entry(k, v)));
            snapshot = entries;
        } finally {
            lock.unlockRead(stamp);
        }
        for (Map.Entry<K, V> e : snapshot) {
            visitor.accept(e.getKey(), e.getValue());
        }
    }

    @Override
    public CacheStats stats() {
        // 计数器基于 LongAdder，无需加锁
        return delegate.stats();
    }

    @Override
    public int capacity() {
        return delegate.capacity();
    }

    @Override
    public Duration defaultTtl() {
        return delegate.defaultTtl();
    }
}
