package com.github.lruttl.cache;

import com.github.lruttl.error.InvalidCacheConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BiConsumer;

/**
 * 非线程安全的 LRU + TTL 缓存核心
 *
 * 用于嵌入已经持有锁的调用方；需要线程安全时使用 {@link SynchronizedExpiringCache}
 * 包装，或通过 {@link LruTtl#newBuilder()} 构建（默认带锁）。
 */
public final class LruTtlCache<K, V> implements ExpiringCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(LruTtlCache.class);

    // 防止 now + ttl 溢出
    private static final long MAXIMUM_TTL_NANOS = Long.MAX_VALUE >> 1;

    private final BoundedStore<K, ExpiringEntry<V>> store;
    private final long defaultTtlNanos;
    private final EvictionListener<K, V> evictionListener;

    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder expireCount = new LongAdder();
    private final LongAdder evictionCount = new LongAdder();

    public LruTtlCache(int maximumSize, Duration defaultTtl) {
        this(maximumSize, defaultTtl, StoreType.LINKED, null);
    }

    public LruTtlCache(int maximumSize, Duration defaultTtl,
                       StoreType storeType, EvictionListener<K, V> evictionListener) {
        if (maximumSize <= 0 || defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new InvalidCacheConfigException("maximumSize and default ttl must be gt 0");
        }
        this.defaultTtlNanos = toNanos(defaultTtl);
        this.evictionListener = evictionListener;
        this.store = Objects.requireNonNull(storeType, "storeType").create(maximumSize);
        this.store.setEvictionListener(this::onStoreEviction);
    }

    private void onStoreEviction(K key, ExpiringEntry<V> entry) {
        evictionCount.increment();
        if (log.isDebugEnabled()) {
            log.debug("evicted lru entry, key={}, capacity={}", key, store.capacity());
        }
        if (evictionListener != null) {
            evictionListener.onEviction(key, entry.value());
        }
    }

    @Override
    public void add(K key, V value) {
        add(key, value, null);
    }

    @Override
    public void add(K key, V value, Duration ttl) {
        long ttlNanos = ttl == null ? defaultTtlNanos : toNanos(ttl);
        long expireAt = System.nanoTime() + ttlNanos;
        store.add(key, new ExpiringEntry<>(value, expireAt));
    }

    @Override
    public Lookup<V> get(K key) {
        ExpiringEntry<V> entry = store.get(key);
        if (entry == null) {
            missCount.increment();
            return Lookup.absent();
        }
        if (entry.isExpired(System.nanoTime())) {
            // get 时清除过期数据，但仍返回旧值
            store.remove(key);
            expireCount.increment();
            return Lookup.expired(entry.value());
        }
        hitCount.increment();
        return Lookup.hit(entry.value());
    }

    @Override
    public Lookup<V> peek(K key) {
        ExpiringEntry<V> entry = store.peek(key);
        if (entry == null) {
            return Lookup.absent();
        }
        if (entry.isExpired(System.nanoTime())) {
            return Lookup.expired(entry.value());
        }
        return Lookup.hit(entry.value());
    }

    @Override
    public Duration ttl(K key) {
        ExpiringEntry<V> entry = store.peek(key);
        if (entry == null) {
            return TTL_ABSENT;
        }
        long remaining = entry.remainingNanos(System.nanoTime());
        if (remaining < 0) {
            return TTL_EXPIRED;
        }
        return Duration.ofNanos(remaining);
    }

    @Override
    public boolean remove(K key) {
        return store.remove(key);
    }

    @Override
    public void clear() {
        store.clear();
    }

    @Override
    public int size() {
        long now = System.nanoTime();
        int[] count = new int[1];
        store.forEach((k, entry) -> {
            if (!entry.isExpired(now)) {
                count[0]++;
            }
        });
        return count[0];
    }

    @Override
    public List<K> keys() {
        List<K> keys = new ArrayList<>(store.size());
        forEach((k, v) -> keys.add(k));
        return keys;
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super V> visitor) {
        long now = System.nanoTime();
        store.forEach((k, entry) -> {
            if (!entry.isExpired(now)) {
                visitor.accept(k, entry.value());
            }
        });
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hitCount.sum(), missCount.sum(), expireCount.sum(), evictionCount.sum());
    }

    @Override
    public int capacity() {
        return store.capacity();
    }

    @Override
    public Duration defaultTtl() {
        return Duration.ofNanos(defaultTtlNanos);
    }

    /** 包含已过期未清除条目的物理数量，仅供测试 */
    int storedSize() {
        return store.size();
    }

    private static long toNanos(Duration ttl) {
        try {
            return Math.min(ttl.toNanos(), MAXIMUM_TTL_NANOS);
        } catch (ArithmeticException e) {
            return ttl.isNegative() ? -MAXIMUM_TTL_NANOS : MAXIMUM_TTL_NANOS;
        }
    }
}
