package com.github.lruttl.cache;

import com.github.lruttl.error.InvalidCacheConfigException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ExpiringCache 构建器
 *
 * <pre>
 * ExpiringCache&lt;String, byte[]&gt; cache = LruTtl.&lt;String, byte[]&gt;newBuilder()
 *         .maximumSize(1000)
 *         .expireAfterWrite(Duration.ofMinutes(5))
 *         .build();
 * </pre>
 *
 * 参数校验在 build() 中进行，不合法时抛出 {@link InvalidCacheConfigException}。
 */
public final class LruTtl<K, V> {
    static final int UNSET_INT = -1;

    int maximumSize = UNSET_INT;
    Duration expireAfterWrite;
    StoreType storeType = StoreType.LINKED;
    EvictionListener<K, V> evictionListener;
    boolean synchronize = true;

    private LruTtl() {}

    public static <K, V> LruTtl<K, V> newBuilder() {
        return new LruTtl<>();
    }

    public LruTtl<K, V> maximumSize(int maximumSize) {
        this.maximumSize = maximumSize;
        return this;
    }

    /** 默认TTL，add 未指定TTL时使用 */
    public LruTtl<K, V> expireAfterWrite(Duration duration) {
        this.expireAfterWrite = duration;
        return this;
    }

    public LruTtl<K, V> expireAfterWrite(long duration, TimeUnit unit) {
        this.expireAfterWrite = Duration.ofNanos(unit.toNanos(duration));
        return this;
    }

    public LruTtl<K, V> storeType(StoreType storeType) {
        this.storeType = Objects.requireNonNull(storeType, "storeType");
        return this;
    }

    /** 容量驱逐回调（TTL过期与显式删除不会触发） */
    public LruTtl<K, V> evictionListener(EvictionListener<K, V> listener) {
        this.evictionListener = listener;
        return this;
    }

    /**
     * 是否使用内部读写锁（默认true）。
     * 嵌入到已经持有锁的调用方时可关闭。
     */
    public LruTtl<K, V> synchronize(boolean synchronize) {
        this.synchronize = synchronize;
        return this;
    }

    public ExpiringCache<K, V> build() {
        // 未设置的参数同样由 LruTtlCache 构造器拒绝
        ExpiringCache<K, V> core = new LruTtlCache<>(maximumSize, expireAfterWrite, storeType, evictionListener);
        return synchronize ? new SynchronizedExpiringCache<>(core) : core;
    }
}
