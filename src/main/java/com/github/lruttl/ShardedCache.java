package com.github.lruttl;

import com.github.lruttl.cache.CacheStats;
import com.github.lruttl.cache.EvictionListener;
import com.github.lruttl.cache.ExpiringCache;
import com.github.lruttl.cache.LruTtl;
import com.github.lruttl.cache.StoreType;
import com.github.lruttl.error.InvalidCacheConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 分片缓存：N 个相互独立、各自加锁的 ExpiringCache，按 key 的哈希选择分片
 *
 * 只负责路由，不保证跨分片的全局LRU顺序，分片之间的占用不均衡是允许的。
 * 调用方通过 {@link #pickShard(String)} 拿到分片后直接在分片上操作。
 *
 * 没有全局锁：size()/keys()/stats() 是逐个分片读取的汇总，
 * 并发写入时得到的结果可能从未在任何一个时刻真实存在过。
 */
public final class ShardedCache<V> {
    private static final Logger log = LoggerFactory.getLogger(ShardedCache.class);

    // 分片数组（final保证可见性）
    private final ExpiringCache<String, V>[] shards;
    private final KeyHasher hasher;

    @SuppressWarnings("unchecked")
    private ShardedCache(Builder<V> builder) {
        this.hasher = builder.hasher;
        int shardCapacity = CacheUtils.shardCapacity(builder.maximumSize, builder.shards);

        this.shards = new ExpiringCache[builder.shards];
        for (int i = 0; i < builder.shards; i++) {
            shards[i] = LruTtl.<String, V>newBuilder()
                    .maximumSize(shardCapacity)
                    .expireAfterWrite(builder.expireAfterWrite)
                    .storeType(builder.storeType)
                    .evictionListener(builder.evictionListener)
                    .build();
        }

        log.debug("initialized sharded cache with {} shards, {} entries per shard",
                shards.length, shardCapacity);
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * 哈希定位分片：hash(key) mod shardCount
     * 同一个实例中相同key永远返回同一个分片
     */
    public ExpiringCache<String, V> pickShard(String key) {
        Objects.requireNonNull(key, "key");
        long hash = hasher.hash64(key.getBytes(StandardCharsets.UTF_8));
        return shards[CacheUtils.shardIndex(hash, shards.length)];
    }

    public ExpiringCache<String, V> shard(int index) {
        return shards[index];
    }

    public int shardCount() {
        return shards.length;
    }

    /**
     * 所有分片未过期条目数之和（非原子快照）
     */
    public long size() {
        long sum = 0;
        for (ExpiringCache<String, V> shard : shards) {
            sum += shard.size();
        }
        return sum;
    }

    /**
     * 所有分片的未过期key（非原子快照），分片内为 MRU -> LRU
     */
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (ExpiringCache<String, V> shard : shards) {
            keys.addAll(shard.keys());
        }
        return keys;
    }

    public CacheStats stats() {
        CacheStats total = CacheStats.empty();
        for (ExpiringCache<String, V> shard : shards) {
            total = total.plus(shard.stats());
        }
        return total;
    }

    public static final class Builder<V> {
        private int shards = -1;
        private int maximumSize = -1;
        private Duration expireAfterWrite;
        private StoreType storeType = StoreType.LINKED;
        private EvictionListener<String, V> evictionListener;
        private KeyHasher hasher;

        private Builder() {}

        public Builder<V> shards(int shards) {
            this.shards = shards;
            return this;
        }

        /** 所有分片的总条目数，必须大于分片数 */
        public Builder<V> maximumSize(int maximumSize) {
            this.maximumSize = maximumSize;
            return this;
        }

        public Builder<V> expireAfterWrite(Duration duration) {
            this.expireAfterWrite = duration;
            return this;
        }

        public Builder<V> expireAfterWrite(long duration, TimeUnit unit) {
            this.expireAfterWrite = Duration.ofNanos(unit.toNanos(duration));
            return this;
        }

        public Builder<V> storeType(StoreType storeType) {
            this.storeType = Objects.requireNonNull(storeType, "storeType");
            return this;
        }

        /** 所有分片共享的容量驱逐回调，可能被多个线程并发调用 */
        public Builder<V> evictionListener(EvictionListener<String, V> listener) {
            this.evictionListener = listener;
            return this;
        }

        public Builder<V> hasher(KeyHasher hasher) {
            this.hasher = Objects.requireNonNull(hasher, "hasher");
            return this;
        }

        public ShardedCache<V> build() {
            if (expireAfterWrite == null || expireAfterWrite.isZero() || expireAfterWrite.isNegative()
                    || shards <= 0 || maximumSize <= shards) {
                throw new InvalidCacheConfigException(
                        "default ttl, shards and maximumSize must be gt 0, and maximumSize must be gt shards");
            }
            if (hasher == null) {
                hasher = new XxHashKeyHasher();
            }
            return new ShardedCache<>(this);
        }
    }
}
