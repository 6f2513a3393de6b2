package com.github.lruttl.tiered;

import com.github.lruttl.cache.EvictionListener;
import com.github.lruttl.cache.ExpiringCache;
import com.github.lruttl.cache.Lookup;
import com.github.lruttl.cache.LruTtl;
import com.github.lruttl.error.EmptyKeyException;
import com.github.lruttl.error.InvalidCacheConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 二级缓存：近端为有容量上限的 LRU+TTL 缓存，远端为慢速存储
 *
 * 一致性约束：
 * 1. 写入顺序 慢速存储 -> 近端缓存，慢速存储写入失败时近端缓存保持不变，
 *    近端缓存中不会出现未持久化的数据
 * 2. 读取 近端缓存 -> 慢速存储，从慢速存储读到数据后按其剩余TTL回填近端缓存
 * 3. 近端缓存过期只清除近端条目，不影响慢速存储（慢速存储是唯一可信数据源）
 *
 * 所有公开方法的key都是原始key，内部自动拼接 prefix。
 * TieredCache 本身不持有锁，调用慢速存储期间不会阻塞近端缓存。
 */
public final class TieredCache {
    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    private final String prefix;
    private final Duration defaultTtl;
    private final ExpiringCache<String, byte[]> nearCache;
    private final SlowStore slowStore;
    private final Codec codec;
    private final Class<? extends RuntimeException> notFoundError;

    private TieredCache(Builder builder) {
        this.prefix = builder.prefix;
        this.defaultTtl = builder.defaultTtl;
        this.slowStore = builder.slowStore;
        this.codec = builder.codec;
        this.notFoundError = builder.notFoundError;
        this.nearCache = LruTtl.<String, byte[]>newBuilder()
                .maximumSize(builder.maximumSize)
                .expireAfterWrite(builder.defaultTtl)
                .evictionListener(builder.evictionListener)
                .build();
    }

    public static Builder builder(SlowStore slowStore) {
        return new Builder(slowStore);
    }

    /**
     * 拼接前缀。由公有方法调用一次，私有方法只接收已拼接的key，避免重复添加前缀
     */
    String resolveKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new EmptyKeyException();
        }
        return prefix + key;
    }

    /**
     * 剩余存活时间：近端缓存中存在且未过期时直接返回，
     * 否则（可能因容量限制被驱逐）查询慢速存储
     */
    public Duration ttl(CallContext ctx, String key) {
        String resolved = resolveKey(key);
        Duration d = nearCache.ttl(resolved);
        if (!d.isNegative()) {
            return d;
        }
        return slowStore.ttl(ctx, resolved);
    }

    /**
     * 读取原始字节，近端缓存未命中时从慢速存储读取并回填
     *
     * 返回的数组不做拷贝，与近端缓存中保存的是同一个引用，调用方不能修改。
     * @return 数据；慢速存储返回空数据时为null
     */
    public byte[] getBytes(CallContext ctx, String key) {
        return getBytesResolved(ctx, resolveKey(key));
    }

    private byte[] getBytesResolved(CallContext ctx, String key) {
        // 过期时 lookup 也带回旧值，但只有 isFound 才算可用命中
        Lookup<byte[]> lookup = nearCache.get(key);
        if (lookup.isFound() && lookup.value() != null && lookup.value().length != 0) {
            return lookup.value();
        }

        // 近端不存在：数据不存在、已过期，或容量不足被驱逐
        byte[] data = slowStore.get(ctx, key);
        if (data == null || data.length == 0) {
            return null;
        }
        backfill(ctx, key, data);
        return data;
    }

    private void backfill(CallContext ctx, String key, byte[] data) {
        Duration ttl;
        try {
            ttl = slowStore.ttl(ctx, key);
        } catch (RuntimeException e) {
            // 获取TTL失败只是不回填，本次读取仍然成功
            log.warn("slow store ttl lookup failed, skip near cache backfill: key={}", key, e);
            return;
        }
        // 负TTL表示慢速存储中无过期时间或key已消失，回填只会得到出生即过期的条目
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        nearCache.add(key, data, ttl);
        log.debug("near cache backfilled: key={}, ttl={}", key, ttl);
    }

    public void setBytes(CallContext ctx, String key, byte[] value) {
        setBytes(ctx, key, value, null);
    }

    /**
     * 写入原始字节
     *
     * value 不做拷贝直接放入近端缓存，写入后调用方不能再修改该数组。
     * @param ttl 为null或0时使用默认TTL
     */
    public void setBytes(CallContext ctx, String key, byte[] value, Duration ttl) {
        setBytesResolved(ctx, resolveKey(key), value, ttl);
    }

    private void setBytesResolved(CallContext ctx, String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        Duration t = (ttl == null || ttl.isZero()) ? defaultTtl : ttl;
        // 先写较慢的缓存，失败时异常直接抛出，近端缓存不写入
        try {
            slowStore.set(ctx, key, value, t);
        } catch (RuntimeException e) {
            log.warn("slow store write failed, near cache left untouched: key={}", key);
            throw e;
        }
        nearCache.add(key, value, t);
    }

    /**
     * 读取并反序列化
     * @return 解码后的值；没有数据时为null
     */
    public <T> T get(CallContext ctx, String key, Class<T> type) {
        byte[] data = getBytesResolved(ctx, resolveKey(key));
        if (data == null) {
            return null;
        }
        return codec.decode(data, type);
    }

    /**
     * 同 {@link #get}，但慢速存储抛出的"未找到"异常（builder 中 notFoundError 配置的类型）
     * 转换为null返回，其他异常照常抛出
     */
    public <T> T getIgnoreNotFound(CallContext ctx, String key, Class<T> type) {
        try {
            return get(ctx, key, type);
        } catch (RuntimeException e) {
            if (notFoundError != null && notFoundError.isInstance(e)) {
                return null;
            }
            throw e;
        }
    }

    public void set(CallContext ctx, String key, Object value) {
        set(ctx, key, value, null);
    }

    /**
     * 序列化后写入，序列化失败时两层缓存都不会写入
     * @param ttl 为null或0时使用默认TTL
     */
    public void set(CallContext ctx, String key, Object value, Duration ttl) {
        String resolved = resolveKey(key);
        byte[] data = codec.encode(value);
        setBytesResolved(ctx, resolved, data, ttl);
    }

    /**
     * 先清除近端缓存，再删除慢速存储
     * @return 慢速存储返回的删除数量
     */
    public long delete(CallContext ctx, String key) {
        String resolved = resolveKey(key);
        nearCache.remove(resolved);
        return slowStore.delete(ctx, resolved);
    }

    public String prefix() {
        return prefix;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    // 测试用：直接观察近端缓存
    ExpiringCache<String, byte[]> nearCache() {
        return nearCache;
    }

    public static final class Builder {
        private final SlowStore slowStore;
        private int maximumSize = -1;
        private Duration defaultTtl;
        private String prefix = "";
        private Codec codec = new JacksonCodec();
        private Class<? extends RuntimeException> notFoundError;
        private EvictionListener<String, byte[]> evictionListener;

        private Builder(SlowStore slowStore) {
            this.slowStore = slowStore;
        }

        /** 近端缓存的最大条目数 */
        public Builder maximumSize(int maximumSize) {
            this.maximumSize = maximumSize;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder defaultTtl(long duration, TimeUnit unit) {
            this.defaultTtl = Duration.ofNanos(unit.toNanos(duration));
            return this;
        }

        /** 所有key的前缀，自动拼接 */
        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder codec(Codec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /** getIgnoreNotFound 视为"无数据"的异常类型 */
        public Builder notFoundError(Class<? extends RuntimeException> notFoundError) {
            this.notFoundError = notFoundError;
            return this;
        }

        /** 近端缓存的容量驱逐回调，key为拼接前缀后的key */
        public Builder evictionListener(EvictionListener<String, byte[]> listener) {
            this.evictionListener = listener;
            return this;
        }

        public TieredCache build() {
            if (slowStore == null) {
                throw new InvalidCacheConfigException("slow store is required");
            }
            if (maximumSize <= 0 || defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
                throw new InvalidCacheConfigException("maximumSize and default ttl must be gt 0");
            }
            return new TieredCache(this);
        }
    }
}
