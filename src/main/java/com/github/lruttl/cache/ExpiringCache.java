package com.github.lruttl.cache;

import java.time.Duration;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * LRU + TTL 缓存
 *
 * 过期是惰性的：没有后台线程清理，只在访问时判断。
 * 已过期但未被访问的条目仍然占用一个容量槽位，直到被 get/remove 清除或被容量驱逐。
 * size/keys/forEach 会透明地过滤掉这类条目。
 */
public interface ExpiringCache<K, V> {

    /** ttl(key) 的返回值：key不存在 */
    Duration TTL_ABSENT = Duration.ofNanos(-2);

    /** ttl(key) 的返回值：key存在但已过期 */
    Duration TTL_EXPIRED = Duration.ofNanos(-1);

    /** 使用默认TTL写入 */
    void add(K key, V value);

    /**
     * 写入并指定TTL
     * @param ttl 为null时使用默认TTL
     */
    void add(K key, V value, Duration ttl);

    /**
     * 读取并提升为MRU。过期条目会被删除，返回 {@link Lookup#expired(Object)}。
     * 会修改新近顺序，同步实现中需要独占锁。
     */
    Lookup<V> get(K key);

    /** 命中返回值，否则返回null */
    default V getIfPresent(K key) {
        Lookup<V> lookup = get(key);
        return lookup.isFound() ? lookup.value() : null;
    }

    /** 只读查询：不改变新近顺序，过期条目也不会被删除 */
    Lookup<V> peek(K key);

    /**
     * 剩余存活时间（peek语义）
     * @return {@link #TTL_ABSENT}、{@link #TTL_EXPIRED} 或剩余的非负时长
     */
    Duration ttl(K key);

    boolean remove(K key);

    /** 清空所有条目（包括已过期的），不触发驱逐回调，统计计数保留 */
    void clear();

    /** 未过期条目数 */
    int size();

    /** 未过期的key，MRU -> LRU */
    List<K> keys();

    /** 按 MRU -> LRU 遍历未过期条目 */
    void forEach(BiConsumer<? super K, ? super V> visitor);

    CacheStats stats();

    int capacity();

    Duration defaultTtl();
}
