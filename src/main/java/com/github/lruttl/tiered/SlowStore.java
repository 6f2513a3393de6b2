package com.github.lruttl.tiered;

import java.time.Duration;

/**
 * 慢速存储（例如Redis）：容量更大、可持久化、可能是远程的。
 * 它是跨进程的唯一可信数据源。
 *
 * 失败通过非受检异常表示，TieredCache 原样向上传播。
 * "未找到"可以抛出 {@link com.github.lruttl.error.KeyNotFoundException}，
 * 也可以返回null。
 */
public interface SlowStore {

    /** 返回数据，不存在时返回null或抛出未找到异常 */
    byte[] get(CallContext ctx, String key);

    void set(CallContext ctx, String key, byte[] value, Duration ttl);

    /** 剩余存活时间；不存在或永不过期时的返回值由实现决定（非正数） */
    Duration ttl(CallContext ctx, String key);

    /** 返回实际删除的数量 */
    long delete(CallContext ctx, String key);
}
