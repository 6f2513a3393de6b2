package com.github.lruttl.cache;

/**
 * 带绝对过期时间的缓存条目，expireAt 为 System.nanoTime() 刻度
 */
final class ExpiringEntry<V> {
    private final V value;
    private final long expireAt;

    ExpiringEntry(V value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    V value() {
        return value;
    }

    long expireAt() {
        return expireAt;
    }

    /** 剩余纳秒数，负数表示已过期（差值比较，避免 nanoTime 溢出） */
    long remainingNanos(long now) {
        return expireAt - now;
    }

    boolean isExpired(long now) {
        return expireAt - now < 0;
    }
}
