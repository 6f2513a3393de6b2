package com.github.lruttl.cache;

public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long expireCount;    // get 时发现并清除的过期条目
    private final long evictionCount;  // 容量驱逐

    public CacheStats(long hitCount, long missCount, long expireCount, long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.expireCount = expireCount;
        this.evictionCount = evictionCount;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    /** 过期也算未命中 */
    public double hitRate() {
        long total = hitCount + missCount + expireCount;
        return total == 0 ? 1.0 : (double) hitCount / total;
    }

    public long hitCount() { return hitCount; }
    public long missCount() { return missCount; }
    public long expireCount() { return expireCount; }
    public long evictionCount() { return evictionCount; }

    /** 分片汇总用 */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hitCount + other.hitCount,
                missCount + other.missCount,
                expireCount + other.expireCount,
                evictionCount + other.evictionCount);
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, expired=%d, evicted=%d}",
                hitCount, missCount, expireCount, evictionCount);
    }
}
