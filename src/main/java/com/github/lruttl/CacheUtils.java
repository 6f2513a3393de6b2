package com.github.lruttl;

public final class CacheUtils {

    private CacheUtils() {}

    /**
     * 每个分片的容量：ceil(maximumSize / shards)
     * 例如：1000条、10个分片 → 100；1001条、10个分片 → 101
     */
    public static int shardCapacity(int maximumSize, int shards) {
        return (int) (((long) maximumSize + shards - 1) / shards);
    }

    /**
     * 64位哈希按无符号数取模定位分片
     * 分片数不要求是2的幂，因此不能用 & mask
     */
    public static int shardIndex(long hash, int shards) {
        return (int) Long.remainderUnsigned(hash, shards);
    }
}
