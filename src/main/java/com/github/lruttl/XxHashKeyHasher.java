package com.github.lruttl;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

/**
 * 默认哈希：xxHash64（lz4-java）
 */
public final class XxHashKeyHasher implements KeyHasher {
    private static final long SEED = 0x9747b28cL;

    private final XXHash64 hash64 = XXHashFactory.fastestInstance().hash64();

    @Override
    public long hash64(byte[] data) {
        return hash64.hash(data, 0, data.length, SEED);
    }
}
