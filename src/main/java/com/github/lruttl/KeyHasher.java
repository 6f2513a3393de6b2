package com.github.lruttl;

/**
 * key字节串 -> 64位哈希
 * 要求快速、分布均匀、结果确定，不要求抗碰撞攻击
 */
@FunctionalInterface
public interface KeyHasher {
    long hash64(byte[] data);
}
