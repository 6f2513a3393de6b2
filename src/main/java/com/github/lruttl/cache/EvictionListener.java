package com.github.lruttl.cache;

/**
 * 容量驱逐回调：仅在超出容量淘汰LRU条目时同步触发，
 * 显式删除与TTL过期都不会触发。
 */
@FunctionalInterface
public interface EvictionListener<K, V> {
    void onEviction(K key, V value);
}
