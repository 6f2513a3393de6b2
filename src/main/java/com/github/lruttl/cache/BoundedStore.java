package com.github.lruttl.cache;

import java.util.function.BiConsumer;

/**
 * 固定容量的LRU存储
 *
 * 约束：
 * 1. size() 永远不超过 capacity()
 * 2. 所有key之间存在严格的新近顺序（MRU在前）
 * 3. add 触发的容量驱逐在 add 返回之前同步回调 EvictionListener
 *
 * 实现不是线程安全的，由调用方（SynchronizedExpiringCache）负责加锁。
 * get 会修改新近顺序，必须独占访问；peek 只读，可与其他 peek 并发。
 */
public interface BoundedStore<K, V> {

    /** 插入或覆盖，并提升为MRU；超出容量时驱逐唯一的LRU条目 */
    void add(K key, V value);

    /** 命中时提升为MRU，未命中返回null */
    V get(K key);

    /** 命中时不改变新近顺序，未命中返回null */
    V peek(K key);

    /** 删除key，不触发驱逐回调 */
    boolean remove(K key);

    int size();

    int capacity();

    /**
     * 按 MRU -> LRU 顺序遍历调用时刻的快照。
     * 遍历中修改存储不会影响本次遍历的剩余部分。
     */
    void forEach(BiConsumer<? super K, ? super V> visitor);

    /** 清空所有条目，不触发驱逐回调 */
    void clear();

    void setEvictionListener(EvictionListener<K, V> listener);
}
