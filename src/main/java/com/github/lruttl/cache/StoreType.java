package com.github.lruttl.cache;

/**
 * BoundedStore 的底层实现选择
 */
public enum StoreType {
    /** HashMap + 手写双向链表（默认） */
    LINKED,
    /** java.util.LinkedHashMap（插入顺序 + 访问时重新插入） */
    LINKED_HASH_MAP;

    <K, V> BoundedStore<K, V> create(int capacity) {
        switch (this) {
            case LINKED_HASH_MAP:
                return new LinkedHashMapLruStore<>(capacity);
            case LINKED:
            default:
                return new LinkedLruStore<>(capacity);
        }
    }
}
