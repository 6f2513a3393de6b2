package com.github.lruttl.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * 基于 LinkedHashMap 的LRU存储
 *
 * 使用插入顺序而非 accessOrder=true：accessOrder 模式下 get() 也会移动节点，
 * peek 就无法做到只读。命中时通过 remove + put 把key移动到尾部（MRU）。
 */
public final class LinkedHashMapLruStore<K, V> implements BoundedStore<K, V> {
    private final int capacity;
    private final LinkedHashMap<K, V> map;
    private EvictionListener<K, V> evictionListener;

    public LinkedHashMapLruStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be gt 0");
        }
        this.capacity = capacity;
        this.map = new LinkedHashMap<>(Math.min(capacity, 1 << 16), 0.75f, false);
    }

    @Override
    public void add(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        // 先删除再插入，保证key位于尾部（MRU）
        map.remove(key);
        map.put(key, value);

        if (map.size() > capacity) {
            Iterator<Map.Entry<K, V>> it = map.entrySet().iterator();
            Map.Entry<K, V> eldest = it.next();
            it.remove();
            if (evictionListener != null) {
                evictionListener.onEviction(eldest.getKey(), eldest.getValue());
            }
        }
    }

    @Override
    public V get(K key) {
        V value = map.remove(key);
        if (value == null) {
            return null;
        }
        map.put(key, value);
        return value;
    }

    @Override
    public V peek(K key) {
        return map.get(key);
    }

    @Override
    public boolean remove(K key) {
        return map.remove(key) != null;
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void forEach(BiConsumer<? super K, ? super V> visitor) {
        List<Map.Entry<K, V>> snapshot = new ArrayList<>(map.entrySet().size());
        for (Map.Entry<K, V> e : map.entrySet()) {
            snapshot.add(Map.entry(e.getKey(), e.getValue()));
        }
        // 插入顺序是 LRU -> MRU，倒序遍历
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            Map.Entry<K, V> e = snapshot.get(i);
            visitor.accept(e.getKey(), e.getValue());
        }
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public void setEvictionListener(EvictionListener<K, V> listener) {
        this.evictionListener = listener;
    }
}
