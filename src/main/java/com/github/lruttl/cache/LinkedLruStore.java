package com.github.lruttl.cache;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * HashMap + AccessOrderDeque 实现的LRU存储
 * map 负责 O(1) 查找，deque 负责 O(1) 的新近顺序维护与LRU淘汰
 */
public final class LinkedLruStore<K, V> implements BoundedStore<K, V> {
    private final int capacity;
    private final HashMap<K, Node<K, V>> map;
    private final AccessOrderDeque<K, V> deque;
    private EvictionListener<K, V> evictionListener;

    public LinkedLruStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be gt 0");
        }
        this.capacity = capacity;
        this.map = new HashMap<>(Math.min(capacity, 1 << 16));
        this.deque = new AccessOrderDeque<>();
    }

    @Override
    public void add(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        Node<K, V> node = map.get(key);
        if (node != null) {
            node.setValue(value);
            deque.moveToTail(node);
            return;
        }

        node = new Node<>(key, value);
        map.put(key, node);
        deque.add(node);

        if (map.size() > capacity) {
            evictLru();
        }
    }

    private void evictLru() {
        if (deque.isEmpty()) {
            return;
        }
        Node<K, V> victim = deque.removeFirst();
        map.remove(victim.getKey());
        if (evictionListener != null) {
            evictionListener.onEviction(victim.getKey(), victim.getValue());
        }
    }

    @Override
    public V get(K key) {
        Node<K, V> node = map.get(key);
        if (node == null) {
            return null;
        }
        deque.moveToTail(node);
        return node.getValue();
    }

    @Override
    public V peek(K key) {
        Node<K, V> node = map.get(key);
        return node == null ? null : node.getValue();
    }

    @Override
    public boolean remove(K key) {
        Node<K, V> node = map.remove(key);
        if (node == null) {
            return false;
        }
        deque.remove(node);
        return true;
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
        List<Map.Entry<K, V>> snapshot = deque.snapshotMostRecentFirst(map.size());
        for (Map.Entry<K, V> e : snapshot) {
            visitor.accept(e.getKey(), e.getValue());
        }
    }

    @Override
    public void clear() {
        map.clear();
        deque.clear();
    }

    @Override
    public void setEvictionListener(EvictionListener<K, V> listener) {
        this.evictionListener = listener;
    }
}
