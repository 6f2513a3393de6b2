package com.github.lruttl.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 访问顺序双端队列
 * 维护节点从LRU(头)到MRU(尾)的顺序，所有修改操作均为 O(1)
 */
final class AccessOrderDeque<K, V> {
    private final Node<K, V> dummy; // 哨兵节点

    AccessOrderDeque() {
        // 哨兵节点不存储实际数据
        this.dummy = new Node<>(null, null);
        dummy.setPreviousInAccessOrder(dummy);
        dummy.setNextInAccessOrder(dummy);
    }

    /** 添加到尾部（MRU位置）- O(1) */
    void add(Node<K, V> e) {
        Node<K, V> prev = dummy.getPreviousInAccessOrder();
        e.setPreviousInAccessOrder(prev);
        e.setNextInAccessOrder(dummy);
        prev.setNextInAccessOrder(e);
        dummy.setPreviousInAccessOrder(e);
    }

    /** 移除并返回头部（LRU位置）- O(1) */
    Node<K, V> removeFirst() {
        Node<K, V> next = dummy.getNextInAccessOrder();
        if (next == dummy) return null;
        remove(next);
        return next;
    }

    /** 移除指定节点 - O(1) */
    void remove(Node<K, V> e) {
        Node<K, V> prev = e.getPreviousInAccessOrder();
        Node<K, V> next = e.getNextInAccessOrder();

        if (prev != null) prev.setNextInAccessOrder(next);
        if (next != null) next.setPreviousInAccessOrder(prev);

        // 清理引用帮助GC
        e.setPreviousInAccessOrder(null);
        e.setNextInAccessOrder(null);
    }

    /** 移动到尾部（标记为最近使用）- O(1) */
    void moveToTail(Node<K, V> e) {
        if (e.getNextInAccessOrder() == dummy) {
            return; // 已经是MRU
        }
        remove(e);
        add(e);
    }

    boolean isEmpty() {
        return dummy.getNextInAccessOrder() == dummy;
    }

    /** 断开所有节点，恢复为只有哨兵的空队列 */
    void clear() {
        Node<K, V> current = dummy.getNextInAccessOrder();
        while (current != dummy) {
            Node<K, V> next = current.getNextInAccessOrder();
            current.setPreviousInAccessOrder(null);
            current.setNextInAccessOrder(null);
            current = next;
        }
        dummy.setPreviousInAccessOrder(dummy);
        dummy.setNextInAccessOrder(dummy);
    }

    /**
     * 从MRU到LRU拷贝 (key, value) 快照。
     * 拷贝的是值而不是节点，之后覆盖节点的值也不会反映到快照中
     */
    List<Map.Entry<K, V>> snapshotMostRecentFirst(int expectedSize) {
        List<Map.Entry<K, V>> snapshot = new ArrayList<>(expectedSize);
        Node<K, V> current = dummy.getPreviousInAccessOrder();
        while (current != dummy) {
            snapshot.add(Map.entry(current.getKey(), current.getValue()));
            current = current.getPreviousInAccessOrder();
        }
        return snapshot;
    }
}
