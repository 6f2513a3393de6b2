package com.github.lruttl.cache;

/**
 * LinkedLruStore 的链表节点：key 不可变，value 可被覆盖写
 */
final class Node<K, V> implements AccessOrder<Node<K, V>> {
    private final K key;
    private V value;

    private Node<K, V> prevInAccessOrder;
    private Node<K, V> nextInAccessOrder;

    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }

    K getKey() {
        return key;
    }

    V getValue() {
        return value;
    }

    void setValue(V value) {
        this.value = value;
    }

    @Override
    public Node<K, V> getPreviousInAccessOrder() {
        return prevInAccessOrder;
    }

    @Override
    public void setPreviousInAccessOrder(Node<K, V> prev) {
        this.prevInAccessOrder = prev;
    }

    @Override
    public Node<K, V> getNextInAccessOrder() {
        return nextInAccessOrder;
    }

    @Override
    public void setNextInAccessOrder(Node<K, V> next) {
        this.nextInAccessOrder = next;
    }
}
