package com.pavan.orderedmap;

/**
 * Doubly linked node of the order list.
 * The key is fixed for the node's lifetime; the value is replaced in place on update,
 * and links change whenever the node is spliced to a new position.
 *
 * @param <K> the type of key
 * @param <V> the type of value
 */
final class Node<K, V> {

    private final K key;
    private V value;
    Node<K, V> prev;
    Node<K, V> next;

    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }

    /**
     * Creates a dataless boundary node.
     */
    static <K, V> Node<K, V> sentinel() {
        return new Node<>(null, null);
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

    // Detaches this node from its neighbors, joining them to each other.
    // The node's own links are left as they were.
    void unlink() {
        prev.next = next;
        next.prev = prev;
    }

    // Links this node directly after the given node.
    void linkAfter(Node<K, V> anchor) {
        prev = anchor;
        next = anchor.next;
        anchor.next.prev = this;
        anchor.next = this;
    }

    // Links this node directly before the given node.
    void linkBefore(Node<K, V> anchor) {
        next = anchor;
        prev = anchor.prev;
        anchor.prev.next = this;
        anchor.prev = this;
    }
}
