package com.pavan.orderedmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Thread-safe map that keeps its entries in insertion order and lets callers reposition them.
 * A hash index over keys is joined with a doubly linked list bounded by two sentinel nodes,
 * so lookup, insertion, deletion and reordering are all O(1).
 * <p>
 * One {@link ReentrantReadWriteLock} guards the index and the list together: reads run under
 * the shared lock, every mutation under the exclusive lock, and each public method is a single
 * critical section.
 * <p>
 * Keys and values must not be null; a {@code null} result always means the key is absent.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class OrderedMap<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(OrderedMap.class);

    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    private final Map<K, Node<K, V>> index;
    private final Node<K, V> head;
    private final Node<K, V> tail;
    private final ReadWriteLock lock;
    private final OrderedMapStats stats;
    private int count;

    public OrderedMap() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public OrderedMap(int initialCapacity) {
        this(initialCapacity, false);
    }

    /**
     * @param initialCapacity expected number of entries, used to size the index
     * @param fair whether the lock should use a fair ordering policy
     */
    public OrderedMap(int initialCapacity, boolean fair) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must not be negative");
        }
        this.index = new HashMap<>(initialCapacity);
        this.head = Node.sentinel();
        this.tail = Node.sentinel();
        head.next = tail;
        tail.prev = head;
        this.lock = new ReentrantReadWriteLock(fair);
        this.stats = new OrderedMapStats();
        this.count = 0;
        logger.trace("Created OrderedMap (initialCapacity={}, fair={})", initialCapacity, fair);
    }

    /**
     * Inserts or updates a key-value pair.
     * A new key is appended at the end; an existing key keeps its position and gets the new value.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            if (node != null) {
                node.setValue(value);
                stats.recordPut(false);
                return;
            }
            node = new Node<>(key, value);
            node.linkBefore(tail);
            index.put(key, node);
            count++;
            stats.recordPut(true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Retrieves a value by key without changing its position.
     *
     * @param key the key to look up
     * @return the value associated with the key, or null if not found
     */
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            Node<K, V> node = index.get(key);
            stats.recordGet(node != null);
            return node == null ? null : node.getValue();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Retrieves a value by key, falling back to {@code defaultValue} when the key is absent.
     */
    public V getOrDefault(K key, V defaultValue) {
        V value = get(key);
        return value == null ? defaultValue : value;
    }

    /**
     * Checks if a key is present.
     */
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes a key and returns its value.
     * The relative order of the remaining entries is unchanged.
     *
     * @param key the key to remove
     * @return the value that was removed, or null if key not found
     */
    public V delete(K key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.remove(key);
            stats.recordDelete(node != null);
            if (node == null) {
                return null;
            }
            node.unlink();
            count--;
            return node.getValue();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a key.
     *
     * @param key the key to remove
     * @return true if the key existed
     */
    public boolean remove(K key) {
        return delete(key) != null;
    }

    /**
     * Returns the number of entries.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Removes all entries, leaving the map as if freshly constructed.
     * Statistics are kept.
     */
    public void clear() {
        int dropped;
        lock.writeLock().lock();
        try {
            dropped = count;
            index.clear();
            head.next = tail;
            tail.prev = head;
            count = 0;
            stats.recordClear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Cleared OrderedMap, {} entries dropped", dropped);
    }

    /**
     * Returns the keys in current order.
     * The list is an unmodifiable copy taken at call time.
     */
    public List<K> keys() {
        lock.readLock().lock();
        try {
            List<K> keys = new ArrayList<>(count);
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                keys.add(node.getKey());
            }
            return Collections.unmodifiableList(keys);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the values in current order.
     * The list is an unmodifiable copy taken at call time.
     */
    public List<V> values() {
        lock.readLock().lock();
        try {
            List<V> values = new ArrayList<>(count);
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                values.add(node.getValue());
            }
            return Collections.unmodifiableList(values);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns immutable key-value pairs in current order, copied at call time.
     */
    public List<Map.Entry<K, V>> entries() {
        lock.readLock().lock();
        try {
            List<Map.Entry<K, V>> entries = new ArrayList<>(count);
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                entries.add(Map.entry(node.getKey(), node.getValue()));
            }
            return Collections.unmodifiableList(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Walks the entries in current order, handing each pair to {@code action}.
     * The shared lock is held for the whole walk, so writers wait until it finishes.
     * The action must not mutate this map.
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        forEachWhile((key, value) -> {
            action.accept(key, value);
            return true;
        });
    }

    /**
     * Walks the entries in current order until {@code action} returns false.
     * The shared lock is held for the walk and released as soon as it stops.
     * The action must not mutate this map.
     *
     * @param action receives each pair; returning false ends the walk
     * @return true if every entry was visited, false if the walk was cut short
     */
    public boolean forEachWhile(BiPredicate<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        lock.readLock().lock();
        try {
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                if (!action.test(node.getKey(), node.getValue())) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the first key in order, or null if the map is empty.
     */
    public K firstKey() {
        lock.readLock().lock();
        try {
            return head.next == tail ? null : head.next.getKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the last key in order, or null if the map is empty.
     */
    public K lastKey() {
        lock.readLock().lock();
        try {
            return tail.prev == head ? null : tail.prev.getKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Moves a key to the end of the order.
     *
     * @param key the key to move
     * @return true if the key exists, false otherwise
     */
    public boolean moveToEnd(K key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            stats.recordMove(node != null);
            if (node == null) {
                return false;
            }
            node.unlink();
            node.linkBefore(tail);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves a key to the start of the order.
     *
     * @param key the key to move
     * @return true if the key exists, false otherwise
     */
    public boolean moveToStart(K key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            stats.recordMove(node != null);
            if (node == null) {
                return false;
            }
            node.unlink();
            node.linkAfter(head);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves {@code key} to directly after {@code afterKey}.
     * Nothing changes unless both keys exist.
     * <p>
     * The target is resolved after {@code key} is unlinked. When both keys are the same,
     * the entry therefore lands after its former successor (a, b, c becomes a, c, b for b),
     * and stays put if it was already last.
     *
     * @return true if both keys exist and the move was applied
     */
    public boolean moveAfter(K key, K afterKey) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(afterKey, "afterKey");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            Node<K, V> anchor = index.get(afterKey);
            boolean found = node != null && anchor != null;
            stats.recordMove(found);
            if (!found) {
                return false;
            }
            if (anchor == node) {
                anchor = node.next;
            }
            node.unlink();
            if (anchor == tail) {
                node.linkBefore(tail);
            } else {
                node.linkAfter(anchor);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves {@code key} to directly before {@code beforeKey}.
     * Mirror image of {@link #moveAfter}: a self move lands before the former predecessor.
     *
     * @return true if both keys exist and the move was applied
     */
    public boolean moveBefore(K key, K beforeKey) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(beforeKey, "beforeKey");
        lock.writeLock().lock();
        try {
            Node<K, V> node = index.get(key);
            Node<K, V> anchor = index.get(beforeKey);
            boolean found = node != null && anchor != null;
            stats.recordMove(found);
            if (!found) {
                return false;
            }
            if (anchor == node) {
                anchor = node.prev;
            }
            node.unlink();
            if (anchor == head) {
                node.linkAfter(head);
            } else {
                node.linkBefore(anchor);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the statistics collector for this map.
     */
    public OrderedMapStats getStats() {
        return stats;
    }

    /**
     * Verifies that the index, the order list and the entry count agree.
     *
     * @throws IllegalStateException describing the first inconsistency found
     */
    void checkInvariants() {
        lock.readLock().lock();
        try {
            if (head.prev != null || tail.next != null) {
                throw new IllegalStateException("Sentinel links outside the list");
            }
            int walked = 0;
            Node<K, V> previous = head;
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                if (node == null || node == head) {
                    throw new IllegalStateException("Order list broken after " + walked + " nodes");
                }
                if (++walked > count) {
                    throw new IllegalStateException("Order list longer than count " + count);
                }
                if (node.prev != previous) {
                    throw new IllegalStateException("Back link mismatch at key " + node.getKey());
                }
                if (index.get(node.getKey()) != node) {
                    throw new IllegalStateException("Index does not point at node for key " + node.getKey());
                }
                previous = node;
            }
            if (tail.prev != previous) {
                throw new IllegalStateException("Tail back link mismatch");
            }
            if (walked != count || index.size() != count) {
                throw new IllegalStateException(String.format(
                    "Size mismatch: list=%d, index=%d, count=%d", walked, index.size(), count));
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            StringBuilder sb = new StringBuilder("OrderedMap[");
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                if (node != head.next) {
                    sb.append(' ');
                }
                sb.append(node.getKey()).append(':').append(node.getValue());
            }
            return sb.append(']').toString();
        } finally {
            lock.readLock().unlock();
        }
    }
}
