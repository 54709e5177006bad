/**
 * Copyright 2010 - 2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.kairos.core.dataStructures.linked;

import org.kairos.core.dataStructures.LongObjectPair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static org.kairos.core.dataStructures.linked.NodeArena.NIL;

/**
 * Doubly-linked deque of (key, value) pairs stored in a {@linkplain NodeArena}. Both ends are O(1), indexed
 * access walks from the nearer end. Negative indices count from the tail, so {@code -1} is the last element.
 */
public class BidirectionalQueue<V> implements Iterable<LongObjectPair<V>> {

    @NotNull
    private final NodeArena<V> arena;
    private int head;
    private int tail;
    private int size;
    private int modCount;

    public BidirectionalQueue() {
        this(new NodeArena<>());
    }

    public BidirectionalQueue(@NotNull final NodeArena<V> arena) {
        this.arena = arena;
        head = tail = NIL;
    }

    @NotNull
    public NodeArena<V> getArena() {
        return arena;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void append(final long key, @Nullable final V value) {
        linkLast(arena.allocate(key, value));
    }

    public void appendLeft(final long key, @Nullable final V value) {
        linkFirst(arena.allocate(key, value));
    }

    @NotNull
    public LongObjectPair<V> get(final int index) {
        final int node = node(index);
        return new LongObjectPair<>(arena.getKey(node), arena.getValue(node));
    }

    public long getKey(final int index) {
        return arena.getKey(node(index));
    }

    @Nullable
    public V getValue(final int index) {
        return arena.getValue(node(index));
    }

    public void set(final int index, final long key, @Nullable final V value) {
        final int node = node(index);
        arena.setKey(node, key);
        arena.setValue(node, value);
    }

    @Nullable
    public V setValue(final int index, @Nullable final V value) {
        return arena.setValue(node(index), value);
    }

    public long getFirstKey() {
        return arena.getKey(first());
    }

    @Nullable
    public V getFirstValue() {
        return arena.getValue(first());
    }

    public long getLastKey() {
        return arena.getKey(last());
    }

    @Nullable
    public V getLastValue() {
        return arena.getValue(last());
    }

    @Nullable
    public V setLastValue(@Nullable final V value) {
        return arena.setValue(last(), value);
    }

    @NotNull
    public LongObjectPair<V> pop() {
        final int node = last();
        unlink(node);
        return release(node);
    }

    @NotNull
    public LongObjectPair<V> popLeft() {
        final int node = first();
        unlink(node);
        return release(node);
    }

    /**
     * Removes up to {@code count} elements from the tail.
     *
     * @return queue sharing the arena of this one and holding removed elements in their original order
     */
    @NotNull
    public BidirectionalQueue<V> pop(final int count) {
        checkCount(count);
        final BidirectionalQueue<V> buffer = new BidirectionalQueue<>(arena);
        for (int i = 0; i < count && size > 0; ++i) {
            moveLastTo(buffer);
        }
        return buffer;
    }

    /**
     * Removes up to {@code count} elements from the head.
     *
     * @return queue sharing the arena of this one and holding removed elements in their original order
     */
    @NotNull
    public BidirectionalQueue<V> popLeft(final int count) {
        checkCount(count);
        final BidirectionalQueue<V> buffer = new BidirectionalQueue<>(arena);
        for (int i = 0; i < count && size > 0; ++i) {
            moveFirstTo(buffer);
        }
        return buffer;
    }

    /**
     * Removes the last element and prepends it to {@code dest}.
     */
    public void moveLastTo(@NotNull final BidirectionalQueue<V> dest) {
        final int node = last();
        unlink(node);
        if (dest.arena == arena) {
            dest.linkFirst(node);
        } else {
            dest.appendLeft(arena.getKey(node), arena.free(node));
        }
    }

    /**
     * Removes the first element and appends it to {@code dest}.
     */
    public void moveFirstTo(@NotNull final BidirectionalQueue<V> dest) {
        final int node = first();
        unlink(node);
        if (dest.arena == arena) {
            dest.linkLast(node);
        } else {
            dest.append(arena.getKey(node), arena.free(node));
        }
    }

    public void clear() {
        int node = head;
        while (node != NIL) {
            final int next = arena.getNext(node);
            arena.free(node);
            node = next;
        }
        head = tail = NIL;
        size = 0;
        ++modCount;
    }

    @NotNull
    @Override
    public Iterator<LongObjectPair<V>> iterator() {
        return new QueueIterator(head, false);
    }

    @NotNull
    public Iterator<LongObjectPair<V>> descendingIterator() {
        return new QueueIterator(tail, true);
    }

    /**
     * Walks the chain in both directions and checks links and size.
     *
     * @return description of the first broken link, or {@code null} if the chain is consistent
     */
    @Nullable
    public String checkStructure() {
        if ((head == NIL) != (tail == NIL) || (head == NIL) != (size == 0)) {
            return "head = " + head + ", tail = " + tail + ", size = " + size;
        }
        int count = 0;
        int prev = NIL;
        for (int node = head; node != NIL; node = arena.getNext(node)) {
            if (!arena.isLive(node) || arena.getPrev(node) != prev || ++count > size) {
                return "broken forward link at node " + node + " after " + count + " nodes";
            }
            prev = node;
        }
        if (prev != tail || count != size) {
            return "forward walk ends at " + prev + " after " + count + " nodes, tail = " + tail + ", size = " + size;
        }
        count = 0;
        for (int node = tail; node != NIL; node = arena.getPrev(node)) {
            if (++count > size) {
                return "backward walk doesn't reach head";
            }
        }
        return count == size ? null : "backward walk visits " + count + " nodes, size = " + size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BidirectionalQueue)) return false;
        final BidirectionalQueue<?> that = (BidirectionalQueue<?>) o;
        if (size != that.size) return false;
        final Iterator<?> it = that.iterator();
        for (final LongObjectPair<V> pair : this) {
            if (!pair.equals(it.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (final LongObjectPair<V> pair : this) {
            result = 31 * result + pair.hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("[");
        for (final LongObjectPair<V> pair : this) {
            if (builder.length() > 1) {
                builder.append(", ");
            }
            builder.append(pair);
        }
        return builder.append(']').toString();
    }

    void linkFirst(final int node) {
        arena.setPrev(node, NIL);
        arena.link(node, head);
        head = node;
        if (tail == NIL) {
            tail = node;
        }
        ++size;
        ++modCount;
    }

    void linkLast(final int node) {
        arena.setNext(node, NIL);
        arena.link(tail, node);
        tail = node;
        if (head == NIL) {
            head = node;
        }
        ++size;
        ++modCount;
    }

    private void unlink(final int node) {
        final int prev = arena.getPrev(node);
        final int next = arena.getNext(node);
        if (prev == NIL) {
            head = next;
        } else {
            arena.setNext(prev, next);
        }
        if (next == NIL) {
            tail = prev;
        } else {
            arena.setPrev(next, prev);
        }
        arena.setPrev(node, NIL);
        arena.setNext(node, NIL);
        --size;
        ++modCount;
    }

    @NotNull
    private LongObjectPair<V> release(final int node) {
        final long key = arena.getKey(node);
        return new LongObjectPair<>(key, arena.free(node));
    }

    private int first() {
        if (head == NIL) {
            throw new NoSuchElementException("Queue is empty");
        }
        return head;
    }

    private int last() {
        if (tail == NIL) {
            throw new NoSuchElementException("Queue is empty");
        }
        return tail;
    }

    private int node(int index) {
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            //noinspection HardCodedStringLiteral
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
        }
        int node;
        if (index <= size >> 1) {
            node = head;
            for (int i = 0; i < index; ++i) {
                node = arena.getNext(node);
            }
        } else {
            node = tail;
            for (int i = size - 1; i > index; --i) {
                node = arena.getPrev(node);
            }
        }
        return node;
    }

    private static void checkCount(final int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count: " + count);
        }
    }

    private final class QueueIterator implements Iterator<LongObjectPair<V>> {

        private final boolean descending;
        private final int expectedModCount;
        private int node;

        private QueueIterator(final int start, final boolean descending) {
            this.descending = descending;
            expectedModCount = modCount;
            node = start;
        }

        @Override
        public boolean hasNext() {
            return node != NIL;
        }

        @Override
        public LongObjectPair<V> next() {
            if (expectedModCount != modCount) {
                throw new ConcurrentModificationException();
            }
            if (node == NIL) {
                throw new NoSuchElementException();
            }
            final LongObjectPair<V> result = new LongObjectPair<>(arena.getKey(node), arena.getValue(node));
            node = descending ? arena.getPrev(node) : arena.getNext(node);
            return result;
        }
    }
}
