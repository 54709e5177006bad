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

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Storage of doubly-linked nodes. A node is addressed by an int handle, its links are handles as well, so
 * removing a node never leaves a dangling reference: the slot returns to the free list and is reused by the
 * next allocation. Every node has a {@code long} key (a revision number, or {@linkplain #NO_KEY}) and a value.
 *
 * <p>Several containers can share one arena. A node belongs to exactly one container at a time, which owns
 * its links; moving a node between containers of the same arena is a relink, not a copy.
 */
@SuppressWarnings("unchecked")
public final class NodeArena<V> {

    public static final int NIL = -1;
    public static final long NO_KEY = Long.MIN_VALUE;

    private static final int FREED = -2;

    private long[] keys;
    private Object[] values;
    private int[] prev;
    private int[] next;
    // slots below the mark were allocated at least once
    private int mark;
    private int freeHead;
    private int liveCount;

    public NodeArena() {
        this(8);
    }

    public NodeArena(final int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        }
        keys = new long[initialCapacity];
        values = new Object[initialCapacity];
        prev = new int[initialCapacity];
        next = new int[initialCapacity];
        freeHead = NIL;
    }

    /**
     * Allocates an unlinked node.
     *
     * @return handle of the node
     */
    public int allocate(final long key, @Nullable final V value) {
        final int node;
        if (freeHead != NIL) {
            node = freeHead;
            freeHead = next[node];
        } else {
            ensureCapacity(mark + 1);
            node = mark++;
        }
        keys[node] = key;
        values[node] = value;
        prev[node] = NIL;
        next[node] = NIL;
        ++liveCount;
        return node;
    }

    /**
     * Returns the slot to the free list. The caller is responsible for unlinking the node first.
     *
     * @return value the node held
     */
    @Nullable
    public V free(final int node) {
        checkLive(node);
        final V result = (V) values[node];
        values[node] = null;
        prev[node] = FREED;
        next[node] = freeHead;
        freeHead = node;
        --liveCount;
        return result;
    }

    public boolean isLive(final int node) {
        return node >= 0 && node < mark && prev[node] != FREED;
    }

    public long getKey(final int node) {
        return keys[node];
    }

    public void setKey(final int node, final long key) {
        keys[node] = key;
    }

    @Nullable
    public V getValue(final int node) {
        return (V) values[node];
    }

    @Nullable
    public V setValue(final int node, @Nullable final V value) {
        final V result = (V) values[node];
        values[node] = value;
        return result;
    }

    public int getPrev(final int node) {
        return prev[node];
    }

    public void setPrev(final int node, final int prevNode) {
        prev[node] = prevNode;
    }

    public int getNext(final int node) {
        return next[node];
    }

    public void setNext(final int node, final int nextNode) {
        next[node] = nextNode;
    }

    /**
     * Links {@code first} and {@code second} so that {@code second} follows {@code first}. Either can be
     * {@linkplain #NIL}.
     */
    public void link(final int first, final int second) {
        if (first != NIL) {
            next[first] = second;
        }
        if (second != NIL) {
            prev[second] = first;
        }
    }

    /**
     * @return number of allocated and not yet freed nodes
     */
    public int size() {
        return liveCount;
    }

    public int getCapacity() {
        return keys.length;
    }

    private void ensureCapacity(final int minCapacity) {
        int oldCapacity = keys.length;
        if (minCapacity > oldCapacity) {
            if (oldCapacity == 0) {
                oldCapacity = 1;
            }
            int newCapacity = (oldCapacity << 3) / 5 + 1;
            if (newCapacity < minCapacity) {
                newCapacity = minCapacity;
            }
            keys = Arrays.copyOf(keys, newCapacity);
            values = Arrays.copyOf(values, newCapacity);
            prev = Arrays.copyOf(prev, newCapacity);
            next = Arrays.copyOf(next, newCapacity);
        }
    }

    private void checkLive(final int node) {
        if (!isLive(node)) {
            //noinspection HardCodedStringLiteral
            throw new IllegalStateException("Node " + node + " is not allocated");
        }
    }
}
