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

import org.kairos.InvariantViolationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import static org.kairos.core.dataStructures.linked.NodeArena.NIL;
import static org.kairos.core.dataStructures.linked.NodeArena.NO_KEY;

/**
 * Doubly-linked sequence with a persistent cursor (the waist) at the last visited element. Access at the cursor
 * is O(1), access at distance {@code d} from the cursor or from either end is O(d), so walking a sequence in
 * small steps never costs more than the steps themselves.
 *
 * <p>Indexed access accepts negative indices counted from the tail and moves the cursor to the element it
 * reaches. Removing the element under the cursor moves the cursor to the next element, or to the previous one
 * if the removed element was the last. The cursor is undefined only in an empty sequence.
 */
public class CursorSequence<V> implements Iterable<V> {

    private static final Logger logger = LoggerFactory.getLogger(CursorSequence.class);

    @NotNull
    private final NodeArena<V> arena;
    private final boolean growOnSet;
    private final boolean checkInvariants;
    private int head;
    private int tail;
    private int waist;
    private int waistIndex;
    private int size;
    private int modCount;

    public CursorSequence() {
        this(true, false);
    }

    /**
     * @param growOnSet       if {@code true}, {@linkplain #set(int, Object)} at index equal to the size appends
     * @param checkInvariants if {@code true}, every mutation is followed by {@linkplain #checkInvariants()}
     */
    public CursorSequence(final boolean growOnSet, final boolean checkInvariants) {
        arena = new NodeArena<>();
        this.growOnSet = growOnSet;
        this.checkInvariants = checkInvariants;
        head = tail = waist = NIL;
        waistIndex = -1;
    }

    public CursorSequence(@NotNull final Iterable<? extends V> elements) {
        this(elements, true, false);
    }

    public CursorSequence(@NotNull final Iterable<? extends V> elements, final boolean growOnSet, final boolean checkInvariants) {
        this(growOnSet, checkInvariants);
        for (final V element : elements) {
            append(element);
        }
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return index of the cursor, {@code -1} if the sequence is empty
     */
    public int getCursorIndex() {
        return waistIndex;
    }

    @Nullable
    public V getCursorValue() {
        return arena.getValue(cursor());
    }

    @Nullable
    public V setCursorValue(@Nullable final V value) {
        return arena.setValue(cursor(), value);
    }

    /**
     * Returns element at the given index and moves the cursor onto it.
     */
    @Nullable
    public V get(final int index) {
        return arena.getValue(locate(normalize(index)));
    }

    /**
     * Replaces element at the given index and moves the cursor onto it. Index equal to the size appends if
     * the sequence was created to grow on set.
     *
     * @return replaced element, {@code null} if the element was appended
     */
    @Nullable
    public V set(final int index, @Nullable final V value) {
        if (index == size && growOnSet) {
            append(value);
            locate(size - 1);
            return null;
        }
        final V result = arena.setValue(locate(normalize(index)), value);
        checkIfNecessary();
        return result;
    }

    /**
     * Moves the cursor by {@code delta} positions, backwards if negative.
     *
     * @return element at the new cursor position
     * @throws IndexOutOfBoundsException if the move would pass either end, the cursor stays in place then
     */
    @Nullable
    public V seek(final int delta) {
        if (size == 0) {
            throw new IndexOutOfBoundsException("Can't seek in empty sequence");
        }
        final int target = waistIndex + delta;
        if (target < 0 || target >= size) {
            //noinspection HardCodedStringLiteral
            throw new IndexOutOfBoundsException("Can't seek by " + delta + " from index " + waistIndex + ", Size: " + size);
        }
        return arena.getValue(locate(target));
    }

    public void append(@Nullable final V value) {
        final int node = arena.allocate(NO_KEY, value);
        arena.link(tail, node);
        tail = node;
        if (head == NIL) {
            head = node;
        }
        if (waist == NIL) {
            waist = node;
            waistIndex = 0;
        }
        ++size;
        ++modCount;
        checkIfNecessary();
    }

    public void appendLeft(@Nullable final V value) {
        final int node = arena.allocate(NO_KEY, value);
        arena.link(node, head);
        head = node;
        if (tail == NIL) {
            tail = node;
        }
        if (waist == NIL) {
            waist = node;
        }
        ++waistIndex;
        ++size;
        ++modCount;
        checkIfNecessary();
    }

    @Nullable
    public V pop() {
        if (size == 0) {
            throw new NoSuchElementException("Sequence is empty");
        }
        return remove(tail, size - 1);
    }

    @Nullable
    public V popLeft() {
        if (size == 0) {
            throw new NoSuchElementException("Sequence is empty");
        }
        return remove(head, 0);
    }

    /**
     * Inserts the value right after the cursor and moves the cursor onto it. In an empty sequence, the value
     * becomes its only element.
     */
    public void insertAtCursor(@Nullable final V value) {
        if (waist == NIL) {
            append(value);
            return;
        }
        final int node = arena.allocate(NO_KEY, value);
        final int next = arena.getNext(waist);
        arena.link(node, next);
        arena.link(waist, node);
        if (next == NIL) {
            tail = node;
        }
        waist = node;
        ++waistIndex;
        ++size;
        ++modCount;
        checkIfNecessary();
    }

    /**
     * Removes the element under the cursor.
     *
     * @return removed element
     */
    @Nullable
    public V removeAtCursor() {
        return remove(cursor(), waistIndex);
    }

    /**
     * Seeks by {@code offset} and inserts the value right after the new cursor position.
     */
    public void insertRelative(final int offset, @Nullable final V value) {
        if (offset != 0) {
            seek(offset);
        }
        insertAtCursor(value);
    }

    /**
     * Seeks by {@code offset} and removes the element there.
     */
    @Nullable
    public V removeRelative(final int offset) {
        if (offset != 0) {
            seek(offset);
        }
        return removeAtCursor();
    }

    public void clear() {
        int node = head;
        while (node != NIL) {
            final int next = arena.getNext(node);
            arena.free(node);
            node = next;
        }
        head = tail = waist = NIL;
        waistIndex = -1;
        size = 0;
        ++modCount;
    }

    @NotNull
    public List<V> toList() {
        final List<V> result = new ArrayList<>(size);
        for (final V value : this) {
            result.add(value);
        }
        return result;
    }

    /**
     * Iterates from head to tail without moving the cursor.
     */
    @NotNull
    @Override
    public Iterator<V> iterator() {
        return new Iterator<V>() {

            private final int expectedModCount = modCount;
            private int node = head;

            @Override
            public boolean hasNext() {
                return node != NIL;
            }

            @Override
            public V next() {
                if (expectedModCount != modCount) {
                    throw new ConcurrentModificationException();
                }
                if (node == NIL) {
                    throw new NoSuchElementException();
                }
                final V result = arena.getValue(node);
                node = arena.getNext(node);
                return result;
            }
        };
    }

    /**
     * Verifies links, size and the cursor.
     *
     * @throws InvariantViolationException if the sequence is inconsistent
     */
    public void checkInvariants() {
        final String error = checkStructure();
        if (error != null) {
            logger.error("CursorSequence is inconsistent: " + error, new Throwable());
            throw new InvariantViolationException(error);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CursorSequence)) return false;
        final CursorSequence<?> that = (CursorSequence<?>) o;
        if (size != that.size) return false;
        final Iterator<?> it = that.iterator();
        for (final V value : this) {
            if (!Objects.equals(value, it.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (final V value : this) {
            result = 31 * result + Objects.hashCode(value);
        }
        return result;
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    @Nullable
    private V remove(final int node, final int index) {
        final int prev = arena.getPrev(node);
        final int next = arena.getNext(node);
        arena.link(prev, next);
        if (prev == NIL) {
            head = next;
        }
        if (next == NIL) {
            tail = prev;
        }
        if (node == waist) {
            if (next != NIL) {
                waist = next;
            } else {
                waist = prev;
                --waistIndex;
            }
        } else if (index < waistIndex) {
            --waistIndex;
        }
        --size;
        ++modCount;
        final V result = arena.free(node);
        checkIfNecessary();
        return result;
    }

    private int cursor() {
        if (waist == NIL) {
            throw new NoSuchElementException("Sequence is empty");
        }
        return waist;
    }

    private int normalize(final int index) {
        final int result = index < 0 ? index + size : index;
        if (result < 0 || result >= size) {
            //noinspection HardCodedStringLiteral
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
        }
        return result;
    }

    // walks from the nearest of head, tail and cursor, then leaves the cursor at the index
    private int locate(final int index) {
        int node;
        int current;
        final int fromWaist = Math.abs(index - waistIndex);
        if (fromWaist <= index && fromWaist <= size - 1 - index) {
            node = waist;
            current = waistIndex;
        } else if (index <= size - 1 - index) {
            node = head;
            current = 0;
        } else {
            node = tail;
            current = size - 1;
        }
        while (current < index) {
            node = arena.getNext(node);
            ++current;
        }
        while (current > index) {
            node = arena.getPrev(node);
            --current;
        }
        waist = node;
        waistIndex = index;
        return node;
    }

    @Nullable
    private String checkStructure() {
        if ((head == NIL) != (tail == NIL) || (head == NIL) != (size == 0) || (waist == NIL) != (size == 0)) {
            return "inconsistent ends: head = " + head + ", tail = " + tail + ", waist = " + waist + ", size = " + size;
        }
        int index = 0;
        int prev = NIL;
        boolean waistFound = waist == NIL;
        for (int node = head; node != NIL; node = arena.getNext(node)) {
            if (!arena.isLive(node) || arena.getPrev(node) != prev || index >= size) {
                return "broken link at node " + node + ", index " + index;
            }
            if (node == waist) {
                if (index != waistIndex) {
                    return "cursor is at index " + index + ", expected " + waistIndex;
                }
                waistFound = true;
            }
            prev = node;
            ++index;
        }
        if (prev != tail || index != size) {
            return "chain of " + index + " nodes ends at " + prev + ", tail = " + tail + ", size = " + size;
        }
        return waistFound ? null : "cursor node " + waist + " is not in the sequence";
    }

    private void checkIfNecessary() {
        if (checkInvariants) {
            checkInvariants();
        }
    }
}
