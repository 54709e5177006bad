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
package org.kairos.history.window;

import org.kairos.InvariantViolationException;
import org.kairos.core.dataStructures.LongObjectPair;
import org.kairos.core.dataStructures.linked.BidirectionalQueue;
import org.kairos.core.dataStructures.linked.NodeArena;
import org.kairos.history.HistoryConfig;
import org.kairos.history.OrderingViolationException;
import org.kairos.history.RevisionHistory;
import org.kairos.history.RevisionNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@linkplain RevisionHistory} optimized for looking up the same revision repeatedly, or its neighbours.
 *
 * <p>Entries are kept in two queues sharing one {@linkplain NodeArena}: the past holds entries at or before the
 * last sought revision, the future holds the ones after it. Their concatenation is always strictly ascending by
 * revision. Every access seeks first, and seeking relocates entries across the split point one by one, so its
 * cost is the distance from the previous access, not the size of history.
 *
 * <p>Views returned by {@linkplain #keys()}, {@linkplain #values()} and {@linkplain #items()} are live and never
 * move the split point. Iteration is in ascending order of revisions.
 */
public class RevisionWindowMap<V> implements RevisionHistory<V> {

    private static final Logger logger = LoggerFactory.getLogger(RevisionWindowMap.class);

    @NotNull
    private final BidirectionalQueue<V> past;
    @NotNull
    private final BidirectionalQueue<V> future;
    private final boolean checkInvariants;
    private final boolean strictOrdering;
    private final int longSeekThreshold;
    private long lastSought;

    public RevisionWindowMap() {
        this(HistoryConfig.DEFAULT);
    }

    public RevisionWindowMap(@NotNull final HistoryConfig config) {
        final NodeArena<V> arena = new NodeArena<>(config.getArenaInitialCapacity());
        past = new BidirectionalQueue<>(arena);
        future = new BidirectionalQueue<>(arena);
        checkInvariants = config.isCheckInvariants();
        strictOrdering = config.isStrictOrdering();
        longSeekThreshold = config.getLongSeekThreshold();
        lastSought = NO_REVISION;
    }

    public RevisionWindowMap(@NotNull final Map<Long, ? extends V> data) {
        this(data, HistoryConfig.DEFAULT);
    }

    /**
     * Creates history from unordered revision to value mapping.
     */
    public RevisionWindowMap(@NotNull final Map<Long, ? extends V> data, @NotNull final HistoryConfig config) {
        this(config);
        for (final Map.Entry<Long, ? extends V> entry : new TreeMap<>(data).entrySet()) {
            final long revision = entry.getKey();
            checkRevision(revision);
            past.append(revision, entry.getValue());
        }
        if (!past.isEmpty()) {
            lastSought = past.getLastKey();
        }
        checkIfNecessary();
    }

    @Override
    public void seek(final long revision) {
        int moved = 0;
        while (!past.isEmpty() && past.getLastKey() > revision) {
            past.moveLastTo(future);
            ++moved;
        }
        while (!future.isEmpty() && future.getFirstKey() <= revision) {
            future.moveFirstTo(past);
            ++moved;
        }
        lastSought = revision;
        if (moved > longSeekThreshold && logger.isDebugEnabled()) {
            logger.debug("Seek to revision " + revision + " relocated " + moved + " of " + size() + " entries");
        }
    }

    @Nullable
    @Override
    public V get(final long revision) {
        seek(revision);
        if (past.isEmpty()) {
            throw new RevisionNotFoundException(revision);
        }
        return past.getLastValue();
    }

    @Override
    public void set(final long revision, @Nullable final V value) {
        checkRevision(revision);
        if (past.isEmpty() && future.isEmpty()) {
            past.append(revision, value);
            lastSought = revision;
            checkIfNecessary();
            return;
        }
        if (strictOrdering) {
            final long last = lastRevision();
            if (revision < last) {
                throw new OrderingViolationException(revision, last);
            }
        }
        seek(revision);
        if (past.isEmpty()) {
            past.append(revision, value);
        } else {
            final long tailRevision = past.getLastKey();
            if (revision == tailRevision) {
                past.setLastValue(value);
            } else if (revision > tailRevision) {
                past.append(revision, value);
            } else {
                throw new OrderingViolationException(revision, tailRevision);
            }
        }
        checkIfNecessary();
    }

    @Override
    public void update(@NotNull final Map<Long, ? extends V> values) {
        for (final Map.Entry<Long, ? extends V> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public void truncateFrom(final long revision) {
        checkRevision(revision);
        while (!past.isEmpty()) {
            past.moveLastTo(future);
        }
        while (!future.isEmpty() && future.getFirstKey() < revision) {
            future.moveFirstTo(past);
        }
        final int discarded = future.size();
        future.clear();
        past.append(revision, null);
        lastSought = revision;
        if (logger.isDebugEnabled()) {
            logger.debug("Truncated " + discarded + " entries at or after revision " + revision);
        }
        checkIfNecessary();
    }

    @Override
    public long revBefore(final long revision) {
        seek(revision);
        if (past.isEmpty()) {
            throw new RevisionNotFoundException(revision);
        }
        return past.getLastKey();
    }

    @Override
    public long revAfter(final long revision) {
        seek(revision);
        return future.isEmpty() ? NO_REVISION : future.getFirstKey();
    }

    @Override
    public boolean contains(final long revision) {
        seek(revision);
        return !past.isEmpty() && past.getLastValue() != null;
    }

    @Override
    public int size() {
        return past.size() + future.size();
    }

    @Override
    public boolean isEmpty() {
        return past.isEmpty() && future.isEmpty();
    }

    /**
     * @return the least recorded revision, or {@linkplain #NO_REVISION} if history is empty
     */
    public long firstRevision() {
        if (!past.isEmpty()) {
            return past.getFirstKey();
        }
        return future.isEmpty() ? NO_REVISION : future.getFirstKey();
    }

    /**
     * @return the greatest recorded revision, or {@linkplain #NO_REVISION} if history is empty
     */
    public long lastRevision() {
        if (!future.isEmpty()) {
            return future.getLastKey();
        }
        return past.isEmpty() ? NO_REVISION : past.getLastKey();
    }

    /**
     * Revisions in ascending order. {@code contains(revision)} is {@code true} if a non-{@code null} value is
     * effective at the revision.
     */
    @NotNull
    public Collection<Long> keys() {
        return new Keys();
    }

    /**
     * Recorded values in ascending order of their revisions, unset markers included.
     */
    @NotNull
    public Collection<V> values() {
        return new Values();
    }

    /**
     * Recorded (revision, value) pairs in ascending order. {@code contains(entry)} is {@code true} if the entry's
     * revision is not below the first recorded one and the value effective at it equals the entry's value.
     */
    @NotNull
    public Collection<Map.Entry<Long, V>> items() {
        return new Items();
    }

    /**
     * Verifies that both queues are consistent, entries are strictly ascending and the split point is where
     * the last seek left it.
     *
     * @throws InvariantViolationException if history is inconsistent
     */
    public void checkInvariants() {
        String error = past.checkStructure();
        if (error == null) {
            error = future.checkStructure();
        }
        if (error == null) {
            error = checkOrder();
        }
        if (error != null) {
            logger.error("RevisionWindowMap is inconsistent: " + error, new Throwable());
            throw new InvariantViolationException(error);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RevisionWindowMap)) return false;
        final RevisionWindowMap<?> that = (RevisionWindowMap<?>) o;
        if (size() != that.size()) return false;
        final Iterator<? extends LongObjectPair<?>> it = that.historyIterator();
        final Iterator<LongObjectPair<V>> thisIt = historyIterator();
        while (thisIt.hasNext()) {
            if (!thisIt.next().equals(it.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        final Iterator<LongObjectPair<V>> it = historyIterator();
        while (it.hasNext()) {
            result = 31 * result + it.next().hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("{");
        final Iterator<LongObjectPair<V>> it = historyIterator();
        while (it.hasNext()) {
            builder.append(it.next());
            if (it.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append('}').toString();
    }

    @NotNull
    private Iterator<LongObjectPair<V>> historyIterator() {
        return new HistoryIterator();
    }

    /**
     * Finds the entry effective at the revision without moving the split point.
     */
    @Nullable
    private LongObjectPair<V> lookup(final long revision) {
        LongObjectPair<V> result = null;
        if (past.isEmpty() || past.getLastKey() <= revision) {
            if (!past.isEmpty()) {
                result = past.get(-1);
            }
            for (final LongObjectPair<V> pair : future) {
                if (pair.getLongKey() > revision) break;
                result = pair;
            }
        } else {
            final Iterator<LongObjectPair<V>> it = past.descendingIterator();
            while (it.hasNext()) {
                final LongObjectPair<V> pair = it.next();
                if (pair.getLongKey() <= revision) {
                    result = pair;
                    break;
                }
            }
        }
        return result;
    }

    @Nullable
    private String checkOrder() {
        long prev = NO_REVISION;
        boolean first = true;
        final Iterator<LongObjectPair<V>> it = historyIterator();
        while (it.hasNext()) {
            final long revision = it.next().getLongKey();
            if (!first && revision <= prev) {
                return "revision " + revision + " follows revision " + prev;
            }
            first = false;
            prev = revision;
        }
        if (lastSought != NO_REVISION) {
            if (!past.isEmpty() && past.getLastKey() > lastSought) {
                return "past ends at " + past.getLastKey() + " after seeking " + lastSought;
            }
            if (!future.isEmpty() && future.getFirstKey() <= lastSought) {
                return "future starts at " + future.getFirstKey() + " after seeking " + lastSought;
            }
        }
        return null;
    }

    private void checkIfNecessary() {
        if (checkInvariants) {
            checkInvariants();
        }
    }

    private static void checkRevision(final long revision) {
        if (revision == NO_REVISION) {
            throw new IllegalArgumentException("Revision " + revision + " is reserved");
        }
    }

    private final class HistoryIterator implements Iterator<LongObjectPair<V>> {

        private Iterator<LongObjectPair<V>> current = past.iterator();
        private boolean inFuture;

        @Override
        public boolean hasNext() {
            if (current.hasNext()) {
                return true;
            }
            if (!inFuture) {
                inFuture = true;
                current = future.iterator();
                return current.hasNext();
            }
            return false;
        }

        @Override
        public LongObjectPair<V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }

    private abstract class HistoryIteratorDecorator<T> implements Iterator<T> {

        protected final HistoryIterator decorated = new HistoryIterator();

        @Override
        public boolean hasNext() {
            return decorated.hasNext();
        }
    }

    private final class Keys extends AbstractCollection<Long> {

        @NotNull
        @Override
        public Iterator<Long> iterator() {
            return new HistoryIteratorDecorator<Long>() {
                @Override
                public Long next() {
                    return decorated.next().getKey();
                }
            };
        }

        @Override
        public int size() {
            return RevisionWindowMap.this.size();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Long)) {
                return false;
            }
            final LongObjectPair<V> pair = lookup((Long) o);
            return pair != null && pair.getValue() != null;
        }
    }

    private final class Values extends AbstractCollection<V> {

        @NotNull
        @Override
        public Iterator<V> iterator() {
            return new HistoryIteratorDecorator<V>() {
                @Override
                public V next() {
                    return decorated.next().getValue();
                }
            };
        }

        @Override
        public int size() {
            return RevisionWindowMap.this.size();
        }

        @Override
        public boolean contains(Object o) {
            for (final V value : this) {
                if (Objects.equals(value, o)) {
                    return true;
                }
            }
            return false;
        }
    }

    private final class Items extends AbstractCollection<Map.Entry<Long, V>> {

        @NotNull
        @Override
        public Iterator<Map.Entry<Long, V>> iterator() {
            return new HistoryIteratorDecorator<Map.Entry<Long, V>>() {
                @Override
                public Map.Entry<Long, V> next() {
                    return decorated.next();
                }
            };
        }

        @Override
        public int size() {
            return RevisionWindowMap.this.size();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Map.Entry)) {
                return false;
            }
            final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) o;
            if (!(entry.getKey() instanceof Long) || isEmpty()) {
                return false;
            }
            final long revision = (Long) entry.getKey();
            if (revision < firstRevision()) {
                return false;
            }
            final LongObjectPair<V> pair = lookup(revision);
            return pair != null && Objects.equals(pair.getValue(), entry.getValue());
        }
    }
}
