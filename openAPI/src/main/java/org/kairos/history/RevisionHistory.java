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
package org.kairos.history;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * History of a single attribute: the values it has had over time, keyed by revision numbers.
 *
 * <p>Once a value is recorded at some revision, it is effective at all greater revisions until the next recorded
 * revision. A {@code null} value is the unset marker: the attribute is absent starting at its revision until the
 * next non-{@code null} entry. Histories are not thread-safe, callers serialize access to each instance.
 *
 * @param <V> type of values
 */
public interface RevisionHistory<V> {

    /**
     * Returned by {@linkplain #revAfter(long)} if no later change is recorded. Can't be used as a revision.
     */
    long NO_REVISION = Long.MIN_VALUE;

    /**
     * Arranges the history for looking up the given revision and its neighbours.
     *
     * @param revision revision number
     */
    void seek(long revision);

    /**
     * Returns the value effective at the given revision.
     *
     * @param revision revision number
     * @return value recorded at the greatest revision not greater than {@code revision}, or {@code null} if that
     * entry is the unset marker
     * @throws RevisionNotFoundException if nothing is recorded at or before {@code revision}
     */
    @Nullable
    V get(long revision);

    /**
     * Records the value at the given revision, overwriting the value recorded exactly at it, if any.
     *
     * @param revision revision number
     * @param value    value, {@code null} records the unset marker
     * @throws OrderingViolationException if the revision can't be recorded without breaking the order of history
     */
    void set(long revision, @Nullable V value);

    /**
     * Applies assignments in iteration order of the map.
     *
     * @param values revision to value assignments
     */
    void update(@NotNull Map<Long, ? extends V> values);

    /**
     * Discards everything recorded at or after the given revision and records the unset marker exactly at it.
     *
     * @param revision revision number
     */
    void truncateFrom(long revision);

    /**
     * @param revision revision number
     * @return the greatest recorded revision not greater than {@code revision}
     * @throws RevisionNotFoundException if nothing is recorded at or before {@code revision}
     */
    long revBefore(long revision);

    /**
     * @param revision revision number
     * @return the least recorded revision greater than {@code revision}, or {@linkplain #NO_REVISION}
     */
    long revAfter(long revision);

    /**
     * @param revision revision number
     * @return {@code true} if a non-{@code null} value is effective at the given revision
     */
    boolean contains(long revision);

    /**
     * @return number of recorded entries including unset markers
     */
    int size();

    boolean isEmpty();
}
