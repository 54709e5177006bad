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

import org.kairos.history.HistoryConfig;
import org.kairos.history.RevisionNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Histories of attribute slots: one {@linkplain RevisionWindowMap} per key, created on first access with the
 * registry's {@linkplain HistoryConfig}. A key is whatever identifies a slot for the caller, e.g. a
 * (graph, node, attribute) tuple.
 */
public class WindowMapRegistry<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(WindowMapRegistry.class);

    @NotNull
    private final HistoryConfig config;
    @NotNull
    private final Map<K, RevisionWindowMap<V>> windows;

    public WindowMapRegistry() {
        this(HistoryConfig.DEFAULT);
    }

    public WindowMapRegistry(@NotNull final HistoryConfig config) {
        this.config = config;
        windows = new LinkedHashMap<>();
    }

    @NotNull
    public HistoryConfig getConfig() {
        return config;
    }

    @NotNull
    public RevisionWindowMap<V> getOrCreate(@NotNull final K key) {
        return windows.computeIfAbsent(key, k -> new RevisionWindowMap<>(config));
    }

    @Nullable
    public RevisionWindowMap<V> find(@NotNull final K key) {
        return windows.get(key);
    }

    @Nullable
    public RevisionWindowMap<V> remove(@NotNull final K key) {
        return windows.remove(key);
    }

    /**
     * @return value of the slot effective at the revision, {@code null} if the slot is unset there
     * @throws RevisionNotFoundException if the slot has no history or nothing is recorded at or before revision
     */
    @Nullable
    public V valueAt(@NotNull final K key, final long revision) {
        final RevisionWindowMap<V> window = windows.get(key);
        if (window == null) {
            throw new RevisionNotFoundException(revision);
        }
        return window.get(revision);
    }

    /**
     * Truncates every history at the revision, so that all slots are unset from it on.
     */
    public void truncateAllFrom(final long revision) {
        for (final RevisionWindowMap<V> window : windows.values()) {
            window.truncateFrom(revision);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Truncated " + windows.size() + " histories at revision " + revision);
        }
    }

    @NotNull
    public Set<K> keys() {
        return Collections.unmodifiableSet(windows.keySet());
    }

    public int size() {
        return windows.size();
    }

    public void clear() {
        windows.clear();
    }
}
