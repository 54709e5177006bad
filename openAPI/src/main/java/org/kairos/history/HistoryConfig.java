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

import org.kairos.AbstractConfig;
import org.kairos.ConfigurationStrategy;
import org.kairos.InvalidSettingException;
import org.kairos.KairosException;
import org.kairos.core.dataStructures.Pair;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Specifies settings of revision histories. Default settings are specified by
 * {@linkplain #DEFAULT} which is immutable. Any newly created {@code HistoryConfig} has the same settings as
 * {@linkplain #DEFAULT}.
 *
 * <p>As a rule, the {@code HistoryConfig} instance is created along with the owner of histories (a registry,
 * a cache of attribute slots) and passed to each history it creates. Settings are read when a history is
 * created, so changing them afterwards affects only the instances created later.
 *
 * <p>{@code HistoryConfig} can be filled with the values of system properties:
 * <pre>
 *     final HistoryConfig config = new HistoryConfig(ConfigurationStrategy.SYSTEM_PROPERTY);
 * </pre>
 */
@SuppressWarnings({"WeakerAccess", "AutoBoxing", "AutoUnboxing"})
public class HistoryConfig extends AbstractConfig {

    public static final HistoryConfig DEFAULT = new HistoryConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public HistoryConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new KairosException("Can't make HistoryConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * If is set to {@code true} then every mutation of a revision history is followed by
     * a full consistency check which throws {@linkplain org.kairos.InvariantViolationException} on failure. The
     * check walks the whole structure, so it is meant for tests and debugging. Default value is {@code false}.
     */
    public static final String CHECK_INVARIANTS = "kairos.history.checkInvariants";

    /**
     * Number of entries a single seek can relocate between the past and the future of a revision history
     * before the seek is reported to the debug log. Default value is {@code 1024}.
     */
    public static final String LONG_SEEK_THRESHOLD = "kairos.history.longSeekThreshold";

    /**
     * If is set to {@code true} then a revision history accepts assignments only at or after its last recorded
     * revision, and rewriting earlier history requires truncation. Default value is {@code false}.
     */
    public static final String STRICT_ORDERING = "kairos.history.strictOrdering";

    /**
     * Initial number of node slots allocated by a history. Default value is {@code 8}.
     */
    public static final String ARENA_INITIAL_CAPACITY = "kairos.arena.initialCapacity";

    public HistoryConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public HistoryConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
                new Pair(CHECK_INVARIANTS, false),
                new Pair(LONG_SEEK_THRESHOLD, 1024),
                new Pair(STRICT_ORDERING, false),
                new Pair(ARENA_INITIAL_CAPACITY, 8)
        }, strategy);
        if (getArenaInitialCapacity() < 0) {
            throw new InvalidSettingException(ARENA_INITIAL_CAPACITY + " should be non-negative");
        }
    }

    @Override
    public HistoryConfig setSetting(@NotNull String key, @NotNull Object value) {
        return (HistoryConfig) super.setSetting(key, value);
    }

    @Override
    public HistoryConfig setMutable(boolean isMutable) {
        return (HistoryConfig) super.setMutable(isMutable);
    }

    /**
     * Sets settings from the map of string keys and string values, e.g. loaded from a properties file.
     *
     * @param settings map of settings
     * @return this {@code HistoryConfig} instance
     */
    public HistoryConfig withSettings(@NotNull final Map<String, String> settings) {
        setSettings(settings);
        return this;
    }

    public boolean isCheckInvariants() {
        return (Boolean) getSetting(CHECK_INVARIANTS);
    }

    public HistoryConfig setCheckInvariants(final boolean checkInvariants) {
        return setSetting(CHECK_INVARIANTS, checkInvariants);
    }

    public int getLongSeekThreshold() {
        return (Integer) getSetting(LONG_SEEK_THRESHOLD);
    }

    public HistoryConfig setLongSeekThreshold(final int entries) {
        return setSetting(LONG_SEEK_THRESHOLD, entries);
    }

    public boolean isStrictOrdering() {
        return (Boolean) getSetting(STRICT_ORDERING);
    }

    public HistoryConfig setStrictOrdering(final boolean strictOrdering) {
        return setSetting(STRICT_ORDERING, strictOrdering);
    }

    public int getArenaInitialCapacity() {
        return (Integer) getSetting(ARENA_INITIAL_CAPACITY);
    }

    public HistoryConfig setArenaInitialCapacity(final int slots) {
        if (slots < 0) {
            throw new InvalidSettingException(ARENA_INITIAL_CAPACITY + " should be non-negative");
        }
        return setSetting(ARENA_INITIAL_CAPACITY, slots);
    }
}
