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
package org.kairos.core.dataStructures;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable pair of a {@code long} key and a value. Compares equal to any {@linkplain Map.Entry} with equal
 * key and value, as the {@code Map.Entry} contract requires.
 */
public final class LongObjectPair<V> implements Map.Entry<Long, V> {

    private final long key;
    @Nullable
    private final V value;

    public LongObjectPair(final long key, @Nullable final V value) {
        this.key = key;
        this.value = value;
    }

    public long getLongKey() {
        return key;
    }

    @NotNull
    @Override
    public Long getKey() {
        return key;
    }

    @Nullable
    @Override
    public V getValue() {
        return value;
    }

    @Override
    public V setValue(V value) {
        throw new UnsupportedOperationException("LongObjectPair is immutable");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Map.Entry)) return false;
        final Map.Entry<?, ?> that = (Map.Entry<?, ?>) o;
        return Objects.equals(getKey(), that.getKey()) && Objects.equals(value, that.getValue());
    }

    @Override
    public int hashCode() {
        return Long.hashCode(key) ^ Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
