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

import org.kairos.KairosException;

/**
 * Thrown on an attempt to record a value at a revision that would break the ascending order of a history.
 */
public class OrderingViolationException extends KairosException {

    private final long revision;
    private final long lastRevision;

    public OrderingViolationException(final long revision, final long lastRevision) {
        super("Can't record revision " + revision + " after revision " + lastRevision);
        this.revision = revision;
        this.lastRevision = lastRevision;
    }

    public long getRevision() {
        return revision;
    }

    public long getLastRevision() {
        return lastRevision;
    }
}
