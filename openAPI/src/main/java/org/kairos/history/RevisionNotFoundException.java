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
 * Thrown on lookup of a revision which has no recorded entry at or before it.
 */
public class RevisionNotFoundException extends KairosException {

    private final long revision;

    public RevisionNotFoundException(final long revision) {
        super("No value is recorded at or before revision " + revision);
        this.revision = revision;
    }

    public long getRevision() {
        return revision;
    }
}
