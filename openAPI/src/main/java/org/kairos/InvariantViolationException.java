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
package org.kairos;

/**
 * Thrown when a container finds its own structure broken, e.g. history entries out of order or the cursor
 * pointing outside the chain. Never a normal failure path: it always indicates a bug.
 */
public class InvariantViolationException extends KairosException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
