/*
 * Copyright DataStax, Inc.
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


package io.github.jstructs.exceptions;

/**
 * Thrown when a data structure finds one of its own invariants broken.
 * <p>
 * This indicates a bug in JStructs rather than in client code. The instance that threw it
 * may already be inconsistent and should be discarded.
 */
public class InternalConsistencyException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public InternalConsistencyException(String message) {
        super(message);
    }
}
