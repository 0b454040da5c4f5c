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
 * Thrown when an operation refers to an element that was never added to the forest.
 */
public class UnknownElementException extends DataException {
    private static final long serialVersionUID = 1L;

    private final int element;

    public UnknownElementException(int element) {
        super("Value " + element + " is not part of the universe");
        this.element = element;
    }

    public int getElement() {
        return element;
    }
}
