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
 * Thrown when an element is added to a disjoint-set forest that already contains it.
 */
public class DuplicateElementException extends DataException {
    private static final long serialVersionUID = 1L;

    private final int element;

    public DuplicateElementException(int element) {
        super("Element " + element + " already present in the universe");
        this.element = element;
    }

    public int getElement() {
        return element;
    }
}
