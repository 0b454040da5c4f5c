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


package io.github.jstructs.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * A contiguous int-indexed array of references that grows on demand.
 * <p>
 * The object counterpart of {@link GrowableIntArray}: slots that have never been assigned
 * read as the default value given at construction, which may be null.
 *
 * @param <T> the element type
 */
public class GrowableArray<T> {
    private static final Logger logger = LoggerFactory.getLogger(GrowableArray.class);

    private final T defaultValue;
    private Object[] values;
    private int length;

    /**
     * Creates an empty array.
     * @param initialCapacity number of slots to allocate up front
     * @param defaultValue value reported for slots that were never assigned
     */
    public GrowableArray(int initialCapacity, T defaultValue) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        this.defaultValue = defaultValue;
        this.values = new Object[initialCapacity];
        if (defaultValue != null) {
            Arrays.fill(values, defaultValue);
        }
    }

    /**
     * @param index a non-negative index
     * @return the value at index, or the default value if index was never assigned
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        checkIndex(index);
        return index < length ? (T) values[index] : defaultValue;
    }

    /**
     * Assigns value to index, growing the array first if necessary. Any slots created by
     * the growth hold the default value.
     */
    public void set(int index, T value) {
        checkIndex(index);
        if (index >= values.length) {
            grow(index + 1);
        }
        values[index] = value;
        if (index >= length) {
            length = index + 1;
        }
    }

    /**
     * @return one more than the highest index ever assigned
     */
    public int length() {
        return length;
    }

    public T defaultValue() {
        return defaultValue;
    }

    private void grow(int minSize) {
        int oldCapacity = values.length;
        int newCapacity = ArrayUtil.oversize(minSize);
        values = Arrays.copyOf(values, newCapacity);
        if (defaultValue != null) {
            Arrays.fill(values, oldCapacity, newCapacity, defaultValue);
        }
        logger.debug("Grew object array from {} to {} slots", oldCapacity, newCapacity);
    }

    private static void checkIndex(int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Index must be non-negative: " + index);
        }
    }
}
