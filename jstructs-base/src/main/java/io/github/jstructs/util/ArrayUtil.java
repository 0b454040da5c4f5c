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

/**
 * Methods for sizing and growing arrays.
 */
public final class ArrayUtil {
    /** Largest array length the JVM reliably allows. */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private ArrayUtil() {
    }

    /**
     * Returns an array size &gt;= minTargetSize, generally over-allocating exponentially to
     * achieve amortized linear-time cost as the array grows.
     *
     * @param minTargetSize the minimum size needed
     * @return the size to allocate
     * @throws IllegalArgumentException if minTargetSize is negative
     */
    public static int oversize(int minTargetSize) {
        if (minTargetSize < 0) {
            throw new IllegalArgumentException("invalid array size " + minTargetSize);
        }
        if (minTargetSize == 0) {
            return 0;
        }
        if (minTargetSize > MAX_ARRAY_LENGTH) {
            throw new IllegalArgumentException("requested array size " + minTargetSize
                                               + " exceeds maximum array in java (" + MAX_ARRAY_LENGTH + ")");
        }

        // asymptotic growth of 1.375x; the constant keeps small arrays from reallocating on every add
        long newSize = (long) minTargetSize + (((long) minTargetSize * 3) >> 3) + 8;
        return (int) Math.min(newSize, MAX_ARRAY_LENGTH);
    }
}
