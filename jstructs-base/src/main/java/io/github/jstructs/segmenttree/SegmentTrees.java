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


package io.github.jstructs.segmenttree;

/**
 * Factory for the concrete segment trees.
 */
public final class SegmentTrees {
    /** The kinds of question a concrete segment tree can answer. */
    public enum Operation {
        /** Maximum value on an interval, see {@link MaxValSegmentTree}. */
        MAX,
        /** Index of a maximum value on an interval, see {@link IndexOfMaxValSegmentTree}. */
        INDEX_OF_MAX
    }

    private SegmentTrees() {
    }

    /**
     * Constructs a segment tree that answers questions of the given kind about data.
     *
     * @param data the values; must be non-empty
     * @param operation the kind of query
     * @return a {@code RangeQuery<Double>} for {@code MAX}, a {@code RangeQuery<Integer>} for
     *         {@code INDEX_OF_MAX}
     */
    public static RangeQuery<?> construct(double[] data, Operation operation) {
        switch (operation) {
            case MAX:
                return new MaxValSegmentTree(data);
            case INDEX_OF_MAX:
                return new IndexOfMaxValSegmentTree(data);
            default:
                throw new IllegalArgumentException("Unsupported operation " + operation);
        }
    }
}
