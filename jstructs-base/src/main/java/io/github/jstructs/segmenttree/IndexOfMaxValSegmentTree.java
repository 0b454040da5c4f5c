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
 * A segment tree that, for an array A(0...n), answers "what is the index of the maximum value
 * in A(i..j)?" in O(log n) time.
 * <p>
 * Combining two intervals needs the winning values as well as their indices, so each node
 * stores an index-value pair. When several entries share the maximum, the leftmost index wins.
 * <p>
 * As with {@link MaxValSegmentTree}, the tree reads the caller's array and must be told of
 * changes through {@link #updateAt(int)}.
 */
public class IndexOfMaxValSegmentTree implements RangeQuery<Integer> {
    /** Returned by {@link #indexOfMaxValOn} for an empty interval. */
    public static final int NO_INDEX = -1;

    private final SegmentTree<IndexedValue> structure;

    /**
     * @param data the values; must be non-empty
     */
    public IndexOfMaxValSegmentTree(double[] data) {
        this.structure = new SegmentTree<>(data.length,
                                           (p1, p2) -> p1.value >= p2.value ? p1 : p2,
                                           i -> new IndexedValue(i, data[i]),
                                           null);
    }

    /**
     * @return an index of the largest value in A(i..j), or {@link #NO_INDEX} if i &gt; j
     */
    public int indexOfMaxValOn(int i, int j) {
        IndexedValue result = structure.queryOn(i, j);
        return result == null ? NO_INDEX : result.index;
    }

    /**
     * @return an index of the largest value in A(i..j), or null if i &gt; j
     */
    @Override
    public Integer queryOn(int i, int j) {
        IndexedValue result = structure.queryOn(i, j);
        return result == null ? null : result.index;
    }

    @Override
    public void updateAt(int idx) {
        structure.updateAt(idx);
    }

    private static final class IndexedValue {
        final int index;
        final double value;

        IndexedValue(int index, double value) {
            this.index = index;
            this.value = value;
        }
    }
}
