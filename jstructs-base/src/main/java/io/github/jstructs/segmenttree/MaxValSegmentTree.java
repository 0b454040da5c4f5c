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
 * A segment tree that, for an array A(0...n), answers "what is the maximum value in A(i..j)?"
 * in O(log n) time.
 * <p>
 * The tree reads the caller's array. After changing {@code data[idx]}, call
 * {@link #updateAt(int)} so later queries see the new value.
 */
public class MaxValSegmentTree implements RangeQuery<Double> {
    private final SegmentTree<Double> structure;

    /**
     * @param data the values; must be non-empty
     */
    public MaxValSegmentTree(double[] data) {
        this.structure = new SegmentTree<>(data.length, Math::max, i -> data[i], Double.NEGATIVE_INFINITY);
    }

    /**
     * @return the largest value in A(i..j), or negative infinity if i &gt; j
     */
    public double maxOn(int i, int j) {
        return structure.queryOn(i, j);
    }

    @Override
    public Double queryOn(int i, int j) {
        return maxOn(i, j);
    }

    @Override
    public void updateAt(int idx) {
        structure.updateAt(idx);
    }
}
