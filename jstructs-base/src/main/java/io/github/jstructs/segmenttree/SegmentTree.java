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

import io.github.jstructs.exceptions.InternalConsistencyException;
import io.github.jstructs.exceptions.InvalidSizeException;
import io.github.jstructs.exceptions.RangeException;
import io.github.jstructs.util.GrowableArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;

/**
 * A generic segment tree over the index range {@code [0, size)}.
 * <p>
 * The tree answers "combine all values on the subinterval {@code left..right}" in O(log n)
 * time for any associative {@code combine}: sums, minima, maxima, the index of a maximum,
 * string concatenation and so on. The operator need not be commutative; partial results are
 * always combined left to right.
 * <p>
 * Values come from {@code leafValue}, which maps an index to the value stored for the
 * single-cell interval {@code i..i}. It is called once per index when the tree is built in
 * O(n), and again for an index whenever {@link #updateAt} is called. To support updates the
 * function must read the caller's current data, for example by closing over a mutable array.
 * <p>
 * Nodes are kept in an implicit binary tree rooted at 1, where node i has children 2i and
 * 2i + 1 and the root covers {@code [0, size - 1]}.
 * See https://cp-algorithms.com/data_structures/segment_tree.html for background.
 * <p>
 * This class is not thread-safe.
 *
 * @param <T> the type of the combined values
 */
public class SegmentTree<T> {
    private static final Logger logger = LoggerFactory.getLogger(SegmentTree.class);

    private static final int ROOT = 1;

    private final int size;
    private final BinaryOperator<T> combine;
    private final IntFunction<T> leafValue;
    private final T identity;
    private final GrowableArray<T> tree;

    /**
     * Builds a segment tree.
     *
     * @param size the number of indices covered; must be positive
     * @param combine associative operator merging the values of two adjacent intervals, left
     *                interval first
     * @param leafValue supplies the value of the single-cell interval {@code i..i}
     * @param identity returned when querying an empty interval. For sums this is zero, for
     *                 maxima negative infinity
     * @throws InvalidSizeException if size is not positive
     */
    public SegmentTree(int size, BinaryOperator<T> combine, IntFunction<T> leafValue, T identity) {
        if (size <= 0) {
            throw new InvalidSizeException("Segment tree size must be positive: " + size);
        }
        this.size = size;
        this.combine = Objects.requireNonNull(combine, "combine");
        this.leafValue = Objects.requireNonNull(leafValue, "leafValue");
        this.identity = identity;
        this.tree = new GrowableArray<>(4 * size, null);

        build(ROOT, 0, size - 1);
        logger.debug("Built segment tree over {} indices using {} nodes", size, tree.length());
    }

    /**
     * Returns the combination of the values on {@code left..right}, inclusive.
     *
     * @param left the left end of the interval
     * @param right the right end of the interval, inclusive
     * @return the combined value, or the identity if {@code left > right}
     * @throws RangeException if the interval is non-empty and not contained in {@code [0, size)}
     */
    public T queryOn(int left, int right) {
        if (left > right) {
            return identity;
        }
        if (left < 0 || right >= size) {
            throw new RangeException("Bad query interval " + left + ".." + right + " (size = " + size + ")");
        }
        return determineVal(ROOT, left, right, 0, size - 1);
    }

    /**
     * Reflects a change to the underlying data at idx. The new value is obtained by calling
     * {@code leafValue} again; every interval containing idx is then recomputed.
     *
     * @param idx the index whose value changed
     * @throws RangeException if idx is not in {@code [0, size)}
     */
    public void updateAt(int idx) {
        if (idx < 0 || idx >= size) {
            throw new RangeException("Cannot update index " + idx + " (size = " + size + ")");
        }
        updateValAt(idx, ROOT, 0, size - 1);
    }

    /**
     * @return the number of indices covered by the tree
     */
    public int size() {
        return size;
    }

    // node covers treeL..treeR; left..right lies within it
    private T determineVal(int node, int left, int right, int treeL, int treeR) {
        if (left == treeL && right == treeR) {
            return tree.get(node);
        }

        int mid = midpoint(treeL, treeR);
        if (right <= mid) {
            return determineVal(leftChild(node), left, right, treeL, mid);
        } else if (left > mid) {
            return determineVal(rightChild(node), left, right, mid + 1, treeR);
        } else {
            T leftVal = determineVal(leftChild(node), left, mid, treeL, mid);
            T rightVal = determineVal(rightChild(node), mid + 1, right, mid + 1, treeR);
            return combine.apply(leftVal, rightVal);
        }
    }

    private void updateValAt(int idx, int node, int treeL, int treeR) {
        if (treeL == treeR) {
            if (treeL != idx) {
                logger.error("Reached leaf {}..{} while updating index {}", treeL, treeR, idx);
                throw new InternalConsistencyException("Leaf " + treeL + " does not match the updated index " + idx);
            }
            tree.set(node, leafValue.apply(idx));
            return;
        }

        int mid = midpoint(treeL, treeR);
        if (idx <= mid) {
            updateValAt(idx, leftChild(node), treeL, mid);
        } else {
            updateValAt(idx, rightChild(node), mid + 1, treeR);
        }
        tree.set(node, combine.apply(tree.get(leftChild(node)), tree.get(rightChild(node))));
    }

    private void build(int node, int treeL, int treeR) {
        if (treeL == treeR) {
            tree.set(node, leafValue.apply(treeL));
            return;
        }

        int mid = midpoint(treeL, treeR);
        build(leftChild(node), treeL, mid);
        build(rightChild(node), mid + 1, treeR);
        tree.set(node, combine.apply(tree.get(leftChild(node)), tree.get(rightChild(node))));
    }

    // every interval split goes through here
    private static int midpoint(int left, int right) {
        return (left + right) >>> 1;
    }

    private static int leftChild(int node) {
        return node << 1;
    }

    private static int rightChild(int node) {
        return (node << 1) + 1;
    }
}
