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


package io.github.jstructs.disjointset;

import io.github.jstructs.exceptions.DataException;
import io.github.jstructs.exceptions.DuplicateElementException;
import io.github.jstructs.exceptions.InvalidSizeException;
import io.github.jstructs.exceptions.SelfUnionException;
import io.github.jstructs.exceptions.UnknownElementException;
import io.github.jstructs.util.GrowableIntArray;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A disjoint-set forest ("union-find") over non-negative int elements.
 * <p>
 * The forest tracks a partition of its elements into disjoint subsets. Elements join the
 * universe through {@link #makeSet} as singletons; {@link #unite} replaces two subsets by
 * their union, and {@link #find} returns the canonical representative of an element's subset.
 * Two elements are in the same subset exactly when their representatives are equal.
 * Elements are never removed and subsets never split.
 * <p>
 * Each subset is a tree in which every element points at its parent; the root is its own
 * parent and serves as the representative. Following Tarjan and van Leeuwen, {@code unite}
 * links by rank and {@code find} shortens paths by halving, which together make the amortized
 * cost of each operation effectively constant.
 * <ul>
 *   <li>Tarjan, Robert E., van Leeuwen, Jan (1984). <i>Worst-case analysis of set union
 *   algorithms</i>. Journal of the ACM. 31 (2): 245-281.</li>
 * </ul>
 * <p>
 * Elements are used directly as array indices, so memory use grows with the largest element
 * added rather than with the number of elements. This class is not thread-safe.
 */
public class DisjointSet {
    private static final Logger logger = LoggerFactory.getLogger(DisjointSet.class);

    /** Parent slot of an element that is not in the universe. */
    private static final int ABSENT = -1;
    private static final int DEFAULT_CAPACITY = 100;

    // parent of each element; an element is a root exactly when it is its own parent
    private final GrowableIntArray forest;
    // upper bound on subtree height, only meaningful for roots
    private final GrowableIntArray rank;
    private int subsetCount;

    /**
     * Creates a forest with an empty universe.
     */
    public DisjointSet() {
        this(0);
    }

    /**
     * Creates a forest whose universe starts as {@code 0, 1, ..., initialSize - 1}, each in its
     * own singleton subset.
     *
     * @param initialSize the number of elements to start with
     * @throws InvalidSizeException if initialSize is negative
     */
    public DisjointSet(int initialSize) {
        if (initialSize < 0) {
            throw new InvalidSizeException("Initial size must be non-negative: " + initialSize);
        }
        int capacity = Math.max(initialSize, DEFAULT_CAPACITY);
        this.forest = new GrowableIntArray(capacity, ABSENT);
        this.rank = new GrowableIntArray(capacity, 0);
        for (int e = 0; e < initialSize; e++) {
            makeSet(e);
        }
        logger.debug("Created disjoint set with {} initial elements", initialSize);
    }

    /**
     * Adds {@code e} to the universe in a new singleton subset.
     *
     * @param e a non-negative element
     * @throws DuplicateElementException if e is already present
     * @throws DataException if e is negative
     */
    public void makeSet(int e) {
        if (e < 0) {
            throw new DataException("Element must be non-negative: " + e);
        }
        if (contains(e)) {
            throw new DuplicateElementException(e);
        }
        forest.set(e, e);
        rank.set(e, 0);
        subsetCount++;
    }

    /**
     * @return true if e has been added to the universe
     */
    public boolean contains(int e) {
        return e >= 0 && forest.get(e) != ABSENT;
    }

    /**
     * Returns the canonical representative of the subset containing e.
     *
     * @param e an element of the universe
     * @return the root of e's tree
     * @throws UnknownElementException if e is not present
     */
    public int find(int e) {
        checkMembership(e);

        // path halving: point every other node on the path at its grandparent
        int x = e;
        int parent = forest.get(x);
        int grandparent = forest.get(parent);
        while (grandparent != parent) {
            forest.set(x, grandparent);
            x = grandparent;
            parent = forest.get(x);
            grandparent = forest.get(parent);
        }
        return parent;
    }

    /**
     * Merges the subsets containing a and b. If they are already in the same subset this is
     * a no-op.
     *
     * @throws UnknownElementException if either element is not present
     * @throws SelfUnionException if a == b
     */
    public void unite(int a, int b) {
        checkMembership(a);
        checkMembership(b);
        if (a == b) {
            throw new SelfUnionException(a);
        }

        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return;
        }
        link(rootA, rootB);
        subsetCount--;
    }

    /**
     * @return true if a and b are in the same subset
     * @throws UnknownElementException if either element is not present
     */
    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * @return the number of disjoint subsets in the partition
     */
    public int subsetCount() {
        return subsetCount;
    }

    /**
     * Returns a snapshot of the partition, keyed by representative. Each value lists the
     * members of that subset in ascending order. Later changes to the forest are not
     * reflected in the returned map.
     */
    public Int2ObjectHashMap<IntArrayList> subsets() {
        var subsets = new Int2ObjectHashMap<IntArrayList>();
        for (int e = 0; e < forest.length(); e++) {
            if (!contains(e)) {
                continue;
            }
            subsets.computeIfAbsent(find(e), k -> new IntArrayList()).addInt(e);
        }
        return subsets;
    }

    // Both arguments must be distinct roots. See Tarjan and van Leeuwen, p 250.
    private void link(int rootA, int rootB) {
        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA > rankB) {
            forest.set(rootB, rootA);
        } else if (rankA == rankB) {
            forest.set(rootB, rootA);
            rank.set(rootA, rankA + 1);
        } else {
            forest.set(rootA, rootB);
        }
    }

    private void checkMembership(int e) {
        if (!contains(e)) {
            throw new UnknownElementException(e);
        }
    }
}
