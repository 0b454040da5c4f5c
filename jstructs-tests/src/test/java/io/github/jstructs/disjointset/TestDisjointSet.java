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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jstructs.exceptions.DataException;
import io.github.jstructs.exceptions.DuplicateElementException;
import io.github.jstructs.exceptions.InvalidSizeException;
import io.github.jstructs.exceptions.SelfUnionException;
import io.github.jstructs.exceptions.UnknownElementException;
import org.agrona.collections.IntArrayList;
import org.agrona.collections.IntHashSet;
import org.junit.Test;

import java.util.stream.IntStream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestDisjointSet extends RandomizedTest {

    @Test
    public void testBasicOperation() {
        var forest = new DisjointSet(10);
        assertEquals(10, forest.subsetCount());

        forest.unite(0, 2);
        assertEquals(9, forest.subsetCount());
        assertEquals(forest.find(0), forest.find(2));

        forest.unite(2, 4);
        forest.unite(4, 6);
        forest.unite(6, 8);

        assertEquals(1, IntStream.of(0, 2, 4, 6, 8).map(forest::find).distinct().count());
        assertEquals(5, IntStream.of(1, 3, 5, 7, 9).map(forest::find).distinct().count());
        assertEquals(6, forest.subsetCount());
    }

    @Test
    public void testSmallUniverseScenario() {
        var forest = new DisjointSet(5);
        forest.unite(0, 1);
        forest.unite(1, 2);
        assertEquals(3, forest.subsetCount());
        assertEquals(forest.find(0), forest.find(2));

        forest.unite(3, 4);
        assertEquals(2, forest.subsetCount());
        assertTrue(forest.connected(3, 4));
        assertFalse(forest.connected(2, 3));
    }

    @Test
    public void testUniteWithinSameSubsetIsNoOp() {
        var forest = new DisjointSet(4);
        forest.unite(0, 1);
        forest.unite(1, 2);
        int root = forest.find(2);
        forest.unite(0, 2);
        assertEquals(2, forest.subsetCount());
        assertEquals(root, forest.find(0));
    }

    @Test
    public void testEqualRankKeepsFirstRoot() {
        var forest = new DisjointSet(4);
        forest.unite(0, 1);
        assertEquals(0, forest.find(1));
        forest.unite(3, 2);
        assertEquals(3, forest.find(2));
        // equal ranks again: the root of the first argument wins
        forest.unite(2, 0);
        assertEquals(3, forest.find(0));
        // a singleton has lower rank and goes underneath
        var other = new DisjointSet(3);
        other.unite(0, 1);
        other.unite(2, 1);
        assertEquals(0, other.find(2));
    }

    @Test
    public void testMakeSetGrowsUniverse() {
        var forest = new DisjointSet();
        assertEquals(0, forest.subsetCount());
        assertFalse(forest.contains(0));

        forest.makeSet(5);
        forest.makeSet(100_000);
        forest.makeSet(0);
        assertEquals(3, forest.subsetCount());
        assertTrue(forest.contains(100_000));
        assertFalse(forest.contains(99_999));
        assertFalse(forest.contains(-1));

        forest.unite(5, 100_000);
        assertEquals(2, forest.subsetCount());
        assertTrue(forest.connected(100_000, 5));
        assertEquals(0, forest.find(0));
    }

    @Test
    public void testDuplicateElement() {
        var forest = new DisjointSet(3);
        var e = assertThrows(DuplicateElementException.class, () -> forest.makeSet(2));
        assertEquals(2, e.getElement());
        assertEquals(3, forest.subsetCount());
    }

    @Test
    public void testNegativeElement() {
        var forest = new DisjointSet(3);
        assertThrows(DataException.class, () -> forest.makeSet(-1));
        assertThrows(UnknownElementException.class, () -> forest.find(-1));
        assertThrows(InvalidSizeException.class, () -> new DisjointSet(-1));
    }

    @Test
    public void testUnknownElement() {
        var forest = new DisjointSet(10);
        var e = assertThrows(UnknownElementException.class, () -> forest.find(10));
        assertEquals(10, e.getElement());
        assertThrows(UnknownElementException.class, () -> forest.unite(0, 10));
        assertThrows(UnknownElementException.class, () -> forest.unite(10, 0));
        // membership is checked before the self-union test
        assertThrows(UnknownElementException.class, () -> forest.unite(10, 10));
        assertEquals(10, forest.subsetCount());
    }

    @Test
    public void testSelfUnion() {
        var forest = new DisjointSet(3);
        forest.unite(0, 1);
        assertThrows(SelfUnionException.class, () -> forest.unite(1, 1));
        assertThrows(SelfUnionException.class, () -> forest.unite(2, 2));
        assertEquals(2, forest.subsetCount());
    }

    @Test
    public void testFindIsIdempotent() {
        int n = randomIntBetween(10, 500);
        var forest = new DisjointSet(n);
        for (int i = 0; i < n; i++) {
            int a = randomIntBetween(0, n - 1);
            int b = randomIntBetween(0, n - 1);
            if (a != b) {
                forest.unite(a, b);
            }
        }
        for (int x = 0; x < n; x++) {
            int root = forest.find(x);
            assertEquals(root, forest.find(root));
            assertEquals(root, forest.find(x));
        }
    }

    @Test
    public void testMatchesNaivePartition() {
        for (int trial = 0; trial < 10; trial++) {
            int universe = randomIntBetween(1, 300);
            var forest = new DisjointSet();
            var reference = new NaivePartition();
            var present = new IntArrayList();
            int added = 0;
            int merges = 0;

            int operations = randomIntBetween(1, 3 * universe);
            for (int op = 0; op < operations; op++) {
                if (present.isEmpty() || randomIntBetween(0, 3) == 0) {
                    int e = randomIntBetween(0, universe - 1);
                    if (forest.contains(e)) {
                        continue;
                    }
                    forest.makeSet(e);
                    reference.add(e);
                    present.addInt(e);
                    added++;
                } else {
                    int a = present.getInt(randomIntBetween(0, present.size() - 1));
                    int b = present.getInt(randomIntBetween(0, present.size() - 1));
                    if (a == b) {
                        continue;
                    }
                    if (forest.find(a) != forest.find(b)) {
                        merges++;
                    }
                    forest.unite(a, b);
                    reference.union(a, b);
                }
                assertEquals(added - merges, forest.subsetCount());
            }

            assertEquals(reference.componentCount(), forest.subsetCount());
            for (int i = 0; i < present.size(); i++) {
                for (int j = 0; j < present.size(); j++) {
                    int a = present.getInt(i);
                    int b = present.getInt(j);
                    assertEquals(reference.connected(a, b), forest.find(a) == forest.find(b));
                }
            }
        }
    }

    @Test
    public void testSubsets() {
        var forest = new DisjointSet(6);
        forest.makeSet(9);
        forest.unite(0, 3);
        forest.unite(3, 5);
        forest.unite(9, 1);

        var subsets = forest.subsets();
        assertEquals(forest.subsetCount(), subsets.size());

        var members = subsets.get(forest.find(5));
        assertEquals(3, members.size());
        assertEquals(0, members.getInt(0));
        assertEquals(3, members.getInt(1));
        assertEquals(5, members.getInt(2));

        var pair = subsets.get(forest.find(1));
        assertEquals(2, pair.size());
        assertEquals(1, pair.getInt(0));
        assertEquals(9, pair.getInt(1));

        var covered = new IntHashSet();
        for (IntArrayList list : subsets.values()) {
            for (int i = 0; i < list.size(); i++) {
                covered.add(list.getInt(i));
            }
        }
        assertEquals(7, covered.size());
        assertNotEquals(forest.find(2), forest.find(4));
    }
}
