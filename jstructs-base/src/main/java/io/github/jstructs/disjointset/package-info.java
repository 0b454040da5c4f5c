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


/**
 * A disjoint-set forest for tracking a partition of non-negative integers.
 *
 * <p>{@link io.github.jstructs.disjointset.DisjointSet} supports adding singleton subsets,
 * merging subsets and querying canonical representatives in amortized near-constant time.
 *
 * <pre>{@code
 * DisjointSet forest = new DisjointSet(5);
 * forest.unite(0, 1);
 * forest.unite(1, 2);
 * forest.subsetCount();        // 3
 * forest.connected(0, 2);      // true
 * }</pre>
 */
package io.github.jstructs.disjointset;
