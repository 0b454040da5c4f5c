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
 * Segment trees for O(log n) range queries with point updates.
 *
 * <p>{@link io.github.jstructs.segmenttree.SegmentTree} is the generic structure, configured
 * with an associative combine operator, a per-index value function and an identity value.
 * {@link io.github.jstructs.segmenttree.MaxValSegmentTree} and
 * {@link io.github.jstructs.segmenttree.IndexOfMaxValSegmentTree} are ready-made trees over
 * a {@code double[]}, also available through
 * {@link io.github.jstructs.segmenttree.SegmentTrees#construct}.
 *
 * <pre>{@code
 * int[] data = {0, 1, 2, 3, 4, 5, 6, 7};
 * SegmentTree<Integer> sums = new SegmentTree<>(data.length, Integer::sum, i -> data[i], 0);
 * sums.queryOn(0, 7);   // 28
 * data[3] = 100;
 * sums.updateAt(3);
 * sums.queryOn(0, 7);   // 125
 * }</pre>
 */
package io.github.jstructs.segmenttree;
