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
 * Growable array storage shared by the data structures in JStructs.
 *
 * <p>Both the disjoint-set forest and the segment tree keep their state in integer-indexed
 * arrays whose final size is not always known up front. This package provides:
 *
 * <ul>
 *   <li>{@link io.github.jstructs.util.GrowableIntArray}: primitive ints, used for the parent
 *       and rank arrays of {@link io.github.jstructs.disjointset.DisjointSet}.
 *   <li>{@link io.github.jstructs.util.GrowableArray}: references, used for the implicit tree
 *       of {@link io.github.jstructs.segmenttree.SegmentTree}.
 *   <li>{@link io.github.jstructs.util.ArrayUtil}: the over-allocation arithmetic both share.
 * </ul>
 *
 * <p>Unassigned slots read as a caller-chosen default value. That lets the forest use a
 * sentinel to mean "not a member" without a separate membership structure.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GrowableIntArray parents = new GrowableIntArray(16, -1);
 * parents.set(100, 100);    // grows to >= 101 slots
 * parents.get(50);          // -1, never assigned
 * }</pre>
 *
 * <p>None of these classes are thread-safe.
 */
package io.github.jstructs.util;
