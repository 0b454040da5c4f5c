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
 * Exception types thrown by the JStructs data structures.
 * <p>
 * All of them are unchecked. They fall into two groups:
 *
 * <h2>Client errors</h2>
 * <p>
 * {@link io.github.jstructs.exceptions.DataException} and its subclasses signal that the
 * caller passed an argument the structure cannot accept:
 * <ul>
 *   <li>{@link io.github.jstructs.exceptions.DuplicateElementException} - adding an element
 *       twice to a {@link io.github.jstructs.disjointset.DisjointSet}</li>
 *   <li>{@link io.github.jstructs.exceptions.UnknownElementException} - referring to an
 *       element that was never added</li>
 *   <li>{@link io.github.jstructs.exceptions.SelfUnionException} - uniting an element with
 *       itself</li>
 *   <li>{@link io.github.jstructs.exceptions.InvalidSizeException} - constructing a structure
 *       with an unusable size</li>
 *   <li>{@link io.github.jstructs.exceptions.RangeException} - an index or query interval
 *       outside the covered range</li>
 * </ul>
 * These are detected before any state changes, so the structure remains usable afterward.
 *
 * <h2>Internal errors</h2>
 * <p>
 * {@link io.github.jstructs.exceptions.InternalConsistencyException} means the structure
 * found its own invariants broken. It is not expected under correct use, and the instance
 * should not be used further.
 *
 * <pre>{@code
 * int root;
 * try {
 *     root = forest.find(element);
 * } catch (UnknownElementException e) {
 *     forest.makeSet(element);
 *     root = element;
 * }
 * }</pre>
 */
package io.github.jstructs.exceptions;
