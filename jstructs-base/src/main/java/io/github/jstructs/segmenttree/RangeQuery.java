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
 * A range-query structure over an array A(0...n) that the caller may update in place.
 *
 * @param <R> the type of a query result
 */
public interface RangeQuery<R> {
    /**
     * Answers the query on A(i..j), inclusive.
     * @return the answer, whose meaning depends on the implementation
     */
    R queryOn(int i, int j);

    /**
     * Tells the structure that A(idx) has changed.
     */
    void updateAt(int idx);
}
