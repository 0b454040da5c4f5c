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
 * JMH benchmarks for the JStructs data structures.
 * <ul>
 *   <li>{@link io.github.jstructs.bench.DisjointSetBenchmark} - forest construction and a
 *       long sequence of random unions</li>
 *   <li>{@link io.github.jstructs.bench.SegmentTreeBenchmark} - segment tree construction,
 *       range-maximum queries and point updates</li>
 * </ul>
 *
 * <h2>Running Benchmarks</h2>
 *
 * <pre>
 * # Build the shaded JAR
 * mvn clean package -pl benchmarks-jmh -am
 *
 * # Run all benchmarks
 * java -jar benchmarks-jmh/target/benchmarks.jar
 *
 * # Run a specific benchmark
 * java -jar benchmarks-jmh/target/benchmarks.jar DisjointSetBenchmark
 * </pre>
 */
package io.github.jstructs.bench;
