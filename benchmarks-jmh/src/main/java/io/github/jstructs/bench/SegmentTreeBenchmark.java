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


package io.github.jstructs.bench;

import io.github.jstructs.segmenttree.MaxValSegmentTree;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmark for {@link MaxValSegmentTree} over {@code size} random values in [-1, 1].
 *
 * <p>Measures construction, a sequence of {@code size} random {@code maxOn} queries, and a
 * sequence of {@code size} random point updates.</p>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class SegmentTreeBenchmark {
    private static final Logger log = LoggerFactory.getLogger(SegmentTreeBenchmark.class);

    /** Number of values covered by the tree. */
    @Param({"100000", "1000000"})
    private int size;

    private double[] data;
    private int[] lefts;
    private int[] rights;
    private MaxValSegmentTree tree;

    /**
     * Constructs a new benchmark instance. JMH populates the @Param fields before setup.
     */
    public SegmentTreeBenchmark() {
        // JMH-managed lifecycle
    }

    /**
     * Generates the data, the query intervals, and a tree to query.
     */
    @Setup(Level.Trial)
    public void setup() {
        var random = new Random(42);
        log.info("Generating {} random values in [-1, 1] and {} query intervals", size, size);
        data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = 2 * random.nextDouble() - 1;
        }
        lefts = new int[size];
        rights = new int[size];
        for (int i = 0; i < size; i++) {
            int v1 = random.nextInt(size);
            int v2 = random.nextInt(size);
            lefts[i] = Math.min(v1, v2);
            rights[i] = Math.max(v1, v2);
        }
        tree = new MaxValSegmentTree(data);
    }

    /**
     * Measures building a tree over the data.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void construct(Blackhole blackhole) {
        blackhole.consume(new MaxValSegmentTree(data));
    }

    /**
     * Measures {@code size} range-maximum queries.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void maxOn(Blackhole blackhole) {
        for (int i = 0; i < size; i++) {
            blackhole.consume(tree.maxOn(lefts[i], rights[i]));
        }
    }

    /**
     * Measures {@code size} point updates.
     */
    @Benchmark
    public void updateAt() {
        for (int i = 0; i < size; i++) {
            int idx = lefts[i];
            data[idx] = -data[idx];
            tree.updateAt(idx);
        }
    }
}
