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

import io.github.jstructs.disjointset.DisjointSet;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmark for {@link DisjointSet}: builds a universe of {@code size} elements, then
 * performs {@code size / 2} unions of randomly chosen pairs.
 *
 * <p>Construction and the union sequence are measured separately. Every trial uses the same
 * pseudo-random pairs so results are comparable across parameter values.</p>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Fork(value = 1)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
@Threads(1)
public class DisjointSetBenchmark {
    private static final Logger log = LoggerFactory.getLogger(DisjointSetBenchmark.class);

    /** Number of elements in the universe. */
    @Param({"100000", "1000000"})
    private int size;

    /** Pairs to unite, flattened as [a0, b0, a1, b1, ...]. */
    private int[] pairs;

    /** A fresh forest for each invocation of {@link #unite}. */
    private DisjointSet forest;

    /**
     * Constructs a new benchmark instance. JMH populates the @Param fields before setup.
     */
    public DisjointSetBenchmark() {
        // JMH-managed lifecycle
    }

    /**
     * Generates the random pairs.
     */
    @Setup(Level.Trial)
    public void setup() {
        log.info("Generating {} random integers in 0...{}", size, size);
        var random = new Random(42);
        pairs = new int[size];
        for (int i = 0; i < pairs.length; i++) {
            pairs[i] = random.nextInt(size);
        }
    }

    /**
     * Builds the forest consumed by the next {@link #unite} invocation.
     */
    @Setup(Level.Invocation)
    public void buildForest() {
        forest = new DisjointSet(size);
    }

    /**
     * Measures building a forest of {@code size} singletons.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void construct(Blackhole blackhole) {
        blackhole.consume(new DisjointSet(size));
    }

    /**
     * Measures {@code size / 2} unions on a fresh forest.
     *
     * @param blackhole JMH blackhole to prevent dead code elimination
     */
    @Benchmark
    public void unite(Blackhole blackhole) {
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            int a = pairs[i];
            int b = pairs[i + 1];
            if (a != b) {
                forest.unite(a, b);
            }
        }
        blackhole.consume(forest.subsetCount());
    }
}
