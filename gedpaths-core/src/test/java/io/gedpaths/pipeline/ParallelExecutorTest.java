package io.gedpaths.pipeline;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.gedpaths.TestGraphs;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.solver.SolverEnvironment;
import io.gedpaths.solver.SolverEnvironmentFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelExecutorTest {

    private static MappingResult fakeResult(PairKey pair) {
        return TestGraphs.result(pair.a(), pair.b(), pair.a() + pair.b(), new int[]{0, 1}, new int[]{0, 1});
    }

    private static SolverEnvironmentFactory countingFactory(AtomicInteger created, Set<PairKey> failOn) {
        return () -> {
            created.incrementAndGet();
            return pair -> {
                if (failOn.contains(pair)) {
                    throw new IllegalStateException("solver failure on " + pair);
                }
                return fakeResult(pair);
            };
        };
    }

    @Test
    void threePairsOnTwoWorkersMergeToThreeEntries(@TempDir Path dir) throws IOException {
        List<PairKey> pairs = List.of(new PairKey(0, 1), new PairKey(0, 2), new PairKey(1, 2));
        ShardLayout layout = new ShardLayout(dir.resolve("tmp"), "TOY");
        AtomicInteger created = new AtomicInteger();

        RunReport report = new ParallelExecutor(2, countingFactory(created, Set.of()), layout)
            .execute(WorkPartitioner.partition(pairs, 2));
        ShardMerger.MergeResult merged = ShardMerger.merge(layout.root(), ShardLayout.shardFileMatcher(), List.of());

        assertThat(report.isComplete()).isTrue();
        assertThat(report.totalChunks()).isEqualTo(3);
        assertThat(merged.results()).extracting(MappingResult::pair).containsExactlyElementsOf(pairs);
        assertThat(created.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void eachWorkerReusesOneEnvironment(@TempDir Path dir) {
        List<PairKey> pairs = PairSet.allPairs(12).pairs();
        Set<SolverEnvironment> seen = ConcurrentHashMap.newKeySet();
        Set<Thread> threads = ConcurrentHashMap.newKeySet();
        AtomicInteger created = new AtomicInteger();
        SolverEnvironmentFactory factory = () -> {
            created.incrementAndGet();
            SolverEnvironment[] self = new SolverEnvironment[1];
            self[0] = pair -> {
                seen.add(self[0]);
                threads.add(Thread.currentThread());
                return fakeResult(pair);
            };
            return self[0];
        };

        RunReport report = new ParallelExecutor(3, factory, new ShardLayout(dir, "TOY"))
            .execute(WorkPartitioner.partition(pairs, 3));

        assertThat(report.isComplete()).isTrue();
        assertThat(report.totalChunks()).isGreaterThan(3);
        assertThat(created.get()).isLessThanOrEqualTo(3);
        assertThat(seen.size()).isEqualTo(created.get());
        assertThat(threads.size()).isLessThanOrEqualTo(3);
    }

    @Test
    void failingChunkLeavesItsPairsPendingAndSiblingsComplete(@TempDir Path dir) throws IOException {
        List<PairKey> pairs = PairSet.allPairs(6).pairs();
        PairKey poison = new PairKey(2, 4);
        ShardLayout layout = new ShardLayout(dir, "TOY");
        List<WorkChunk> chunks = WorkPartitioner.partition(pairs, 2);

        RunReport report = new ParallelExecutor(2, countingFactory(new AtomicInteger(), Set.of(poison)), layout)
            .execute(chunks);

        assertThat(report.isComplete()).isFalse();
        assertThat(report.failures()).hasSize(1);
        ChunkOutcome failure = report.failures().get(0);
        assertThat(failure.failedPairs()).contains(poison);
        assertThat(failure.failure()).get().extracting(Throwable::getMessage).asString().contains("(2, 4)");
        assertThat(report.succeededChunks()).isEqualTo(chunks.size() - 1);

        List<MappingResult> merged =
            ShardMerger.merge(dir, ShardLayout.shardFileMatcher(), List.of()).results();
        assertThat(merged).hasSize(pairs.size() - failure.failedPairs().size());
        assertThat(merged).extracting(MappingResult::pair).doesNotContain(poison);
    }

    @Test
    void solverErrorIsIsolatedToItsChunk(@TempDir Path dir) {
        List<PairKey> pairs = PairSet.allPairs(6).pairs();
        PairKey poison = new PairKey(1, 3);
        List<WorkChunk> chunks = WorkPartitioner.partition(pairs, 3);
        AtomicInteger created = new AtomicInteger();
        SolverEnvironmentFactory factory = () -> {
            created.incrementAndGet();
            return pair -> {
                if (pair.equals(poison)) {
                    throw new StackOverflowError("deep recursion on " + pair);
                }
                return fakeResult(pair);
            };
        };

        RunReport report = new ParallelExecutor(3, factory, new ShardLayout(dir, "TOY")).execute(chunks);

        assertThat(report.totalChunks()).isEqualTo(chunks.size());
        assertThat(report.failures()).hasSize(1);
        assertThat(report.failures().get(0).failure()).get().isInstanceOf(StackOverflowError.class);
        assertThat(report.failedPairs()).contains(poison);
        assertThat(report.succeededChunks()).isEqualTo(chunks.size() - 1);
    }

    @Test
    void eachChunkWritesItsOwnShard(@TempDir Path dir) throws IOException {
        List<PairKey> pairs = PairSet.allPairs(5).pairs();
        List<WorkChunk> chunks = WorkPartitioner.partition(pairs, 2);

        RunReport report = new ParallelExecutor(2, countingFactory(new AtomicInteger(), Set.of()),
            new ShardLayout(dir, "TOY")).execute(chunks);

        List<Path> shards = report.outcomes().stream().map(o -> o.shard().orElseThrow()).toList();
        assertThat(shards).doesNotHaveDuplicates().hasSize(chunks.size());
        for (ChunkOutcome outcome : report.outcomes()) {
            assertThat(MappingResultCodec.read(outcome.shard().orElseThrow()))
                .extracting(MappingResult::pair)
                .containsExactlyElementsOf(outcome.chunk().pairs());
        }
    }

    @Test
    void noChunksIsANoOp(@TempDir Path dir) {
        RunReport report = new ParallelExecutor(4, countingFactory(new AtomicInteger(), Set.of()),
            new ShardLayout(dir, "TOY")).execute(List.of());

        assertThat(report.totalChunks()).isZero();
        assertThat(report.isComplete()).isTrue();
    }

    @Test
    void rejectsNonPositiveThreadCount(@TempDir Path dir) {
        assertThatThrownBy(() -> new ParallelExecutor(0, () -> ParallelExecutorTest::fakeResult,
            new ShardLayout(dir, "TOY"))).isInstanceOf(IllegalArgumentException.class);
    }
}
