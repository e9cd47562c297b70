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

import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.solver.SolverEnvironment;
import io.gedpaths.solver.SolverEnvironmentFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs work chunks on a bounded pool of worker threads.
///
/// ## Worker model
///
/// Each of the `threads` workers pulls the next unclaimed chunk from a shared
/// cursor until none are left, so faster workers take more chunks. A worker owns
/// exactly one [SolverEnvironment], created on its first chunk and handed to every
/// later chunk it processes. Nothing else is shared between workers except the
/// cursor and the [ChunkProgressReporter].
///
/// ```text
///   chunks: [c0][c1][c2][c3][c4][c5] ...
///              \    |    /
///   worker_000 (env A): c0, c3, c4 ...
///   worker_001 (env B): c1, c2, c5 ...
/// ```
///
/// ## Failure isolation
///
/// A chunk that throws, including an [Error] such as a stack overflow inside the
/// solver, becomes a failed [ChunkOutcome]; its pairs stay pending and sibling chunks
/// are unaffected. The environment that was in use is discarded and
/// the worker creates a fresh one for its next chunk.
///
/// ## Output
///
/// Every chunk writes its results through the [ShardOutput] handle obtained from
/// the [ShardLayout], which is distinct per worker and chunk.
public class ParallelExecutor {
    private static final Logger logger = LogManager.getLogger(ParallelExecutor.class);

    private final int threads;
    private final SolverEnvironmentFactory environmentFactory;
    private final ShardLayout layout;

    public ParallelExecutor(int threads, SolverEnvironmentFactory environmentFactory, ShardLayout layout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.threads = threads;
        this.environmentFactory = environmentFactory;
        this.layout = layout;
    }

    /// Processes all chunks and blocks until every worker is done.
    ///
    /// @param chunks the chunks to process
    /// @return one outcome per chunk
    public RunReport execute(List<WorkChunk> chunks) {
        long start = System.nanoTime();
        if (chunks.isEmpty()) {
            logger.info("No chunks to process");
            return new RunReport(List.of(), Duration.ZERO);
        }

        int workers = Math.min(threads, chunks.size());
        logger.info("Processing {} chunks with {} worker(s)", chunks.size(), workers);
        ChunkProgressReporter progress = new ChunkProgressReporter(chunks.size());
        AtomicInteger cursor = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        List<ChunkOutcome> outcomes = new ArrayList<>(chunks.size());
        try {
            List<Future<List<ChunkOutcome>>> futures = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                final int workerIndex = w;
                futures.add(pool.submit(() -> runWorker(workerIndex, chunks, cursor, progress)));
            }
            for (Future<List<ChunkOutcome>> future : futures) {
                outcomes.addAll(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker terminated abnormally", e.getCause());
        } finally {
            pool.shutdown();
        }

        RunReport report = new RunReport(outcomes, Duration.ofNanos(System.nanoTime() - start));
        if (!report.isComplete()) {
            logger.warn("{} of {} chunks failed, {} pairs left pending",
                report.failures().size(), report.totalChunks(), report.failedPairs().size());
        }
        return report;
    }

    private List<ChunkOutcome> runWorker(int workerIndex, List<WorkChunk> chunks, AtomicInteger cursor,
                                         ChunkProgressReporter progress) {
        List<ChunkOutcome> outcomes = new ArrayList<>();
        SolverEnvironment environment = null;
        try {
            int next;
            while ((next = cursor.getAndIncrement()) < chunks.size()) {
                WorkChunk chunk = chunks.get(next);
                ShardOutput output = layout.outputFor(workerIndex, chunk.index());
                try {
                    if (environment == null) {
                        environment = environmentFactory.create();
                        logger.debug("Worker {} created its solver environment", workerIndex);
                    }
                    outcomes.add(processChunk(environment, chunk, output, workerIndex));
                } catch (Throwable e) {
                    logger.error("Exception in parallel computation for chunk {} ({} pairs left pending): {}",
                        chunk.index(), chunk.size(), e.toString(), e);
                    outcomes.add(ChunkOutcome.failure(chunk, workerIndex, e));
                    close(environment, workerIndex);
                    environment = null;
                }
                progress.chunkFinished();
            }
        } finally {
            close(environment, workerIndex);
        }
        return outcomes;
    }

    /// Solves every pair of a chunk with `environment` and writes them to `output`.
    ///
    /// @throws IOException if the shard cannot be written
    static ChunkOutcome processChunk(SolverEnvironment environment, WorkChunk chunk, ShardOutput output,
                                     int workerIndex) throws IOException {
        List<MappingResult> results = new ArrayList<>(chunk.size());
        for (PairKey pair : chunk.pairs()) {
            results.add(environment.solve(pair));
        }
        output.write(results);
        return ChunkOutcome.success(chunk, workerIndex, output.file());
    }

    private static void close(SolverEnvironment environment, int workerIndex) {
        if (environment == null) {
            return;
        }
        try {
            environment.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing solver environment of worker {}: {}", workerIndex, e.getMessage());
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "mapping-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
