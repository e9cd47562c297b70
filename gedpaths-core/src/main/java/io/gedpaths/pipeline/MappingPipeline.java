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
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.solver.SolverEnvironment;
import io.gedpaths.solver.SolverEnvironmentFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// Computes the mappings of a pair set into the canonical result file of a method and dataset.
///
/// A run proceeds as follows:
/// 1. An existing canonical file and any shards left by an interrupted run are
///    loaded, validated, repaired and rewritten.
/// 2. Pairs that already have a result are removed from the request.
/// 3. The remaining pairs are partitioned and computed in parallel into shards.
/// 4. Shards and existing results are merged, validated and repaired once more.
/// 5. The canonical binary and CSV files are written and consumed shards removed,
///    unless shards are kept; kept shards are absorbed by the next run.
///
/// Re-running with the same request leaves the canonical file unchanged; adding pairs
/// only appends results for the new ones.
public class MappingPipeline {
    private static final Logger logger = LogManager.getLogger(MappingPipeline.class);

    private final SolverEnvironmentFactory environmentFactory;
    private final MappingPaths paths;
    private final int threads;
    private final boolean keepShards;

    public MappingPipeline(SolverEnvironmentFactory environmentFactory, MappingPaths paths, int threads,
                           boolean keepShards) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.environmentFactory = environmentFactory;
        this.paths = paths;
        this.threads = threads;
        this.keepShards = keepShards;
    }

    public MappingPaths paths() {
        return paths;
    }

    /// Runs the pipeline for `requested`.
    ///
    /// @throws IOException if the output directory, an existing result file or a shard
    ///     cannot be read or written
    public MappingRunSummary run(PairSet requested) throws IOException {
        long start = System.nanoTime();
        Files.createDirectories(paths.datasetDir());

        List<MappingResult> existing = new ArrayList<>();
        if (Files.exists(paths.canonicalFile())) {
            existing.addAll(MappingResultCodec.read(paths.canonicalFile()));
            logger.info("Loaded {} existing mappings from {}", existing.size(), paths.canonicalFile());
        }
        boolean changed = false;
        List<Path> leftovers = ShardMerger.findShards(paths.shardRoot(), ShardLayout.shardFileMatcher());
        if (!leftovers.isEmpty()) {
            logger.info("Recovering {} shard file(s) left by an earlier run", leftovers.size());
            ShardMerger.MergeResult recovered =
                ShardMerger.merge(paths.shardRoot(), ShardLayout.shardFileMatcher(), existing);
            existing = new ArrayList<>(recovered.results());
            changed = true;
        }
        RepairLoop.Report existingRepair = RepairLoop.Report.empty();
        List<Integer> invalidExisting = ValidityChecker.invalidIndices(existing);
        if (!invalidExisting.isEmpty()) {
            existingRepair = new RepairLoop(environmentFactory).repair(existing, invalidExisting);
            changed = true;
        }
        if (changed) {
            ShardMerger.writeCanonical(existing, paths.canonicalFile(), paths.csvFile());
            ShardMerger.deleteShards(paths.shardRoot(), leftovers);
        }

        Set<PairKey> existingKeys = existing.stream().map(MappingResult::pair).collect(Collectors.toSet());
        List<PairKey> pending = ResumeFilter.filter(requested.pairs(), existingKeys);
        int skipped = requested.size() - pending.size();
        if (skipped > 0) {
            logger.info("Skipping {} pairs that already have a mapping", skipped);
        }

        RunReport report = new RunReport(List.of(), Duration.ZERO);
        if (pending.isEmpty()) {
            logger.info("No pending pairs, all {} requested mappings exist", requested.size());
        } else {
            logger.info("Computing {} mappings with {} thread(s)", pending.size(), threads);
            List<WorkChunk> chunks = WorkPartitioner.partition(pending, threads);
            report = new ParallelExecutor(threads, environmentFactory, paths.shardLayout()).execute(chunks);
        }
        for (ChunkOutcome failure : report.failures()) {
            logger.warn("Chunk {} failed, pending pairs: {}", failure.chunkIndex(), failure.failedPairs());
        }

        ShardMerger.MergeResult merged =
            ShardMerger.merge(paths.shardRoot(), ShardLayout.shardFileMatcher(), existing);
        List<MappingResult> results = new ArrayList<>(merged.results());
        Set<PairKey> alreadyRetried = new HashSet<>(existingRepair.stillInvalid());
        List<Integer> invalidMerged = new ArrayList<>();
        for (int index : ValidityChecker.invalidIndices(results)) {
            if (!alreadyRetried.contains(results.get(index).pair())) {
                invalidMerged.add(index);
            }
        }
        RepairLoop.Report mergedRepair = new RepairLoop(environmentFactory).repair(results, invalidMerged);
        ShardMerger.writeCanonical(results, paths.canonicalFile(), paths.csvFile());
        if (ValidityChecker.invalidIndices(results).isEmpty()) {
            logger.info("All {} mappings valid", results.size());
        }

        if (keepShards) {
            logger.info("Keeping {} shard file(s) under {}", merged.shardFiles().size(), paths.shardRoot());
        } else {
            ShardMerger.deleteShards(paths.shardRoot(), merged.shardFiles());
        }

        return new MappingRunSummary(requested.size(), skipped, pending.size(), report.failedPairs(),
            existingRepair, mergedRepair, results.size(), paths.canonicalFile(),
            Duration.ofNanos(System.nanoTime() - start));
    }

    /// Computes a single pair directly, without partitioning or persisting anything.
    public static MappingResult solveSingle(SolverEnvironmentFactory environmentFactory, PairKey pair) {
        try (SolverEnvironment environment = environmentFactory.create()) {
            return environment.solve(pair);
        }
    }
}
