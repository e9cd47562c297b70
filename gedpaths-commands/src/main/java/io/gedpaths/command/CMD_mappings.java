package io.gedpaths.command;

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

import io.gedpaths.command.common.DatasetOption;
import io.gedpaths.command.common.ParallelExecutionOption;
import io.gedpaths.command.common.RandomSeedOption;
import io.gedpaths.command.common.SingleGraphPairOption;
import io.gedpaths.command.common.SolverOption;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.pipeline.MappingPaths;
import io.gedpaths.pipeline.MappingPipeline;
import io.gedpaths.pipeline.MappingRunSummary;
import io.gedpaths.pipeline.PairSet;
import io.gedpaths.solver.SolverEnvironmentFactory;
import io.gedpaths.solver.SolverProviders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.Callable;

/// Compute node mappings between graph pairs of a dataset.
///
/// ## Usage
///
/// ```bash
/// # all pairs of MUTAG with 8 worker threads
/// gedpaths mappings --db MUTAG --threads 8
///
/// # 1000 sampled pairs, reproducible
/// gedpaths mappings --db MUTAG --num-pairs 1000 --seed 7
///
/// # one pair, printed only
/// gedpaths mappings --db MUTAG --source-id 3 --target-id 17
/// ```
///
/// Results go to `<mappings>/<method>/<db>/<db>_ged_mapping.bin` with a CSV sibling.
/// Pairs that already have a result are skipped, so an interrupted run can be
/// restarted with the same arguments.
@CommandLine.Command(
    name = "mappings",
    header = "Compute node mappings between graph pairs",
    description = "Computes, merges, validates and repairs pairwise mappings into one canonical result file.",
    exitCodeList = {
        "0: Success",
        "1: Configuration or input error",
        "2: Runtime or I/O error, or pairs left pending"
    }
)
public class CMD_mappings implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_mappings.class);

    @CommandLine.Mixin
    private DatasetOption datasetOption = new DatasetOption();

    @CommandLine.Mixin
    private SolverOption solverOption = new SolverOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private SingleGraphPairOption pairOption = new SingleGraphPairOption();

    @CommandLine.Option(
        names = {"--mappings"},
        description = "Root directory for mapping results (default: ${DEFAULT-VALUE})",
        defaultValue = "Results/Mappings/"
    )
    private Path mappingsRoot;

    @CommandLine.Option(
        names = {"--num-pairs"},
        description = "Compute this many randomly sampled pairs instead of all pairs"
    )
    private Integer numPairs;

    @CommandLine.Option(
        names = {"--graph-ids"},
        description = "File with one graph id per line (all pairs among them) or two ids per line (explicit pairs)"
    )
    private Path graphIdsFile;

    @CommandLine.Option(
        names = {"--keep-shards"},
        description = "Keep per-chunk shard files after merging"
    )
    private boolean keepShards = false;

    @Override
    public Integer call() {
        try {
            GraphDataset dataset = datasetOption.loadDataset();
            SolverEnvironmentFactory factory = SolverProviders.factory(dataset, solverOption.toConfig());

            Optional<PairKey> single = pairOption.getPair(dataset);
            if (single.isPresent()) {
                printSingle(MappingPipeline.solveSingle(factory, single.get()));
                return 0;
            }

            int threads = parallelOption.getThreadCount();
            if (parallelOption.exceedsAvailableCores()) {
                logger.warn("{} threads requested but only {} cores available", threads,
                    Runtime.getRuntime().availableProcessors());
            }
            MappingPaths paths = new MappingPaths(mappingsRoot, solverOption.getMethod(), dataset.name());
            PairSet pairs = selectPairs(dataset, paths);
            logger.info("Requested {} pairs of dataset {} with method {}", pairs.size(), dataset.name(),
                solverOption.getMethod());

            MappingRunSummary summary = new MappingPipeline(factory, paths, threads, keepShards).run(pairs);
            printSummary(summary);
            return summary.failedPairs().isEmpty() ? 0 : 2;
        } catch (NoSuchFileException e) {
            logger.error("Input file not found: {}", e.getFile());
            System.err.println("Error: File not found: " + e.getFile());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Error computing mappings", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private PairSet selectPairs(GraphDataset dataset, MappingPaths paths) throws IOException {
        if (graphIdsFile != null) {
            if (!Files.isRegularFile(graphIdsFile)) {
                throw new NoSuchFileException(graphIdsFile.toString());
            }
            return PairSet.fromIdFile(graphIdsFile, dataset);
        }
        if (numPairs != null) {
            PairSet sampled = PairSet.sample(dataset.size(), numPairs, seedOption.getSeed());
            sampled.writeTo(paths.graphIdsFile());
            logger.info("Sampled {} pairs with seed {}, written to {}", sampled.size(), seedOption.getSeed(),
                paths.graphIdsFile());
            return sampled;
        }
        return PairSet.allPairs(dataset.size());
    }

    private static void printSingle(MappingResult result) {
        System.out.printf("Pair: %s%n", result.pair());
        System.out.printf("Distance: %s%n", result.distance());
        System.out.printf("Lower bound: %s%n", result.lowerBound());
        System.out.printf("Upper bound: %s%n", result.upperBound());
        System.out.printf("Runtime: %.6fs%n", result.runtimeSeconds());
        System.out.printf("Forward map: %s%n", Arrays.toString(result.forwardMap()));
        System.out.printf("Backward map: %s%n", Arrays.toString(result.backwardMap()));
    }

    private static void printSummary(MappingRunSummary summary) {
        System.out.printf("Requested pairs:   %d%n", summary.requestedPairs());
        System.out.printf("Already computed:  %d%n", summary.skippedPairs());
        System.out.printf("Computed this run: %d%n", summary.scheduledPairs() - summary.failedPairs().size());
        System.out.printf("Total results:     %d (%s)%n", summary.totalResults(), summary.canonicalFile());
        int repaired = summary.existingRepair().repaired().size() + summary.mergedRepair().repaired().size();
        if (repaired > 0) {
            System.out.printf("Repaired mappings: %d%n", repaired);
        }
        if (summary.invalidPairs().isEmpty()) {
            System.out.println("All mappings valid");
        } else {
            System.out.printf("Invalid mappings:  %d %s%n", summary.invalidPairs().size(), summary.invalidPairs());
        }
        if (!summary.failedPairs().isEmpty()) {
            System.err.printf("Failed pairs (left pending): %d %s%n", summary.failedPairs().size(),
                summary.failedPairs());
        }
        System.out.printf("Elapsed: %.2fs%n", summary.elapsed().toMillis() / 1000.0);
    }
}
