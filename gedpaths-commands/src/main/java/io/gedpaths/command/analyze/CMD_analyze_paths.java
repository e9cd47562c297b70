package io.gedpaths.command.analyze;

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
import io.gedpaths.editpath.EditOperation;
import io.gedpaths.editpath.EditPath;
import io.gedpaths.editpath.EditPathLayout;
import io.gedpaths.editpath.EditPathStore;
import io.gedpaths.stats.PathStatisticsAggregator;
import io.gedpaths.stats.PathStatisticsSummary;
import io.gedpaths.stats.StatisticsExporter;
import io.gedpaths.stats.ValueStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Aggregate statistics over persisted edit paths.
///
/// Reads `<db>_edit_paths.bin` and its info file, computes per-metric statistics and
/// position buckets, and writes one CSV per metric and category to `Evaluation/`.
@CommandLine.Command(
    name = "paths",
    header = "Aggregate edit path statistics",
    description = "Computes operation counts, positions, buckets and connectivity over edit paths.",
    exitCodeList = {
        "0: Success",
        "1: Edit path files not found or invalid option",
        "2: Error reading or writing files"
    }
)
public class CMD_analyze_paths implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_analyze_paths.class);

    @CommandLine.Option(
        names = {"--db", "--dataset"},
        description = "Dataset name (default: ${DEFAULT-VALUE})",
        defaultValue = "MUTAG"
    )
    private String datasetName;

    @CommandLine.Option(
        names = {"--method"},
        description = "Method whose results are used (default: ${DEFAULT-VALUE})",
        defaultValue = "GREEDY"
    )
    private String method;

    @CommandLine.Option(
        names = {"--paths"},
        description = "Root directory of edit paths (default: ${DEFAULT-VALUE})",
        defaultValue = "Results/Paths/"
    )
    private Path pathsRoot;

    @CommandLine.Option(
        names = {"--buckets"},
        description = "Number of position buckets (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int bucketCount;

    @CommandLine.Option(
        names = {"--out"},
        description = "Output directory for statistics files (default: <paths>/<method>/<db>/Evaluation)"
    )
    private Path outDir;

    @Override
    public Integer call() {
        try {
            EditPathLayout layout = new EditPathLayout(pathsRoot, methodName(), datasetName);
            for (Path file : List.of(layout.snapshotFile(), layout.infoFile())) {
                if (!Files.isRegularFile(file)) {
                    throw new NoSuchFileException(file.toString());
                }
            }
            List<EditPath> paths = EditPathStore.read(layout.snapshotFile(), layout.infoFile());
            logger.info("Read {} edit paths from {}", paths.size(), layout.snapshotFile());

            PathStatisticsSummary summary = new PathStatisticsAggregator(bucketCount).aggregate(paths);
            Path target = outDir != null ? outDir : layout.evaluationDir();
            List<Path> written = StatisticsExporter.write(target, summary);

            printSummary(summary);
            System.out.printf("%nWrote %d files to %s%n", written.size(), target);
            return 0;
        } catch (NoSuchFileException e) {
            logger.error("Edit path file not found: {}", e.getFile());
            System.err.println("Error: File not found: " + e.getFile());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Error analyzing edit paths", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private static void printSummary(PathStatisticsSummary summary) {
        System.out.printf("Edit paths: %d%n%n", summary.paths().size());
        System.out.printf("%-28s %8s %10s %10s %10s %10s%n", "Metric", "Count", "Mean", "StdDev", "Min", "Max");
        for (ValueStatistics stats : summary.metrics().values()) {
            System.out.printf("%-28s %8d %10.3f %10.3f %10.3f %10.3f%n", stats.name(), stats.count(), stats.mean(),
                stats.stdDev(), stats.min(), stats.max());
        }
        System.out.println();
        System.out.println("Operations per position bucket:");
        for (EditOperation operation : EditOperation.values()) {
            System.out.printf("%-14s %s%n", operation.displayName(), Arrays.toString(summary.bucketTotals(operation)));
        }
    }

    private String methodName() {
        return method.trim().toUpperCase(Locale.ROOT);
    }
}
