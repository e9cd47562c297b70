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

import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.pipeline.MappingPaths;
import io.gedpaths.stats.MappingComparison;
import io.gedpaths.stats.ValueStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Summarize the canonical mappings of a method, optionally against a second method.
@CommandLine.Command(
    name = "mappings",
    header = "Summarize computed mappings",
    description = "Reports validity and distance/runtime statistics, and compares two methods on shared pairs.",
    exitCodeList = {
        "0: Success",
        "1: Mapping file not found",
        "2: Error reading or writing files"
    }
)
public class CMD_analyze_mappings implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_analyze_mappings.class);

    @CommandLine.Option(
        names = {"--db", "--dataset"},
        description = "Dataset name (default: ${DEFAULT-VALUE})",
        defaultValue = "MUTAG"
    )
    private String datasetName;

    @CommandLine.Option(
        names = {"--method"},
        description = "Method whose mappings are analyzed (default: ${DEFAULT-VALUE})",
        defaultValue = "GREEDY"
    )
    private String method;

    @CommandLine.Option(
        names = {"--compare-method"},
        description = "Second method to compare distances with"
    )
    private String compareMethod;

    @CommandLine.Option(
        names = {"--mappings"},
        description = "Root directory of mapping results (default: ${DEFAULT-VALUE})",
        defaultValue = "Results/Mappings/"
    )
    private Path mappingsRoot;

    @CommandLine.Option(
        names = {"--csv-out"},
        description = "Write the per-pair comparison to this CSV file (requires --compare-method)"
    )
    private Path csvOut;

    @Override
    public Integer call() {
        try {
            if (csvOut != null && compareMethod == null) {
                throw new IllegalArgumentException("--csv-out requires --compare-method");
            }
            List<MappingResult> results = load(method);
            printOverview(method, results);

            if (compareMethod != null) {
                List<MappingResult> other = load(compareMethod);
                printOverview(compareMethod, other);
                MappingComparison comparison = MappingComparison.compare(results, other);
                printComparison(comparison);
                if (csvOut != null) {
                    comparison.writeCsv(csvOut);
                    System.out.printf("Comparison written to %s%n", csvOut);
                }
            }
            return 0;
        } catch (NoSuchFileException e) {
            logger.error("Mapping file not found: {}", e.getFile());
            System.err.println("Error: File not found: " + e.getFile());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Error analyzing mappings", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private List<MappingResult> load(String methodName) throws IOException {
        String normalized = methodName.trim().toUpperCase(Locale.ROOT);
        Path file = new MappingPaths(mappingsRoot, normalized, datasetName).canonicalFile();
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        List<MappingResult> results = MappingResultCodec.read(file);
        logger.info("Loaded {} mappings of {} from {}", results.size(), normalized, file);
        return results;
    }

    private static void printOverview(String methodName, List<MappingResult> results) {
        List<PairKey> invalid = new ArrayList<>();
        double[] distances = new double[results.size()];
        double[] runtimes = new double[results.size()];
        for (int i = 0; i < results.size(); i++) {
            MappingResult result = results.get(i);
            distances[i] = result.distance();
            runtimes[i] = result.runtimeSeconds();
            if (!ValidityChecker.isValid(result)) {
                invalid.add(result.pair());
            }
        }
        System.out.printf("Method %s: %d mappings, %d valid%n", methodName, results.size(),
            results.size() - invalid.size());
        if (!invalid.isEmpty()) {
            System.out.printf("  Invalid pairs: %s%n", invalid);
        }
        print(ValueStatistics.compute("Distance", distances));
        print(ValueStatistics.compute("Runtime", runtimes));
    }

    private static void print(ValueStatistics stats) {
        System.out.printf("  %-10s mean=%.4f stdDev=%.4f min=%.4f max=%.4f%n", stats.name(), stats.mean(),
            stats.stdDev(), stats.min(), stats.max());
    }

    private void printComparison(MappingComparison comparison) {
        System.out.printf("Common pairs: %d%n", comparison.commonPairs());
        System.out.printf("  %s better: %d%n", method, comparison.aBetter());
        System.out.printf("  %s better: %d%n", compareMethod, comparison.bBetter());
        System.out.printf("  Equal: %d%n", comparison.equal());
        print(comparison.differences());
    }
}
