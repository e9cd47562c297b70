package io.gedpaths.stats;

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

import io.gedpaths.editpath.EditOperation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/// Writes a [PathStatisticsSummary] as one CSV file per metric or category.
///
/// ```text
/// <dir>/<Metric>.csv              value      one row per sample
/// <dir>/<Category>_Positions.csv  positions  one row per path, comma-joined step indices
/// <dir>/<Category>_Buckets.csv    value      one row per bucket
/// ```
public final class StatisticsExporter {
    private static final Logger logger = LogManager.getLogger(StatisticsExporter.class);

    public static final String VALUE_HEADER = "value";
    public static final String POSITIONS_HEADER = "positions";

    private StatisticsExporter() {
    }

    /// Writes all files into `dir`, creating it if needed.
    ///
    /// @return the files written
    /// @throws IOException if the directory or a file cannot be written
    public static List<Path> write(Path dir, PathStatisticsSummary summary) throws IOException {
        Files.createDirectories(dir);
        List<Path> written = new ArrayList<>();
        for (ValueStatistics metric : summary.metrics().values()) {
            List<String> rows = new ArrayList<>(metric.count());
            for (double value : metric.values()) {
                rows.add(format(value));
            }
            written.add(writeRows(dir.resolve(metric.name() + ".csv"), VALUE_HEADER, rows));
        }
        for (EditOperation operation : EditOperation.values()) {
            List<String> positionRows = summary.positions(operation).stream()
                .map(steps -> steps.stream().map(String::valueOf).collect(Collectors.joining(",")))
                .collect(Collectors.toList());
            written.add(writeRows(dir.resolve(operation.displayName() + "_Positions.csv"), POSITIONS_HEADER,
                positionRows));

            List<String> bucketRows = new ArrayList<>(summary.bucketCount());
            for (int total : summary.bucketTotals(operation)) {
                bucketRows.add(String.valueOf(total));
            }
            written.add(writeRows(dir.resolve(operation.displayName() + "_Buckets.csv"), VALUE_HEADER, bucketRows));
        }
        logger.info("Wrote {} statistics files to {}", written.size(), dir);
        return written;
    }

    private static Path writeRows(Path file, String header, List<String> rows) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file)) {
            writer.write(header);
            writer.newLine();
            for (String row : rows) {
                writer.write(row);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IOException("Failed to write statistics file " + file + ": " + e.getMessage(), e);
        }
        return file;
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
