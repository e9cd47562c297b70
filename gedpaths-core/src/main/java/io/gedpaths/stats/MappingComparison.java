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

import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Joins the mappings of two methods on their pair and compares the distances.
///
/// A method is better on a pair when its distance is smaller.
public final class MappingComparison {

    public static final String CSV_HEADER = "id1,id2,distance_a,distance_b,difference";

    /// One joined pair; `difference` is `distanceA - distanceB`.
    public record Row(PairKey pair, double distanceA, double distanceB) {
        public double difference() {
            return distanceA - distanceB;
        }
    }

    private final List<Row> rows;

    private MappingComparison(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    /// Joins `a` and `b` on their pairs, in the order of `a`.
    public static MappingComparison compare(List<MappingResult> a, List<MappingResult> b) {
        Map<PairKey, MappingResult> byPair = new HashMap<>();
        for (MappingResult result : b) {
            byPair.putIfAbsent(result.pair(), result);
        }
        List<Row> rows = new ArrayList<>();
        for (MappingResult result : a) {
            MappingResult other = byPair.get(result.pair());
            if (other != null) {
                rows.add(new Row(result.pair(), result.distance(), other.distance()));
            }
        }
        return new MappingComparison(rows);
    }

    public List<Row> rows() {
        return rows;
    }

    public int commonPairs() {
        return rows.size();
    }

    public int aBetter() {
        return (int) rows.stream().filter(r -> r.distanceA() < r.distanceB()).count();
    }

    public int bBetter() {
        return (int) rows.stream().filter(r -> r.distanceB() < r.distanceA()).count();
    }

    public int equal() {
        return commonPairs() - aBetter() - bBetter();
    }

    public ValueStatistics differences() {
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = rows.get(i).difference();
        }
        return ValueStatistics.compute("DistanceDifference", values);
    }

    /// @throws IOException if the file cannot be written
    public void writeCsv(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (Row row : rows) {
                writer.write(String.format(Locale.ROOT, "%d,%d,%s,%s,%s", row.pair().a(), row.pair().b(),
                    StatisticsExporter.format(row.distanceA()), StatisticsExporter.format(row.distanceB()),
                    StatisticsExporter.format(row.difference())));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IOException("Failed to write comparison CSV " + file + ": " + e.getMessage(), e);
        }
    }
}
