package io.gedpaths.mapping;

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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;

/// Writes the human-readable tabular sibling of a canonical mapping file.
public final class MappingCsvExporter {

    public static final String HEADER = "id1,id2,distance,lowerBound,upperBound,runtime";

    private MappingCsvExporter() {
    }

    /// Writes one row per result, in the order given.
    ///
    /// @throws IOException if the file cannot be written
    public static void write(Path path, Collection<MappingResult> results) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path)) {
            writer.write(HEADER);
            writer.newLine();
            for (MappingResult r : results) {
                writer.write(row(r));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IOException("Failed to write mapping CSV " + path + ": " + e.getMessage(), e);
        }
    }

    static String row(MappingResult r) {
        return String.format(Locale.ROOT, "%d,%d,%s,%s,%s,%s",
            r.pair().a(), r.pair().b(),
            format(r.distance()), format(r.lowerBound()), format(r.upperBound()), format(r.runtimeSeconds()));
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
