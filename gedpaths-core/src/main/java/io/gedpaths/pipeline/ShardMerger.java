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

import io.gedpaths.mapping.MappingCsvExporter;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.PairKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Merges shard files into one canonical, sorted, duplicate-free result set.
///
/// Entries are deduplicated by [PairKey] with the first writer winning: results that
/// were already canonical come first, then shards in path order. Every dropped
/// duplicate is logged. A missing or empty shard root is not an error.
public final class ShardMerger {
    private static final Logger logger = LogManager.getLogger(ShardMerger.class);

    /// The merged result set and the shard files it was built from.
    ///
    /// @param results merged results sorted by pair
    /// @param shardFiles the shard files that were read
    /// @param duplicates number of entries dropped as duplicates
    public record MergeResult(List<MappingResult> results, List<Path> shardFiles, int duplicates) {
    }

    private ShardMerger() {
    }

    /// Merges every file below `shardRoot` that `matcher` accepts into `existing`.
    ///
    /// @throws IOException if a shard cannot be read; the message names the file
    public static MergeResult merge(Path shardRoot, Predicate<Path> matcher, Collection<MappingResult> existing)
        throws IOException {
        Map<PairKey, MappingResult> merged = new LinkedHashMap<>();
        int duplicates = 0;
        for (MappingResult result : existing) {
            if (merged.putIfAbsent(result.pair(), result) != null) {
                duplicates++;
                logger.warn("Duplicate canonical entry for pair {} ignored", result.pair());
            }
        }

        List<Path> shardFiles = findShards(shardRoot, matcher);
        for (Path shard : shardFiles) {
            List<MappingResult> shardResults;
            try {
                shardResults = MappingResultCodec.read(shard);
            } catch (IOException e) {
                throw new IOException("Failed to read shard " + shard + ": " + e.getMessage(), e);
            }
            for (MappingResult result : shardResults) {
                if (merged.putIfAbsent(result.pair(), result) != null) {
                    duplicates++;
                    logger.warn("Duplicate result for pair {} in shard {} ignored (first writer wins)",
                        result.pair(), shard);
                }
            }
        }

        List<MappingResult> sorted = new ArrayList<>(merged.values());
        sorted.sort(Comparator.comparing(MappingResult::pair));
        logger.info("Merged {} shard file(s) and {} existing result(s) into {} result(s)",
            shardFiles.size(), existing.size(), sorted.size());
        return new MergeResult(sorted, shardFiles, duplicates);
    }

    /// Finds the shard files below a root, in path order.
    ///
    /// @throws IOException if the directory tree cannot be listed
    public static List<Path> findShards(Path shardRoot, Predicate<Path> matcher) throws IOException {
        if (!Files.isDirectory(shardRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(shardRoot)) {
            return paths.filter(Files::isRegularFile)
                .filter(matcher)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /// Writes the canonical binary file and its CSV sibling.
    ///
    /// @throws IOException if either file cannot be written
    public static void writeCanonical(List<MappingResult> results, Path binaryFile, Path csvFile) throws IOException {
        MappingResultCodec.write(binaryFile, results);
        MappingCsvExporter.write(csvFile, results);
        logger.info("Wrote {} results to {} and {}", results.size(), binaryFile, csvFile);
    }

    /// Deletes consumed shard files and any directories below `shardRoot` left empty.
    ///
    /// @throws IOException if the directory tree cannot be listed
    public static void deleteShards(Path shardRoot, List<Path> shardFiles) throws IOException {
        for (Path shard : shardFiles) {
            Files.deleteIfExists(shard);
        }
        if (!Files.isDirectory(shardRoot)) {
            return;
        }
        List<Path> dirs;
        try (Stream<Path> paths = Files.walk(shardRoot)) {
            dirs = paths.filter(Files::isDirectory)
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        }
        for (Path dir : dirs) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                }
            } catch (IOException e) {
                logger.warn("Could not remove shard directory {}: {}", dir, e.getMessage());
            }
        }
    }
}
