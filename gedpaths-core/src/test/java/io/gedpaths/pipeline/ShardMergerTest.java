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
import io.gedpaths.mapping.MappingCsvExporter;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.PairKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardMergerTest {

    private static MappingResult result(int a, int b, double distance) {
        return TestGraphs.result(a, b, distance, new int[]{0}, new int[]{0});
    }

    @Test
    void mergesSortsAndDeduplicatesFirstWriterWins(@TempDir Path dir) throws IOException {
        ShardLayout layout = new ShardLayout(dir, "TOY");
        layout.outputFor(0, 0).write(List.of(result(1, 2, 5), result(0, 3, 1)));
        layout.outputFor(1, 1).write(List.of(result(1, 2, 9), result(0, 1, 2)));

        ShardMerger.MergeResult merged = ShardMerger.merge(dir, ShardLayout.shardFileMatcher(), List.of());

        assertThat(merged.results()).extracting(MappingResult::pair)
            .containsExactly(new PairKey(0, 1), new PairKey(0, 3), new PairKey(1, 2));
        assertThat(merged.results().get(2).distance()).isEqualTo(5);
        assertThat(merged.duplicates()).isEqualTo(1);
        assertThat(merged.shardFiles()).hasSize(2);
    }

    @Test
    void existingResultsWinOverShards(@TempDir Path dir) throws IOException {
        ShardLayout layout = new ShardLayout(dir, "TOY");
        layout.outputFor(0, 0).write(List.of(result(0, 1, 7)));

        ShardMerger.MergeResult merged =
            ShardMerger.merge(dir, ShardLayout.shardFileMatcher(), List.of(result(0, 1, 3)));

        assertThat(merged.results()).singleElement().extracting(MappingResult::distance).isEqualTo(3.0);
    }

    @Test
    void emptyOrMissingShardRootProducesEmptyCanonicalFile(@TempDir Path dir) throws IOException {
        ShardMerger.MergeResult merged =
            ShardMerger.merge(dir.resolve("absent"), ShardLayout.shardFileMatcher(), List.of());
        Path bin = dir.resolve("TOY_ged_mapping.bin");
        Path csv = dir.resolve("TOY_ged_mapping.csv");

        ShardMerger.writeCanonical(merged.results(), bin, csv);

        assertThat(merged.results()).isEmpty();
        assertThat(Files.size(bin)).isZero();
        assertThat(Files.readAllLines(csv)).containsExactly(MappingCsvExporter.HEADER);
    }

    @Test
    void ignoresFilesThatAreNotShards(@TempDir Path dir) throws IOException {
        new ShardLayout(dir, "TOY").outputFor(0, 0).write(List.of(result(0, 1, 1)));
        Files.writeString(dir.resolve("notes.txt"), "not a shard");

        assertThat(ShardMerger.merge(dir, ShardLayout.shardFileMatcher(), List.of()).results()).hasSize(1);
    }

    @Test
    void unreadableShardIsReportedWithItsPath(@TempDir Path dir) throws IOException {
        Path shard = new ShardLayout(dir, "TOY").outputFor(0, 0).file();
        Files.createDirectories(shard.getParent());
        Files.write(shard, new byte[]{1, 0, 0});

        assertThatThrownBy(() -> ShardMerger.merge(dir, ShardLayout.shardFileMatcher(), List.of()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining(shard.toString());
    }

    @Test
    void deleteShardsRemovesFilesAndEmptyDirectories(@TempDir Path dir) throws IOException {
        Path root = dir.resolve("tmp");
        ShardLayout layout = new ShardLayout(root, "TOY");
        layout.outputFor(0, 0).write(List.of(result(0, 1, 1)));
        layout.outputFor(1, 3).write(List.of(result(0, 2, 1)));
        List<Path> shards = ShardMerger.findShards(root, ShardLayout.shardFileMatcher());

        ShardMerger.deleteShards(root, shards);

        assertThat(shards).allSatisfy(p -> assertThat(p).doesNotExist());
        assertThat(root).doesNotExist();
    }

    @Test
    void canonicalFilesMirrorEachOther(@TempDir Path dir) throws IOException {
        List<MappingResult> results = List.of(result(0, 1, 2), result(0, 2, 3.5));
        Path bin = dir.resolve("out.bin");
        Path csv = dir.resolve("out.csv");

        ShardMerger.writeCanonical(results, bin, csv);

        assertThat(MappingResultCodec.read(bin)).isEqualTo(results);
        assertThat(Files.readAllLines(csv)).hasSize(3)
            .element(2).asString().startsWith("0,2,3.500000,");
    }
}
