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
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.PairKey;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PairSetTest {

    private final GraphDataset dataset = TestGraphs.toyDataset();

    @Test
    void allPairsAreSortedAndComplete() {
        PairSet set = PairSet.allPairs(4);

        assertThat(set.pairs()).containsExactly(
            new PairKey(0, 1), new PairKey(0, 2), new PairKey(0, 3),
            new PairKey(1, 2), new PairKey(1, 3), new PairKey(2, 3));
    }

    @Test
    void ofNormalizesAndDeduplicates() {
        PairSet set = PairSet.of(List.of(new PairKey(2, 1), new PairKey(1, 2), new PairKey(0, 3)));

        assertThat(set.pairs()).containsExactly(new PairKey(0, 3), new PairKey(1, 2));
    }

    @Nested
    class Sampling {

        @Test
        void sameSeedSameSample() {
            assertThat(PairSet.sample(20, 15, 42).pairs()).isEqualTo(PairSet.sample(20, 15, 42).pairs());
        }

        @Test
        void sampleHasRequestedSizeAndIsSorted() {
            PairSet set = PairSet.sample(10, 12, 7);

            assertThat(set.size()).isEqualTo(12);
            assertThat(set.pairs()).isSorted();
            assertThat(set.pairs()).allSatisfy(p -> assertThat(p.b()).isLessThan(10));
        }

        @Test
        void canSampleEveryPair() {
            assertThat(PairSet.sample(5, 10, 1).pairs()).isEqualTo(PairSet.allPairs(5).pairs());
        }

        @Test
        void rejectsTooManyPairs() {
            assertThatThrownBy(() -> PairSet.sample(4, 7, 1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class IdFiles {

        @Test
        void singleIdsYieldAllPairsAmongThem(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ids.txt");
            Files.writeString(file, "# subset\n3\n0\n\n4\n");

            PairSet set = PairSet.fromIdFile(file, dataset);

            assertThat(set.pairs()).containsExactly(new PairKey(0, 3), new PairKey(0, 4), new PairKey(3, 4));
        }

        @Test
        void idPairsYieldExactlyThosePairs(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ids.txt");
            Files.writeString(file, "4 1\n0 2\n");

            PairSet set = PairSet.fromIdFile(file, dataset);

            assertThat(set.pairs()).containsExactly(new PairKey(0, 2), new PairKey(1, 4));
        }

        @Test
        void writtenPairsReadBack(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("graph_ids.txt");
            PairSet sample = PairSet.sample(dataset.size(), 4, 3);

            sample.writeTo(file);

            assertThat(PairSet.fromIdFile(file, dataset).pairs()).isEqualTo(sample.pairs());
        }

        @Test
        void rejectsOutOfRangeId(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ids.txt");
            Files.writeString(file, "0 9\n");

            assertThatThrownBy(() -> PairSet.fromIdFile(file, dataset))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("9");
        }

        @Test
        void rejectsMixedForms(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("ids.txt");
            Files.writeString(file, "0 1\n2\n");

            assertThatThrownBy(() -> PairSet.fromIdFile(file, dataset))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mixes");
        }

        @Test
        void missingFileIsAnIoError(@TempDir Path dir) {
            assertThatThrownBy(() -> PairSet.fromIdFile(dir.resolve("absent.txt"), dataset))
                .isInstanceOf(IOException.class);
        }
    }
}
