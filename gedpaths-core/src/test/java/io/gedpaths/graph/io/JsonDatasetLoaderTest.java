package io.gedpaths.graph.io;

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
import io.gedpaths.graph.LabeledGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonDatasetLoaderTest {

    private final JsonDatasetLoader loader = new JsonDatasetLoader();

    @Test
    void readsDocumentWithOptionalEdgeLabels(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("MINI.json"), """
            {
              "name": "MINI",
              "graphs": [
                {"name": "a", "node_labels": [6, 7, 6], "edges": [[0, 1, 2], [1, 2]]},
                {"node_labels": [1]}
              ]
            }
            """);

        GraphDataset dataset = loader.loadDataset("MINI", dir);

        assertThat(dataset.name()).isEqualTo("MINI");
        assertThat(dataset.size()).isEqualTo(2);
        LabeledGraph first = dataset.graph(0);
        assertThat(first.nodeLabels()).containsExactly(6, 7, 6);
        assertThat(first.edgeLabel(0, 1)).isEqualTo(2);
        assertThat(first.edgeLabel(1, 2)).isEqualTo(0);
        assertThat(dataset.graph(1).name()).isEqualTo("MINI_1");
    }

    @Test
    void savedDatasetLoadsIdentically(@TempDir Path dir) throws IOException {
        GraphDataset original = TestGraphs.toyDataset();

        Path file = loader.saveDataset(original, dir);
        GraphDataset loaded = loader.loadDataset("TOY", dir);

        assertThat(file).isEqualTo(JsonDatasetLoader.datasetFile("TOY", dir));
        assertThat(loaded.graphs()).isEqualTo(original.graphs());
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.loadDataset("NOPE", dir))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("NOPE.json");
    }

    @Test
    void malformedJsonIsAnIoError(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("BAD.json"), "{\"graphs\": [ {\"node_labels\": \"x\"} ]");

        assertThatThrownBy(() -> loader.loadDataset("BAD", dir)).isInstanceOf(IOException.class);
    }

    @Test
    void edgeOutOfRangeIsAnIoError(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("EDGE.json"), "{\"graphs\": [{\"node_labels\": [0, 0], \"edges\": [[0, 5]]}]}");

        assertThatThrownBy(() -> loader.loadDataset("EDGE", dir))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Invalid graph");
    }
}
