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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.graph.LabeledGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes graph datasets stored as JSON documents.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "name": "MUTAG",
 *   "graphs": [
 *     {"name": "MUTAG_0", "node_labels": [0, 0, 1], "edges": [[0, 1, 0], [1, 2, 1]]},
 *     ...
 *   ]
 * }
 * }</pre>
 *
 * <p>An edge entry may omit its label (two elements), in which case the label is 0.
 * The dataset {@code NAME} is read from {@code <path>/NAME.json}.
 */
public class JsonDatasetLoader implements DatasetLoader {
    private static final Logger logger = LogManager.getLogger(JsonDatasetLoader.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    static class DatasetDocument {
        @SerializedName("name")
        String name;

        @SerializedName("graphs")
        List<GraphDocument> graphs;
    }

    static class GraphDocument {
        @SerializedName("name")
        String name;

        @SerializedName("node_labels")
        int[] nodeLabels;

        @SerializedName("edges")
        int[][] edges;
    }

    /// Returns the file a dataset is read from.
    public static Path datasetFile(String name, Path path) {
        return path.resolve(name + ".json");
    }

    @Override
    public GraphDataset loadDataset(String name, Path path) throws IOException {
        Path file = datasetFile(name, path);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Dataset file not found: " + file);
        }
        DatasetDocument doc;
        try (Reader reader = Files.newBufferedReader(file)) {
            doc = GSON.fromJson(reader, DatasetDocument.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed dataset file " + file + ": " + e.getMessage(), e);
        }
        if (doc == null || doc.graphs == null) {
            throw new IOException("Dataset file " + file + " contains no graphs");
        }

        List<LabeledGraph> graphs = new ArrayList<>(doc.graphs.size());
        for (int i = 0; i < doc.graphs.size(); i++) {
            graphs.add(toGraph(name, i, doc.graphs.get(i), file));
        }
        logger.info("Loaded dataset {} with {} graphs from {}", name, graphs.size(), file);
        return new GraphDataset(doc.name != null ? doc.name : name, graphs);
    }

    private LabeledGraph toGraph(String dataset, int index, GraphDocument g, Path file) throws IOException {
        String graphName = g.name != null ? g.name : dataset + "_" + index;
        int[] labels = g.nodeLabels != null ? g.nodeLabels : new int[0];
        List<LabeledGraph.Edge> edges = new ArrayList<>();
        if (g.edges != null) {
            for (int[] e : g.edges) {
                if (e == null || e.length < 2 || e.length > 3) {
                    throw new IOException("Malformed edge in graph " + graphName + " of " + file);
                }
                edges.add(new LabeledGraph.Edge(e[0], e[1], e.length == 3 ? e[2] : 0));
            }
        }
        try {
            return LabeledGraph.of(graphName, labels, edges);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid graph " + graphName + " in " + file + ": " + e.getMessage(), e);
        }
    }

    /// Writes a dataset in the format read by [#loadDataset].
    ///
    /// @param dataset the dataset to write
    /// @param path the processed-data directory
    /// @return the written file
    /// @throws IOException if the file cannot be written
    public Path saveDataset(GraphDataset dataset, Path path) throws IOException {
        Files.createDirectories(path);
        DatasetDocument doc = new DatasetDocument();
        doc.name = dataset.name();
        doc.graphs = new ArrayList<>(dataset.size());
        for (LabeledGraph graph : dataset.graphs()) {
            GraphDocument g = new GraphDocument();
            g.name = graph.name();
            g.nodeLabels = graph.nodeLabels();
            g.edges = new int[graph.edgeCount()][];
            int i = 0;
            for (LabeledGraph.Edge e : graph.edges()) {
                g.edges[i++] = new int[]{e.u(), e.v(), e.label()};
            }
            doc.graphs.add(g);
        }
        Path file = datasetFile(dataset.name(), path);
        try (Writer writer = Files.newBufferedWriter(file)) {
            GSON.toJson(doc, writer);
        }
        return file;
    }
}
