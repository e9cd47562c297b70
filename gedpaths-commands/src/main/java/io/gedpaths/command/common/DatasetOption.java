package io.gedpaths.command.common;

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

import io.gedpaths.graph.GraphDataset;
import io.gedpaths.graph.io.JsonDatasetLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Shared dataset selection options.
 * Provides {@code --db} and {@code --processed} and loads the selected dataset.
 */
public class DatasetOption {
    private static final Logger logger = LogManager.getLogger(DatasetOption.class);

    @CommandLine.Option(
        names = {"--db", "--dataset"},
        description = "Dataset name (default: ${DEFAULT-VALUE})",
        defaultValue = "MUTAG"
    )
    private String datasetName;

    @CommandLine.Option(
        names = {"--processed"},
        description = "Directory holding processed datasets as <db>.json (default: ${DEFAULT-VALUE})",
        defaultValue = "Data/ProcessedGraphs/"
    )
    private Path processedPath;

    public Path getDatasetFile() {
        return JsonDatasetLoader.datasetFile(datasetName, processedPath);
    }

    /**
     * Loads the selected dataset.
     *
     * @return the loaded dataset
     * @throws NoSuchFileException if the dataset file does not exist
     * @throws IOException if the dataset file cannot be read
     */
    public GraphDataset loadDataset() throws IOException {
        Path file = getDatasetFile();
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "dataset file not found");
        }
        GraphDataset dataset = new JsonDatasetLoader().loadDataset(datasetName, processedPath);
        logger.info("Loaded dataset {} with {} graphs", dataset.name(), dataset.size());
        return dataset;
    }
}
