package io.gedpaths.command;

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

import io.gedpaths.command.common.DatasetOption;
import io.gedpaths.command.common.RandomSeedOption;
import io.gedpaths.command.common.SingleGraphPairOption;
import io.gedpaths.editpath.EditPath;
import io.gedpaths.editpath.EditPathBuilder;
import io.gedpaths.editpath.EditPathGenerator;
import io.gedpaths.editpath.EditPathLayout;
import io.gedpaths.editpath.EditPathStore;
import io.gedpaths.editpath.InvalidCorrespondenceException;
import io.gedpaths.editpath.PathStrategy;
import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.pipeline.MappingPaths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Build edit paths from the canonical mappings of a method.
///
/// ## Usage
///
/// ```bash
/// gedpaths paths --db MUTAG --num-mappings 500 --path-strategy RANDOM --seed 3
/// gedpaths paths --db MUTAG --source-id 0 --target-id 4 --connected-only --force
/// ```
///
/// Invalid mappings are skipped with a warning naming the pair. Output goes to
/// `<paths>/<method>/<db>/<db>_edit_paths.bin` and `<db>_edit_paths_info.csv`.
@CommandLine.Command(
    name = "paths",
    header = "Build edit paths from computed mappings",
    description = "Derives the sequence of intermediate graphs between each mapped pair.",
    exitCodeList = {
        "0: Success, or output exists and --force was not given",
        "1: Configuration or input error, including a pair without mapping or no valid mapping",
        "2: Runtime or I/O error"
    }
)
public class CMD_paths implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_paths.class);

    @CommandLine.Mixin
    private DatasetOption datasetOption = new DatasetOption();

    @CommandLine.Option(
        names = {"--method"},
        description = "Method whose results are used (default: ${DEFAULT-VALUE})",
        defaultValue = "GREEDY"
    )
    private String method;

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private SingleGraphPairOption pairOption = new SingleGraphPairOption();

    @CommandLine.Option(
        names = {"--mappings"},
        description = "Root directory of mapping results (default: ${DEFAULT-VALUE})",
        defaultValue = "Results/Mappings/"
    )
    private Path mappingsRoot;

    @CommandLine.Option(
        names = {"--paths"},
        description = "Root directory for edit paths (default: ${DEFAULT-VALUE})",
        defaultValue = "Results/Paths/"
    )
    private Path pathsRoot;

    @CommandLine.Option(
        names = {"--num-mappings"},
        description = "Build paths for this many randomly chosen valid mappings (default: all)",
        defaultValue = "0"
    )
    private int numMappings;

    @CommandLine.Option(
        names = {"--path-strategy"},
        description = "Edit ordering: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "CANONICAL"
    )
    private PathStrategy pathStrategy;

    @CommandLine.Option(
        names = {"--connected-only"},
        description = "Prefer edits that keep the intermediate graph connected"
    )
    private boolean connectedOnly = false;

    @CommandLine.Option(
        names = {"--force"},
        description = "Overwrite existing edit path files"
    )
    private boolean force = false;

    @Override
    public Integer call() {
        try {
            if (numMappings < 0) {
                throw new IllegalArgumentException("--num-mappings must not be negative, got: " + numMappings);
            }
            GraphDataset dataset = datasetOption.loadDataset();
            MappingPaths mappingPaths = new MappingPaths(mappingsRoot, methodName(), dataset.name());
            if (!Files.isRegularFile(mappingPaths.canonicalFile())) {
                throw new NoSuchFileException(mappingPaths.canonicalFile().toString());
            }
            EditPathLayout layout = new EditPathLayout(pathsRoot, methodName(), dataset.name());
            if (EditPathStore.exists(layout.snapshotFile(), layout.infoFile()) && !force) {
                System.out.println("Edit paths already exist at " + layout.snapshotFile() + ", use --force to overwrite");
                return 0;
            }

            List<MappingResult> results = MappingResultCodec.read(mappingPaths.canonicalFile());
            logger.info("Loaded {} mappings from {}", results.size(), mappingPaths.canonicalFile());
            EditPathGenerator.Selection selection = EditPathGenerator.select(results, pairOption.getPair(dataset),
                numMappings, seedOption.getSeed());
            if (!selection.skippedInvalid().isEmpty()) {
                System.err.printf("Skipped %d invalid mappings: %s%n", selection.skippedInvalid().size(),
                    selection.skippedInvalid());
            }

            if (selection.selected().isEmpty()) {
                logger.error("No valid mappings to build edit paths from in {}", mappingPaths.canonicalFile());
                System.err.println("Error: No valid mappings to build edit paths from in "
                    + mappingPaths.canonicalFile());
                return 1;
            }

            EditPathBuilder builder = new EditPathBuilder(pathStrategy.create(seedOption.getSeed(), connectedOnly));
            List<EditPath> paths = new EditPathGenerator(dataset, builder).generate(selection.selected());
            EditPathStore.write(layout.snapshotFile(), layout.infoFile(), paths);

            long operations = paths.stream().mapToLong(EditPath::length).sum();
            System.out.printf("Built %d edit paths (%d operations) with strategy %s%s%n", paths.size(), operations,
                pathStrategy, connectedOnly ? " (connected only)" : "");
            System.out.printf("Snapshots: %s%n", layout.snapshotFile());
            System.out.printf("Operations: %s%n", layout.infoFile());
            return 0;
        } catch (NoSuchFileException e) {
            logger.error("Input file not found: {}", e.getFile());
            System.err.println("Error: File not found: " + e.getFile());
            return 1;
        } catch (InvalidCorrespondenceException e) {
            logger.error("Cannot build edit path: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Error building edit paths", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private String methodName() {
        return method.trim().toUpperCase(Locale.ROOT);
    }
}
