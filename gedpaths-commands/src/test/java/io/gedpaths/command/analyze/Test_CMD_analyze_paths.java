package io.gedpaths.command.analyze;

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

import io.gedpaths.command.CMD_gedpaths;
import io.gedpaths.command.ToyDataset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class Test_CMD_analyze_paths {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    private Path paths;

    @BeforeEach
    public void setUp() throws IOException {
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        Path processed = ToyDataset.write(tempDir.resolve("processed"));
        Path mappings = tempDir.resolve("mappings");
        paths = tempDir.resolve("paths");
        assertThat(CMD_gedpaths.commandLine().execute("mappings", "--db", ToyDataset.NAME,
            "--processed", processed.toString(), "--mappings", mappings.toString())).isZero();
        assertThat(CMD_gedpaths.commandLine().execute("paths", "--db", ToyDataset.NAME,
            "--processed", processed.toString(), "--mappings", mappings.toString(),
            "--paths", paths.toString())).isZero();
        outContent.reset();
    }

    @AfterEach
    public void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void writesStatisticsToEvaluationDirectory() throws IOException {
        int exitCode = CMD_gedpaths.commandLine().execute("analyze", "paths", "--db", ToyDataset.NAME,
            "--paths", paths.toString(), "--buckets", "4");

        assertThat(exitCode).isZero();
        Path evaluation = paths.resolve("GREEDY").resolve(ToyDataset.NAME).resolve("Evaluation");
        assertThat(evaluation.resolve("EditPathLength.csv")).isRegularFile();
        assertThat(Files.readAllLines(evaluation.resolve("EditPathLength.csv"))).hasSize(ToyDataset.ALL_PAIRS + 1);
        List<String> buckets = Files.readAllLines(evaluation.resolve("NodeInsert_Buckets.csv"));
        assertThat(buckets).hasSize(4 + 1);
        assertThat(evaluation.resolve("EdgeDelete_Positions.csv")).isRegularFile();
        assertThat(outContent.toString())
            .contains("Edit paths: " + ToyDataset.ALL_PAIRS)
            .contains("ConnectedSnapshotFraction");
    }

    @Test
    public void customOutputDirectory() {
        Path out = tempDir.resolve("stats");

        assertThat(CMD_gedpaths.commandLine().execute("analyze", "paths", "--db", ToyDataset.NAME,
            "--paths", paths.toString(), "--out", out.toString())).isZero();

        assertThat(out.resolve("SnapshotNodeCount.csv")).isRegularFile();
    }

    @Test
    public void missingPathsAreAnInputError() {
        assertThat(CMD_gedpaths.commandLine().execute("analyze", "paths", "--db", "OTHER",
            "--paths", paths.toString())).isEqualTo(1);
        assertThat(errContent.toString()).contains("OTHER_edit_paths.bin");
    }

    @Test
    public void zeroBucketsIsRejected() {
        assertThat(CMD_gedpaths.commandLine().execute("analyze", "paths", "--db", ToyDataset.NAME,
            "--paths", paths.toString(), "--buckets", "0")).isEqualTo(1);
    }
}
