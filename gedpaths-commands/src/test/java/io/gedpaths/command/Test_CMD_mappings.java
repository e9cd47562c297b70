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

import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.MappingResultCodec;
import io.gedpaths.mapping.ValidityChecker;
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

public class Test_CMD_mappings {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    private Path processed;
    private Path mappings;

    @BeforeEach
    public void setUp() throws IOException {
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        processed = ToyDataset.write(tempDir.resolve("processed"));
        mappings = tempDir.resolve("mappings");
    }

    @AfterEach
    public void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int run(String... extra) {
        String[] base = {"mappings", "--db", ToyDataset.NAME, "--processed", processed.toString(),
            "--mappings", mappings.toString()};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return CMD_gedpaths.commandLine().execute(args);
    }

    private Path canonicalFile() {
        return mappings.resolve("GREEDY").resolve(ToyDataset.NAME).resolve("TOY_ged_mapping.bin");
    }

    @Test
    public void computesAllPairsInParallel() throws IOException {
        int exitCode = run("--threads", "3");

        assertThat(exitCode).isZero();
        List<MappingResult> results = MappingResultCodec.read(canonicalFile());
        assertThat(results).hasSize(ToyDataset.ALL_PAIRS).allMatch(ValidityChecker::isValid);
        assertThat(canonicalFile().resolveSibling("TOY_ged_mapping.csv")).isRegularFile();
        assertThat(canonicalFile().resolveSibling("tmp")).doesNotExist();
        assertThat(outContent.toString())
            .contains("Total results:     " + ToyDataset.ALL_PAIRS)
            .contains("All mappings valid");
    }

    @Test
    public void rerunSkipsComputedPairs() {
        assertThat(run()).isZero();
        outContent.reset();

        assertThat(run()).isZero();

        assertThat(outContent.toString())
            .contains("Already computed:  " + ToyDataset.ALL_PAIRS)
            .contains("Computed this run: 0");
    }

    @Test
    public void sampledPairsAreRecorded() throws IOException {
        assertThat(run("--num-pairs", "4", "--seed", "7")).isZero();

        Path idsFile = canonicalFile().resolveSibling("graph_ids.txt");
        assertThat(idsFile).isRegularFile();
        assertThat(Files.readAllLines(idsFile)).hasSize(4);
        assertThat(MappingResultCodec.read(canonicalFile())).hasSize(4);
    }

    @Test
    public void explicitPairFile() throws IOException {
        Path ids = Files.writeString(tempDir.resolve("ids.txt"), "0 3\n2 4\n");

        assertThat(run("--graph-ids", ids.toString())).isZero();

        assertThat(MappingResultCodec.read(canonicalFile())).extracting(r -> r.pair().a() + "-" + r.pair().b())
            .containsExactly("0-3", "2-4");
    }

    @Test
    public void singlePairIsPrintedOnly() {
        assertThat(run("--source-id", "0", "--target-id", "4")).isZero();

        assertThat(outContent.toString()).contains("Pair:").contains("Forward map: [");
        assertThat(mappings).doesNotExist();
    }

    @Test
    public void outOfRangeSourceIdIsAConfigurationError() {
        assertThat(run("--source-id", "9", "--target-id", "1")).isEqualTo(1);
        assertThat(errContent.toString()).contains("out of range");
    }

    @Test
    public void loneSourceIdIsAConfigurationError() {
        assertThat(run("--source-id", "1")).isEqualTo(1);
    }

    @Test
    public void unknownMethodIsAConfigurationError() {
        assertThat(run("--method", "NOPE")).isEqualTo(1);
        assertThat(errContent.toString()).contains("Unknown solver method");
    }

    @Test
    public void missingDatasetIsAConfigurationError() {
        int exitCode = CMD_gedpaths.commandLine().execute("mappings", "--db", "MISSING",
            "--processed", processed.toString(), "--mappings", mappings.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("File not found").contains("MISSING.json");
    }

    @Test
    public void unknownFlagIsRejected() {
        assertThat(run("--no-such-flag")).isEqualTo(2);
    }
}
