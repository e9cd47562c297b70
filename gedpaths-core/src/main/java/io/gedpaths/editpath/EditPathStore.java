package io.gedpaths.editpath;

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

import io.gedpaths.graph.LabeledGraph;
import io.gedpaths.mapping.PairKey;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Persists edit paths as a snapshot file plus an operation side file.
///
/// The snapshot file concatenates every snapshot of every path in path order, each
/// laid out little-endian as:
///
/// ```
/// sourceId (4B) | targetId (4B) | step (4B) | nodeCount (4B) | int[nodeCount] labels
/// edgeCount (4B) | edgeCount x (u (4B), v (4B), label (4B))
/// ```
///
/// The side file is a CSV with header `source_id,step,target_id,operation` and one row
/// per operation; row `step` names the edit from snapshot `step` to snapshot `step + 1`.
public final class EditPathStore {

    public static final String INFO_HEADER = "source_id,step,target_id,operation";

    private EditPathStore() {
    }

    /// Writes `paths` to the two files, replacing them. Both files are written to
    /// sibling temporary files first and only moved into place once both are complete.
    ///
    /// @throws IOException if either file cannot be written
    public static void write(Path snapshotFile, Path infoFile, List<EditPath> paths) throws IOException {
        createParent(snapshotFile);
        createParent(infoFile);
        Path snapshotTmp = temporarySibling(snapshotFile);
        Path infoTmp = temporarySibling(infoFile);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(snapshotTmp))) {
                for (EditPath path : paths) {
                    for (int step = 0; step < path.snapshots().size(); step++) {
                        out.write(encode(path.pair(), step, path.snapshot(step)));
                    }
                }
            } catch (IOException e) {
                throw new IOException("Failed to write edit paths to " + snapshotFile + ": " + e.getMessage(), e);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(infoTmp)) {
                writer.write(INFO_HEADER);
                writer.newLine();
                for (EditPath path : paths) {
                    for (EditStep step : path.steps()) {
                        writer.write(step.sourceId() + "," + step.step() + "," + step.targetId() + ","
                            + step.operation().name());
                        writer.newLine();
                    }
                }
            } catch (IOException e) {
                throw new IOException("Failed to write edit path info to " + infoFile + ": " + e.getMessage(), e);
            }
            moveIntoPlace(infoTmp, infoFile);
            moveIntoPlace(snapshotTmp, snapshotFile);
        } finally {
            Files.deleteIfExists(snapshotTmp);
            Files.deleteIfExists(infoTmp);
        }
    }

    /// Checks whether both files of a previous [#write] are present.
    public static boolean exists(Path snapshotFile, Path infoFile) {
        return Files.isRegularFile(snapshotFile) && Files.isRegularFile(infoFile);
    }

    /// Reads paths back, pairing the snapshots of each path with its operations.
    ///
    /// @throws IOException if a file cannot be read, is truncated, or the two files disagree
    public static List<EditPath> read(Path snapshotFile, Path infoFile) throws IOException {
        Map<PairKey, List<LabeledGraph>> snapshots = readSnapshots(snapshotFile);
        Map<PairKey, List<EditStep>> steps = readSteps(infoFile);
        List<EditPath> paths = new ArrayList<>(snapshots.size());
        for (Map.Entry<PairKey, List<LabeledGraph>> entry : snapshots.entrySet()) {
            List<EditStep> pathSteps = steps.getOrDefault(entry.getKey(), List.of());
            try {
                paths.add(new EditPath(entry.getKey(), entry.getValue(), pathSteps));
            } catch (IllegalArgumentException e) {
                throw new IOException("Inconsistent edit path files " + snapshotFile + " and " + infoFile + ": "
                    + e.getMessage(), e);
            }
        }
        for (PairKey pair : steps.keySet()) {
            if (!snapshots.containsKey(pair)) {
                throw new IOException("Operations for pair " + pair + " in " + infoFile + " have no snapshots in "
                    + snapshotFile);
            }
        }
        return paths;
    }

    static byte[] encode(PairKey pair, int step, LabeledGraph graph) {
        int size = 4 * 4 + 4 * graph.nodeCount() + 4 + 12 * graph.edgeCount();
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(pair.a());
        buffer.putInt(pair.b());
        buffer.putInt(step);
        buffer.putInt(graph.nodeCount());
        for (int label : graph.nodeLabels()) {
            buffer.putInt(label);
        }
        buffer.putInt(graph.edgeCount());
        for (LabeledGraph.Edge edge : graph.edges()) {
            buffer.putInt(edge.u());
            buffer.putInt(edge.v());
            buffer.putInt(edge.label());
        }
        return buffer.array();
    }

    private static Map<PairKey, List<LabeledGraph>> readSnapshots(Path file) throws IOException {
        Map<PairKey, List<LabeledGraph>> byPair = new LinkedHashMap<>();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] head = new byte[16];
            int first;
            while ((first = in.read()) >= 0) {
                head[0] = (byte) first;
                readFully(in, head, 1, head.length - 1, file);
                ByteBuffer buffer = ByteBuffer.wrap(head).order(ByteOrder.LITTLE_ENDIAN);
                int sourceId = buffer.getInt();
                int targetId = buffer.getInt();
                int step = buffer.getInt();
                int[] labels = readInts(in, buffer.getInt(), file);
                int[] edgeData = readInts(in, 3 * readInts(in, 1, file)[0], file);
                List<LabeledGraph.Edge> edges = new ArrayList<>(edgeData.length / 3);
                PairKey pair;
                try {
                    for (int i = 0; i < edgeData.length; i += 3) {
                        edges.add(new LabeledGraph.Edge(edgeData[i], edgeData[i + 1], edgeData[i + 2]));
                    }
                    pair = new PairKey(sourceId, targetId);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Corrupt snapshot record in " + file + ": " + e.getMessage(), e);
                }
                List<LabeledGraph> pathSnapshots = byPair.computeIfAbsent(pair, k -> new ArrayList<>());
                if (step != pathSnapshots.size()) {
                    throw new IOException("Snapshot " + step + " of pair " + pair + " in " + file
                        + " is out of order, expected step " + pathSnapshots.size());
                }
                try {
                    pathSnapshots.add(LabeledGraph.of(sourceId + "_" + targetId + "_" + step, labels, edges));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Corrupt snapshot record in " + file + ": " + e.getMessage(), e);
                }
            }
        }
        return byPair;
    }

    private static Map<PairKey, List<EditStep>> readSteps(Path file) throws IOException {
        Map<PairKey, List<EditStep>> byPair = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            String header = reader.readLine();
            if (header == null || !header.trim().equals(INFO_HEADER)) {
                throw new IOException("Missing header '" + INFO_HEADER + "' in " + file);
            }
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split(",");
                if (fields.length != 4) {
                    throw new IOException("Malformed line " + lineNumber + " in " + file + ": " + line);
                }
                try {
                    EditStep step = new EditStep(Integer.parseInt(fields[0].trim()), Integer.parseInt(fields[1].trim()),
                        Integer.parseInt(fields[2].trim()), EditOperation.parse(fields[3]));
                    byPair.computeIfAbsent(new PairKey(step.sourceId(), step.targetId()), k -> new ArrayList<>())
                        .add(step);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Malformed line " + lineNumber + " in " + file + ": " + e.getMessage(), e);
                }
            }
        }
        return byPair;
    }

    private static int[] readInts(InputStream in, int count, Path file) throws IOException {
        if (count < 0) {
            throw new IOException("Corrupt snapshot record in " + file + ": negative length " + count);
        }
        byte[] bytes = new byte[4 * count];
        readFully(in, bytes, 0, bytes.length, file);
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = buffer.getInt();
        }
        return values;
    }

    private static void readFully(InputStream in, byte[] target, int offset, int length, Path file)
        throws IOException {
        int done = 0;
        while (done < length) {
            int read = in.read(target, offset + done, length - done);
            if (read < 0) {
                throw new EOFException("Truncated snapshot record in " + file);
            }
            done += read;
        }
    }

    static Path temporarySibling(Path file) {
        return file.resolveSibling(file.getFileName() + ".tmp");
    }

    private static void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
