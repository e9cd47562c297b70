package io.gedpaths.mapping;

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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
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
import java.util.Collection;
import java.util.List;

/// Binary encoding of [MappingResult] records.
///
/// A file is a plain concatenation of records, each laid out little-endian as:
///
/// ```
/// +--------+--------+-------------+---------------+---------------+-------------+
/// | a (4B) | b (4B) | dist (8B)   | lower (8B)    | upper (8B)    | runtime (8B)|
/// +--------+--------+-------------+---------------+---------------+-------------+
/// | n (4B) | int[n] forward map   | m (4B)        | int[m] backward map         |
/// +--------+----------------------+---------------+-----------------------------+
/// ```
public final class MappingResultCodec {

    private static final int FIXED_BYTES = 4 + 4 + 8 * 4;

    private MappingResultCodec() {
    }

    /// Writes records to `path`, replacing any existing file. The file is written to a
    /// sibling temporary file first and moved into place, so readers never observe a
    /// partially written file.
    ///
    /// @throws IOException if the file cannot be written
    public static void write(Path path, Collection<MappingResult> results) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
            for (MappingResult result : results) {
                out.write(encode(result));
            }
        } catch (IOException e) {
            throw new IOException("Failed to write mapping results to " + path + ": " + e.getMessage(), e);
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /// Reads all records from `path`.
    ///
    /// @throws IOException if the file cannot be read or ends inside a record
    public static List<MappingResult> read(Path path) throws IOException {
        List<MappingResult> results = new ArrayList<>();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            MappingResult next;
            while ((next = readRecord(in, path)) != null) {
                results.add(next);
            }
        }
        return results;
    }

    static byte[] encode(MappingResult result) {
        int n = result.forwardSize();
        int m = result.backwardSize();
        ByteBuffer buffer = ByteBuffer.allocate(FIXED_BYTES + 4 + 4 * n + 4 + 4 * m).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(result.pair().a());
        buffer.putInt(result.pair().b());
        buffer.putDouble(result.distance());
        buffer.putDouble(result.lowerBound());
        buffer.putDouble(result.upperBound());
        buffer.putDouble(result.runtimeSeconds());
        buffer.putInt(n);
        for (int v : result.forwardMap()) {
            buffer.putInt(v);
        }
        buffer.putInt(m);
        for (int v : result.backwardMap()) {
            buffer.putInt(v);
        }
        return buffer.array();
    }

    private static MappingResult readRecord(InputStream in, Path path) throws IOException {
        byte[] fixed = new byte[FIXED_BYTES + 4];
        int first = in.read();
        if (first < 0) {
            return null;
        }
        fixed[0] = (byte) first;
        readFully(in, fixed, 1, fixed.length - 1, path);
        ByteBuffer head = ByteBuffer.wrap(fixed).order(ByteOrder.LITTLE_ENDIAN);
        int a = head.getInt();
        int b = head.getInt();
        double distance = head.getDouble();
        double lower = head.getDouble();
        double upper = head.getDouble();
        double runtime = head.getDouble();
        int[] forward = readInts(in, head.getInt(), path);
        byte[] count = new byte[4];
        readFully(in, count, 0, 4, path);
        int[] backward = readInts(in, ByteBuffer.wrap(count).order(ByteOrder.LITTLE_ENDIAN).getInt(), path);
        try {
            return new MappingResult(new PairKey(a, b), distance, lower, upper, forward, backward, runtime);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt mapping record in " + path + ": " + e.getMessage(), e);
        }
    }

    private static int[] readInts(InputStream in, int count, Path path) throws IOException {
        if (count < 0) {
            throw new IOException("Corrupt mapping record in " + path + ": negative map length " + count);
        }
        byte[] bytes = new byte[4 * count];
        readFully(in, bytes, 0, bytes.length, path);
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = buffer.getInt();
        }
        return values;
    }

    private static void readFully(InputStream in, byte[] target, int offset, int length, Path path) throws IOException {
        int done = 0;
        while (done < length) {
            int read = in.read(target, offset + done, length - done);
            if (read < 0) {
                throw new EOFException("Truncated mapping record in " + path);
            }
            done += read;
        }
    }
}
