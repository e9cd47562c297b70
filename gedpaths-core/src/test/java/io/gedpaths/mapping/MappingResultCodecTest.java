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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingResultCodecTest {

    private static final MappingResult FIRST = new MappingResult(new PairKey(0, 1), 3.0, 2.0, 3.0,
        new int[]{1, 0, MappingResult.UNMAPPED}, new int[]{1, 0}, 0.25);
    private static final MappingResult SECOND = new MappingResult(new PairKey(2, 7), 0.5, 0.0, 1.5,
        new int[]{}, new int[]{MappingResult.UNMAPPED}, 1e-3);

    @Test
    void recordLayoutIsLittleEndian() {
        ByteBuffer buffer = ByteBuffer.wrap(MappingResultCodec.encode(FIRST)).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(buffer.getInt()).isEqualTo(0);
        assertThat(buffer.getInt()).isEqualTo(1);
        assertThat(buffer.getDouble()).isEqualTo(3.0);
        assertThat(buffer.getDouble()).isEqualTo(2.0);
        assertThat(buffer.getDouble()).isEqualTo(3.0);
        assertThat(buffer.getDouble()).isEqualTo(0.25);
        assertThat(buffer.getInt()).isEqualTo(3);
        assertThat(new int[]{buffer.getInt(), buffer.getInt(), buffer.getInt()}).containsExactly(1, 0, -1);
        assertThat(buffer.getInt()).isEqualTo(2);
        assertThat(new int[]{buffer.getInt(), buffer.getInt()}).containsExactly(1, 0);
        assertThat(buffer.hasRemaining()).isFalse();
    }

    @Test
    void readsBackWhatWasWritten(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nested").resolve("m.bin");

        MappingResultCodec.write(file, List.of(FIRST, SECOND));

        assertThat(MappingResultCodec.read(file)).containsExactly(FIRST, SECOND);
        assertThat(Files.exists(dir.resolve("nested").resolve("m.bin.tmp"))).isFalse();
    }

    @Test
    void emptyFileHasNoRecords(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.bin");
        MappingResultCodec.write(file, List.of());

        assertThat(Files.size(file)).isZero();
        assertThat(MappingResultCodec.read(file)).isEmpty();
    }

    @Test
    void truncatedFileIsRejected(@TempDir Path dir) throws IOException {
        byte[] full = MappingResultCodec.encode(FIRST);
        Path file = dir.resolve("cut.bin");
        Files.write(file, Arrays.copyOf(full, full.length - 3));

        assertThatThrownBy(() -> MappingResultCodec.read(file))
            .isInstanceOf(EOFException.class)
            .hasMessageContaining(file.toString());
    }

    @Test
    void recordWithInvalidPairIsRejected(@TempDir Path dir) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(MappingResultCodec.encode(FIRST)).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(4, 0);
        Path file = dir.resolve("bad.bin");
        Files.write(file, buffer.array());

        assertThatThrownBy(() -> MappingResultCodec.read(file))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Corrupt mapping record");
    }
}
