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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/// Counts finished chunks and logs progress every 1% of the total.
///
/// Counting is lock-free; only the emission of a report line is serialized, so the
/// computation itself never waits on the reporter.
public class ChunkProgressReporter {
    private static final Logger logger = LogManager.getLogger(ChunkProgressReporter.class);

    private final int totalChunks;
    private final int cadence;
    private final AtomicInteger finished = new AtomicInteger();
    private final LongSupplier clock;
    private final long startNanos;
    private final Object printLock = new Object();
    private volatile String lastReport = "";

    public ChunkProgressReporter(int totalChunks) {
        this(totalChunks, System::nanoTime);
    }

    ChunkProgressReporter(int totalChunks, LongSupplier clock) {
        this.totalChunks = totalChunks;
        this.cadence = Math.max(1, totalChunks / 100);
        this.clock = clock;
        this.startNanos = clock.getAsLong();
    }

    /// Records one finished chunk (successful or not) and reports if due.
    ///
    /// @return the number of chunks finished so far
    public int chunkFinished() {
        int done = finished.incrementAndGet();
        if (done % cadence == 0 || done == totalChunks) {
            String line = format(done);
            synchronized (printLock) {
                lastReport = line;
                logger.info(line);
            }
        }
        return done;
    }

    public int finished() {
        return finished.get();
    }

    /// The most recently emitted report line.
    public String lastReport() {
        return lastReport;
    }

    String format(int done) {
        double elapsed = (clock.getAsLong() - startNanos) / 1e9;
        double rate = elapsed > 1e-9 ? done / elapsed : 0.0;
        double pct = totalChunks > 0 ? 100.0 * done / totalChunks : 100.0;
        double remaining = rate > 1e-9 ? (totalChunks - done) / rate : -1.0;
        return String.format(Locale.ROOT, "Progress: %d/%d chunks (%.1f%%), elapsed=%.1fs, rate=%.2f chunks/s, ETA=%s",
            done, totalChunks, pct, elapsed, rate, formatSeconds(remaining));
    }

    static String formatSeconds(double seconds) {
        if (seconds < 0) {
            return "unknown";
        }
        long s = Math.round(seconds);
        long h = s / 3600;
        long m = (s % 3600) / 60;
        long ss = s % 60;
        if (h > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", h, m, ss);
        }
        return String.format(Locale.ROOT, "%d:%02d", m, ss);
    }
}
