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

import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/// The sorted, duplicate-free set of graph pairs a run works on.
///
/// Three sources are supported:
/// - [#allPairs] every unordered pair of a dataset
/// - [#fromIdFile] an id file, either one id per line (all pairs among the listed
///   ids) or two ids per line (explicit pairs)
/// - [#sample] a seeded uniform sample of distinct pairs
public final class PairSet {
    private static final Logger logger = LogManager.getLogger(PairSet.class);

    private final List<PairKey> pairs;

    private PairSet(Collection<PairKey> pairs) {
        this.pairs = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(pairs)));
    }

    /// Creates a pair set from arbitrary keys; the result is sorted and deduplicated.
    public static PairSet of(Collection<PairKey> pairs) {
        return new PairSet(pairs);
    }

    /// All pairs `(i, j)` with `0 <= i < j < graphCount`.
    public static PairSet allPairs(int graphCount) {
        List<PairKey> pairs = new ArrayList<>();
        for (int i = 0; i < graphCount; i++) {
            for (int j = i + 1; j < graphCount; j++) {
                pairs.add(new PairKey(i, j));
            }
        }
        return new PairSet(pairs);
    }

    /// All pairs among the given ids.
    ///
    /// @throws IllegalArgumentException if an id is out of range for `dataset`
    public static PairSet amongIds(Collection<Integer> ids, GraphDataset dataset) {
        TreeSet<Integer> distinct = new TreeSet<>(ids);
        for (int id : distinct) {
            dataset.checkId(id);
        }
        List<Integer> sorted = new ArrayList<>(distinct);
        List<PairKey> pairs = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                pairs.add(new PairKey(sorted.get(i), sorted.get(j)));
            }
        }
        return new PairSet(pairs);
    }

    /// Reads an id file.
    ///
    /// Blank lines and lines starting with `#` are skipped. A file whose lines all hold
    /// one id yields every pair among those ids; a file whose lines hold two ids
    /// yields exactly those pairs. Mixing both forms is an error.
    ///
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException on malformed lines or out-of-range ids
    public static PairSet fromIdFile(Path file, GraphDataset dataset) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Graph id file does not exist: " + file);
        }
        List<Integer> singles = new ArrayList<>();
        List<PairKey> explicit = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file)) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("[\\s,]+");
            try {
                if (parts.length == 1) {
                    singles.add(Integer.parseInt(parts[0]));
                } else if (parts.length == 2) {
                    int a = Integer.parseInt(parts[0]);
                    int b = Integer.parseInt(parts[1]);
                    dataset.checkId(a);
                    dataset.checkId(b);
                    explicit.add(new PairKey(a, b));
                } else {
                    throw new IllegalArgumentException("expected one or two ids");
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed graph id in " + file + " line " + lineNumber + ": '"
                    + trimmed + "'", e);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid entry in " + file + " line " + lineNumber + ": "
                    + e.getMessage(), e);
            }
        }
        if (!singles.isEmpty() && !explicit.isEmpty()) {
            throw new IllegalArgumentException("Graph id file " + file + " mixes single ids and id pairs");
        }
        PairSet set = explicit.isEmpty() ? amongIds(singles, dataset) : new PairSet(explicit);
        logger.info("Read {} pairs from id file {}", set.size(), file);
        return set;
    }

    /// Draws `count` distinct pairs uniformly at random.
    ///
    /// @param graphCount the dataset size
    /// @param count the number of pairs, at most `graphCount*(graphCount-1)/2`
    /// @param seed the random seed
    /// @throws IllegalArgumentException if `count` exceeds the number of available pairs
    public static PairSet sample(int graphCount, int count, long seed) {
        long available = (long) graphCount * (graphCount - 1) / 2;
        if (count < 0 || count > available) {
            throw new IllegalArgumentException("Cannot sample " + count + " pairs from " + available
                + " available pairs");
        }
        UniformRandomProvider rng = RandomGenerators.create(seed);
        Set<PairKey> chosen = new HashSet<>();
        while (chosen.size() < count) {
            int x = rng.nextInt(graphCount);
            int y = rng.nextInt(graphCount);
            if (x != y) {
                chosen.add(new PairKey(x, y));
            }
        }
        return new PairSet(chosen);
    }

    /// Returns the pairs in canonical order.
    public List<PairKey> pairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /// Writes the pairs, one `a b` line each.
    ///
    /// @throws IOException if the file cannot be written
    public void writeTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file)) {
            for (PairKey pair : pairs) {
                writer.write(pair.a() + " " + pair.b());
                writer.newLine();
            }
        }
    }
}
