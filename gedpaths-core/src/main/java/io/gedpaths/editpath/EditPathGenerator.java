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

import io.gedpaths.graph.GraphDataset;
import io.gedpaths.mapping.MappingResult;
import io.gedpaths.mapping.PairKey;
import io.gedpaths.mapping.ValidityChecker;
import io.gedpaths.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/// Selects mappings and builds their edit paths over a dataset.
public class EditPathGenerator {
    private static final Logger logger = LogManager.getLogger(EditPathGenerator.class);

    private final GraphDataset dataset;
    private final EditPathBuilder builder;

    public EditPathGenerator(GraphDataset dataset, EditPathBuilder builder) {
        this.dataset = dataset;
        this.builder = builder;
    }

    /// The mappings chosen for path generation.
    ///
    /// @param selected valid mappings to build, sorted by pair
    /// @param skippedInvalid pairs skipped because their mapping is invalid
    public record Selection(List<MappingResult> selected, List<PairKey> skippedInvalid) {
        public Selection {
            selected = List.copyOf(selected);
            skippedInvalid = List.copyOf(skippedInvalid);
        }
    }

    /// Chooses the valid mappings to build paths for.
    ///
    /// @param results canonical mappings
    /// @param only restrict to this pair
    /// @param limit when positive, keep this many valid mappings drawn with `seed`
    /// @param seed sampling seed
    /// @throws IllegalArgumentException if `only` names a pair that has no mapping
    public static Selection select(List<MappingResult> results, Optional<PairKey> only, int limit, long seed) {
        if (only.isPresent() && results.stream().noneMatch(r -> r.pair().equals(only.get()))) {
            throw new IllegalArgumentException("No mapping found for pair " + only.get());
        }
        List<MappingResult> valid = new ArrayList<>();
        List<PairKey> skipped = new ArrayList<>();
        for (MappingResult result : results) {
            if (only.isPresent() && !only.get().equals(result.pair())) {
                continue;
            }
            if (ValidityChecker.isValid(result)) {
                valid.add(result);
            } else {
                skipped.add(result.pair());
                logger.warn("Skipping invalid mapping for pair {}", result.pair());
            }
        }
        logger.info("{} valid mappings considered, {} invalid skipped", valid.size(), skipped.size());

        if (limit > 0 && limit < valid.size()) {
            UniformRandomProvider rng = RandomGenerators.create(seed);
            RandomGenerators.shuffle(valid, rng);
            valid = new ArrayList<>(valid.subList(0, limit));
            logger.info("Sampled {} mappings with seed {}", limit, seed);
        }
        valid.sort(Comparator.comparing(MappingResult::pair));
        return new Selection(valid, skipped);
    }

    /// Builds one path per mapping, in the given order.
    ///
    /// @throws InvalidCorrespondenceException if a mapping does not fit its graphs
    public List<EditPath> generate(List<MappingResult> mappings) {
        List<EditPath> paths = new ArrayList<>(mappings.size());
        for (MappingResult mapping : mappings) {
            PairKey pair = mapping.pair();
            EditPath path = builder.build(mapping, dataset.graph(pair.a()), dataset.graph(pair.b()));
            logger.debug("Built path for pair {} with {} operations", pair, path.length());
            paths.add(path);
        }
        logger.info("Built {} edit paths", paths.size());
        return paths;
    }
}
