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
import io.gedpaths.mapping.PairKey;
import picocli.CommandLine;

import java.util.Optional;

/**
 * Shared options selecting one source/target graph pair instead of a batch.
 */
public class SingleGraphPairOption {

    @CommandLine.Option(
        names = {"--source-id"},
        description = "Source graph id; requires --target-id"
    )
    private Integer sourceId;

    @CommandLine.Option(
        names = {"--target-id"},
        description = "Target graph id; requires --source-id"
    )
    private Integer targetId;

    public boolean isSpecified() {
        return sourceId != null || targetId != null;
    }

    /**
     * Gets the selected pair, checking both ids against the dataset.
     *
     * @param dataset the dataset the ids refer to
     * @return the pair, or empty if neither id was given
     * @throws IllegalArgumentException if only one id is given, the ids are equal, or an id is out of range
     */
    public Optional<PairKey> getPair(GraphDataset dataset) {
        if (!isSpecified()) {
            return Optional.empty();
        }
        if (sourceId == null || targetId == null) {
            throw new IllegalArgumentException("--source-id and --target-id must be given together");
        }
        dataset.checkId(sourceId);
        dataset.checkId(targetId);
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("--source-id and --target-id must differ, got " + sourceId);
        }
        return Optional.of(new PairKey(sourceId, targetId));
    }
}
