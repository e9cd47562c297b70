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

import java.util.Arrays;
import java.util.Objects;

/// The outcome of one distance computation between the graphs of a [PairKey].
///
/// `forwardMap[i]` is the node of graph `b` that node `i` of graph `a` is mapped to,
/// `backwardMap[j]` the node of graph `a` that node `j` of graph `b` is mapped to.
/// [#UNMAPPED] marks a node that is deleted (forward) or inserted (backward).
///
/// The arrays are copied on construction and on access, so instances are immutable.
public final class MappingResult {

    /// Marker for a node without a counterpart.
    public static final int UNMAPPED = -1;

    private final PairKey pair;
    private final double distance;
    private final double lowerBound;
    private final double upperBound;
    private final int[] forwardMap;
    private final int[] backwardMap;
    private final double runtimeSeconds;

    public MappingResult(PairKey pair, double distance, double lowerBound, double upperBound,
                         int[] forwardMap, int[] backwardMap, double runtimeSeconds) {
        this.pair = Objects.requireNonNull(pair, "pair cannot be null");
        this.distance = distance;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.forwardMap = Objects.requireNonNull(forwardMap, "forwardMap cannot be null").clone();
        this.backwardMap = Objects.requireNonNull(backwardMap, "backwardMap cannot be null").clone();
        this.runtimeSeconds = runtimeSeconds;
    }

    public PairKey pair() {
        return pair;
    }

    public double distance() {
        return distance;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    public int[] forwardMap() {
        return forwardMap.clone();
    }

    public int[] backwardMap() {
        return backwardMap.clone();
    }

    public int forwardSize() {
        return forwardMap.length;
    }

    public int backwardSize() {
        return backwardMap.length;
    }

    public int forward(int sourceNode) {
        return forwardMap[sourceNode];
    }

    public int backward(int targetNode) {
        return backwardMap[targetNode];
    }

    public double runtimeSeconds() {
        return runtimeSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappingResult)) {
            return false;
        }
        MappingResult that = (MappingResult) o;
        return Double.compare(distance, that.distance) == 0
            && Double.compare(lowerBound, that.lowerBound) == 0
            && Double.compare(upperBound, that.upperBound) == 0
            && Double.compare(runtimeSeconds, that.runtimeSeconds) == 0
            && pair.equals(that.pair)
            && Arrays.equals(forwardMap, that.forwardMap)
            && Arrays.equals(backwardMap, that.backwardMap);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(pair, distance, lowerBound, upperBound, runtimeSeconds);
        result = 31 * result + Arrays.hashCode(forwardMap);
        return 31 * result + Arrays.hashCode(backwardMap);
    }

    @Override
    public String toString() {
        return "MappingResult{" + pair + ", distance=" + distance + ", bounds=[" + lowerBound + ", " + upperBound
            + "], forward=" + Arrays.toString(forwardMap) + ", backward=" + Arrays.toString(backwardMap) + "}";
    }
}
