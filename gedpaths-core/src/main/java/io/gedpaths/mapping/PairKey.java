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

import java.util.Comparator;

/// An unordered pair of graph ids, normalized so that `a < b`.
///
/// Equality and ordering are lexicographic on `(a, b)`, so sorting a collection of
/// keys gives the canonical processing and output order.
///
/// @param a the smaller graph id
/// @param b the larger graph id
public record PairKey(int a, int b) implements Comparable<PairKey> {

    public static final Comparator<PairKey> ORDER =
        Comparator.comparingInt(PairKey::a).thenComparingInt(PairKey::b);

    public PairKey {
        if (a < 0 || b < 0) {
            throw new IllegalArgumentException("graph ids must be non-negative: (" + a + ", " + b + ")");
        }
        if (a == b) {
            throw new IllegalArgumentException("a pair needs two distinct graph ids, got (" + a + ", " + b + ")");
        }
        if (a > b) {
            int tmp = a;
            a = b;
            b = tmp;
        }
    }

    /// Creates a normalized key from two ids in any order.
    public static PairKey of(int x, int y) {
        return new PairKey(x, y);
    }

    @Override
    public int compareTo(PairKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + a + ", " + b + ")";
    }
}
