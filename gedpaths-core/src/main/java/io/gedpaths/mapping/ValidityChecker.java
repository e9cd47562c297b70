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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/// Detects corrupt node correspondences.
///
/// A result is invalid when either of its node maps assigns the same target more
/// than once. [MappingResult#UNMAPPED] entries mark insertions or deletions and are
/// not counted as duplicates. A result broken on one side is treated the same as
/// one broken on both.
public final class ValidityChecker {

    private ValidityChecker() {
    }

    public static boolean isValid(MappingResult result) {
        return isInjective(result.forwardMap()) && isInjective(result.backwardMap());
    }

    /// @return indices of the invalid entries in `results`, ascending; empty when all are valid
    public static List<Integer> invalidIndices(List<MappingResult> results) {
        List<Integer> invalid = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            if (!isValid(results.get(i))) {
                invalid.add(i);
            }
        }
        return invalid;
    }

    static boolean isInjective(int[] map) {
        BitSet seen = new BitSet();
        for (int target : map) {
            if (target == MappingResult.UNMAPPED) {
                continue;
            }
            if (target < 0 || seen.get(target)) {
                return false;
            }
            seen.set(target);
        }
        return true;
    }
}
