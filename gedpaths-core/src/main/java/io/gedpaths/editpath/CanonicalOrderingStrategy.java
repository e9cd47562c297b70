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

import java.util.Comparator;
import java.util.List;

/// Deletions first, then insertions, then relabels; node edits before edge edits of
/// the same type; ties broken by node ids.
public class CanonicalOrderingStrategy implements EditOrderingStrategy {

    public static final Comparator<Edit> CANONICAL_ORDER = Comparator
        .comparing(Edit::editType)
        .thenComparing(Edit::objectKind)
        .thenComparingInt(Edit::u)
        .thenComparingInt(Edit::v);

    @Override
    public Edit pick(List<Edit> legalEdits, WorkingGraph current) {
        return legalEdits.stream().min(CANONICAL_ORDER).orElseThrow();
    }
}
