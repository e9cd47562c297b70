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

import io.gedpaths.mapping.PairKey;

/// Thrown when a node correspondence cannot be turned into an edit path.
public class InvalidCorrespondenceException extends RuntimeException {
    private final PairKey pair;

    public InvalidCorrespondenceException(PairKey pair, String message) {
        super("Invalid correspondence for pair " + pair + ": " + message);
        this.pair = pair;
    }

    public PairKey pair() {
        return pair;
    }
}
