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

/// A pending elementary edit expressed on stable node ids.
///
/// Node edits use `u` as the node and ignore `v`; edge edits name the edge `(u, v)`
/// with `u < v`. `label` is the label after the edit and is unused for deletions.
///
/// @param operation edit category
/// @param u node id, or first edge endpoint
/// @param v second edge endpoint, `-1` for node edits
/// @param label new label
public record Edit(EditOperation operation, int u, int v, int label) {

    public static Edit node(EditOperation operation, int node, int label) {
        if (operation.objectKind() != ObjectKind.NODE) {
            throw new IllegalArgumentException("Not a node operation: " + operation);
        }
        return new Edit(operation, node, -1, label);
    }

    public static Edit edge(EditOperation operation, int u, int v, int label) {
        if (operation.objectKind() != ObjectKind.EDGE) {
            throw new IllegalArgumentException("Not an edge operation: " + operation);
        }
        return new Edit(operation, Math.min(u, v), Math.max(u, v), label);
    }

    public EditType editType() {
        return operation.editType();
    }

    public ObjectKind objectKind() {
        return operation.objectKind();
    }
}
