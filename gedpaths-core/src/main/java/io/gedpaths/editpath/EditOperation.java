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

import java.util.Locale;

/// One of the six elementary edit categories.
public enum EditOperation {
    NODE_INSERT(ObjectKind.NODE, EditType.INSERT),
    NODE_DELETE(ObjectKind.NODE, EditType.DELETE),
    NODE_RELABEL(ObjectKind.NODE, EditType.RELABEL),
    EDGE_INSERT(ObjectKind.EDGE, EditType.INSERT),
    EDGE_DELETE(ObjectKind.EDGE, EditType.DELETE),
    EDGE_RELABEL(ObjectKind.EDGE, EditType.RELABEL);

    private final ObjectKind objectKind;
    private final EditType editType;

    EditOperation(ObjectKind objectKind, EditType editType) {
        this.objectKind = objectKind;
        this.editType = editType;
    }

    public ObjectKind objectKind() {
        return objectKind;
    }

    public EditType editType() {
        return editType;
    }

    public static EditOperation of(ObjectKind objectKind, EditType editType) {
        for (EditOperation operation : values()) {
            if (operation.objectKind == objectKind && operation.editType == editType) {
                return operation;
            }
        }
        throw new IllegalArgumentException("No operation for " + objectKind + " " + editType);
    }

    /// Parses a persisted operation name such as `NODE_INSERT`, ignoring case.
    public static EditOperation parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown edit operation: " + text, e);
        }
    }

    /// Label used in file names and reports, e.g. `Node Insert` becomes `NodeInsert`.
    public String displayName() {
        String kind = objectKind.name().charAt(0) + objectKind.name().substring(1).toLowerCase(Locale.ROOT);
        String type = editType.name().charAt(0) + editType.name().substring(1).toLowerCase(Locale.ROOT);
        return kind + type;
    }
}
