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

import java.util.ArrayList;
import java.util.List;

/// Restricts a delegate to edits that leave the graph connected, whenever any exist.
///
/// If every legal edit would disconnect the graph the delegate chooses among all of
/// them, so a path is always produced.
public class ConnectivityPreservingStrategy implements EditOrderingStrategy {
    private final EditOrderingStrategy delegate;

    public ConnectivityPreservingStrategy(EditOrderingStrategy delegate) {
        this.delegate = delegate;
    }

    @Override
    public Edit pick(List<Edit> legalEdits, WorkingGraph current) {
        List<Edit> connected = new ArrayList<>(legalEdits.size());
        for (Edit edit : legalEdits) {
            if (current.isConnectedAfter(edit)) {
                connected.add(edit);
            }
        }
        return delegate.pick(connected.isEmpty() ? legalEdits : connected, current);
    }
}
