package io.gedpaths.solver;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/// Lookup of [SolverProvider] implementations on the class path.
public final class SolverProviders {

    private SolverProviders() {
    }

    /// Returns all registered providers.
    public static List<SolverProvider> all() {
        List<SolverProvider> providers = new ArrayList<>();
        for (SolverProvider provider : ServiceLoader.load(SolverProvider.class)) {
            providers.add(provider);
        }
        return providers;
    }

    /// Finds the provider for a method name, ignoring case.
    public static Optional<SolverProvider> find(String method) {
        String wanted = method.trim().toUpperCase(Locale.ROOT);
        return all().stream().filter(p -> p.name().equalsIgnoreCase(wanted)).findFirst();
    }

    /// Returns the names of all registered methods.
    public static List<String> names() {
        return all().stream().map(SolverProvider::name).sorted().toList();
    }

    /// Creates a factory for environments of the configured method over `dataset`.
    ///
    /// @throws IllegalArgumentException if no provider is registered for the method
    public static SolverEnvironmentFactory factory(GraphDataset dataset, SolverConfig config) {
        SolverProvider provider = find(config.method()).orElseThrow(() -> new IllegalArgumentException(
            "Unknown solver method: " + config.method() + " (available: " + String.join(", ", names()) + ")"));
        return () -> provider.create(dataset, config);
    }
}
