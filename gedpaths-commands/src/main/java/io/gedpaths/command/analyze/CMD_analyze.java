package io.gedpaths.command.analyze;

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

import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Umbrella command for analyzing computed mappings and edit paths.
@CommandLine.Command(name = "analyze",
    header = "Analyze mappings and edit paths",
    description = "Contains subcommands that summarize computed results",
    subcommands = {
        CMD_analyze_mappings.class,
        CMD_analyze_paths.class
    })
public class CMD_analyze implements Callable<Integer> {

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
