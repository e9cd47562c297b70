package io.gedpaths.command;

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

import io.gedpaths.command.analyze.CMD_analyze;
import picocli.CommandLine;

/// Tools for computing graph mappings and edit paths over graph datasets
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "gedpaths",
    mixinStandardHelpOptions = true,
    version = "gedpaths 0.1.0",
    subcommands = {
        CMD_mappings.class,
        CMD_paths.class,
        CMD_analyze.class
    })
public class CMD_gedpaths {

    /// Create the configured command line
    /// @return the command line for the top level command
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_gedpaths()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /// run a gedpaths command
    /// @param args command line args
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
