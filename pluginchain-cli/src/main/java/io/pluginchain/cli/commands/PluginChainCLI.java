package io.pluginchain.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the plugin chain command line.
///
/// Registers the subcommands:
/// - `plan` - Build a chain for a goal tag and render it as text, Mermaid or JSON
/// - `suggest` - Rank candidate chains for a free-text goal
/// - `validate` - Check a plugin descriptor manifest
///
/// @see ChainPlanCommand
/// @see ChainSuggestCommand
/// @see ManifestValidateCommand
@TopCommand
@Command(
        name = "pluginchain",
        mixinStandardHelpOptions = true,
        description = "Plugin Chain Orchestration Engine",
        subcommands = {ChainPlanCommand.class, ChainSuggestCommand.class, ManifestValidateCommand.class})
public class PluginChainCLI {}
