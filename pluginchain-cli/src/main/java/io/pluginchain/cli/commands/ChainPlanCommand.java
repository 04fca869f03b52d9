package io.pluginchain.cli.commands;

import io.pluginchain.cli.visualizer.ChainVisualizer;
import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.CyclicDependencyException;
import io.pluginchain.core.chain.Goal;
import io.pluginchain.core.chain.NoViableChainException;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/// CLI command that dry-builds a chain for a goal tag and renders it.
///
/// ### Usage
/// ```bash
/// pluginchain plan report [--seed data/raw]... [--format text|mermaid|json] [-m plugins.json]
/// ```
///
/// Nothing is executed; the plan shows which plugins would run, in which order, and which
/// producer feeds each input.
@CommandLine.Command(name = "plan", description = "Build a chain for a goal tag without running it")
class ChainPlanCommand extends ChainCommand {

    @CommandLine.Parameters(index = "0", description = "Required output type tag")
    String goalTag;

    @CommandLine.Option(
            names = "--seed",
            description = "Input tag supplied by the caller (repeatable)")
    List<String> seeds = new ArrayList<>();

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid, json")
    String format;

    @Inject ChainVisualizer visualizer;

    @Override
    protected boolean showBanner() {
        return "text".equals(format);
    }

    @Override
    protected void execute() {
        try {
            loadManifest();
            Chain chain = environment.getChainBuilder().buildChain(Goal.of(goalTag, seeds));
            System.out.print(visualizer.visualize(chain, format, useColor()));
        } catch (NoViableChainException e) {
            printFailure("No plugin produces '" + e.getUnresolvedTag() + "'");
            System.err.println("   Resolution path: " + String.join(" -> ", e.getResolutionPath()));
        } catch (CyclicDependencyException e) {
            printFailure("Cyclic dependency: " + String.join(" -> ", e.getCycle()));
        } catch (Exception e) {
            printFailure("Planning failed: " + e.getMessage());
        }
    }
}
