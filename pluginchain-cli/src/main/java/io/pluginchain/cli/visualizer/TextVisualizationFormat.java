package io.pluginchain.cli.visualizer;

import io.pluginchain.cli.ui.AnsiStyles;
import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainNode;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;

/// Text rendering of a chain: one box per node in execution order.
///
/// ```
/// Chain: chain-3f2a91c04b7e  (goal: report)
/// ──────────────────────────────────────────────────
///
/// ┌─ 1. Source
/// │  outputs: [data/raw]
/// └─
/// ┌─ 2. Transform
/// │  data/raw ← Source
/// │  outputs: [data/clean]
/// └─
/// ```
///
/// The goal node is marked with `(goal)`; seed inputs are listed as `← seed`.
///
/// @implNote Thread-safe. Stateless rendering.
/// @see MermaidVisualizationFormat for diagram output
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(Chain chain, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append(styles.bold("Chain:")).append(' ').append(styles.accent(chain.getId()))
                .append("  ").append(styles.gray("(goal: " + chain.getGoal().requiredOutputTag() + ")"))
                .append(nl);
        sb.append(styles.gray("─".repeat(50))).append(nl).append(nl);

        int position = 1;
        for (ChainNode node : chain.getNodes()) {
            sb.append(styles.boxTop()).append(' ').append(position++).append(". ")
                    .append(styles.accent(node.id()));
            if (!node.id().equals(node.pluginName())) {
                sb.append(' ').append(styles.gray("[" + node.pluginName() + "]"));
            }
            if (node.id().equals(chain.getGoalNodeId())) {
                sb.append(' ').append(styles.success("(goal)"));
            }
            sb.append(nl);
            for (Map.Entry<String, String> input : node.resolvedInputs().entrySet()) {
                sb.append(styles.boxMid()).append("  ").append(input.getKey()).append(" ← ")
                        .append(input.getValue()).append(nl);
            }
            for (String seed : node.seedInputs()) {
                sb.append(styles.boxMid()).append("  ").append(seed).append(" ← ")
                        .append(styles.warn("seed")).append(nl);
            }
            sb.append(styles.boxMid()).append("  ")
                    .append(styles.gray("outputs: " + node.outputTypes())).append(nl);
            sb.append(styles.boxBottom()).append(nl);
        }
        return sb.toString();
    }
}
