package io.pluginchain.cli.visualizer;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainEdge;
import io.pluginchain.core.chain.ChainNode;
import jakarta.enterprise.context.ApplicationScoped;

/// Mermaid flowchart rendering of a chain, wrapped in a Markdown code block.
///
/// ### Shapes
/// - plugin node: rectangle labelled with the plugin name
/// - goal node: stadium shape
/// - seed input: parallelogram feeding its consumers
///
/// Edges are labelled with the type tag they carry. Color settings are ignored.
///
/// @implNote Thread-safe. Stateless rendering.
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(Chain chain, boolean useColor) {
        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart LR\n");

        for (String seed : chain.getGoal().seedInputs()) {
            sb.append("    ").append(seedId(seed)).append("[/\"").append(escape(seed)).append("\"/]\n");
        }
        for (ChainNode node : chain.getNodes()) {
            String id = sanitizeId(node.id());
            String label = escape(node.pluginName());
            if (node.id().equals(chain.getGoalNodeId())) {
                sb.append("    ").append(id).append("([\"").append(label).append("\"])\n");
            } else {
                sb.append("    ").append(id).append("[\"").append(label).append("\"]\n");
            }
        }

        for (ChainEdge edge : chain.getEdges()) {
            sb.append("    ").append(sanitizeId(edge.producerId()))
                    .append(" -->|\"").append(escape(edge.tag())).append("\"| ")
                    .append(sanitizeId(edge.consumerId())).append('\n');
        }
        for (ChainNode node : chain.getNodes()) {
            for (String seed : node.seedInputs()) {
                sb.append("    ").append(seedId(seed)).append(" -.-> ")
                        .append(sanitizeId(node.id())).append('\n');
            }
        }

        sb.append("```\n");
        return sb.toString();
    }

    private String seedId(String tag) {
        return "seed_" + tag.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        if (isReservedKeyword(sanitized)) {
            return "node_" + sanitized;
        }
        return sanitized;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase()) {
            case "end", "subgraph", "graph", "flowchart", "direction", "click", "style", "classdef",
                    "class", "linkstyle" -> true;
            default -> false;
        };
    }
}
