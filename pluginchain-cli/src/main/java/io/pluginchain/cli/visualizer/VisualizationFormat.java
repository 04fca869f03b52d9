package io.pluginchain.cli.visualizer;

import io.pluginchain.core.chain.Chain;

/// Strategy interface for rendering chains in different output formats.
///
/// Implementations are discovered via CDI and registered in {@link ChainVisualizer}.
///
/// ### Built-in Formats
/// - `text` - boxed node list in execution order ({@link TextVisualizationFormat})
/// - `mermaid` - Mermaid flowchart ({@link MermaidVisualizationFormat})
/// - `json` - the serialized chain ({@link JsonVisualizationFormat})
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection, never null
    String getName();

    /// Renders the chain in this format.
    ///
    /// @param chain the chain to render, not null
    /// @param useColor whether ANSI color codes may be emitted
    /// @return formatted representation, never null
    String render(Chain chain, boolean useColor);
}
