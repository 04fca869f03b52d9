package io.pluginchain.cli.visualizer;

import io.pluginchain.core.chain.Chain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.TreeMap;

/// Registry and dispatcher for chain visualization formats.
///
/// @implNote Thread-safe after construction. The format map is immutable.
/// @see VisualizationFormat
@ApplicationScoped
public class ChainVisualizer {

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with all CDI-discovered formats.
    ///
    /// @param formatInstances CDI-provided format implementations, not null
    @Inject
    public ChainVisualizer(Instance<VisualizationFormat> formatInstances) {
        this(formatInstances.stream().toList());
    }

    /// Creates a visualizer over an explicit format list.
    ///
    /// @param formatList format implementations with unique names, not null
    public ChainVisualizer(Iterable<VisualizationFormat> formatList) {
        Map<String, VisualizationFormat> byName = new TreeMap<>();
        for (VisualizationFormat format : formatList) {
            if (byName.putIfAbsent(format.getName(), format) != null) {
                throw new IllegalStateException("Duplicate visualization format: " + format.getName());
            }
        }
        this.formats = Map.copyOf(byName);
    }

    /// Renders a chain using the named format.
    ///
    /// @param chain the chain to render, not null
    /// @param formatName format name such as "text" or "mermaid", not null
    /// @param useColor whether ANSI color codes may be emitted
    /// @return rendered chain, never null
    /// @throws IllegalArgumentException if the format is not registered
    public String visualize(Chain chain, String formatName, boolean useColor) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: " + formatName + ". Available: "
                            + String.join(", ", new TreeMap<>(formats).keySet()));
        }
        return format.render(chain, useColor);
    }

    public Iterable<String> getAvailableFormats() {
        return new TreeMap<>(formats).keySet();
    }
}
