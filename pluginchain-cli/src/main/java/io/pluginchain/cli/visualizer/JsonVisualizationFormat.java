package io.pluginchain.cli.visualizer;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.serialization.ChainSerializer;
import jakarta.enterprise.context.ApplicationScoped;

/// Renders the chain as its JSON serialization, suitable for saving and reloading.
@ApplicationScoped
public class JsonVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public String render(Chain chain, boolean useColor) {
        return ChainSerializer.toJson(chain) + "\n";
    }
}
