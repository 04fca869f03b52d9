package io.pluginchain.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.Goal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChainVisualizerTest {

    private final ChainVisualizer visualizer = new ChainVisualizer(List.of(
            new TextVisualizationFormat(), new MermaidVisualizationFormat(), new JsonVisualizationFormat()));

    @Test
    void shouldListFormatsSorted() {
        assertThat(visualizer.getAvailableFormats()).containsExactly("json", "mermaid", "text");
    }

    @Test
    void shouldDispatchByName() throws Exception {
        Chain chain = TextVisualizationFormatTest.buildChain(Goal.of("report"));

        assertThat(visualizer.visualize(chain, "mermaid", false)).startsWith("```mermaid");
        assertThat(visualizer.visualize(chain, "json", false)).contains("\"id\" : \"" + chain.getId() + "\"");
    }

    @Test
    void shouldRejectUnknownFormat() throws Exception {
        Chain chain = TextVisualizationFormatTest.buildChain(Goal.of("report"));

        assertThatThrownBy(() -> visualizer.visualize(chain, "dot", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: dot. Available: json, mermaid, text");
    }

    @Test
    void shouldRejectDuplicateFormatNames() {
        assertThatThrownBy(() -> new ChainVisualizer(
                        List.of(new TextVisualizationFormat(), new TextVisualizationFormat())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("text");
    }
}
