package io.pluginchain.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;

import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.chain.ChainBuilder;
import io.pluginchain.core.chain.Goal;
import io.pluginchain.core.plugin.PluginDescriptor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TextVisualizationFormatTest {

    private TextVisualizationFormat format;

    @BeforeEach
    void setUp() {
        format = new TextVisualizationFormat();
    }

    @Test
    void shouldReturnTextAsFormatName() {
        assertThat(format.getName()).isEqualTo("text");
    }

    @Test
    void shouldRenderChainHeader() throws Exception {
        Chain chain = buildChain(Goal.of("report"));

        String result = format.render(chain, false);

        assertThat(result).startsWith("Chain: " + chain.getId());
        assertThat(result).contains("(goal: report)");
    }

    @Test
    void shouldRenderNodesInExecutionOrderWithProducers() throws Exception {
        String result = format.render(buildChain(Goal.of("report")), false);

        assertThat(result).contains("┌─ 1. Source");
        assertThat(result).contains("┌─ 2. Transform");
        assertThat(result).contains("┌─ 3. Analyze (goal)");
        assertThat(result).contains("│  data/raw ← Source");
        assertThat(result).contains("│  outputs: [report]");
    }

    @Test
    void shouldMarkSeedInputs() throws Exception {
        String result = format.render(buildChain(Goal.of("report", "data/raw")), false);

        assertThat(result).contains("data/raw ← seed");
        assertThat(result).doesNotContain("Source");
    }

    @Test
    void shouldNotEmitAnsiCodesWithoutColor() throws Exception {
        String result = format.render(buildChain(Goal.of("report")), false);

        assertThat(result).doesNotContain("\u001B[");
    }

    @Test
    void shouldEmitAnsiCodesWithColor() throws Exception {
        String result = format.render(buildChain(Goal.of("report")), true);

        assertThat(result).contains("\u001B[");
    }

    static Chain buildChain(Goal goal) throws Exception {
        List<PluginDescriptor> plugins = List.of(
                PluginDescriptor.builder("Source").outputs("data/raw").build(),
                PluginDescriptor.builder("Transform").inputs("data/raw").outputs("data/clean").build(),
                PluginDescriptor.builder("Analyze").inputs("data/clean").outputs("report").build());
        return new ChainBuilder().buildChain(goal, plugins);
    }
}
