package io.pluginchain.core.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ChainTest {

    private static ChainNode node(String id, Map<String, String> inputs, String... outputs) {
        return new ChainNode(id, id, inputs, Set.of(), Set.of(outputs));
    }

    @Test
    void shouldOrderNodesTopologicallyRegardlessOfInsertionOrder() {
        Chain chain = Chain.builder()
                .goal(Goal.of("report"))
                .goalNodeId("Analyze")
                .node(node("Analyze", Map.of("clean", "Transform"), "report"))
                .node(node("Transform", Map.of("raw", "Source"), "clean"))
                .node(node("Source", Map.of(), "raw"))
                .build();

        assertThat(chain.executionOrder()).containsExactly("Source", "Transform", "Analyze");
        assertThat(chain.dependentsOf("Source")).containsExactly("Transform");
        assertThat(chain.getMetadata().pluginCount()).isEqualTo(3);
        assertThat(chain.getId()).startsWith("chain-").hasSize("chain-".length() + 12);
    }

    @Test
    void shouldRejectCycle() {
        assertThatThrownBy(() -> Chain.builder()
                        .goal(Goal.of("a"))
                        .goalNodeId("A")
                        .node(node("A", Map.of("b", "B"), "a"))
                        .node(node("B", Map.of("a", "A"), "b"))
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void shouldRejectEdgeWhoseProducerLacksTheTag() {
        assertThatThrownBy(() -> Chain.builder()
                        .goal(Goal.of("report"))
                        .goalNodeId("Analyze")
                        .node(node("Analyze", Map.of("clean", "Source"), "report"))
                        .node(node("Source", Map.of(), "raw"))
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not output 'clean'");
    }

    @Test
    void shouldRejectAmbiguousFanIn() {
        assertThatThrownBy(() -> Chain.builder()
                        .goal(Goal.of("report"))
                        .goalNodeId("Analyze")
                        .node(node("Analyze", Map.of("clean", "CleanA"), "report"))
                        .node(node("CleanA", Map.of(), "clean"))
                        .node(node("CleanB", Map.of(), "clean"))
                        .edges(List.of(
                                new ChainEdge("CleanA", "Analyze", "clean"),
                                new ChainEdge("CleanB", "Analyze", "clean")))
                        .build())
                .isInstanceOf(AmbiguousFanInException.class);
    }

    @Test
    void shouldRejectUndeclaredSeed() {
        assertThatThrownBy(() -> Chain.builder()
                        .goal(Goal.of("report"))
                        .goalNodeId("Analyze")
                        .node(new ChainNode("Analyze", "Analyze", Map.of(), Set.of("clean"), Set.of("report")))
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("seed");
    }

    @Test
    void shouldRejectGoalNodeNotProducingGoal() {
        assertThatThrownBy(() -> Chain.builder()
                        .goal(Goal.of("report"))
                        .goalNodeId("Source")
                        .node(node("Source", Map.of(), "raw"))
                        .build())
                .isInstanceOf(IllegalStateException.class);
    }
}
