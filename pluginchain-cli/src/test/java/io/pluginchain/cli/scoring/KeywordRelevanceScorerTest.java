package io.pluginchain.cli.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.pluginchain.core.plugin.PluginDescriptor;
import org.junit.jupiter.api.Test;

class KeywordRelevanceScorerTest {

    private final KeywordRelevanceScorer scorer = new KeywordRelevanceScorer();

    private final PluginDescriptor analyzer = PluginDescriptor.builder("ReportAnalyzer")
            .inputs("data/clean")
            .outputs("report")
            .description("Summarizes cleaned data")
            .category("analytics")
            .build();

    @Test
    void shouldDropStopWordsAndShortWords() {
        assertThat(KeywordRelevanceScorer.keywords("Please build me a report for the team"))
                .containsExactly("build", "report", "team");
    }

    @Test
    void shouldSplitCamelCaseNames() {
        assertThat(KeywordRelevanceScorer.vocabulary(analyzer))
                .contains("report", "analyzer", "data", "clean", "summarizes", "analytics");
    }

    @Test
    void shouldScoreFractionOfMatchedKeywords() {
        assertThat(scorer.score("report team", analyzer)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.score("clean data report", analyzer)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldMatchByPrefix() {
        assertThat(scorer.score("analyze", analyzer)).isEqualTo(1.0);
        assertThat(scorer.score("summarize", analyzer)).isEqualTo(1.0);
        // prefixes shorter than four letters only match exactly
        assertThat(scorer.score("rep", analyzer)).isZero();
    }

    @Test
    void shouldScoreZeroWithoutKeywords() {
        assertThat(scorer.score("the and for", analyzer)).isZero();
        assertThat(scorer.score("weather forecast", analyzer)).isZero();
    }

    @Test
    void shouldExplainMatches() {
        assertThat(scorer.explain("report on cleaned data", analyzer))
                .containsExactly("matched keywords cleaned, data, report");
        assertThat(scorer.explain("weather", analyzer)).isEmpty();
    }
}
