package io.pluginchain.cli.commands;

import io.pluginchain.cli.scoring.KeywordRelevanceScorer;
import io.pluginchain.cli.ui.AnsiStyles;
import io.pluginchain.core.chain.ChainNode;
import io.pluginchain.core.suggest.ChainSuggestion;
import io.pluginchain.core.suggest.SuggestionContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import picocli.CommandLine;

/// CLI command that ranks candidate chains for a free-text goal.
///
/// ### Usage
/// ```bash
/// pluginchain suggest "summarize my data" [--seed data/raw]... [--limit 3]
/// ```
///
/// Relevance comes from {@link KeywordRelevanceScorer}; ranking and chain construction are
/// the suggestion engine's.
@CommandLine.Command(name = "suggest", description = "Suggest chains for a free-text goal")
class ChainSuggestCommand extends ChainCommand {

    @CommandLine.Parameters(index = "0", description = "Goal in plain words")
    String goalText;

    @CommandLine.Option(
            names = "--seed",
            description = "Input tag you can supply (repeatable)")
    List<String> seeds = new ArrayList<>();

    @CommandLine.Option(
            names = "--limit",
            description = "Maximum number of suggestions (default: configured maximum)")
    Integer limit;

    @Inject KeywordRelevanceScorer scorer;

    @Override
    protected void execute() {
        if (limit != null && limit < 1) {
            printFailure("--limit must be positive but was " + limit);
            return;
        }
        try {
            loadManifest();
            List<ChainSuggestion> suggestions = environment.getSuggestionEngine()
                    .suggestChains(goalText, SuggestionContext.withInputs(Set.copyOf(seeds)), scorer);
            if (limit != null && suggestions.size() > limit) {
                suggestions = suggestions.subList(0, limit);
            }
            if (suggestions.isEmpty()) {
                printWarning("No chain matches \"" + goalText + "\"");
                return;
            }
            AnsiStyles styles = styles();
            int rank = 1;
            for (ChainSuggestion suggestion : suggestions) {
                printSuggestion(rank++, suggestion, styles);
            }
        } catch (Exception e) {
            printFailure("Suggestion failed: " + e.getMessage());
        }
    }

    private void printSuggestion(int rank, ChainSuggestion suggestion, AnsiStyles styles) {
        String plugins = suggestion.chainSketch().getNodes().stream()
                .map(ChainNode::pluginName)
                .collect(Collectors.joining(" " + styles.arrow() + " "));
        System.out.printf(
                Locale.ROOT,
                "%d. %s %s  (confidence %.2f, score %.2f)%n",
                rank,
                styles.bold(suggestion.chainSketch().getGoal().requiredOutputTag()),
                styles.gray(suggestion.chainSketch().getId()),
                suggestion.confidence(),
                suggestion.aggregateScore());
        System.out.println("   " + plugins);
        for (String reason : suggestion.rationale()) {
            System.out.println("   " + styles.bullet() + " " + reason);
        }
        Duration estimate = suggestion.estimatedDuration();
        if (!estimate.isZero()) {
            System.out.println("   " + styles.dim("estimated " + estimate.toMillis() + " ms"));
        }
    }
}
