package io.pluginchain.core.suggest;

import io.pluginchain.core.chain.Chain;
import java.time.Duration;
import java.util.List;

/// One ranked, non-executed chain proposal.
///
/// @param chainSketch the dry-built chain
/// @param confidence relevance of the plugin producing the chain's goal tag
/// @param aggregateScore mean relevance of all plugins in the chain, the ranking key
/// @param rationale short scoring reasons, never null
/// @param estimatedDuration sum of the plugins' average durations, zero without history
public record ChainSuggestion(
        Chain chainSketch,
        double confidence,
        double aggregateScore,
        List<String> rationale,
        Duration estimatedDuration) {

    public ChainSuggestion {
        rationale = List.copyOf(rationale);
    }
}
