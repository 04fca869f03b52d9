package io.pluginchain.core.suggest;

import io.pluginchain.core.plugin.PluginDescriptor;
import java.util.List;

/// Scores how relevant a plugin is to a free-text goal.
///
/// The suggestion engine performs no language understanding of its own; all
/// relevance judgement comes from the injected scorer.
@FunctionalInterface
public interface RelevanceScorer {

    /// Scores a plugin against a goal.
    ///
    /// @param goalText free-text goal, not null
    /// @param descriptor plugin to score, not null
    /// @return relevance within `[0, 1]`
    double score(String goalText, PluginDescriptor descriptor);

    /// Returns short reasons behind a score, such as matched tags.
    ///
    /// @param goalText free-text goal, not null
    /// @param descriptor scored plugin, not null
    /// @return reasons, never null (may be empty)
    default List<String> explain(String goalText, PluginDescriptor descriptor) {
        return List.of();
    }
}
