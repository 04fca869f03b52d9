package io.pluginchain.core.suggest;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/// Caller context for a suggestion request.
///
/// @param availableInputs tags the caller can supply, used as seed inputs of candidate goals
/// @param excludedPlugins plugins that must not appear in any suggestion
public record SuggestionContext(Set<String> availableInputs, Set<String> excludedPlugins) {

    public SuggestionContext {
        availableInputs = Collections.unmodifiableSortedSet(
                new TreeSet<>(availableInputs != null ? availableInputs : Set.of()));
        excludedPlugins = Collections.unmodifiableSortedSet(
                new TreeSet<>(excludedPlugins != null ? excludedPlugins : Set.of()));
    }

    public static SuggestionContext empty() {
        return new SuggestionContext(Set.of(), Set.of());
    }

    public static SuggestionContext withInputs(Set<String> availableInputs) {
        return new SuggestionContext(availableInputs, Set.of());
    }
}
