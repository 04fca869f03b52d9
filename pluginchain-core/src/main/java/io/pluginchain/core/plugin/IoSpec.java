package io.pluginchain.core.plugin;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/// Input and output type tags a plugin declares.
///
/// @param inputs tags consumed by the plugin, never null (may be empty)
/// @param outputs tags produced by the plugin, never null
public record IoSpec(Set<String> inputs, Set<String> outputs) {

    /// Compact constructor; copies both sets into sorted, unmodifiable views.
    public IoSpec {
        inputs = inputs != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(inputs))
                : Collections.emptySortedSet();
        outputs = outputs != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(outputs))
                : Collections.emptySortedSet();
    }

    /// Creates a spec from tag lists.
    ///
    /// @param inputs input tags, not null
    /// @param outputs output tags, not null
    /// @return new spec, never null
    public static IoSpec of(Set<String> inputs, Set<String> outputs) {
        return new IoSpec(inputs, outputs);
    }
}
