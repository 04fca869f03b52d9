package io.pluginchain.core.chain;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Structured goal handed to the {@link ChainBuilder}.
///
/// @param requiredOutputTag the type tag the chain must produce, not null or blank
/// @param seedInputs tags the caller supplies directly, never null (may be empty)
public record Goal(String requiredOutputTag, Set<String> seedInputs) {

    public Goal {
        Objects.requireNonNull(requiredOutputTag, "requiredOutputTag must not be null");
        if (requiredOutputTag.isBlank()) {
            throw new IllegalArgumentException("requiredOutputTag must not be blank");
        }
        seedInputs = seedInputs != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(seedInputs))
                : Collections.emptySortedSet();
    }

    /// Creates a goal for an output tag with optional seed inputs.
    ///
    /// @param requiredOutputTag target tag, not null
    /// @param seedInputs externally supplied tags
    /// @return new goal, never null
    public static Goal of(String requiredOutputTag, String... seedInputs) {
        return new Goal(requiredOutputTag, Set.copyOf(Arrays.asList(seedInputs)));
    }

    /// Creates a goal for an output tag with the given seed inputs.
    ///
    /// @param requiredOutputTag target tag, not null
    /// @param seedInputs externally supplied tags, not null
    /// @return new goal, never null
    public static Goal of(String requiredOutputTag, Collection<String> seedInputs) {
        return new Goal(requiredOutputTag, new TreeSet<>(seedInputs));
    }

    /// Returns whether a tag is supplied by the caller.
    ///
    /// @param tag type tag, not null
    /// @return true if `tag` is a seed input
    public boolean isSeeded(String tag) {
        return seedInputs.contains(tag);
    }
}
