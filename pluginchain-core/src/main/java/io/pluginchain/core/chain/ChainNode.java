package io.pluginchain.core.chain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/// One plugin invocation inside a {@link Chain}.
///
/// Each required input tag is either resolved to exactly one producer node
/// (`resolvedInputs`) or supplied by the caller (`seedInputs`), never both.
///
/// @param id node identifier, unique within the chain, not null
/// @param pluginName name of the plugin to invoke, not null
/// @param resolvedInputs input tag to producer node id, never null
/// @param seedInputs input tags taken from the run's seed values, never null
/// @param outputTypes tags the plugin declares as outputs, never null
public record ChainNode(
        String id,
        String pluginName,
        Map<String, String> resolvedInputs,
        Set<String> seedInputs,
        Set<String> outputTypes) {

    public ChainNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(pluginName, "pluginName must not be null");
        SortedMap<String, String> inputs =
                new TreeMap<>(resolvedInputs != null ? resolvedInputs : Map.of());
        resolvedInputs = Collections.unmodifiableSortedMap(inputs);
        seedInputs = Collections.unmodifiableSortedSet(
                new TreeSet<>(seedInputs != null ? seedInputs : Set.of()));
        outputTypes = Collections.unmodifiableSortedSet(
                new TreeSet<>(outputTypes != null ? outputTypes : Set.of()));
        for (String tag : seedInputs) {
            if (resolvedInputs.containsKey(tag)) {
                throw new IllegalArgumentException(
                        "Node " + id + " takes '" + tag + "' both from a producer and a seed");
            }
        }
    }

    /// Returns the ids of the nodes this node depends on.
    ///
    /// @return sorted, unmodifiable set of producer ids, never null
    public Set<String> dependencies() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(resolvedInputs.values()));
    }

    /// Returns every tag this node consumes, resolved or seeded.
    ///
    /// @return sorted, unmodifiable set of input tags, never null
    public Set<String> inputTags() {
        TreeSet<String> tags = new TreeSet<>(resolvedInputs.keySet());
        tags.addAll(seedInputs);
        return Collections.unmodifiableSortedSet(tags);
    }
}
