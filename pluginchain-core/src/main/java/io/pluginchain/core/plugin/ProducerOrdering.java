package io.pluginchain.core.plugin;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/// Deterministic ranking of producers competing for the same type tag.
///
/// Order, highest preference first:
/// 1. descriptors whose `collaboratesWith` names one of the given plugins
/// 2. higher `chainPriority`
/// 3. name ascending
///
/// `chainPriority` only separates candidates that are equal on collaboration, so a
/// low-priority collaborator always beats a high-priority stranger.
public final class ProducerOrdering {

    private ProducerOrdering() {}

    /// Returns the comparator for the given collaboration context.
    ///
    /// @param selectedPlugins names of plugins already chosen, not null (may be empty)
    /// @return comparator ordering best candidates first, never null
    public static Comparator<PluginDescriptor> relativeTo(Collection<String> selectedPlugins) {
        Objects.requireNonNull(selectedPlugins, "selectedPlugins must not be null");
        Comparator<PluginDescriptor> collaborationFirst =
                Comparator.comparing(d -> !d.collaboratesWithAny(selectedPlugins));
        return collaborationFirst
                .thenComparing(PluginDescriptor::chainPriority, Comparator.reverseOrder())
                .thenComparing(PluginDescriptor::name);
    }
}
