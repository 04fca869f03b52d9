package io.pluginchain.core.chain;

import java.util.Comparator;
import java.util.Objects;

/// Directed data edge: `producerId` feeds its `tag` output into `consumerId`.
///
/// @param producerId id of the producing node, not null
/// @param consumerId id of the consuming node, not null
/// @param tag type tag carried along the edge, not null
public record ChainEdge(String producerId, String consumerId, String tag) {

    /// Canonical edge order: consumer, then tag, then producer.
    public static final Comparator<ChainEdge> CANONICAL_ORDER =
            Comparator.comparing(ChainEdge::consumerId)
                    .thenComparing(ChainEdge::tag)
                    .thenComparing(ChainEdge::producerId);

    public ChainEdge {
        Objects.requireNonNull(producerId, "producerId must not be null");
        Objects.requireNonNull(consumerId, "consumerId must not be null");
        Objects.requireNonNull(tag, "tag must not be null");
    }
}
