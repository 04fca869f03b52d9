package io.pluginchain.core.chain;

/// Descriptive information attached to a built chain.
///
/// @param createdBy component that produced the chain, never null
/// @param pluginCount number of distinct plugins in the chain
public record ChainMetadata(String createdBy, int pluginCount) {

    /// Creator label used by {@link ChainBuilder}.
    public static final String CHAIN_BUILDER = "chain-builder";

    public ChainMetadata {
        createdBy = createdBy != null ? createdBy : CHAIN_BUILDER;
    }
}
