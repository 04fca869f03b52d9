package io.pluginchain.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.pluginchain.core.chain.Chain;

/// Jackson mixin that binds `Chain` deserialization to its builder.
///
/// Applied to `Chain.class` via `PluginChainJacksonModule.setupModule()`. The builder
/// re-runs every chain validation, so a tampered document fails instead of producing an
/// inconsistent chain.
///
/// @apiNote The companion mixin {@link ChainBuilderMixin} must also be registered.
///
/// @see io.pluginchain.serialization.PluginChainJacksonModule
@JsonDeserialize(builder = Chain.Builder.class)
public abstract class ChainMixin {}
