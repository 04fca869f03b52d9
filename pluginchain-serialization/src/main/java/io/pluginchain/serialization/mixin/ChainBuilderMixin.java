package io.pluginchain.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Chain.Builder`: maps JSON field names directly to builder methods.
///
/// @see ChainMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class ChainBuilderMixin {}
