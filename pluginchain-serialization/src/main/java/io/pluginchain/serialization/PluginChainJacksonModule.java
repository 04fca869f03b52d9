package io.pluginchain.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.pluginchain.core.chain.Chain;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.serialization.mixin.ChainBuilderMixin;
import io.pluginchain.serialization.mixin.ChainMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all plugin chain serialization configuration in one
/// place.
///
/// **Custom deserializers** (types whose defaults cannot be expressed by a record constructor):
/// - `PluginDescriptor` via `PluginDescriptorDeserializer`, so manifests may omit optional
///   fields and still receive the descriptor defaults
///
/// **Mixin/builder pairs** (immutable builder-pattern domain objects):
/// - `Chain` + `Chain.Builder`
///
/// Records (`ChainNode`, `ChainEdge`, `Goal`, `RunSnapshot`, `NodeState`, ...) bind through
/// their canonical constructors and need no registration.
///
/// @see ChainSerializer for the convenience factory API
public class PluginChainJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4113790262514046021L;

    public PluginChainJacksonModule() {
        super("PluginChainJacksonModule");

        addDeserializer(PluginDescriptor.class, new PluginDescriptorDeserializer());
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Chain.class, ChainMixin.class);
        context.setMixInAnnotations(Chain.Builder.class, ChainBuilderMixin.class);
    }
}
