package io.pluginchain.core.plugin;

import java.util.Map;

/// Execution contract implemented by every plugin the engine can chain.
///
/// The engine never inspects plugin classes reflectively: it relies on the declared
/// {@link IoSpec} to match outputs to inputs, and on {@link #execute} to run.
///
/// ### Contracts
/// - `execute` receives exactly the tags the chain resolved for this plugin, keyed by tag
/// - The returned map must contain every output tag that downstream nodes consume
/// - Failures are reported by throwing {@link PluginException}; any other runtime
///   exception is also captured by the executor and recorded as a node failure
///
/// @implNote Implementations must be thread-safe when chains run in parallel mode:
/// the same instance may serve several runs at once.
///
/// @see PluginDescriptor for the registry-side capability record
/// @see io.pluginchain.core.execution.ChainExecutor for invocation
public interface Plugin {

    /// Returns the unique plugin name; must match the registered descriptor name.
    ///
    /// @return plugin name, never null
    String name();

    /// Returns the declared input and output tags.
    ///
    /// @return I/O specification, never null
    IoSpec getIoSpec();

    /// Executes the plugin.
    ///
    /// @param inputs values keyed by input tag, never null
    /// @param context run-scoped execution context, never null
    /// @return values keyed by output tag, may be empty but should not be null
    /// @throws PluginException if the plugin cannot produce its outputs
    Map<String, Object> execute(Map<String, Object> inputs, PluginContext context)
            throws PluginException;

    /// Checks inputs before execution.
    ///
    /// Returning `false` fails the node with code `INVALID_INPUT` without calling
    /// {@link #execute}.
    ///
    /// @param inputs values keyed by input tag, never null
    /// @return true if the inputs are acceptable
    default boolean validateInput(Map<String, Object> inputs) {
        return true;
    }

    /// Releases plugin-held resources. Called once when the plugin is unregistered.
    default void close() {}
}
