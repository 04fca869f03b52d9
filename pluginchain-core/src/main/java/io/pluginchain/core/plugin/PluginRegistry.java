package io.pluginchain.core.plugin;

import io.pluginchain.core.exception.DuplicatePluginException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/// Registry of plugin capability descriptors and their implementations.
///
/// The registry is pure lookup: it never runs plugins. The chain builder reads
/// descriptors from it, the executor resolves implementations from it, and the
/// suggestion engine scores its entries.
///
/// ### Contracts
/// - Names are unique; registering a taken name is a defect
/// - Every query returns an immutable snapshot, so callers never observe a
///   registration that happens while they iterate
///
/// @implNote Implementations must be thread-safe.
///
/// @see DefaultPluginRegistry for the standard implementation
/// @see ProducerOrdering for the producer ranking used by {@link #findProducers}
public interface PluginRegistry {

    /// Registers a descriptor without an implementation.
    ///
    /// Useful for planning-only registries (dry runs, manifests). Nodes backed by
    /// such a plugin fail with `MISSING_PLUGIN` if the chain is executed.
    ///
    /// @param descriptor descriptor to register, not null
    /// @throws DuplicatePluginException if the name is already registered
    void register(PluginDescriptor descriptor);

    /// Registers a descriptor together with its implementation.
    ///
    /// @param descriptor descriptor to register, not null
    /// @param plugin implementation whose name and I/O spec match the descriptor, not null
    /// @throws DuplicatePluginException if the name is already registered
    /// @throws IllegalArgumentException if the plugin does not match the descriptor
    void register(PluginDescriptor descriptor, Plugin plugin);

    /// Registers a plugin using the descriptor derived from its own I/O spec.
    ///
    /// @param plugin implementation to register, not null
    /// @throws DuplicatePluginException if the name is already registered
    default void register(Plugin plugin) {
        register(PluginDescriptor.of(plugin), plugin);
    }

    /// Removes a plugin and closes its implementation, if any.
    ///
    /// @param name plugin name, not null
    /// @return true if the plugin was registered
    boolean unregister(String name);

    /// Looks up a descriptor by name.
    ///
    /// @param name plugin name, not null
    /// @return the descriptor, or empty if not registered
    Optional<PluginDescriptor> get(String name);

    /// Looks up the implementation bound to a plugin name.
    ///
    /// @param name plugin name, not null
    /// @return the implementation, or empty if unknown or descriptor-only
    Optional<Plugin> getPlugin(String name);

    /// Returns all descriptors ordered by name.
    ///
    /// @return immutable snapshot, never null
    List<PluginDescriptor> list();

    /// Returns the descriptors matching a filter, ordered by name.
    ///
    /// @param filter predicate on descriptor tags, flags or priority, not null
    /// @return immutable snapshot, never null
    default List<PluginDescriptor> list(Predicate<PluginDescriptor> filter) {
        return list().stream().filter(filter).toList();
    }

    /// Returns all producers of a tag in deterministic preference order.
    ///
    /// @param tag type tag, not null
    /// @return immutable snapshot ordered by priority then name, never null
    default List<PluginDescriptor> findProducers(String tag) {
        return findProducers(tag, Set.of());
    }

    /// Returns all producers of a tag, ranking collaborators of the given plugins first.
    ///
    /// @param tag type tag, not null
    /// @param selectedPlugins names of plugins already chosen, not null
    /// @return immutable snapshot ordered by {@link ProducerOrdering}, never null
    List<PluginDescriptor> findProducers(String tag, Collection<String> selectedPlugins);

    /// Returns whether a plugin name is registered.
    ///
    /// @param name plugin name, not null
    /// @return true if registered
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Returns the number of registered plugins.
    ///
    /// @return plugin count
    default int size() {
        return list().size();
    }
}
