package io.pluginchain.core.plugin;

import io.pluginchain.core.exception.DuplicatePluginException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link PluginRegistry}.
///
/// Stores one entry per plugin name in a {@link ConcurrentHashMap}. Registration uses
/// `putIfAbsent`, so two threads racing on the same name see exactly one winner and
/// one {@link DuplicatePluginException}.
///
/// @implNote Thread-safe. Every query copies the current values into an immutable list
/// before returning.
///
/// ### Usage
/// {@snippet :
/// PluginRegistry registry = new DefaultPluginRegistry();
/// registry.register(new SourcePlugin());
/// List<PluginDescriptor> producers = registry.findProducers("data/raw");
/// }
///
/// @see PluginRegistry for the contract
public final class DefaultPluginRegistry implements PluginRegistry {

    private static final Logger logger = Logger.getLogger(DefaultPluginRegistry.class.getName());

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public DefaultPluginRegistry() {}

    /// Creates a registry with initial descriptor-only entries.
    ///
    /// @param descriptors descriptors to register, not null
    /// @throws DuplicatePluginException if two descriptors share a name
    public DefaultPluginRegistry(Collection<PluginDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        descriptors.forEach(this::register);
    }

    @Override
    public void register(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        put(new Entry(descriptor, null));
    }

    @Override
    public void register(PluginDescriptor descriptor, Plugin plugin) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(plugin, "plugin must not be null");
        if (!descriptor.name().equals(plugin.name())) {
            throw new IllegalArgumentException(
                    "Plugin name '" + plugin.name() + "' does not match descriptor '"
                            + descriptor.name() + "'");
        }
        IoSpec spec = plugin.getIoSpec();
        if (!spec.equals(descriptor.ioSpec())) {
            throw new IllegalArgumentException(
                    "Plugin " + plugin.name() + " declares " + spec
                            + " but descriptor declares " + descriptor.ioSpec());
        }
        put(new Entry(descriptor, plugin));
    }

    private void put(Entry entry) {
        String name = entry.descriptor().name();
        if (entries.putIfAbsent(name, entry) != null) {
            throw new DuplicatePluginException("Plugin already registered: " + name);
        }
        logger.info(
                "Registered plugin: " + name + " (outputs " + entry.descriptor().outputTypes() + ")");
    }

    /// Removes a plugin and closes its implementation.
    ///
    /// @apiNote **Side effects**:
    /// - Calls {@link Plugin#close()} on the removed implementation
    /// - Logs removal at INFO level if the plugin existed
    ///
    /// @param name plugin name, not null
    /// @return `true` if a plugin was removed
    @Override
    public boolean unregister(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Entry removed = entries.remove(name);
        if (removed == null) {
            return false;
        }
        if (removed.plugin() != null) {
            try {
                removed.plugin().close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Plugin " + name + " failed to close", e);
            }
        }
        logger.info("Unregistered plugin: " + name);
        return true;
    }

    @Override
    public Optional<PluginDescriptor> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(entries.get(name)).map(Entry::descriptor);
    }

    @Override
    public Optional<Plugin> getPlugin(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(entries.get(name)).map(Entry::plugin);
    }

    @Override
    public List<PluginDescriptor> list() {
        return entries.values().stream()
                .map(Entry::descriptor)
                .sorted(Comparator.comparing(PluginDescriptor::name))
                .toList();
    }

    @Override
    public List<PluginDescriptor> findProducers(String tag, Collection<String> selectedPlugins) {
        Objects.requireNonNull(tag, "tag must not be null");
        return entries.values().stream()
                .map(Entry::descriptor)
                .filter(d -> d.produces(tag))
                .sorted(ProducerOrdering.relativeTo(selectedPlugins))
                .toList();
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return entries.containsKey(name);
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record Entry(PluginDescriptor descriptor, Plugin plugin) {}
}
