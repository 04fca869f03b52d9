package io.pluginchain.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.pluginchain.core.plugin.PluginDescriptor;
import io.pluginchain.core.plugin.PluginRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A JSON document listing plugin descriptors.
///
/// ```json
/// {
///   "plugins": [
///     {"name": "Source", "outputTypes": ["data/raw"]},
///     {"name": "Transform", "inputTypes": ["data/raw"], "outputTypes": ["data/clean"],
///      "chainPriority": 0.8, "collaboratesWith": ["Source"]}
///   ]
/// }
/// ```
///
/// Manifests let tools plan chains without loading plugin implementations.
///
/// @param plugins descriptors in document order, never null
public record DescriptorManifest(List<PluginDescriptor> plugins) {

    private static final Logger logger = Logger.getLogger(DescriptorManifest.class.getName());

    public DescriptorManifest {
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
    }

    /// Parses a manifest.
    ///
    /// @param json manifest JSON, not null
    /// @return parsed manifest, never null
    /// @throws IllegalArgumentException if the JSON is malformed or a descriptor is invalid
    public static DescriptorManifest parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return ChainSerializer.createMapper().readValue(json, DescriptorManifest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid plugin manifest: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads a manifest file.
    ///
    /// @param file manifest path, not null
    /// @return parsed manifest, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid manifest
    public static DescriptorManifest read(Path file) throws IOException {
        DescriptorManifest manifest = parse(Files.readString(file));
        logger.fine("Read " + manifest.plugins().size() + " plugin descriptors from " + file);
        return manifest;
    }

    /// Registers every descriptor, without implementations.
    ///
    /// @param registry target registry, not null
    /// @throws io.pluginchain.core.exception.DuplicatePluginException if a name is taken
    public void registerAll(PluginRegistry registry) {
        plugins.forEach(registry::register);
    }

    public String toJson() {
        try {
            return ChainSerializer.createMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize plugin manifest: " + e.getMessage(), e);
        }
    }
}
