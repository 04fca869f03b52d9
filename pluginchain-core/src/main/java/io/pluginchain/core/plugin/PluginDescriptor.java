package io.pluginchain.core.plugin;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/// Immutable capability descriptor of a registered plugin.
///
/// Descriptors are what the chain builder reasons about: which type tags a plugin
/// consumes and produces, which plugins it prefers to run next to, and whether it
/// may be picked automatically. Matching between outputs and inputs is plain tag
/// equality; there is no central type registry.
///
/// ### Contracts
/// - **Precondition**: `name` must not be blank, `outputTypes` must not be empty,
///   `chainPriority` must be within `[0, 1]`
/// - **Postcondition**: All tag sets are unmodifiable and iterate in natural order,
///   so two descriptors built from the same values serialize identically
/// - **Invariant**: `inputTypes` may be empty (source plugins need no input)
///
/// ### Usage
/// {@snippet :
/// PluginDescriptor transform = PluginDescriptor.builder("Transform")
///     .inputs("data/raw")
///     .outputs("data/clean")
///     .collaboratesWith("Analyze")
///     .chainPriority(0.7)
///     .build();
/// }
///
/// @param name unique plugin identifier, not null or blank
/// @param inputTypes tags the plugin consumes, not null (may be empty)
/// @param outputTypes tags the plugin produces, not null or empty
/// @param collaboratesWith names of plugins this one prefers to be chained with, not null
/// @param autoChain whether the builder may select this plugin on its own
/// @param chainPriority tie-break weight within `[0, 1]`, higher wins
/// @param description human-readable summary, never null (may be empty)
/// @param category grouping label, never null
/// @see PluginRegistry for registration and lookup
public record PluginDescriptor(
        String name,
        Set<String> inputTypes,
        Set<String> outputTypes,
        Set<String> collaboratesWith,
        boolean autoChain,
        double chainPriority,
        String description,
        String category) {

    /// Priority assigned when none is given.
    public static final double DEFAULT_PRIORITY = 0.5;

    /// Category assigned when none is given.
    public static final String DEFAULT_CATEGORY = "general";

    /// Compact constructor with validation.
    public PluginDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        inputTypes = sortedCopy(inputTypes, "inputTypes");
        outputTypes = sortedCopy(outputTypes, "outputTypes");
        collaboratesWith = sortedCopy(collaboratesWith, "collaboratesWith");
        if (outputTypes.isEmpty()) {
            throw new IllegalArgumentException("Plugin " + name + " must declare an output type");
        }
        if (Double.isNaN(chainPriority) || chainPriority < 0.0 || chainPriority > 1.0) {
            throw new IllegalArgumentException(
                    "chainPriority must be within [0, 1] but was " + chainPriority);
        }
        description = description != null ? description : "";
        category = category != null && !category.isBlank() ? category : DEFAULT_CATEGORY;
    }

    /// Creates a builder for a descriptor with the given name.
    ///
    /// @param name unique plugin identifier, not null
    /// @return new builder, never null
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /// Creates a descriptor from a plugin's own I/O specification with default flags.
    ///
    /// @param plugin the plugin to describe, not null
    /// @return descriptor with auto-chaining enabled and default priority, never null
    public static PluginDescriptor of(Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin must not be null");
        IoSpec spec = plugin.getIoSpec();
        return builder(plugin.name()).inputs(spec.inputs()).outputs(spec.outputs()).build();
    }

    /// Returns whether this plugin produces the given tag.
    ///
    /// @param tag type tag to check, not null
    /// @return true if `tag` is among the output types
    public boolean produces(String tag) {
        return outputTypes.contains(tag);
    }

    /// Returns whether this plugin consumes the given tag.
    ///
    /// @param tag type tag to check, not null
    /// @return true if `tag` is among the input types
    public boolean consumes(String tag) {
        return inputTypes.contains(tag);
    }

    /// Returns whether this descriptor names any of the given plugins as a collaborator.
    ///
    /// @param pluginNames plugin names to test, not null
    /// @return true if at least one name is listed in `collaboratesWith`
    public boolean collaboratesWithAny(Collection<String> pluginNames) {
        for (String candidate : pluginNames) {
            if (collaboratesWith.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /// Returns the I/O specification implied by this descriptor.
    ///
    /// @return I/O spec with the same tag sets, never null
    public IoSpec ioSpec() {
        return new IoSpec(inputTypes, outputTypes);
    }

    private static Set<String> sortedCopy(Collection<String> tags, String field) {
        if (tags == null) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> copy = new TreeSet<>();
        for (String tag : tags) {
            Objects.requireNonNull(tag, field + " must not contain null");
            if (tag.isBlank()) {
                throw new IllegalArgumentException(field + " must not contain blank tags");
            }
            copy.add(tag);
        }
        return Collections.unmodifiableSortedSet(copy);
    }

    /// Fluent builder for {@link PluginDescriptor}.
    ///
    /// @implNote **Not thread-safe**.
    public static final class Builder {
        private final String name;
        private final Set<String> inputs = new TreeSet<>();
        private final Set<String> outputs = new TreeSet<>();
        private final Set<String> collaborators = new TreeSet<>();
        private boolean autoChain = true;
        private double chainPriority = DEFAULT_PRIORITY;
        private String description = "";
        private String category = DEFAULT_CATEGORY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder inputs(String... tags) {
            inputs.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder inputs(Collection<String> tags) {
            inputs.addAll(tags);
            return this;
        }

        public Builder outputs(String... tags) {
            outputs.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder outputs(Collection<String> tags) {
            outputs.addAll(tags);
            return this;
        }

        public Builder collaboratesWith(String... pluginNames) {
            collaborators.addAll(Arrays.asList(pluginNames));
            return this;
        }

        public Builder autoChain(boolean autoChain) {
            this.autoChain = autoChain;
            return this;
        }

        public Builder chainPriority(double chainPriority) {
            this.chainPriority = chainPriority;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        /// Builds the descriptor.
        ///
        /// @return validated descriptor, never null
        /// @throws IllegalArgumentException if any field violates the descriptor contracts
        public PluginDescriptor build() {
            return new PluginDescriptor(
                    name,
                    inputs,
                    outputs,
                    collaborators,
                    autoChain,
                    chainPriority,
                    description,
                    category);
        }
    }
}
