package io.pluginchain.core.execution;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Per-run execution options.
///
/// ### Defaults
/// - `failFast`: `false`
/// - `perNodeTimeout`: null, meaning the executor's configured default
/// - `seeds`: empty
/// - `attributes`: empty
/// - `cancellationToken`: a fresh token
///
/// @param failFast abort all pending nodes on the first node failure
/// @param perNodeTimeout timeout for each node, null for the executor default
/// @param seeds values for the chain's seed input tags, never null
/// @param attributes caller attributes exposed through the plugin context, never null
/// @param cancellationToken token that cancels the run, never null
public record RunOptions(
        boolean failFast,
        Duration perNodeTimeout,
        Map<String, Object> seeds,
        Map<String, Object> attributes,
        CancellationToken cancellationToken) {

    public RunOptions {
        if (perNodeTimeout != null && (perNodeTimeout.isNegative() || perNodeTimeout.isZero())) {
            throw new IllegalArgumentException("perNodeTimeout must be positive: " + perNodeTimeout);
        }
        seeds = seeds != null ? Collections.unmodifiableMap(new HashMap<>(seeds)) : Map.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();
    }

    /// Returns options with every default applied.
    ///
    /// @return new options with a fresh cancellation token, never null
    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RunOptions}.
    public static final class Builder {
        private boolean failFast;
        private Duration perNodeTimeout;
        private final Map<String, Object> seeds = new HashMap<>();
        private final Map<String, Object> attributes = new HashMap<>();
        private CancellationToken cancellationToken;

        private Builder() {}

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder perNodeTimeout(Duration perNodeTimeout) {
            this.perNodeTimeout = perNodeTimeout;
            return this;
        }

        /// Supplies the value for a seed input tag.
        ///
        /// @param tag seed tag declared by the chain's goal, not null
        /// @param value value handed to consuming plugins
        /// @return this builder for chaining
        public Builder seed(String tag, Object value) {
            seeds.put(Objects.requireNonNull(tag, "tag must not be null"), value);
            return this;
        }

        public Builder seeds(Map<String, Object> values) {
            seeds.putAll(values);
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(
                    Objects.requireNonNull(key, "key must not be null"),
                    Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(failFast, perNodeTimeout, seeds, attributes, cancellationToken);
        }
    }
}
