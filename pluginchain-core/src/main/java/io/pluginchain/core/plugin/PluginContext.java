package io.pluginchain.core.plugin;

import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/// Run-scoped context handed to {@link Plugin#execute}.
///
/// Exposes the identifiers of the current run and node, caller-supplied attributes,
/// a read-only view of the run's cancellation flag, and a hook to attach resources
/// that must be closed when the run is cleaned up.
///
/// @implNote Thread-safe. Attributes are an immutable copy.
public final class PluginContext {

    private final String runId;
    private final String chainId;
    private final String nodeId;
    private final Map<String, Object> attributes;
    private final BooleanSupplier cancellationRequested;
    private final Consumer<AutoCloseable> resourceSink;

    /// Creates a context.
    ///
    /// @param runId run identifier, not null
    /// @param chainId chain identifier, not null
    /// @param nodeId node identifier, not null
    /// @param attributes caller-supplied attributes, not null
    /// @param cancellationRequested reports whether the run has been cancelled, not null
    /// @param resourceSink receives resources to close at run cleanup, not null
    public PluginContext(
            String runId,
            String chainId,
            String nodeId,
            Map<String, Object> attributes,
            BooleanSupplier cancellationRequested,
            Consumer<AutoCloseable> resourceSink) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.chainId = Objects.requireNonNull(chainId, "chainId must not be null");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
        this.cancellationRequested =
                Objects.requireNonNull(cancellationRequested, "cancellationRequested must not be null");
        this.resourceSink = Objects.requireNonNull(resourceSink, "resourceSink must not be null");
    }

    public String getRunId() {
        return runId;
    }

    public String getChainId() {
        return chainId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns a caller-supplied attribute.
    ///
    /// @param key attribute key, not null
    /// @return the value, or null if absent
    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    /// Returns whether cancellation of the run has been requested.
    ///
    /// Long-running plugins may poll this and stop early; the executor does not
    /// interrupt a plugin because of cancellation.
    ///
    /// @return true once the run's cancellation token has fired
    public boolean isCancellationRequested() {
        return cancellationRequested.getAsBoolean();
    }

    /// Registers a resource that is closed when the run is cleaned up.
    ///
    /// @param resource resource to close later, not null
    public void attachResource(AutoCloseable resource) {
        resourceSink.accept(Objects.requireNonNull(resource, "resource must not be null"));
    }
}
