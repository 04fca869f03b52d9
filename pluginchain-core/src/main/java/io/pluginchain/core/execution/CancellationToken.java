package io.pluginchain.core.execution;

import java.util.concurrent.atomic.AtomicReference;

/// One-shot cooperative cancellation flag shared between a run and its callers.
///
/// Firing the token stops the executor from starting further nodes. Nodes that are
/// already running finish normally and their results are still recorded.
///
/// @implNote Thread-safe.
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /// Fires the token.
    ///
    /// @param reason why the run is cancelled, not null
    /// @return true if this call fired the token, false if it was already fired
    public boolean cancel(String reason) {
        return this.reason.compareAndSet(null, reason != null ? reason : "cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /// Returns the reason passed to the first {@link #cancel} call.
    ///
    /// @return cancellation reason, or null if not cancelled
    public String getReason() {
        return reason.get();
    }
}
