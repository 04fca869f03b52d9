package io.pluginchain.core.plugin;

import java.io.Serial;
import java.util.Objects;

/// Thrown by a plugin when it cannot produce its outputs.
///
/// The `code` is a short machine-readable identifier (for example `RATE_LIMITED`)
/// that ends up in the failed node's {@link io.pluginchain.core.execution.ExecutionError}.
public class PluginException extends Exception {

    @Serial private static final long serialVersionUID = 4127339150216610387L;

    private final String code;

    /// Creates an exception with a code and message.
    ///
    /// @param code machine-readable error code, not null
    /// @param message description of the failure
    public PluginException(String code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /// Creates an exception with a code, message and cause.
    ///
    /// @param code machine-readable error code, not null
    /// @param message description of the failure
    /// @param cause underlying exception
    public PluginException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /// Returns the machine-readable error code.
    ///
    /// @return error code, never null
    public String getCode() {
        return code;
    }
}
