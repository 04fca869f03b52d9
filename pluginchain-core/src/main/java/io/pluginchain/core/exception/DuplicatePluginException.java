package io.pluginchain.core.exception;

import java.io.Serial;

/// Thrown when a plugin is registered under a name that is already taken.
///
/// Registration conflicts are programming errors, so this is unchecked.
public class DuplicatePluginException extends IllegalStateException {
    @Serial private static final long serialVersionUID = 2806631459926342174L;

    public DuplicatePluginException(String message) {
        super(message);
    }
}
