package io.pluginchain.core.exception;

import java.io.Serial;

public class RunNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -3178027540719163245L;

    public RunNotFoundException(String message) {
        super(message);
    }
}
