package io.pluginchain.core.chain;

import java.io.Serial;

/// Thrown when two producers claim the same input tag of one consumer.
///
/// The builder resolves every tag to a single producer, so this always signals a
/// defect (a hand-assembled or corrupted chain) rather than a user error.
public class AmbiguousFanInException extends IllegalStateException {
    @Serial private static final long serialVersionUID = -1968047183301726154L;

    public AmbiguousFanInException(String consumerId, String tag, String first, String second) {
        super("Node '" + consumerId + "' input '" + tag + "' claimed by both '" + first
                + "' and '" + second + "'");
    }
}
