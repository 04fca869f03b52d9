package io.pluginchain.core.chain;

import java.io.Serial;

/// Base type for failures that prevent {@link ChainBuilder} from producing a chain.
///
/// No partial chain is ever returned alongside this exception.
public class ChainBuildException extends Exception {
    @Serial private static final long serialVersionUID = 5318150729485519361L;

    public ChainBuildException(String message) {
        super(message);
    }
}
