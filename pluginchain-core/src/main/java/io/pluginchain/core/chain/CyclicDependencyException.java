package io.pluginchain.core.chain;

import java.io.Serial;
import java.util.List;

/// Thrown when resolving a tag leads back to a tag or plugin already on the
/// current resolution path.
public class CyclicDependencyException extends ChainBuildException {
    @Serial private static final long serialVersionUID = 7750294632116590823L;

    private final List<String> cycle;

    /// Creates the exception.
    ///
    /// @param cycle tags along the cycle, first element repeated at the end
    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
