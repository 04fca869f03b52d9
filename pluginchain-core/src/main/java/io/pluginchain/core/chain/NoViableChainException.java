package io.pluginchain.core.chain;

import java.io.Serial;
import java.util.List;

/// Thrown when a required tag has no eligible producer among the candidates.
public class NoViableChainException extends ChainBuildException {
    @Serial private static final long serialVersionUID = -4488921270392671865L;

    private final String unresolvedTag;
    private final List<String> resolutionPath;

    /// Creates the exception.
    ///
    /// @param unresolvedTag the tag without producer, not null
    /// @param resolutionPath tags being resolved when the failure happened, goal first
    /// @param reason short explanation, not null
    public NoViableChainException(String unresolvedTag, List<String> resolutionPath, String reason) {
        super("No viable chain: " + reason + " for tag '" + unresolvedTag + "' (path "
                + String.join(" <- ", resolutionPath) + ")");
        this.unresolvedTag = unresolvedTag;
        this.resolutionPath = List.copyOf(resolutionPath);
    }

    public String getUnresolvedTag() {
        return unresolvedTag;
    }

    public List<String> getResolutionPath() {
        return resolutionPath;
    }
}
