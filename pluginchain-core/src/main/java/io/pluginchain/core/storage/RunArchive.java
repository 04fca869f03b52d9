package io.pluginchain.core.storage;

import io.pluginchain.core.execution.RunSnapshot;
import java.io.IOException;

/// Destination for final run snapshots retired from a {@link ChainRunStore}.
@FunctionalInterface
public interface RunArchive {

    /// Persists a run snapshot.
    ///
    /// @param snapshot final snapshot of the run, not null
    /// @throws IOException if the snapshot cannot be written
    void archive(RunSnapshot snapshot) throws IOException;
}
