package io.pluginchain.core.storage;

import io.pluginchain.core.exception.RunNotFoundException;
import io.pluginchain.core.execution.ChainRun;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/// Storage for {@link ChainRun} records, shared by the executor and monitoring callers.
///
/// ### Contracts
/// - A run id maps to exactly one run instance for the lifetime of the record
/// - `cleanup` is idempotent: cleaning up an absent run is a no-op returning false
/// - Listing methods return snapshots of the current membership
///
/// @implNote Implementations must be thread-safe.
///
/// @see InMemoryChainRunStore for the default implementation
public interface ChainRunStore {

    /// Stores a run.
    ///
    /// @param run run to store, not null
    /// @throws IllegalStateException if a different run instance already uses the same id
    void put(ChainRun run);

    /// Looks up a run.
    ///
    /// @param runId run identifier, not null
    /// @return the run, or empty if not stored
    Optional<ChainRun> get(String runId);

    /// Looks up a run, failing if absent.
    ///
    /// @param runId run identifier, not null
    /// @return the run, never null
    /// @throws RunNotFoundException if no run is stored under this id
    default ChainRun getOrThrow(String runId) throws RunNotFoundException {
        return get(runId).orElseThrow(() -> new RunNotFoundException("Run not found: " + runId));
    }

    /// Returns runs that have not reached a terminal status.
    ///
    /// @return immutable list ordered by run id, never null
    List<ChainRun> listActive();

    /// Returns all stored runs.
    ///
    /// @return immutable list ordered by run id, never null
    List<ChainRun> listAll();

    /// Retires a run: cancels it if still active, releases its resources, archives its
    /// final snapshot when an archive is configured, and removes the record.
    ///
    /// @param runId run identifier, not null
    /// @return true if a run was removed, false if none was stored
    boolean cleanup(String runId);

    /// Cleans up every finished run that ended more than `olderThan` ago.
    ///
    /// @param olderThan minimum age since the run ended, not null
    /// @return number of runs retired
    int evictCompleted(Duration olderThan);

    /// Returns the number of stored runs.
    ///
    /// @return run count
    int size();
}
