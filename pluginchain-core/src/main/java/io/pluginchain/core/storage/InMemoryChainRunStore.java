package io.pluginchain.core.storage;

import io.pluginchain.core.execution.ChainRun;
import io.pluginchain.core.execution.RunSnapshot;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// In-memory run store (default implementation).
///
/// Thread-safe, no external dependencies. Runs are indexed by run id; an optional
/// {@link RunArchive} receives the final snapshot of every cleaned-up run.
///
/// @see ChainRunStore for contract
public final class InMemoryChainRunStore implements ChainRunStore {

    private static final Logger logger = Logger.getLogger(InMemoryChainRunStore.class.getName());

    private final Map<String, ChainRun> runs = new ConcurrentHashMap<>();
    private final RunArchive archive;
    private final Clock clock;

    /// Creates a store without archival.
    public InMemoryChainRunStore() {
        this(null, Clock.systemUTC());
    }

    /// Creates a store.
    ///
    /// @param archive destination for retired runs, may be null
    /// @param clock clock used for eviction age, not null
    public InMemoryChainRunStore(RunArchive archive, Clock clock) {
        this.archive = archive;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void put(ChainRun run) {
        Objects.requireNonNull(run, "run must not be null");
        ChainRun existing = runs.putIfAbsent(run.getRunId(), run);
        if (existing != null && existing != run) {
            throw new IllegalStateException("Run id already in use: " + run.getRunId());
        }
    }

    @Override
    public Optional<ChainRun> get(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<ChainRun> listActive() {
        return runs.values().stream()
                .filter(ChainRun::isActive)
                .sorted(Comparator.comparing(ChainRun::getRunId))
                .toList();
    }

    @Override
    public List<ChainRun> listAll() {
        return runs.values().stream().sorted(Comparator.comparing(ChainRun::getRunId)).toList();
    }

    @Override
    public boolean cleanup(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        ChainRun run = runs.remove(runId);
        if (run == null) {
            return false;
        }
        if (run.isActive()) {
            run.cancel("run cleaned up");
        }
        int released = run.releaseResources();
        if (archive != null) {
            RunSnapshot snapshot = run.snapshot();
            try {
                archive.archive(snapshot);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to archive run " + runId, e);
            }
        }
        logger.info("Cleaned up run " + runId + " (" + released + " resources released)");
        return true;
    }

    @Override
    public int evictCompleted(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        Instant cutoff = clock.instant().minus(olderThan);
        int evicted = 0;
        for (ChainRun run : listAll()) {
            Instant endedAt = run.getEndedAt();
            if (!run.isActive() && endedAt != null && !endedAt.isAfter(cutoff) && cleanup(run.getRunId())) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return runs.size();
    }
}
