package io.pluginchain.serialization;

import io.pluginchain.core.execution.RunSnapshot;
import io.pluginchain.core.storage.RunArchive;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// {@link RunArchive} writing each retired run to `<directory>/<runId>.json`.
///
/// @implNote Thread-safe. Each run id maps to its own file.
public final class JsonFileRunArchive implements RunArchive {

    private static final Logger logger = Logger.getLogger(JsonFileRunArchive.class.getName());

    private final Path directory;

    /// @param directory archive directory, created on first write if missing
    public JsonFileRunArchive(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public void archive(RunSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(snapshot.runId());
        Files.writeString(file, ChainSerializer.snapshotToJson(snapshot));
        logger.info("Archived run " + snapshot.runId() + " to " + file);
    }

    /// Reads an archived run.
    ///
    /// @param runId run identifier, not null
    /// @return the snapshot, or empty if the run was never archived here
    /// @throws IOException if the file exists but cannot be read
    public Optional<RunSnapshot> read(String runId) throws IOException {
        Path file = fileFor(runId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(ChainSerializer.snapshotFromJson(Files.readString(file)));
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        if (runId.isBlank() || runId.contains("/") || runId.contains("\\") || runId.contains("..")) {
            throw new IllegalArgumentException("Run id is not a safe file name: " + runId);
        }
        return directory.resolve(runId + ".json");
    }
}
