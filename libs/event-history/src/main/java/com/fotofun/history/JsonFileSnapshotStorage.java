package com.fotofun.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps each snapshot as {@code <id>.json} in one directory. The directory is created on
 * first use.
 */
public class JsonFileSnapshotStorage implements SnapshotStorage {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStorage.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileSnapshotStorage(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(Snapshot snapshot) {
        try {
            Files.createDirectories(directory);
            mapper.writeValue(fileFor(snapshot.id()).toFile(), snapshot);
            log.debug("Saved snapshot {} to {}", snapshot.id(), directory);
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to save snapshot " + snapshot.id(), e);
        }
    }

    @Override
    public Optional<Snapshot> load(String snapshotId) {
        Path file = fileFor(snapshotId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), Snapshot.class));
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to read snapshot " + snapshotId, e);
        }
    }

    @Override
    public void delete(String snapshotId) {
        try {
            Files.deleteIfExists(fileFor(snapshotId));
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to delete snapshot " + snapshotId, e);
        }
    }

    @Override
    public List<Snapshot> list() {
        List<Snapshot> snapshots = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return snapshots;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                snapshots.add(mapper.readValue(file.toFile(), Snapshot.class));
            }
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to list snapshots in " + directory, e);
        }
        return snapshots;
    }

    private Path fileFor(String snapshotId) {
        if (snapshotId.contains("/") || snapshotId.contains("\\") || snapshotId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid snapshot id: " + snapshotId);
        }
        return directory.resolve(snapshotId + SUFFIX);
    }
}
