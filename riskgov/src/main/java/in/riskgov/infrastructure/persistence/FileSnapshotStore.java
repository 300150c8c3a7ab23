package in.riskgov.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.riskgov.application.port.output.SnapshotStore;
import in.riskgov.domain.common.PersistenceException;
import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One JSON file per snapshot key in a directory. A save writes a temp file in the
 * same directory and renames it over the target.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private static final String STREAM_PREFIX = "stream-";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSnapshotStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public void saveStream(StreamSnapshot snapshot) {
        write(snapshot.key(), snapshot);
    }

    @Override
    public void saveGovernance(GovernanceSnapshot snapshot) {
        write(GovernanceSnapshot.KEY, snapshot);
    }

    @Override
    public Optional<StreamSnapshot> loadStream(String streamId) {
        return read(STREAM_PREFIX + streamId, StreamSnapshot.class);
    }

    @Override
    public Optional<GovernanceSnapshot> loadGovernance() {
        return read(GovernanceSnapshot.KEY, GovernanceSnapshot.class);
    }

    @Override
    public List<String> listStreams() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, STREAM_PREFIX + "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(STREAM_PREFIX.length(), name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new PersistenceException(directory.toString(), "cannot list snapshots", e);
        }
        Collections.sort(ids);
        return ids;
    }

    private void write(String key, Object snapshot) {
        Path target = directory.resolve(key + SUFFIX);
        Path temp = directory.resolve(key + SUFFIX + ".tmp");
        try {
            Files.createDirectories(directory);
            Files.write(temp, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[FileSnapshotStore] Saved {}", target);
        } catch (IOException e) {
            throw new PersistenceException(key, "cannot write snapshot " + target, e);
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Path file = directory.resolve(key + SUFFIX);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.error("[FileSnapshotStore] Unreadable snapshot {}, ignoring it: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
