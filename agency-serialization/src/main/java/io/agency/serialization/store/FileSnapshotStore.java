package io.agency.serialization.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agency.core.exception.SnapshotVersionConflictException;
import io.agency.core.exception.StorageException;
import io.agency.core.state.SnapshotStore;
import io.agency.core.state.SnapshotSummary;
import io.agency.core.workflow.WorkflowSnapshot;
import io.agency.serialization.SnapshotSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Snapshot store keeping one JSON file per version on the local filesystem.
///
/// Layout: `{root}/{encoded workflow id}/{version, zero-padded}.json`. Ids whose
/// encoded form exceeds {@value #MAX_DIRECTORY_NAME} characters are stored under
/// an encoded prefix followed by `~` and the SHA-256 of the id. A version
/// is first written to a temporary file in the same directory and then moved
/// into place, so readers never see a partial snapshot. Temporary files left
/// behind by a crash are ignored and overwritten on the next write.
///
/// ### Contracts
/// - **Atomicity**: write-then-rename per version
/// - **Versioning**: checked against the files on disk under a per-workflow lock
/// - **Failure**: every `IOException` surfaces as {@link StorageException}
///
/// @implNote Thread-safe within one process. Two processes sharing a directory
/// are not coordinated.
///
/// @see SnapshotStore for the contract
public final class FileSnapshotStore implements SnapshotStore {

    private static final Logger logger = Logger.getLogger(FileSnapshotStore.class.getName());

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    static final int MAX_DIRECTORY_NAME = 200;
    private static final int HASHED_PREFIX = 64;
    // URLEncoder always escapes '~', so it only appears in hashed names.
    private static final char HASH_MARK = '~';

    private final Path root;
    private final ObjectMapper mapper;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    /// Creates a store rooted at a directory, creating it if needed.
    ///
    /// @param root data directory, not null
    /// @throws StorageException if the directory cannot be created
    public FileSnapshotStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = SnapshotSerializer.createMapper();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create snapshot directory " + root, e);
        }
        logger.info("File snapshot store at " + root.toAbsolutePath());
    }

    @Override
    public void put(WorkflowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        String workflowId = snapshot.workflowId();

        synchronized (lockFor(workflowId)) {
            Path dir = directoryOf(workflowId);
            long last = latestVersion(dir);
            if (snapshot.version() != last + 1) {
                throw new SnapshotVersionConflictException(
                        workflowId, last + 1, snapshot.version());
            }

            Path target = dir.resolve(fileName(snapshot.version()));
            Path temp = dir.resolve(fileName(snapshot.version()) + TEMP_SUFFIX);
            try {
                Files.createDirectories(dir);
                mapper.writeValue(temp.toFile(), snapshot);
                move(temp, target);
            } catch (IOException e) {
                throw new StorageException(
                        "Failed to write snapshot "
                                + workflowId
                                + " v"
                                + snapshot.version()
                                + ": "
                                + e.getMessage(),
                        e);
            }
        }
    }

    @Override
    public Optional<WorkflowSnapshot> getLatest(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        long last = latestVersion(directoryOf(workflowId));
        return last == 0 ? Optional.empty() : get(workflowId, last);
    }

    @Override
    public Optional<WorkflowSnapshot> get(String workflowId, long version) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        Path file = directoryOf(workflowId).resolve(fileName(version));
        if (version < 1 || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public List<SnapshotSummary> list() {
        List<SnapshotSummary> summaries = new ArrayList<>();
        for (String workflowId : workflowIds()) {
            Path dir = directoryOf(workflowId);
            for (long version : versions(dir)) {
                summaries.add(read(dir.resolve(fileName(version))).summary());
            }
        }
        summaries.sort(
                Comparator.comparing(SnapshotSummary::workflowId)
                        .thenComparingLong(SnapshotSummary::version));
        return summaries;
    }

    @Override
    public List<WorkflowSnapshot> listLatest() {
        List<WorkflowSnapshot> latest = new ArrayList<>();
        for (String workflowId : workflowIds()) {
            getLatest(workflowId).ifPresent(latest::add);
        }
        latest.sort(Comparator.comparing(WorkflowSnapshot::workflowId));
        return latest;
    }

    @Override
    public int delete(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        synchronized (lockFor(workflowId)) {
            Path dir = directoryOf(workflowId);
            int removed = versions(dir).size();
            deleteDirectory(dir);
            return removed;
        }
    }

    @Override
    public int deleteTerminalOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");

        int removed = 0;
        for (String workflowId : workflowIds()) {
            synchronized (lockFor(workflowId)) {
                Optional<WorkflowSnapshot> latest = getLatest(workflowId);
                if (latest.isPresent()
                        && latest.get().status().isTerminal()
                        && latest.get().updatedAt().isBefore(cutoff)) {
                    deleteDirectory(directoryOf(workflowId));
                    removed++;
                }
            }
        }
        return removed;
    }

    private WorkflowSnapshot read(Path file) {
        try {
            return mapper.readValue(file.toFile(), WorkflowSnapshot.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warning("Atomic move not supported, falling back to plain move: " + target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private long latestVersion(Path dir) {
        List<Long> versions = versions(dir);
        return versions.isEmpty() ? 0 : versions.get(versions.size() - 1);
    }

    private static List<Long> versions(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .filter(stem -> !stem.isEmpty() && stem.chars().allMatch(Character::isDigit))
                    .map(Long::parseLong)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list snapshots in " + dir, e);
        }
    }

    private List<String> workflowIds() {
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .map(this::workflowIdOf)
                    .flatMap(Optional::stream)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list snapshot directory " + root, e);
        }
    }

    private Optional<String> workflowIdOf(Path dir) {
        String name = dir.getFileName().toString();
        if (name.indexOf(HASH_MARK) < 0) {
            return Optional.of(decode(name));
        }
        long last = latestVersion(dir);
        return last == 0
                ? Optional.empty()
                : Optional.of(read(dir.resolve(fileName(last))).workflowId());
    }

    private static void deleteDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(
                    file -> {
                        try {
                            Files.deleteIfExists(file);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
            Files.deleteIfExists(dir);
        } catch (IOException | UncheckedIOException e) {
            throw new StorageException("Failed to delete snapshots in " + dir, e);
        }
    }

    private Object lockFor(String workflowId) {
        return locks.computeIfAbsent(workflowId, id -> new Object());
    }

    private Path directoryOf(String workflowId) {
        return root.resolve(encode(workflowId));
    }

    private static String fileName(long version) {
        return String.format("%012d", version) + SUFFIX;
    }

    // Dots are escaped as well so "." and ".." cannot name a directory outside the root.
    static String encode(String workflowId) {
        String encoded =
                URLEncoder.encode(workflowId, StandardCharsets.UTF_8)
                        .replace(".", "%2E")
                        .replace("*", "%2A");
        if (encoded.length() <= MAX_DIRECTORY_NAME) {
            return encoded;
        }
        return encoded.substring(0, HASHED_PREFIX) + HASH_MARK + sha256(workflowId);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String decode(String directoryName) {
        return URLDecoder.decode(directoryName, StandardCharsets.UTF_8);
    }
}
