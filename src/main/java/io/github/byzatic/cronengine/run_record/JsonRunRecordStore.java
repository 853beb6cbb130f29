package io.github.byzatic.cronengine.run_record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Run records kept in one versioned JSON file: {@code {version, updatedAt, jobs: {cronId: record}}}.
 * <p>
 * Several processes may share the file. Every mutation takes an exclusive lock on the sidecar
 * {@code <file>.lock}, re-reads the file, applies its change to the one affected record and rewrites the file
 * through a temp file and an atomic rename before returning. Readers reload the file when it has been replaced
 * since they last saw it. Ordering of writes for one cronId is the caller's job lock.
 */
@ThreadSafe
public final class JsonRunRecordStore implements RunRecordStoreInterface {
    private final static Logger logger = LoggerFactory.getLogger(JsonRunRecordStore.class);

    public static final int STORE_VERSION = 1;
    public static final int MAX_ERROR_LENGTH = 200;

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    // FileChannel locks are held per JVM, so stores in one process sharing a file queue here first
    private static final ConcurrentMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockPath;
    private final Clock clock;

    @GuardedBy("this")
    private StoreFile store;

    @GuardedBy("this")
    private @Nullable FileStamp seen;

    private JsonRunRecordStore(Path path, StoreFile store, @Nullable FileStamp seen, Clock clock) {
        this.path = path;
        this.lockPath = path.resolveSibling(path.getFileName() + ".lock");
        this.store = store;
        this.seen = seen;
        this.clock = clock;
    }

    /**
     * Loads the store from {@code path}. A missing file yields an empty store; an unreadable one is logged
     * and replaced by an empty store on the next write.
     */
    public static @NotNull JsonRunRecordStore load(@NotNull Path path) throws IOException {
        return load(path, Clock.systemUTC());
    }

    public static @NotNull JsonRunRecordStore load(@NotNull Path path, @NotNull Clock clock) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(clock, "clock");
        FileStamp stamp = FileStamp.of(path);
        return new JsonRunRecordStore(path, read(path, clock), stamp, clock);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized @NotNull Optional<RunRecord> getRecord(@NotNull String cronId) {
        refreshIfReplaced();
        RunRecord r = store.jobs.get(cronId);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    public synchronized @NotNull Optional<RunRecord> getRecordByThreadId(@NotNull String threadId) {
        refreshIfReplaced();
        for (RunRecord r : store.jobs.values()) {
            if (threadId.equals(r.getThreadId())) return Optional.of(r.copy());
        }
        return Optional.empty();
    }

    public synchronized @NotNull List<RunRecord> listRecords() {
        refreshIfReplaced();
        List<RunRecord> out = new ArrayList<>(store.jobs.size());
        for (RunRecord r : store.jobs.values()) out.add(r.copy());
        return out;
    }

    /**
     * Creates the record if missing, then applies the non-null fields of {@code update}.
     */
    public synchronized @NotNull RunRecord upsertRecord(@NotNull String cronId, @Nullable String threadId,
                                                        @Nullable RecordUpdate update) throws IOException {
        return mutate(jobs -> {
            RunRecord r = jobs.computeIfAbsent(cronId, id -> new RunRecord(id, threadId));
            if (threadId != null) r.setThreadId(threadId);
            if (update != null) update.applyTo(r);
            return r.copy();
        });
    }

    public @NotNull RunRecord upsertRecord(@NotNull String cronId, @Nullable String threadId) throws IOException {
        return upsertRecord(cronId, threadId, null);
    }

    @Override
    public synchronized void recordRun(@NotNull String cronId, @NotNull RunStatus status,
                                       @Nullable String error) throws IOException {
        Objects.requireNonNull(status, "status");
        mutate(jobs -> {
            RunRecord r = jobs.computeIfAbsent(cronId, id -> new RunRecord(id, null));
            r.setRunCount(r.getRunCount() + 1);
            r.setLastRunAt(clock.instant());
            r.setLastStatus(status);
            r.setLastError(status == RunStatus.ERROR ? truncate(error) : null);
            return Boolean.TRUE;
        });
    }

    /**
     * Pins the model for one job; {@code null} clears the override.
     */
    public synchronized void setModelOverride(@NotNull String cronId, @Nullable String model) throws IOException {
        mutate(jobs -> {
            jobs.computeIfAbsent(cronId, id -> new RunRecord(id, null)).setModelOverride(model);
            return Boolean.TRUE;
        });
    }

    public synchronized boolean removeRecord(@NotNull String cronId) throws IOException {
        return mutate(jobs -> jobs.remove(cronId) != null);
    }

    public synchronized boolean removeByThreadId(@NotNull String threadId) throws IOException {
        return mutate(jobs -> jobs.values().removeIf(r -> threadId.equals(r.getThreadId())));
    }

    synchronized int version() {
        return store.version;
    }

    static @Nullable String truncate(@Nullable String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * Runs {@code change} against the freshest on-disk content while holding both the in-process and the
     * cross-process lock, then writes the result back. Nothing is written when the change returns {@code false}.
     */
    @GuardedBy("this")
    private <R> R mutate(Function<Map<String, RunRecord>, R> change) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        ReentrantLock local = IN_PROCESS_LOCKS.computeIfAbsent(path.toAbsolutePath().normalize(),
                p -> new ReentrantLock());
        local.lock();
        try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            store = read(path, clock);
            R result = change.apply(store.jobs);
            if (!Boolean.FALSE.equals(result)) persist();
            seen = FileStamp.of(path);
            return result;
        } finally {
            local.unlock();
        }
    }

    @GuardedBy("this")
    private void refreshIfReplaced() {
        try {
            FileStamp current = FileStamp.of(path);
            if (Objects.equals(current, seen)) return;
            logger.debug("cron:stats store {} changed on disk, reloading", path);
            store = read(path, clock);
            seen = current;
        } catch (IOException e) {
            logger.warn("cron:stats store {} could not be reloaded, serving last known content", path, e);
        }
    }

    @GuardedBy("this")
    private void persist() throws IOException {
        store.updatedAt = clock.millis();
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp." + ProcessHandle.current().pid());
        Files.write(tmp, MAPPER.writeValueAsBytes(store));
        Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private static StoreFile read(Path path, Clock clock) throws IOException {
        try {
            StoreFile file = MAPPER.readValue(Files.readAllBytes(path), StoreFile.class);
            if (file.jobs == null) file.jobs = new LinkedHashMap<>();
            return file;
        } catch (NoSuchFileException e) {
            return StoreFile.empty(clock.millis());
        } catch (JsonProcessingException e) {
            logger.warn("cron:stats store {} is corrupt, starting empty: {}", path, e.getOriginalMessage());
            return StoreFile.empty(clock.millis());
        }
    }

    /**
     * Identity of the file on disk. Each write replaces the file by rename, so a new file key or a new
     * modification time means another writer got there.
     */
    private static final class FileStamp {
        private final @Nullable Object fileKey;
        private final FileTime modified;
        private final long size;

        private FileStamp(@Nullable Object fileKey, FileTime modified, long size) {
            this.fileKey = fileKey;
            this.modified = modified;
            this.size = size;
        }

        static @Nullable FileStamp of(Path path) throws IOException {
            try {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                return new FileStamp(attrs.fileKey(), attrs.lastModifiedTime(), attrs.size());
            } catch (NoSuchFileException e) {
                return null;
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FileStamp)) return false;
            FileStamp other = (FileStamp) o;
            return size == other.size && Objects.equals(fileKey, other.fileKey) && modified.equals(other.modified);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fileKey, modified, size);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class StoreFile {
        public int version = STORE_VERSION;
        public long updatedAt;
        public Map<String, RunRecord> jobs = new LinkedHashMap<>();

        static StoreFile empty(long now) {
            StoreFile f = new StoreFile();
            f.updatedAt = now;
            return f;
        }
    }
}
