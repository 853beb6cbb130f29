package io.github.byzatic.cronengine.job_lock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * File-system job lock.
 * <p>
 * Layout: {@code {lockDir}/{sanitized(cronId)}.{hash8(cronId)}.lock/meta.json}. The directory's existence
 * is the claim; the token inside {@code meta.json} is the only credential accepted by {@link #release}.
 *
 * <h3>Staleness</h3>
 * <ul>
 *   <li>No readable metadata and the directory is younger than the grace period: another acquirer is
 *       mid-write, fail with {@link LockInitializingException}.</li>
 *   <li>No readable metadata and older than the grace period: orphaned, removed.</li>
 *   <li>Owner PID dead: removed.</li>
 *   <li>Owner PID alive but its start time differs from the recorded one: the PID was recycled, removed.</li>
 * </ul>
 * After removing a stale lock the create is retried exactly once; losing that race is reported as
 * {@link LockContentionException}.
 * <p>
 * There is no heartbeat: a lock left behind by a killed process is reclaimed by the next acquirer.
 */
@ThreadSafe
public class DirectoryJobLock implements JobLockInterface {
    private final static Logger logger = LoggerFactory.getLogger(DirectoryJobLock.class);

    static final String META_FILE = "meta.json";
    static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(2);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ProcessInspector inspector;
    private final Duration gracePeriod;
    private final Clock clock;

    public DirectoryJobLock() {
        this(new ProcProcessInspector(), DEFAULT_GRACE_PERIOD, Clock.systemUTC());
    }

    public DirectoryJobLock(@NotNull ProcessInspector inspector) {
        this(inspector, DEFAULT_GRACE_PERIOD, Clock.systemUTC());
    }

    public DirectoryJobLock(@NotNull ProcessInspector inspector, @NotNull Duration gracePeriod, @NotNull Clock clock) {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Collision-resistant lock name: characters outside {@code [a-zA-Z0-9._-]} become {@code _} and the first
     * 8 hex chars of SHA-256 over the full id are appended, so {@code "a/b"} and {@code "a_b"} never share a lock.
     */
    public static @NotNull String lockName(@NotNull String cronId) {
        String sanitized = cronId.replaceAll("[^a-zA-Z0-9._-]", "_");
        String hash = Hashing.sha256().hashString(cronId, StandardCharsets.UTF_8).toString().substring(0, 8);
        return sanitized + "." + hash;
    }

    public static @NotNull Path lockPath(@NotNull Path lockDir, @NotNull String cronId) {
        return lockDir.resolve(lockName(cronId) + ".lock");
    }

    @Override
    public @NotNull String acquire(@NotNull Path lockDir, @NotNull String cronId) throws JobLockException, IOException {
        Objects.requireNonNull(lockDir, "lockDir");
        Objects.requireNonNull(cronId, "cronId");
        Files.createDirectories(lockDir);

        Path lockPath = lockPath(lockDir, cronId);
        long pid = inspector.currentPid();
        LockMeta meta = new LockMeta(pid, generateToken(), clock.instant().toString(), inspector.startTime(pid));

        if (tryCreate(lockPath, meta)) {
            logger.debug("cron:lock acquired cronId={} path={}", cronId, lockPath);
            return meta.getToken();
        }

        LockMeta existing = readMeta(lockPath);
        if (existing == null) {
            long age = directoryAgeMillis(lockPath);
            if (age < gracePeriod.toMillis()) {
                throw new LockInitializingException(cronId, age);
            }
            logger.debug("cron:lock orphaned (no meta, age {}ms), removing cronId={}", age, cronId);
            removeStaleLock(lockPath);
        } else if (inspector.isAlive(existing.getPid())) {
            Long recorded = existing.getStartTime();
            Long live = inspector.startTime(existing.getPid());
            if (recorded != null && live != null && !recorded.equals(live)) {
                logger.debug("cron:lock pid {} reused (startTime {} != {}), removing cronId={}",
                        existing.getPid(), recorded, live, cronId);
                removeStaleLock(lockPath);
            } else {
                throw new LockHeldException(cronId, existing.getPid());
            }
        } else {
            logger.debug("cron:lock owner pid {} is gone, removing cronId={}", existing.getPid(), cronId);
            removeStaleLock(lockPath);
        }

        if (tryCreate(lockPath, meta)) {
            logger.debug("cron:lock acquired after stale removal cronId={}", cronId);
            return meta.getToken();
        }
        throw new LockContentionException(cronId);
    }

    @Override
    public void release(@NotNull Path lockDir, @NotNull String cronId, @NotNull String token) throws IOException {
        Path lockPath = lockPath(lockDir, cronId);
        LockMeta meta = readMeta(lockPath);
        if (meta == null) return;
        if (meta.getToken().equals(token)) {
            deleteRecursively(lockPath);
            logger.debug("cron:lock released cronId={}", cronId);
        } else {
            logger.debug("cron:lock release ignored, token does not match current owner pid={} cronId={}",
                    meta.getPid(), cronId);
        }
    }

    @Override
    public boolean isHeld(@NotNull Path lockDir, @NotNull String cronId) {
        return readMeta(lockPath(lockDir, cronId)) != null;
    }

    /**
     * Deletes a lock directory judged stale. Overridable so races with other acquirers can be reproduced.
     */
    void removeStaleLock(Path lockPath) throws IOException {
        deleteRecursively(lockPath);
    }

    private boolean tryCreate(Path lockPath, LockMeta meta) throws IOException {
        try {
            Files.createDirectory(lockPath);
        } catch (FileAlreadyExistsException e) {
            return false;
        }
        try {
            writeMeta(lockPath, meta);
        } catch (IOException e) {
            // we own the empty directory, do not leave it to wait out the grace period
            deleteRecursively(lockPath);
            throw e;
        }
        return true;
    }

    private void writeMeta(Path lockPath, LockMeta meta) throws IOException {
        Path target = lockPath.resolve(META_FILE);
        Path tmp = lockPath.resolve(META_FILE + ".tmp." + meta.getPid());
        Files.write(tmp, (MAPPER.writeValueAsString(meta) + "\n").getBytes(StandardCharsets.UTF_8));
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    static @Nullable LockMeta readMeta(Path lockPath) {
        Path metaPath = lockPath.resolve(META_FILE);
        try {
            JsonNode node = MAPPER.readTree(Files.readAllBytes(metaPath));
            if (node == null || !node.path("pid").isNumber() || !node.path("token").isTextual()) {
                return null;
            }
            JsonNode startTime = node.path("startTime");
            return new LockMeta(
                    node.get("pid").asLong(),
                    node.get("token").asText(),
                    node.path("acquiredAt").asText(null),
                    startTime.isNumber() ? startTime.asLong() : null);
        } catch (IOException e) {
            return null;
        }
    }

    private long directoryAgeMillis(Path lockPath) {
        try {
            long modified = Files.getLastModifiedTime(lockPath).toMillis();
            return Math.max(0, clock.millis() - modified);
        } catch (IOException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        try {
            MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (NoSuchFileException ignore) {
            // already gone
        }
    }

    private static String generateToken() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
