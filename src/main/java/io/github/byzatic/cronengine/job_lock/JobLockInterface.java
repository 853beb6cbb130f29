package io.github.byzatic.cronengine.job_lock;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Cross-process mutex keyed by a job's stable cronId.
 */
public interface JobLockInterface {

    /**
     * Claims the lock for {@code cronId}.
     *
     * @return token that must be presented to {@link #release(Path, String, String)}
     * @throws LockHeldException         a live process owns the lock
     * @throws LockInitializingException another acquirer is still writing its metadata
     * @throws LockContentionException   a stale lock was reclaimed by someone else first
     * @throws IOException               unexpected filesystem failure
     */
    @NotNull String acquire(@NotNull Path lockDir, @NotNull String cronId) throws JobLockException, IOException;

    /**
     * Removes the lock if {@code token} matches its metadata. Absent locks and foreign tokens are ignored.
     */
    void release(@NotNull Path lockDir, @NotNull String cronId, @NotNull String token) throws IOException;

    /**
     * Read-only check: a lock directory with readable metadata exists.
     */
    boolean isHeld(@NotNull Path lockDir, @NotNull String cronId);
}
