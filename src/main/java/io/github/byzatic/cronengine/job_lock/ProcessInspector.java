package io.github.byzatic.cronengine.job_lock;

import org.jetbrains.annotations.Nullable;

/**
 * Source of process facts used to decide whether a lock owner is still around.
 */
public interface ProcessInspector {

    long currentPid();

    /**
     * @return {@code true} if a process with this PID exists, even if it belongs to another user
     */
    boolean isAlive(long pid);

    /**
     * Start time of the process in platform units (clock ticks since boot on Linux).
     *
     * @return start time, or {@code null} when unavailable on this platform or for this PID
     */
    @Nullable Long startTime(long pid);
}
