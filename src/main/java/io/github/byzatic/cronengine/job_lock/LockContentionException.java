package io.github.byzatic.cronengine.job_lock;

/**
 * A stale lock was removed but another acquirer re-created it first.
 */
public class LockContentionException extends JobLockException {
    public LockContentionException(String cronId) {
        super(cronId, "Lock contention for \"" + cronId + "\" (lost race on retry)");
    }
}
