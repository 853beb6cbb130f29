package io.github.byzatic.cronengine.job_lock;

/**
 * The lock is owned by a live process.
 */
public class LockHeldException extends JobLockException {
    private final long ownerPid;

    public LockHeldException(String cronId, long ownerPid) {
        super(cronId, "Lock held by PID " + ownerPid + " for \"" + cronId + "\"");
        this.ownerPid = ownerPid;
    }

    public long getOwnerPid() {
        return ownerPid;
    }
}
