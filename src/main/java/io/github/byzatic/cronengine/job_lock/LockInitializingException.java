package io.github.byzatic.cronengine.job_lock;

/**
 * The lock directory exists but its metadata has not been written yet and the directory
 * is still inside the grace period.
 */
public class LockInitializingException extends JobLockException {
    private final long directoryAgeMillis;

    public LockInitializingException(String cronId, long directoryAgeMillis) {
        super(cronId, "Lock initializing for \"" + cronId + "\" (dir age: " + directoryAgeMillis + "ms)");
        this.directoryAgeMillis = directoryAgeMillis;
    }

    public long getDirectoryAgeMillis() {
        return directoryAgeMillis;
    }
}
