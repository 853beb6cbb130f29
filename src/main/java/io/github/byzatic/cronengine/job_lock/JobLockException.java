package io.github.byzatic.cronengine.job_lock;

/**
 * Base class for expected lock-acquisition failures. None of them is a run outcome:
 * the tick is skipped and the next acquirer tries again.
 */
public abstract class JobLockException extends Exception {
    private final String cronId;

    protected JobLockException(String cronId, String message) {
        super(message);
        this.cronId = cronId;
    }

    public String getCronId() {
        return cronId;
    }
}
