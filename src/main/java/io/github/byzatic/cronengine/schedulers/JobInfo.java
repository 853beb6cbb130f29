package io.github.byzatic.cronengine.schedulers;

import java.time.Instant;

/**
 * Read-only view of a registered job for reporting.
 */
public final class JobInfo {
    public final String id;
    public final String cronId;
    public final String name;
    public final String schedule;
    public final String timezone;
    public final Instant nextRun;
    public final boolean enabled;
    public final boolean running;

    JobInfo(String id, String cronId, String name, String schedule, String timezone,
            Instant nextRun, boolean enabled, boolean running) {
        this.id = id;
        this.cronId = cronId;
        this.name = name;
        this.schedule = schedule;
        this.timezone = timezone;
        this.nextRun = nextRun;
        this.enabled = enabled;
        this.running = running;
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", cronId='" + cronId + "', name='" + name + "', schedule='" + schedule +
                "', timezone=" + timezone + ", nextRun=" + nextRun + ", enabled=" + enabled +
                ", running=" + running + '}';
    }
}
