package io.github.byzatic.cronengine.schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Due signal for one job. Entries whose generation no longer matches the registration are dropped,
 * which is how re-registration and disabling invalidate ticks already queued.
 * <p>
 * The delay is measured against the scheduler's clock, so a fixed or offset clock shifts firing as well.
 */
final class ScheduledEntry implements Delayed {
    final String jobId;
    final long generation;
    final long triggerAtMillis;
    private final Clock clock;

    ScheduledEntry(String jobId, long generation, Instant triggerAt, Clock clock) {
        this.jobId = jobId;
        this.generation = generation;
        this.triggerAtMillis = triggerAt.toEpochMilli();
        this.clock = clock;
    }

    boolean isCurrentFor(JobRecord rec) {
        return rec != null && rec.enabled && rec.generation == generation;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(triggerAtMillis - clock.millis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other instanceof ScheduledEntry) {
            int byTime = Long.compare(triggerAtMillis, ((ScheduledEntry) other).triggerAtMillis);
            return byTime != 0 ? byTime : jobId.compareTo(((ScheduledEntry) other).jobId);
        }
        return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public String toString() {
        return "ScheduledEntry{jobId='" + jobId + "', generation=" + generation +
                ", triggerAt=" + Instant.ofEpochMilli(triggerAtMillis) + '}';
    }
}
