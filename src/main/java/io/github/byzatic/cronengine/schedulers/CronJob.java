package io.github.byzatic.cronengine.schedulers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registered scheduled job.
 * <p>
 * Scheduling fields are fixed at registration and owned by {@link JobScheduler}; re-registering creates a
 * new instance. The {@code running} flag belongs to the executor for the duration of one run and is only a
 * same-process overlap guard; cross-process exclusion comes from the job lock keyed by {@link #getCronId()}.
 */
public final class CronJob {
    private final String id;
    private final String cronId;
    private final String threadId;
    private final String guildId;
    private final String name;
    private final JobDefinition definition;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CronJob(@NotNull String id, @Nullable String cronId, @Nullable String threadId, @NotNull String guildId,
                   @NotNull String name, @NotNull JobDefinition definition) {
        this.id = Objects.requireNonNull(id, "id");
        this.cronId = cronId == null ? "" : cronId;
        this.threadId = threadId;
        this.guildId = Objects.requireNonNull(guildId, "guildId");
        this.name = Objects.requireNonNull(name, "name");
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    /**
     * Process-local id, e.g. the id of the thread or file the definition came from.
     */
    public @NotNull String getId() {
        return id;
    }

    /**
     * Stable id surviving restarts; key of the job lock and run record. Empty when the job has none yet.
     */
    public @NotNull String getCronId() {
        return cronId;
    }

    public boolean hasCronId() {
        return !cronId.isEmpty();
    }

    public @Nullable String getThreadId() {
        return threadId;
    }

    public @NotNull String getGuildId() {
        return guildId;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull JobDefinition getDefinition() {
        return definition;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claims the overlap guard.
     *
     * @return {@code false} if a run is already in progress in this process
     */
    public boolean tryMarkRunning() {
        return running.compareAndSet(false, true);
    }

    public void clearRunning() {
        running.set(false);
    }

    @Override
    public String toString() {
        return "CronJob{id='" + id + "', cronId='" + cronId + "', name='" + name + "', " + definition + '}';
    }
}
