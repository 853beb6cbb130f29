package io.github.byzatic.cronengine.platform;

import io.github.byzatic.cronengine.run_record.RunRecord;
import io.github.byzatic.cronengine.schedulers.CronJob;
import org.jetbrains.annotations.NotNull;

/**
 * Operator-facing status surface. Every call is best-effort from the engine's point of view:
 * exceptions thrown here are logged and never change a run's outcome.
 */
public interface StatusReporter {

    StatusReporter NOOP = new StatusReporter() {
        @Override
        public void runtimeError(@NotNull StatusContext context, @NotNull String message) {
        }

        @Override
        public void actionFailed(@NotNull String actionType, @NotNull String error) {
        }
    };

    void runtimeError(@NotNull StatusContext context, @NotNull String message);

    void actionFailed(@NotNull String actionType, @NotNull String error);

    /**
     * Marks the job as running on any external status display.
     */
    default void markRunning(@NotNull CronJob job) {
    }

    /**
     * Creates or edits the job's status message from its current run record.
     */
    default void upsertStatus(@NotNull CronJob job, @NotNull RunRecord record) {
    }
}
