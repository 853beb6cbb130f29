package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.platform.StatusContext;
import io.github.byzatic.cronengine.platform.StatusReporter;
import io.github.byzatic.cronengine.run_record.RunRecord;
import io.github.byzatic.cronengine.schedulers.CronJob;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingStatus implements StatusReporter {
    final List<String> runtimeErrors = new CopyOnWriteArrayList<>();
    final List<StatusContext> contexts = new CopyOnWriteArrayList<>();
    final List<String> actionFailures = new CopyOnWriteArrayList<>();
    final List<String> markedRunning = new CopyOnWriteArrayList<>();
    final List<RunRecord> upserts = new CopyOnWriteArrayList<>();
    volatile boolean failCosmeticUpdates;

    @Override
    public void runtimeError(@NotNull StatusContext context, @NotNull String message) {
        contexts.add(context);
        runtimeErrors.add(message);
    }

    @Override
    public void actionFailed(@NotNull String actionType, @NotNull String error) {
        actionFailures.add(actionType + ": " + error);
    }

    @Override
    public void markRunning(@NotNull CronJob job) {
        if (failCosmeticUpdates) throw new IllegalStateException("status message deleted");
        markedRunning.add(job.getId());
    }

    @Override
    public void upsertStatus(@NotNull CronJob job, @NotNull RunRecord record) {
        if (failCosmeticUpdates) throw new IllegalStateException("status message deleted");
        upserts.add(record);
    }
}
