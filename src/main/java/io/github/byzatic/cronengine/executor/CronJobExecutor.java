package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.actions.ActionContext;
import io.github.byzatic.cronengine.actions.ActionDispatcher;
import io.github.byzatic.cronengine.actions.ActionRequest;
import io.github.byzatic.cronengine.actions.ActionResult;
import io.github.byzatic.cronengine.actions.ParsedActions;
import io.github.byzatic.cronengine.job_lock.JobLockException;
import io.github.byzatic.cronengine.output.OutputFormatter;
import io.github.byzatic.cronengine.output.UserErrorMessages;
import io.github.byzatic.cronengine.platform.DeliveryChannel;
import io.github.byzatic.cronengine.platform.Scope;
import io.github.byzatic.cronengine.platform.StatusContext;
import io.github.byzatic.cronengine.run_record.RunRecord;
import io.github.byzatic.cronengine.run_record.RunRecordStoreInterface;
import io.github.byzatic.cronengine.run_record.RunStatus;
import io.github.byzatic.cronengine.runtime.ImageData;
import io.github.byzatic.cronengine.runtime.InvocationEvent;
import io.github.byzatic.cronengine.runtime.InvocationRequest;
import io.github.byzatic.cronengine.runtime.InvocationStream;
import io.github.byzatic.cronengine.schedulers.CronJob;
import io.github.byzatic.cronengine.schedulers.JobTickHandler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one tick of a scheduled job end to end: overlap guard, job lock, target resolution, runtime
 * invocation, optional actions, chunked delivery and run recording.
 * <p>
 * {@link #execute(CronJob, ExecutorContext)} never throws. Whatever happens inside a run, the job's
 * {@code running} flag is cleared and an acquired lock is released with the token it was acquired with.
 * Lock contention is a silent skip and leaves no run record.
 */
public class CronJobExecutor implements JobTickHandler {
    private static final Logger logger = LoggerFactory.getLogger(CronJobExecutor.class);

    private final ExecutorContext context;
    private final ExecutionStats stats = new ExecutionStats();

    public CronJobExecutor(@NotNull ExecutorContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public @NotNull ExecutorContext getContext() {
        return context;
    }

    public @NotNull ExecutionStats getStats() {
        return stats;
    }

    @Override
    public void onTick(CronJob job) {
        execute(job, context);
    }

    public void execute(@NotNull CronJob job, @NotNull ExecutorContext ctx) {
        if (!job.tryMarkRunning()) {
            stats.recordSkippedOverlap();
            logger.warn("cron:skip previous run still active job={} name={}", job.getId(), job.getName());
            return;
        }

        String lockToken = null;
        Path lockDir = ctx.getLockDir();
        if (lockDir != null && job.hasCronId()) {
            try {
                lockToken = ctx.getJobLock().acquire(lockDir, job.getCronId());
            } catch (JobLockException e) {
                job.clearRunning();
                stats.recordSkippedLock();
                logger.debug("cron:skip lock not acquired job={} cronId={}: {}", job.getId(), job.getCronId(), e.getMessage());
                return;
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                job.clearRunning();
                stats.recordSkippedLock();
                logger.warn("cron:skip lock acquire failed job={} cronId={}", job.getId(), job.getCronId(), e);
                return;
            }
        }

        Run run = new Run(job, ctx);
        try {
            switch (run.perform()) {
                case SUCCESS:
                    stats.recordSuccess();
                    break;
                case EMPTY:
                    stats.recordEmpty();
                    break;
                case ERROR:
                    stats.recordError();
                    break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.recordError();
            run.fail("interrupted", e);
        } catch (Exception | Error e) {
            rethrowIfFatal(e);
            stats.recordError();
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        } finally {
            finish(job, ctx, lockDir, lockToken);
        }
    }

    private void finish(CronJob job, ExecutorContext ctx, @Nullable Path lockDir, @Nullable String lockToken) {
        if (lockToken != null && lockDir != null) {
            try {
                ctx.getJobLock().release(lockDir, job.getCronId(), lockToken);
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec lock release failed job={} cronId={}", job.getId(), job.getCronId(), e);
            }
        }
        job.clearRunning();

        RunRecordStoreInterface store = ctx.getRecordStore();
        if (store != null && job.hasCronId()) {
            try {
                Optional<RunRecord> record = store.getRecord(job.getCronId());
                if (record.isPresent()) {
                    ctx.getStatus().upsertStatus(job, record.get());
                }
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec status message update failed job={}", job.getId(), e);
            }
        }
    }

    /**
     * Errors the JVM cannot recover from are let through; anything else a collaborator throws ends the run.
     */
    private static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) throw (VirtualMachineError) t;
    }

    private enum Outcome {
        SUCCESS, EMPTY, ERROR
    }

    /**
     * State of a single run. The resolved channel is kept so that a late failure can still be surfaced there.
     */
    private static final class Run {
        private final CronJob job;
        private final ExecutorContext ctx;
        private final String sessionKey;
        private DeliveryChannel channel;

        Run(CronJob job, ExecutorContext ctx) {
            this.job = job;
            this.ctx = ctx;
            this.sessionKey = "cron:" + job.getId();
        }

        Outcome perform() throws Exception {
            String channelName = job.getDefinition().getChannel();

            Scope scope = ctx.getDelivery().resolveScope(job.getGuildId());
            if (scope == null) {
                return configError(null, "scope " + job.getGuildId() + " not found");
            }
            channel = ctx.getDelivery().resolveChannel(scope, channelName);
            if (channel == null) {
                return configError(channelName, "target channel \"" + channelName + "\" not found");
            }
            if (!isAllowed(channel, ctx.getAllowChannelIds())) {
                DeliveryChannel rejected = channel;
                channel = null;
                logger.debug("cron:exec rejected channel {}", rejected);
                return configError(channelName, "target channel \"" + channelName + "\" not allowlisted");
            }

            String model = resolveModel();
            String prompt = PromptBuilder.build(job, ctx.getPermissionNote());

            try {
                ctx.getStatus().markRunning(job);
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.debug("cron:exec pre-run status update failed job={}", job.getId(), e);
            }

            logger.info("cron:exec start job={} name={} channel={} model={}", job.getId(), job.getName(), channelName, model);

            InvocationRequest request = InvocationRequest.builder()
                    .prompt(prompt)
                    .model(model)
                    .cwd(ctx.getCwd())
                    .timeout(ctx.getTimeout())
                    .tools(ctx.getTools())
                    .sessionKey(sessionKey)
                    .build();

            String finalText = null;
            StringBuilder fallback = new StringBuilder();
            List<ImageData> images = new ArrayList<>();
            try (InvocationStream stream = ctx.getRuntime().invoke(request)) {
                while (stream.hasNext()) {
                    InvocationEvent evt = stream.next();
                    switch (evt.getType()) {
                        case TEXT_FINAL:
                            finalText = evt.getText();
                            break;
                        case TEXT_DELTA:
                            fallback.append(evt.getText());
                            break;
                        case LOG_LINE:
                            fallback.append(evt.getText()).append('\n');
                            break;
                        case IMAGE_DATA:
                            images.add(evt.getImage());
                            break;
                        case ERROR:
                            return runtimeError(evt.getText());
                        case DONE:
                            break;
                    }
                }
            }

            String output = finalText != null && !finalText.isEmpty() ? finalText : fallback.toString();
            if (output.isBlank() && images.isEmpty()) {
                logger.warn("cron:exec empty output job={}", job.getId());
                record(RunStatus.SKIPPED, null);
                return Outcome.EMPTY;
            }

            String text = ctx.isActionsEnabled() ? applyActions(output, scope) : output;

            String shaped = OutputFormatter.truncateCodeBlocks(text, ctx.getCodeBlockMaxLines());
            for (String chunk : OutputFormatter.split(shaped, ctx.getChunkLimit())) {
                if (!chunk.isBlank()) {
                    ctx.getDelivery().send(channel, chunk);
                }
            }
            if (!images.isEmpty()) {
                ctx.getDelivery().sendImages(channel, images);
            }

            logger.info("cron:exec done job={} name={} channel={}", job.getId(), job.getName(), channelName);
            record(RunStatus.SUCCESS, null);
            return Outcome.SUCCESS;
        }

        void fail(String message, Throwable cause) {
            logger.error("cron:exec failed job={}", job.getId(), cause);
            report(message);
            notifyChannel(message);
            record(RunStatus.ERROR, message);
        }

        private String resolveModel() {
            RunRecordStoreInterface store = ctx.getRecordStore();
            if (store == null || !job.hasCronId()) {
                return ctx.getDefaultModel();
            }
            return store.getRecord(job.getCronId())
                    .map(r -> r.effectiveModel(ctx.getDefaultModel()))
                    .orElse(ctx.getDefaultModel());
        }

        private String applyActions(String output, Scope scope) {
            ActionDispatcher dispatcher = Objects.requireNonNull(ctx.getActionDispatcher());
            ParsedActions parsed = dispatcher.parse(output, ctx.getEnabledCategories());
            List<ActionRequest> actions = parsed.getActions();
            if (actions.isEmpty()) {
                return parsed.getCleanText();
            }
            List<ActionResult> results = dispatcher.execute(actions, new ActionContext(scope, channel));
            for (int i = 0; i < results.size() && i < actions.size(); i++) {
                ActionResult result = results.get(i);
                if (!result.isOk()) {
                    try {
                        ctx.getStatus().actionFailed(actions.get(i).getType(), String.valueOf(result.getError()));
                    } catch (Exception | Error e) {
                        rethrowIfFatal(e);
                        logger.warn("cron:exec action failure report failed job={}", job.getId(), e);
                    }
                }
            }
            String lines = results.stream().map(ActionResult::toResultLine).collect(Collectors.joining("\n"));
            return parsed.getCleanText().stripTrailing() + "\n\n" + lines;
        }

        private Outcome configError(@Nullable String channelName, String reason) {
            logger.error("cron:exec {} job={}", reason, job.getId());
            try {
                ctx.getStatus().runtimeError(new StatusContext(sessionKey, channelName),
                        "Cron \"" + job.getName() + "\": " + reason);
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec status report failed job={}", job.getId(), e);
            }
            record(RunStatus.ERROR, reason);
            return Outcome.ERROR;
        }

        private Outcome runtimeError(String message) {
            logger.error("cron:exec runtime error job={}: {}", job.getId(), message);
            report(message);
            notifyChannel(message);
            record(RunStatus.ERROR, message);
            return Outcome.ERROR;
        }

        private void report(String message) {
            try {
                ctx.getStatus().runtimeError(new StatusContext(sessionKey, job.getDefinition().getChannel()),
                        "Cron \"" + job.getName() + "\": " + message);
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec status report failed job={}", job.getId(), e);
            }
        }

        private void notifyChannel(String message) {
            if (channel == null) {
                return;
            }
            try {
                ctx.getDelivery().send(channel, UserErrorMessages.map(message));
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec could not deliver error notice job={}", job.getId(), e);
            }
        }

        private void record(RunStatus status, @Nullable String error) {
            RunRecordStoreInterface store = ctx.getRecordStore();
            if (store == null || !job.hasCronId()) {
                return;
            }
            try {
                store.recordRun(job.getCronId(), status, error);
            } catch (Exception | Error e) {
                rethrowIfFatal(e);
                logger.warn("cron:exec run record write failed job={} status={}", job.getId(), status, e);
            }
        }

        private static boolean isAllowed(DeliveryChannel channel, @Nullable Set<String> allowChannelIds) {
            if (allowChannelIds == null) {
                return true;
            }
            return allowChannelIds.contains(channel.getId())
                    || (channel.getParentId() != null && allowChannelIds.contains(channel.getParentId()));
        }
    }
}
