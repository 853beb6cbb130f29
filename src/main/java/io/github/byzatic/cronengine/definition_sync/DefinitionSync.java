package io.github.byzatic.cronengine.definition_sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.byzatic.cronengine.base_exceptions.ValidationException;
import io.github.byzatic.cronengine.run_record.CronIds;
import io.github.byzatic.cronengine.run_record.JsonRunRecordStore;
import io.github.byzatic.cronengine.schedulers.CronJob;
import io.github.byzatic.cronengine.schedulers.JobDefinition;
import io.github.byzatic.cronengine.schedulers.JobScheduler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the scheduler registry in step with a directory of JSON job definitions.
 * <p>
 * A definition without a {@code cronId} gets a generated one, written back into its file so that the id
 * survives restarts. Invalid files are logged and skipped; a previously valid registration stays active.
 */
public class DefinitionSync implements DefinitionChangeListener {
    private final static Logger logger = LoggerFactory.getLogger(DefinitionSync.class);

    public static final String SUFFIX = ".json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final JobScheduler scheduler;
    private final JsonRunRecordStore recordStore;
    private final Path directory;
    private final Set<String> managedIds = ConcurrentHashMap.newKeySet();

    public DefinitionSync(@NotNull JobScheduler scheduler, @Nullable JsonRunRecordStore recordStore,
                          @NotNull Path directory) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.recordStore = recordStore;
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public @NotNull Path getDirectory() {
        return directory;
    }

    public static @NotNull String jobIdOf(@NotNull Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
    }

    /**
     * Loads every definition file in the directory and drops registrations whose file is gone.
     *
     * @return number of jobs registered or already up to date
     */
    public int syncAll() throws IOException {
        Set<String> present = ConcurrentHashMap.newKeySet();
        int ok = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) continue;
                present.add(jobIdOf(file));
                if (apply(file).isPresent()) ok++;
            }
        }
        for (String id : Set.copyOf(managedIds)) {
            if (!present.contains(id)) {
                remove(id);
            }
        }
        logger.info("cron:defs synced {} job(s) from {}", ok, directory);
        return ok;
    }

    /**
     * Registers or updates the job described by {@code file}.
     *
     * @return the registered job, or empty when the file is unreadable, invalid or disabled
     */
    public @NotNull Optional<CronJob> apply(@NotNull Path file) {
        String jobId = jobIdOf(file);
        DefinitionFile def;
        try {
            def = read(file);
        } catch (NoSuchFileException e) {
            logger.debug("cron:defs {} vanished before it could be read", file);
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("cron:defs cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        try {
            validate(def);
        } catch (ValidationException e) {
            logger.warn("cron:defs invalid definition {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        if (Boolean.TRUE.equals(def.disabled)) {
            remove(jobId);
            logger.info("cron:defs {} is disabled", jobId);
            return Optional.empty();
        }

        String cronId = def.cronId;
        if (cronId == null || cronId.isBlank()) {
            cronId = CronIds.generate();
            try {
                writeCronId(file, cronId);
            } catch (IOException e) {
                logger.warn("cron:defs cannot persist generated cronId for {}, job not registered", file, e);
                return Optional.empty();
            }
        }

        JobDefinition definition = new JobDefinition(def.schedule, def.timezone, def.channel, def.prompt);
        Optional<CronJob> current = scheduler.getJob(jobId);
        if (current.isPresent() && isSame(current.get(), def, cronId, definition)) {
            managedIds.add(jobId);
            return current;
        }

        CronJob job;
        try {
            job = scheduler.register(jobId, def.threadId, def.guildId, def.name, definition, cronId);
        } catch (ValidationException e) {
            logger.warn("cron:defs invalid definition {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        managedIds.add(jobId);

        if (recordStore != null) {
            try {
                recordStore.upsertRecord(cronId, def.threadId);
            } catch (IOException e) {
                logger.warn("cron:defs run record upsert failed for cronId={}", cronId, e);
            }
        }
        return Optional.of(job);
    }

    public boolean remove(@NotNull String jobId) {
        managedIds.remove(jobId);
        return scheduler.unregister(jobId);
    }

    @Override
    public void onDefinitionCreated(Path file) {
        apply(file);
    }

    @Override
    public void onDefinitionModified(Path file) {
        apply(file);
    }

    @Override
    public void onDefinitionDeleted(Path file) {
        String jobId = jobIdOf(file);
        if (remove(jobId)) {
            logger.info("cron:defs {} removed with its definition file", jobId);
        }
    }

    static DefinitionFile read(Path file) throws IOException {
        return MAPPER.readValue(file.toFile(), DefinitionFile.class);
    }

    private static void validate(DefinitionFile def) throws ValidationException {
        requireText("name", def.name);
        requireText("guildId", def.guildId);
        requireText("schedule", def.schedule);
        requireText("channel", def.channel);
        requireText("prompt", def.prompt);
    }

    private static void requireText(String field, String value) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
    }

    private static boolean isSame(CronJob job, DefinitionFile def, String cronId, JobDefinition definition) {
        return job.getCronId().equals(cronId)
                && job.getName().equals(def.name)
                && job.getGuildId().equals(def.guildId)
                && Objects.equals(job.getThreadId(), def.threadId)
                && job.getDefinition().equals(definition);
    }

    /**
     * Adds {@code cronId} to the file, keeping every other field as written.
     */
    private static void writeCronId(Path file, String cronId) throws IOException {
        ObjectNode tree;
        try {
            tree = (ObjectNode) MAPPER.readTree(file.toFile());
        } catch (JsonProcessingException | ClassCastException e) {
            throw new IOException("definition is not a JSON object: " + file, e);
        }
        tree.put("cronId", cronId);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), tree);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("cron:defs assigned cronId={} to {}", cronId, file);
    }
}
