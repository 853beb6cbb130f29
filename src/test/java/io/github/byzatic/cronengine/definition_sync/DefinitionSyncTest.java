package io.github.byzatic.cronengine.definition_sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.byzatic.cronengine.run_record.JsonRunRecordStore;
import io.github.byzatic.cronengine.run_record.RunRecord;
import io.github.byzatic.cronengine.schedulers.CronJob;
import io.github.byzatic.cronengine.schedulers.JobDefinition;
import io.github.byzatic.cronengine.schedulers.JobScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionSyncTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tmp;

    private Path defs;
    private JobScheduler scheduler;
    private JsonRunRecordStore store;
    private DefinitionSync sync;

    @BeforeEach
    void setUp() throws Exception {
        defs = Files.createDirectories(tmp.resolve("defs"));
        scheduler = JobScheduler.builder().handler(job -> {
        }).build();
        store = JsonRunRecordStore.load(tmp.resolve("cron-stats.json"));
        sync = new DefinitionSync(scheduler, store, defs);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private Path write(String name, String json) throws Exception {
        Path file = defs.resolve(name);
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String definition(String cronId, String schedule) {
        return "{"
                + (cronId != null ? "\"cronId\":\"" + cronId + "\"," : "")
                + "\"name\":\"Daily standup\",\"guildId\":\"g1\",\"threadId\":\"t1\","
                + "\"channel\":\"#general\",\"prompt\":\"Summarize yesterday\","
                + "\"schedule\":\"" + schedule + "\",\"timezone\":\"Europe/Berlin\",\"owner\":\"ops\"}";
    }

    @Test
    void syncAll_registersValidDefinitions_andSkipsInvalidOnes() throws Exception {
        write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        write("broken.json", "{ not json");
        write("incomplete.json", "{\"name\":\"x\",\"guildId\":\"g1\",\"schedule\":\"0 9 * * *\",\"channel\":\"c\"}");
        write("notes.txt", "ignored");

        assertEquals(1, sync.syncAll());

        CronJob job = scheduler.getJob("standup").orElseThrow();
        assertEquals("cron-a1", job.getCronId());
        assertEquals("g1", job.getGuildId());
        assertEquals("t1", job.getThreadId());
        assertEquals("Europe/Berlin", job.getDefinition().getTimezone());
        assertFalse(scheduler.getJob("broken").isPresent());
        assertFalse(scheduler.getJob("incomplete").isPresent());
        assertEquals(1, scheduler.listJobs().size());
    }

    @Test
    void apply_generatesCronId_andWritesItBackKeepingOtherFields() throws Exception {
        Path file = write("standup.json", definition(null, "0 9 * * 1-5"));

        CronJob job = sync.apply(file).orElseThrow();

        assertTrue(job.hasCronId());
        JsonNode written = JSON.readTree(file.toFile());
        assertEquals(job.getCronId(), written.get("cronId").asText());
        assertEquals("ops", written.get("owner").asText());
        assertEquals("Summarize yesterday", written.get("prompt").asText());
        assertFalse(Files.exists(defs.resolve("standup.json.tmp")));
    }

    @Test
    void apply_upsertsRunRecord() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));

        sync.apply(file);

        RunRecord record = store.getRecord("cron-a1").orElseThrow();
        assertEquals("t1", record.getThreadId());
        assertEquals(0, record.getRunCount());
        assertTrue(Files.exists(store.getPath()));
    }

    @Test
    void apply_unchangedDefinition_keepsExistingRegistration() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        CronJob first = sync.apply(file).orElseThrow();

        CronJob second = sync.apply(file).orElseThrow();

        assertSame(first, second);
    }

    @Test
    void apply_changedSchedule_replacesRegistration() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        CronJob first = sync.apply(file).orElseThrow();

        write("standup.json", definition("cron-a1", "30 10 * * *"));
        CronJob second = sync.apply(file).orElseThrow();

        assertNotSame(first, second);
        assertEquals("30 10 * * *", scheduler.getJob("standup").orElseThrow().getDefinition().getSchedule());
        assertEquals("cron-a1", second.getCronId());
    }

    @Test
    void apply_invalidUpdate_leavesPreviousRegistrationActive() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        sync.apply(file);

        write("standup.json", definition("cron-a1", "not a schedule"));
        Optional<CronJob> result = sync.apply(file);

        assertFalse(result.isPresent());
        assertEquals("0 9 * * 1-5", scheduler.getJob("standup").orElseThrow().getDefinition().getSchedule());
    }

    @Test
    void apply_disabledDefinition_unregistersJob() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        sync.apply(file);

        write("standup.json", definition("cron-a1", "0 9 * * 1-5").replace("\"owner\"", "\"disabled\":true,\"owner\""));

        assertFalse(sync.apply(file).isPresent());
        assertFalse(scheduler.getJob("standup").isPresent());
    }

    @Test
    void onDefinitionDeleted_unregistersJob() throws Exception {
        Path file = write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        sync.onDefinitionCreated(file);
        assertTrue(scheduler.getJob("standup").isPresent());

        Files.delete(file);
        sync.onDefinitionDeleted(file);

        assertFalse(scheduler.getJob("standup").isPresent());
    }

    @Test
    void syncAll_dropsJobsWhoseFileIsGone() throws Exception {
        write("standup.json", definition("cron-a1", "0 9 * * 1-5"));
        Path other = write("digest.json", definition("cron-b2", "0 8 * * 1"));
        assertEquals(2, sync.syncAll());

        Files.delete(other);

        assertEquals(1, sync.syncAll());
        assertTrue(scheduler.getJob("standup").isPresent());
        assertFalse(scheduler.getJob("digest").isPresent());
    }

    @Test
    void syncAll_leavesJobsRegisteredByOthersAlone() throws Exception {
        scheduler.register("manual", null, "g1", "Manual",
                new JobDefinition("0 9 * * *", null, "general", "hi"), "cron-m");

        sync.syncAll();

        assertTrue(scheduler.getJob("manual").isPresent());
    }

    @Test
    void jobIdOf_stripsSuffix() {
        assertEquals("standup", DefinitionSync.jobIdOf(Path.of("/x/standup.json")));
        assertEquals("README", DefinitionSync.jobIdOf(Path.of("README")));
    }
}
