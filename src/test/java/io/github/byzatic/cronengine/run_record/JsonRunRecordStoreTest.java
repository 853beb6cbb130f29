package io.github.byzatic.cronengine.run_record;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRunRecordStoreTest {

    private static final Instant NOW = Instant.parse("2025-08-08T09:00:00Z");

    @TempDir
    Path dir;

    private JsonRunRecordStore newStore() throws Exception {
        return JsonRunRecordStore.load(dir.resolve("cron-run-stats.json"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void missingFile_loadsEmpty() throws Exception {
        JsonRunRecordStore store = newStore();
        assertTrue(store.listRecords().isEmpty());
        assertEquals(JsonRunRecordStore.STORE_VERSION, store.version());
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    void corruptFile_loadsEmpty_andIsReplacedOnWrite() throws Exception {
        Path file = dir.resolve("cron-run-stats.json");
        Files.writeString(file, "{ not json");

        JsonRunRecordStore store = newStore();
        assertTrue(store.listRecords().isEmpty());

        store.recordRun("cron-1", RunStatus.SUCCESS);
        assertEquals(1, newStore().listRecords().size());
    }

    @Test
    void recordRun_createsRecordLazily_andCountsRuns() throws Exception {
        JsonRunRecordStore store = newStore();

        store.recordRun("cron-1", RunStatus.SUCCESS);
        store.recordRun("cron-1", RunStatus.SUCCESS);

        RunRecord r = store.getRecord("cron-1").orElseThrow();
        assertEquals(2, r.getRunCount());
        assertEquals(RunStatus.SUCCESS, r.getLastStatus());
        assertEquals(NOW, r.getLastRunAt());
        assertNull(r.getLastError());
    }

    @Test
    void recordRun_error_truncatesMessage_andSuccessClearsIt() throws Exception {
        JsonRunRecordStore store = newStore();
        String longError = "x".repeat(500);

        store.recordRun("cron-1", RunStatus.ERROR, longError);
        RunRecord failed = store.getRecord("cron-1").orElseThrow();
        assertEquals(RunStatus.ERROR, failed.getLastStatus());
        assertEquals(JsonRunRecordStore.MAX_ERROR_LENGTH, failed.getLastError().length());

        store.recordRun("cron-1", RunStatus.SUCCESS);
        assertNull(store.getRecord("cron-1").orElseThrow().getLastError());
    }

    @Test
    void skippedRun_isRecordedWithoutError() throws Exception {
        JsonRunRecordStore store = newStore();
        store.recordRun("cron-1", RunStatus.SKIPPED, "ignored");

        RunRecord r = store.getRecord("cron-1").orElseThrow();
        assertEquals(RunStatus.SKIPPED, r.getLastStatus());
        assertNull(r.getLastError());
    }

    @Test
    void writesSurviveReload_inVersionedJsonLayout() throws Exception {
        JsonRunRecordStore store = newStore();
        store.upsertRecord("cron-1", "thread-1", RecordUpdate.builder().cadence("daily").model("haiku").build());
        store.recordRun("cron-1", RunStatus.ERROR, "rate limited");

        JsonRunRecordStore reloaded = newStore();
        RunRecord r = reloaded.getRecord("cron-1").orElseThrow();
        assertEquals("thread-1", r.getThreadId());
        assertEquals("daily", r.getCadence());
        assertEquals("haiku", r.getModel());
        assertEquals("rate limited", r.getLastError());

        JsonNode root = JsonRunRecordStore.MAPPER.readTree(store.getPath().toFile());
        assertEquals(1, root.get("version").asInt());
        assertEquals("error", root.path("jobs").path("cron-1").path("lastStatus").asText());
        assertEquals("2025-08-08T09:00:00Z", root.path("jobs").path("cron-1").path("lastRunAt").asText());
        assertFalse(Files.list(dir).anyMatch(p -> p.getFileName().toString().contains(".tmp")));
    }

    @Test
    void upsert_appliesOnlyNonNullFields() throws Exception {
        JsonRunRecordStore store = newStore();
        store.upsertRecord("cron-1", "thread-1",
                RecordUpdate.builder().cadence("hourly").purposeTags(List.of("report")).build());
        store.upsertRecord("cron-1", null, RecordUpdate.builder().disabled(true).build());

        RunRecord r = store.getRecord("cron-1").orElseThrow();
        assertEquals("thread-1", r.getThreadId());
        assertEquals("hourly", r.getCadence());
        assertEquals(List.of("report"), r.getPurposeTags());
        assertTrue(r.isDisabled());
    }

    @Test
    void effectiveModel_prefersOverride_thenClassified_thenDefault() throws Exception {
        JsonRunRecordStore store = newStore();
        store.upsertRecord("cron-1", null);
        assertEquals("default", store.getRecord("cron-1").orElseThrow().effectiveModel("default"));

        store.upsertRecord("cron-1", null, RecordUpdate.builder().model("haiku").build());
        assertEquals("haiku", store.getRecord("cron-1").orElseThrow().effectiveModel("default"));

        store.setModelOverride("cron-1", "opus");
        assertEquals("opus", store.getRecord("cron-1").orElseThrow().effectiveModel("default"));

        store.setModelOverride("cron-1", null);
        assertEquals("haiku", store.getRecord("cron-1").orElseThrow().effectiveModel("default"));
    }

    @Test
    void returnedRecordsAreCopies() throws Exception {
        JsonRunRecordStore store = newStore();
        store.recordRun("cron-1", RunStatus.SUCCESS);

        store.getRecord("cron-1").orElseThrow().setRunCount(99);

        assertEquals(1, store.getRecord("cron-1").orElseThrow().getRunCount());
    }

    @Test
    void lookupAndRemovalByThreadId() throws Exception {
        JsonRunRecordStore store = newStore();
        store.upsertRecord("cron-1", "thread-1");
        store.upsertRecord("cron-2", "thread-2");

        assertEquals("cron-2", store.getRecordByThreadId("thread-2").orElseThrow().getCronId());
        assertTrue(store.removeByThreadId("thread-2"));
        assertFalse(store.removeByThreadId("thread-2"));
        assertTrue(store.getRecord("cron-2").isEmpty());

        assertTrue(store.removeRecord("cron-1"));
        assertFalse(store.removeRecord("cron-1"));
        assertTrue(newStore().listRecords().isEmpty());
    }

    @Test
    void twoStoresOnOneFile_keepEachOthersRecords() throws Exception {
        JsonRunRecordStore a = newStore();
        JsonRunRecordStore b = newStore();

        a.recordRun("cron-aaaa", RunStatus.SUCCESS);
        b.recordRun("cron-bbbb", RunStatus.ERROR, "boom");

        JsonRunRecordStore reloaded = newStore();
        assertEquals(1, reloaded.getRecord("cron-aaaa").orElseThrow().getRunCount());
        assertEquals(RunStatus.ERROR, reloaded.getRecord("cron-bbbb").orElseThrow().getLastStatus());
        assertTrue(a.getRecord("cron-bbbb").isPresent());
    }

    @Test
    void modelOverrideFromAnotherStore_isVisibleWithoutReload() throws Exception {
        JsonRunRecordStore a = newStore();
        JsonRunRecordStore b = newStore();
        b.recordRun("cron-1", RunStatus.SUCCESS);
        assertNull(b.getRecord("cron-1").orElseThrow().getModelOverride());

        a.setModelOverride("cron-1", "opus");

        RunRecord seenByB = b.getRecord("cron-1").orElseThrow();
        assertEquals("opus", seenByB.getModelOverride());
        assertEquals(1, seenByB.getRunCount());
    }

    @Test
    void concurrentWritersOnOneFile_loseNoRuns() throws Exception {
        JsonRunRecordStore a = newStore();
        JsonRunRecordStore b = newStore();
        int perWriter = 20;
        Thread ta = new Thread(() -> writeRuns(a, "cron-aaaa", perWriter));
        Thread tb = new Thread(() -> writeRuns(b, "cron-bbbb", perWriter));
        ta.start();
        tb.start();
        ta.join(10_000);
        tb.join(10_000);

        JsonRunRecordStore reloaded = newStore();
        assertEquals(perWriter, reloaded.getRecord("cron-aaaa").orElseThrow().getRunCount());
        assertEquals(perWriter, reloaded.getRecord("cron-bbbb").orElseThrow().getRunCount());
    }

    private static void writeRuns(JsonRunRecordStore store, String cronId, int times) {
        try {
            for (int i = 0; i < times; i++) store.recordRun(cronId, RunStatus.SUCCESS);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void truncate_leavesShortAndNullUntouched() {
        assertNull(JsonRunRecordStore.truncate(null));
        assertEquals("short", JsonRunRecordStore.truncate("short"));
    }
}
