package io.github.byzatic.cronengine.definition_sync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobDefinitionWatcherTest {

    @TempDir
    Path dir;

    private JobDefinitionWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) watcher.close();
    }

    /**
     * Collects events as "TYPE:fileName" and opens a latch per expected event count.
     */
    private static final class Recorder implements DefinitionChangeListener {
        final List<String> events = new CopyOnWriteArrayList<>();
        volatile CountDownLatch latch = new CountDownLatch(1);

        void expect(int n) {
            latch = new CountDownLatch(n);
        }

        private void add(String type, Path file) {
            events.add(type + ":" + file.getFileName());
            latch.countDown();
        }

        @Override
        public void onDefinitionCreated(Path file) {
            add("CREATED", file);
        }

        @Override
        public void onDefinitionModified(Path file) {
            add("MODIFIED", file);
        }

        @Override
        public void onDefinitionDeleted(Path file) {
            add("DELETED", file);
        }
    }

    private static void write(Path file, String content) throws Exception {
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void polling_reportsCreateModifyAndDelete() throws Exception {
        Recorder recorder = new Recorder();
        watcher = JobDefinitionWatcher.builder()
                .rootPath(dir)
                .listener(recorder)
                .pollingIntervalMillis(50)
                .debounceWindowMillis(0)
                .build();
        watcher.start();
        assertTrue(watcher.isRunning());

        Path file = dir.resolve("standup.json");
        recorder.expect(1);
        write(file, "{}");
        assertTrue(recorder.latch.await(5, TimeUnit.SECONDS));
        assertEquals("CREATED:standup.json", recorder.events.get(0));

        recorder.expect(1);
        write(file, "{\"name\":\"changed\"}");
        assertTrue(recorder.latch.await(5, TimeUnit.SECONDS));
        assertEquals("MODIFIED:standup.json", recorder.events.get(1));

        recorder.expect(1);
        Files.delete(file);
        assertTrue(recorder.latch.await(5, TimeUnit.SECONDS));
        assertEquals("DELETED:standup.json", recorder.events.get(2));
    }

    @Test
    void filesPresentAtStartup_andOtherSuffixes_areNotReported() throws Exception {
        write(dir.resolve("existing.json"), "{}");
        Recorder recorder = new Recorder();
        watcher = JobDefinitionWatcher.builder()
                .rootPath(dir)
                .listener(recorder)
                .pollingIntervalMillis(50)
                .debounceWindowMillis(0)
                .build();
        watcher.start();

        write(dir.resolve("notes.txt"), "x");
        recorder.expect(1);
        write(dir.resolve("fresh.json"), "{}");

        assertTrue(recorder.latch.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(List.of("CREATED:fresh.json"), recorder.events);
    }

    @Test
    void debounce_holdsChangesUntilFileSettles() throws Exception {
        Recorder recorder = new Recorder();
        watcher = JobDefinitionWatcher.builder()
                .rootPath(dir)
                .listener(recorder)
                .pollingIntervalMillis(TimeUnit.HOURS.toMillis(1))
                .debounceWindowMillis(500)
                .build();
        watcher.start();
        // let the initial scheduled scan pass before driving scans by hand
        Thread.sleep(300);

        Path file = dir.resolve("standup.json");
        write(file, "{}");
        watcher.scanOnce(1_000);
        watcher.scanOnce(1_200);
        Thread.sleep(200);
        assertTrue(recorder.events.isEmpty());

        recorder.expect(1);
        watcher.scanOnce(1_600);
        assertTrue(recorder.latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("CREATED:standup.json"), recorder.events);
    }

    @Test
    void debounce_createThenDeleteWithinWindow_reportsNothing() throws Exception {
        Recorder recorder = new Recorder();
        watcher = JobDefinitionWatcher.builder()
                .rootPath(dir)
                .listener(recorder)
                .pollingIntervalMillis(TimeUnit.HOURS.toMillis(1))
                .debounceWindowMillis(500)
                .build();
        watcher.start();
        Thread.sleep(300);

        Path file = dir.resolve("scratch.json");
        write(file, "{}");
        watcher.scanOnce(1_000);
        Files.delete(file);
        watcher.scanOnce(1_100);
        watcher.scanOnce(5_000);

        Thread.sleep(300);
        assertTrue(recorder.events.isEmpty());
    }

    @Test
    void close_stopsWatcher() throws Exception {
        watcher = JobDefinitionWatcher.builder()
                .rootPath(dir)
                .listener(new Recorder())
                .build();
        watcher.start();

        watcher.close();

        assertFalse(watcher.isRunning());
    }

    @Test
    void build_rejectsMissingDirectory() {
        assertThrows(Exception.class, () -> JobDefinitionWatcher.builder()
                .rootPath(dir.resolve("missing"))
                .listener(new Recorder())
                .build());
    }
}
