package io.github.byzatic.cronengine.definition_sync;

import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;
import org.apache.commons.vfs2.FileSystemManager;
import org.apache.commons.vfs2.VFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one directory (Apache Commons VFS) for job definition files and reports settled changes.
 * <p>
 * Only regular files whose name ends with the configured suffix are tracked; subdirectories are ignored.
 * Changes of one file are coalesced until it has been quiet for the debounce window, so an editor's
 * write-rename sequence arrives as a single event. Files present at construction are considered known and
 * produce no event; load them explicitly with {@link DefinitionSync#syncAll()}.
 */
@Beta
@ThreadSafe
public class JobDefinitionWatcher implements Closeable {
    private final static Logger logger = LoggerFactory.getLogger(JobDefinitionWatcher.class);

    private static final FileObject[] EMPTY = new FileObject[0];

    private final FileObject rootDir;
    private final String suffix;
    private final DefinitionChangeListener listener;
    private final long pollingIntervalMillis;
    private final long debounceWindowMillis;

    private final ScheduledExecutorService poller;
    private final ExecutorService eventDispatcher;
    private final BlockingQueue<DefinitionEvent> eventQueue;

    private final Map<Path, FileSnapshot> knownFiles = new ConcurrentHashMap<>();
    @GuardedBy("this")
    private final Map<Path, Pending> pending = new LinkedHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private JobDefinitionWatcher(Builder b) throws FileSystemException {
        FileSystemManager fsManager = b.fsManager != null ? b.fsManager : VFS.getManager();
        this.rootDir = fsManager.resolveFile(Objects.requireNonNull(b.rootUri, "rootUri"));
        if (!rootDir.exists() || !rootDir.isFolder()) {
            throw new FileSystemException("Definition directory must exist and be a directory: " + b.rootUri);
        }
        this.suffix = b.suffix;
        this.listener = Objects.requireNonNull(b.listener, "listener");
        this.pollingIntervalMillis = b.pollingIntervalMillis;
        this.debounceWindowMillis = b.debounceWindowMillis;
        this.eventQueue = new ArrayBlockingQueue<>(b.maxQueueSize);

        this.poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-defs-poller");
            t.setDaemon(true);
            return t;
        });
        this.eventDispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cron-defs-dispatcher");
            t.setDaemon(true);
            return t;
        });

        primeKnownFiles();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start polling. No-op if already running.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) return;

        eventDispatcher.submit(this::dispatchLoop);
        poller.scheduleAtFixedRate(() -> {
            try {
                scanOnce(System.currentTimeMillis());
            } catch (Exception e) {
                logger.error("cron:defs scan failed, will retry on next poll", e);
            }
        }, 0, pollingIntervalMillis, TimeUnit.MILLISECONDS);
        logger.debug("cron:defs watching {} every {}ms", rootDir.getName().getPath(), pollingIntervalMillis);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        poller.shutdownNow();
        eventDispatcher.shutdownNow();
    }

    // ======== Internal ========

    private void dispatchLoop() {
        while (running.get()) {
            DefinitionEvent ev;
            try {
                ev = eventQueue.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            if (ev == null) continue;
            try {
                switch (ev.type) {
                    case CREATED:
                        listener.onDefinitionCreated(ev.path);
                        break;
                    case MODIFIED:
                        listener.onDefinitionModified(ev.path);
                        break;
                    case DELETED:
                        listener.onDefinitionDeleted(ev.path);
                        break;
                }
            } catch (RuntimeException e) {
                logger.error("cron:defs listener failed for {}", ev, e);
            }
        }
    }

    private void primeKnownFiles() throws FileSystemException {
        for (FileObject fo : children()) {
            if (!isDefinition(fo)) continue;
            knownFiles.put(toLocalPath(fo), FileSnapshot.of(fo));
        }
    }

    /**
     * One poll: diff the directory against the last snapshot, then release changes that have settled.
     */
    synchronized void scanOnce(long nowMillis) throws FileSystemException {
        Set<Path> seen = new HashSet<>();
        for (FileObject fo : children()) {
            if (!isDefinition(fo)) continue;
            Path p = toLocalPath(fo);
            seen.add(p);

            FileSnapshot current;
            try {
                fo.refresh();
                current = FileSnapshot.of(fo);
            } catch (FileSystemException e) {
                logger.debug("cron:defs cannot read {}, retrying next poll: {}", p, e.getMessage());
                continue;
            }
            FileSnapshot prev = knownFiles.put(p, current);
            if (prev == null) {
                note(new DefinitionEvent(p, DefinitionEvent.Type.CREATED), nowMillis);
            } else if (!prev.equals(current)) {
                note(new DefinitionEvent(p, DefinitionEvent.Type.MODIFIED), nowMillis);
            }
        }
        for (Path p : new ArrayList<>(knownFiles.keySet())) {
            if (!seen.contains(p)) {
                knownFiles.remove(p);
                note(new DefinitionEvent(p, DefinitionEvent.Type.DELETED), nowMillis);
            }
        }
        release(nowMillis);
    }

    private void note(DefinitionEvent event, long nowMillis) {
        Pending prev = pending.get(event.path);
        DefinitionEvent merged = DefinitionEvent.merge(prev == null ? null : prev.event, event);
        if (merged == null) {
            pending.remove(event.path);
        } else {
            pending.put(event.path, new Pending(merged, nowMillis));
        }
    }

    private void release(long nowMillis) {
        List<DefinitionEvent> ready = new ArrayList<>();
        for (Iterator<Pending> it = pending.values().iterator(); it.hasNext(); ) {
            Pending p = it.next();
            if (nowMillis - p.lastChangeMillis >= debounceWindowMillis) {
                ready.add(p.event);
                it.remove();
            }
        }
        for (DefinitionEvent ev : ready) {
            if (!eventQueue.offer(ev)) {
                logger.warn("cron:defs event queue full, dropping {}", ev);
            }
        }
    }

    private FileObject[] children() {
        try {
            rootDir.refresh();
            FileObject[] kids = rootDir.getChildren();
            return kids != null ? kids : EMPTY;
        } catch (FileSystemException e) {
            logger.warn("cron:defs cannot list {}: {}", rootDir.getName().getPath(), e.getMessage());
            return EMPTY;
        }
    }

    private boolean isDefinition(FileObject fo) {
        try {
            return fo.isFile() && fo.getName().getBaseName().endsWith(suffix);
        } catch (FileSystemException e) {
            logger.debug("cron:defs skipping {}: {}", fo.getName().getPath(), e.getMessage());
            return false;
        }
    }

    private static Path toLocalPath(FileObject fo) {
        return Paths.get(fo.getName().getPath());
    }

    private static final class Pending {
        final DefinitionEvent event;
        final long lastChangeMillis;

        Pending(DefinitionEvent event, long lastChangeMillis) {
            this.event = event;
            this.lastChangeMillis = lastChangeMillis;
        }
    }

    public static class Builder {
        private FileSystemManager fsManager;
        private String rootUri;
        private String suffix = ".json";
        private DefinitionChangeListener listener;
        private long pollingIntervalMillis = 1000;
        private long debounceWindowMillis = 500;
        private int maxQueueSize = 1024;

        public Builder fsManager(FileSystemManager fsManager) {
            this.fsManager = fsManager;
            return this;
        }

        /**
         * Directory URI, e.g. "file:///var/lib/bot/crons".
         */
        public Builder rootUri(String rootUri) {
            this.rootUri = rootUri;
            return this;
        }

        public Builder rootPath(Path path) {
            Objects.requireNonNull(path, "path");
            this.rootUri = path.toUri().toString();
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = Objects.requireNonNull(suffix, "suffix");
            return this;
        }

        public Builder listener(DefinitionChangeListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder pollingIntervalMillis(long interval) {
            if (interval <= 0) throw new IllegalArgumentException("interval must be > 0");
            this.pollingIntervalMillis = interval;
            return this;
        }

        /**
         * Quiet period a file must reach before its change is reported; 0 reports on the next poll.
         */
        public Builder debounceWindowMillis(long millis) {
            if (millis < 0) throw new IllegalArgumentException("millis must be >= 0");
            this.debounceWindowMillis = millis;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            if (maxQueueSize <= 0) throw new IllegalArgumentException("maxQueueSize must be > 0");
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public JobDefinitionWatcher build() throws FileSystemException {
            Objects.requireNonNull(rootUri, "rootUri");
            Objects.requireNonNull(listener, "listener");
            return new JobDefinitionWatcher(this);
        }
    }
}
