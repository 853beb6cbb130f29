package io.github.byzatic.cronengine.job_lock;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads liveness from {@link ProcessHandle} and start times from {@code /proc/{pid}/stat}.
 * On platforms without procfs the start time is always {@code null}, so PID reuse goes undetected there.
 */
public final class ProcProcessInspector implements ProcessInspector {
    private final static Logger logger = LoggerFactory.getLogger(ProcProcessInspector.class);

    // starttime is field 22; fields are counted from the one after the ")" that ends comm (field 2)
    private static final int START_TIME_INDEX = 22 - 3;

    private final Path procRoot;

    public ProcProcessInspector() {
        this(Paths.get("/proc"));
    }

    ProcProcessInspector(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public boolean isAlive(long pid) {
        if (pid <= 0) return false;
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public @Nullable Long startTime(long pid) {
        Path stat = procRoot.resolve(Long.toString(pid)).resolve("stat");
        try {
            return parseStartTime(new String(Files.readAllBytes(stat), StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.trace("No start time for pid {}: {}", pid, e.toString());
            return null;
        }
    }

    /**
     * Extracts the starttime field from the content of a {@code /proc/{pid}/stat} file.
     * The command name may itself contain spaces and parentheses, so parsing starts after the last ')'.
     */
    static @Nullable Long parseStartTime(String stat) {
        int closeParen = stat.lastIndexOf(')');
        if (closeParen < 0 || closeParen + 2 > stat.length()) return null;
        String[] fields = stat.substring(closeParen + 2).trim().split(" ");
        if (fields.length <= START_TIME_INDEX) return null;
        try {
            return Long.parseLong(fields[START_TIME_INDEX]);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
