package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.job_lock.JobLockException;
import io.github.byzatic.cronengine.job_lock.JobLockInterface;
import io.github.byzatic.cronengine.job_lock.LockHeldException;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory lock that remembers every acquire and release.
 */
class RecordingLock implements JobLockInterface {
    final Map<String, String> held = new ConcurrentHashMap<>();
    final List<String> acquired = new CopyOnWriteArrayList<>();
    final List<String> released = new CopyOnWriteArrayList<>();
    final AtomicInteger acquireCalls = new AtomicInteger();
    private final AtomicInteger seq = new AtomicInteger();

    void holdByOtherProcess(String cronId) {
        held.put(cronId, "foreign");
    }

    @Override
    public @NotNull String acquire(@NotNull Path lockDir, @NotNull String cronId) throws JobLockException {
        acquireCalls.incrementAndGet();
        String token = "tok-" + seq.incrementAndGet();
        if (held.putIfAbsent(cronId, token) != null) {
            throw new LockHeldException(cronId, 4242L);
        }
        acquired.add(token);
        return token;
    }

    @Override
    public void release(@NotNull Path lockDir, @NotNull String cronId, @NotNull String token) {
        released.add(token);
        held.remove(cronId, token);
    }

    @Override
    public boolean isHeld(@NotNull Path lockDir, @NotNull String cronId) {
        return held.containsKey(cronId);
    }
}
