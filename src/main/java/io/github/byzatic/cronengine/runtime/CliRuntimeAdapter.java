package io.github.byzatic.cronengine.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.cronengine.base_exceptions.ExternalProcessException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an agent CLI as a subprocess per invocation.
 * <p>
 * Command line: {@code <binary> -p --model M [--dangerously-skip-permissions] [--output-format F
 * [--include-partial-messages]] [--tools a,b] <prompt>}.
 * <ul>
 *   <li>{@code TEXT}: every stdout line is a delta; the whole stdout becomes the final text on exit 0.</li>
 *   <li>{@code STREAM_JSON}: stdout is line-delimited JSON; text fields become deltas and their
 *       concatenation the final text.</li>
 * </ul>
 * A non-zero exit or a timeout ends the stream with an error event carrying stderr (or stdout) as message.
 * Live subprocesses are tracked so {@link #killActive()} can terminate them on shutdown. {@link #close()} also
 * stops the threads that pump process output.
 */
@ThreadSafe
public final class CliRuntimeAdapter implements RuntimeAdapter {
    private final static Logger logger = LoggerFactory.getLogger(CliRuntimeAdapter.class);

    public enum OutputFormat {
        TEXT("text"), STREAM_JSON("stream-json");

        private final String flag;

        OutputFormat(String flag) {
            this.flag = flag;
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long PUMP_DRAIN_MILLIS = 5_000;

    private final String binary;
    private final boolean dangerouslySkipPermissions;
    private final OutputFormat outputFormat;
    private final boolean echoStdio;
    private final ExecutorService io;
    private final Set<Process> active = ConcurrentHashMap.newKeySet();

    private CliRuntimeAdapter(Builder b) {
        this.binary = Objects.requireNonNull(b.binary, "binary");
        this.dangerouslySkipPermissions = b.dangerouslySkipPermissions;
        this.outputFormat = b.outputFormat;
        this.echoStdio = b.echoStdio;
        AtomicInteger seq = new AtomicInteger();
        this.io = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runtime-cli-io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public @NotNull String id() {
        return "cli:" + binary;
    }

    @Override
    public @NotNull InvocationStream invoke(@NotNull InvocationRequest request) throws ExternalProcessException {
        if (io.isShutdown()) {
            throw new IllegalStateException("runtime adapter " + id() + " is closed");
        }
        List<String> command = buildCommand(request);
        ProcessBuilder pb = new ProcessBuilder(command).directory(request.getCwd().toFile());
        Map<String, String> env = pb.environment();
        env.putIfAbsent("NO_COLOR", "1");
        env.putIfAbsent("FORCE_COLOR", "0");
        env.putIfAbsent("TERM", "dumb");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExternalProcessException("Failed to start runtime binary " + binary, e);
        }
        active.add(process);
        logger.debug("runtime:cli started pid={} model={}", process.pid(), request.getModel());

        InvocationStreams.QueueStream stream = InvocationStreams.queue(() -> {
            if (process.isAlive()) process.destroyForcibly();
            active.remove(process);
        });
        io.submit(() -> supervise(process, request, stream));
        return stream;
    }

    @Override
    public void killActive() {
        for (Process p : new ArrayList<>(active)) {
            logger.info("runtime:cli killing pid={}", p.pid());
            p.destroyForcibly();
        }
        active.clear();
    }

    @Override
    public void close() {
        if (io.isShutdown()) return;
        killActive();
        io.shutdownNow();
        logger.debug("runtime:cli closed {}", id());
    }

    boolean isClosed() {
        return io.isShutdown();
    }

    int activeCount() {
        return active.size();
    }

    List<String> buildCommand(InvocationRequest request) {
        List<String> args = new ArrayList<>();
        args.add(binary);
        args.add("-p");
        args.add("--model");
        args.add(request.getModel());
        if (dangerouslySkipPermissions) args.add("--dangerously-skip-permissions");
        args.add("--output-format");
        args.add(outputFormat.flag);
        if (outputFormat == OutputFormat.STREAM_JSON) args.add("--include-partial-messages");
        if (!request.getTools().isEmpty()) {
            args.add("--tools");
            args.add(String.join(",", request.getTools()));
        }
        args.add(request.getPrompt());
        return args;
    }

    private void supervise(Process process, InvocationRequest request, InvocationStreams.QueueStream stream) {
        StringBuilder stdoutAll = new StringBuilder();
        StringBuilder merged = new StringBuilder();
        StringBuilder stderrAll = new StringBuilder();
        try {
            Future<?> out = io.submit(() -> pumpStdout(process.getInputStream(), stream, stdoutAll, merged));
            Future<?> err = io.submit(() -> pumpStderr(process.getErrorStream(), stream, stderrAll));

            boolean exited;
            if (request.getTimeout() == null) {
                process.waitFor();
                exited = true;
            } else {
                exited = process.waitFor(request.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!exited) {
                process.destroyForcibly();
                stream.push(InvocationEvent.error("runtime timed out after " + request.getTimeout().toMillis() + "ms"));
                return;
            }

            awaitPump(out);
            awaitPump(err);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String msg = firstNonBlank(stderrAll.toString(), stdoutAll.toString(), "runtime exit " + exitCode);
                stream.push(InvocationEvent.error(msg.trim()));
                return;
            }

            String finalText = outputFormat == OutputFormat.TEXT ? stdoutAll.toString() : merged.toString();
            if (!finalText.isBlank()) stream.push(InvocationEvent.textFinal(finalText.stripTrailing()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            stream.push(InvocationEvent.error("runtime supervision interrupted"));
        } catch (RuntimeException e) {
            logger.error("runtime:cli supervisor failed pid={}", process.pid(), e);
            stream.push(InvocationEvent.error(String.valueOf(e)));
        } finally {
            active.remove(process);
            stream.push(InvocationEvent.done());
        }
    }

    private void pumpStdout(InputStream in, InvocationStreams.QueueStream stream,
                            StringBuilder stdoutAll, StringBuilder merged) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stdoutAll.append(line).append('\n');
                if (outputFormat == OutputFormat.TEXT) {
                    stream.push(InvocationEvent.textDelta(line + "\n"));
                    continue;
                }
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                if (echoStdio) stream.push(InvocationEvent.logLine(InvocationEvent.LogStream.STDOUT, trimmed));
                String text = extractText(trimmed);
                if (text != null) {
                    merged.append(text);
                    stream.push(InvocationEvent.textDelta(text));
                }
            }
        } catch (IOException e) {
            logger.debug("runtime:cli stdout closed: {}", e.toString());
        }
    }

    private void pumpStderr(InputStream in, InvocationStreams.QueueStream stream, StringBuilder stderrAll) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stderrAll.append(line).append('\n');
                if (echoStdio) stream.push(InvocationEvent.logLine(InvocationEvent.LogStream.STDERR, line));
            }
        } catch (IOException e) {
            logger.debug("runtime:cli stderr closed: {}", e.toString());
        }
    }

    private static void awaitPump(Future<?> pump) throws InterruptedException {
        try {
            pump.get(PUMP_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("runtime:cli output pump did not finish cleanly: {}", e.toString());
        }
    }

    /**
     * Pulls text out of one stream-json line. Looks at {@code text}, {@code delta}, {@code content},
     * {@code data.text} and {@code event.delta.text}; anything that is not a JSON object yields {@code null}.
     */
    static @Nullable String extractText(String line) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (IOException e) {
            return null;
        }
        if (node == null || !node.isObject()) return null;
        JsonNode[] candidates = {
                node.get("text"),
                node.get("delta"),
                node.get("content"),
                node.path("data").get("text"),
                node.path("event").path("delta").get("text"),
        };
        for (JsonNode c : candidates) {
            if (c != null && c.isTextual() && !c.asText().isEmpty()) return c.asText();
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return "";
    }

    public static final class Builder {
        private String binary = "claude";
        private boolean dangerouslySkipPermissions;
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private boolean echoStdio;

        public Builder binary(String binary) {
            this.binary = Objects.requireNonNull(binary);
            return this;
        }

        public Builder dangerouslySkipPermissions(boolean skip) {
            this.dangerouslySkipPermissions = skip;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = Objects.requireNonNull(outputFormat);
            return this;
        }

        /**
         * Emit raw stdout/stderr lines as log events.
         */
        public Builder echoStdio(boolean echoStdio) {
            this.echoStdio = echoStdio;
            return this;
        }

        public CliRuntimeAdapter build() {
            return new CliRuntimeAdapter(this);
        }
    }
}
