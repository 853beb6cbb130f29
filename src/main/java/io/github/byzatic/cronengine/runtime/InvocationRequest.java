package io.github.byzatic.cronengine.runtime;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one runtime invocation.
 */
public final class InvocationRequest {
    private final String prompt;
    private final String model;
    private final Path cwd;
    private final Duration timeout;
    private final List<String> tools;
    private final String sessionKey;

    private InvocationRequest(Builder b) {
        this.prompt = Objects.requireNonNull(b.prompt, "prompt");
        this.model = Objects.requireNonNull(b.model, "model");
        this.cwd = Objects.requireNonNull(b.cwd, "cwd");
        this.timeout = b.timeout;
        this.tools = List.copyOf(b.tools);
        this.sessionKey = b.sessionKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull String getPrompt() {
        return prompt;
    }

    public @NotNull String getModel() {
        return model;
    }

    public @NotNull Path getCwd() {
        return cwd;
    }

    /**
     * @return timeout, or {@code null} for none
     */
    public @Nullable Duration getTimeout() {
        return timeout;
    }

    public @NotNull List<String> getTools() {
        return tools;
    }

    public @Nullable String getSessionKey() {
        return sessionKey;
    }

    @Override
    public String toString() {
        return "InvocationRequest{model='" + model + "', cwd=" + cwd + ", timeout=" + timeout +
                ", tools=" + tools + ", promptLength=" + prompt.length() + '}';
    }

    public static final class Builder {
        private String prompt;
        private String model;
        private Path cwd;
        private Duration timeout;
        private List<String> tools = List.of();
        private String sessionKey;

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder cwd(Path cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder tools(List<String> tools) {
            this.tools = Objects.requireNonNull(tools, "tools");
            return this;
        }

        public Builder sessionKey(String sessionKey) {
            this.sessionKey = sessionKey;
            return this;
        }

        public InvocationRequest build() {
            return new InvocationRequest(this);
        }
    }
}
