package io.github.byzatic.cronengine.platform;

import org.jetbrains.annotations.Nullable;

/**
 * Where a reported problem came from.
 */
public final class StatusContext {
    private final String sessionKey;
    private final String channelName;

    public StatusContext(String sessionKey, @Nullable String channelName) {
        this.sessionKey = sessionKey;
        this.channelName = channelName;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public @Nullable String getChannelName() {
        return channelName;
    }

    @Override
    public String toString() {
        return "StatusContext{sessionKey='" + sessionKey + "', channelName='" + channelName + "'}";
    }
}
