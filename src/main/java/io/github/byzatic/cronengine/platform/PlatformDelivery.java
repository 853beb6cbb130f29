package io.github.byzatic.cronengine.platform;

import io.github.byzatic.cronengine.runtime.ImageData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Chat-platform side of job delivery.
 */
public interface PlatformDelivery {

    @Nullable Scope resolveScope(@NotNull String scopeId);

    /**
     * @param nameOrId channel name (with or without a leading {@code #}) or id
     */
    @Nullable DeliveryChannel resolveChannel(@NotNull Scope scope, @NotNull String nameOrId);

    /**
     * Sends one message that already fits the platform's size limit.
     */
    void send(@NotNull DeliveryChannel channel, @NotNull String content) throws IOException;

    /**
     * Sends images produced by the runtime. Platforms without image support may ignore them.
     */
    default void sendImages(@NotNull DeliveryChannel channel, @NotNull List<ImageData> images) throws IOException {
    }
}
