package io.github.byzatic.cronengine.executor;

import io.github.byzatic.cronengine.platform.DeliveryChannel;
import io.github.byzatic.cronengine.platform.PlatformDelivery;
import io.github.byzatic.cronengine.platform.Scope;
import io.github.byzatic.cronengine.runtime.ImageData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingDelivery implements PlatformDelivery {
    final Map<String, Scope> scopes = new ConcurrentHashMap<>();
    final Map<String, DeliveryChannel> channels = new ConcurrentHashMap<>();
    final List<String> sent = new CopyOnWriteArrayList<>();
    final List<ImageData> images = new CopyOnWriteArrayList<>();
    volatile IOException sendFailure;
    volatile Error sendError;

    RecordingDelivery withScope(String id) {
        scopes.put(id, new Scope(id, "Scope " + id));
        return this;
    }

    RecordingDelivery withChannel(DeliveryChannel channel) {
        channels.put(channel.getName(), channel);
        return this;
    }

    @Override
    public @Nullable Scope resolveScope(@NotNull String scopeId) {
        return scopes.get(scopeId);
    }

    @Override
    public @Nullable DeliveryChannel resolveChannel(@NotNull Scope scope, @NotNull String nameOrId) {
        String name = nameOrId.startsWith("#") ? nameOrId.substring(1) : nameOrId;
        return channels.get(name);
    }

    @Override
    public void send(@NotNull DeliveryChannel channel, @NotNull String content) throws IOException {
        if (sendFailure != null) throw sendFailure;
        if (sendError != null) throw sendError;
        sent.add(content);
    }

    @Override
    public void sendImages(@NotNull DeliveryChannel channel, @NotNull List<ImageData> images) {
        this.images.addAll(images);
    }
}
