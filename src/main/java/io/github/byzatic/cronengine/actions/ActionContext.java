package io.github.byzatic.cronengine.actions;

import io.github.byzatic.cronengine.platform.DeliveryChannel;
import io.github.byzatic.cronengine.platform.Scope;

import java.util.Objects;

/**
 * Where actions from one run are applied.
 */
public final class ActionContext {
    private final Scope scope;
    private final DeliveryChannel channel;

    public ActionContext(Scope scope, DeliveryChannel channel) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public Scope getScope() {
        return scope;
    }

    public DeliveryChannel getChannel() {
        return channel;
    }
}
