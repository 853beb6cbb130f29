package io.github.byzatic.cronengine.platform;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Resolved delivery target. Threads carry the id of their parent channel.
 */
public final class DeliveryChannel {
    private final String id;
    private final String name;
    private final String parentId;

    public DeliveryChannel(String id, String name, @Nullable String parentId) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.parentId = parentId;
    }

    public DeliveryChannel(String id, String name) {
        this(id, name, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public @Nullable String getParentId() {
        return parentId;
    }

    public boolean isThread() {
        return parentId != null;
    }

    @Override
    public String toString() {
        return "DeliveryChannel{id='" + id + "', name='" + name + "'" +
                (parentId != null ? ", parentId='" + parentId + '\'' : "") + '}';
    }
}
