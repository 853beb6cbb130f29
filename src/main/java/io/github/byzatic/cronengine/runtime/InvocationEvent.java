package io.github.byzatic.cronengine.runtime;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One element of the stream produced by a runtime invocation. Not persisted.
 */
public final class InvocationEvent {

    public enum Type {
        TEXT_DELTA, TEXT_FINAL, ERROR, LOG_LINE, IMAGE_DATA, DONE
    }

    public enum LogStream {
        STDOUT, STDERR
    }

    private static final InvocationEvent DONE_EVENT = new InvocationEvent(Type.DONE, null, null, null);

    private final Type type;
    private final String text;
    private final LogStream stream;
    private final ImageData image;

    private InvocationEvent(Type type, @Nullable String text, @Nullable LogStream stream, @Nullable ImageData image) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = text;
        this.stream = stream;
        this.image = image;
    }

    public static InvocationEvent textDelta(String text) {
        return new InvocationEvent(Type.TEXT_DELTA, Objects.requireNonNull(text, "text"), null, null);
    }

    public static InvocationEvent textFinal(String text) {
        return new InvocationEvent(Type.TEXT_FINAL, Objects.requireNonNull(text, "text"), null, null);
    }

    public static InvocationEvent error(String message) {
        return new InvocationEvent(Type.ERROR, Objects.requireNonNull(message, "message"), null, null);
    }

    public static InvocationEvent logLine(LogStream stream, String line) {
        return new InvocationEvent(Type.LOG_LINE, Objects.requireNonNull(line, "line"), stream, null);
    }

    public static InvocationEvent imageData(ImageData image) {
        return new InvocationEvent(Type.IMAGE_DATA, null, null, Objects.requireNonNull(image, "image"));
    }

    public static InvocationEvent done() {
        return DONE_EVENT;
    }

    public Type getType() {
        return type;
    }

    /**
     * Text for deltas and finals, the message for errors, the line for log lines.
     */
    public @Nullable String getText() {
        return text;
    }

    public @Nullable LogStream getStream() {
        return stream;
    }

    public @Nullable ImageData getImage() {
        return image;
    }

    @Override
    public String toString() {
        return "InvocationEvent{type=" + type +
                (text != null ? ", text='" + text + '\'' : "") +
                (stream != null ? ", stream=" + stream : "") +
                (image != null ? ", image=" + image : "") + '}';
    }
}
