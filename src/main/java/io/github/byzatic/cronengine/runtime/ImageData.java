package io.github.byzatic.cronengine.runtime;

import java.util.Objects;

/**
 * Image emitted by the runtime, base64 encoded.
 */
public final class ImageData {
    private final String base64;
    private final String mediaType;

    public ImageData(String base64, String mediaType) {
        this.base64 = Objects.requireNonNull(base64, "base64");
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType");
    }

    public String getBase64() {
        return base64;
    }

    /**
     * {@code image/png}, {@code image/jpeg} or {@code image/webp}.
     */
    public String getMediaType() {
        return mediaType;
    }

    @Override
    public String toString() {
        return "ImageData{mediaType='" + mediaType + "', size=" + base64.length() + '}';
    }
}
