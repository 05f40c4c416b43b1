package org.photocollage.model.collage;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Where the bytes of one source photo come from: a remote URL or an in-memory upload.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ImageReference {

    private final String url;
    private final String name;
    private final byte[] data;

    public static ImageReference ofUrl(String url) {
        Objects.requireNonNull(url, "url");
        return new ImageReference(url, url, null);
    }

    public static ImageReference ofBytes(String name, byte[] data) {
        Objects.requireNonNull(data, "data");
        return new ImageReference(null, name != null ? name : "upload", data);
    }

    public boolean isRemote() {
        return url != null;
    }

    /**
     * Short form for log lines; long signed storage URLs are cut.
     */
    public String describe() {
        return name.length() > 50 ? name.substring(0, 50) + "..." : name;
    }

    @Override
    public String toString() {
        return describe();
    }
}
