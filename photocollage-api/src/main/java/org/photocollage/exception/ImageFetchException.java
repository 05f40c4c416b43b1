package org.photocollage.exception;

/**
 * Raised when the bytes of a single source image cannot be retrieved
 * (transport error, timeout or non-2xx response). The image is dropped.
 */
public class ImageFetchException extends Exception {

    public ImageFetchException(String message) {
        super(message);
    }

    public ImageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
