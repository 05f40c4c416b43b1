package org.photocollage.exception;

/**
 * Raised when retrieved bytes are not a decodable image. The image is dropped.
 */
public class ImageDecodeException extends Exception {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
