package org.photocollage.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    INVALID_COLLAGE_REQUEST(HttpStatus.BAD_REQUEST, "Invalid collage request: %s"),
    NO_IMAGES_AVAILABLE(HttpStatus.UNPROCESSABLE_ENTITY, "None of the %d requested images could be downloaded or decoded"),
    COLLAGE_ENCODING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to encode collage: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new APIException(formattedMessage, this.status);
    }
}
