package org.photocollage.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class APIException extends RuntimeException {

    private final HttpStatus status;

    public APIException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public APIException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
