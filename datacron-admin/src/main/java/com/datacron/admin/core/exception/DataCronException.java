package com.datacron.admin.core.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A request the service refuses, with the HTTP status to answer it with.
 */
@Getter
public class DataCronException extends RuntimeException {

    private static final long serialVersionUID = 42L;

    private final HttpStatus status;

    public DataCronException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public DataCronException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static DataCronException badRequest(String message) {
        return new DataCronException(HttpStatus.BAD_REQUEST, message);
    }

    public static DataCronException notFound(String message) {
        return new DataCronException(HttpStatus.NOT_FOUND, message);
    }
}
