package com.datacron.admin.controller.resolver;

import com.datacron.admin.core.exception.DataCronException;
import com.datacron.core.cron.CronException;
import com.datacron.core.model.ReturnT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns exceptions thrown by the controllers into a {@link ReturnT} body with the matching
 * HTTP status.
 */
@Slf4j
@ControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(DataCronException.class)
    public ResponseEntity<ReturnT<String>> handleDataCron(DataCronException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error(e.getMessage(), e);
        }
        return build(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(CronException.class)
    public ResponseEntity<ReturnT<String>> handleCron(CronException e) {
        return build(HttpStatus.BAD_REQUEST, "Invalid cron expression: " + e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ReturnT<String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug(">>>>>>>>>>> datacron, unreadable request body: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ReturnT<String>> handleIllegalArgument(IllegalArgumentException e) {
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ReturnT<String>> handleMethod(HttpRequestMethodNotSupportedException e) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ReturnT<String>> handleOther(Exception e) {
        log.error(e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.toString());
    }

    private static ResponseEntity<ReturnT<String>> build(HttpStatus status, String msg) {
        return ResponseEntity.status(status).body(new ReturnT<>(status.value(), msg));
    }
}
