package com.anthem.acctctl.gateway.controller;

import com.anthem.acctctl.core.exception.AcctCtlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Instant;

/**
 * Maps account control failures to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AcctCtlException.class)
    public ResponseEntity<ErrorResponse> handleAcctCtl(AcctCtlException e) {
        HttpStatus status = statusOf(e);
        log.warn("Request failed: kind={}, message={}", e.getKind(), e.getMessage());
        return respond(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, null, e.getMessage());
    }

    @ExceptionHandler(SdkException.class)
    public ResponseEntity<ErrorResponse> handleSdk(SdkException e) {
        log.error("AWS call failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, null, e.getMessage());
    }

    static HttpStatus statusOf(AcctCtlException e) {
        switch (e.getKind()) {
            case INVALID_SPEC:
            case INVALID_TAG:
                return HttpStatus.BAD_REQUEST;
            case NO_ACCESS:
                return HttpStatus.FORBIDDEN;
            case NO_CTL:
                return HttpStatus.NOT_FOUND;
            case CTL_UPDATE:
            case ALLOC_FAILED:
                return HttpStatus.CONFLICT;
            case UNABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(status.getReasonPhrase())
                .kind(kind)
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
