package mailbox.jobs.app.controller;

import lombok.extern.slf4j.Slf4j;
import mailbox.jobs.app.exception.ApprovalConflictException;
import mailbox.jobs.app.exception.EventStreamUnavailableException;
import mailbox.jobs.app.exception.IllegalJobStateException;
import mailbox.jobs.app.exception.InvalidJobPayloadException;
import mailbox.jobs.app.exception.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({ApprovalConflictException.class, IllegalJobStateException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        log.warn("Rejected job operation: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(InvalidJobPayloadException.class)
    public ResponseEntity<Map<String, Object>> badPayload(InvalidJobPayloadException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(EventStreamUnavailableException.class)
    public ResponseEntity<Map<String, Object>> unavailable(EventStreamUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
