package ai.classtalk.backend.controller;

import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.InvalidSegmentException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to HTTP responses.
 * Bodies always carry an {@code error} message; conflicts add the fields the client needs to resync.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CursorConflictException.class)
    public ResponseEntity<Map<String, Object>> handleCursorConflict(CursorConflictException e) {
        Map<String, Object> body = error(e.getMessage());
        body.put("expected", e.getExpected());
        body.put("actual", e.getActual());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SessionClosedException.class)
    public ResponseEntity<Map<String, Object>> handleSessionClosed(SessionClosedException e) {
        Map<String, Object> body = error(e.getMessage());
        body.put("status", e.getStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error(e.getMessage()));
    }

    @ExceptionHandler(InvalidSegmentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSegment(InvalidSegmentException e) {
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.toList());
        Map<String, Object> body = error("Validation failed");
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        logger.warn("Rejected malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("Malformed request"));
    }

    @ExceptionHandler(ModerationServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceFailure(ModerationServiceException e) {
        logger.error("Moderation service failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }

    private static String describe(FieldError fieldError) {
        return fieldError.getField() + ": " + fieldError.getDefaultMessage();
    }
}
