package omni.sync.app.controller;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.exception.AuthException;
import omni.sync.app.exception.InvalidOAuthStateException;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.exception.OAuthExchangeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, JobPayloadException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidBody(MethodArgumentNotValidException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body");
    }

    @ExceptionHandler(InvalidOAuthStateException.class)
    public ResponseEntity<Map<String, String>> invalidState(InvalidOAuthStateException e) {
        log.warn("Rejected OAuth callback: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_state", e.getMessage());
    }

    @ExceptionHandler(OAuthExchangeException.class)
    public ResponseEntity<Map<String, String>> exchangeFailed(OAuthExchangeException e) {
        return error(HttpStatus.BAD_GATEWAY, "exchange_failed", e.getMessage());
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, String>> reconnectRequired(AuthException e) {
        return error(HttpStatus.CONFLICT, "reconnect_required", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", code, "message", message != null ? message : ""));
    }
}
