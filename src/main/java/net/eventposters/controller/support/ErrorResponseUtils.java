package net.eventposters.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent {@code {error, message}} payloads.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(errorBody(error, message));
    }

    public static ResponseEntity<Map<String, String>> internalServerError(String error, String message) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, error, message);
    }

    public static ResponseEntity<Map<String, String>> badRequest(String error, String message) {
        return error(HttpStatus.BAD_REQUEST, error, message);
    }
}
