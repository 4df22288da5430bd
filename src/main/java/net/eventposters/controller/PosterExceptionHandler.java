package net.eventposters.controller;

import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import net.eventposters.controller.support.ErrorResponseUtils;
import net.eventposters.exception.FontAssetException;
import net.eventposters.exception.PosterRenderException;
import net.eventposters.util.LoggingUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps poster failures to {@code {error, message}} responses.
 */
@RestControllerAdvice
@Slf4j
public class PosterExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException exception) {
        String message = exception.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
        return ErrorResponseUtils.badRequest("Invalid poster request", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(Exception exception) {
        return ErrorResponseUtils.badRequest("Invalid poster request", exception.getMessage());
    }

    @ExceptionHandler(FontAssetException.class)
    public ResponseEntity<Map<String, String>> handleFont(FontAssetException exception) {
        LoggingUtils.error(log, exception, "Poster font unavailable ({})", exception.getAssetName());
        return ErrorResponseUtils.internalServerError("Poster font unavailable", exception.getMessage());
    }

    @ExceptionHandler(PosterRenderException.class)
    public ResponseEntity<Map<String, String>> handleRender(PosterRenderException exception) {
        LoggingUtils.error(log, exception, "Poster rendering failed");
        return ErrorResponseUtils.internalServerError("Poster rendering failed", exception.getMessage());
    }
}
