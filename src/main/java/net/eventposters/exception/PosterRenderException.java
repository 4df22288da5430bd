package net.eventposters.exception;

/**
 * Rendering could not produce an image (encoding failure, interrupted batch).
 */
public class PosterRenderException extends RuntimeException {

    public PosterRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
