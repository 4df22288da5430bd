package net.eventposters.domain.poster;

/**
 * Non-fatal outcome of publishing a poster to the webhook endpoint.
 *
 * @param success whether the endpoint answered HTTP 200
 * @param statusCode HTTP status, or {@code null} when no response arrived
 * @param message human-readable status line
 */
public record PublishResult(boolean success, Integer statusCode, String message) {

    public static PublishResult succeeded(int statusCode) {
        return new PublishResult(true, statusCode, "Poster published");
    }

    public static PublishResult failed(Integer statusCode, String message) {
        return new PublishResult(false, statusCode, message);
    }
}
