/**
 * Publishes finished posters to the configured webhook endpoint.
 * Failures never propagate: every outcome is reported as a {@link PublishResult}.
 */
package net.eventposters.service;

import lombok.extern.slf4j.Slf4j;
import net.eventposters.config.PosterProperties;
import net.eventposters.domain.poster.EventRecord;
import net.eventposters.domain.poster.PublishResult;
import net.eventposters.domain.poster.RenderedPoster;
import net.eventposters.util.ExternalApiLogger;
import net.eventposters.util.LoggingUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class WebhookPublisher {

    private static final String API_NAME = "Webhook";
    private static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private final WebClient webClient;
    private final PosterProperties.Webhook settings;

    public WebhookPublisher(WebClient.Builder webClientBuilder, PosterProperties posterProperties) {
        this.webClient = webClientBuilder.build();
        this.settings = posterProperties.getWebhook();
    }

    public PublishResult publish(RenderedPoster poster, EventRecord event) {
        if (!StringUtils.hasText(settings.getUrl())) {
            log.warn("Poster publish requested but no webhook URL is configured");
            return PublishResult.failed(null, "webhook not configured");
        }
        String eventName = String.join("\n", event.titleLines());
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "PUBLISH", eventName);

        PublishResult result = Mono.defer(() -> webClient.post()
                .uri(settings.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload(poster, event, eventName))
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    return response.releaseBody().thenReturn(toResult(status));
                }))
            .timeout(settings.getTimeout())
            .onErrorResume(TimeoutException.class, error -> {
                LoggingUtils.warn(log, error, "Webhook call timed out after {}", settings.getTimeout());
                return Mono.just(PublishResult.failed(null, "webhook timed out after " + settings.getTimeout().toSeconds() + "s"));
            })
            .onErrorResume(error -> !(error instanceof TimeoutException), error -> {
                LoggingUtils.warn(log, error, "Webhook call to {} failed", settings.getUrl());
                return Mono.just(PublishResult.failed(null, "webhook unreachable: " + error.getMessage()));
            })
            .blockOptional()
            .orElseGet(() -> PublishResult.failed(null, "webhook returned no response"));

        if (result.success()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "PUBLISH", eventName, 1);
        } else {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "PUBLISH", eventName, result.message());
        }
        return result;
    }

    Map<String, Object> payload(RenderedPoster poster, EventRecord event, String eventName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("image_url", DATA_URL_PREFIX + Base64.getEncoder().encodeToString(poster.png()));
        body.put("event_name", eventName);
        body.put("date", event.date());
        body.put("time", event.time());
        body.put("place", event.venue());
        body.put("address", event.address());
        return body;
    }

    private static PublishResult toResult(int status) {
        if (status == HttpStatus.OK.value()) {
            return PublishResult.succeeded(status);
        }
        return PublishResult.failed(status, "webhook responded with HTTP " + status);
    }
}
