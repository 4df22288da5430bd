/**
 * Pexels-backed photo search for poster backgrounds.
 * Searches square photos, picks the result matching the requested page and downloads
 * the original-resolution file. Transient failures are retried once; a denied rate
 * limiter permit skips the call entirely.
 */
package net.eventposters.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import net.eventposters.config.PosterProperties;
import net.eventposters.support.search.ImageSearchClient;
import net.eventposters.support.search.ImageSearchRequest;
import net.eventposters.util.ExternalApiLogger;
import net.eventposters.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

@Service
@Slf4j
public class PexelsImageSearchClient implements ImageSearchClient {

    private static final String API_NAME = "Pexels";
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private final WebClient webClient;
    private final PosterProperties.Search settings;
    private final RateLimiter rateLimiter;

    public PexelsImageSearchClient(WebClient.Builder webClientBuilder,
                                   PosterProperties posterProperties,
                                   @Qualifier("imageSearchRateLimiter") RateLimiter rateLimiter) {
        this.webClient = webClientBuilder.build();
        this.settings = posterProperties.getSearch();
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Mono<byte[]> findImage(ImageSearchRequest request) {
        if (!StringUtils.hasText(settings.getApiKey())) {
            log.warn("No Pexels API key configured; skipping background search for '{}'", request.query());
            return Mono.empty();
        }
        if (!rateLimiter.acquirePermission()) {
            ExternalApiLogger.logRateLimited(log, API_NAME, request.query());
            return Mono.empty();
        }
        return searchPhotoUrl(request).flatMap(photoUrl -> download(photoUrl, request.query()));
    }

    private Mono<String> searchPhotoUrl(ImageSearchRequest request) {
        return Mono.fromCallable(() -> searchUri(request))
            .flatMap(uri -> search(uri, request));
    }

    private URI searchUri(ImageSearchRequest request) {
        return UriComponentsBuilder.fromUriString(settings.getBaseUrl())
            .path("/search")
            .queryParam("query", request.query())
            .queryParam("per_page", request.perPage())
            .queryParam("page", request.page())
            .queryParam("orientation", "square")
            .encode()
            .build()
            .toUri();
    }

    private Mono<String> search(URI uri, ImageSearchRequest request) {
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "SEARCH", request.query());
        return webClient.get()
            .uri(uri)
            .header(HttpHeaders.AUTHORIZATION, settings.getApiKey())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(settings.getTimeout())
            .retryWhen(transientRetry(uri))
            .doOnError(error -> ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", request.query(),
                error.getMessage()))
            .flatMap(body -> Mono.justOrEmpty(selectPhotoUrl(body, request)));
    }

    private String selectPhotoUrl(JsonNode body, ImageSearchRequest request) {
        JsonNode photos = body.path("photos");
        int index = request.photoIndex();
        if (!photos.isArray() || index >= photos.size()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", request.query(), 0);
            log.info("No photo at index {} for '{}' page {}", index, request.query(), request.page());
            return null;
        }
        String url = photos.get(index).path("src").path("original").asText(null);
        if (!StringUtils.hasText(url)) {
            log.info("Photo {} for '{}' has no original source URL", index, request.query());
            return null;
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", request.query(), photos.size());
        return url;
    }

    private Mono<byte[]> download(String photoUrl, String query) {
        return Mono.fromCallable(() -> URI.create(photoUrl))
            .flatMap(uri -> download(uri, photoUrl, query));
    }

    private Mono<byte[]> download(URI uri, String photoUrl, String query) {
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "DOWNLOAD", query);
        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(settings.getTimeout())
            .retryWhen(transientRetry(uri))
            .doOnNext(bytes -> ExternalApiLogger.logHttpResponse(log, 200, photoUrl, bytes.length))
            .doOnError(error -> ExternalApiLogger.logApiCallFailure(log, API_NAME, "DOWNLOAD", query,
                error.getMessage()));
    }

    private Retry transientRetry(URI uri) {
        return Retry.backoff(settings.getMaxRetries(), RETRY_BACKOFF)
            .filter(throwable -> {
                if (throwable instanceof WebClientResponseException wcre) {
                    // 4xx (including 429) fails fast
                    return wcre.getStatusCode().is5xxServerError();
                }
                return throwable instanceof IOException || throwable instanceof WebClientRequestException;
            })
            .doBeforeRetry(retrySignal -> LoggingUtils.warn(log, retrySignal.failure(),
                "Retrying Pexels call to {}. Attempt #{}", uri, retrySignal.totalRetries() + 1))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
