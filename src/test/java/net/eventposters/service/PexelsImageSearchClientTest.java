package net.eventposters.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import net.eventposters.config.PosterProperties;
import net.eventposters.support.search.ImageSearchRequest;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PexelsImageSearchClientTest {

    private static final String BASE_URL = "https://api.pexels.test/v1";
    private static final byte[] PHOTO = {1, 2, 3, 4};
    private static final String TWO_PHOTOS = """
        {"page": 1, "per_page": 15, "photos": [
          {"id": 1, "src": {"original": "https://images.pexels.test/photos/1.jpeg"}},
          {"id": 2, "src": {"original": "https://images.pexels.test/photos/2.jpeg"}}
        ]}
        """;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void should_DownloadPhotoMatchingPage_When_SearchSucceeds() {
        PexelsImageSearchClient client = client(this::pexels, "secret-key", unlimited());

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop party", 2, 15)))
            .assertNext(bytes -> assertThat(bytes).isEqualTo(PHOTO))
            .verifyComplete();

        assertThat(requests).hasSize(2);
        URI search = requests.get(0).url();
        assertThat(search.getPath()).isEqualTo("/v1/search");
        assertThat(search.getQuery())
            .contains("query=rooftop party", "per_page=15", "page=2", "orientation=square");
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("secret-key");
        assertThat(requests.get(1).url().toString()).isEqualTo("https://images.pexels.test/photos/2.jpeg");
    }

    @Test
    void should_CompleteEmpty_When_PageIndexIsBeyondResults() {
        PexelsImageSearchClient client = client(this::pexels, "secret-key", unlimited());

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop party", 3, 15)))
            .verifyComplete();

        assertThat(requests).hasSize(1);
    }

    @Test
    void should_RetryOnce_When_ServerErrorPersists() {
        PexelsImageSearchClient client = client(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build());
        }, "secret-key", unlimited());

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop", 1, 15)))
            .expectError(WebClientResponseException.class)
            .verify(Duration.ofSeconds(10));

        assertThat(requests).hasSize(2);
    }

    @Test
    void should_NotRetry_When_ClientErrorReturned() {
        PexelsImageSearchClient client = client(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.UNAUTHORIZED).build());
        }, "wrong-key", unlimited());

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop", 1, 15)))
            .expectError(WebClientResponseException.class)
            .verify(Duration.ofSeconds(5));

        assertThat(requests).hasSize(1);
    }

    @Test
    void should_SkipCall_When_ApiKeyIsMissing() {
        PexelsImageSearchClient client = client(this::pexels, " ", unlimited());

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop", 1, 15))).verifyComplete();

        assertThat(requests).isEmpty();
    }

    @Test
    void should_SkipCall_When_RateLimiterDeniesPermit() {
        RateLimiter singlePermit = RateLimiter.of("test", RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ZERO)
            .build());
        PexelsImageSearchClient client = client(this::pexels, "secret-key", singlePermit);

        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop", 1, 15)))
            .expectNextCount(1)
            .verifyComplete();
        StepVerifier.create(client.findImage(new ImageSearchRequest("rooftop", 2, 15))).verifyComplete();

        assertThat(requests).hasSize(2);
    }

    @Test
    void should_SignalErrorInsteadOfThrowing_When_BaseUrlIsMalformed() {
        PosterProperties properties = new PosterProperties();
        properties.getSearch().setBaseUrl("http://api.pexels.com:notaport/v1");
        properties.getSearch().setApiKey("secret-key");
        PexelsImageSearchClient client = new PexelsImageSearchClient(WebClient.builder().exchangeFunction(this::pexels), properties, unlimited());

        Mono<byte[]> result = client.findImage(new ImageSearchRequest("rooftop", 1, 15));

        StepVerifier.create(result)
            .expectError(IllegalArgumentException.class)
            .verify(Duration.ofSeconds(5));
        assertThat(requests).isEmpty();
    }

    private Mono<ClientResponse> pexels(ClientRequest request) {
        requests.add(request);
        if (request.url().getPath().endsWith("/search")) {
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(TWO_PHOTOS)
                .build());
        }
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_JPEG_VALUE)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(PHOTO)))
            .build());
    }

    private static PexelsImageSearchClient client(ExchangeFunction exchange, String apiKey, RateLimiter rateLimiter) {
        PosterProperties properties = new PosterProperties();
        properties.getSearch().setBaseUrl(BASE_URL);
        properties.getSearch().setApiKey(apiKey);
        properties.getSearch().setTimeout(Duration.ofSeconds(2));
        return new PexelsImageSearchClient(WebClient.builder().exchangeFunction(exchange), properties, rateLimiter);
    }

    private static RateLimiter unlimited() {
        return RateLimiter.of("unlimited", RateLimiterConfig.custom()
            .limitForPeriod(1000)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ZERO)
            .build());
    }
}
