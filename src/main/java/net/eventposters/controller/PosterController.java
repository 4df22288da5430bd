package net.eventposters.controller;

import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import net.eventposters.application.poster.PosterVariantService;
import net.eventposters.controller.dto.EventPosterRequest;
import net.eventposters.controller.dto.PosterVariantDto;
import net.eventposters.controller.support.ErrorResponseUtils;
import net.eventposters.domain.poster.EventRecord;
import net.eventposters.domain.poster.PublishResult;
import net.eventposters.domain.poster.RenderedPoster;
import net.eventposters.service.WebhookPublisher;
import net.eventposters.support.poster.CancellationToken;
import net.eventposters.support.poster.PosterAssembler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * Poster endpoints: single render, variant batch and webhook publishing.
 */
@RestController
@RequestMapping("/api/posters")
@Slf4j
public class PosterController {

    static final String WARNINGS_HEADER = "X-Poster-Warnings";

    private final PosterAssembler posterAssembler;
    private final PosterVariantService posterVariantService;
    private final WebhookPublisher webhookPublisher;
    private final Duration batchTimeout;

    public PosterController(PosterAssembler posterAssembler,
                            PosterVariantService posterVariantService,
                            WebhookPublisher webhookPublisher,
                            @Value("${poster.batch-timeout:120s}") Duration batchTimeout) {
        this.posterAssembler = posterAssembler;
        this.posterVariantService = posterVariantService;
        this.webhookPublisher = webhookPublisher;
        this.batchTimeout = batchTimeout;
    }

    @PostMapping(produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> renderPoster(@Valid @RequestBody EventPosterRequest request) {
        EventRecord event = request.toEventRecord();
        RenderedPoster poster = posterAssembler.render(event);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .cacheControl(CacheControl.noStore());
        if (!poster.warnings().isEmpty()) {
            response.header(WARNINGS_HEADER, String.join("; ", poster.warnings()));
        }
        return response.body(poster.png());
    }

    /**
     * Renders the variant batch off the request thread. A request timeout, a client
     * disconnect or any other end of the request cancels the batch and its background fetches.
     */
    @PostMapping(path = "/variants", produces = MediaType.APPLICATION_JSON_VALUE)
    public DeferredResult<ResponseEntity<?>> renderVariants(@Valid @RequestBody EventPosterRequest request) {
        EventRecord event = request.toEventRecord();
        CancellationToken token = CancellationToken.create();
        DeferredResult<ResponseEntity<?>> result = new DeferredResult<>(batchTimeout.toMillis());
        result.onTimeout(() -> {
            log.warn("Variant batch timed out after {}; cancelling", batchTimeout);
            token.cancel();
            result.setErrorResult(ErrorResponseUtils.error(HttpStatus.SERVICE_UNAVAILABLE,
                "Variant rendering timed out", "No variants were rendered within " + batchTimeout.toSeconds() + "s"));
        });
        result.onError(error -> {
            log.info("Variant request ended with {}; cancelling batch", error.toString());
            token.cancel();
        });
        result.onCompletion(token::cancel);

        posterVariantService.submitVariants(event, token).whenComplete((variants, error) -> {
            if (error != null) {
                result.setErrorResult(unwrap(error));
                return;
            }
            List<PosterVariantDto> body = variants.stream().map(PosterVariantDto::from).toList();
            log.info("Rendered {} poster variant(s)", body.size());
            result.setResult(ResponseEntity.ok(body));
        });
        return result;
    }

    @PostMapping(path = "/publish", produces = MediaType.APPLICATION_JSON_VALUE)
    public PublishResult publish(@Valid @RequestBody EventPosterRequest request) {
        EventRecord event = request.toEventRecord();
        RenderedPoster poster = posterAssembler.render(event);
        return webhookPublisher.publish(poster, event);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
