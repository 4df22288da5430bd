package net.eventposters.support.poster;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import javax.imageio.ImageIO;
import net.eventposters.config.PosterProperties;
import net.eventposters.domain.poster.BackgroundResolution;
import net.eventposters.support.search.ImageSearchClient;
import net.eventposters.support.search.ImageSearchRequest;
import net.eventposters.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Turns an optional background query into a decoded photo or a fallback signal.
 *
 * <p>Nothing here throws for a failed lookup: transport errors, timeouts, empty result
 * pages and undecodable bytes all become {@link BackgroundResolution.Fallback}.
 */
@Component
public class BackgroundResolver {

    private static final Logger log = LoggerFactory.getLogger(BackgroundResolver.class);
    private static final long MAX_INPUT_PIXELS = 60_000_000L;

    private final ImageSearchClient imageSearchClient;
    private final int perPage;
    private final Duration overallTimeout;

    public BackgroundResolver(ImageSearchClient imageSearchClient, PosterProperties posterProperties) {
        this.imageSearchClient = imageSearchClient;
        PosterProperties.Search search = posterProperties.getSearch();
        this.perPage = search.getPerPage();
        // search plus download, each possibly retried
        this.overallTimeout = search.getTimeout().multipliedBy(2L * (search.getMaxRetries() + 1) + 1);
    }

    public BackgroundResolution resolve(String query, int page) {
        return resolve(query, page, CancellationToken.none());
    }

    public BackgroundResolution resolve(String query, int page, CancellationToken token) {
        if (!StringUtils.hasText(query)) {
            return BackgroundResolution.fallback("no background query");
        }
        if (token.isCancelled()) {
            return BackgroundResolution.fallback("cancelled");
        }
        ImageSearchRequest request = new ImageSearchRequest(query, page, perPage);
        Optional<byte[]> bytes = Mono.defer(() -> imageSearchClient.findImage(request))
            .takeUntilOther(token.whenCancelled())
            .timeout(overallTimeout)
            .onErrorResume(error -> {
                LoggingUtils.warn(log, error, "Background search for '{}' page {} failed", request.query(), page);
                return Mono.empty();
            })
            .blockOptional();
        if (token.isCancelled()) {
            return BackgroundResolution.fallback("cancelled");
        }
        if (bytes.isEmpty() || bytes.get().length == 0) {
            log.warn("No background image for '{}' page {}; using white canvas", request.query(), page);
            return BackgroundResolution.fallback("no image found for '" + request.query() + "' page " + page);
        }
        return decode(bytes.get(), request);
    }

    private BackgroundResolution decode(byte[] bytes, ImageSearchRequest request) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                log.warn("Background for '{}' is not a decodable image", request.query());
                return BackgroundResolution.fallback("background image could not be decoded");
            }
            if ((long) image.getWidth() * image.getHeight() > MAX_INPUT_PIXELS) {
                log.warn("Background for '{}' is too large ({}x{})", request.query(), image.getWidth(), image.getHeight());
                return BackgroundResolution.fallback("background image too large");
            }
            return BackgroundResolution.resolved(image);
        } catch (IOException exception) {
            LoggingUtils.warn(log, exception, "Failed to decode background for '{}'", request.query());
            return BackgroundResolution.fallback("background image could not be decoded");
        }
    }
}
