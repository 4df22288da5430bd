package net.eventposters.support.assets;

import com.github.benmanes.caffeine.cache.Cache;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import net.eventposters.util.ExternalApiLogger;
import net.eventposters.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link AssetCache} over an {@link FileSystemAssetStore} that downloads missing
 * icons from their configured URLs on first use.
 *
 * <p>Single fetch per key comes from Caffeine's atomic {@code get(key, loader)}:
 * concurrent callers for the same key block on the running load. Downloaded icons
 * are written next to the local assets so later processes skip the download.
 */
public class IconFetchingAssetCache implements AssetCache {

    private static final Logger log = LoggerFactory.getLogger(IconFetchingAssetCache.class);
    private static final String API_NAME = "IconSource";
    private static final long MAX_ICON_BYTES = 1024 * 1024;

    private final FileSystemAssetStore assetStore;
    private final Cache<String, byte[]> cache;
    private final WebClient webClient;
    private final Map<String, String> iconUrls;
    private final Duration fetchTimeout;

    public IconFetchingAssetCache(FileSystemAssetStore assetStore,
                                  Cache<String, byte[]> cache,
                                  WebClient.Builder webClientBuilder,
                                  Map<String, String> iconUrls,
                                  Duration fetchTimeout) {
        this.assetStore = assetStore;
        this.cache = cache;
        this.webClient = webClientBuilder.build();
        this.iconUrls = iconUrls == null ? Map.of() : Map.copyOf(iconUrls);
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public Optional<byte[]> getOrFetch(String logicalName) {
        if (!StringUtils.hasText(logicalName)) {
            return Optional.empty();
        }
        byte[] bytes = cache.get(logicalName, this::load);
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }

    private byte[] load(String logicalName) {
        Optional<byte[]> local = assetStore.read(logicalName);
        if (local.isPresent()) {
            return local.get();
        }
        if (!AssetStore.isIconKey(logicalName)) {
            return null;
        }
        String iconName = AssetStore.iconName(logicalName);
        String sourceUrl = iconUrls.get(iconName);
        if (!StringUtils.hasText(sourceUrl)) {
            log.debug("No local file or source URL for icon '{}'", iconName);
            return null;
        }
        byte[] downloaded = download(iconName, sourceUrl);
        if (downloaded != null) {
            memoize(iconName, downloaded);
        }
        return downloaded;
    }

    private byte[] download(String iconName, String sourceUrl) {
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "FETCH_ICON", iconName);
        byte[] bytes = Mono.fromCallable(() -> URI.create(sourceUrl))
            .flatMap(uri -> webClient.get()
                .uri(uri)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        ExternalApiLogger.logApiCallFailure(log, API_NAME, "FETCH_ICON", iconName,
                            "HTTP " + response.statusCode().value());
                        return response.releaseBody().then(Mono.<byte[]>empty());
                    }
                    long contentLength = response.headers().contentLength().orElse(-1L);
                    if (contentLength > MAX_ICON_BYTES) {
                        return response.releaseBody().then(Mono.<byte[]>empty());
                    }
                    return response.bodyToMono(byte[].class);
                }))
            .timeout(fetchTimeout)
            .onErrorResume(TimeoutException.class, error -> {
                LoggingUtils.warn(log, error, "Icon request timed out for {}", sourceUrl);
                return Mono.empty();
            })
            .onErrorResume(error -> {
                LoggingUtils.warn(log, error, "Icon request failed for {}", sourceUrl);
                return Mono.empty();
            })
            .blockOptional()
            .orElse(null);
        if (bytes == null || bytes.length == 0 || bytes.length > MAX_ICON_BYTES) {
            return null;
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "FETCH_ICON", iconName, 1);
        return bytes;
    }

    private void memoize(String iconName, byte[] bytes) {
        Path target = assetStore.iconPath(iconName);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException ioException) {
            LoggingUtils.warn(log, ioException, "Could not store icon '{}' at {}; it will be fetched again next start",
                iconName, target);
        }
    }
}
