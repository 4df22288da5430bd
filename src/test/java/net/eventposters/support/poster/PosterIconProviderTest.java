package net.eventposters.support.poster;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import net.eventposters.config.CacheFactory;
import net.eventposters.support.assets.FileSystemAssetStore;
import net.eventposters.support.assets.IconFetchingAssetCache;
import net.eventposters.testutil.PosterTestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class PosterIconProviderTest {

    @TempDir
    Path assetDir;

    @Test
    void should_DecodeLocalIcon() throws Exception {
        Files.createDirectories(assetDir.resolve("icons"));
        Files.write(assetDir.resolve("icons").resolve("clock.png"), PosterTestData.solidPng(40, 40, Color.WHITE));

        PosterIconProvider icons = provider(Map.of());

        assertThat(icons.icon(PosterIconProvider.CLOCK))
            .hasValueSatisfying(image -> assertThat(image.getWidth()).isEqualTo(40));
    }

    @Test
    void should_ReturnEmpty_When_IconUrlIsMalformed() {
        PosterIconProvider icons = provider(Map.of("clock", "http://exa mple.com/clock.png"));

        assertThat(icons.icon(PosterIconProvider.CLOCK)).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_IconBytesAreNotAnImage() throws Exception {
        Files.createDirectories(assetDir.resolve("icons"));
        Files.write(assetDir.resolve("icons").resolve("calendar.png"), new byte[] {1, 2, 3});

        assertThat(provider(Map.of()).icon(PosterIconProvider.CALENDAR)).isEmpty();
    }

    private PosterIconProvider provider(Map<String, String> iconUrls) {
        FileSystemAssetStore store = new FileSystemAssetStore(assetDir, "logo.png", "");
        IconFetchingAssetCache cache = new IconFetchingAssetCache(
            store,
            new CacheFactory().createCacheWithSize(16),
            WebClient.builder().exchangeFunction(request -> Mono.error(new IllegalStateException("no call expected"))),
            iconUrls,
            Duration.ofSeconds(2)
        );
        return new PosterIconProvider(cache);
    }
}
