package net.eventposters.config;

import com.github.benmanes.caffeine.cache.Cache;
import java.nio.file.Path;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.support.assets.AssetCache;
import net.eventposters.support.assets.FileSystemAssetStore;
import net.eventposters.support.assets.IconFetchingAssetCache;
import net.eventposters.support.poster.FontTextMeasurer;
import net.eventposters.support.poster.FooterContent;
import net.eventposters.support.poster.PosterFontLoader;
import net.eventposters.support.poster.TextMeasurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the layout, assets and typography shared by every rendering stage.
 */
@Configuration
public class PosterRenderingConfig {

    private static final Logger log = LoggerFactory.getLogger(PosterRenderingConfig.class);

    @Bean
    public LayoutConfig layoutConfig() {
        return LayoutConfig.defaults();
    }

    @Bean
    public FileSystemAssetStore fileSystemAssetStore(PosterProperties posterProperties) {
        PosterProperties.Assets assets = posterProperties.getAssets();
        Path baseDir = Path.of(assets.getDir()).toAbsolutePath().normalize();
        log.info("Reading poster assets from {}", baseDir);
        return new FileSystemAssetStore(baseDir, assets.getLogo(), assets.getFont());
    }

    @Bean
    public AssetCache assetCache(FileSystemAssetStore fileSystemAssetStore,
                                 Cache<String, byte[]> assetBytesCache,
                                 WebClient.Builder webClientBuilder,
                                 PosterProperties posterProperties) {
        PosterProperties.Assets assets = posterProperties.getAssets();
        return new IconFetchingAssetCache(
            fileSystemAssetStore,
            assetBytesCache,
            webClientBuilder,
            assets.getIconUrls(),
            assets.getIconFetchTimeout()
        );
    }

    @Bean
    public PosterFontLoader posterFontLoader(FileSystemAssetStore fileSystemAssetStore,
                                             PosterProperties posterProperties) {
        PosterProperties.Assets assets = posterProperties.getAssets();
        if (StringUtils.hasText(assets.getFont())) {
            return PosterFontLoader.fromAsset(fileSystemAssetStore);
        }
        log.info("No font asset configured; using system family '{}'", assets.getFontFamily());
        return PosterFontLoader.system(assets.getFontFamily());
    }

    @Bean
    public TextMeasurer textMeasurer(PosterFontLoader posterFontLoader) {
        return new FontTextMeasurer(posterFontLoader);
    }

    @Bean
    public FooterContent footerContent(PosterProperties posterProperties) {
        PosterProperties.Footer footer = posterProperties.getFooter();
        return new FooterContent(footer.getCtaText(), footer.getLinkText(), footer.getQrUrl());
    }
}
