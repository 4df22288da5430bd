package net.eventposters.support.poster;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;
import net.eventposters.exception.AssetLoadException;
import net.eventposters.support.assets.AssetCache;
import net.eventposters.support.assets.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decoded icon glyphs for the datetime line. A missing or unreadable icon is reported
 * as empty so the caller can fall back to plain text.
 */
@Component
public class PosterIconProvider {

    public static final String CALENDAR = "calendar";
    public static final String CLOCK = "clock";

    private static final Logger log = LoggerFactory.getLogger(PosterIconProvider.class);

    private final AssetCache assetCache;

    public PosterIconProvider(AssetCache assetCache) {
        this.assetCache = assetCache;
    }

    public Optional<BufferedImage> icon(String iconName) {
        Optional<byte[]> bytes;
        try {
            bytes = assetCache.getOrFetch(AssetStore.iconKey(iconName));
        } catch (AssetLoadException exception) {
            log.warn("Icon '{}' could not be read: {}", iconName, exception.getMessage());
            return Optional.empty();
        }
        if (bytes.isEmpty()) {
            log.debug("Icon '{}' is unavailable", iconName);
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes.get()));
            if (image == null) {
                log.warn("Icon '{}' is not a decodable image", iconName);
            }
            return Optional.ofNullable(image);
        } catch (IOException exception) {
            log.warn("Failed to decode icon '{}'", iconName, exception);
            return Optional.empty();
        }
    }
}
