package net.eventposters.support.poster;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.font.TextAttribute;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import net.eventposters.domain.poster.FontSpec;
import net.eventposters.domain.poster.FontWeight;
import net.eventposters.exception.FontAssetException;
import net.eventposters.support.assets.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@link FontSpec}s to concrete fonts.
 *
 * <p>The base font is loaded once, either from the {@code font} asset or from a
 * system family. Every size/weight combination derives a new {@link Font}; the
 * base font is never mutated.
 */
public class PosterFontLoader {

    private static final Logger log = LoggerFactory.getLogger(PosterFontLoader.class);

    private final AssetStore assetStore;
    private final String family;
    private volatile Font baseFont;

    private PosterFontLoader(AssetStore assetStore, String family) {
        this.assetStore = assetStore;
        this.family = family;
    }

    /**
     * Loader backed by the TrueType {@code font} asset. A missing or corrupt asset
     * fails every render with {@link FontAssetException}.
     */
    public static PosterFontLoader fromAsset(AssetStore assetStore) {
        return new PosterFontLoader(assetStore, AssetStore.FONT);
    }

    /**
     * Loader backed by an installed or logical font family such as {@code SansSerif}.
     */
    public static PosterFontLoader system(String family) {
        return new PosterFontLoader(null, family);
    }

    public String family() {
        return family;
    }

    public Font font(FontWeight weight, int sizePt) {
        return font(new FontSpec(family, weight, sizePt));
    }

    public Font font(FontSpec spec) {
        Map<TextAttribute, Object> attributes = new HashMap<>();
        attributes.put(TextAttribute.WEIGHT, spec.weight().textAttributeWeight());
        attributes.put(TextAttribute.SIZE, (float) spec.sizePt());
        return baseFont().deriveFont(attributes);
    }

    private Font baseFont() {
        Font cached = baseFont;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (baseFont != null) {
                return baseFont;
            }
            baseFont = assetStore == null ? new Font(family, Font.PLAIN, 12) : loadAssetFont();
            return baseFont;
        }
    }

    private Font loadAssetFont() {
        byte[] bytes = assetStore.read(AssetStore.FONT)
            .orElseThrow(() -> new FontAssetException(AssetStore.FONT, "Poster font asset not found"));
        try {
            Font font = Font.createFont(Font.TRUETYPE_FONT, new ByteArrayInputStream(bytes));
            log.info("Loaded poster font '{}' ({} bytes)", font.getFontName(), bytes.length);
            return font;
        } catch (FontFormatException | IOException exception) {
            throw new FontAssetException(AssetStore.FONT, "Poster font asset is not a valid TrueType font", exception);
        }
    }
}
