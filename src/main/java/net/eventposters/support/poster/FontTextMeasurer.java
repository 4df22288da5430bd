package net.eventposters.support.poster;

import java.awt.font.FontRenderContext;
import net.eventposters.domain.poster.FontWeight;

/**
 * Measures with the same antialiasing and fractional-metrics settings
 * {@link PosterGraphics#applyQualityHints} draws with.
 */
public class FontTextMeasurer implements TextMeasurer {

    private static final FontRenderContext RENDER_CONTEXT = new FontRenderContext(null, true, true);

    private final PosterFontLoader fontLoader;

    public FontTextMeasurer(PosterFontLoader fontLoader) {
        this.fontLoader = fontLoader;
    }

    @Override
    public double width(String text, FontWeight weight, int sizePt) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return fontLoader.font(weight, sizePt).getStringBounds(text, RENDER_CONTEXT).getWidth();
    }
}
