package net.eventposters.support.poster;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.eventposters.domain.poster.DatetimeText;
import net.eventposters.domain.poster.FitResult;
import net.eventposters.domain.poster.FontWeight;
import net.eventposters.domain.poster.LayoutConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Draws the datetime line, the fitted title block, venue and address onto the panel.
 *
 * <p>Every line is horizontally centered on the canvas. Title and venue lines carry a drop shadow
 * whose offset grows with the font size.
 */
@Component
public class TextLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(TextLayoutEngine.class);

    private final LayoutConfig layout;
    private final PosterFontLoader fonts;
    private final TextMeasurer measurer;
    private final PosterIconProvider icons;

    public TextLayoutEngine(LayoutConfig layout,
                            PosterFontLoader fonts,
                            TextMeasurer measurer,
                            PosterIconProvider icons) {
        this.layout = layout;
        this.fonts = fonts;
        this.measurer = measurer;
        this.icons = icons;
    }

    /**
     * Shadow offset in pixels for a title drawn at {@code fontSize}.
     */
    public static int shadowOffset(int fontSize) {
        return Math.max(2, (int) Math.ceil(fontSize / 30.0));
    }

    public BufferedImage layout(BufferedImage canvas,
                                FitResult title,
                                DatetimeText datetime,
                                String venue,
                                String address) {
        Graphics2D graphics = canvas.createGraphics();
        try {
            PosterGraphics.applyQualityHints(graphics);
            drawDatetime(graphics, datetime);
            drawTitle(graphics, title);
            LayoutConfig.TextStyle style = layout.text();
            drawCenteredLine(graphics, venue, FontWeight.SEMI_BOLD, style.venueFontSize(), layout.venueCenterY(), true);
            drawCenteredLine(graphics, address, FontWeight.REGULAR, style.addressFontSize(), layout.addressCenterY(), false);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    private void drawDatetime(Graphics2D graphics, DatetimeText datetime) {
        LayoutConfig.TextStyle style = layout.text();
        int size = style.datetimeFontSize();
        Optional<BufferedImage> clock = icons.icon(PosterIconProvider.CLOCK);
        Optional<BufferedImage> calendar = icons.icon(PosterIconProvider.CALENDAR);
        if (clock.isEmpty() && calendar.isEmpty()) {
            log.debug("No datetime icons available; drawing '{}' as text", datetime.joined());
            drawCenteredLine(graphics, datetime.joined(), FontWeight.SEMI_BOLD, size, layout.datetimeCenterY(), false);
            return;
        }

        List<Segment> segments = new ArrayList<>();
        if (!datetime.time().isEmpty()) {
            segments.add(new Segment(clock.orElse(null), datetime.time()));
        }
        if (!datetime.date().isEmpty()) {
            segments.add(new Segment(calendar.orElse(null), datetime.date()));
        }
        if (segments.isEmpty()) {
            return;
        }

        double totalWidth = style.segmentGap() * (segments.size() - 1.0);
        for (Segment segment : segments) {
            totalWidth += segmentWidth(segment, size);
        }

        Font font = fonts.font(FontWeight.SEMI_BOLD, size);
        graphics.setFont(font);
        FontMetrics metrics = graphics.getFontMetrics(font);
        int centerY = layout.datetimeCenterY();
        float baseline = PosterGraphics.baselineForCenter(metrics, centerY);
        double x = (layout.canvasWidth() - totalWidth) / 2.0;
        graphics.setColor(Color.WHITE);
        for (Segment segment : segments) {
            if (segment.icon() != null) {
                int iconY = centerY - style.iconSize() / 2;
                graphics.drawImage(segment.icon(), (int) Math.round(x), iconY, style.iconSize(), style.iconSize(), null);
                x += style.iconSize() + style.iconGap();
            }
            graphics.drawString(segment.text(), (float) x, baseline);
            x += measurer.width(segment.text(), FontWeight.SEMI_BOLD, size) + style.segmentGap();
        }
    }

    private double segmentWidth(Segment segment, int size) {
        double width = measurer.width(segment.text(), FontWeight.SEMI_BOLD, size);
        if (segment.icon() != null) {
            width += layout.text().iconSize() + layout.text().iconGap();
        }
        return width;
    }

    private void drawTitle(Graphics2D graphics, FitResult title) {
        if (title.lines().isEmpty()) {
            return;
        }
        Rectangle region = layout.titleRegion();
        int size = title.chosenFontSize();
        double top = region.y + (region.height - title.blockHeight()) / 2.0;
        for (int i = 0; i < title.lines().size(); i++) {
            double centerY = top + i * (size + title.lineSpacing()) + size / 2.0;
            drawCenteredLine(graphics, title.lines().get(i), FontWeight.BOLD, size, centerY, true);
        }
    }

    private void drawCenteredLine(Graphics2D graphics,
                                  String text,
                                  FontWeight weight,
                                  int size,
                                  double centerY,
                                  boolean shadow) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Font font = fonts.font(weight, size);
        graphics.setFont(font);
        FontMetrics metrics = graphics.getFontMetrics(font);
        float x = (float) ((layout.canvasWidth() - measurer.width(text, weight, size)) / 2.0);
        float baseline = PosterGraphics.baselineForCenter(metrics, centerY);
        if (shadow) {
            int offset = shadowOffset(size);
            graphics.setColor(layout.text().shadowColor());
            graphics.drawString(text, x + offset, baseline + offset);
        }
        graphics.setColor(Color.WHITE);
        graphics.drawString(text, x, baseline);
    }

    private record Segment(BufferedImage icon, String text) {}
}
