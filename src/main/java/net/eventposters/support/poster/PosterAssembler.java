package net.eventposters.support.poster;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import net.eventposters.domain.poster.BackgroundResolution;
import net.eventposters.domain.poster.DatetimeText;
import net.eventposters.domain.poster.EventRecord;
import net.eventposters.domain.poster.FitResult;
import net.eventposters.domain.poster.FontWeight;
import net.eventposters.domain.poster.FooterResult;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.domain.poster.RenderedPoster;
import net.eventposters.exception.PosterRenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders a complete poster: background and panel, title fitting, text, footer,
 * then flattening to an opaque PNG.
 *
 * <p>Given the same event and background the output bytes are identical.
 */
@Component
public class PosterAssembler {

    private static final Logger log = LoggerFactory.getLogger(PosterAssembler.class);

    private final LayoutConfig layout;
    private final BackgroundResolver backgroundResolver;
    private final PanelCompositor panelCompositor;
    private final TypographyFitter titleFitter;
    private final TextLayoutEngine textLayoutEngine;
    private final FooterComposer footerComposer;

    public PosterAssembler(LayoutConfig layout,
                           BackgroundResolver backgroundResolver,
                           PanelCompositor panelCompositor,
                           TextMeasurer measurer,
                           TextLayoutEngine textLayoutEngine,
                           FooterComposer footerComposer) {
        this.layout = layout;
        this.backgroundResolver = backgroundResolver;
        this.panelCompositor = panelCompositor;
        this.titleFitter = new TypographyFitter(measurer, FontWeight.BOLD, layout.text().titleLineSpacingRatio());
        this.textLayoutEngine = textLayoutEngine;
        this.footerComposer = footerComposer;
    }

    public RenderedPoster render(EventRecord event) {
        return render(event, CancellationToken.none());
    }

    public RenderedPoster render(EventRecord event, CancellationToken token) {
        BackgroundResolution background = backgroundResolver.resolve(event.backgroundQuery(), event.page(), token);
        return assemble(event, background);
    }

    public RenderedPoster assemble(EventRecord event, BackgroundResolution background) {
        LayoutConfig.TextStyle text = layout.text();
        Rectangle titleRegion = layout.titleRegion();
        FitResult fit = titleFitter.fit(
            event.titleLines(),
            titleRegion.width,
            titleRegion.height,
            text.titleStartSize(),
            text.titleMinSize(),
            text.titleSizeStep()
        );
        if (fit.usedWrapFallback()) {
            log.info("Title did not fit at any size; re-wrapped into {} lines at {}pt", fit.lines().size(),
                fit.chosenFontSize());
        }

        BufferedImage canvas = new BufferedImage(layout.canvasWidth(), layout.canvasHeight(), BufferedImage.TYPE_INT_ARGB);
        panelCompositor.apply(canvas, background);
        textLayoutEngine.layout(canvas, fit, new DatetimeText(event.time(), event.date()), event.venue(), event.address());

        List<String> warnings = new ArrayList<>();
        FooterResult footer = footerComposer.compose(canvas);
        if (footer instanceof FooterResult.Skipped skipped) {
            warnings.add(skipped.warning());
        }
        if (background instanceof BackgroundResolution.Fallback fallback && event.backgroundQuery() != null) {
            warnings.add("Background unavailable: " + fallback.reason());
        }

        byte[] png = encodePng(flatten(canvas));
        return new RenderedPoster(png, layout.canvasWidth(), layout.canvasHeight(), fit, background.isFallback(), warnings);
    }

    private BufferedImage flatten(BufferedImage canvas) {
        BufferedImage opaque = new BufferedImage(canvas.getWidth(), canvas.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = opaque.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, opaque.getWidth(), opaque.getHeight());
            graphics.drawImage(canvas, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return opaque;
    }

    private byte[] encodePng(BufferedImage canvas) {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            boolean encoded = ImageIO.write(canvas, "png", outputStream);
            if (!encoded) {
                throw new PosterRenderException("No PNG writer is available for poster rendering", null);
            }
            return outputStream.toByteArray();
        } catch (IOException ioException) {
            throw new PosterRenderException("Failed to encode poster image", ioException);
        }
    }
}
