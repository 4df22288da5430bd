package net.eventposters.support.poster;

import com.google.zxing.WriterException;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;
import net.eventposters.domain.poster.FontWeight;
import net.eventposters.domain.poster.FooterResult;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.exception.AssetLoadException;
import net.eventposters.support.assets.AssetCache;
import net.eventposters.support.assets.AssetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Draws the white footer band: logo, separator, call to action with link, and QR code.
 *
 * <p>Everything the band needs is prepared before the first pixel is drawn, so a
 * skipped footer leaves the canvas exactly as it was.
 */
@Component
public class FooterComposer {

    private static final Logger log = LoggerFactory.getLogger(FooterComposer.class);
    private static final int SEPARATOR_INSET = 25;
    private static final int CTA_OFFSET = -20;
    private static final int LINK_OFFSET = 22;
    private static final int QR_BORDER_PADDING = 5;
    private static final int QR_BORDER_ARC = 16;

    private final LayoutConfig layout;
    private final AssetCache assetCache;
    private final PosterFontLoader fonts;
    private final QrCodeRenderer qrCodeRenderer;
    private final FooterContent content;

    public FooterComposer(LayoutConfig layout,
                          AssetCache assetCache,
                          PosterFontLoader fonts,
                          QrCodeRenderer qrCodeRenderer,
                          FooterContent content) {
        this.layout = layout;
        this.assetCache = assetCache;
        this.fonts = fonts;
        this.qrCodeRenderer = qrCodeRenderer;
        this.content = content;
    }

    public FooterResult compose(BufferedImage canvas) {
        Optional<BufferedImage> logo = loadLogo();
        if (logo.isEmpty()) {
            return skipped("Logo asset unavailable; footer omitted");
        }
        LayoutConfig.FooterStyle style = layout.footer();
        BufferedImage qrCode;
        try {
            qrCode = qrCodeRenderer.render(content.qrUrl(), style.qrSize());
        } catch (WriterException | IllegalArgumentException exception) {
            log.warn("QR code for '{}' could not be encoded", content.qrUrl(), exception);
            return skipped("QR code could not be encoded; footer omitted");
        }

        Graphics2D graphics = canvas.createGraphics();
        try {
            PosterGraphics.applyQualityHints(graphics);
            drawBand(graphics, style, logo.get(), qrCode);
        } finally {
            graphics.dispose();
        }
        return FooterResult.applied();
    }

    private void drawBand(Graphics2D graphics, LayoutConfig.FooterStyle style, BufferedImage logo, BufferedImage qrCode) {
        int top = layout.footerTop();
        int height = style.height();
        int centerY = top + height / 2;
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, top, layout.canvasWidth(), height);

        int logoHeight = style.logoHeight();
        int logoWidth = (int) Math.round(logoHeight * (logo.getWidth() / (double) logo.getHeight()));
        int logoX = style.logoLeftMargin();
        graphics.drawImage(logo, logoX, centerY - logoHeight / 2, logoWidth, logoHeight, null);

        int separatorX = logoX + logoWidth + style.separatorGap();
        graphics.setColor(style.separatorColor());
        graphics.setStroke(new BasicStroke(style.separatorWidth()));
        graphics.drawLine(separatorX, top + SEPARATOR_INSET, separatorX, top + height - SEPARATOR_INSET);

        int textX = separatorX + style.separatorGap();
        drawLeftAligned(graphics, content.ctaText(), FontWeight.SEMI_BOLD, style.ctaFontSize(),
            style.brandColor(), textX, centerY + CTA_OFFSET);
        drawLeftAligned(graphics, content.linkText(), FontWeight.REGULAR, style.linkFontSize(),
            style.linkColor(), textX, centerY + LINK_OFFSET);

        int qrX = layout.canvasWidth() - style.qrRightPadding() - style.qrSize();
        int qrY = centerY - style.qrSize() / 2;
        graphics.drawImage(qrCode, qrX, qrY, style.qrSize(), style.qrSize(), null);
        graphics.setColor(style.brandColor());
        graphics.setStroke(new BasicStroke(2f));
        graphics.draw(new RoundRectangle2D.Float(
            qrX - QR_BORDER_PADDING,
            qrY - QR_BORDER_PADDING,
            style.qrSize() + QR_BORDER_PADDING * 2f,
            style.qrSize() + QR_BORDER_PADDING * 2f,
            QR_BORDER_ARC,
            QR_BORDER_ARC
        ));
    }

    private void drawLeftAligned(Graphics2D graphics,
                                 String text,
                                 FontWeight weight,
                                 int size,
                                 Color color,
                                 int x,
                                 int centerY) {
        if (text == null || text.isBlank()) {
            return;
        }
        Font font = fonts.font(weight, size);
        graphics.setFont(font);
        FontMetrics metrics = graphics.getFontMetrics(font);
        graphics.setColor(color);
        graphics.drawString(text, (float) x, PosterGraphics.baselineForCenter(metrics, centerY));
    }

    private Optional<BufferedImage> loadLogo() {
        Optional<byte[]> bytes;
        try {
            bytes = assetCache.getOrFetch(AssetStore.LOGO);
        } catch (AssetLoadException exception) {
            log.warn("Logo asset could not be read: {}", exception.getMessage());
            return Optional.empty();
        }
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            BufferedImage logo = ImageIO.read(new ByteArrayInputStream(bytes.get()));
            if (logo == null || logo.getHeight() == 0) {
                log.warn("Logo asset is not a decodable image");
                return Optional.empty();
            }
            return Optional.of(logo);
        } catch (IOException exception) {
            log.warn("Failed to decode logo asset", exception);
            return Optional.empty();
        }
    }

    private FooterResult skipped(String warning) {
        log.warn(warning);
        return FooterResult.skipped(warning);
    }
}
