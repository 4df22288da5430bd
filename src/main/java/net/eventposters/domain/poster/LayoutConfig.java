package net.eventposters.domain.poster;

import java.awt.Color;
import java.awt.Rectangle;

/**
 * Immutable poster geometry and palette shared by every rendering stage.
 *
 * <p>All values are named constants; nothing here is derived from event content.
 * Construction fails when the panel would leave the canvas or overlap the footer band.
 *
 * @param canvasWidth canvas width in pixels
 * @param canvasHeight canvas height in pixels
 * @param panel panel fractions and colors
 * @param text text block offsets and font sizes
 * @param footer footer band geometry and colors
 */
public record LayoutConfig(
    int canvasWidth,
    int canvasHeight,
    PanelStyle panel,
    TextStyle text,
    FooterStyle footer
) {

    public static final int CANVAS_SIZE = 1080;

    public LayoutConfig {
        if (canvasWidth <= 0 || canvasHeight <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive");
        }
        if (panel == null || text == null || footer == null) {
            throw new IllegalArgumentException("Panel, text and footer styles are required");
        }
        Rectangle bounds = panelBounds(canvasWidth, canvasHeight, panel);
        if (bounds.x < 0 || bounds.y < 0
            || bounds.x + bounds.width > canvasWidth
            || bounds.y + bounds.height > canvasHeight - footer.height()) {
            throw new IllegalArgumentException("Panel " + bounds + " does not fit inside the canvas above the footer");
        }
    }

    /**
     * Returns the production layout: 1080x1080 canvas, 80% x 55% panel at 16% from the top.
     */
    public static LayoutConfig defaults() {
        return new LayoutConfig(
            CANVAS_SIZE,
            CANVAS_SIZE,
            new PanelStyle(
                0.80,
                0.55,
                0.16,
                new Color(0, 51, 153, 150),
                2,
                new Color(0, 82, 204, 255),
                new Color(255, 255, 255, 90),
                2,
                new Color(255, 196, 0, 255),
                6
            ),
            new TextStyle(
                70,
                40,
                40,
                12,
                40,
                96,
                36,
                4,
                0.25,
                50,
                30,
                110,
                44,
                55,
                32,
                new Color(0, 0, 0, 110)
            ),
            new FooterStyle(
                155,
                110,
                30,
                30,
                new Color(200, 205, 215),
                2,
                125,
                30,
                new Color(0, 51, 153),
                new Color(0, 82, 204),
                30,
                26
            )
        );
    }

    /**
     * Panel rectangle in canvas coordinates.
     */
    public Rectangle panelBounds() {
        return panelBounds(canvasWidth, canvasHeight, panel);
    }

    public int footerTop() {
        return canvasHeight - footer.height();
    }

    /**
     * Vertical center of the datetime line.
     */
    public int datetimeCenterY() {
        return panelBounds().y + text.datetimeOffset();
    }

    public int venueCenterY() {
        Rectangle bounds = panelBounds();
        return bounds.y + bounds.height - text.venueOffset();
    }

    public int addressCenterY() {
        Rectangle bounds = panelBounds();
        return bounds.y + bounds.height - text.addressOffset();
    }

    /**
     * Box the title block must fit into: between the datetime and venue lines,
     * inset horizontally from the panel edges.
     */
    public Rectangle titleRegion() {
        Rectangle bounds = panelBounds();
        int top = datetimeCenterY() + text.datetimeFontSize() / 2 + text.titleVerticalGap();
        int bottom = venueCenterY() - text.venueFontSize() / 2 - text.titleVerticalGap();
        int left = bounds.x + text.titleHorizontalPadding();
        int width = bounds.width - 2 * text.titleHorizontalPadding();
        return new Rectangle(left, top, width, Math.max(0, bottom - top));
    }

    private static Rectangle panelBounds(int canvasWidth, int canvasHeight, PanelStyle panel) {
        int width = (int) (canvasWidth * panel.widthFraction());
        int height = (int) (canvasHeight * panel.heightFraction());
        int left = (canvasWidth - width) / 2;
        int top = (int) (canvasHeight * panel.topFraction());
        return new Rectangle(left, top, width, height);
    }

    /**
     * @param widthFraction panel width relative to the canvas width
     * @param heightFraction panel height relative to the canvas height
     * @param topFraction panel top offset relative to the canvas height
     * @param tintColor translucent layer composited over photographic backgrounds
     * @param blurRadius box blur radius applied after tinting, 0 disables it
     * @param fillColor solid panel color
     * @param borderColor panel outline color
     * @param borderWidth panel outline stroke width
     * @param accentColor stripe color along the panel top edge
     * @param accentHeight stripe height
     */
    public record PanelStyle(
        double widthFraction,
        double heightFraction,
        double topFraction,
        Color tintColor,
        int blurRadius,
        Color fillColor,
        Color borderColor,
        int borderWidth,
        Color accentColor,
        int accentHeight
    ) {}

    /**
     * @param datetimeOffset datetime line center below the panel top
     * @param datetimeFontSize datetime font size
     * @param iconSize square icon glyph size
     * @param iconGap gap between an icon and its text
     * @param segmentGap gap between the time and date segments
     * @param titleStartSize largest title size tried
     * @param titleMinSize smallest title size tried
     * @param titleSizeStep decrement between tried sizes
     * @param titleLineSpacingRatio title line spacing relative to the font size
     * @param titleHorizontalPadding title inset from the panel sides
     * @param titleVerticalGap gap between the title block and the datetime/venue lines
     * @param venueOffset venue line center above the panel bottom
     * @param venueFontSize venue font size
     * @param addressOffset address line center above the panel bottom
     * @param addressFontSize address font size
     * @param shadowColor drop-shadow fill
     */
    public record TextStyle(
        int datetimeOffset,
        int datetimeFontSize,
        int iconSize,
        int iconGap,
        int segmentGap,
        int titleStartSize,
        int titleMinSize,
        int titleSizeStep,
        double titleLineSpacingRatio,
        int titleHorizontalPadding,
        int titleVerticalGap,
        int venueOffset,
        int venueFontSize,
        int addressOffset,
        int addressFontSize,
        Color shadowColor
    ) {}

    /**
     * @param height footer band height
     * @param logoHeight logo height after scaling
     * @param logoLeftMargin logo inset from the left edge
     * @param separatorGap horizontal gap on both sides of the separator
     * @param separatorColor separator line color
     * @param separatorWidth separator stroke width
     * @param qrSize QR code edge length
     * @param qrRightPadding QR code inset from the right edge
     * @param brandColor call-to-action color and QR border color
     * @param linkColor link text color
     * @param ctaFontSize call-to-action font size
     * @param linkFontSize link font size
     */
    public record FooterStyle(
        int height,
        int logoHeight,
        int logoLeftMargin,
        int separatorGap,
        Color separatorColor,
        int separatorWidth,
        int qrSize,
        int qrRightPadding,
        Color brandColor,
        Color linkColor,
        int ctaFontSize,
        int linkFontSize
    ) {}
}
