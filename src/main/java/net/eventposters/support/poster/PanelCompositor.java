package net.eventposters.support.poster;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.util.Arrays;
import net.eventposters.domain.poster.BackgroundResolution;
import net.eventposters.domain.poster.LayoutConfig;
import org.springframework.stereotype.Component;

/**
 * Paints the background layer and the central content panel.
 *
 * <p>Photographic backgrounds are stretched to the canvas, tinted and lightly blurred.
 * A fallback background leaves the canvas plain white. The panel is drawn on top in
 * both cases with its border and accent stripe.
 */
@Component
public class PanelCompositor {

    private final LayoutConfig layout;

    public PanelCompositor(LayoutConfig layout) {
        this.layout = layout;
    }

    public BufferedImage apply(BufferedImage canvas, BackgroundResolution background) {
        Graphics2D graphics = canvas.createGraphics();
        try {
            PosterGraphics.applyQualityHints(graphics);
            paintBackground(graphics, background);
        } finally {
            graphics.dispose();
        }
        if (background instanceof BackgroundResolution.Resolved && layout.panel().blurRadius() > 0) {
            blurInPlace(canvas, layout.panel().blurRadius());
        }
        graphics = canvas.createGraphics();
        try {
            PosterGraphics.applyQualityHints(graphics);
            drawPanel(graphics);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    private void paintBackground(Graphics2D graphics, BackgroundResolution background) {
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, layout.canvasWidth(), layout.canvasHeight());
        if (background instanceof BackgroundResolution.Resolved resolved) {
            graphics.drawImage(resolved.image(), 0, 0, layout.canvasWidth(), layout.canvasHeight(), null);
            graphics.setColor(layout.panel().tintColor());
            graphics.fillRect(0, 0, layout.canvasWidth(), layout.canvasHeight());
        }
    }

    private void blurInPlace(BufferedImage canvas, int radius) {
        int side = radius * 2 + 1;
        float[] weights = new float[side * side];
        Arrays.fill(weights, 1f / weights.length);
        ConvolveOp blur = new ConvolveOp(new Kernel(side, side, weights), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage blurred = blur.filter(canvas, null);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setComposite(AlphaComposite.Src);
            graphics.drawImage(blurred, 0, 0, null);
        } finally {
            graphics.dispose();
        }
    }

    private void drawPanel(Graphics2D graphics) {
        LayoutConfig.PanelStyle style = layout.panel();
        Rectangle bounds = layout.panelBounds();
        graphics.setColor(style.fillColor());
        graphics.fill(bounds);

        graphics.setColor(style.borderColor());
        graphics.setStroke(new BasicStroke(style.borderWidth()));
        graphics.draw(bounds);

        graphics.setColor(style.accentColor());
        graphics.fillRect(bounds.x, bounds.y, bounds.width, style.accentHeight());
    }
}
