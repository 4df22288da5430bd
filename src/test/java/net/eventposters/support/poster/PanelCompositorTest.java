package net.eventposters.support.poster;

import java.awt.Color;
import java.awt.image.BufferedImage;
import net.eventposters.domain.poster.BackgroundResolution;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.testutil.PosterTestData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PanelCompositorTest {

    private final LayoutConfig layout = LayoutConfig.defaults();
    private final PanelCompositor compositor = new PanelCompositor(layout);

    @Test
    void should_PaintWhiteCanvasAndPanel_When_BackgroundFallsBack() {
        BufferedImage canvas = newCanvas();

        compositor.apply(canvas, BackgroundResolution.fallback("no background query"));

        assertThat(canvas.getRGB(5, 5)).isEqualTo(0xFFFFFFFF);
        assertThat(canvas.getRGB(1075, 1000)).isEqualTo(0xFFFFFFFF);
        assertThat(canvas.getRGB(540, 470)).isEqualTo(new Color(0, 82, 204).getRGB());
    }

    @Test
    void should_DrawAccentStripeAlongPanelTop() {
        BufferedImage canvas = newCanvas();

        compositor.apply(canvas, BackgroundResolution.fallback("none"));

        int stripeY = layout.panelBounds().y + 3;
        assertThat(canvas.getRGB(540, stripeY)).isEqualTo(new Color(255, 196, 0).getRGB());
        int belowStripe = layout.panelBounds().y + layout.panel().accentHeight() + 2;
        assertThat(canvas.getRGB(540, belowStripe)).isEqualTo(new Color(0, 82, 204).getRGB());
    }

    @Test
    void should_TintPhotoBackground_When_BackgroundResolved() {
        BufferedImage photo = PosterTestData.decode(PosterTestData.solidPng(400, 300, Color.RED));
        BufferedImage canvas = newCanvas();

        compositor.apply(canvas, BackgroundResolution.resolved(photo));

        int corner = canvas.getRGB(20, 20);
        assertThat(PosterTestData.red(corner)).isBetween(90, 120);
        assertThat(PosterTestData.green(corner)).isBetween(20, 40);
        assertThat(PosterTestData.blue(corner)).isBetween(80, 100);
        assertThat(canvas.getRGB(540, 470)).isEqualTo(new Color(0, 82, 204).getRGB());
    }

    private BufferedImage newCanvas() {
        return new BufferedImage(layout.canvasWidth(), layout.canvasHeight(), BufferedImage.TYPE_INT_ARGB);
    }
}
