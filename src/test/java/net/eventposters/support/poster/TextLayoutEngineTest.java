package net.eventposters.support.poster;

import java.awt.Color;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.List;
import net.eventposters.domain.poster.DatetimeText;
import net.eventposters.domain.poster.FitResult;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.support.assets.AssetStore;
import net.eventposters.testutil.PosterRenderingFixture;
import net.eventposters.testutil.PosterTestData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextLayoutEngineTest {

    private static final Color PANEL = new Color(0, 82, 204);
    private static final int WHITE = 0xFFFFFFFF;

    @Test
    void should_GrowShadowOffsetWithFontSize() {
        assertThat(TextLayoutEngine.shadowOffset(36)).isEqualTo(2);
        assertThat(TextLayoutEngine.shadowOffset(60)).isEqualTo(2);
        assertThat(TextLayoutEngine.shadowOffset(88)).isEqualTo(3);
        assertThat(TextLayoutEngine.shadowOffset(96)).isEqualTo(4);
    }

    @Test
    void should_DrawTitleInsideTitleRegion() {
        PosterRenderingFixture fixture = PosterRenderingFixture.withoutAssets();
        LayoutConfig layout = fixture.layout();
        BufferedImage canvas = PosterTestData.filledCanvas(1080, 1080, PANEL);
        FitResult title = new FitResult(88, List.of("REUNIÓN", "EXATEC", "BONN"), false, 22);

        fixture.textLayoutEngine().layout(canvas, title, new DatetimeText("", ""), "", "");

        Rectangle region = layout.titleRegion();
        assertThat(PosterTestData.pixels(canvas, region.y, region.height)).contains(WHITE);
        assertThat(PosterTestData.pixels(canvas, 0, region.y - 40)).doesNotContain(WHITE);
        assertThat(PosterTestData.pixels(canvas, region.y + region.height + 40, 300)).doesNotContain(WHITE);
    }

    @Test
    void should_DrawPlainDatetimeText_When_IconsAreMissing() {
        PosterRenderingFixture fixture = PosterRenderingFixture.withoutAssets();
        LayoutConfig layout = fixture.layout();
        BufferedImage canvas = PosterTestData.filledCanvas(1080, 1080, PANEL);

        fixture.textLayoutEngine().layout(canvas, new FitResult(96, List.of(), false, 24),
            new DatetimeText("19:00", "24.10.2026"), "Café Central", "Marktplatz 1");

        int datetimeTop = layout.datetimeCenterY() - 25;
        assertThat(PosterTestData.pixels(canvas, datetimeTop, 50)).contains(WHITE);
        assertThat(PosterTestData.pixels(canvas, layout.venueCenterY() - 25, 50)).contains(WHITE);
        assertThat(PosterTestData.pixels(canvas, layout.addressCenterY() - 18, 36)).contains(WHITE);
    }

    @Test
    void should_DrawIconGlyphs_When_IconsAreAvailable() {
        byte[] icon = PosterTestData.solidPng(40, 40, Color.GREEN);
        PosterRenderingFixture fixture = PosterRenderingFixture.withoutAssets()
            .asset(AssetStore.iconKey(PosterIconProvider.CLOCK), icon)
            .asset(AssetStore.iconKey(PosterIconProvider.CALENDAR), icon);
        LayoutConfig layout = fixture.layout();
        BufferedImage canvas = PosterTestData.filledCanvas(1080, 1080, PANEL);

        fixture.textLayoutEngine().layout(canvas, new FitResult(96, List.of(), false, 24),
            new DatetimeText("19:00", "24.10.2026"), "", "");

        int[] row = PosterTestData.pixels(canvas, layout.datetimeCenterY(), 1);
        long greenPixels = Arrays.stream(row).filter(pixel -> pixel == Color.GREEN.getRGB()).count();
        assertThat(greenPixels).isGreaterThanOrEqualTo(2L * (layout.text().iconSize() - 4));
    }
}
