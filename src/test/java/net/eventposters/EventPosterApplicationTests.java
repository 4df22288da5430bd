package net.eventposters;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import net.eventposters.domain.poster.LayoutConfig;
import net.eventposters.domain.poster.RenderedPoster;
import net.eventposters.support.poster.PosterAssembler;
import net.eventposters.testutil.PosterTestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class EventPosterApplicationTests {

    @Autowired
    private PosterAssembler posterAssembler;

    @Autowired
    private LayoutConfig layout;

    @Test
    void should_RenderPosterWithLogoFooter_When_UsingShippedConfiguration() {
        RenderedPoster poster = posterAssembler.render(PosterTestData.reunionEvent());

        assertThat(poster.width()).isEqualTo(1080);
        assertThat(poster.backgroundFallback()).isTrue();
        assertThat(poster.warnings()).isEmpty();

        BufferedImage image = PosterTestData.decode(poster.png());
        assertThat(image.getHeight()).isEqualTo(1080);
        int footerTop = layout.footerTop();
        int footerCenterY = footerTop + layout.footer().height() / 2;
        // navy emblem on the left of the shipped logo
        int logo = image.getRGB(layout.footer().logoLeftMargin() + 55, footerCenterY + 18);
        assertThat(PosterTestData.blue(logo)).isGreaterThan(120);
        assertThat(PosterTestData.red(logo)).isLessThan(60);
        int qrX = layout.canvasWidth() - layout.footer().qrRightPadding() - layout.footer().qrSize();
        int qrY = footerCenterY - layout.footer().qrSize() / 2;
        int[] qrPixels = image.getRGB(qrX, qrY, layout.footer().qrSize(), layout.footer().qrSize(), null, 0,
            layout.footer().qrSize());
        assertThat(qrPixels).contains(0xFF000000, 0xFFFFFFFF);
    }

    @Test
    void should_CopyDotEnvEntriesIntoSystemProperties(@TempDir Path dir) throws Exception {
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, "EVENT_POSTERS_TEST_KEY=from-dotenv\n");
        try {
            EventPosterApplication.loadDotEnvFile(envFile);

            assertThat(System.getProperty("EVENT_POSTERS_TEST_KEY")).isEqualTo("from-dotenv");
        } finally {
            System.clearProperty("EVENT_POSTERS_TEST_KEY");
        }
    }
}
