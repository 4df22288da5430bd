package net.eventposters.support.poster;

import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QrCodeRendererTest {

    @Test
    void should_RenderSquareBlackAndWhiteRaster() throws Exception {
        BufferedImage qr = new QrCodeRenderer().render("https://lu.ma/EXATEC-Alemania", 125);

        assertThat(qr.getWidth()).isEqualTo(125);
        assertThat(qr.getHeight()).isEqualTo(125);
        int[] pixels = qr.getRGB(0, 0, 125, 125, null, 0, 125);
        assertThat(pixels).containsOnly(0xFF000000, 0xFFFFFFFF);
        assertThat(pixels).contains(0xFF000000);
    }
}
