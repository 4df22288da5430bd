package net.eventposters.support.poster;

import java.util.List;
import net.eventposters.domain.poster.FitResult;
import net.eventposters.domain.poster.FontWeight;
import net.eventposters.testutil.PosterTestData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypographyFitterTest {

    private static final double CHAR_RATIO = 0.6;

    private final TextMeasurer measurer = PosterTestData.monospaceMeasurer(CHAR_RATIO);
    private final TypographyFitter fitter = new TypographyFitter(measurer, FontWeight.BOLD, 0.25);

    @Test
    void should_UseStartSize_When_LinesFitImmediately() {
        FitResult result = fitter.fit(List.of("HELLO"), 800, 300, 96, 36, 4);

        assertThat(result.chosenFontSize()).isEqualTo(96);
        assertThat(result.usedWrapFallback()).isFalse();
        assertThat(result.lines()).containsExactly("HELLO");
    }

    @Test
    void should_ChooseLargestSizeInStepSequence_When_WidthLimitsTheLine() {
        FitResult result = fitter.fit(List.of("ABCDEFGHIJ"), 500, 400, 96, 36, 4);

        assertThat(result.chosenFontSize()).isEqualTo(80);
        assertThat(measurer.width("ABCDEFGHIJ", FontWeight.BOLD, 80)).isLessThanOrEqualTo(500);
        assertThat(measurer.width("ABCDEFGHIJ", FontWeight.BOLD, 84)).isGreaterThan(500);
    }

    @Test
    void should_ShrinkUntilBlockHeightFits_When_ManyLines() {
        FitResult result = fitter.fit(List.of("AB", "CD", "EF"), 1000, 200, 96, 36, 4);

        assertThat(result.chosenFontSize()).isEqualTo(56);
        assertThat(result.lineSpacing()).isEqualTo(14.0);
        assertThat(result.blockHeight()).isLessThanOrEqualTo(200);
    }

    @Test
    void should_ReWrapWordsAtMinimumSize_When_NoSizeFits() {
        FitResult result = fitter.fit(List.of("ONE TWO THREE FOUR FIVE SIX"), 300, 1000, 96, 36, 4);

        assertThat(result.usedWrapFallback()).isTrue();
        assertThat(result.chosenFontSize()).isEqualTo(36);
        assertThat(result.lines()).containsExactly("ONE TWO THREE", "FOUR FIVE SIX");
        assertThat(result.lines())
            .allSatisfy(line -> assertThat(measurer.width(line, FontWeight.BOLD, 36)).isLessThanOrEqualTo(300));
    }

    @Test
    void should_KeepOverlongWordWhole_When_ItExceedsBoundingWidth() {
        String word = "X".repeat(40);

        FitResult result = fitter.fit(List.of(word), 400, 500, 96, 36, 4);

        assertThat(result.usedWrapFallback()).isTrue();
        assertThat(result.lines()).containsExactly(word);
    }

    @Test
    void should_PutOverlongWordOnItsOwnLine_When_SurroundedByShortWords() {
        String word = "Y".repeat(30);

        FitResult result = fitter.fit(List.of("AN " + word + " IS"), 300, 1000, 96, 36, 4);

        assertThat(result.lines()).containsExactly("AN", word, "IS");
    }

    @Test
    void should_ReturnStartSizeWithoutLines_When_TitleIsEmpty() {
        FitResult result = fitter.fit(List.of(), 500, 300, 96, 36, 4);

        assertThat(result.chosenFontSize()).isEqualTo(96);
        assertThat(result.lines()).isEmpty();
        assertThat(result.blockHeight()).isZero();
    }

    @Test
    void should_RejectInvalidSizeRange() {
        assertThatThrownBy(() -> fitter.fit(List.of("A"), 500, 300, 96, 36, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fitter.fit(List.of("A"), 500, 300, 30, 36, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> fitter.fit(List.of("A"), 0, 300, 96, 36, 4))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
