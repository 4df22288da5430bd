package net.eventposters.domain.poster;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRecordTest {

    @Test
    void should_UpperCaseAndDropBlankLines_When_NormalizingRawTitle() {
        assertThat(EventRecord.normalizeTitle("  Reunión \n\n exatec\r\nBonn  \n   "))
            .containsExactly("REUNIÓN", "EXATEC", "BONN");
    }

    @Test
    void should_UseRootLocaleRules_When_UpperCasing() {
        assertThat(EventRecord.normalizeTitle("istanbul")).containsExactly("ISTANBUL");
    }

    @Test
    void should_ReturnNoLines_When_TitleIsBlank() {
        assertThat(EventRecord.normalizeTitle("  \n ")).isEmpty();
        assertThat(EventRecord.normalizeTitle(null)).isEmpty();
    }

    @Test
    void should_RejectPageBelowOne() {
        assertThatThrownBy(() -> EventRecord.fromRawTitle("19:00", "01.01.2026", "Party", "Bar", "Street", null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("page");
    }

    @Test
    void should_TreatBlankBackgroundQueryAsAbsent() {
        EventRecord event = EventRecord.fromRawTitle("19:00", "01.01.2026", "Party", "Bar", "Street", "   ", 1);

        assertThat(event.backgroundQuery()).isNull();
        assertThat(event.backgroundQueryIfPresent()).isEmpty();
    }

    @Test
    void should_KeepEverythingButBackground_When_CopyingWithBackground() {
        EventRecord event = EventRecord.fromRawTitle(" 19:00 ", "01.01.2026", "Party", " Bar ", "Street", null, 1);

        EventRecord variant = event.withBackground("rooftop bar", 3);

        assertThat(variant.backgroundQuery()).isEqualTo("rooftop bar");
        assertThat(variant.page()).isEqualTo(3);
        assertThat(variant.time()).isEqualTo("19:00");
        assertThat(variant.venue()).isEqualTo("Bar");
        assertThat(variant.titleLines()).isEqualTo(event.titleLines());
    }
}
