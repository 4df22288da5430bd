package net.eventposters.domain.poster;

/**
 * Identifies one concrete font instance: family asset, weight and point size.
 *
 * @param family logical asset name or system family the font is loaded from
 * @param weight rendered weight
 * @param sizePt point size
 */
public record FontSpec(String family, FontWeight weight, int sizePt) {

    public FontSpec {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("Font family is required");
        }
        if (weight == null) {
            throw new IllegalArgumentException("Font weight is required");
        }
        if (sizePt <= 0) {
            throw new IllegalArgumentException("Font size must be positive but was " + sizePt);
        }
    }
}
