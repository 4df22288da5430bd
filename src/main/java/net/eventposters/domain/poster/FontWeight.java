package net.eventposters.domain.poster;

import java.awt.font.TextAttribute;

/**
 * Weights the poster font family is rendered in.
 */
public enum FontWeight {
    REGULAR(TextAttribute.WEIGHT_REGULAR),
    SEMI_BOLD(TextAttribute.WEIGHT_SEMIBOLD),
    BOLD(TextAttribute.WEIGHT_BOLD);

    private final Float textAttributeWeight;

    FontWeight(Float textAttributeWeight) {
        this.textAttributeWeight = textAttributeWeight;
    }

    /**
     * Value for {@link TextAttribute#WEIGHT} when deriving a concrete font.
     */
    public Float textAttributeWeight() {
        return textAttributeWeight;
    }
}
