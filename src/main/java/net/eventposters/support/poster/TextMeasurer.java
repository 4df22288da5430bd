package net.eventposters.support.poster;

import net.eventposters.domain.poster.FontWeight;

/**
 * Rendered width of a string in the poster font.
 */
@FunctionalInterface
public interface TextMeasurer {

    double width(String text, FontWeight weight, int sizePt);
}
