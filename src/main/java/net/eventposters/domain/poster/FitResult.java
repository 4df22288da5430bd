package net.eventposters.domain.poster;

import java.util.List;

/**
 * Outcome of fitting the title block into its bounding box.
 *
 * @param chosenFontSize size the lines are drawn at
 * @param lines lines to draw, re-wrapped when {@code usedWrapFallback} is set
 * @param usedWrapFallback whether no size fitted and words were re-wrapped at the minimum size
 * @param lineSpacing vertical gap between consecutive lines at {@code chosenFontSize}
 */
public record FitResult(int chosenFontSize, List<String> lines, boolean usedWrapFallback, double lineSpacing) {

    public FitResult {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Total block height: every line box plus the gaps between them.
     */
    public double blockHeight() {
        if (lines.isEmpty()) {
            return 0;
        }
        return lines.size() * (chosenFontSize + lineSpacing) - lineSpacing;
    }
}
