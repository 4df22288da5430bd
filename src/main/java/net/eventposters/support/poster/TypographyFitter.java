package net.eventposters.support.poster;

import java.util.ArrayList;
import java.util.List;
import net.eventposters.domain.poster.FitResult;
import net.eventposters.domain.poster.FontWeight;

/**
 * Chooses the largest font size at which a block of lines fits a bounding box.
 *
 * <p>Sizes are tried from {@code startSize} down to {@code minSize}. A size fits when
 * every line is at most the bounding width and the block (line boxes plus
 * {@code lineSpacingRatio * size} between lines) is at most the bounding height.
 * When no size fits, all words are re-wrapped greedily at {@code minSize}. A single
 * word wider than the box keeps its own line and overflows; words are never split.
 */
public class TypographyFitter {

    private final TextMeasurer measurer;
    private final FontWeight weight;
    private final double lineSpacingRatio;

    public TypographyFitter(TextMeasurer measurer, FontWeight weight, double lineSpacingRatio) {
        if (lineSpacingRatio < 0) {
            throw new IllegalArgumentException("lineSpacingRatio must not be negative");
        }
        this.measurer = measurer;
        this.weight = weight;
        this.lineSpacingRatio = lineSpacingRatio;
    }

    public FitResult fit(List<String> lines,
                         double boundingWidth,
                         double boundingHeight,
                         int startSize,
                         int minSize,
                         int sizeStep) {
        if (boundingWidth <= 0 || boundingHeight <= 0) {
            throw new IllegalArgumentException("Bounding box must have a positive size");
        }
        if (sizeStep <= 0 || minSize <= 0 || startSize < minSize) {
            throw new IllegalArgumentException(
                "Invalid size range start=" + startSize + " min=" + minSize + " step=" + sizeStep);
        }
        if (lines == null || lines.isEmpty()) {
            return new FitResult(startSize, List.of(), false, lineSpacing(startSize));
        }
        for (int size = startSize; size >= minSize; size -= sizeStep) {
            if (fits(lines, size, boundingWidth, boundingHeight)) {
                return new FitResult(size, lines, false, lineSpacing(size));
            }
        }
        return new FitResult(minSize, wrapWords(lines, minSize, boundingWidth), true, lineSpacing(minSize));
    }

    private boolean fits(List<String> lines, int size, double boundingWidth, double boundingHeight) {
        double spacing = lineSpacing(size);
        double blockHeight = lines.size() * (size + spacing) - spacing;
        if (blockHeight > boundingHeight) {
            return false;
        }
        for (String line : lines) {
            if (measurer.width(line, weight, size) > boundingWidth) {
                return false;
            }
        }
        return true;
    }

    private List<String> wrapWords(List<String> lines, int size, double boundingWidth) {
        List<String> wrapped = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : lines) {
            for (String word : line.trim().split("\\s+")) {
                if (word.isEmpty()) {
                    continue;
                }
                if (current.length() == 0) {
                    current.append(word);
                    continue;
                }
                String candidate = current + " " + word;
                if (measurer.width(candidate, weight, size) <= boundingWidth) {
                    current.append(' ').append(word);
                } else {
                    wrapped.add(current.toString());
                    current.setLength(0);
                    current.append(word);
                }
            }
        }
        if (current.length() > 0) {
            wrapped.add(current.toString());
        }
        return wrapped;
    }

    private double lineSpacing(int size) {
        return size * lineSpacingRatio;
    }
}
