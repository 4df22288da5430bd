package net.eventposters.domain.poster;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Immutable event details a poster is rendered from.
 *
 * <p>Title lines are already normalized: trimmed, blank lines removed and
 * upper-cased with {@link Locale#ROOT} so layout never depends on the host locale.
 *
 * @param time display time, e.g. {@code 19:00}
 * @param date display date, e.g. {@code 24.10.2026}
 * @param titleLines ordered, upper-cased title lines
 * @param venue venue name
 * @param address venue address
 * @param backgroundQuery optional background search term; {@code null} when absent
 * @param page search-result page, starting at 1
 */
public record EventRecord(
    String time,
    String date,
    List<String> titleLines,
    String venue,
    String address,
    String backgroundQuery,
    int page
) {

    public EventRecord {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1 but was " + page);
        }
        time = time == null ? "" : time.trim();
        date = date == null ? "" : date.trim();
        venue = venue == null ? "" : venue.trim();
        address = address == null ? "" : address.trim();
        titleLines = titleLines == null ? List.of() : List.copyOf(titleLines);
        backgroundQuery = StringUtils.hasText(backgroundQuery) ? backgroundQuery.trim() : null;
    }

    /**
     * Builds a record from a raw, user-entered multi-line title.
     */
    public static EventRecord fromRawTitle(String time,
                                           String date,
                                           String rawTitle,
                                           String venue,
                                           String address,
                                           String backgroundQuery,
                                           int page) {
        return new EventRecord(time, date, normalizeTitle(rawTitle), venue, address, backgroundQuery, page);
    }

    /**
     * Splits a raw title on line breaks, drops blank lines and upper-cases the rest.
     */
    public static List<String> normalizeTitle(String rawTitle) {
        if (!StringUtils.hasText(rawTitle)) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : rawTitle.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed.toUpperCase(Locale.ROOT));
            }
        }
        return List.copyOf(lines);
    }

    public Optional<String> backgroundQueryIfPresent() {
        return Optional.ofNullable(backgroundQuery);
    }

    /**
     * Returns a copy targeting another background query and result page.
     */
    public EventRecord withBackground(String query, int newPage) {
        return new EventRecord(time, date, titleLines, venue, address, query, newPage);
    }
}
