package net.eventposters.domain.poster;

/**
 * Time and date shown on the datetime line.
 */
public record DatetimeText(String time, String date) {

    public DatetimeText {
        time = time == null ? "" : time;
        date = date == null ? "" : date;
    }

    /**
     * Single-string form used when no icon glyphs are available.
     */
    public String joined() {
        if (time.isEmpty()) {
            return date;
        }
        if (date.isEmpty()) {
            return time;
        }
        return time + " | " + date;
    }
}
