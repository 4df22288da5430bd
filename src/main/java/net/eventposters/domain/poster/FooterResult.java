package net.eventposters.domain.poster;

/**
 * Result of the footer stage. A skipped footer leaves the canvas untouched.
 */
public sealed interface FooterResult permits FooterResult.Applied, FooterResult.Skipped {

    static FooterResult applied() {
        return new Applied();
    }

    static FooterResult skipped(String warning) {
        return new Skipped(warning);
    }

    record Applied() implements FooterResult {}

    record Skipped(String warning) implements FooterResult {}
}
