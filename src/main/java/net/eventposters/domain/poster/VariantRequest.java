package net.eventposters.domain.poster;

/**
 * One planned poster variant: which background query and page to render with.
 *
 * @param index position in the batch, starting at 0
 * @param query background search query, may be {@code null} for the white canvas
 * @param page search-result page
 */
public record VariantRequest(int index, String query, int page) {}
