package net.eventposters.support.search;

/**
 * One background lookup: a query, the result page and the provider page size.
 *
 * @param query search keywords, never blank
 * @param page result page, starting at 1
 * @param perPage results per provider page
 */
public record ImageSearchRequest(String query, int page, int perPage) {

    public ImageSearchRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1 but was " + page);
        }
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be >= 1 but was " + perPage);
        }
        query = query.trim();
    }

    /**
     * Position of the wanted photo inside the returned result list.
     */
    public int photoIndex() {
        return (page - 1) % perPage;
    }
}
