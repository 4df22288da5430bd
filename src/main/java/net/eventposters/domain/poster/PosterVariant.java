package net.eventposters.domain.poster;

/**
 * A rendered variant at its requested batch position.
 */
public record PosterVariant(VariantRequest request, RenderedPoster poster) {

    public int index() {
        return request.index();
    }
}
