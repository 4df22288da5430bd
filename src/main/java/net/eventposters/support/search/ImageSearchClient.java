package net.eventposters.support.search;

import reactor.core.publisher.Mono;

/**
 * External photo search used for poster backgrounds.
 */
public interface ImageSearchClient {

    /**
     * Finds and downloads the photo selected by {@code request}.
     *
     * @return the raw image bytes, or an empty Mono when nothing matched; errors
     *         signal transport or provider failures
     */
    Mono<byte[]> findImage(ImageSearchRequest request);
}
