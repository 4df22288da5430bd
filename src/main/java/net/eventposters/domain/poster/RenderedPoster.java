package net.eventposters.domain.poster;

import java.util.List;

/**
 * A finished, opaque PNG poster plus what happened while rendering it.
 *
 * @param png encoded PNG bytes
 * @param width image width
 * @param height image height
 * @param fitResult title fitting outcome
 * @param backgroundFallback whether the white canvas replaced a photographic background
 * @param warnings non-fatal degradations (missing logo, missing icons)
 */
public record RenderedPoster(
    byte[] png,
    int width,
    int height,
    FitResult fitResult,
    boolean backgroundFallback,
    List<String> warnings
) {

    public RenderedPoster {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
