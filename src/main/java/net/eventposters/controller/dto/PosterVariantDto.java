package net.eventposters.controller.dto;

import java.util.Base64;
import java.util.List;
import net.eventposters.domain.poster.PosterVariant;

/**
 * JSON view of one rendered variant.
 */
public record PosterVariantDto(
    int index,
    String query,
    int page,
    boolean backgroundFallback,
    List<String> warnings,
    String imageBase64
) {

    public static PosterVariantDto from(PosterVariant variant) {
        return new PosterVariantDto(
            variant.index(),
            variant.request().query(),
            variant.request().page(),
            variant.poster().backgroundFallback(),
            variant.poster().warnings(),
            Base64.getEncoder().encodeToString(variant.poster().png())
        );
    }
}
