package net.eventposters.domain.poster;

import java.awt.image.BufferedImage;

/**
 * Result of background acquisition: either a raster at its native resolution or
 * a signal to paint the plain white canvas instead.
 */
public sealed interface BackgroundResolution permits BackgroundResolution.Resolved, BackgroundResolution.Fallback {

    static BackgroundResolution resolved(BufferedImage image) {
        return new Resolved(image);
    }

    static BackgroundResolution fallback(String reason) {
        return new Fallback(reason);
    }

    default boolean isFallback() {
        return this instanceof Fallback;
    }

    /**
     * @param image decoded background, never {@code null}
     */
    record Resolved(BufferedImage image) implements BackgroundResolution {
        public Resolved {
            if (image == null) {
                throw new IllegalArgumentException("Resolved background requires an image");
            }
        }
    }

    /**
     * @param reason why no background is available, for logs and warnings
     */
    record Fallback(String reason) implements BackgroundResolution {}
}
