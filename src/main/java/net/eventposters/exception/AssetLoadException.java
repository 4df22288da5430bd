package net.eventposters.exception;

/**
 * A poster asset (logo, font, icon) could not be read or decoded.
 * RETRYABLE: No (assets are static files)
 */
public class AssetLoadException extends RuntimeException {

    private final String assetName;

    public AssetLoadException(String assetName, String message, Throwable cause) {
        super(message, cause);
        this.assetName = assetName;
    }

    public String getAssetName() {
        return assetName;
    }
}
