package net.eventposters.exception;

/**
 * The poster font is missing or corrupt. Fatal to the render that hit it:
 * no image is produced.
 */
public class FontAssetException extends AssetLoadException {

    public FontAssetException(String assetName, String message) {
        super(assetName, message, null);
    }

    public FontAssetException(String assetName, String message, Throwable cause) {
        super(assetName, message, cause);
    }
}
