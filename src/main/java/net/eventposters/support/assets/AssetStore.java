package net.eventposters.support.assets;

import java.util.Optional;

/**
 * Read-only lookup of poster assets by logical name.
 *
 * <p>Logical names are {@value #LOGO}, {@value #FONT} and {@code icon:<name>}.
 */
public interface AssetStore {

    String LOGO = "logo";
    String FONT = "font";
    String ICON_PREFIX = "icon:";

    /**
     * Reads the raw bytes of an asset.
     *
     * @param logicalName asset key
     * @return bytes, or empty when the asset does not exist
     * @throws net.eventposters.exception.AssetLoadException when the asset exists but cannot be read
     */
    Optional<byte[]> read(String logicalName);

    static String iconKey(String iconName) {
        return ICON_PREFIX + iconName;
    }

    static boolean isIconKey(String logicalName) {
        return logicalName != null && logicalName.startsWith(ICON_PREFIX);
    }

    static String iconName(String logicalName) {
        return logicalName.substring(ICON_PREFIX.length());
    }
}
