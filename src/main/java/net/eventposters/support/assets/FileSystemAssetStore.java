package net.eventposters.support.assets;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import net.eventposters.exception.AssetLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StringUtils;

/**
 * Reads assets from a directory, falling back to {@code assets/} on the classpath.
 */
public class FileSystemAssetStore implements AssetStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemAssetStore.class);
    private static final String CLASSPATH_ROOT = "assets/";
    private static final String ICON_DIRECTORY = "icons";
    private static final String ICON_EXTENSION = ".png";

    private final Path baseDir;
    private final String logoPath;
    private final String fontPath;

    public FileSystemAssetStore(Path baseDir, String logoPath, String fontPath) {
        this.baseDir = baseDir;
        this.logoPath = logoPath;
        this.fontPath = fontPath;
    }

    @Override
    public Optional<byte[]> read(String logicalName) {
        Optional<String> relativePath = relativePath(logicalName);
        if (relativePath.isEmpty()) {
            return Optional.empty();
        }
        Path file = baseDir.resolve(relativePath.get()).normalize();
        if (Files.isRegularFile(file)) {
            try {
                return Optional.of(Files.readAllBytes(file));
            } catch (IOException ioException) {
                throw new AssetLoadException(logicalName, "Failed to read asset " + file, ioException);
            }
        }
        return readClasspath(logicalName, CLASSPATH_ROOT + relativePath.get());
    }

    /**
     * File an icon is stored at, whether or not it exists yet.
     */
    public Path iconPath(String iconName) {
        return baseDir.resolve(ICON_DIRECTORY).resolve(iconName + ICON_EXTENSION);
    }

    Optional<String> relativePath(String logicalName) {
        if (LOGO.equals(logicalName)) {
            return StringUtils.hasText(logoPath) ? Optional.of(logoPath) : Optional.empty();
        }
        if (FONT.equals(logicalName)) {
            return StringUtils.hasText(fontPath) ? Optional.of(fontPath) : Optional.empty();
        }
        if (AssetStore.isIconKey(logicalName)) {
            String iconName = AssetStore.iconName(logicalName);
            if (!iconName.matches("[a-z0-9-]+")) {
                log.warn("Rejected icon name '{}'", iconName);
                return Optional.empty();
            }
            return Optional.of(ICON_DIRECTORY + "/" + iconName + ICON_EXTENSION);
        }
        log.warn("Unknown asset name '{}'", logicalName);
        return Optional.empty();
    }

    private Optional<byte[]> readClasspath(String logicalName, String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream stream = resource.getInputStream()) {
            return Optional.of(stream.readAllBytes());
        } catch (IOException ioException) {
            throw new AssetLoadException(logicalName, "Failed to read classpath asset " + resourcePath, ioException);
        }
    }
}
