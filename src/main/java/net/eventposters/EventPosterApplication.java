/**
 * Main application class for the event poster renderer
 *
 * Features:
 * - Loads a local .env file (for PEXELS_API_KEY) before the context starts
 * - Forces headless AWT so posters render on servers without a display
 * - Entry point for Spring Boot application
 */

package net.eventposters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventPosterApplication {

    private static final Logger log = LoggerFactory.getLogger(EventPosterApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Path.of(".env"));
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(EventPosterApplication.class, args);
    }

    /**
     * Copies entries of a .env file into system properties unless an environment
     * variable of the same name is already set.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
