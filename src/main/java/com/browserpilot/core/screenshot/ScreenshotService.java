package com.browserpilot.core.screenshot;

import com.browserpilot.client.AutomationClient;
import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Downloads screenshots the service captured.
 * <p>
 * References are whatever path the service reported (often an absolute path on
 * the service host); only their last path segment is sent back.
 */
@Service
public class ScreenshotService {

    private static final Logger log = LoggerFactory.getLogger(ScreenshotService.class);

    private final AutomationClient client;
    private final PilotProperties properties;

    public ScreenshotService(AutomationClient client, PilotProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    /**
     * Reduces a screenshot reference to its file name. Handles both separators.
     */
    public static String fileName(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new ValidationException("screenshot", null, "screenshot reference must not be empty");
        }
        String trimmed = reference.trim();
        int cut = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String name = trimmed.substring(cut + 1);
        if (name.isEmpty() || name.equals("..") || name.equals(".")) {
            throw new ValidationException("screenshot", null, "no file name in screenshot reference: " + reference);
        }
        return name;
    }

    public byte[] fetch(String reference) {
        return client.fetchScreenshot(fileName(reference));
    }

    public Path save(String reference) {
        return save(reference, Path.of(properties.getScreenshotDirectory()));
    }

    /**
     * Fetches a screenshot and writes it into {@code directory}, creating it if needed.
     *
     * @return the written file
     */
    public Path save(String reference, Path directory) {
        String name = fileName(reference);
        byte[] bytes = client.fetchScreenshot(name);
        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(name);
            Files.write(target, bytes);
            log.info("Saved screenshot {} ({} bytes)", target, bytes.length);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write screenshot " + name + " to " + directory, e);
        }
    }
}
