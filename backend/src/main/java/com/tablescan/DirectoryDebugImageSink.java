package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@code <imageId>_<state>.png} files into one directory. Write failures are logged
 * and otherwise ignored; a debug dump never fails an image.
 */
public class DirectoryDebugImageSink implements DebugImageSink {

    private static final Logger log = LoggerFactory.getLogger(DirectoryDebugImageSink.class);

    private final Path directory;

    public DirectoryDebugImageSink(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void publish(String imageId, String state, BufferedImage image) {
        String name = sanitize(imageId == null ? "image" : imageId) + "_" + sanitize(state) + ".png";
        Path target = directory.resolve(name);
        try {
            Files.createDirectories(directory);
            ImageIO.write(image, "png", target.toFile());
            log.debug("Debug image written: {}", target);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not write debug image {}: {}", target, e.getMessage());
        }
    }

    private static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
