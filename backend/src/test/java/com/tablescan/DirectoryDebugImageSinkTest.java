package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryDebugImageSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void publish_writesPngNamedAfterImageAndState() throws Exception {
        Path directory = tempDir.resolve("debug");
        DirectoryDebugImageSink sink = new DirectoryDebugImageSink(directory);

        sink.publish("scan 1.jpg", "locator_binary", SyntheticImages.binary(12, 8));

        Path written = directory.resolve("scan_1.jpg_locator_binary.png");
        assertTrue(Files.exists(written));
        assertEquals(12, ImageIO.read(written.toFile()).getWidth());
    }

    @Test
    void publish_unwritableDirectory_isIgnored() throws Exception {
        Path notADirectory = Files.createFile(tempDir.resolve("file"));
        DirectoryDebugImageSink sink = new DirectoryDebugImageSink(notADirectory);
        BufferedImage image = SyntheticImages.binary(4, 4);

        assertDoesNotThrow(() -> sink.publish(null, "cells_blobs", image));
    }
}
