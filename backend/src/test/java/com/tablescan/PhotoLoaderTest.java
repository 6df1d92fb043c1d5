package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PhotoLoaderTest {

    @TempDir
    Path tempDir;

    private static BufferedImage marked() {
        BufferedImage image = SyntheticImages.whitePhoto(4, 2);
        image.setRGB(0, 0, Color.RED.getRGB());
        return image;
    }

    private static byte[] png(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    void load_pngWithoutExif_keepsPixels() throws Exception {
        BufferedImage loaded = PhotoLoader.load(png(marked()));

        assertEquals(BufferedImage.TYPE_INT_RGB, loaded.getType());
        assertEquals(4, loaded.getWidth());
        assertEquals(2, loaded.getHeight());
        assertEquals(Color.RED.getRGB(), loaded.getRGB(0, 0));
    }

    @Test
    void load_fromPath() throws Exception {
        Path file = tempDir.resolve("photo.png");
        Files.write(file, png(marked()));

        assertEquals(4, PhotoLoader.load(file).getWidth());
    }

    @Test
    void load_garbage_throwsIOException() {
        assertThrows(IOException.class, () -> PhotoLoader.load("not an image".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readOrientation_withoutMetadata_isUpright() throws Exception {
        assertEquals(1, PhotoLoader.readOrientation(png(marked())));
        assertEquals(1, PhotoLoader.readOrientation(new byte[]{1, 2, 3}));
    }

    @Test
    void applyOrientation_six_rotatesClockwise() {
        BufferedImage rotated = PhotoLoader.applyOrientation(marked(), 6);

        assertEquals(2, rotated.getWidth());
        assertEquals(4, rotated.getHeight());
        assertEquals(Color.RED.getRGB(), rotated.getRGB(1, 0));
    }

    @Test
    void applyOrientation_three_rotatesHalfTurn() {
        BufferedImage rotated = PhotoLoader.applyOrientation(marked(), 3);

        assertEquals(4, rotated.getWidth());
        assertEquals(Color.RED.getRGB(), rotated.getRGB(3, 1));
    }

    @Test
    void applyOrientation_one_returnsSameImage() {
        BufferedImage image = marked();

        assertSame(image, PhotoLoader.applyOrientation(image, 1));
    }
}
