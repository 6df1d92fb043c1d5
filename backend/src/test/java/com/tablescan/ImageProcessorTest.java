package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Color;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

class ImageProcessorTest {

    @Test
    void toGrayscale_usesLuminanceWeights() {
        BufferedImage photo = SyntheticImages.whitePhoto(3, 1);
        photo.setRGB(0, 0, 0xFF0000);
        photo.setRGB(1, 0, 0x00FF00);
        photo.setRGB(2, 0, 0x0000FF);

        BufferedImage gray = ImageProcessor.toGrayscale(photo);

        assertEquals(BufferedImage.TYPE_BYTE_GRAY, gray.getType());
        assertEquals(76, SyntheticImages.sample(gray, 0, 0));
        assertEquals(150, SyntheticImages.sample(gray, 1, 0));
        assertEquals(29, SyntheticImages.sample(gray, 2, 0));
    }

    @Test
    void toGrayscale_leavesInputUntouched() {
        BufferedImage photo = SyntheticImages.whitePhoto(4, 4);
        photo.setRGB(1, 1, 0x123456);

        ImageProcessor.toGrayscale(photo);

        assertEquals(0x123456, photo.getRGB(1, 1) & 0xFFFFFF);
    }

    @Test
    void add_saturatesAt255() {
        BufferedImage a = SyntheticImages.binary(2, 1);
        BufferedImage b = SyntheticImages.binary(2, 1);
        a.getRaster().setSample(0, 0, 0, 200);
        b.getRaster().setSample(0, 0, 0, 100);
        b.getRaster().setSample(1, 0, 0, 40);

        BufferedImage sum = ImageProcessor.add(a, b);

        assertEquals(255, SyntheticImages.sample(sum, 0, 0));
        assertEquals(40, SyntheticImages.sample(sum, 1, 0));
    }

    @Test
    void subtract_clampsAtZero() {
        BufferedImage a = SyntheticImages.binary(2, 1);
        BufferedImage b = SyntheticImages.binary(2, 1);
        a.getRaster().setSample(0, 0, 0, 50);
        a.getRaster().setSample(1, 0, 0, 255);
        b.getRaster().setSample(0, 0, 0, 100);

        BufferedImage difference = ImageProcessor.subtract(a, b);

        assertEquals(0, SyntheticImages.sample(difference, 0, 0));
        assertEquals(255, SyntheticImages.sample(difference, 1, 0));
    }

    @Test
    void add_rejectsDifferentSizes() {
        assertThrows(IllegalArgumentException.class,
                () -> ImageProcessor.add(SyntheticImages.binary(2, 2), SyntheticImages.binary(3, 2)));
    }

    @Test
    void invert_flipsSamples() {
        BufferedImage gray = SyntheticImages.binary(2, 1);
        gray.getRaster().setSample(1, 0, 0, 200);

        BufferedImage inverted = ImageProcessor.invert(gray);

        assertEquals(255, SyntheticImages.sample(inverted, 0, 0));
        assertEquals(55, SyntheticImages.sample(inverted, 1, 0));
    }

    @Test
    void addPadding_growsEverySideWithColour() {
        BufferedImage photo = SyntheticImages.whitePhoto(10, 5);
        SyntheticImages.fill(photo, 0, 0, 10, 5, Color.BLACK);

        BufferedImage padded = ImageProcessor.addPadding(photo, 4, Color.WHITE);

        assertEquals(18, padded.getWidth());
        assertEquals(13, padded.getHeight());
        assertEquals(0xFFFFFF, padded.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0xFFFFFF, padded.getRGB(17, 12) & 0xFFFFFF);
        assertEquals(0x000000, padded.getRGB(4, 4) & 0xFFFFFF);
        assertEquals(0x000000, padded.getRGB(13, 8) & 0xFFFFFF);
    }

    @Test
    void crop_clipsToImage() {
        BufferedImage photo = SyntheticImages.whitePhoto(20, 10);

        BufferedImage cropped = ImageProcessor.crop(photo, new BoundingBox(15, 5, 10, 10));

        assertEquals(5, cropped.getWidth());
        assertEquals(5, cropped.getHeight());
    }

    @Test
    void countForeground_countsNonZeroSamples() {
        BufferedImage binary = SyntheticImages.binary(10, 10);
        SyntheticImages.set(binary, 2, 2, 3, 4);

        assertEquals(12, ImageProcessor.countForeground(binary));
    }
}
