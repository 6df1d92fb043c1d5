package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

class MorphologyTest {

    private static BufferedImage cross() {
        BufferedImage binary = SyntheticImages.binary(60, 60);
        SyntheticImages.set(binary, 5, 30, 50, 1);   // horizontal line
        SyntheticImages.set(binary, 30, 5, 1, 50);   // vertical line
        return binary;
    }

    @Test
    void erode_withHorizontalElement_keepsOnlyHorizontalStrokes() {
        BufferedImage eroded = Morphology.erode(cross(), StructuringElement.horizontal(9, 1));

        assertEquals(255, SyntheticImages.sample(eroded, 20, 30));
        assertEquals(0, SyntheticImages.sample(eroded, 30, 10));
        assertEquals(0, SyntheticImages.sample(eroded, 30, 50));
    }

    @Test
    void open_restoresTheSurvivingLineExactly() {
        BufferedImage opened = Morphology.open(cross(), StructuringElement.horizontal(9, 1));

        BufferedImage expected = SyntheticImages.binary(60, 60);
        SyntheticImages.set(expected, 5, 30, 50, 1);
        assertImagesEqual(expected, opened);
    }

    @Test
    void open_withEvenElement_isExact() {
        BufferedImage binary = SyntheticImages.binary(20, 3);
        SyntheticImages.set(binary, 3, 1, 10, 1);
        SyntheticImages.set(binary, 16, 1, 2, 1);

        BufferedImage opened = Morphology.open(binary, StructuringElement.horizontal(4, 1));

        BufferedImage expected = SyntheticImages.binary(20, 3);
        SyntheticImages.set(expected, 3, 1, 10, 1);
        assertImagesEqual(expected, opened);
    }

    @Test
    void dilate_growsSinglePixelIntoKernel() {
        BufferedImage binary = SyntheticImages.binary(9, 9);
        SyntheticImages.set(binary, 4, 4, 1, 1);

        BufferedImage dilated = Morphology.dilate(binary, StructuringElement.block(3));

        assertEquals(9, ImageProcessor.countForeground(dilated));
        assertEquals(255, SyntheticImages.sample(dilated, 3, 3));
        assertEquals(255, SyntheticImages.sample(dilated, 5, 5));
    }

    @Test
    void dilate_iteratesAndKeepsDimensions() {
        BufferedImage binary = SyntheticImages.binary(11, 7);
        SyntheticImages.set(binary, 5, 3, 1, 1);

        BufferedImage dilated = Morphology.dilate(binary, StructuringElement.block(3).withIterations(2));

        assertEquals(11, dilated.getWidth());
        assertEquals(7, dilated.getHeight());
        assertEquals(25, ImageProcessor.countForeground(dilated));
    }

    @Test
    void dilate_atImageEdge_doesNotCrop() {
        BufferedImage binary = SyntheticImages.binary(5, 5);
        SyntheticImages.set(binary, 0, 0, 1, 1);

        BufferedImage dilated = Morphology.dilate(binary, StructuringElement.block(3));

        assertEquals(4, ImageProcessor.countForeground(dilated));
    }

    @Test
    void close_fillsNarrowGap() {
        BufferedImage binary = SyntheticImages.binary(20, 5);
        SyntheticImages.set(binary, 2, 2, 7, 1);
        SyntheticImages.set(binary, 10, 2, 7, 1);

        BufferedImage closed = Morphology.close(binary, StructuringElement.horizontal(3, 1));

        assertEquals(255, SyntheticImages.sample(closed, 9, 2));
        assertEquals(15, ImageProcessor.countForeground(closed));
    }

    @Test
    void removeSmallComponents_dropsComponentsBelowArea() {
        BufferedImage binary = SyntheticImages.binary(30, 30);
        SyntheticImages.set(binary, 2, 2, 3, 1);      // 3 pixels
        SyntheticImages.set(binary, 10, 10, 5, 4);    // 20 pixels
        SyntheticImages.set(binary, 20, 20, 1, 1);    // 1 pixel
        SyntheticImages.set(binary, 21, 21, 2, 2);    // diagonal neighbour, 5 pixels together

        BufferedImage cleaned = Morphology.removeSmallComponents(binary, 5);

        assertEquals(25, ImageProcessor.countForeground(cleaned));
        assertEquals(0, SyntheticImages.sample(cleaned, 3, 2));
        assertEquals(255, SyntheticImages.sample(cleaned, 20, 20));
    }

    private static void assertImagesEqual(BufferedImage expected, BufferedImage actual) {
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getHeight(), actual.getHeight());
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                assertEquals(SyntheticImages.sample(expected, x, y), SyntheticImages.sample(actual, x, y),
                        "pixel " + x + "," + y);
            }
        }
    }
}
