package com.tablescan;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Color;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

class MatsTest {

    @Test
    void rgb_keepsRedInFirstChannel() {
        BufferedImage photo = SyntheticImages.whitePhoto(4, 3);
        photo.setRGB(2, 1, new Color(200, 30, 10).getRGB());

        Mat mat = Mats.rgb(photo);

        assertEquals(CvType.CV_8UC3, mat.type());
        assertEquals(3, mat.rows());
        assertEquals(4, mat.cols());
        assertArrayEquals(new double[]{200, 30, 10}, mat.get(1, 2), 0.0);
        assertEquals(new Color(200, 30, 10).getRGB(), Mats.toRgb(mat).getRGB(2, 1));
    }

    @Test
    void gray_copiesBinarySamplesInRasterOrder() {
        BufferedImage binary = SyntheticImages.binary(5, 4);
        SyntheticImages.set(binary, 3, 2, 1, 1);

        Mat mat = Mats.gray(binary);

        assertEquals(CvType.CV_8UC1, mat.type());
        assertEquals(255.0, mat.get(2, 3)[0], 0.0);
        assertEquals(0.0, mat.get(3, 2)[0], 0.0);
        assertEquals(255, SyntheticImages.sample(Mats.toGray(mat), 3, 2));
    }

    @Test
    void toGray_wrongChannelCount_throws() {
        Mat colour = Mats.rgb(SyntheticImages.whitePhoto(2, 2));

        assertThrows(IllegalArgumentException.class, () -> Mats.toGray(colour));
    }
}
