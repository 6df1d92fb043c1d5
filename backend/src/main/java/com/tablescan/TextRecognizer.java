package com.tablescan;

import java.awt.image.BufferedImage;

/**
 * Recognition engine turning one cell image into text. Implementations may block and may
 * fail; the caller treats any failure as an empty cell.
 */
@FunctionalInterface
public interface TextRecognizer {

    String recognize(BufferedImage cellImage) throws Exception;
}
