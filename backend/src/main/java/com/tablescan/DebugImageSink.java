package com.tablescan;

import java.awt.image.BufferedImage;

/**
 * Receives intermediate images of each stage, e.g. {@code "structure_mask"}.
 */
public interface DebugImageSink {

    DebugImageSink NONE = (imageId, state, image) -> { };

    void publish(String imageId, String state, BufferedImage image);
}
