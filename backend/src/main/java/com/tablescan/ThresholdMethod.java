package com.tablescan;

public enum ThresholdMethod {
    /** Global cutoff taken from configuration. */
    FIXED,
    /** Global cutoff derived from the image histogram. */
    OTSU,
    /** Per-pixel cutoff from the mean of a local block. */
    ADAPTIVE_MEAN
}
