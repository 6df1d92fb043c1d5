package com.tablescan;

/**
 * Rectangular kernel for erosion and dilation. The anchor sits at the centre, so odd sizes
 * are symmetric.
 */
public final class StructuringElement {

    public enum Orientation {
        /** {@code length} wide, {@code thickness} tall. */
        HORIZONTAL,
        /** {@code thickness} wide, {@code length} tall. */
        VERTICAL,
        /** {@code length} wide, {@code thickness} tall, meant for compact glyphs. */
        BLOCK
    }

    public final Orientation orientation;
    public final int width;
    public final int height;
    public final int iterations;

    private StructuringElement(Orientation orientation, int width, int height, int iterations) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Kernel size must be positive: " + width + "x" + height);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("Kernel iterations must be positive: " + iterations);
        }
        this.orientation = orientation;
        this.width = width;
        this.height = height;
        this.iterations = iterations;
    }

    public static StructuringElement of(Orientation orientation, int length, int thickness, int iterations) {
        switch (orientation) {
            case VERTICAL:
                return new StructuringElement(orientation, thickness, length, iterations);
            case HORIZONTAL:
            case BLOCK:
            default:
                return new StructuringElement(orientation, length, thickness, iterations);
        }
    }

    public static StructuringElement horizontal(int length, int thickness) {
        return of(Orientation.HORIZONTAL, length, thickness, 1);
    }

    public static StructuringElement vertical(int length, int thickness) {
        return of(Orientation.VERTICAL, length, thickness, 1);
    }

    public static StructuringElement block(int size) {
        return of(Orientation.BLOCK, size, size, 1);
    }

    public StructuringElement withIterations(int iterations) {
        return new StructuringElement(orientation, width, height, iterations);
    }

    public int anchorX() {
        return width / 2;
    }

    public int anchorY() {
        return height / 2;
    }

    @Override
    public String toString() {
        return String.format("%s %dx%d x%d", orientation, width, height, iterations);
    }
}
