package com.tablescan;

import java.util.Objects;

/**
 * Axis-aligned rectangle in pixel coordinates. {@code x}/{@code y} are the top-left pixel,
 * the box covers {@code width} x {@code height} pixels.
 */
public final class BoundingBox {

    public final int x;
    public final int y;
    public final int width;
    public final int height;

    public BoundingBox(int x, int y, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative box size: " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int area() {
        return width * height;
    }

    /** Exclusive right edge. */
    public int right() {
        return x + width;
    }

    /** Exclusive bottom edge. */
    public int bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public BoundingBox union(BoundingBox other) {
        int left = Math.min(x, other.x);
        int top = Math.min(y, other.y);
        int right = Math.max(right(), other.right());
        int bottom = Math.max(bottom(), other.bottom());
        return new BoundingBox(left, top, right - left, bottom - top);
    }

    /** Grows the box by {@code margin} on every side, clipped to a {@code maxWidth} x {@code maxHeight} image. */
    public BoundingBox expand(int margin, int maxWidth, int maxHeight) {
        int left = Math.max(0, x - margin);
        int top = Math.max(0, y - margin);
        int right = Math.min(maxWidth, right() + margin);
        int bottom = Math.min(maxHeight, bottom() + margin);
        return new BoundingBox(left, top, Math.max(0, right - left), Math.max(0, bottom - top));
    }

    public boolean liesWithin(int imageWidth, int imageHeight) {
        return x >= 0 && y >= 0 && right() <= imageWidth && bottom() <= imageHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) o;
        return x == that.x && y == that.y && width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) [%dx%d]", x, y, width, height);
    }
}
