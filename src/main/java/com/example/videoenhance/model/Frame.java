package com.example.videoenhance.model;

import java.util.Arrays;

/**
 * One still image of a video: sequence index, source timestamp and an immutable
 * sRGB pixel buffer. Pixels are packed as 0xRRGGBB, row-major.
 */
public final class Frame {

    private final int index;
    private final double timestampSeconds;
    private final int width;
    private final int height;
    private final int[] pixels;

    public Frame(int index, double timestampSeconds, int width, int height, int[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Pixel buffer does not match " + width + "x" + height);
        }
        this.index = index;
        this.timestampSeconds = timestampSeconds;
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    public int getIndex() {
        return index;
    }

    public double getTimestampSeconds() {
        return timestampSeconds;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    /**
     * Packed 0xRRGGBB value at the given position in the row-major buffer.
     */
    public int getRgb(int position) {
        return pixels[position];
    }

    public int getRgb(int x, int y) {
        return pixels[y * width + x];
    }

    public int[] copyPixels() {
        return pixels.clone();
    }

    public boolean hasSameGeometry(Frame other) {
        return other != null && width == other.width && height == other.height;
    }

    /**
     * Same position in the sequence, new pixels.
     */
    public Frame withPixels(int newWidth, int newHeight, int[] newPixels) {
        return new Frame(index, timestampSeconds, newWidth, newHeight, newPixels);
    }

    public boolean samePixels(Frame other) {
        return hasSameGeometry(other) && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public String toString() {
        return String.format("Frame{index=%d, t=%.3fs, %dx%d}", index, timestampSeconds, width, height);
    }
}
