package com.example.videoenhance.ai.lut;

import java.util.Locale;

/**
 * Immutable 3D color lookup table with {@code size} nodes per axis. Node
 * {@code i} on an axis stands for the input level {@code i * 255 / (size - 1)};
 * each node stores an output RGB triple in [0, 255].
 */
public final class ColorTransform {

    public static final int DEFAULT_SIZE = 32;

    private final int size;
    // Flattened as ((r * size + g) * size + b) * 3 + channel.
    private final float[] table;

    ColorTransform(int size, float[] table) {
        this.size = size;
        this.table = table;
    }

    public static ColorTransform identity(int size) {
        requireValidSize(size);
        float[] table = new float[size * size * size * 3];
        for (int r = 0; r < size; r++) {
            for (int g = 0; g < size; g++) {
                for (int b = 0; b < size; b++) {
                    int base = nodeOffset(size, r, g, b);
                    table[base] = (float) nodeLevel(size, r);
                    table[base + 1] = (float) nodeLevel(size, g);
                    table[base + 2] = (float) nodeLevel(size, b);
                }
            }
        }
        return new ColorTransform(size, table);
    }

    public int getSize() {
        return size;
    }

    /**
     * Output value of one channel (0 = red, 1 = green, 2 = blue) at a grid node.
     */
    public float output(int r, int g, int b, int channel) {
        return table[nodeOffset(size, r, g, b) + channel];
    }

    public boolean isIdentity() {
        for (int r = 0; r < size; r++) {
            for (int g = 0; g < size; g++) {
                for (int b = 0; b < size; b++) {
                    int base = nodeOffset(size, r, g, b);
                    if (table[base] != (float) nodeLevel(size, r)
                            || table[base + 1] != (float) nodeLevel(size, g)
                            || table[base + 2] != (float) nodeLevel(size, b)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * Renders the table in the .cube text format (red varies fastest, values in [0, 1]),
     * readable by ffmpeg's lut3d filter and most grading tools.
     */
    public String toCubeFormat(String title) {
        StringBuilder sb = new StringBuilder(size * size * size * 28 + 64);
        sb.append("TITLE \"").append(title).append("\"\n");
        sb.append("LUT_3D_SIZE ").append(size).append("\n\n");
        for (int b = 0; b < size; b++) {
            for (int g = 0; g < size; g++) {
                for (int r = 0; r < size; r++) {
                    int base = nodeOffset(size, r, g, b);
                    sb.append(String.format(Locale.ROOT, "%.6f %.6f %.6f%n",
                        table[base] / 255.0, table[base + 1] / 255.0, table[base + 2] / 255.0));
                }
            }
        }
        return sb.toString();
    }

    static double nodeLevel(int size, int node) {
        return node * 255.0 / (size - 1);
    }

    static int nodeOffset(int size, int r, int g, int b) {
        return ((r * size + g) * size + b) * 3;
    }

    static void requireValidSize(int size) {
        if (size < 2 || size > 256) {
            throw new IllegalArgumentException("LUT size must be within [2, 256]: " + size);
        }
    }
}
