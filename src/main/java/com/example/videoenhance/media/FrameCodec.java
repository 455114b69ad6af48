package com.example.videoenhance.media;

import com.example.videoenhance.model.Frame;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Conversion between {@link Frame} pixel buffers and encoded images (PNG, JPEG).
 */
public final class FrameCodec {

    public static final String PNG = "png";

    private FrameCodec() {
    }

    public static Frame read(Path path, int index, double timestampSeconds) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Not a readable image: " + path);
        }
        return fromImage(image, index, timestampSeconds);
    }

    public static void write(Frame frame, Path path) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        if (!ImageIO.write(toImage(frame), PNG, path.toFile())) {
            throw new IOException("No PNG writer available for " + path);
        }
    }

    /**
     * Decodes image bytes returned by a provider.
     */
    public static Frame decode(byte[] data, int index, double timestampSeconds) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("Unsupported image data (" + data.length + " bytes)");
        }
        return fromImage(image, index, timestampSeconds);
    }

    public static byte[] encode(Frame frame, String format) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(toImage(frame), format, baos)) {
            throw new IOException("No image writer for format " + format);
        }
        return baos.toByteArray();
    }

    /**
     * Bilinear rescale to the given geometry. Index and timestamp are kept.
     */
    public static Frame resize(Frame frame, int width, int height) {
        if (frame.getWidth() == width && frame.getHeight() == height) {
            return frame;
        }
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(toImage(frame), 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return fromImage(scaled, frame.getIndex(), frame.getTimestampSeconds());
    }

    public static BufferedImage toImage(Frame frame) {
        BufferedImage image = new BufferedImage(frame.getWidth(), frame.getHeight(), BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, frame.getWidth(), frame.getHeight(), frame.copyPixels(), 0, frame.getWidth());
        return image;
    }

    public static Frame fromImage(BufferedImage image, int index, double timestampSeconds) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < argb.length; i++) {
            argb[i] &= 0xFFFFFF;
        }
        return new Frame(index, timestampSeconds, width, height, argb);
    }
}
