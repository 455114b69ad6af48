package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.FrameGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Applies a group's color transform to every frame of the group.
 */
@Service
public class TransformPropagator {

    private static final Logger log = LoggerFactory.getLogger(TransformPropagator.class);

    /**
     * Maps every pixel through the transform with trilinear interpolation between
     * the eight surrounding grid nodes. The identity transform returns the same pixels.
     */
    public Frame apply(ColorTransform transform, Frame frame) {
        int size = transform.getSize();
        double scale = (size - 1) / 255.0;
        int[] out = new int[frame.getPixelCount()];

        for (int i = 0; i < out.length; i++) {
            int rgb = frame.getRgb(i);
            double fr = ((rgb >> 16) & 0xFF) * scale;
            double fg = ((rgb >> 8) & 0xFF) * scale;
            double fb = (rgb & 0xFF) * scale;

            int r0 = Math.min((int) fr, size - 2);
            int g0 = Math.min((int) fg, size - 2);
            int b0 = Math.min((int) fb, size - 2);
            double dr = fr - r0;
            double dg = fg - g0;
            double db = fb - b0;

            int packed = 0;
            for (int c = 0; c < 3; c++) {
                double c00 = lerp(transform.output(r0, g0, b0, c), transform.output(r0 + 1, g0, b0, c), dr);
                double c01 = lerp(transform.output(r0, g0, b0 + 1, c), transform.output(r0 + 1, g0, b0 + 1, c), dr);
                double c10 = lerp(transform.output(r0, g0 + 1, b0, c), transform.output(r0 + 1, g0 + 1, b0, c), dr);
                double c11 = lerp(transform.output(r0, g0 + 1, b0 + 1, c), transform.output(r0 + 1, g0 + 1, b0 + 1, c), dr);
                double value = lerp(lerp(c00, c10, dg), lerp(c01, c11, dg), db);
                int channel = (int) Math.max(0, Math.min(255, Math.round(value)));
                packed = (packed << 8) | channel;
            }
            out[i] = packed;
        }
        return frame.withPixels(frame.getWidth(), frame.getHeight(), out);
    }

    /**
     * Writes the whole group to the sink. The representative is written with its edited
     * pixels as-is, including any surgical edits; every other frame is loaded and color
     * mapped.
     *
     * @param representativeEdited final edited representative, already at source geometry
     */
    public void propagate(FrameGroup group, Frame representativeEdited, ColorTransform transform,
                          FrameSource source, FrameSink sink) throws IOException {
        for (int index = group.getStartIndex(); index < group.getEndIndex(); index++) {
            if (index == group.getRepresentativeIndex()) {
                sink.write(representativeEdited);
            } else {
                sink.write(apply(transform, source.load(index)));
            }
        }
        log.debug("Propagated transform to {} frames of group {}", group.getFrameCount(), group.getGroupIndex());
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }
}
