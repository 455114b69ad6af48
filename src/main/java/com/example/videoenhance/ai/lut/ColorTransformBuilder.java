package com.example.videoenhance.ai.lut;

import com.example.videoenhance.model.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives a color lookup table from one frame before and after enhancement.
 * The two frames must be pixel-aligned: the enhancement instruction forbids
 * changes to spatial composition.
 */
@Service
public class ColorTransformBuilder {

    private static final Logger log = LoggerFactory.getLogger(ColorTransformBuilder.class);

    public ColorTransform build(Frame before, Frame after) {
        return build(before, after, ColorTransform.DEFAULT_SIZE);
    }

    /**
     * Each before pixel spreads its color offset (after - before) over the eight grid
     * nodes around it, with the same trilinear weights {@link TransformPropagator#apply}
     * reads them back with. A node's output is its own level plus the weighted mean
     * offset, so a flat color maps back onto its edited value. Nodes no pixel touched
     * keep the identity mapping, so untouched color regions are left alone.
     *
     * @throws GeometryMismatchException if the frames differ in size
     */
    public ColorTransform build(Frame before, Frame after, int size) {
        ColorTransform.requireValidSize(size);
        if (!before.hasSameGeometry(after)) {
            throw new GeometryMismatchException(before.getWidth(), before.getHeight(),
                                                after.getWidth(), after.getHeight());
        }

        int nodes = size * size * size;
        double[] offsetSums = new double[nodes * 3];
        double[] weights = new double[nodes];
        double scale = (size - 1) / 255.0;

        int pixelCount = before.getPixelCount();
        for (int i = 0; i < pixelCount; i++) {
            int in = before.getRgb(i);
            int out = after.getRgb(i);
            int inR = (in >> 16) & 0xFF;
            int inG = (in >> 8) & 0xFF;
            int inB = in & 0xFF;
            double offR = ((out >> 16) & 0xFF) - inR;
            double offG = ((out >> 8) & 0xFF) - inG;
            double offB = (out & 0xFF) - inB;

            double fr = inR * scale;
            double fg = inG * scale;
            double fb = inB * scale;
            int r0 = Math.min((int) fr, size - 2);
            int g0 = Math.min((int) fg, size - 2);
            int b0 = Math.min((int) fb, size - 2);
            double dr = fr - r0;
            double dg = fg - g0;
            double db = fb - b0;

            for (int corner = 0; corner < 8; corner++) {
                int ri = corner >> 2;
                int gi = (corner >> 1) & 1;
                int bi = corner & 1;
                double w = (ri == 1 ? dr : 1 - dr) * (gi == 1 ? dg : 1 - dg) * (bi == 1 ? db : 1 - db);
                if (w <= 0) {
                    continue;
                }
                int node = ((r0 + ri) * size + (g0 + gi)) * size + (b0 + bi);
                offsetSums[node * 3] += w * offR;
                offsetSums[node * 3 + 1] += w * offG;
                offsetSums[node * 3 + 2] += w * offB;
                weights[node] += w;
            }
        }

        float[] table = new float[nodes * 3];
        int observed = 0;
        for (int r = 0; r < size; r++) {
            for (int g = 0; g < size; g++) {
                for (int b = 0; b < size; b++) {
                    int node = (r * size + g) * size + b;
                    int base = node * 3;
                    double levelR = ColorTransform.nodeLevel(size, r);
                    double levelG = ColorTransform.nodeLevel(size, g);
                    double levelB = ColorTransform.nodeLevel(size, b);
                    if (weights[node] > 0) {
                        observed++;
                        table[base] = clamp(levelR + offsetSums[base] / weights[node]);
                        table[base + 1] = clamp(levelG + offsetSums[base + 1] / weights[node]);
                        table[base + 2] = clamp(levelB + offsetSums[base + 2] / weights[node]);
                    } else {
                        table[base] = (float) levelR;
                        table[base + 1] = (float) levelG;
                        table[base + 2] = (float) levelB;
                    }
                }
            }
        }

        log.debug("Built {}^3 color transform from {} pixels ({} of {} nodes observed)",
                  size, pixelCount, observed, nodes);
        return new ColorTransform(size, table);
    }

    private static float clamp(double value) {
        return (float) Math.max(0.0, Math.min(255.0, value));
    }
}
