package com.example.videoenhance.ai.providers.imagen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Builds inpainting masks for named frame regions. White marks the pixels the
 * mask editor may change; black is kept.
 *
 * <p>Regions: the nine cells of a 3x3 grid ({@code top-left} ... {@code bottom-right},
 * each widened by a margin of width/20 so neighbouring edits blend),
 * {@code background} (a border 20% deep on every side), {@code foreground}
 * (the central 60%) and {@code global}. Unknown names fall back to {@code global}.
 */
@Component
public class RegionMaskGenerator {

    private static final Logger log = LoggerFactory.getLogger(RegionMaskGenerator.class);

    public static final List<String> GRID_REGIONS = List.of(
        "top-left", "top-center", "top-right",
        "center-left", "center", "center-right",
        "bottom-left", "bottom-center", "bottom-right");

    public BufferedImage generate(int width, int height, String region) {
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = mask.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.WHITE);
            for (Rectangle r : editableAreas(width, height, region)) {
                g.fillRect(r.x, r.y, r.width, r.height);
            }
        } finally {
            g.dispose();
        }
        return mask;
    }

    public byte[] generatePng(int width, int height, String region) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(generate(width, height, region), "png", baos);
        return baos.toByteArray();
    }

    List<Rectangle> editableAreas(int width, int height, String region) {
        String name = region == null ? "global" : region.trim().toLowerCase(Locale.ROOT);

        int gridIndex = GRID_REGIONS.indexOf(name);
        if (gridIndex >= 0) {
            return List.of(gridCell(width, height, gridIndex / 3, gridIndex % 3));
        }

        switch (name) {
            case "background": {
                int edgeW = width / 5;
                int edgeH = height / 5;
                return List.of(
                    new Rectangle(0, 0, width, edgeH),
                    new Rectangle(0, height - edgeH, width, edgeH),
                    new Rectangle(0, edgeH, edgeW, height - 2 * edgeH),
                    new Rectangle(width - edgeW, edgeH, edgeW, height - 2 * edgeH));
            }
            case "foreground":
                return List.of(new Rectangle(width / 5, height / 5, 4 * width / 5 - width / 5, 4 * height / 5 - height / 5));
            case "global":
                return List.of(new Rectangle(0, 0, width, height));
            default:
                log.warn("Unknown mask region '{}', editing the whole frame", region);
                return List.of(new Rectangle(0, 0, width, height));
        }
    }

    private Rectangle gridCell(int width, int height, int row, int col) {
        int thirdW = width / 3;
        int thirdH = height / 3;
        int margin = width / 20;

        int x1 = col == 0 ? 0 : col * thirdW - margin;
        int x2 = col == 2 ? width : (col + 1) * thirdW + margin;
        int y1 = row == 0 ? 0 : row * thirdH - margin;
        int y2 = row == 2 ? height : (row + 1) * thirdH + margin;

        x1 = Math.max(0, x1);
        y1 = Math.max(0, y1);
        x2 = Math.min(width, x2);
        y2 = Math.min(height, y2);
        return new Rectangle(x1, y1, x2 - x1, y2 - y1);
    }
}
