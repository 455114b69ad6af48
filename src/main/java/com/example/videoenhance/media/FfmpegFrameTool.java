package com.example.videoenhance.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Frame extraction and reassembly with ffmpeg. Frames are lossless PNG; the
 * output is H.264/yuv420p MP4 with the source audio stream copied unchanged.
 */
@Service
public class FfmpegFrameTool implements FrameExtractionTool {

    private static final Logger log = LoggerFactory.getLogger(FfmpegFrameTool.class);

    public static final String FRAME_PATTERN = "frame_%06d.png";

    @Value("${ffmpeg.path:ffmpeg}")
    private String ffmpegPath = "ffmpeg";

    @Override
    public List<Path> extractFrames(Path input, Double fps, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ToolInvocationException("Cannot create frame directory " + outputDir, e);
        }

        long startTime = System.currentTimeMillis();
        ToolProcess.run(buildExtractCommand(input, fps, outputDir));

        List<Path> frames;
        try (Stream<Path> files = Files.list(outputDir)) {
            frames = files
                .filter(p -> p.getFileName().toString().startsWith("frame_") && p.getFileName().toString().endsWith(".png"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ToolInvocationException("Cannot list extracted frames in " + outputDir, e);
        }
        if (frames.isEmpty()) {
            throw new ToolInvocationException("ffmpeg produced no frames for " + input, 0);
        }

        log.info("Extracted {} frames from {} at {} fps in {}ms", frames.size(), input.getFileName(),
                 fps == null ? "source" : String.format(Locale.ROOT, "%.2f", fps),
                 System.currentTimeMillis() - startTime);
        return frames;
    }

    @Override
    public Path reassemble(Path framesDir, Path originalInput, double fps, boolean copyAudio, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ToolInvocationException("Cannot create output directory for " + output, e);
        }

        long startTime = System.currentTimeMillis();
        ToolProcess.run(buildReassembleCommand(framesDir, originalInput, fps, copyAudio, output));

        if (!Files.isRegularFile(output)) {
            throw new ToolInvocationException("ffmpeg reported success but wrote no output: " + output, 0);
        }
        log.info("Reassembled video {} at {} fps (audio copied: {}) in {}ms", output.getFileName(),
                 String.format(Locale.ROOT, "%.2f", fps), copyAudio, System.currentTimeMillis() - startTime);
        return output;
    }

    List<String> buildExtractCommand(Path input, Double fps, Path outputDir) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegPath);
        cmd.add("-i");
        cmd.add(input.toString());
        if (fps != null) {
            cmd.add("-vf");
            cmd.add("fps=" + formatRate(fps));
        }
        cmd.add("-vsync");
        cmd.add("0");
        cmd.add("-y");
        cmd.add(outputDir.resolve(FRAME_PATTERN).toString());
        return cmd;
    }

    List<String> buildReassembleCommand(Path framesDir, Path originalInput, double fps, boolean copyAudio, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegPath);
        cmd.add("-framerate");
        cmd.add(formatRate(fps));
        cmd.add("-i");
        cmd.add(framesDir.resolve(FRAME_PATTERN).toString());
        if (copyAudio) {
            cmd.add("-i");
            cmd.add(originalInput.toString());
            cmd.add("-map");
            cmd.add("0:v");
            // '?' keeps sources without an audio stream working
            cmd.add("-map");
            cmd.add("1:a?");
        }
        cmd.add("-c:v");
        cmd.add("libx264");
        cmd.add("-crf");
        cmd.add("18");
        cmd.add("-preset");
        cmd.add("slow");
        cmd.add("-pix_fmt");
        cmd.add("yuv420p");
        if (copyAudio) {
            cmd.add("-c:a");
            cmd.add("copy");
        } else {
            cmd.add("-an");
        }
        cmd.add("-movflags");
        cmd.add("+faststart");
        cmd.add("-y");
        cmd.add(output.toString());
        return cmd;
    }

    private static String formatRate(double fps) {
        if (fps == Math.rint(fps)) {
            return String.valueOf((long) fps);
        }
        return String.format(Locale.ROOT, "%.3f", fps);
    }
}
