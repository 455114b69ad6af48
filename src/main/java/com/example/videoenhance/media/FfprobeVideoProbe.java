package com.example.videoenhance.media;

import com.example.videoenhance.model.VideoMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads stream properties with {@code ffprobe -print_format json}.
 */
@Service
public class FfprobeVideoProbe implements VideoProbe {

    private static final Logger log = LoggerFactory.getLogger(FfprobeVideoProbe.class);

    @Value("${ffprobe.path:ffprobe}")
    private String ffprobePath = "ffprobe";

    private final ObjectMapper objectMapper;

    public FfprobeVideoProbe(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public VideoMetadata probe(Path video) {
        if (!Files.isRegularFile(video)) {
            throw new ToolInvocationException("Input video not found: " + video, -1);
        }
        String output = ToolProcess.run(buildCommand(video));
        VideoMetadata metadata = parse(output);
        try {
            metadata.setSizeBytes(Files.size(video));
        } catch (IOException e) {
            throw new ToolInvocationException("Cannot stat " + video + ": " + e.getMessage(), e);
        }
        log.info("Probed {}: {}", video.getFileName(), metadata);
        return metadata;
    }

    List<String> buildCommand(Path video) {
        return List.of(ffprobePath,
            "-v", "quiet",
            "-print_format", "json",
            "-show_format",
            "-show_streams",
            video.toString());
    }

    /**
     * Extracts duration, frame rate, geometry and codecs from ffprobe's JSON output.
     */
    VideoMetadata parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ToolInvocationException("Unreadable ffprobe output: " + e.getMessage(), e);
        }

        VideoMetadata metadata = new VideoMetadata();
        boolean hasVideo = false;
        for (JsonNode stream : root.path("streams")) {
            String type = stream.path("codec_type").asText();
            if ("video".equals(type) && !hasVideo) {
                hasVideo = true;
                metadata.setVideoCodec(stream.path("codec_name").asText(null));
                metadata.setWidth(stream.path("width").asInt());
                metadata.setHeight(stream.path("height").asInt());
                double fps = parseFrameRate(stream.path("r_frame_rate").asText(""));
                if (fps <= 0) {
                    fps = parseFrameRate(stream.path("avg_frame_rate").asText(""));
                }
                metadata.setFrameRate(fps);
                if (stream.has("duration")) {
                    metadata.setDurationSeconds(stream.path("duration").asDouble());
                }
            } else if ("audio".equals(type) && metadata.getAudioCodec() == null) {
                metadata.setAudioCodec(stream.path("codec_name").asText(null));
            }
        }
        if (!hasVideo) {
            throw new ToolInvocationException("No video stream found", -1);
        }

        // Container duration is more reliable than the stream's when both exist.
        JsonNode formatDuration = root.path("format").path("duration");
        if (!formatDuration.isMissingNode()) {
            metadata.setDurationSeconds(formatDuration.asDouble(metadata.getDurationSeconds()));
        }
        return metadata;
    }

    /**
     * Parses ffprobe rates such as "30/1", "30000/1001" or "25". Returns 0 when unparseable.
     */
    static double parseFrameRate(String rate) {
        if (rate == null || rate.isBlank()) {
            return 0;
        }
        try {
            int slash = rate.indexOf('/');
            if (slash < 0) {
                return Double.parseDouble(rate.trim());
            }
            double num = Double.parseDouble(rate.substring(0, slash).trim());
            double den = Double.parseDouble(rate.substring(slash + 1).trim());
            return den == 0 ? 0 : num / den;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
