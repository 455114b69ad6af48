package com.example.videoenhance.pipeline;

import com.example.videoenhance.ai.core.VideoEnhancementException;
import com.example.videoenhance.ai.grouping.FrameGrouper;
import com.example.videoenhance.ai.histogram.HistogramEngine;
import com.example.videoenhance.ai.lut.ColorTransform;
import com.example.videoenhance.ai.lut.ColorTransformBuilder;
import com.example.videoenhance.ai.lut.GeometryMismatchException;
import com.example.videoenhance.ai.lut.TransformPropagator;
import com.example.videoenhance.ai.orchestrator.EnhancementOrchestrator;
import com.example.videoenhance.ai.orchestrator.RunDeadline;
import com.example.videoenhance.config.EnhancementProperties;
import com.example.videoenhance.media.ExtractionRatePolicy;
import com.example.videoenhance.media.FrameCodec;
import com.example.videoenhance.media.FrameExtractionTool;
import com.example.videoenhance.media.ToolInvocationException;
import com.example.videoenhance.media.VideoProbe;
import com.example.videoenhance.model.DegradationReason;
import com.example.videoenhance.model.EnhancementAttempt;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.FrameFile;
import com.example.videoenhance.model.FrameGroup;
import com.example.videoenhance.model.GroupDegradationNotice;
import com.example.videoenhance.model.StopReason;
import com.example.videoenhance.model.VideoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * End-to-end enhancement of one video:
 * probe, admit, extract, group, enhance each group's representative,
 * propagate its color change to the rest of the group, reassemble.
 *
 * Only extraction, reassembly and rejected input abort a run. Anything that goes
 * wrong inside a group leaves that group's original frames in the output and
 * adds a notice to the result.
 */
@Service
public class VideoEnhancementPipeline {

    private static final Logger log = LoggerFactory.getLogger(VideoEnhancementPipeline.class);

    static final String OUTPUT_FRAME_PATTERN = "frame_%06d.png";
    static final String OUTPUT_SUFFIX = "_enhanced.mp4";

    private final VideoProbe videoProbe;
    private final FrameExtractionTool frameTool;
    private final ExtractionRatePolicy ratePolicy;
    private final HistogramEngine histogramEngine;
    private final FrameGrouper frameGrouper;
    private final EnhancementOrchestrator orchestrator;
    private final ColorTransformBuilder transformBuilder;
    private final TransformPropagator propagator;
    private final EnhancementProperties properties;

    public VideoEnhancementPipeline(VideoProbe videoProbe,
                                    FrameExtractionTool frameTool,
                                    ExtractionRatePolicy ratePolicy,
                                    HistogramEngine histogramEngine,
                                    FrameGrouper frameGrouper,
                                    EnhancementOrchestrator orchestrator,
                                    ColorTransformBuilder transformBuilder,
                                    TransformPropagator propagator,
                                    EnhancementProperties properties) {
        this.videoProbe = videoProbe;
        this.frameTool = frameTool;
        this.ratePolicy = ratePolicy;
        this.histogramEngine = histogramEngine;
        this.frameGrouper = frameGrouper;
        this.orchestrator = orchestrator;
        this.transformBuilder = transformBuilder;
        this.propagator = propagator;
        this.properties = properties;
    }

    /**
     * Enhances the video and writes it next to the input as {@code <name>_enhanced.mp4}.
     */
    public EnhancementResult enhanceVideo(Path inputPath, EnhancementConfig config) {
        return enhanceVideo(inputPath, defaultOutputPath(inputPath), config);
    }

    /**
     * @throws IllegalArgumentException  if the config is invalid
     * @throws InputRejectedException    if the input is too long or too large to be worth enhancing
     * @throws ToolInvocationException   if probing, extraction or reassembly fails
     */
    public EnhancementResult enhanceVideo(Path inputPath, Path outputPath, EnhancementConfig config) {
        config.validate();
        long startTime = System.currentTimeMillis();
        RunDeadline deadline = RunDeadline.after(Duration.ofSeconds(config.getWallClockBudgetSeconds()));
        log.info("Enhancing {} -> {} with {}", inputPath, outputPath, config);

        VideoMetadata metadata = videoProbe.probe(inputPath);
        admit(inputPath, metadata, config);

        double fps = ratePolicy.choose(metadata.getDurationSeconds(), metadata.getFrameRate(),
                                       config.getExtractionFrameRate());
        log.info("Source: {}; extracting at {} fps", metadata, fps);

        Path workDir = createWorkDir();
        try {
            Path framesDir = workDir.resolve("frames");
            Path enhancedDir = workDir.resolve("enhanced");
            Files.createDirectories(enhancedDir);

            List<FrameFile> frames = toFrameFiles(frameTool.extractFrames(inputPath, fps, framesDir), fps);
            List<FrameGroup> groups = groupFrames(frames, config.getGroupSimilarityThreshold());
            log.info("Split {} frames into {} groups ({} frames/group on average)", frames.size(), groups.size(),
                     String.format("%.1f", groups.isEmpty() ? 0.0 : (double) frames.size() / groups.size()));

            List<GroupEnhancementResult> groupResults = runGroups(groups, frames, config, deadline, enhancedDir);

            Path written = frameTool.reassemble(enhancedDir, inputPath, fps, true, outputPath);

            EnhancementResult result = new EnhancementResult();
            result.setOutputPath(written.toString());
            result.setSourceMetadata(metadata);
            result.setExtractionFrameRate(fps);
            result.setTotalFrames(frames.size());
            result.setTotalGroups(groups.size());
            result.setGroups(groupResults);
            result.setProcessingTimeMs(System.currentTimeMillis() - startTime);
            result.setSummary(summarize(result));

            log.info("Enhancement of {} finished in {}ms: {}", inputPath, result.getProcessingTimeMs(), result.getSummary());
            for (GroupDegradationNotice notice : result.getNotices()) {
                log.warn("{}", notice);
            }
            return result;
        } catch (IOException e) {
            throw new VideoEnhancementException("I/O failure in work directory " + workDir + ": " + e.getMessage(), e);
        } finally {
            cleanUp(workDir);
        }
    }

    // =========================
    // Run steps
    // =========================

    private void admit(Path inputPath, VideoMetadata metadata, EnhancementConfig config) {
        if (metadata.getDurationSeconds() > config.getMaxDurationSeconds()) {
            throw new InputRejectedException(String.format(
                "Video is %.1fs long, limit is %.0fs: enhancement is not cost-effective for longer videos",
                metadata.getDurationSeconds(), config.getMaxDurationSeconds()));
        }
        if (metadata.getSizeBytes() > config.getMaxInputBytes()) {
            throw new InputRejectedException(String.format(
                "Video %s is %d bytes, limit is %d: enhancement is not cost-effective for larger files",
                inputPath.getFileName(), metadata.getSizeBytes(), config.getMaxInputBytes()));
        }
    }

    private static List<FrameFile> toFrameFiles(List<Path> paths, double fps) {
        List<FrameFile> frames = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            frames.add(new FrameFile(i, i / fps, paths.get(i)));
        }
        return frames;
    }

    /**
     * Streams frames from disk one at a time; only the previous histogram is kept.
     */
    private List<FrameGroup> groupFrames(List<FrameFile> frames, double threshold) {
        try {
            return frameGrouper.group(frames.size(), i -> {
                try {
                    return histogramEngine.compute(load(frames.get(i)));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, threshold);
        } catch (UncheckedIOException e) {
            throw new ToolInvocationException("Cannot read extracted frame: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private List<GroupEnhancementResult> runGroups(List<FrameGroup> groups, List<FrameFile> frames,
                                                   EnhancementConfig config, RunDeadline deadline,
                                                   Path enhancedDir) {
        List<GroupEnhancementResult> results = new ArrayList<>(groups.size());
        if (groups.isEmpty()) {
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getConcurrency(), groups.size()));
        try {
            List<Future<GroupEnhancementResult>> futures = new ArrayList<>(groups.size());
            for (FrameGroup group : groups) {
                futures.add(pool.submit(() -> processGroup(group, frames, config, deadline, enhancedDir)));
            }

            // Barrier: every group is on disk before reassembly starts.
            for (int i = 0; i < futures.size(); i++) {
                FrameGroup group = groups.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Group {} worker failed: {}", group.getGroupIndex(), cause.getMessage(), cause);
                    results.add(fallBackToOriginals(group, frames, enhancedDir, StopReason.SERVICE_FAILURE,
                                                    DegradationReason.GROUP_FAILED, cause.getMessage()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoEnhancementException("Interrupted while waiting for group workers", e);
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    GroupEnhancementResult processGroup(FrameGroup group, List<FrameFile> frames, EnhancementConfig config,
                                        RunDeadline deadline, Path enhancedDir) {
        int groupIndex = group.getGroupIndex();
        if (deadline.isExpired()) {
            log.warn("Group {}: wall-clock budget exhausted before start, keeping original frames", groupIndex);
            return fallBackToOriginals(group, frames, enhancedDir, StopReason.DEADLINE,
                                       DegradationReason.DEADLINE_EXCEEDED, "wall-clock budget exhausted before group started");
        }

        try {
            Frame representative = load(frames.get(group.getRepresentativeIndex()));
            EnhancementAttempt attempt = orchestrator.enhance(groupIndex, representative, config.getQualityScoreTarget(),
                                                              config.getMaxIterationsPerGroup(), config.getUserFeedback(),
                                                              deadline);
            GroupEnhancementResult result = GroupEnhancementResult.from(group, attempt);

            if (!attempt.hasEdit()) {
                copyOriginals(group, frames, enhancedDir);
                return result;
            }

            Frame edited = attempt.getBestFrame();
            ColorTransform transform;
            try {
                transform = transformBuilder.build(representative, edited, config.getLutSize());
            } catch (GeometryMismatchException e) {
                log.warn("Group {}: {}; rescaling the edit and leaving the other frames unchanged", groupIndex, e.getMessage());
                result.addNotice(new GroupDegradationNotice(groupIndex, DegradationReason.GEOMETRY_MISMATCH, e.getMessage()));
                edited = FrameCodec.resize(edited, representative.getWidth(), representative.getHeight());
                transform = ColorTransform.identity(config.getLutSize());
            }

            propagator.propagate(group, edited, transform,
                index -> load(frames.get(index)),
                frame -> FrameCodec.write(frame, outputFrame(enhancedDir, frame.getIndex())));
            return result;
        } catch (Exception e) {
            log.error("Group {}: failed, keeping original frames: {}", groupIndex, e.getMessage(), e);
            return fallBackToOriginals(group, frames, enhancedDir, StopReason.SERVICE_FAILURE,
                                       DegradationReason.GROUP_FAILED, e.getMessage());
        }
    }

    private GroupEnhancementResult fallBackToOriginals(FrameGroup group, List<FrameFile> frames, Path enhancedDir,
                                                       StopReason stopReason, DegradationReason reason, String detail) {
        try {
            copyOriginals(group, frames, enhancedDir);
        } catch (IOException e) {
            // Reassembly cannot succeed with a hole in the frame sequence.
            throw new VideoEnhancementException("Cannot write original frames of group " + group.getGroupIndex(), e);
        }
        return GroupEnhancementResult.unchanged(group, stopReason,
                                                new GroupDegradationNotice(group.getGroupIndex(), reason, detail));
    }

    private static void copyOriginals(FrameGroup group, List<FrameFile> frames, Path enhancedDir) throws IOException {
        for (int index = group.getStartIndex(); index < group.getEndIndex(); index++) {
            Files.copy(frames.get(index).path(), outputFrame(enhancedDir, index), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // =========================
    // Helpers
    // =========================

    private static Frame load(FrameFile file) throws IOException {
        return FrameCodec.read(file.path(), file.index(), file.timestampSeconds());
    }

    static Path outputFrame(Path dir, int index) {
        return dir.resolve(String.format(OUTPUT_FRAME_PATTERN, index + 1));
    }

    static Path defaultOutputPath(Path inputPath) {
        String name = inputPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = inputPath.toAbsolutePath().getParent();
        return parent == null ? Paths.get(base + OUTPUT_SUFFIX) : parent.resolve(base + OUTPUT_SUFFIX);
    }

    private static String summarize(EnhancementResult result) {
        List<String> parts = new ArrayList<>();
        for (GroupEnhancementResult group : result.getGroups()) {
            if (group.getEnhancementDescription() != null && !group.getEnhancementDescription().isBlank()) {
                parts.add(String.format("Group %d (%d frames): %s", group.getGroupIndex() + 1,
                                        group.getFrameCount(), group.getEnhancementDescription()));
            }
        }
        String summary = parts.isEmpty()
            ? "Video enhancement complete."
            : String.format("Enhanced %d frame groups: %s", result.getTotalGroups(), String.join("; ", parts));
        long degraded = result.getDegradedGroupCount();
        if (degraded > 0) {
            summary += String.format(" (%d of %d groups degraded)", degraded, result.getTotalGroups());
        }
        return summary;
    }

    private Path createWorkDir() {
        try {
            String configured = properties.getWorkDir();
            if (configured == null || configured.isBlank()) {
                return Files.createTempDirectory("video-enhance-");
            }
            Path base = Paths.get(configured);
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "video-enhance-");
        } catch (IOException e) {
            throw new VideoEnhancementException("Cannot create work directory: " + e.getMessage(), e);
        }
    }

    private static void cleanUp(Path workDir) {
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete temp file: {}", path, e);
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up work directory: {}", workDir, e);
        }
    }
}
