package com.example.videoenhance.pipeline;

import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.providers.CritiqueProvider;
import com.example.videoenhance.ai.providers.EditedImage;
import com.example.videoenhance.ai.providers.ImageEnhancementProvider;
import com.example.videoenhance.media.FrameCodec;
import com.example.videoenhance.media.FrameExtractionTool;
import com.example.videoenhance.media.ToolInvocationException;
import com.example.videoenhance.media.VideoProbe;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.DegradationReason;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.StopReason;
import com.example.videoenhance.model.VideoMetadata;
import com.example.videoenhance.testsupport.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end runs with fake media tools and mocked AI services
 */
@SpringBootTest
@ActiveProfiles("ci")
public class VideoEnhancementPipelineTest {

    private static final int SIZE = 16;
    private static final int GRAY = TestFrames.rgb(105, 150, 45);
    private static final int BLUE = TestFrames.rgb(20, 30, 200);

    @Autowired
    private VideoEnhancementPipeline pipeline;

    @MockBean
    private VideoProbe videoProbe;

    @MockBean
    private FrameExtractionTool frameTool;

    @MockBean
    private ImageEnhancementProvider enhancementProvider;

    @MockBean
    private CritiqueProvider critiqueProvider;

    @TempDir
    Path tempDir;

    private Path input;
    private List<Frame> reassembled;

    @BeforeEach
    public void setUp() throws IOException {
        input = Files.write(tempDir.resolve("clip.mp4"), new byte[]{0, 0, 0, 1});
        reassembled = null;

        when(enhancementProvider.isAvailable()).thenReturn(true);
        when(enhancementProvider.getProviderName()).thenReturn("mock-enhancer");
        when(critiqueProvider.isAvailable()).thenReturn(true);
        when(critiqueProvider.getProviderName()).thenReturn("mock-critic");
        when(critiqueProvider.critique(any(Frame.class))).thenReturn(new Critique(9.0, List.of()));

        when(frameTool.reassemble(any(Path.class), any(Path.class), anyDouble(), anyBoolean(), any(Path.class)))
            .thenAnswer(invocation -> {
                reassembled = readFrames(invocation.getArgument(0));
                Path output = invocation.getArgument(4);
                return Files.write(output, new byte[]{1});
            });
    }

    @Test
    public void testEnhanceVideo_StaticShot_OneGroupOneEditAppliedToAllFrames() {
        // Given: 10s at 30fps, 300 identical frames
        probeReturns(10.0, 30.0);
        extractionWrites(300, i -> GRAY);
        enhancerShifts(30, 0, -15);
        EnhancementConfig config = new EnhancementConfig();

        // When
        EnhancementResult result = pipeline.enhanceVideo(input, config);

        // Then
        assertEquals(300, result.getTotalFrames());
        assertEquals(1, result.getTotalGroups());
        assertEquals(30.0, result.getExtractionFrameRate());
        verify(enhancementProvider, times(1)).enhance(any(Frame.class), anyString());
        verify(frameTool).reassemble(any(Path.class), eq(input), eq(30.0), eq(true), any(Path.class));

        assertNotNull(reassembled);
        assertEquals(300, reassembled.size());
        for (Frame frame : reassembled) {
            assertEquals(TestFrames.rgb(135, 150, 30), frame.getRgb(0), "Every frame carries the representative's edit");
        }
        assertTrue(result.getNotices().isEmpty());
        assertEquals(StopReason.SCORE_TARGET_REACHED, result.getGroups().get(0).getStopReason());
        assertTrue(result.getOutputPath().endsWith("clip_enhanced.mp4"));
    }

    @Test
    public void testEnhanceVideo_TwoScenes_EachGroupEnhancedOnce() {
        // Given
        probeReturns(2.0, 30.0);
        extractionWrites(40, i -> i < 20 ? GRAY : BLUE);
        enhancerShifts(0, 0, 0);

        // When
        EnhancementResult result = pipeline.enhanceVideo(input, new EnhancementConfig());

        // Then
        assertEquals(2, result.getTotalGroups());
        assertEquals(0, result.getGroups().get(0).getStartIndex());
        assertEquals(20, result.getGroups().get(1).getStartIndex());
        verify(enhancementProvider, times(2)).enhance(any(Frame.class), anyString());
        assertEquals(40, reassembled.size());
        assertEquals(GRAY, reassembled.get(19).getRgb(0));
        assertEquals(BLUE, reassembled.get(20).getRgb(0));
    }

    @Test
    public void testEnhanceVideo_TooLong_RejectedBeforeExtraction() {
        probeReturns(200.0, 30.0);

        InputRejectedException e = assertThrows(InputRejectedException.class,
            () -> pipeline.enhanceVideo(input, new EnhancementConfig()));

        assertTrue(e.getMessage().contains("not cost-effective"));
        verify(frameTool, never()).extractFrames(any(Path.class), any(), any(Path.class));
        verifyNoInteractions(enhancementProvider);
    }

    @Test
    public void testEnhanceVideo_TooLarge_Rejected() {
        probeReturns(10.0, 30.0);
        EnhancementConfig config = new EnhancementConfig();
        config.setMaxInputBytes(2);

        assertThrows(InputRejectedException.class, () -> pipeline.enhanceVideo(input, config));
    }

    @Test
    public void testEnhanceVideo_InvalidConfig_Throws() {
        EnhancementConfig config = new EnhancementConfig();
        config.setConcurrency(0);

        assertThrows(IllegalArgumentException.class, () -> pipeline.enhanceVideo(input, config));
        verifyNoInteractions(videoProbe);
    }

    @Test
    public void testEnhanceVideo_ZeroBudget_OriginalFramesWithDeadlineNotices() {
        // Given
        probeReturns(2.0, 30.0);
        extractionWrites(40, i -> i < 20 ? GRAY : BLUE);
        EnhancementConfig config = new EnhancementConfig();
        config.setWallClockBudgetSeconds(0);

        // When
        EnhancementResult result = pipeline.enhanceVideo(input, config);

        // Then
        verifyNoInteractions(enhancementProvider);
        assertEquals(2, result.getNotices().size());
        assertTrue(result.getNotices().stream().allMatch(n -> n.reason() == DegradationReason.DEADLINE_EXCEEDED));
        assertEquals(40, reassembled.size());
        assertEquals(GRAY, reassembled.get(0).getRgb(0));
        assertEquals(BLUE, reassembled.get(39).getRgb(0));
    }

    @Test
    public void testEnhanceVideo_EditChangesSize_RescaledWithGeometryNotice() {
        // Given
        probeReturns(1.0, 30.0);
        extractionWrites(10, i -> GRAY);
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenReturn(new EditedImage(TestFrames.solid(0, SIZE * 2, SIZE * 2, TestFrames.rgb(135, 150, 30)), "upscaled"));

        // When
        EnhancementResult result = pipeline.enhanceVideo(input, new EnhancementConfig());

        // Then
        assertEquals(DegradationReason.GEOMETRY_MISMATCH, result.getNotices().get(0).reason());
        assertEquals(10, reassembled.size());
        for (Frame frame : reassembled) {
            assertEquals(SIZE, frame.getWidth(), "Every output frame keeps the source geometry");
            assertEquals(SIZE, frame.getHeight());
        }
        int representative = result.getGroups().get(0).getRepresentativeIndex();
        assertEquals(TestFrames.rgb(135, 150, 30), reassembled.get(representative).getRgb(0));
        assertEquals(GRAY, reassembled.get(0).getRgb(0), "Other frames use the identity transform");
    }

    @Test
    public void testEnhanceVideo_EnhancementServiceDown_OriginalFramesWithNotice() {
        probeReturns(1.0, 30.0);
        extractionWrites(10, i -> GRAY);
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenThrow(new ServiceCallException("mock-enhancer", "401 unauthorized"));

        EnhancementResult result = pipeline.enhanceVideo(input, new EnhancementConfig());

        assertEquals(DegradationReason.ENHANCEMENT_FAILED, result.getNotices().get(0).reason());
        assertEquals(1, result.getDegradedGroupCount());
        assertTrue(reassembled.stream().allMatch(f -> f.getRgb(0) == GRAY));
    }

    @Test
    public void testEnhanceVideo_ExtractionFails_AbortsRun() {
        probeReturns(1.0, 30.0);
        when(frameTool.extractFrames(any(Path.class), any(), any(Path.class)))
            .thenThrow(new ToolInvocationException("ffmpeg exited with code 1", 1));

        assertThrows(ToolInvocationException.class, () -> pipeline.enhanceVideo(input, new EnhancementConfig()));
        verify(frameTool, never()).reassemble(any(Path.class), any(Path.class), anyDouble(), anyBoolean(), any(Path.class));
    }

    @Test
    public void testDefaultOutputPath_AddsSuffixNextToInput() {
        Path output = VideoEnhancementPipeline.defaultOutputPath(tempDir.resolve("holiday.final.mov"));

        assertEquals(tempDir.toAbsolutePath().resolve("holiday.final_enhanced.mp4"), output);
    }

    // =========================
    // Fakes
    // =========================

    private void probeReturns(double durationSeconds, double fps) {
        VideoMetadata metadata = new VideoMetadata(durationSeconds, fps, SIZE, SIZE);
        metadata.setAudioCodec("aac");
        metadata.setSizeBytes(4);
        when(videoProbe.probe(any(Path.class))).thenReturn(metadata);
    }

    private void extractionWrites(int count, IntUnaryOperator colorAt) {
        when(frameTool.extractFrames(any(Path.class), any(), any(Path.class))).thenAnswer(invocation -> {
            Path dir = invocation.getArgument(2);
            Files.createDirectories(dir);
            List<Path> paths = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                Path path = dir.resolve(String.format("frame_%06d.png", i + 1));
                FrameCodec.write(TestFrames.solid(i, SIZE, SIZE, colorAt.applyAsInt(i)), path);
                paths.add(path);
            }
            return paths;
        });
    }

    private void enhancerShifts(int dr, int dg, int db) {
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenAnswer(invocation -> {
                Frame frame = invocation.getArgument(0);
                return new EditedImage(TestFrames.shifted(frame, dr, dg, db), "color graded");
            });
    }

    private static List<Frame> readFrames(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.sorted().collect(Collectors.toList());
        }
        List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            frames.add(FrameCodec.read(files.get(i), i, i / 30.0));
        }
        return frames;
    }
}
