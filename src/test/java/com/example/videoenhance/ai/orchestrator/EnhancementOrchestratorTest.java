package com.example.videoenhance.ai.orchestrator;

import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.core.TransientServiceException;
import com.example.videoenhance.ai.providers.CritiqueProvider;
import com.example.videoenhance.ai.providers.EditedImage;
import com.example.videoenhance.ai.providers.ImageEnhancementProvider;
import com.example.videoenhance.ai.providers.SurgicalEditProvider;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.CritiqueIssue;
import com.example.videoenhance.model.DegradationReason;
import com.example.videoenhance.model.EnhancementAttempt;
import com.example.videoenhance.model.EnhancementState;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.StopReason;
import com.example.videoenhance.testsupport.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the improve-and-critique loop with mocked AI services
 */
@SpringBootTest
@ActiveProfiles("ci")
public class EnhancementOrchestratorTest {

    @Autowired
    private EnhancementOrchestrator orchestrator;

    @MockBean
    private ImageEnhancementProvider enhancementProvider;

    @MockBean
    private CritiqueProvider critiqueProvider;

    @MockBean
    private SurgicalEditProvider surgicalEditProvider;

    private final Frame representative = TestFrames.solid(12, TestFrames.rgb(100, 100, 100));
    private final Frame enhanced = TestFrames.solid(0, TestFrames.rgb(120, 110, 100));

    @BeforeEach
    public void setUp() {
        when(enhancementProvider.isAvailable()).thenReturn(true);
        when(enhancementProvider.getProviderName()).thenReturn("mock-enhancer");
        when(critiqueProvider.isAvailable()).thenReturn(true);
        when(critiqueProvider.getProviderName()).thenReturn("mock-critic");
        when(surgicalEditProvider.isAvailable()).thenReturn(true);
        when(surgicalEditProvider.getProviderName()).thenReturn("mock-inpainter");
    }

    @Test
    public void testEnhance_FirstCritiqueMeetsTarget_SatisfiedAfterOneIteration() {
        // Given
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenReturn(new EditedImage(enhanced, "Warmer tones, lifted shadows"));
        when(critiqueProvider.critique(any(Frame.class))).thenReturn(new Critique(9.0, List.of()));

        // When
        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        // Then
        assertEquals(EnhancementState.SATISFIED, attempt.getState());
        assertEquals(StopReason.SCORE_TARGET_REACHED, attempt.getStopReason());
        assertEquals(1, attempt.getIterations());
        assertEquals(9.0, attempt.getFinalScore());
        assertEquals("Warmer tones, lifted shadows", attempt.getEnhancementDescription());
        assertTrue(attempt.getNotices().isEmpty());
        verify(enhancementProvider, times(1)).enhance(any(Frame.class), anyString());
        verify(critiqueProvider, times(1)).critique(any(Frame.class));
        verifyNoInteractions(surgicalEditProvider);
    }

    @Test
    public void testEnhance_EditKeepsRepresentativePosition() {
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, ""));
        when(critiqueProvider.critique(any(Frame.class))).thenReturn(new Critique(9.0, List.of()));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(12, attempt.getEdited().getIndex());
        assertEquals(representative.getTimestampSeconds(), attempt.getEdited().getTimestampSeconds());
        assertEquals(enhanced.getRgb(0), attempt.getEdited().getRgb(0));
    }

    @Test
    public void testEnhance_ScoreNeverReachesTarget_StopsAtIterationCap() {
        // Given
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(5.0, List.of(CritiqueIssue.global("Increase contrast"))));

        // When
        EnhancementAttempt attempt = orchestrator.enhance(1, representative, 8.5, 3, null, RunDeadline.none());

        // Then
        assertEquals(EnhancementState.TERMINAL, attempt.getState());
        assertEquals(StopReason.ITERATION_CAP, attempt.getStopReason());
        assertEquals(3, attempt.getIterations());
        verify(enhancementProvider, times(3)).enhance(any(Frame.class), anyString());
        verify(critiqueProvider, times(3)).critique(any(Frame.class));
        assertTrue(attempt.hasEdit(), "Best edit is kept even though the target was missed");
    }

    @Test
    public void testEnhance_GlobalRetry_SendsNumberedIssues() {
        // Given
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(6.0, List.of(CritiqueIssue.global("Reduce noise"), CritiqueIssue.global("Warm skin"))))
            .thenReturn(new Critique(9.0, List.of()));

        // When
        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, "Make it moodier", RunDeadline.none());

        // Then
        verify(enhancementProvider).enhance(any(Frame.class),
            argThat(s -> s.contains("ADDITIONAL USER FEEDBACK") && s.contains("Make it moodier") && !s.contains("1. Reduce noise")));
        verify(enhancementProvider).enhance(any(Frame.class),
            argThat(s -> s.contains("1. Reduce noise") && s.contains("2. Warm skin")));
        assertEquals(2, attempt.getIterations());
        assertEquals(List.of("Reduce noise", "Warm skin"), attempt.getImprovementsApplied());
    }

    @Test
    public void testEnhance_TransientFailureThenSuccess_RecoversViaRetry() {
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenThrow(new TransientServiceException("mock-enhancer", "503"))
            .thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class))).thenReturn(new Critique(9.0, List.of()));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(EnhancementState.SATISFIED, attempt.getState());
        assertTrue(attempt.getNotices().isEmpty());
        verify(enhancementProvider, times(2)).enhance(any(Frame.class), anyString());
    }

    @Test
    public void testEnhance_EnhancementFails_KeepsOriginalWithNotice() {
        // Given
        when(enhancementProvider.enhance(any(Frame.class), anyString()))
            .thenThrow(new ServiceCallException("mock-enhancer", "400 invalid argument"));

        // When
        EnhancementAttempt attempt = orchestrator.enhance(2, representative, 8.5, 3, null, RunDeadline.none());

        // Then
        assertFalse(attempt.hasEdit());
        assertSame(representative, attempt.getBestFrame());
        assertEquals(StopReason.SERVICE_FAILURE, attempt.getStopReason());
        assertEquals(1, attempt.getNotices().size());
        assertEquals(DegradationReason.ENHANCEMENT_FAILED, attempt.getNotices().get(0).reason());
        assertEquals(2, attempt.getNotices().get(0).groupIndex());
        verifyNoInteractions(critiqueProvider);
    }

    @Test
    public void testEnhance_CritiqueUnparseable_AcceptsCurrentEdit() {
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenThrow(new MalformedResponseException("mock-critic", "no JSON object in response"));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(EnhancementState.SATISFIED, attempt.getState());
        assertEquals(StopReason.CRITIQUE_UNPARSEABLE, attempt.getStopReason());
        assertTrue(attempt.hasEdit());
        assertEquals(DegradationReason.CRITIQUE_UNPARSEABLE, attempt.getNotices().get(0).reason());
        verify(critiqueProvider, times(2)).critique(any(Frame.class));
    }

    @Test
    public void testEnhance_CritiqueServiceDown_TerminalWithEdit() {
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenThrow(new ServiceCallException("mock-critic", "403 forbidden"));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(EnhancementState.TERMINAL, attempt.getState());
        assertTrue(attempt.hasEdit());
        assertEquals(DegradationReason.CRITIQUE_FAILED, attempt.getNotices().get(0).reason());
    }

    @Test
    public void testEnhance_SurgicalIssue_UsesMaskEdit() {
        // Given
        Frame inpainted = TestFrames.solid(0, TestFrames.rgb(125, 110, 100));
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(7.0, List.of(CritiqueIssue.surgical("Remove lens flare", "top-right"))))
            .thenReturn(new Critique(9.0, List.of()));
        when(surgicalEditProvider.edit(any(Frame.class), eq("top-right"), eq("Remove lens flare"))).thenReturn(inpainted);

        // When
        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        // Then
        assertEquals(EnhancementState.SATISFIED, attempt.getState());
        assertEquals(2, attempt.getIterations());
        assertEquals(inpainted.getRgb(0), attempt.getEdited().getRgb(0));
        assertEquals(List.of("top-right: Remove lens flare"), attempt.getImprovementsApplied());
        verify(enhancementProvider, times(1)).enhance(any(Frame.class), anyString());
    }

    @Test
    public void testEnhance_SurgicalEditFails_KeepsPreviousEdit() {
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(7.0, List.of(CritiqueIssue.surgical("Remove logo", "bottom-left"))));
        when(surgicalEditProvider.edit(any(Frame.class), anyString(), anyString()))
            .thenThrow(new ServiceCallException("mock-inpainter", "400 bad mask"));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(EnhancementState.TERMINAL, attempt.getState());
        assertEquals(enhanced.getRgb(0), attempt.getBestFrame().getRgb(0));
        assertEquals(DegradationReason.SURGICAL_EDIT_FAILED, attempt.getNotices().get(0).reason());
    }

    @Test
    public void testEnhance_SurgicalProviderUnavailable_FallsBackToGlobalRetry() {
        when(surgicalEditProvider.isAvailable()).thenReturn(false);
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(7.0, List.of(CritiqueIssue.surgical("Remove logo", "bottom-left"))))
            .thenReturn(new Critique(9.0, List.of()));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertEquals(EnhancementState.SATISFIED, attempt.getState());
        verify(enhancementProvider, times(2)).enhance(any(Frame.class), anyString());
        verify(surgicalEditProvider, never()).edit(any(Frame.class), anyString(), anyString());
    }

    @Test
    public void testEnhance_DeadlinePassed_StopsAfterFirstCritique() {
        when(enhancementProvider.enhance(any(Frame.class), anyString())).thenReturn(new EditedImage(enhanced, "pass"));
        when(critiqueProvider.critique(any(Frame.class)))
            .thenReturn(new Critique(5.0, List.of(CritiqueIssue.global("Increase contrast"))));

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.after(Duration.ZERO));

        assertEquals(StopReason.DEADLINE, attempt.getStopReason());
        assertEquals(1, attempt.getIterations());
        assertTrue(attempt.hasEdit());
    }

    @Test
    public void testEnhance_ProvidersUnavailable_KeepsOriginal() {
        when(enhancementProvider.isAvailable()).thenReturn(false);

        EnhancementAttempt attempt = orchestrator.enhance(0, representative, 8.5, 3, null, RunDeadline.none());

        assertFalse(attempt.hasEdit());
        assertEquals(DegradationReason.ENHANCEMENT_FAILED, attempt.getNotices().get(0).reason());
        verify(enhancementProvider, never()).enhance(any(Frame.class), anyString());
    }
}
