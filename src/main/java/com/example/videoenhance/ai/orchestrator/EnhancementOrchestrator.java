package com.example.videoenhance.ai.orchestrator;

import com.example.videoenhance.ai.core.AIModelProvider;
import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.providers.CritiqueProvider;
import com.example.videoenhance.ai.providers.EditedImage;
import com.example.videoenhance.ai.providers.ImageEnhancementProvider;
import com.example.videoenhance.ai.providers.PromptLibrary;
import com.example.videoenhance.ai.providers.SurgicalEditProvider;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.CritiqueIssue;
import com.example.videoenhance.model.DegradationReason;
import com.example.videoenhance.model.EnhancementAttempt;
import com.example.videoenhance.model.EnhancementState;
import com.example.videoenhance.model.Frame;
import com.example.videoenhance.model.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the improve-and-critique loop for one group's representative frame:
 *
 * <pre>
 * ENHANCING -> ANALYZING -> SATISFIED
 *                        -> SURGICAL_EDIT -> ANALYZING ...
 *                        -> GLOBAL_RETRY  -> ANALYZING ...
 *                        -> TERMINAL
 * </pre>
 *
 * Service failures never escape: the attempt keeps the best frame obtained so
 * far and records a degradation notice.
 */
@Service
public class EnhancementOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EnhancementOrchestrator.class);

    private final ServiceCallExecutor executor;
    private final QualityGate qualityGate;
    private final PromptLibrary prompts;

    @Autowired(required = false)
    private ImageEnhancementProvider enhancementProvider;

    @Autowired(required = false)
    private CritiqueProvider critiqueProvider;

    @Autowired(required = false)
    private SurgicalEditProvider surgicalEditProvider;

    @Autowired
    public EnhancementOrchestrator(ServiceCallExecutor executor, QualityGate qualityGate, PromptLibrary prompts) {
        this.executor = executor;
        this.qualityGate = qualityGate;
        this.prompts = prompts;
    }

    /**
     * Enhances a representative frame until the quality gate stops the loop.
     * The returned attempt is always terminal.
     *
     * @param userFeedback optional text appended to the creative instruction
     */
    public EnhancementAttempt enhance(int groupIndex, Frame representative, double scoreTarget,
                                      int maxIterations, String userFeedback, RunDeadline deadline) {
        EnhancementAttempt attempt = new EnhancementAttempt(groupIndex, representative);
        String instruction = prompts.enhancementInstruction(userFeedback);

        if (!isUsable(enhancementProvider) || !isUsable(critiqueProvider)) {
            attempt.addNotice(DegradationReason.ENHANCEMENT_FAILED, "No enhancement or critique provider is available");
            attempt.finish(EnhancementState.TERMINAL, StopReason.SERVICE_FAILURE);
            log.warn("Group {}: AI providers unavailable, keeping original frame", groupIndex);
            return attempt;
        }

        // ENHANCING
        attempt.beginEditing(EnhancementState.ENHANCING);
        try {
            EditedImage result = executor.execute("enhance group " + groupIndex,
                () -> enhancementProvider.enhance(representative, instruction));
            attempt.acceptEdit(alignWith(representative, result.frame()));
            attempt.setEnhancementDescription(result.description());
        } catch (ServiceCallException e) {
            attempt.addNotice(DegradationReason.ENHANCEMENT_FAILED, e.getMessage());
            attempt.finish(EnhancementState.TERMINAL, StopReason.SERVICE_FAILURE);
            log.warn("Group {}: enhancement failed, keeping original frame: {}", groupIndex, e.getMessage());
            return attempt;
        }

        while (!attempt.isTerminal()) {
            analyze(attempt);
            if (attempt.isTerminal()) {
                break;
            }

            QualityGate.Verdict verdict = qualityGate.evaluate(attempt, scoreTarget, maxIterations, deadline);
            if (verdict != null) {
                attempt.finish(verdict.state(), verdict.reason());
                break;
            }

            if (attempt.getCritique().hasSurgicalIssues() && isUsable(surgicalEditProvider)) {
                surgicalEdit(attempt);
            } else {
                globalRetry(attempt, instruction);
            }
        }

        log.info("Group {}: enhancement finished with {} ({}) after {} iteration(s), score={}",
                 groupIndex, attempt.getState(), attempt.getStopReason(), attempt.getIterations(),
                 attempt.getFinalScore());
        return attempt;
    }

    private void analyze(EnhancementAttempt attempt) {
        attempt.beginAnalyzing();
        int group = attempt.getGroupIndex();
        Frame edited = attempt.getEdited();
        try {
            Critique critique = executor.execute("critique group " + group, () -> critiqueProvider.critique(edited));
            attempt.recordCritique(critique);
            log.debug("Group {}: {}", group, critique);
        } catch (MalformedResponseException e) {
            // Nothing usable to act on; keep the edit as it stands.
            attempt.addNotice(DegradationReason.CRITIQUE_UNPARSEABLE, e.getMessage());
            attempt.finish(EnhancementState.SATISFIED, StopReason.CRITIQUE_UNPARSEABLE);
            log.warn("Group {}: critique unreadable, accepting current edit", group);
        } catch (ServiceCallException e) {
            attempt.addNotice(DegradationReason.CRITIQUE_FAILED, e.getMessage());
            attempt.finish(EnhancementState.TERMINAL, StopReason.SERVICE_FAILURE);
            log.warn("Group {}: critique failed, accepting current edit: {}", group, e.getMessage());
        }
    }

    /**
     * One mask edit per surgical issue, counted as a single iteration.
     */
    private void surgicalEdit(EnhancementAttempt attempt) {
        attempt.beginEditing(EnhancementState.SURGICAL_EDIT);
        int group = attempt.getGroupIndex();
        Frame current = attempt.getEdited();

        for (CritiqueIssue issue : attempt.getCritique().surgicalIssues()) {
            Frame input = current;
            try {
                Frame result = executor.execute("mask edit group " + group + " (" + issue.region() + ")",
                    () -> surgicalEditProvider.edit(input, issue.region(), issue.description()));
                current = alignWith(input, result);
                attempt.addImprovement(issue.region() + ": " + issue.description());
            } catch (ServiceCallException e) {
                attempt.acceptEdit(current);
                attempt.addNotice(DegradationReason.SURGICAL_EDIT_FAILED, e.getMessage());
                attempt.finish(EnhancementState.TERMINAL, StopReason.SERVICE_FAILURE);
                log.warn("Group {}: mask edit of region '{}' failed: {}", group, issue.region(), e.getMessage());
                return;
            }
        }
        attempt.acceptEdit(current);
    }

    private void globalRetry(EnhancementAttempt attempt, String instruction) {
        attempt.beginEditing(EnhancementState.GLOBAL_RETRY);
        int group = attempt.getGroupIndex();
        Frame current = attempt.getEdited();
        List<CritiqueIssue> issues = attempt.getCritique().getIssues();
        String retryInstruction = prompts.retryInstruction(instruction, issues);

        try {
            EditedImage result = executor.execute("re-enhance group " + group,
                () -> enhancementProvider.enhance(current, retryInstruction));
            attempt.acceptEdit(alignWith(current, result.frame()));
            issues.forEach(issue -> attempt.addImprovement(issue.description()));
        } catch (ServiceCallException e) {
            attempt.addNotice(DegradationReason.GLOBAL_RETRY_FAILED, e.getMessage());
            attempt.finish(EnhancementState.TERMINAL, StopReason.SERVICE_FAILURE);
            log.warn("Group {}: global retry failed, keeping previous edit: {}", group, e.getMessage());
        }
    }

    /**
     * Providers return bare images; pin the result to the input's position in the sequence.
     */
    private static Frame alignWith(Frame source, Frame edited) {
        if (edited.getIndex() == source.getIndex() && edited.getTimestampSeconds() == source.getTimestampSeconds()) {
            return edited;
        }
        return source.withPixels(edited.getWidth(), edited.getHeight(), edited.copyPixels());
    }

    private static boolean isUsable(AIModelProvider provider) {
        return provider != null && provider.isAvailable();
    }
}
