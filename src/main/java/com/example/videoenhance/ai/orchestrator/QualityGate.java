package com.example.videoenhance.ai.orchestrator;

import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.EnhancementAttempt;
import com.example.videoenhance.model.EnhancementState;
import com.example.videoenhance.model.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides after every critique whether a group's improve-and-critique loop stops.
 * Conditions are checked in a fixed order and the first match wins:
 * <ol>
 *   <li>score at or above target: SATISFIED</li>
 *   <li>no remaining issues: SATISFIED</li>
 *   <li>iteration cap reached: TERMINAL</li>
 *   <li>run deadline passed: TERMINAL</li>
 * </ol>
 */
@Service
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    /**
     * @return the stop verdict, or null when another edit should be attempted
     */
    public Verdict evaluate(EnhancementAttempt attempt, double scoreTarget, int maxIterations, RunDeadline deadline) {
        Critique critique = attempt.getCritique();
        if (critique == null) {
            throw new IllegalStateException("Group " + attempt.getGroupIndex() + " has not been critiqued yet");
        }

        Verdict verdict = null;
        if (critique.getScore() >= scoreTarget) {
            verdict = new Verdict(EnhancementState.SATISFIED, StopReason.SCORE_TARGET_REACHED);
        } else if (!critique.hasIssues()) {
            verdict = new Verdict(EnhancementState.SATISFIED, StopReason.NO_ISSUES);
        } else if (attempt.getIterations() >= maxIterations) {
            verdict = new Verdict(EnhancementState.TERMINAL, StopReason.ITERATION_CAP);
        } else if (deadline.isExpired()) {
            verdict = new Verdict(EnhancementState.TERMINAL, StopReason.DEADLINE);
        }

        log.debug("QualityGate: group {} score={} (target {}), issues={}, iterations={}/{} -> {}",
                  attempt.getGroupIndex(), critique.getScore(), scoreTarget, critique.getIssues().size(),
                  attempt.getIterations(), maxIterations, verdict == null ? "continue" : verdict);
        return verdict;
    }

    /**
     * Terminal state and why the loop stopped
     */
    public record Verdict(EnhancementState state, StopReason reason) {
    }
}
