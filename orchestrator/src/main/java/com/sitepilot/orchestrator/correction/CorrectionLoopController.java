package com.sitepilot.orchestrator.correction;

import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides what happens after each validation.
 *
 * <pre>
 *   no errors                          -> SUCCESS (per-cycle count reset)
 *   total >= maxTotalAttempts          -> TERMINATE
 *   perCycle <= targetedBeforeRegen    -> TARGETED_CORRECTION
 *   otherwise                          -> FULL_REGENERATION (per-cycle count reset)
 * </pre>
 *
 * With the defaults (2, 5) the 3rd consecutive failure regenerates and the
 * 5th failure overall ends the request.
 */
@Component
public class CorrectionLoopController {

    private static final Logger log = LoggerFactory.getLogger(CorrectionLoopController.class);

    private final int targetedAttemptsBeforeRegeneration;
    private final int maxTotalAttempts;

    @Autowired
    public CorrectionLoopController(OrchestratorProperties properties) {
        this(properties.getCorrection().getTargetedAttemptsBeforeRegeneration(),
             properties.getCorrection().getMaxTotalAttempts());
    }

    public CorrectionLoopController(int targetedAttemptsBeforeRegeneration, int maxTotalAttempts) {
        if (targetedAttemptsBeforeRegeneration < 0 || maxTotalAttempts < 1) {
            throw new IllegalArgumentException("Invalid correction thresholds: targeted="
                    + targetedAttemptsBeforeRegeneration + ", max=" + maxTotalAttempts);
        }
        this.targetedAttemptsBeforeRegeneration = targetedAttemptsBeforeRegeneration;
        this.maxTotalAttempts                   = maxTotalAttempts;
    }

    public CorrectionRoute route(ValidationReport report, CorrectionAttemptCounter counter) {
        if (report.isClean()) {
            counter.resetCycle();
            return CorrectionRoute.SUCCESS;
        }
        return recordFailure(counter);
    }

    /** Route a failed attempt that produced no validation report (apply-level retry). */
    public CorrectionRoute recordFailure(CorrectionAttemptCounter counter) {
        counter.recordFailure();
        CorrectionRoute route;
        if (counter.total() >= maxTotalAttempts) {
            route = CorrectionRoute.TERMINATE;
        } else if (counter.perCycle() <= targetedAttemptsBeforeRegeneration) {
            route = CorrectionRoute.TARGETED_CORRECTION;
        } else {
            counter.resetCycle();
            route = CorrectionRoute.FULL_REGENERATION;
        }
        log.info("Correction route {} after {}", route, counter);
        return route;
    }
}
