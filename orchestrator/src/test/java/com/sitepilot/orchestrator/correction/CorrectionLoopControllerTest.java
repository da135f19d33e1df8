package com.sitepilot.orchestrator.correction;

import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.Severity;
import com.sitepilot.orchestrator.validation.ValidationError;
import com.sitepilot.orchestrator.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrectionLoopControllerTest {

    static final ValidationReport CLEAN  = new ValidationReport(List.of(), Map.of());
    static final ValidationReport FAILED = new ValidationReport(List.of(
            ValidationError.of(ErrorKind.BUILD_ERROR, Severity.CRITICAL, "src/App.jsx", "boom")), Map.of());

    final CorrectionLoopController controller = new CorrectionLoopController(2, 5);

    @Test
    void route_cleanReport_successAndCycleReset() {
        CorrectionAttemptCounter counter = new CorrectionAttemptCounter();
        controller.route(FAILED, counter);

        assertThat(controller.route(CLEAN, counter)).isEqualTo(CorrectionRoute.SUCCESS);
        assertThat(counter.perCycle()).isZero();
        assertThat(counter.total()).isEqualTo(1);
    }

    @Test
    void route_consecutiveFailures_followEscalationLadder() {
        CorrectionAttemptCounter counter = new CorrectionAttemptCounter();
        List<CorrectionRoute> routes = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            routes.add(controller.route(FAILED, counter));
        }

        assertThat(routes).containsExactly(
                CorrectionRoute.TARGETED_CORRECTION,
                CorrectionRoute.TARGETED_CORRECTION,
                CorrectionRoute.FULL_REGENERATION,
                CorrectionRoute.TARGETED_CORRECTION,
                CorrectionRoute.TERMINATE);
    }

    @Test
    void route_thirdFailure_regeneratesAndResetsCycleOnly() {
        CorrectionAttemptCounter counter = new CorrectionAttemptCounter();
        controller.route(FAILED, counter);
        controller.route(FAILED, counter);

        assertThat(controller.route(FAILED, counter)).isEqualTo(CorrectionRoute.FULL_REGENERATION);
        assertThat(counter.perCycle()).isZero();
        assertThat(counter.total()).isEqualTo(3);
    }

    @Test
    void route_totalNeverDecreases() {
        CorrectionAttemptCounter counter = new CorrectionAttemptCounter();
        int previous = 0;
        for (int i = 0; i < 4; i++) {
            controller.route(i % 2 == 0 ? FAILED : CLEAN, counter);
            assertThat(counter.total()).isGreaterThanOrEqualTo(previous);
            previous = counter.total();
        }
        assertThat(counter.total()).isEqualTo(2);
    }

    @Test
    void recordFailure_withoutReport_countsLikeValidationFailure() {
        CorrectionAttemptCounter counter = new CorrectionAttemptCounter();

        assertThat(controller.recordFailure(counter)).isEqualTo(CorrectionRoute.TARGETED_CORRECTION);
        assertThat(counter.total()).isEqualTo(1);
    }

    @Test
    void constructor_invalidThresholds_rejected() {
        assertThatThrownBy(() -> new CorrectionLoopController(2, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
