package com.sitepilot.orchestrator.correction;

/**
 * Failed-attempt bookkeeping for one request.
 *
 * {@code perCycle} counts failures since the last regeneration and is reset
 * when the loop escalates; {@code total} only ever grows.
 */
public class CorrectionAttemptCounter {

    private int perCycle;
    private int total;

    public int perCycle() { return perCycle; }
    public int total()    { return total; }

    void recordFailure() {
        perCycle++;
        total++;
    }

    void resetCycle() {
        perCycle = 0;
    }

    @Override
    public String toString() {
        return "attempts(perCycle=" + perCycle + ", total=" + total + ")";
    }
}
