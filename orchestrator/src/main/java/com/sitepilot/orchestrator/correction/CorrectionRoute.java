package com.sitepilot.orchestrator.correction;

public enum CorrectionRoute {
    SUCCESS,
    TARGETED_CORRECTION,
    FULL_REGENERATION,
    TERMINATE
}
