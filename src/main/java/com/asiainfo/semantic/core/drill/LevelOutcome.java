package com.asiainfo.semantic.core.drill;

public enum LevelOutcome {
    STEP_TAKEN,
    COVERAGE_REACHED,
    INSUFFICIENT_IMPROVEMENT,
    NO_ELIGIBLE_CANDIDATE
}
