package me.golemcore.warranty.domain.model;

import java.util.List;

/**
 * Outcome of comparing an executed step sequence with the expected one.
 */
public record StepValidationResult(boolean passed, List<String> failures, List<String> expectedSteps,
        List<String> actualSteps, String stepDiff) {
}
