package me.golemcore.warranty.domain.eval;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.warranty.domain.model.StepValidationResult;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compares the executed step sequence of a run with the sequence an eval case
 * expects.
 *
 * <p>
 * Rules: a {@code null} expectation always passes; an empty one always fails;
 * steps must match index by index; extra steps fail; a shorter run passes only
 * if it stopped at one of the configured final steps.
 */
@Component
public class StepSequenceValidator {

    private static final String ARROW = " → ";
    private static final String ACTUAL_PREFIX = "Actual:   ";

    private final Set<String> finalSteps;

    @Autowired
    public StepSequenceValidator(AgentProperties properties) {
        this(properties.getEval().getFinalSteps());
    }

    public StepSequenceValidator(Set<String> finalSteps) {
        this.finalSteps = Set.copyOf(finalSteps);
    }

    public StepValidationResult validate(List<String> expected, List<String> actual) {
        List<String> actualSteps = actual != null ? List.copyOf(actual) : List.of();
        if (expected == null) {
            return new StepValidationResult(true, List.of(), List.of(), actualSteps,
                    "Step validation not enabled for this test case");
        }
        if (expected.isEmpty()) {
            return new StepValidationResult(false,
                    List.of("Expected steps cannot be empty when step validation is enabled"),
                    List.of(), actualSteps, "");
        }

        List<String> failures = new ArrayList<>();
        if (actualSteps.size() > expected.size()) {
            failures.add("Too many steps executed: expected " + expected.size() + ", got " + actualSteps.size());
            failures.add("Unexpected steps: " + actualSteps.subList(expected.size(), actualSteps.size()));
        }

        for (int i = 0; i < expected.size(); i++) {
            if (i >= actualSteps.size()) {
                String lastActual = actualSteps.isEmpty() ? null : actualSteps.get(actualSteps.size() - 1);
                if (lastActual == null || !finalSteps.contains(lastActual)) {
                    failures.add("Missing steps: expected " + expected.subList(i, expected.size())
                            + ", workflow ended at '" + lastActual + "'");
                }
                break;
            }
            if (!actualSteps.get(i).equals(expected.get(i))) {
                failures.add("Step " + (i + 1) + " mismatch: expected '" + expected.get(i) + "', got '"
                        + actualSteps.get(i) + "'");
            }
        }

        return new StepValidationResult(failures.isEmpty(), List.copyOf(failures), List.copyOf(expected),
                actualSteps, buildDiff(expected, actualSteps));
    }

    /**
     * Multi-line failure report, or an empty string when the result passed.
     */
    public String formatFailure(StepValidationResult result) {
        if (result.passed()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Step validation failed:\n\n");
        sb.append(result.stepDiff()).append("\n\n");
        for (String failure : result.failures()) {
            sb.append("  • ").append(failure).append('\n');
        }
        return sb.toString().trim();
    }

    String buildDiff(List<String> expected, List<String> actual) {
        if (expected.isEmpty() && actual.isEmpty()) {
            return "No steps";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Expected: ").append(expected.isEmpty() ? "(none)" : String.join(ARROW, expected)).append('\n');
        sb.append(ACTUAL_PREFIX).append(actual.isEmpty() ? "(none)" : String.join(ARROW, actual));

        int mismatch = -1;
        for (int i = 0; i < Math.min(expected.size(), actual.size()); i++) {
            if (!expected.get(i).equals(actual.get(i))) {
                mismatch = i;
                break;
            }
        }
        if (mismatch >= 0) {
            StringBuilder indicator = new StringBuilder(" ".repeat(ACTUAL_PREFIX.length()));
            for (int i = 0; i < mismatch; i++) {
                indicator.append(actual.get(i)).append(ARROW);
            }
            indicator.append("^".repeat(actual.get(mismatch).length())).append(" mismatch");
            sb.append('\n').append(indicator);
        }
        return sb.toString();
    }
}
