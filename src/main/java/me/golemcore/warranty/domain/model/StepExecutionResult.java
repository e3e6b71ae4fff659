package me.golemcore.warranty.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of executing a single step. One instance per loop iteration, in
 * execution order.
 */
@Value
@Builder
public class StepExecutionResult {

    String stepId;
    String responseText;

    @Builder.Default
    StepDecision decision = StepDecision.unparsed();

    boolean success;
    StepFailureKind failureKind;
    String failureMessage;
    Duration elapsed;

    public String getNextStep() {
        return decision.getNextStep();
    }

    public boolean isParseFailed() {
        return failureKind == StepFailureKind.PARSE_FAILED;
    }

    public static StepExecutionResult parsed(String stepId, String responseText, StepDecision decision,
            Duration elapsed) {
        return StepExecutionResult.builder()
                .stepId(stepId)
                .responseText(responseText)
                .decision(decision)
                .success(true)
                .elapsed(elapsed)
                .build();
    }

    public static StepExecutionResult parseFailed(String stepId, String responseText, StepDecision decision,
            Duration elapsed) {
        return StepExecutionResult.builder()
                .stepId(stepId)
                .responseText(responseText)
                .decision(decision)
                .success(false)
                .failureKind(StepFailureKind.PARSE_FAILED)
                .failureMessage("Response has no NEXT_STEP marker")
                .elapsed(elapsed)
                .build();
    }
}
