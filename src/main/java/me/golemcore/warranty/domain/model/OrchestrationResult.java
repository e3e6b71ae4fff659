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
import java.util.List;

/**
 * Final output of an orchestration run. The trace holds every executed step
 * in order, including the partial trace of runs that did not complete.
 */
@Value
@Builder
public class OrchestrationResult {

    String runId;
    OrchestrationStatus status;
    RunState terminalState;

    /** Last step that was executed, or the entry step when none ran. */
    String terminalStepId;

    List<StepExecutionResult> trace;
    StepContext finalContext;
    List<StepTransition> transitions;

    StepFailureKind failureKind;
    String failureMessage;
    Throwable failureCause;

    Duration elapsed;

    public List<String> stepSequence() {
        return trace.stream().map(StepExecutionResult::getStepId).toList();
    }

    public int getTotalSteps() {
        return trace.size();
    }

    public boolean isCompleted() {
        return status == OrchestrationStatus.COMPLETED;
    }
}
