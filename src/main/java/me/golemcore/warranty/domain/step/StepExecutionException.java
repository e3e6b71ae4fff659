package me.golemcore.warranty.domain.step;

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

import me.golemcore.warranty.domain.model.StepFailureKind;

/**
 * Unrecoverable failure while executing a step: the instruction is missing, the
 * reasoning service failed, or the run was cancelled while waiting for it.
 */
public class StepExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String stepId;
    private final StepFailureKind kind;

    public StepExecutionException(String stepId, StepFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.kind = kind;
    }

    public StepExecutionException(String stepId, StepFailureKind kind, String message) {
        this(stepId, kind, message, null);
    }

    public String getStepId() {
        return stepId;
    }

    public StepFailureKind getKind() {
        return kind;
    }
}
