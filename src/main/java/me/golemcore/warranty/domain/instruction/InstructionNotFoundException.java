package me.golemcore.warranty.domain.instruction;

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

/**
 * Raised when no usable instruction document exists for a step identifier.
 */
public class InstructionNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String stepId;

    public InstructionNotFoundException(String stepId, String reason) {
        super("Instruction not found for step '" + stepId + "': " + reason);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
