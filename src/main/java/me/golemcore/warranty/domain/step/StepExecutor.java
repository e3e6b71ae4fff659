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

import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepExecutionResult;

/**
 * Executes a single workflow step against the reasoning service.
 */
public interface StepExecutor {

    /**
     * Executes {@code stepId} with the given context.
     *
     * @return the parsed result; a response without a NEXT_STEP marker is
     *         returned as a parse-failed result rather than thrown
     * @throws StepExecutionException
     *             if the instruction is missing, the service fails, or the run is
     *             cancelled while the step waits
     */
    StepExecutionResult execute(String stepId, StepContext context, RunControl runControl);
}
