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

public enum StepFailureKind {

    /**
     * No instruction document exists for the step identifier.
     */
    INSTRUCTION_NOT_FOUND,

    /**
     * The reasoning service was unreachable, timed out or returned an error.
     */
    EXECUTION_FAILED,

    /**
     * The run was cancelled or its deadline expired while the step was waiting.
     */
    CANCELLED,

    /**
     * The step produced a response without an actionable NEXT_STEP marker.
     */
    PARSE_FAILED
}
