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

/**
 * What the orchestrator does when a step response has no NEXT_STEP marker.
 */
public enum ParseFailurePolicy {

    /** Fail the run immediately. */
    FAIL,

    /**
     * Execute the same step once more; fail the run if the second response is
     * also unparseable. The retry counts against the step ceiling.
     */
    RETRY_SAME_STEP
}
