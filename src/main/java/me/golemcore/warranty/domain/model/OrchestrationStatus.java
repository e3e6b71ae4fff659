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

public enum OrchestrationStatus {

    COMPLETED, CIRCUIT_BROKEN, FAILED;

    public static OrchestrationStatus fromTerminalState(RunState state) {
        return switch (state) {
        case DONE -> COMPLETED;
        case CIRCUIT_BROKEN -> CIRCUIT_BROKEN;
        case FAILED -> FAILED;
        case RUNNING -> throw new IllegalArgumentException("RUNNING is not a terminal state");
        };
    }
}
