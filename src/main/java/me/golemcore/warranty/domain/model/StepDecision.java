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
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Routing decision parsed from a step response. {@link #nextStep} is
 * {@code null} when the response carried no actionable NEXT_STEP marker.
 */
@Value
@Builder
public class StepDecision {

    String nextStep;
    String serialNumber;
    String reason;
    String warrantyStatus;
    String ticketId;
    String issueDescription;

    /** Every recognized marker with its raw value, keyed by marker name. */
    @Singular
    Map<String, String> markers;

    public boolean hasNextStep() {
        return nextStep != null;
    }

    public static StepDecision unparsed() {
        return StepDecision.builder().build();
    }
}
