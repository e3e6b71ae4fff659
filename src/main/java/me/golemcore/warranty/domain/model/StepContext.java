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
 * Workflow state threaded through one orchestration run.
 *
 * <p>
 * Instances are immutable. After each step the orchestrator derives a new
 * instance with {@link #toBuilder()}, so the context a step received is never
 * changed by later steps. Optional fields stay {@code null} until a step
 * provides them.
 */
@Value
@Builder(toBuilder = true)
public class StepContext {

    String emailId;
    String emailSubject;
    String emailBody;
    String fromAddress;
    String threadId;
    String messageId;

    String serialNumber;
    String issueDescription;
    String warrantyStatus;
    String ticketId;

    /** Step-specific fields that have no dedicated slot. */
    @Singular
    Map<String, String> attributes;

    public static StepContext fromEmail(EmailMessage email) {
        return StepContext.builder()
                .emailId(email.getId())
                .emailSubject(email.getSubject())
                .emailBody(email.getBody())
                .fromAddress(email.getFromAddress())
                .threadId(email.getThreadId())
                .messageId(email.getMessageId())
                .build();
    }

    public boolean hasSerialNumber() {
        return serialNumber != null && !serialNumber.isBlank();
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }
}
