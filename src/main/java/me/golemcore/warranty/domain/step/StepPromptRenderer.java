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

import me.golemcore.warranty.domain.model.InstructionDocument;
import me.golemcore.warranty.domain.model.LlmRequest;
import me.golemcore.warranty.domain.model.StepContext;

import java.util.Map;

/**
 * Renders the reasoning request for one step.
 *
 * <p>
 * The system prompt carries the optional main instruction, the step
 * instruction and the expected output markers. The user prompt exposes the
 * original email and every context field a previous step has set.
 */
public class StepPromptRenderer {

    private static final String OUTPUT_FORMAT = """
            ## Output format
            End your answer with one marker per line:
            NEXT_STEP: <step id, or %s when the workflow is finished>
            SERIAL: <serial number, only if found>
            WARRANTY_STATUS: <warranty status, only if known>
            TICKET_ID: <ticket id, only if created>
            ISSUE: <short issue description, only if identified>
            REASON: <one sentence explaining the decision>""";

    private final String terminalStep;

    public StepPromptRenderer(String terminalStep) {
        this.terminalStep = terminalStep;
    }

    public LlmRequest render(InstructionDocument mainInstruction, InstructionDocument stepInstruction,
            StepContext context) {
        return LlmRequest.builder()
                .systemPrompt(buildSystemPrompt(mainInstruction, stepInstruction))
                .userPrompt(buildUserPrompt(context))
                .build();
    }

    String buildSystemPrompt(InstructionDocument mainInstruction, InstructionDocument stepInstruction) {
        StringBuilder sb = new StringBuilder();
        if (mainInstruction != null) {
            sb.append(mainInstruction.getBody()).append("\n\n");
        }
        sb.append("## Current step: ").append(stepInstruction.getKey()).append('\n');
        sb.append(stepInstruction.getBody()).append("\n\n");
        sb.append(OUTPUT_FORMAT.formatted(terminalStep));
        return sb.toString();
    }

    String buildUserPrompt(StepContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Customer Email:\n");
        appendLine(sb, "Subject", context.getEmailSubject());
        appendLine(sb, "From", context.getFromAddress());
        appendLine(sb, "Body", context.getEmailBody());
        sb.append('\n');

        appendLine(sb, "Serial Number", context.getSerialNumber());
        appendLine(sb, "Warranty Status", context.getWarrantyStatus());
        appendLine(sb, "Ticket ID", context.getTicketId());
        appendLine(sb, "Issue", context.getIssueDescription());
        for (Map.Entry<String, String> entry : context.getAttributes().entrySet()) {
            appendLine(sb, entry.getKey(), entry.getValue());
        }
        return sb.toString().trim();
    }

    private void appendLine(StringBuilder sb, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        sb.append(label).append(": ").append(value).append('\n');
    }
}
