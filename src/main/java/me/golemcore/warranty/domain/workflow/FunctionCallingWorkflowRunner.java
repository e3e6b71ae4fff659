package me.golemcore.warranty.domain.workflow;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.instruction.InstructionNotFoundException;
import me.golemcore.warranty.domain.instruction.InstructionStore;
import me.golemcore.warranty.domain.model.EmailMessage;
import me.golemcore.warranty.domain.model.InstructionDocument;
import me.golemcore.warranty.domain.model.LlmRequest;
import me.golemcore.warranty.domain.model.LlmResponse;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.OrchestrationStatus;
import me.golemcore.warranty.domain.model.RunState;
import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepExecutionResult;
import me.golemcore.warranty.domain.model.StepFailureKind;
import me.golemcore.warranty.domain.model.WorkflowMode;
import me.golemcore.warranty.domain.step.RunControl;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import me.golemcore.warranty.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Legacy single-pass mode: the main instruction and the email go to the
 * reasoning service in one call, without step routing. The result is reported
 * as a one-entry trace so callers handle both modes the same way.
 */
@Component
@Slf4j
public class FunctionCallingWorkflowRunner implements WorkflowRunner {

    private final InstructionStore instructionStore;
    private final LlmPort llmPort;
    private final AgentProperties properties;
    private final Clock clock;

    public FunctionCallingWorkflowRunner(InstructionStore instructionStore, LlmPort llmPort,
            AgentProperties properties, Clock clock) {
        this.instructionStore = instructionStore;
        this.llmPort = llmPort;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public WorkflowMode getMode() {
        return WorkflowMode.FUNCTION_CALLING;
    }

    @Override
    public OrchestrationResult run(EmailMessage email, RunControl runControl) {
        String runId = UUID.randomUUID().toString();
        String key = properties.getInstructions().getMainInstruction();
        StepContext context = StepContext.fromEmail(email);
        Instant started = clock.instant();

        InstructionDocument instruction;
        try {
            instruction = instructionStore.load(key);
        } catch (InstructionNotFoundException e) {
            return failed(runId, key, context, StepFailureKind.INSTRUCTION_NOT_FOUND, e, started);
        } catch (UncheckedIOException e) {
            return failed(runId, key, context, StepFailureKind.EXECUTION_FAILED, e, started);
        }

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(instruction.getBody())
                .userPrompt("Subject: " + email.getSubject() + "\nFrom: " + email.getFromAddress()
                        + "\n\n" + email.getBody())
                .runId(runId)
                .build();

        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            return failed(runId, key, context, StepFailureKind.EXECUTION_FAILED, e, started);
        }
        runControl.attach(future);
        try {
            Optional<Duration> remaining = runControl.remaining();
            LlmResponse response = remaining.isPresent()
                    ? future.get(remaining.get().toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
            String text = response != null && response.getContent() != null ? response.getContent() : "";
            StepExecutionResult entry = StepExecutionResult.builder()
                    .stepId(key)
                    .responseText(text)
                    .success(true)
                    .elapsed(Duration.between(started, clock.instant()))
                    .build();
            log.info("[Legacy] Run {} completed for email {}", runId, email.getId());
            return OrchestrationResult.builder()
                    .runId(runId)
                    .status(OrchestrationStatus.COMPLETED)
                    .terminalState(RunState.DONE)
                    .terminalStepId(key)
                    .trace(List.of(entry))
                    .finalContext(context)
                    .transitions(List.of())
                    .elapsed(Duration.between(started, clock.instant()))
                    .build();
        } catch (CancellationException | TimeoutException e) {
            future.cancel(true);
            return failed(runId, key, context, StepFailureKind.CANCELLED, e, started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(runId, key, context, StepFailureKind.CANCELLED, e, started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(runId, key, context, StepFailureKind.EXECUTION_FAILED, cause, started);
        } finally {
            runControl.detach(future);
        }
    }

    private OrchestrationResult failed(String runId, String key, StepContext context, StepFailureKind kind,
            Throwable cause, Instant started) {
        log.warn("[Legacy] Run {} failed ({}): {}", runId, kind, cause.getMessage());
        return OrchestrationResult.builder()
                .runId(runId)
                .status(OrchestrationStatus.FAILED)
                .terminalState(RunState.FAILED)
                .terminalStepId(key)
                .trace(List.of())
                .finalContext(context)
                .transitions(List.of())
                .failureKind(kind)
                .failureMessage(cause.getMessage())
                .failureCause(cause)
                .elapsed(Duration.between(started, clock.instant()))
                .build();
    }
}
