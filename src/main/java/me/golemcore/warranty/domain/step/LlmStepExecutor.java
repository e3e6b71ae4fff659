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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.instruction.InstructionNotFoundException;
import me.golemcore.warranty.domain.instruction.InstructionStore;
import me.golemcore.warranty.domain.model.InstructionDocument;
import me.golemcore.warranty.domain.model.LlmRequest;
import me.golemcore.warranty.domain.model.LlmResponse;
import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepDecision;
import me.golemcore.warranty.domain.model.StepExecutionResult;
import me.golemcore.warranty.domain.model.StepFailureKind;
import me.golemcore.warranty.port.outbound.LlmPort;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Step executor that renders the step instruction with the current context,
 * calls the {@link LlmPort} and parses the reply with a
 * {@link StepDecisionParser}.
 */
@Slf4j
public class LlmStepExecutor implements StepExecutor {

    private final InstructionStore instructionStore;
    private final LlmPort llmPort;
    private final StepPromptRenderer renderer;
    private final StepDecisionParser parser;
    private final String mainInstructionKey;
    private final Clock clock;

    public LlmStepExecutor(InstructionStore instructionStore, LlmPort llmPort, StepPromptRenderer renderer,
            StepDecisionParser parser, String mainInstructionKey, Clock clock) {
        this.instructionStore = instructionStore;
        this.llmPort = llmPort;
        this.renderer = renderer;
        this.parser = parser;
        this.mainInstructionKey = mainInstructionKey;
        this.clock = clock;
    }

    @Override
    public StepExecutionResult execute(String stepId, StepContext context, RunControl runControl) {
        Instant started = clock.instant();

        InstructionDocument mainInstruction = loadInstruction(stepId, mainInstructionKey);
        InstructionDocument stepInstruction = loadInstruction(stepId, stepId);

        LlmRequest request = renderer.render(mainInstruction, stepInstruction, context);
        LlmResponse response = await(stepId, request, runControl);

        String text = response.getContent() != null ? response.getContent() : "";
        StepDecision decision = parser.parse(text);
        Duration elapsed = Duration.between(started, clock.instant());

        if (!decision.hasNextStep()) {
            log.warn("[Step] {} produced no NEXT_STEP marker ({} chars of output)", stepId, text.length());
            return StepExecutionResult.parseFailed(stepId, text, decision, elapsed);
        }

        log.debug("[Step] {} -> {} in {}ms", stepId, decision.getNextStep(), elapsed.toMillis());
        return StepExecutionResult.parsed(stepId, text, decision, elapsed);
    }

    private InstructionDocument loadInstruction(String stepId, String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        try {
            return instructionStore.load(key);
        } catch (InstructionNotFoundException e) {
            throw new StepExecutionException(stepId, StepFailureKind.INSTRUCTION_NOT_FOUND, e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new StepExecutionException(stepId, StepFailureKind.EXECUTION_FAILED, e.getMessage(), e);
        }
    }

    private LlmResponse await(String stepId, LlmRequest request, RunControl runControl) {
        if (runControl.isCancelled()) {
            throw cancelled(stepId, runControl, null);
        }

        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            throw new StepExecutionException(stepId, StepFailureKind.EXECUTION_FAILED,
                    "Reasoning service call failed: " + e.getMessage(), e);
        }

        runControl.attach(future);
        try {
            Optional<Duration> remaining = runControl.remaining();
            LlmResponse response = remaining.isPresent()
                    ? future.get(remaining.get().toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
            if (response == null) {
                throw new StepExecutionException(stepId, StepFailureKind.EXECUTION_FAILED,
                        "Reasoning service returned no response");
            }
            return response;
        } catch (CancellationException e) {
            throw cancelled(stepId, runControl, e);
        } catch (TimeoutException e) {
            runControl.cancel("run deadline exceeded");
            throw cancelled(stepId, runControl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw cancelled(stepId, runControl, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepExecutionException(stepId, StepFailureKind.EXECUTION_FAILED,
                    "Reasoning service call failed: " + cause.getMessage(), cause);
        } finally {
            runControl.detach(future);
        }
    }

    private StepExecutionException cancelled(String stepId, RunControl runControl, Throwable cause) {
        String reason = runControl.getCancelReason() != null ? runControl.getCancelReason() : "interrupted";
        return new StepExecutionException(stepId, StepFailureKind.CANCELLED,
                "Step " + stepId + " cancelled: " + reason, cause);
    }
}
