package me.golemcore.warranty.domain.orchestration;

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

import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.OrchestrationStatus;
import me.golemcore.warranty.domain.model.ParseFailurePolicy;
import me.golemcore.warranty.domain.model.RunState;
import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepDecision;
import me.golemcore.warranty.domain.model.StepExecutionResult;
import me.golemcore.warranty.domain.model.StepFailureKind;
import me.golemcore.warranty.domain.model.StepTransition;
import me.golemcore.warranty.domain.step.RunControl;
import me.golemcore.warranty.domain.step.StepExecutionException;
import me.golemcore.warranty.domain.step.StepExecutor;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import me.golemcore.warranty.port.outbound.TransitionLogPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Step state machine (one orchestration run per call).
 *
 * <p>
 * Contract: starting from the entry step, execute the current step, apply its
 * routing decision to a fresh context and continue until the step returns the
 * terminal sentinel ({@code DONE}), a step fails, or the step ceiling is
 * exceeded ({@code CIRCUIT_BROKEN}). No exception escapes
 * {@link #orchestrate}: every run ends with a well-formed
 * {@link OrchestrationResult} that keeps the partial trace.
 */
public class StepOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StepOrchestrator.class);

    static final String MDC_RUN_ID = "runId";
    static final String MDC_EMAIL_ID = "emailId";
    static final String REASON_ATTRIBUTE = "reason";

    private final StepExecutor stepExecutor;
    private final TransitionLogPort transitionLog;
    private final AgentProperties.OrchestrationProperties settings;
    private final Clock clock;

    public StepOrchestrator(StepExecutor stepExecutor, TransitionLogPort transitionLog,
            AgentProperties.OrchestrationProperties settings) {
        this(stepExecutor, transitionLog, settings, Clock.systemUTC());
    }

    // Visible for testing
    public StepOrchestrator(StepExecutor stepExecutor, TransitionLogPort transitionLog,
            AgentProperties.OrchestrationProperties settings, Clock clock) {
        this.stepExecutor = stepExecutor;
        this.transitionLog = transitionLog;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs the workflow from the configured entry step with the configured
     * ceiling and run timeout.
     */
    public OrchestrationResult orchestrate(StepContext initialContext) {
        return orchestrate(settings.getEntryStep(), initialContext, settings.getMaxSteps());
    }

    public OrchestrationResult orchestrate(String entryStepId, StepContext initialContext, int ceiling) {
        return orchestrate(entryStepId, initialContext, ceiling, newRunControl());
    }

    /**
     * Runs the workflow.
     *
     * @param entryStepId
     *            first step to execute
     * @param initialContext
     *            context handed to the first step
     * @param ceiling
     *            maximum number of steps; the run is circuit-broken when another
     *            step would exceed it
     * @param runControl
     *            cancellation signal and deadline for the whole run
     * @throws IllegalArgumentException
     *             if the arguments are invalid; nothing is executed in that case
     */
    public OrchestrationResult orchestrate(String entryStepId, StepContext initialContext, int ceiling,
            RunControl runControl) {
        if (entryStepId == null || entryStepId.isBlank()) {
            throw new IllegalArgumentException("entryStepId must not be blank");
        }
        if (initialContext == null) {
            throw new IllegalArgumentException("initialContext must not be null");
        }
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be at least 1, got " + ceiling);
        }
        if (runControl == null) {
            throw new IllegalArgumentException("runControl must not be null");
        }

        Run run = new Run(UUID.randomUUID().toString(), entryStepId, initialContext, clock.instant());
        MDC.put(MDC_RUN_ID, run.runId);
        if (initialContext.getEmailId() != null) {
            MDC.put(MDC_EMAIL_ID, initialContext.getEmailId());
        }
        try {
            log.info("[Orchestrator] Starting run {} at {} (ceiling {})", run.runId, entryStepId, ceiling);
            OrchestrationResult result = loop(run, ceiling, runControl);
            log.info("[Orchestrator] Run {} finished: {} after {} steps {}", run.runId, result.getStatus(),
                    result.getTotalSteps(), result.stepSequence());
            return result;
        } finally {
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_EMAIL_ID);
        }
    }

    private OrchestrationResult loop(Run run, int ceiling, RunControl runControl) {
        String currentStep = run.entryStepId;
        boolean parseRetryUsed = false;
        int stepCount = 0;

        while (true) {
            stepCount++;

            if (stepCount > ceiling) {
                String message = "Circuit breaker: exceeded max steps (" + ceiling + "), next step '"
                        + currentStep + "' not executed";
                transition(run, stepCount, currentStep, RunState.CIRCUIT_BROKEN, null, message);
                return finish(run, RunState.CIRCUIT_BROKEN, null, message, null);
            }

            if (runControl.isCancelled() || runControl.isExpired()) {
                String reason = runControl.isCancelled() ? runControl.getCancelReason() : "run deadline exceeded";
                String message = "Run cancelled before step " + currentStep + ": " + reason;
                transition(run, stepCount, currentStep, RunState.FAILED, null, message);
                return finish(run, RunState.FAILED, StepFailureKind.CANCELLED, message, null);
            }

            StepExecutionResult result;
            try {
                result = stepExecutor.execute(currentStep, run.context, runControl);
            } catch (StepExecutionException e) {
                transition(run, stepCount, currentStep, RunState.FAILED, null, e.getMessage());
                return finish(run, RunState.FAILED, e.getKind(), e.getMessage(), e);
            } catch (RuntimeException e) {
                String message = "Unexpected failure in step " + currentStep + ": " + e.getMessage();
                log.error("[Orchestrator] {}", message, e);
                transition(run, stepCount, currentStep, RunState.FAILED, null, message);
                return finish(run, RunState.FAILED, StepFailureKind.EXECUTION_FAILED, message, e);
            }

            run.trace.add(result);
            run.lastExecutedStep = currentStep;

            if (!result.isSuccess()) {
                if (settings.getParseFailurePolicy() == ParseFailurePolicy.RETRY_SAME_STEP && !parseRetryUsed) {
                    parseRetryUsed = true;
                    transition(run, stepCount, currentStep, RunState.RUNNING, currentStep,
                            "no routing decision, retrying step once");
                    continue;
                }
                String message = "Step " + currentStep + " produced no routing decision";
                transition(run, stepCount, currentStep, RunState.FAILED, null, message);
                return finish(run, RunState.FAILED, StepFailureKind.PARSE_FAILED, message, null);
            }
            parseRetryUsed = false;

            run.context = applyDecision(run.context, result.getDecision());

            String nextStep = result.getNextStep();
            if (settings.getTerminalStep().equals(nextStep)) {
                transition(run, stepCount, currentStep, RunState.DONE, nextStep, result.getDecision().getReason());
                return finish(run, RunState.DONE, null, null, null);
            }

            transition(run, stepCount, currentStep, RunState.RUNNING, nextStep, result.getDecision().getReason());
            currentStep = nextStep;
        }
    }

    /**
     * Derives the next context. Only fields the step actually reported are
     * replaced; everything else carries over from the previous context.
     */
    StepContext applyDecision(StepContext context, StepDecision decision) {
        StepContext.StepContextBuilder next = context.toBuilder();
        if (decision.getSerialNumber() != null) {
            next.serialNumber(decision.getSerialNumber());
        }
        if (decision.getWarrantyStatus() != null) {
            next.warrantyStatus(decision.getWarrantyStatus());
        }
        if (decision.getTicketId() != null) {
            next.ticketId(decision.getTicketId());
        }
        if (decision.getIssueDescription() != null) {
            next.issueDescription(decision.getIssueDescription());
        }
        if (decision.getReason() != null) {
            next.attribute(REASON_ATTRIBUTE, decision.getReason());
        }
        return next.build();
    }

    private void transition(Run run, int stepNumber, String stepId, RunState toState, String nextStepId,
            String detail) {
        StepTransition transition = StepTransition.builder()
                .runId(run.runId)
                .stepNumber(stepNumber)
                .stepId(stepId)
                .fromState(RunState.RUNNING)
                .toState(toState)
                .nextStepId(nextStepId)
                .elapsedMs(Duration.between(run.startedAt, clock.instant()).toMillis())
                .detail(detail)
                .build();
        run.transitions.add(transition);
        try {
            transitionLog.record(transition);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Transition log rejected entry for {}: {}", stepId, e.getMessage());
        }
    }

    private OrchestrationResult finish(Run run, RunState terminalState, StepFailureKind failureKind,
            String failureMessage, Throwable cause) {
        if (terminalState != RunState.DONE) {
            log.warn("[Orchestrator] Run {} ended {}: {}", run.runId, terminalState, failureMessage);
        }
        return OrchestrationResult.builder()
                .runId(run.runId)
                .status(OrchestrationStatus.fromTerminalState(terminalState))
                .terminalState(terminalState)
                .terminalStepId(run.lastExecutedStep != null ? run.lastExecutedStep : run.entryStepId)
                .trace(List.copyOf(run.trace))
                .finalContext(run.context)
                .transitions(List.copyOf(run.transitions))
                .failureKind(failureKind)
                .failureMessage(failureMessage)
                .failureCause(cause)
                .elapsed(Duration.between(run.startedAt, clock.instant()))
                .build();
    }

    private RunControl newRunControl() {
        return RunControl.withTimeout(settings.getRunTimeout(), clock);
    }

    private static final class Run {
        private final String runId;
        private final String entryStepId;
        private final Instant startedAt;
        private final List<StepExecutionResult> trace = new ArrayList<>();
        private final List<StepTransition> transitions = new ArrayList<>();
        private StepContext context;
        private String lastExecutedStep;

        private Run(String runId, String entryStepId, StepContext context, Instant startedAt) {
            this.runId = runId;
            this.entryStepId = entryStepId;
            this.context = context;
            this.startedAt = startedAt;
        }
    }
}
