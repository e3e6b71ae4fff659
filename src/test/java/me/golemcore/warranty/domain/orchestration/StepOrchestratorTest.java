package me.golemcore.warranty.domain.orchestration;

import me.golemcore.warranty.domain.instruction.InstructionCache;
import me.golemcore.warranty.domain.instruction.InstructionStore;
import me.golemcore.warranty.domain.model.LlmResponse;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.OrchestrationStatus;
import me.golemcore.warranty.domain.model.ParseFailurePolicy;
import me.golemcore.warranty.domain.model.RunState;
import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepDecision;
import me.golemcore.warranty.domain.model.StepExecutionResult;
import me.golemcore.warranty.domain.model.StepFailureKind;
import me.golemcore.warranty.domain.model.StepTransition;
import me.golemcore.warranty.domain.step.LlmStepExecutor;
import me.golemcore.warranty.domain.step.MarkerStepDecisionParser;
import me.golemcore.warranty.domain.step.RunControl;
import me.golemcore.warranty.domain.step.StepExecutionException;
import me.golemcore.warranty.domain.step.StepExecutor;
import me.golemcore.warranty.domain.step.StepPromptRenderer;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import me.golemcore.warranty.port.outbound.InstructionSourcePort;
import me.golemcore.warranty.port.outbound.LlmPort;
import me.golemcore.warranty.port.outbound.TransitionLogPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StepOrchestratorTest {

    private static final String ENTRY = "01-extract-serial";
    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    @Mock
    private TransitionLogPort transitionLog;

    @Mock
    private InstructionSourcePort instructionSource;

    @Mock
    private LlmPort llmPort;

    private AgentProperties.OrchestrationProperties settings;
    private Clock clock;
    private StepContext initialContext;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        settings = new AgentProperties.OrchestrationProperties();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        initialContext = StepContext.builder()
                .emailId("email-1")
                .emailSubject("Warranty claim")
                .emailBody("My device SN-12345 stopped working")
                .fromAddress("customer@example.com")
                .build();
        when(instructionSource.read(anyString()))
                .thenAnswer(invocation -> Optional.of("Instructions for " + invocation.getArgument(0)));
    }

    // ==================== Termination ====================

    @Test
    void shouldCompleteAfterOneStepWhenServiceReturnsSentinel() {
        StepExecutor executor = (stepId, context, control) -> parsed(stepId, "DONE");

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.COMPLETED, result.getStatus());
        assertEquals(RunState.DONE, result.getTerminalState());
        assertEquals(1, result.getTotalSteps());
        assertEquals(ENTRY, result.getTerminalStepId());
        assertNull(result.getFailureKind());
        assertTrue(result.isCompleted());
    }

    @Test
    void shouldCircuitBreakWhenStepsAlternate() {
        StepExecutor executor = (stepId, context, control) -> parsed(stepId,
                "A".equals(stepId) ? "B" : "A");

        OrchestrationResult result = orchestrator(executor).orchestrate("A", initialContext, 10);

        assertEquals(OrchestrationStatus.CIRCUIT_BROKEN, result.getStatus());
        assertEquals(10, result.getTotalSteps());
        assertEquals(List.of("A", "B", "A", "B", "A", "B", "A", "B", "A", "B"), result.stepSequence());
        assertEquals("B", result.getTerminalStepId());
        assertTrue(result.getFailureMessage().contains("exceeded max steps (10)"));
        assertNull(result.getFailureKind());
    }

    @Test
    void shouldRespectSmallCeiling() {
        StepExecutor executor = (stepId, context, control) -> parsed(stepId, "loop");

        OrchestrationResult result = orchestrator(executor).orchestrate("loop", initialContext, 1);

        assertEquals(OrchestrationStatus.CIRCUIT_BROKEN, result.getStatus());
        assertEquals(1, result.getTotalSteps());
    }

    @Test
    void shouldUseConfiguredEntryStepAndCeiling() {
        settings.setMaxSteps(3);
        List<String> executed = new ArrayList<>();
        StepExecutor executor = (stepId, context, control) -> {
            executed.add(stepId);
            return parsed(stepId, "again");
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(initialContext);

        assertEquals(OrchestrationStatus.CIRCUIT_BROKEN, result.getStatus());
        assertEquals(ENTRY, executed.get(0));
        assertEquals(3, result.getTotalSteps());
    }

    @Test
    void shouldRejectInvalidArgumentsBeforeExecuting() {
        AtomicInteger calls = new AtomicInteger();
        StepOrchestrator orchestrator = orchestrator((stepId, context, control) -> {
            calls.incrementAndGet();
            return parsed(stepId, "DONE");
        });

        assertThrows(IllegalArgumentException.class, () -> orchestrator.orchestrate(" ", initialContext, 10));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.orchestrate(ENTRY, null, 10));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.orchestrate(ENTRY, initialContext, 0));
        assertEquals(0, calls.get());
    }

    // ==================== Context ====================

    @Test
    void shouldNeverMutateContextHandedToStep() {
        List<StepContext> received = new ArrayList<>();
        StepExecutor executor = (stepId, context, control) -> {
            received.add(context);
            if (ENTRY.equals(stepId)) {
                return parsed(stepId, decision("02-check-warranty").serialNumber("SN-12345").build());
            }
            return parsed(stepId, decision("DONE").warrantyStatus("valid").build());
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(2, received.size());
        assertSame(initialContext, received.get(0));
        assertNotSame(received.get(0), received.get(1));
        assertNull(received.get(0).getSerialNumber());
        assertEquals("SN-12345", received.get(1).getSerialNumber());
        assertNull(received.get(1).getWarrantyStatus());
        assertNotSame(received.get(1), result.getFinalContext());
        assertEquals("valid", result.getFinalContext().getWarrantyStatus());
    }

    @Test
    void shouldKeepPriorValuesWhenMarkersAbsent() {
        StepExecutor executor = (stepId, context, control) -> {
            if (ENTRY.equals(stepId)) {
                return parsed(stepId, decision("02-check-warranty").serialNumber("SN-12345").build());
            }
            return parsed(stepId, "DONE");
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals("SN-12345", result.getFinalContext().getSerialNumber());
        assertEquals("email-1", result.getFinalContext().getEmailId());
    }

    @Test
    void shouldStoreReasonAsAttribute() {
        StepOrchestrator orchestrator = orchestrator((stepId, context, control) -> parsed(stepId, "DONE"));

        StepContext next = orchestrator.applyDecision(initialContext,
                decision("DONE").reason("valid warranty").ticketId("TCK-9").issueDescription("dead").build());

        assertEquals("valid warranty", next.getAttribute(StepOrchestrator.REASON_ATTRIBUTE));
        assertEquals("TCK-9", next.getTicketId());
        assertEquals("dead", next.getIssueDescription());
        assertTrue(initialContext.getAttributes().isEmpty());
    }

    // ==================== End to end ====================

    @Test
    void shouldRunExtractThenCheckWarrantyToCompletion() {
        when(llmPort.chat(any()))
                .thenReturn(reply("Serial found.\nNEXT_STEP: 02-check-warranty\nSERIAL: SN-12345"))
                .thenReturn(reply("Covered.\nNEXT_STEP: DONE\nREASON: valid warranty"));

        OrchestrationResult result = orchestrator(llmExecutor()).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("01-extract-serial", "02-check-warranty"), result.stepSequence());
        assertEquals("SN-12345", result.getFinalContext().getSerialNumber());
        assertEquals("valid warranty", result.getFinalContext().getAttribute("reason"));
        assertEquals("02-check-warranty", result.getTerminalStepId());
    }

    @Test
    void shouldFailWithCancellationWhileSecondStepOutstanding() throws Exception {
        CompletableFuture<LlmResponse> neverCompletes = new CompletableFuture<>();
        CountDownLatch secondCallStarted = new CountDownLatch(1);
        when(llmPort.chat(any()))
                .thenReturn(reply("NEXT_STEP: 02-check-warranty\nSERIAL: SN-12345"))
                .thenAnswer(invocation -> {
                    secondCallStarted.countDown();
                    return neverCompletes;
                });
        RunControl control = RunControl.unbounded();

        Thread canceller = new Thread(() -> {
            try {
                if (secondCallStarted.await(5, TimeUnit.SECONDS)) {
                    control.cancel("shutdown requested");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        OrchestrationResult result = orchestrator(llmExecutor()).orchestrate(ENTRY, initialContext, 10, control);
        canceller.join(5000);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.CANCELLED, result.getFailureKind());
        assertEquals(List.of(ENTRY), result.stepSequence());
        assertEquals("SN-12345", result.getFinalContext().getSerialNumber());
        assertTrue(neverCompletes.isCancelled());
    }

    @Test
    void shouldNotStartStepAfterCancellation() {
        RunControl control = RunControl.unbounded();
        StepExecutor executor = (stepId, context, runControl) -> {
            runControl.cancel("stop after first");
            return parsed(stepId, "02-check-warranty");
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10, control);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.CANCELLED, result.getFailureKind());
        assertEquals(1, result.getTotalSteps());
        assertTrue(result.getFailureMessage().contains("stop after first"));
    }

    // ==================== Failures ====================

    @Test
    void shouldFailWithPartialTraceWhenStepThrows() {
        StepExecutor executor = (stepId, context, control) -> {
            if (ENTRY.equals(stepId)) {
                return parsed(stepId, "99-missing");
            }
            throw new StepExecutionException(stepId, StepFailureKind.INSTRUCTION_NOT_FOUND, "no document");
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.INSTRUCTION_NOT_FOUND, result.getFailureKind());
        assertEquals(List.of(ENTRY), result.stepSequence());
        assertTrue(result.getFailureCause() instanceof StepExecutionException);
    }

    @Test
    void shouldContainUnexpectedExecutorErrors() {
        StepExecutor executor = (stepId, context, control) -> {
            throw new IllegalStateException("boom");
        };

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals(0, result.getTotalSteps());
        assertEquals(ENTRY, result.getTerminalStepId());
    }

    @Test
    void shouldFailOnParseFailureByDefault() {
        StepExecutor executor = (stepId, context, control) -> parseFailed(stepId);

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.PARSE_FAILED, result.getFailureKind());
        assertEquals(1, result.getTotalSteps());
        assertTrue(result.getTrace().get(0).isParseFailed());
    }

    @Test
    void shouldRetrySameStepOnceWhenPolicyAllows() {
        settings.setParseFailurePolicy(ParseFailurePolicy.RETRY_SAME_STEP);
        AtomicInteger calls = new AtomicInteger();
        StepExecutor executor = (stepId, context, control) -> calls.incrementAndGet() == 1
                ? parseFailed(stepId)
                : parsed(stepId, "DONE");

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.COMPLETED, result.getStatus());
        assertEquals(List.of(ENTRY, ENTRY), result.stepSequence());
    }

    @Test
    void shouldFailAfterSingleRetryWhenStillUnparsed() {
        settings.setParseFailurePolicy(ParseFailurePolicy.RETRY_SAME_STEP);
        StepExecutor executor = (stepId, context, control) -> parseFailed(stepId);

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.FAILED, result.getStatus());
        assertEquals(StepFailureKind.PARSE_FAILED, result.getFailureKind());
        assertEquals(2, result.getTotalSteps());
    }

    @Test
    void shouldCountRetryAgainstCeiling() {
        settings.setParseFailurePolicy(ParseFailurePolicy.RETRY_SAME_STEP);
        StepExecutor executor = (stepId, context, control) -> parseFailed(stepId);

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 1);

        assertEquals(OrchestrationStatus.CIRCUIT_BROKEN, result.getStatus());
        assertEquals(1, result.getTotalSteps());
    }

    // ==================== Transitions ====================

    @Test
    void shouldRecordOneTransitionPerStep() {
        StepExecutor executor = (stepId, context, control) -> parsed(stepId,
                ENTRY.equals(stepId) ? "02-check-warranty" : "DONE");

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        ArgumentCaptor<StepTransition> captor = ArgumentCaptor.forClass(StepTransition.class);
        verify(transitionLog, times(2)).record(captor.capture());
        List<StepTransition> recorded = captor.getAllValues();
        assertEquals(result.getTransitions(), recorded);

        StepTransition first = recorded.get(0);
        assertEquals(result.getRunId(), first.getRunId());
        assertEquals(1, first.getStepNumber());
        assertEquals(ENTRY, first.getStepId());
        assertEquals(RunState.RUNNING, first.getFromState());
        assertEquals(RunState.RUNNING, first.getToState());
        assertEquals("02-check-warranty", first.getNextStepId());
        assertEquals(0, first.getElapsedMs());

        StepTransition last = recorded.get(1);
        assertEquals(2, last.getStepNumber());
        assertEquals(RunState.DONE, last.getToState());
    }

    @Test
    void shouldIgnoreTransitionSinkFailures() {
        doThrow(new IllegalStateException("sink down")).when(transitionLog).record(any());
        StepExecutor executor = (stepId, context, control) -> parsed(stepId, "DONE");

        OrchestrationResult result = orchestrator(executor).orchestrate(ENTRY, initialContext, 10);

        assertEquals(OrchestrationStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getTransitions().size());
    }

    @Test
    void shouldReturnImmutableTrace() {
        StepOrchestrator orchestrator = orchestrator((stepId, context, control) -> parsed(stepId, "DONE"));

        OrchestrationResult result = orchestrator.orchestrate(ENTRY, initialContext, 10);

        assertThrows(UnsupportedOperationException.class, () -> result.getTrace().add(parsed("x", "DONE")));
        assertFalse(result.getRunId().isBlank());
        assertEquals(Duration.ZERO, result.getElapsed());
    }

    // ==================== Helpers ====================

    private StepOrchestrator orchestrator(StepExecutor executor) {
        return new StepOrchestrator(executor, transitionLog, settings, clock);
    }

    private LlmStepExecutor llmExecutor() {
        InstructionStore store = new InstructionStore(instructionSource, new InstructionCache());
        return new LlmStepExecutor(store, llmPort, new StepPromptRenderer("DONE"),
                new MarkerStepDecisionParser("DONE"), "main", clock);
    }

    private static StepDecision.StepDecisionBuilder decision(String nextStep) {
        return StepDecision.builder().nextStep(nextStep);
    }

    private static StepExecutionResult parsed(String stepId, String nextStep) {
        return parsed(stepId, decision(nextStep).build());
    }

    private static StepExecutionResult parsed(String stepId, StepDecision decision) {
        return StepExecutionResult.parsed(stepId, "NEXT_STEP: " + decision.getNextStep(), decision, Duration.ZERO);
    }

    private static StepExecutionResult parseFailed(String stepId) {
        return StepExecutionResult.parseFailed(stepId, "no markers here", StepDecision.unparsed(), Duration.ZERO);
    }

    private static CompletableFuture<LlmResponse> reply(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
