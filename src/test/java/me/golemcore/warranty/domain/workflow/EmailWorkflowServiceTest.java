package me.golemcore.warranty.domain.workflow;

import me.golemcore.warranty.domain.model.EmailMessage;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.OrchestrationStatus;
import me.golemcore.warranty.domain.model.WorkflowMode;
import me.golemcore.warranty.domain.step.RunControl;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailWorkflowServiceTest {

    private WorkflowRunner stepMachine;
    private WorkflowRunner functionCalling;
    private AgentProperties properties;
    private EmailWorkflowService service;

    @BeforeEach
    void setUp() {
        stepMachine = mock(WorkflowRunner.class);
        functionCalling = mock(WorkflowRunner.class);
        when(stepMachine.getMode()).thenReturn(WorkflowMode.STEP_MACHINE);
        when(functionCalling.getMode()).thenReturn(WorkflowMode.FUNCTION_CALLING);
        properties = new AgentProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-02-01T10:00:00Z"), ZoneOffset.UTC);
        service = new EmailWorkflowService(List.of(stepMachine, functionCalling), properties, clock);
    }

    @Test
    void shouldDispatchToStepMachineByDefault() {
        OrchestrationResult expected = result();
        when(stepMachine.run(any(), any())).thenReturn(expected);

        OrchestrationResult actual = service.process(email("email-1"));

        assertSame(expected, actual);
        verify(functionCalling, never()).run(any(), any());
    }

    @Test
    void shouldDispatchToConfiguredMode() {
        properties.getOrchestration().setMode(WorkflowMode.FUNCTION_CALLING);
        when(functionCalling.run(any(), any())).thenReturn(result());

        service.process(email("email-1"));

        verify(functionCalling).run(any(), any());
        verify(stepMachine, never()).run(any(), any());
    }

    @Test
    void shouldAssignIdToEmailWithoutOne() {
        when(stepMachine.run(any(), any())).thenReturn(result());

        service.process(email(null));

        ArgumentCaptor<EmailMessage> captor = ArgumentCaptor.forClass(EmailMessage.class);
        verify(stepMachine).run(captor.capture(), any());
        assertNotNull(captor.getValue().getId());
    }

    @Test
    void shouldPassRunControlWithConfiguredTimeout() {
        properties.getOrchestration().setRunTimeout(Duration.ofSeconds(90));
        when(stepMachine.run(any(), any())).thenReturn(result());

        service.process(email("email-1"));

        ArgumentCaptor<RunControl> captor = ArgumentCaptor.forClass(RunControl.class);
        verify(stepMachine).run(any(), captor.capture());
        assertEquals(Duration.ofSeconds(90), captor.getValue().remaining().orElseThrow());
    }

    @Test
    void shouldRejectNullEmail() {
        assertThrows(IllegalArgumentException.class, () -> service.process(null));
    }

    @Test
    void shouldFailWhenModeHasNoRunner() {
        EmailWorkflowService onlyStepMachine = new EmailWorkflowService(List.of(stepMachine), properties,
                Clock.systemUTC());

        assertThrows(IllegalStateException.class,
                () -> onlyStepMachine.process(email("email-1"), WorkflowMode.FUNCTION_CALLING));
    }

    @Test
    void shouldCancelActiveRunAndRejectDuplicates() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        when(stepMachine.run(any(), any())).thenAnswer(invocation -> {
            RunControl control = invocation.getArgument(1);
            running.countDown();
            long waitedMs = 0;
            while (!control.isCancelled() && waitedMs < 5000) {
                Thread.sleep(10);
                waitedMs += 10;
            }
            return result();
        });

        CompletableFuture<OrchestrationResult> inFlight = CompletableFuture
                .supplyAsync(() -> service.process(email("email-1")));
        assertTrue(running.await(5, TimeUnit.SECONDS));

        assertTrue(service.isActive("email-1"));
        assertThrows(IllegalStateException.class, () -> service.process(email("email-1")));
        assertTrue(service.cancel("email-1", "operator stop"));

        inFlight.get(5, TimeUnit.SECONDS);
        assertFalse(service.isActive("email-1"));
        assertFalse(service.cancel("email-1", "again"));
    }

    private EmailMessage email(String id) {
        return EmailMessage.builder()
                .id(id)
                .subject("Warranty claim")
                .body("SN-12345 broken")
                .fromAddress("customer@example.com")
                .build();
    }

    private OrchestrationResult result() {
        return OrchestrationResult.builder()
                .runId("run-1")
                .status(OrchestrationStatus.COMPLETED)
                .trace(List.of())
                .transitions(List.of())
                .build();
    }
}
