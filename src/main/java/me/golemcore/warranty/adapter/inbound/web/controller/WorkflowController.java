package me.golemcore.warranty.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.eval.StepSequenceValidator;
import me.golemcore.warranty.domain.model.EmailMessage;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.StepContext;
import me.golemcore.warranty.domain.model.StepValidationResult;
import me.golemcore.warranty.domain.model.WorkflowMode;
import me.golemcore.warranty.domain.workflow.EmailWorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the warranty workflow for a single email and checks step sequences.
 */
@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final EmailWorkflowService workflowService;
    private final StepSequenceValidator stepSequenceValidator;

    @PostMapping("/run")
    public Mono<ResponseEntity<RunResponse>> run(@RequestBody(required = false) RunRequest request) {
        if (request == null || request.body() == null || request.body().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "body is required");
        }
        WorkflowMode mode = parseMode(request.mode());
        EmailMessage email = EmailMessage.builder()
                .id(blankToNull(request.emailId()))
                .subject(request.subject())
                .body(request.body())
                .fromAddress(request.from())
                .threadId(request.threadId())
                .messageId(request.messageId())
                .receivedAt(Instant.now())
                .build();

        // Runs block on the reasoning service
        return Mono.fromCallable(() -> {
            try {
                OrchestrationResult result = mode != null
                        ? workflowService.process(email, mode)
                        : workflowService.process(email);
                return ResponseEntity.ok(toResponse(result));
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{emailId}/cancel")
    public Mono<ResponseEntity<CancelResponse>> cancel(@PathVariable String emailId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null && request.reason() != null && !request.reason().isBlank()
                ? request.reason()
                : "cancelled via API";
        boolean cancelled = workflowService.cancel(emailId, reason);
        if (!cancelled) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active run for email " + emailId);
        }
        return Mono.just(ResponseEntity.ok(new CancelResponse(emailId, true)));
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidateResponse>> validate(@RequestBody(required = false) ValidateRequest request) {
        if (request == null || request.actual() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "actual is required");
        }
        StepValidationResult result = stepSequenceValidator.validate(request.expected(), request.actual());
        log.debug("[Eval] Step validation passed={}", result.passed());
        return Mono.just(ResponseEntity.ok(new ValidateResponse(
                result.passed(),
                result.failures(),
                result.stepDiff(),
                stepSequenceValidator.formatFailure(result))));
    }

    private static WorkflowMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return null;
        }
        try {
            return WorkflowMode.valueOf(mode.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown mode: " + mode, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static RunResponse toResponse(OrchestrationResult result) {
        StepContext context = result.getFinalContext();
        return new RunResponse(
                result.getRunId(),
                result.getStatus().name(),
                result.getTerminalStepId(),
                result.stepSequence(),
                context != null ? context.getEmailId() : null,
                context != null ? context.getSerialNumber() : null,
                context != null ? context.getWarrantyStatus() : null,
                context != null ? context.getTicketId() : null,
                context != null ? context.getAttributes() : Map.of(),
                result.getFailureKind() != null ? result.getFailureKind().name() : null,
                result.getFailureMessage(),
                result.getElapsed() != null ? result.getElapsed().toMillis() : 0);
    }

    public record RunRequest(
            String emailId,
            String subject,
            String body,
            String from,
            String threadId,
            String messageId,
            String mode) {
    }

    public record RunResponse(
            String runId,
            String status,
            String terminalStep,
            List<String> steps,
            String emailId,
            String serialNumber,
            String warrantyStatus,
            String ticketId,
            Map<String, String> attributes,
            String failureKind,
            String failureMessage,
            long elapsedMs) {
    }

    public record CancelRequest(String reason) {
    }

    public record CancelResponse(String emailId, boolean cancelled) {
    }

    public record ValidateRequest(List<String> expected, List<String> actual) {
    }

    public record ValidateResponse(
            boolean passed,
            List<String> failures,
            String diff,
            String report) {
    }
}
