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
import me.golemcore.warranty.domain.model.EmailMessage;
import me.golemcore.warranty.domain.model.OrchestrationResult;
import me.golemcore.warranty.domain.model.WorkflowMode;
import me.golemcore.warranty.domain.step.RunControl;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the email-processing layer. Picks the {@link WorkflowRunner}
 * for the configured {@link WorkflowMode} once per email and keeps the
 * {@link RunControl} of in-flight runs so they can be cancelled.
 */
@Service
@Slf4j
public class EmailWorkflowService {

    private final Map<WorkflowMode, WorkflowRunner> runners = new EnumMap<>(WorkflowMode.class);
    private final Map<String, RunControl> activeRuns = new ConcurrentHashMap<>();
    private final AgentProperties properties;
    private final Clock clock;

    public EmailWorkflowService(List<WorkflowRunner> runners, AgentProperties properties, Clock clock) {
        for (WorkflowRunner runner : runners) {
            this.runners.put(runner.getMode(), runner);
        }
        this.properties = properties;
        this.clock = clock;
    }

    public OrchestrationResult process(EmailMessage email) {
        return process(email, properties.getOrchestration().getMode());
    }

    public OrchestrationResult process(EmailMessage email, WorkflowMode mode) {
        if (email == null) {
            throw new IllegalArgumentException("email must not be null");
        }
        WorkflowRunner runner = runners.get(mode);
        if (runner == null) {
            throw new IllegalStateException("No workflow runner registered for mode " + mode);
        }

        EmailMessage identified = email.getId() != null
                ? email
                : email.toBuilder().id(UUID.randomUUID().toString()).build();
        RunControl runControl = RunControl.withTimeout(properties.getOrchestration().getRunTimeout(), clock);
        RunControl previous = activeRuns.putIfAbsent(identified.getId(), runControl);
        if (previous != null) {
            throw new IllegalStateException("Email " + identified.getId() + " is already being processed");
        }

        log.info("[Workflow] Processing email {} in {} mode", identified.getId(), mode);
        try {
            return runner.run(identified, runControl);
        } finally {
            activeRuns.remove(identified.getId(), runControl);
        }
    }

    /**
     * Cancels the in-flight run for {@code emailId}.
     *
     * @return {@code true} if a run was active
     */
    public boolean cancel(String emailId, String reason) {
        RunControl runControl = activeRuns.get(emailId);
        if (runControl == null) {
            return false;
        }
        log.info("[Workflow] Cancelling run for email {}: {}", emailId, reason);
        runControl.cancel(reason);
        return true;
    }

    public boolean isActive(String emailId) {
        return activeRuns.containsKey(emailId);
    }
}
