package me.golemcore.warranty.infrastructure.config;

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

import me.golemcore.warranty.domain.instruction.InstructionCache;
import me.golemcore.warranty.domain.instruction.InstructionStore;
import me.golemcore.warranty.domain.orchestration.StepOrchestrator;
import me.golemcore.warranty.domain.step.LlmStepExecutor;
import me.golemcore.warranty.domain.step.MarkerStepDecisionParser;
import me.golemcore.warranty.domain.step.StepDecisionParser;
import me.golemcore.warranty.domain.step.StepExecutor;
import me.golemcore.warranty.domain.step.StepPromptRenderer;
import me.golemcore.warranty.port.outbound.LlmPort;
import me.golemcore.warranty.port.outbound.TransitionLogPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestrationConfiguration {

    @Bean
    public InstructionCache instructionCache() {
        // Process-lifetime cache shared by all runs.
        return new InstructionCache();
    }

    @Bean
    public StepDecisionParser stepDecisionParser(AgentProperties properties) {
        return new MarkerStepDecisionParser(properties.getOrchestration().getTerminalStep());
    }

    @Bean
    public StepPromptRenderer stepPromptRenderer(AgentProperties properties) {
        return new StepPromptRenderer(properties.getOrchestration().getTerminalStep());
    }

    @Bean
    public StepExecutor stepExecutor(InstructionStore instructionStore, LlmPort llmPort,
            StepPromptRenderer renderer, StepDecisionParser parser, AgentProperties properties, Clock clock) {
        return new LlmStepExecutor(instructionStore, llmPort, renderer, parser,
                properties.getInstructions().getMainInstruction(), clock);
    }

    @Bean
    public StepOrchestrator stepOrchestrator(StepExecutor stepExecutor, TransitionLogPort transitionLog,
            AgentProperties properties, Clock clock) {
        return new StepOrchestrator(stepExecutor, transitionLog, properties.getOrchestration(), clock);
    }
}
