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

import lombok.Data;
import me.golemcore.warranty.domain.model.ParseFailurePolicy;
import me.golemcore.warranty.domain.model.WorkflowMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private InstructionsProperties instructions = new InstructionsProperties();
    private OrchestrationProperties orchestration = new OrchestrationProperties();
    private EvalProperties eval = new EvalProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /**
         * Model in {@code provider/model} form, e.g. {@code openai/gpt-4o-mini} or
         * {@code anthropic/claude-3-5-haiku-latest}.
         */
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.2;
        private int maxTokens = 2048;
        private long timeoutMs = 60000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== INSTRUCTIONS ====================

    @Data
    public static class InstructionsProperties {
        /** Filesystem directory holding {@code <step-id>.md} documents. */
        private String directory = "${user.home}/.warranty-agent/instructions";

        /** Classpath location checked when the directory has no document. */
        private String classpathLocation = "instructions/";

        /**
         * Key of the document prepended to every step prompt and used by the legacy
         * mode. Blank disables it for the step machine.
         */
        private String mainInstruction = "main";
    }

    // ==================== ORCHESTRATION ====================

    @Data
    public static class OrchestrationProperties {
        private WorkflowMode mode = WorkflowMode.STEP_MACHINE;
        private String entryStep = "01-extract-serial";
        private String terminalStep = "DONE";

        /** Circuit breaker: maximum number of steps executed in one run. */
        private int maxSteps = 10;

        /** Wall-clock budget for one run, including every reasoning call. */
        private Duration runTimeout = Duration.ofMinutes(5);

        private ParseFailurePolicy parseFailurePolicy = ParseFailurePolicy.FAIL;
    }

    // ==================== EVAL ====================

    @Data
    public static class EvalProperties {
        /** Steps at which a workflow may legitimately end early. */
        private Set<String> finalSteps = new LinkedHashSet<>(List.of(
                "05-send-confirmation", "04-out-of-scope", "03d-request-serial", "DONE"));
    }
}
