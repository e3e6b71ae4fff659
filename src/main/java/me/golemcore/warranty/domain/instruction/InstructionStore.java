package me.golemcore.warranty.domain.instruction;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.model.InstructionDocument;
import me.golemcore.warranty.port.outbound.InstructionSourcePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads step instruction documents (Markdown with optional YAML frontmatter)
 * and caches them per step identifier in an {@link InstructionCache}.
 */
@Service
@Slf4j
public class InstructionStore {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n?(.*)$", Pattern.DOTALL);
    private static final Pattern STEP_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final String SUPPRESS_UNCHECKED = "unchecked";

    private final InstructionSourcePort source;
    private final InstructionCache cache;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public InstructionStore(InstructionSourcePort source, InstructionCache cache) {
        this.source = source;
        this.cache = cache;
    }

    /**
     * Returns the instruction document for {@code stepId}.
     *
     * @throws InstructionNotFoundException
     *             if the identifier is malformed, no document exists or the
     *             document body is empty
     */
    public InstructionDocument load(String stepId) {
        if (stepId == null || !STEP_ID_PATTERN.matcher(stepId).matches() || stepId.contains("..")) {
            throw new InstructionNotFoundException(String.valueOf(stepId), "invalid step identifier");
        }
        return cache.getOrLoad(stepId, this::readAndParse);
    }

    /**
     * Convenience accessor for the instruction body.
     */
    public String loadText(String stepId) {
        return load(stepId).getBody();
    }

    private InstructionDocument readAndParse(String stepId) {
        String raw = source.read(stepId)
                .orElseThrow(() -> new InstructionNotFoundException(stepId, "no document"));
        InstructionDocument document = parse(stepId, raw);
        log.info("[Instructions] Loaded and cached {} (name={}, version={}, {} chars)",
                stepId, document.getName(), document.getVersion(), document.getBody().length());
        return document;
    }

    private InstructionDocument parse(String stepId, String raw) {
        String normalized = raw.replace("\r\n", "\n");
        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);

        String body = normalized;
        Map<String, Object> metadata = Map.of();
        if (matcher.matches()) {
            body = matcher.group(2);
            try {
                @SuppressWarnings(SUPPRESS_UNCHECKED)
                Map<String, Object> yaml = yamlMapper.readValue(matcher.group(1), Map.class);
                if (yaml != null) {
                    metadata = yaml;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[Instructions] Failed to parse frontmatter of {}: {}", stepId, e.getMessage());
            }
        }

        if (body.isBlank()) {
            throw new InstructionNotFoundException(stepId, "empty body");
        }

        return InstructionDocument.builder()
                .key(stepId)
                .name(stringValue(metadata.get("name"), stepId))
                .description(stringValue(metadata.get("description"), ""))
                .version(stringValue(metadata.get("version"), null))
                .trigger(stringValue(metadata.get("trigger"), null))
                .body(body.trim())
                .build();
    }

    private String stringValue(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }
}
