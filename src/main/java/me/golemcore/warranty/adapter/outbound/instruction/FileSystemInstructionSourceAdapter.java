package me.golemcore.warranty.adapter.outbound.instruction;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import me.golemcore.warranty.port.outbound.InstructionSourcePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Reads {@code <key>.md} instruction documents from the configured directory,
 * falling back to the bundled classpath documents.
 *
 * <p>
 * Directory configured via {@code agent.instructions.directory}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileSystemInstructionSourceAdapter implements InstructionSourcePort {

    private static final String EXTENSION = ".md";

    private final AgentProperties properties;

    private Path directory;

    @PostConstruct
    public void init() {
        this.directory = resolveDirectory(properties.getInstructions().getDirectory());
        if (directory != null && Files.isDirectory(directory)) {
            log.info("Instruction directory: {}", directory);
        } else {
            log.info("Instruction directory {} not present, using bundled instructions only", directory);
        }
    }

    @Override
    public Optional<String> read(String key) {
        if (directory != null) {
            Path file = directory.resolve(key + EXTENSION).normalize();
            if (file.startsWith(directory) && Files.isRegularFile(file)) {
                try {
                    return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read instruction: " + file, e);
                }
            }
        }
        return readClasspath(key);
    }

    private Optional<String> readClasspath(String key) {
        ClassPathResource resource = new ClassPathResource(
                properties.getInstructions().getClasspathLocation() + key + EXTENSION);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled instruction: " + key, e);
        }
    }

    private Path resolveDirectory(String configured) {
        if (configured == null || configured.isBlank()) {
            return null;
        }
        try {
            String resolved = configured.replace("${user.home}", System.getProperty("user.home"));
            return Paths.get(resolved).toAbsolutePath().normalize();
        } catch (RuntimeException e) {
            log.warn("[Instructions] Invalid directory '{}': {}", configured, e.getMessage());
            return null;
        }
    }
}
