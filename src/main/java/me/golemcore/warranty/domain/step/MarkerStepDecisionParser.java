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

import me.golemcore.warranty.domain.model.StepDecision;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for {@code MARKER: value} routing output.
 *
 * <p>
 * Marker names are matched case-insensitively, surrounding whitespace is
 * ignored and the first non-blank occurrence of a marker wins. Lines that are
 * not recognized markers are skipped.
 */
public class MarkerStepDecisionParser implements StepDecisionParser {

    public static final String NEXT_STEP = "NEXT_STEP";
    public static final String SERIAL = "SERIAL";
    public static final String REASON = "REASON";
    public static final String WARRANTY_STATUS = "WARRANTY_STATUS";
    public static final String TICKET_ID = "TICKET_ID";
    public static final String ISSUE = "ISSUE";

    private static final Pattern MARKER_LINE = Pattern.compile(
            "^\\s*(NEXT_STEP|SERIAL|REASON|WARRANTY_STATUS|TICKET_ID|ISSUE)\\s*:\\s*(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> ABSENT_VALUES = Set.of("NONE", "N/A", "NULL", "-");

    private final String terminalStep;

    public MarkerStepDecisionParser(String terminalStep) {
        this.terminalStep = terminalStep;
    }

    @Override
    public StepDecision parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return StepDecision.unparsed();
        }

        Map<String, String> found = new LinkedHashMap<>();
        for (String line : responseText.split("\\r?\\n")) {
            Matcher matcher = MARKER_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String marker = matcher.group(1).toUpperCase(Locale.ROOT);
            String value = unquote(matcher.group(2));
            if (!value.isEmpty()) {
                found.putIfAbsent(marker, value);
            }
        }

        return StepDecision.builder()
                .nextStep(normalizeNextStep(found.get(NEXT_STEP)))
                .serialNumber(presentOrNull(found.get(SERIAL)))
                .reason(found.get(REASON))
                .warrantyStatus(presentOrNull(found.get(WARRANTY_STATUS)))
                .ticketId(presentOrNull(found.get(TICKET_ID)))
                .issueDescription(presentOrNull(found.get(ISSUE)))
                .markers(found)
                .build();
    }

    private String normalizeNextStep(String value) {
        if (value == null) {
            return null;
        }
        String token = value.split("\\s+")[0];
        if (token.equalsIgnoreCase(terminalStep)) {
            return terminalStep;
        }
        return token;
    }

    private String presentOrNull(String value) {
        if (value == null || ABSENT_VALUES.contains(value.toUpperCase(Locale.ROOT))) {
            return null;
        }
        return value;
    }

    private String unquote(String value) {
        String trimmed = value.trim();
        while (trimmed.length() >= 2 && isQuote(trimmed.charAt(0))
                && trimmed.charAt(trimmed.length() - 1) == trimmed.charAt(0)) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }
}
