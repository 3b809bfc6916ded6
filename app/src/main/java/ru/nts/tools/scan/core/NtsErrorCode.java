/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.scan.core;

import java.util.Map;

/**
 * Structured error codes for the scanner.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: FILE_NOT_FOUND]
 * Message: Input file not found
 * Solution: Check the input path 'logs/app.log'. Paths are resolved against the project root.
 * Context: path=logs/app.log
 * </pre>
 */
public enum NtsErrorCode {

    // ============ Input Errors ============

    FILE_NOT_FOUND("Input file not found",
            "Check the input path '%path%'. Paths are resolved against the project root."),

    FILE_NOT_READABLE("Input file not readable",
            "Check file permissions for '%path%'. Ensure the file is not locked."),

    NOT_A_FILE("Input is not a regular file",
            "'%path%' is a directory or a special file. Pass a regular file to scan."),

    // ============ Pattern Errors ============

    PATTERN_SET_EMPTY("No patterns to search for",
            "Provide at least one non-empty pattern."),

    PATTERN_EMPTY("Empty pattern",
            "Pattern #%index% is empty. Empty patterns have no defined match position, remove it."),

    PATTERN_UNENCODABLE("Pattern cannot be encoded",
            "Pattern #%index% contains characters not representable in %charset%."),

    PATTERN_SET_TOO_LARGE("Pattern set too large",
            "Patterns total %total% bytes, the limit is %limit% bytes. Split the patterns into several scans."),

    // ============ Cache Errors ============

    CACHE_CORRUPTED("Result cache is corrupted",
            "Store '%path%' could not be read (%reason%). It is ignored and rewritten on the next successful scan."),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide the required parameter '%parameter%'."),

    PARAM_INVALID("Invalid parameter value",
            "Parameter '%parameter%' has value '%value%', expected %expected%."),

    PARAM_OUT_OF_RANGE("Parameter out of range",
            "Parameter '%parameter%' = %value% must be within [%min%, %max%]."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    NtsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, pattern, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }
}
