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
package ru.nts.tools.rms.core;

import java.util.Map;

/**
 * Structured error codes for rms-check.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example output on stderr:
 * <pre>
 * [ERROR: FILE_NOT_FOUND]
 * Message: File not found
 * Solution: Check the script path.
 * Context: path=maps/Arabia.rms
 * </pre>
 *
 * Ошибки содержимого скрипта сюда не относятся: они всегда становятся диагностиками.
 */
public enum RmsErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check the script path: %path%"),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_IS_BINARY("Binary file detected",
            "Random map scripts are plain text. Extract scripts from ZR@ archives before checking them."),

    FILE_ENCODING_ERROR("Cannot encode fixed content",
            "The fixed script contains characters the original encoding (%charset%) cannot represent."),

    FILE_WRITE_FAILED("Cannot write file",
            "Check that %path% is writable. A backup copy may remain next to it with the .bak suffix."),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide the '%parameter%' parameter. Run 'rms-check help' for usage."),

    PARAM_INVALID("Invalid parameter value",
            "Parameter '%parameter%' got '%value%'. Expected: %expected%"),

    UNKNOWN_COMPATIBILITY("Unknown compatibility target",
            "'%value%' is not a known target. Use one of: %expected%"),

    // ============ Runtime Errors ============

    CHECK_CANCELLED("Check cancelled",
            "A newer version of the document was submitted.");

    private final String message;
    private final String solution;

    RmsErrorCode(String message, String solution) {
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
     * @param context Optional context map (path, parameter, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Подстановка %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
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

    public String format() {
        return format(null);
    }
}
