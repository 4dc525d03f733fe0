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
package ru.nts.tools.atomic.core;

import java.util.Map;

/**
 * Structured error codes for atomic edit operations.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: CONTENT_CHANGED]
 * Message: File content changed since it was read
 * Solution: Re-read src/Main.java and rebuild the edit against the current content.
 * Context: path=src/Main.java
 * </pre>
 */
public enum NtsErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path. The file must exist for edit and delete operations."),

    FILE_ALREADY_EXISTS("File already exists",
            "Use operation='edit' to change %path% or delete it first."),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_IS_DIRECTORY("Path is a directory",
            "Only regular files can be edited or deleted."),

    PARENT_NOT_CREATABLE("Parent directory cannot be created",
            "Check that no regular file blocks the directory path and that it is writable."),

    // ============ Transaction Errors ============

    CONTENT_CHANGED("File content changed since it was read",
            "Re-read %path% and rebuild the edit against the current content."),

    DUPLICATE_PATH("Path appears more than once in a transaction",
            "Merge all changes to %path% into a single edit."),

    TRANSACTION_NOT_PENDING("Transaction is no longer pending",
            "Create a new transaction. Edits can only be added before commit."),

    TRANSACTION_FAILED("Transaction failed",
            "Inspect the listed errors. Nothing was left half-applied unless a rollback error is reported."),

    APPLY_FAILED("Cannot apply edit",
            "Check disk space and permissions for %path%. All applied edits were reverted."),

    ROLLBACK_FAILED("Cannot revert edit",
            "State of %path% is unknown. Inspect the file manually."),

    LOCK_INTERRUPTED("Interrupted while waiting for a file lock",
            "Nothing was applied. Retry the operation."),

    // ============ History Errors ============

    HISTORY_CORRUPTED("Cannot read saved history",
            "The history file is malformed. Delete it to start a fresh history."),

    // ============ System Errors ============

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
     * @param context Optional context map (path, action, etc.)
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
