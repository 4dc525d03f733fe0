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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for file-scoped errors met while validating, applying or reverting an edit.
 * {@link #toEditError()} renders the "path: message" line stored in a transaction result.
 */
public class NtsFileException extends NtsException {

    private final String path;

    public NtsFileException(NtsErrorCode code, String path) {
        super(code, Map.of("path", path));
        this.path = path;
    }

    public NtsFileException(NtsErrorCode code, String path, Throwable cause) {
        super(code, createContext(path, cause), cause);
        this.path = path;
    }

    private static Map<String, Object> createContext(String path, Throwable cause) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        if (cause != null) {
            ctx.put("cause", describe(cause));
        }
        return ctx;
    }

    public String getPath() {
        return path;
    }

    /**
     * Однострочное описание ошибки для списка ошибок транзакции.
     */
    public String toEditError() {
        String line = path + ": " + getCode().getMessage();
        Object cause = getContext().get("cause");
        return cause != null ? line + " (" + cause + ")" : line;
    }

    /**
     * Текст исключения без пустых сообщений (NoSuchFileException и т.п. часто несут только путь).
     */
    public static String describe(Throwable t) {
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return t.getClass().getSimpleName() + ": " + msg;
    }

    /**
     * Factory: File not found
     */
    public static NtsFileException notFound(String path) {
        return new NtsFileException(NtsErrorCode.FILE_NOT_FOUND, path);
    }

    /**
     * Factory: File already exists (create over existing file)
     */
    public static NtsFileException alreadyExists(String path) {
        return new NtsFileException(NtsErrorCode.FILE_ALREADY_EXISTS, path);
    }

    /**
     * Factory: Stale read
     */
    public static NtsFileException contentChanged(String path) {
        return new NtsFileException(NtsErrorCode.CONTENT_CHANGED, path);
    }

    /**
     * Factory: Apply failure wrapping the underlying I/O error
     */
    public static NtsFileException applyFailed(String path, Throwable cause) {
        return new NtsFileException(NtsErrorCode.APPLY_FAILED, path, cause);
    }

    /**
     * Factory: Rollback failure wrapping the underlying I/O error
     */
    public static NtsFileException rollbackFailed(String path, Throwable cause) {
        return new NtsFileException(NtsErrorCode.ROLLBACK_FAILED, path, cause);
    }
}
