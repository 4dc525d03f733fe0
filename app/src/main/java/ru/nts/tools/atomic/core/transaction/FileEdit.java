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
package ru.nts.tools.atomic.core.transaction;

/**
 * Одна операция над файлом внутри транзакции.
 *
 * <p>{@code oldContent} - содержимое, которое вызывающий считает текущим (пусто для create);
 * {@code newContent} - целевое содержимое (пусто для delete). Флаг {@code applied} и текст
 * ошибки заполняются при выполнении.
 */
public class FileEdit {

    private final String path;
    private final String oldContent;
    private final String newContent;
    private final OperationType operation;
    private boolean applied;
    private String error;

    public FileEdit(String path, String oldContent, String newContent, OperationType operation) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Edit path is empty");
        }
        this.path = path;
        this.oldContent = oldContent != null ? oldContent : "";
        this.newContent = newContent != null ? newContent : "";
        this.operation = operation != null ? operation : OperationType.EDIT;
    }

    public String getPath() {
        return path;
    }

    public String getOldContent() {
        return oldContent;
    }

    public String getNewContent() {
        return newContent;
    }

    public OperationType getOperation() {
        return operation;
    }

    public boolean isApplied() {
        return applied;
    }

    void markApplied() {
        this.applied = true;
    }

    void markReverted() {
        this.applied = false;
    }

    public String getError() {
        return error;
    }

    void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return operation.wireName() + " " + path + (applied ? " [applied]" : "");
    }
}
