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
 * Описание правки для {@link AtomicEditManager#atomicEdit}.
 *
 * @param path       путь к файлу
 * @param oldContent текущее содержимое (пусто для create)
 * @param newContent новое содержимое (пусто для delete)
 * @param operation  вид операции; null означает edit
 */
public record EditRequest(String path, String oldContent, String newContent, OperationType operation) {

    public static EditRequest edit(String path, String oldContent, String newContent) {
        return new EditRequest(path, oldContent, newContent, OperationType.EDIT);
    }

    public static EditRequest create(String path, String content) {
        return new EditRequest(path, "", content, OperationType.CREATE);
    }

    public static EditRequest delete(String path, String currentContent) {
        return new EditRequest(path, currentContent, "", OperationType.DELETE);
    }
}
