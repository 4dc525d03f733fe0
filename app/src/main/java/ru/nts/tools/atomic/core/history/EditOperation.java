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
package ru.nts.tools.atomic.core.history;

import ru.nts.tools.atomic.core.transaction.OperationType;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Зафиксированная обратимая правка одного файла.
 * Создается только {@link UndoHistory} в момент записи.
 *
 * @param transactionId id транзакции, если правка входит в {@link TransactionGroup}, иначе null
 * @param operation     вид операции; определяет, удаляется ли файл при undo/redo
 */
public record EditOperation(
        String id,
        String filePath,
        String beforeContent,
        String afterContent,
        LocalDateTime timestamp,
        String toolName,
        String description,
        String snapshotHash,
        String transactionId,
        OperationType operation
) implements HistoryEntry {

    public EditOperation {
        beforeContent = beforeContent != null ? beforeContent : "";
        afterContent = afterContent != null ? afterContent : "";
        toolName = toolName != null ? toolName : "edit";
        description = description != null ? description : "";
        operation = operation != null ? operation : OperationType.EDIT;
    }

    @Override
    public List<EditOperation> edits() {
        return List.of(this);
    }

    public boolean isPartOfTransaction() {
        return transactionId != null;
    }
}
