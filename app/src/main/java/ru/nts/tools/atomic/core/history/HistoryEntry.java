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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Запись истории отмены: правка одного файла или целая транзакция.
 * Запись перемещается между стеками undo и redo целиком и никогда не делится.
 */
public sealed interface HistoryEntry permits EditOperation, TransactionGroup {

    String id();

    LocalDateTime timestamp();

    String description();

    String snapshotHash();

    /**
     * Правки записи в порядке применения. Для одиночной правки - она сама.
     */
    List<EditOperation> edits();

    /**
     * Пути всех файлов, затронутых записью.
     */
    default List<String> filePaths() {
        List<String> paths = new ArrayList<>();
        for (EditOperation edit : edits()) {
            paths.add(edit.filePath());
        }
        return paths;
    }

    /**
     * Проверяет, затрагивает ли запись файл (путь уже нормализован).
     */
    default boolean touches(String normalizedPath) {
        for (EditOperation edit : edits()) {
            if (edit.filePath().equals(normalizedPath)) {
                return true;
            }
        }
        return false;
    }
}
