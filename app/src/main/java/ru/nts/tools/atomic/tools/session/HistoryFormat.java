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
package ru.nts.tools.atomic.tools.session;

import ru.nts.tools.atomic.core.history.EditOperation;
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.TransactionGroup;
import ru.nts.tools.atomic.core.history.UndoHistory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Текстовое представление записей истории для инструментов undo/redo/file_history.
 */
final class HistoryFormat {

    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private HistoryFormat() {
    }

    static String fileName(String path) {
        Path name = Paths.get(path).getFileName();
        return name != null ? name.toString() : path;
    }

    /**
     * "edit to Main.java (desc)" или "transaction txn_x (desc): 2 files (A.java, B.java)".
     */
    static String describe(HistoryEntry entry) {
        StringBuilder sb = new StringBuilder();
        if (entry instanceof TransactionGroup group) {
            sb.append("transaction ").append(group.id());
            if (!group.description().isBlank()) {
                sb.append(" (").append(group.description()).append(")");
            }
            sb.append(": ").append(group.size()).append(" file").append(group.size() == 1 ? "" : "s")
                    .append(" (").append(String.join(", ", fileNames(group))).append(")");
        } else if (entry instanceof EditOperation op) {
            sb.append("edit to ").append(fileName(op.filePath()));
            if (!op.description().isBlank()) {
                sb.append(" (").append(op.description()).append(")");
            }
        }
        return sb.toString();
    }

    private static List<String> fileNames(TransactionGroup group) {
        List<String> names = new ArrayList<>();
        for (EditOperation op : group.edits()) {
            names.add(fileName(op.filePath()));
        }
        return names;
    }

    /**
     * " [2 more undo, 1 redo available]" или пустая строка.
     */
    static String availability(UndoHistory history, String filePath) {
        int undo = history.getUndoCount(filePath);
        int redo = history.getRedoCount(filePath);
        List<String> stats = new ArrayList<>();
        if (undo > 0) {
            stats.add(undo + " more undo");
        }
        if (redo > 0) {
            stats.add(redo + " redo");
        }
        return stats.isEmpty() ? "" : " [" + String.join(", ", stats) + " available]";
    }

    static String lineDelta(String before, String after) {
        int delta = after.split("\n", -1).length - before.split("\n", -1).length;
        return delta > 0 ? "+" + delta : String.valueOf(delta);
    }
}
