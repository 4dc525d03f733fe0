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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.atomic.core.McpTool;
import ru.nts.tools.atomic.core.PathSanitizer;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.core.history.EditOperation;
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.TransactionGroup;
import ru.nts.tools.atomic.core.history.UndoHistory;
import ru.nts.tools.atomic.core.transaction.ReplayDirection;
import ru.nts.tools.atomic.core.transaction.TransactionResult;

import java.util.List;

/**
 * Отмена последней правки (или последней правки конкретного файла).
 * Транзакция нескольких файлов отменяется целиком.
 *
 * <p>Если восстановить файлы не удалось, запись возвращается в undo-стек.
 */
public class UndoTool implements McpTool {

    static final int HISTORY_LIMIT = 20;

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public UndoTool(SessionContext session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "undo";
    }

    @Override
    public String getDescription() {
        return "Undo the last edit, restoring the previous state. A multi-file transaction is undone as a whole. "
                + "With show_history lists recent edits instead.";
    }

    @Override
    public String getCategory() {
        return "session";
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description",
                "File whose last edit should be undone. If omitted, undoes the most recent edit across all files.");
        props.putObject("show_history").put("type", "boolean").put("description",
                "Show edit history instead of undoing. Default: false.");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        UndoHistory history = session.getUndoHistory();
        String filePath = params.hasNonNull("path")
                ? PathSanitizer.sanitize(session.getProjectRoot(), params.get("path").asText()).toString()
                : null;

        if (params.path("show_history").asBoolean(false)) {
            return text(formatHistory(history, filePath), false);
        }

        HistoryEntry entry = history.undo(filePath);
        if (entry == null) {
            return text(filePath != null
                    ? "No edits to undo for: " + HistoryFormat.fileName(filePath)
                    : "No edits to undo", false);
        }

        TransactionResult result = session.edits().replay(entry, ReplayDirection.UNDO);
        if (!result.isSuccess()) {
            history.returnToUndoStack(entry);
            System.err.println("Undo of " + entry.id() + " failed: " + result.getErrors());
            return text("Error undoing " + HistoryFormat.describe(entry) + ":\n  • "
                    + String.join("\n  • ", result.getErrors()), true);
        }

        return text("✓ Undid " + HistoryFormat.describe(entry) + HistoryFormat.availability(history, filePath), false);
    }

    private String formatHistory(UndoHistory history, String filePath) {
        List<HistoryEntry> entries = history.getHistory(filePath, HISTORY_LIMIT);
        if (entries.isEmpty()) {
            return filePath != null
                    ? "No edit history for: " + HistoryFormat.fileName(filePath)
                    : "No edit history available";
        }
        StringBuilder sb = new StringBuilder("## Edit History\n\n");
        int i = 1;
        for (HistoryEntry entry : entries) {
            sb.append(i++).append(". ");
            if (entry instanceof TransactionGroup group) {
                sb.append("**Transaction** (").append(group.timestamp().format(HistoryFormat.TIME)).append(") - ")
                        .append(group.description()).append(" [").append(group.size()).append(" files]");
            } else if (entry instanceof EditOperation op) {
                String desc = op.description().isBlank() ? op.toolName() : op.description();
                sb.append("**").append(HistoryFormat.fileName(op.filePath())).append("** (")
                        .append(op.timestamp().format(HistoryFormat.TIME)).append(") - ").append(desc)
                        .append(" [").append(HistoryFormat.lineDelta(op.beforeContent(), op.afterContent()))
                        .append(" lines]");
            }
            sb.append("\n");
        }
        sb.append("\n*").append(history.getUndoCount(filePath)).append(" undo, ")
                .append(history.getRedoCount(filePath)).append(" redo available*");
        return sb.toString();
    }

    private JsonNode text(String text, boolean isError) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        if (isError) {
            res.put("isError", true);
        }
        return res;
    }
}
