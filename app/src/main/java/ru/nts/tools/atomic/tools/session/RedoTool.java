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
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.UndoHistory;
import ru.nts.tools.atomic.core.transaction.ReplayDirection;
import ru.nts.tools.atomic.core.transaction.TransactionResult;

/**
 * Повтор отмененной правки. Любая новая правка очищает redo-стек.
 */
public class RedoTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public RedoTool(SessionContext session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "redo";
    }

    @Override
    public String getDescription() {
        return "Redo an undone edit. Use after undo to restore the change.";
    }

    @Override
    public String getCategory() {
        return "session";
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("path").put("type", "string").put("description",
                "File whose last undo should be redone. If omitted, redoes the most recent undo across all files.");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        UndoHistory history = session.getUndoHistory();
        String filePath = params.hasNonNull("path")
                ? PathSanitizer.sanitize(session.getProjectRoot(), params.get("path").asText()).toString()
                : null;

        HistoryEntry entry = history.redo(filePath);
        ObjectNode res = mapper.createObjectNode();
        ObjectNode content = res.putArray("content").addObject().put("type", "text");
        if (entry == null) {
            content.put("text", filePath != null
                    ? "No edits to redo for: " + HistoryFormat.fileName(filePath)
                    : "No edits to redo");
            return res;
        }

        TransactionResult result = session.edits().replay(entry, ReplayDirection.REDO);
        if (!result.isSuccess()) {
            history.returnToRedoStack(entry);
            System.err.println("Redo of " + entry.id() + " failed: " + result.getErrors());
            content.put("text", "Error redoing " + HistoryFormat.describe(entry) + ":\n  • "
                    + String.join("\n  • ", result.getErrors()));
            res.put("isError", true);
            return res;
        }

        content.put("text", "✓ Redid " + HistoryFormat.describe(entry) + HistoryFormat.availability(history, filePath));
        return res;
    }
}
