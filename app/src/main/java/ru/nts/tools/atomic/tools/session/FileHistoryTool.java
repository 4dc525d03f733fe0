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

import java.nio.file.Path;
import java.util.List;

/**
 * Инструмент для просмотра истории изменений файла в рамках текущей сессии.
 * Правки из транзакций показываются наравне с одиночными.
 */
public class FileHistoryTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public FileHistoryTool(SessionContext session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "file_history";
    }

    @Override
    public String getDescription() {
        return "Show session history of changes for a specific file, oldest first.";
    }

    @Override
    public String getCategory() {
        return "session";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Path to the file.");
        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        if (!params.hasNonNull("path")) {
            throw new IllegalArgumentException("Parameter 'path' is required");
        }
        String pathStr = params.get("path").asText();
        Path path = PathSanitizer.sanitize(session.getProjectRoot(), pathStr);

        List<EditOperation> history = session.getUndoHistory().getFileHistory(path.toString());

        ObjectNode res = mapper.createObjectNode();
        var content = res.putArray("content").addObject();
        content.put("type", "text");

        if (history.isEmpty()) {
            content.put("text", "No session history found for: " + pathStr);
        } else {
            StringBuilder sb = new StringBuilder("Session history for " + pathStr + " (" + history.size() + " changes):\n");
            for (EditOperation op : history) {
                sb.append("- ").append(op.timestamp().format(HistoryFormat.TIME))
                        .append(" [").append(op.toolName()).append("] ")
                        .append(op.operation().wireName());
                if (!op.description().isBlank()) {
                    sb.append(": ").append(op.description());
                }
                sb.append(" (").append(HistoryFormat.lineDelta(op.beforeContent(), op.afterContent())).append(" lines)");
                if (op.isPartOfTransaction()) {
                    sb.append(" in ").append(op.transactionId());
                }
                sb.append("\n");
            }
            content.put("text", sb.toString().trim());
        }

        return res;
    }
}
