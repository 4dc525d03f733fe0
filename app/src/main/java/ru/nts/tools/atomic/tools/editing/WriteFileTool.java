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
package ru.nts.tools.atomic.tools.editing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.atomic.core.DiffUtils;
import ru.nts.tools.atomic.core.FileStore;
import ru.nts.tools.atomic.core.McpTool;
import ru.nts.tools.atomic.core.PathSanitizer;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.core.transaction.OperationType;
import ru.nts.tools.atomic.core.transaction.TransactionFailedException;
import ru.nts.tools.atomic.core.transaction.TransactionResult;

import java.nio.file.Path;

/**
 * Создание или полная перезапись файла.
 * Правка попадает в историю отмены как одиночная операция.
 */
public class WriteFileTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public WriteFileTool(SessionContext session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "write";
    }

    @Override
    public String getDescription() {
        return "Create a new file or overwrite an existing one with the given content. Reversible with undo.";
    }

    @Override
    public String getCategory() {
        return "editing";
    }

    @Override
    public JsonNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Path to the file (relative to project root or absolute).");
        props.putObject("content").put("type", "string").put("description", "Full content of the file.");
        schema.putArray("required").add("path").add("content");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        if (!params.hasNonNull("path")) {
            throw new IllegalArgumentException("Parameter 'path' is required");
        }
        if (!params.hasNonNull("content")) {
            throw new IllegalArgumentException("Parameter 'content' is required");
        }
        String pathStr = params.get("path").asText();
        String content = params.get("content").asText();
        Path path = PathSanitizer.sanitize(session.getProjectRoot(), pathStr);
        String display = PathSanitizer.relativize(session.getProjectRoot(), path.toString());

        FileStore files = session.getFileStore();
        boolean exists = files.exists(path);
        if (exists && files.isDirectory(path)) {
            throw new IllegalArgumentException("Path is a directory: " + display);
        }
        String before = exists ? files.read(path) : "";
        OperationType operation = exists ? OperationType.EDIT : OperationType.CREATE;

        TransactionResult result = session.edits().commitFileEdit(path.toString(), before, content, operation,
                getName(), (exists ? "Write " : "Create ") + display, session);
        if (!result.isSuccess()) {
            throw new TransactionFailedException(result);
        }

        StringBuilder sb = new StringBuilder();
        if (exists) {
            sb.append("Wrote ").append(display);
        } else {
            sb.append("Created ").append(display);
        }
        sb.append(" (").append(content.isEmpty() ? 0 : content.split("\n", -1).length).append(" lines)");
        String diff = DiffUtils.getCompactDiff(before, content);
        if (!diff.isEmpty()) {
            sb.append("\n\n").append(diff);
        }

        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", sb.toString());
        return res;
    }
}
