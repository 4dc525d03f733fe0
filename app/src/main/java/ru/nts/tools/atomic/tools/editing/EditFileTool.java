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
import ru.nts.tools.atomic.core.NtsFileException;
import ru.nts.tools.atomic.core.PathSanitizer;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.core.transaction.OperationType;
import ru.nts.tools.atomic.core.transaction.TransactionFailedException;
import ru.nts.tools.atomic.core.transaction.TransactionResult;

import java.nio.file.Path;

/**
 * Точечная замена текста в одном файле.
 *
 * <p>Искомый фрагмент должен встречаться в файле ровно один раз, либо нужно явно
 * разрешить замену всех вхождений через replace_all.
 */
public class EditFileTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public EditFileTool(SessionContext session) {
        this.session = session;
    }

    @Override
    public String getName() {
        return "edit";
    }

    @Override
    public String getDescription() {
        return "Replace an exact text fragment in a file. The fragment must be unique unless replace_all is set. Reversible with undo.";
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
        props.putObject("path").put("type", "string").put("description", "Path to the file.");
        props.putObject("old_string").put("type", "string").put("description", "Exact text to replace.");
        props.putObject("new_string").put("type", "string").put("description", "Replacement text.");
        props.putObject("replace_all").put("type", "boolean").put("description",
                "Replace every occurrence instead of requiring a unique match. Default: false.");
        schema.putArray("required").add("path").add("old_string").add("new_string");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        if (!params.hasNonNull("path")) {
            throw new IllegalArgumentException("Parameter 'path' is required");
        }
        String oldString = params.path("old_string").asText("");
        String newString = params.path("new_string").asText("");
        boolean replaceAll = params.path("replace_all").asBoolean(false);
        if (oldString.isEmpty()) {
            throw new IllegalArgumentException("Parameter 'old_string' must not be empty");
        }
        if (oldString.equals(newString)) {
            throw new IllegalArgumentException("old_string and new_string are identical");
        }

        Path path = PathSanitizer.sanitize(session.getProjectRoot(), params.get("path").asText());
        String display = PathSanitizer.relativize(session.getProjectRoot(), path.toString());
        FileStore files = session.getFileStore();
        if (!files.exists(path)) {
            throw NtsFileException.notFound(display);
        }

        String current = files.read(path);
        int occurrences = countOccurrences(current, oldString);
        if (occurrences == 0) {
            throw new IllegalArgumentException("old_string not found in " + display);
        }
        if (occurrences > 1 && !replaceAll) {
            throw new IllegalArgumentException("old_string appears " + occurrences + " times in " + display
                    + ". Provide more context or set replace_all=true.");
        }
        String updated = replaceAll
                ? current.replace(oldString, newString)
                : replaceFirst(current, oldString, newString);

        TransactionResult result = session.edits().commitFileEdit(path.toString(), current, updated,
                OperationType.EDIT, getName(), "Edit " + display, session);
        if (!result.isSuccess()) {
            throw new TransactionFailedException(result);
        }

        int replaced = replaceAll ? occurrences : 1;
        StringBuilder sb = new StringBuilder();
        sb.append("Edited ").append(display).append(" (").append(replaced).append(" replacement")
                .append(replaced == 1 ? "" : "s").append(")");
        String diff = DiffUtils.getCompactDiff(current, updated);
        if (!diff.isEmpty()) {
            sb.append("\n\n").append(diff);
        }

        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", sb.toString());
        return res;
    }

    static int countOccurrences(String text, String fragment) {
        int count = 0;
        int idx = text.indexOf(fragment);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(fragment, idx + fragment.length());
        }
        return count;
    }

    static String replaceFirst(String text, String fragment, String replacement) {
        int idx = text.indexOf(fragment);
        return text.substring(0, idx) + replacement + text.substring(idx + fragment.length());
    }
}
