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
import ru.nts.tools.atomic.core.transaction.EditRequest;
import ru.nts.tools.atomic.core.transaction.OperationType;
import ru.nts.tools.atomic.core.transaction.Transaction;
import ru.nts.tools.atomic.core.transaction.TransactionResult;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Атомарная правка нескольких файлов: все изменения применяются вместе или откатываются.
 *
 * <p>Для edit с old_content заменяется первое вхождение фрагмента, без old_content файл
 * перезаписывается целиком. Для delete текущее содержимое читается с диска.
 * Успешная транзакция отменяется одним undo.
 */
public class MultiFileEditTool implements McpTool {

    static final int MAX_DIFFS = 5;

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionContext session;

    public MultiFileEditTool(SessionContext session) {
        this.session = session;
    }

    /**
     * Подготовленная правка: полное содержимое файла до и после, плюс фрагменты для показа diff.
     */
    private record PreparedEdit(EditRequest request, String displayPath, String displayOld, String displayNew) {
    }

    @Override
    public String getName() {
        return "multifile_edit";
    }

    @Override
    public String getDescription() {
        return "Edit multiple files atomically - all changes succeed or all are rolled back. One undo reverts the whole set.";
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

        var edits = props.putObject("edits");
        edits.put("type", "array").put("description", "File edits to perform atomically.").put("minItems", 1);
        var item = edits.putObject("items");
        item.put("type", "object");
        var itemProps = item.putObject("properties");
        itemProps.putObject("path").put("type", "string").put("description", "Path to the file.");
        itemProps.putObject("old_content").put("type", "string").put("description",
                "Exact fragment to replace (first occurrence). Empty for full replacement or new files.");
        itemProps.putObject("new_content").put("type", "string").put("description",
                "Replacement fragment, full content, or content of a new file. Empty for deletion.");
        var op = itemProps.putObject("operation");
        op.put("type", "string").put("default", "edit").put("description", "edit (replace), create (new file), delete.");
        op.putArray("enum").add("edit").add("create").add("delete");
        item.putArray("required").add("path");

        props.putObject("description").put("type", "string").put("description", "Description of the changes for undo history.");
        props.putObject("dry_run").put("type", "boolean").put("description",
                "Validate and preview diffs without touching files. Default: false.");
        schema.putArray("required").add("edits");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        JsonNode editsNode = params.get("edits");
        if (editsNode == null || !editsNode.isArray() || editsNode.isEmpty()) {
            throw new IllegalArgumentException("No edits provided");
        }
        String description = params.path("description").asText("");
        boolean dryRun = params.path("dry_run").asBoolean(false);

        List<PreparedEdit> prepared = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < editsNode.size(); i++) {
            try {
                prepared.add(prepare(editsNode.get(i)));
            } catch (IllegalArgumentException | SecurityException | IOException e) {
                errors.add("Edit " + (i + 1) + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            return response("Validation failed (nothing was changed):\n" + bullets(errors), true);
        }

        List<EditRequest> requests = new ArrayList<>();
        for (PreparedEdit edit : prepared) {
            requests.add(edit.request());
        }
        if (description.isBlank()) {
            description = "Multi-file edit (" + requests.size() + " files)";
        }

        if (dryRun) {
            return dryRun(requests, prepared, description);
        }

        TransactionResult result = session.edits().atomicEdit(requests, session, description);
        if (!result.isSuccess()) {
            return response(formatFailure(result), true);
        }
        return response(formatSuccess(result, prepared), false);
    }

    private PreparedEdit prepare(JsonNode edit) throws IOException {
        String pathStr = edit.path("path").asText("");
        if (pathStr.isBlank()) {
            throw new IllegalArgumentException("Missing path");
        }
        OperationType operation = OperationType.fromWireName(edit.path("operation").asText("edit"));
        String oldContent = edit.path("old_content").asText("");
        String newContent = edit.path("new_content").asText("");

        Path path = PathSanitizer.sanitize(session.getProjectRoot(), pathStr);
        String display = PathSanitizer.relativize(session.getProjectRoot(), path.toString());
        FileStore files = session.getFileStore();

        return switch (operation) {
            case EDIT -> {
                if (!files.exists(path)) {
                    throw new IllegalArgumentException("File not found: " + display);
                }
                String current = files.read(path);
                if (oldContent.isEmpty()) {
                    yield new PreparedEdit(EditRequest.edit(path.toString(), current, newContent), display, current, newContent);
                }
                int idx = current.indexOf(oldContent);
                if (idx < 0) {
                    throw new IllegalArgumentException("Could not find old_content in " + display);
                }
                String updated = current.substring(0, idx) + newContent + current.substring(idx + oldContent.length());
                yield new PreparedEdit(EditRequest.edit(path.toString(), current, updated), display, oldContent, newContent);
            }
            case CREATE -> {
                if (files.exists(path)) {
                    throw new IllegalArgumentException("File already exists: " + display);
                }
                yield new PreparedEdit(EditRequest.create(path.toString(), newContent), display, "", newContent);
            }
            case DELETE -> {
                if (!files.exists(path)) {
                    throw new IllegalArgumentException("File not found: " + display);
                }
                String current = files.read(path);
                yield new PreparedEdit(EditRequest.delete(path.toString(), current), display, current, "");
            }
        };
    }

    /**
     * Проверяет транзакцию тем же валидатором, что и commit, но ничего не применяет и не пишет в историю.
     */
    private JsonNode dryRun(List<EditRequest> requests, List<PreparedEdit> prepared, String description) {
        Transaction txn = new Transaction("dry_run", description);
        for (EditRequest request : requests) {
            txn.addEdit(request.path(), request.oldContent(), request.newContent(), request.operation());
        }
        List<String> errors = session.edits().validate(txn);
        if (!errors.isEmpty()) {
            return response("**MultiFileEdit (dry run)** validation failed:\n" + bullets(relativize(errors)), true);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**MultiFileEdit (dry run)** ").append(requests.size())
                .append(" file(s) validated, nothing was changed\n\n");
        for (PreparedEdit edit : prepared) {
            sb.append("  ").append(marker(edit.request().operation())).append(" ").append(edit.displayPath())
                    .append(" (").append(edit.request().operation().wireName()).append(")\n");
        }
        appendDiffs(sb, prepared);
        return response(sb.toString().trim(), false);
    }

    private String formatSuccess(TransactionResult result, List<PreparedEdit> prepared) {
        List<String> stats = new ArrayList<>();
        if (!result.getFilesCreated().isEmpty()) {
            stats.add("+" + result.getFilesCreated().size() + " created");
        }
        if (!result.getFilesModified().isEmpty()) {
            stats.add("~" + result.getFilesModified().size() + " modified");
        }
        if (!result.getFilesDeleted().isEmpty()) {
            stats.add("-" + result.getFilesDeleted().size() + " deleted");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("**MultiFileEdit** ").append(result.getAffectedCount()).append(" file(s) (")
                .append(stats.isEmpty() ? "no changes" : String.join(", ", stats)).append(")\n");
        sb.append("Transaction: ").append(result.getTransactionId()).append("\n\n");
        for (String path : result.getFilesCreated()) {
            sb.append("  + ").append(display(path)).append(" (created)\n");
        }
        for (String path : result.getFilesModified()) {
            sb.append("  ~ ").append(display(path)).append("\n");
        }
        for (String path : result.getFilesDeleted()) {
            sb.append("  - ").append(display(path)).append(" (deleted)\n");
        }
        appendDiffs(sb, prepared);
        return sb.toString().trim();
    }

    private void appendDiffs(StringBuilder sb, List<PreparedEdit> prepared) {
        List<String> diffs = new ArrayList<>();
        for (PreparedEdit edit : prepared) {
            if (edit.request().operation() == OperationType.DELETE) {
                continue;
            }
            String diff = DiffUtils.getCompactDiff(edit.displayOld(), edit.displayNew());
            if (!diff.isEmpty()) {
                diffs.add("**" + Paths.get(edit.displayPath()).getFileName() + "**\n" + diff);
            }
        }
        if (diffs.isEmpty()) {
            return;
        }
        sb.append("\n").append(String.join("\n\n", diffs.subList(0, Math.min(diffs.size(), MAX_DIFFS))));
        if (diffs.size() > MAX_DIFFS) {
            sb.append("\n\n... and ").append(diffs.size() - MAX_DIFFS).append(" more file(s)");
        }
    }

    /**
     * Разделяет три исхода: ничего не тронуто, все откачено, откат не удался.
     */
    private String formatFailure(TransactionResult result) {
        StringBuilder sb = new StringBuilder();
        if (!result.getValidationErrors().isEmpty()) {
            sb.append("**MultiFileEdit Failed** (nothing was changed)\n\n");
            sb.append("Validation errors:\n").append(bullets(relativize(result.getValidationErrors())));
            return sb.toString().trim();
        }
        if (result.getRollbackErrors().isEmpty()) {
            sb.append("**MultiFileEdit Failed** (all changes rolled back)\n\n");
        } else {
            sb.append("**MultiFileEdit Failed** (rollback incomplete)\n\n");
        }
        sb.append("Errors:\n").append(bullets(relativize(result.getApplyErrors())));
        if (!result.getRevertedFiles().isEmpty()) {
            sb.append("\nReverted:\n").append(bullets(relativize(result.getRevertedFiles())));
        }
        if (!result.getRollbackErrors().isEmpty()) {
            sb.append("\nRollback errors (file state unknown, inspect manually):\n")
                    .append(bullets(relativize(result.getRollbackErrors())));
        } else if (result.isRolledBack()) {
            sb.append("\n✓ All partial changes have been rolled back.");
        }
        return sb.toString().trim();
    }

    private String display(String absolutePath) {
        return PathSanitizer.relativize(session.getProjectRoot(), absolutePath);
    }

    /**
     * Заменяет абсолютный корень проекта в сообщениях на относительные пути.
     */
    private List<String> relativize(List<String> lines) {
        String prefix = session.getProjectRoot().toAbsolutePath().normalize().toString() + File.separator;
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(line.replace(prefix, ""));
        }
        return result;
    }

    private static String marker(OperationType operation) {
        return switch (operation) {
            case CREATE -> "+";
            case EDIT -> "~";
            case DELETE -> "-";
        };
    }

    private static String bullets(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append("  • ").append(line).append("\n");
        }
        return sb.toString();
    }

    private JsonNode response(String text, boolean isError) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        if (isError) {
            res.put("isError", true);
        }
        return res;
    }
}
