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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.atomic.core.NtsErrorCode;
import ru.nts.tools.atomic.core.NtsException;
import ru.nts.tools.atomic.core.transaction.OperationType;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сериализация {@link UndoHistory} в JSON и обратно.
 *
 * <p>Формат:
 * <pre>
 * {
 *   "undo_stack":   [ {"type": "edit", ...} | {"type": "transaction", "edits": [...], ...} ],
 *   "redo_stack":   [ ... ],
 *   "op_counter":   42,
 *   "transactions": { "txn_...": { ...group... } }
 * }
 * </pre>
 * Порядок стеков, теги записей и счетчик восстанавливаются без изменений. Группа, которая
 * есть и в стеке, и в карте transactions, после загрузки - один и тот же объект.
 */
public class HistoryCodec {

    static final String TYPE_EDIT = "edit";
    static final String TYPE_TRANSACTION = "transaction";

    private final ObjectMapper mapper;

    public HistoryCodec() {
        this(new ObjectMapper());
    }

    public HistoryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ==================== Write ====================

    public ObjectNode toJson(UndoHistory history) {
        ObjectNode root = mapper.createObjectNode();
        writeStack(root.putArray("undo_stack"), history.undoStackSnapshot());
        writeStack(root.putArray("redo_stack"), history.redoStackSnapshot());
        root.put("op_counter", history.getOpCounter());
        ObjectNode groups = root.putObject("transactions");
        for (Map.Entry<String, TransactionGroup> entry : history.transactionsSnapshot().entrySet()) {
            groups.set(entry.getKey(), writeGroup(entry.getValue()));
        }
        return root;
    }

    public String toJsonString(UndoHistory history) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(history));
        } catch (JsonProcessingException e) {
            throw new NtsException(NtsErrorCode.INTERNAL_ERROR, Map.of("action", "serialize history"), e);
        }
    }

    private void writeStack(ArrayNode array, List<HistoryEntry> stack) {
        for (HistoryEntry entry : stack) {
            if (entry instanceof EditOperation op) {
                array.add(writeEdit(op));
            } else if (entry instanceof TransactionGroup group) {
                array.add(writeGroup(group));
            }
        }
    }

    private ObjectNode writeEdit(EditOperation op) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_EDIT);
        node.put("id", op.id());
        node.put("file_path", op.filePath());
        node.put("before_content", op.beforeContent());
        node.put("after_content", op.afterContent());
        node.put("timestamp", op.timestamp().toString());
        node.put("tool_name", op.toolName());
        node.put("description", op.description());
        node.put("snapshot_hash", op.snapshotHash());
        node.put("transaction_id", op.transactionId());
        node.put("operation", op.operation().wireName());
        return node;
    }

    private ObjectNode writeGroup(TransactionGroup group) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_TRANSACTION);
        node.put("id", group.id());
        node.put("timestamp", group.timestamp().toString());
        node.put("description", group.description());
        node.put("snapshot_hash", group.snapshotHash());
        ArrayNode edits = node.putArray("edits");
        for (EditOperation op : group.edits()) {
            edits.add(writeEdit(op));
        }
        return node;
    }

    // ==================== Read ====================

    public UndoHistory fromJsonString(String json, int maxHistorySize) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw corrupted("invalid JSON", e);
        }
        return fromJson(root, maxHistorySize);
    }

    /**
     * @throws NtsException HISTORY_CORRUPTED, если структура не соответствует формату
     */
    public UndoHistory fromJson(JsonNode root, int maxHistorySize) {
        if (root == null || !root.isObject()) {
            throw corrupted("root must be an object", null);
        }
        Map<String, TransactionGroup> groups = new LinkedHashMap<>();
        JsonNode groupsNode = root.path("transactions");
        Iterator<Map.Entry<String, JsonNode>> fields = groupsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            groups.put(field.getKey(), readGroup(field.getValue()));
        }

        List<HistoryEntry> undo = readStack(root.path("undo_stack"), groups);
        List<HistoryEntry> redo = readStack(root.path("redo_stack"), groups);

        UndoHistory history = new UndoHistory(maxHistorySize);
        history.restore(undo, redo, groups, root.path("op_counter").asInt(0));
        return history;
    }

    private List<HistoryEntry> readStack(JsonNode array, Map<String, TransactionGroup> groups) {
        List<HistoryEntry> stack = new ArrayList<>();
        if (array.isMissingNode() || array.isNull()) {
            return stack;
        }
        if (!array.isArray()) {
            throw corrupted("stack must be an array", null);
        }
        for (JsonNode node : array) {
            String type = node.path("type").asText();
            switch (type) {
                case TYPE_EDIT -> stack.add(readEdit(node));
                case TYPE_TRANSACTION -> {
                    TransactionGroup group = readGroup(node);
                    // Одна и та же группа в стеке и в карте - один объект
                    TransactionGroup known = groups.putIfAbsent(group.id(), group);
                    stack.add(known != null ? known : group);
                }
                default -> throw corrupted("unknown entry type '" + type + "'", null);
            }
        }
        return stack;
    }

    private EditOperation readEdit(JsonNode node) {
        return new EditOperation(
                required(node, "id"),
                required(node, "file_path"),
                node.path("before_content").asText(""),
                node.path("after_content").asText(""),
                readTimestamp(node),
                node.path("tool_name").asText("edit"),
                node.path("description").asText(""),
                optional(node, "snapshot_hash"),
                optional(node, "transaction_id"),
                readOperation(node)
        );
    }

    private TransactionGroup readGroup(JsonNode node) {
        List<EditOperation> edits = new ArrayList<>();
        for (JsonNode edit : node.path("edits")) {
            edits.add(readEdit(edit));
        }
        return new TransactionGroup(
                required(node, "id"),
                edits,
                readTimestamp(node),
                node.path("description").asText(""),
                optional(node, "snapshot_hash")
        );
    }

    private OperationType readOperation(JsonNode node) {
        String op = node.path("operation").asText(OperationType.EDIT.wireName());
        try {
            return OperationType.fromWireName(op);
        } catch (IllegalArgumentException e) {
            throw corrupted("unknown operation '" + op + "'", e);
        }
    }

    private LocalDateTime readTimestamp(JsonNode node) {
        String ts = required(node, "timestamp");
        try {
            return LocalDateTime.parse(ts);
        } catch (DateTimeParseException e) {
            throw corrupted("invalid timestamp '" + ts + "'", e);
        }
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw corrupted("missing field '" + field + "'", null);
        }
        return value.asText();
    }

    private static String optional(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static NtsException corrupted(String reason, Throwable cause) {
        return new NtsException(NtsErrorCode.HISTORY_CORRUPTED, Map.of("reason", reason), cause);
    }
}
