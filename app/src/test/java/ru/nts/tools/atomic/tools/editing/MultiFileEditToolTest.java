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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.atomic.core.EditConfig;
import ru.nts.tools.atomic.core.FailingFileStore;
import ru.nts.tools.atomic.core.SessionContext;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инструмента multifile_edit: подготовка правок, успешный commit,
 * откат и пробный прогон без изменений.
 */
class MultiFileEditToolTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FailingFileStore store;
    private SessionContext session;
    private MultiFileEditTool tool;

    @BeforeEach
    void setUp() throws Exception {
        store = new FailingFileStore();
        session = new SessionContext("tool", EditConfig.defaults(tempDir), store);
        tool = new MultiFileEditTool(session);
        Files.writeString(tempDir.resolve("b.txt"), "line one\nold value\nline three");
        Files.writeString(tempDir.resolve("c.txt"), "bye");
    }

    private ObjectNode threeFileParams() {
        ObjectNode params = mapper.createObjectNode();
        ArrayNode edits = params.putArray("edits");
        edits.addObject().put("path", "a.txt").put("operation", "create").put("new_content", "hello");
        edits.addObject().put("path", "b.txt").put("old_content", "old value").put("new_content", "new value");
        edits.addObject().put("path", "c.txt").put("operation", "delete");
        return params;
    }

    private static String text(JsonNode result) {
        return result.get("content").get(0).get("text").asText();
    }

    @Test
    void testAppliesAllEdits() throws Exception {
        JsonNode result = tool.execute(threeFileParams());
        String text = text(result);

        assertFalse(result.has("isError"));
        assertTrue(text.contains("**MultiFileEdit** 3 file(s) (+1 created, ~1 modified, -1 deleted)"), text);
        assertTrue(text.contains("+ a.txt (created)"));
        assertTrue(text.contains("- c.txt (deleted)"));
        assertTrue(text.contains("new value"));

        assertEquals("hello", Files.readString(tempDir.resolve("a.txt")));
        assertEquals("line one\nnew value\nline three", Files.readString(tempDir.resolve("b.txt")));
        assertFalse(Files.exists(tempDir.resolve("c.txt")));
        assertEquals(1, session.getUndoHistory().getUndoCount());
        assertEquals("Multi-file edit (3 files)", session.getUndoHistory().getHistory(1).get(0).description());
    }

    @Test
    void testPreparationErrorsAreNumbered() throws Exception {
        ObjectNode params = mapper.createObjectNode();
        ArrayNode edits = params.putArray("edits");
        edits.addObject().put("path", "b.txt").put("old_content", "absent").put("new_content", "x");
        edits.addObject().put("path", "c.txt").put("operation", "create").put("new_content", "x");
        edits.addObject().put("operation", "edit");
        edits.addObject().put("path", "../outside.txt").put("operation", "create");

        JsonNode result = tool.execute(params);
        String text = text(result);

        assertTrue(result.get("isError").asBoolean());
        assertTrue(text.contains("Edit 1: Could not find old_content in b.txt"), text);
        assertTrue(text.contains("Edit 2: File already exists: c.txt"));
        assertTrue(text.contains("Edit 3: Missing path"));
        assertTrue(text.contains("Edit 4: Access denied"));
        assertEquals("bye", Files.readString(tempDir.resolve("c.txt")));
        assertFalse(session.getUndoHistory().canUndo());
    }

    @Test
    void testApplyFailureReportsRollback() throws Exception {
        store.failWrites(tempDir.resolve("b.txt"));

        JsonNode result = tool.execute(threeFileParams());
        String text = text(result);

        assertTrue(result.get("isError").asBoolean());
        assertTrue(text.contains("**MultiFileEdit Failed** (all changes rolled back)"), text);
        assertTrue(text.contains("b.txt: Cannot apply edit"));
        assertTrue(text.contains("Reverted:"));
        assertTrue(text.contains("All partial changes have been rolled back"));
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
        assertEquals("bye", Files.readString(tempDir.resolve("c.txt")));
    }

    @Test
    void testRollbackFailureIsFlagged() throws Exception {
        store.failWrites(tempDir.resolve("b.txt")).failDeletes(tempDir.resolve("a.txt"));

        String text = text(tool.execute(threeFileParams()));

        assertTrue(text.contains("(rollback incomplete)"), text);
        assertTrue(text.contains("Rollback errors (file state unknown, inspect manually):"));
        assertTrue(text.contains("Rollback failed for a.txt"));
    }

    @Test
    void testDryRunChangesNothing() throws Exception {
        ObjectNode params = threeFileParams();
        params.put("dry_run", true);

        JsonNode result = tool.execute(params);
        String text = text(result);

        assertFalse(result.has("isError"));
        assertTrue(text.contains("(dry run)"));
        assertTrue(text.contains("3 file(s) validated"));
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
        assertEquals("bye", Files.readString(tempDir.resolve("c.txt")));
        assertFalse(session.getUndoHistory().canUndo());
        assertTrue(session.edits().getActiveTransactions().isEmpty());
    }

    @Test
    void testDryRunReportsValidationErrors() throws Exception {
        ObjectNode params = mapper.createObjectNode();
        params.put("dry_run", true);
        ArrayNode edits = params.putArray("edits");
        edits.addObject().put("path", "b.txt").put("new_content", "first");
        edits.addObject().put("path", "./b.txt").put("new_content", "second");

        JsonNode result = tool.execute(params);

        assertTrue(result.get("isError").asBoolean());
        assertTrue(text(result).contains("b.txt: Path appears more than once"), text(result));
    }

    @Test
    void testEmptyEditsRejected() {
        ObjectNode params = mapper.createObjectNode();
        params.putArray("edits");
        assertThrows(IllegalArgumentException.class, () -> tool.execute(params));

        JsonNode feedback = tool.executeWithFeedback(params);
        assertTrue(feedback.get("isError").asBoolean());
        assertTrue(text(feedback).startsWith("Error [INVALID_ARGUMENTS]"));
    }

    @Test
    void testDiffListIsCapped() throws Exception {
        ObjectNode params = mapper.createObjectNode();
        ArrayNode edits = params.putArray("edits");
        for (int i = 0; i < 7; i++) {
            edits.addObject().put("path", "f" + i + ".txt").put("operation", "create").put("new_content", "v" + i);
        }

        String text = text(tool.execute(params));

        assertTrue(text.contains("+7 created"));
        assertTrue(text.contains("... and 2 more file(s)"), text);
    }
}
