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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.atomic.core.EditConfig;
import ru.nts.tools.atomic.core.FailingFileStore;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.tools.editing.MultiFileEditTool;
import ru.nts.tools.atomic.tools.editing.WriteFileTool;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инструментов undo, redo и file_history поверх реальных правок.
 */
class UndoRedoToolTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FailingFileStore store;
    private SessionContext session;
    private WriteFileTool writeTool;
    private MultiFileEditTool multiTool;
    private UndoTool undoTool;
    private RedoTool redoTool;
    private FileHistoryTool historyTool;

    @BeforeEach
    void setUp() {
        store = new FailingFileStore();
        session = new SessionContext("undo", EditConfig.defaults(tempDir), store);
        writeTool = new WriteFileTool(session);
        multiTool = new MultiFileEditTool(session);
        undoTool = new UndoTool(session);
        redoTool = new RedoTool(session);
        historyTool = new FileHistoryTool(session);
    }

    private static String text(JsonNode result) {
        return result.get("content").get(0).get("text").asText();
    }

    private void write(String path, String content) throws Exception {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", path);
        params.put("content", content);
        writeTool.execute(params);
    }

    private JsonNode undo() throws Exception {
        return undoTool.execute(mapper.createObjectNode());
    }

    private JsonNode redo() throws Exception {
        return redoTool.execute(mapper.createObjectNode());
    }

    @Test
    void testUndoRedoWholeTransaction() throws Exception {
        Files.writeString(tempDir.resolve("b.txt"), "old");
        Files.writeString(tempDir.resolve("c.txt"), "bye");
        ObjectNode params = mapper.createObjectNode();
        params.put("description", "three files");
        ArrayNode edits = params.putArray("edits");
        edits.addObject().put("path", "a.txt").put("operation", "create").put("new_content", "hello");
        edits.addObject().put("path", "b.txt").put("new_content", "new");
        edits.addObject().put("path", "c.txt").put("operation", "delete");
        multiTool.execute(params);

        String undone = text(undo());
        assertTrue(undone.startsWith("✓ Undid transaction txn_"), undone);
        assertTrue(undone.contains("(three files): 3 files (a.txt, b.txt, c.txt)"));
        assertTrue(undone.endsWith("[1 redo available]"));
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
        assertEquals("old", Files.readString(tempDir.resolve("b.txt")));
        assertEquals("bye", Files.readString(tempDir.resolve("c.txt")));

        String redone = text(redo());
        assertTrue(redone.startsWith("✓ Redid transaction"), redone);
        assertEquals("hello", Files.readString(tempDir.resolve("a.txt")));
        assertEquals("new", Files.readString(tempDir.resolve("b.txt")));
        assertFalse(Files.exists(tempDir.resolve("c.txt")));
    }

    @Test
    void testNewEditClearsRedo() throws Exception {
        write("x.txt", "v1");
        write("x.txt", "v2");
        write("x.txt", "v3");

        undo();
        assertEquals("v2", Files.readString(tempDir.resolve("x.txt")));
        assertEquals(1, session.getUndoHistory().getRedoCount());

        write("y.txt", "unrelated");

        assertEquals(0, session.getUndoHistory().getRedoCount());
        assertEquals("No edits to redo", text(redo()));
        assertEquals("v2", Files.readString(tempDir.resolve("x.txt")));
    }

    @Test
    void testUndoOfCreateRemovesFile() throws Exception {
        write("fresh.txt", "content");

        String undone = text(undo());

        assertTrue(undone.startsWith("✓ Undid edit to fresh.txt (Create fresh.txt)"), undone);
        assertFalse(Files.exists(tempDir.resolve("fresh.txt")));
        assertEquals("No edits to undo", text(undo()));
    }

    @Test
    void testPathScopedUndo() throws Exception {
        write("a.txt", "a1");
        write("b.txt", "b1");
        write("a.txt", "a2");
        write("b.txt", "b2");

        ObjectNode params = mapper.createObjectNode();
        params.put("path", "a.txt");
        String undone = text(undoTool.execute(params));

        assertTrue(undone.contains("edit to a.txt"), undone);
        assertTrue(undone.endsWith("[1 more undo, 1 redo available]"), undone);
        assertEquals("a1", Files.readString(tempDir.resolve("a.txt")));
        assertEquals("b2", Files.readString(tempDir.resolve("b.txt")));

        params.put("path", "missing.txt");
        assertEquals("No edits to undo for: missing.txt", text(undoTool.execute(params)));
    }

    @Test
    void testFailedUndoReturnsEntryToStack() throws Exception {
        write("a.txt", "one");
        write("a.txt", "two");
        store.failWrites(tempDir.resolve("a.txt"));

        JsonNode result = undo();

        assertTrue(result.get("isError").asBoolean());
        assertTrue(text(result).startsWith("Error undoing edit to a.txt"), text(result));
        assertEquals("two", Files.readString(tempDir.resolve("a.txt")));
        assertEquals(2, session.getUndoHistory().getUndoCount());
        assertEquals(0, session.getUndoHistory().getRedoCount());
    }

    @Test
    void testShowHistory() throws Exception {
        write("a.txt", "one");
        write("a.txt", "one\ntwo\nthree");
        ObjectNode batch = mapper.createObjectNode();
        ArrayNode edits = batch.putArray("edits");
        edits.addObject().put("path", "b.txt").put("operation", "create").put("new_content", "b");
        edits.addObject().put("path", "c.txt").put("operation", "create").put("new_content", "c");
        multiTool.execute(batch);

        ObjectNode params = mapper.createObjectNode();
        params.put("show_history", true);
        String text = text(undoTool.execute(params));

        assertTrue(text.startsWith("## Edit History"), text);
        assertTrue(text.contains("1. **Transaction**"));
        assertTrue(text.contains("Multi-file edit (2 files) [2 files]"));
        assertTrue(text.contains("2. **a.txt**"));
        assertTrue(text.contains("[+2 lines]"));
        assertTrue(text.contains("*3 undo, 0 redo available*"));
        assertEquals(3, session.getUndoHistory().getUndoCount(), "show_history does not undo");
    }

    @Test
    void testFileHistoryExpandsTransactions() throws Exception {
        write("a.txt", "one");
        ObjectNode batch = mapper.createObjectNode();
        ArrayNode edits = batch.putArray("edits");
        edits.addObject().put("path", "a.txt").put("new_content", "two");
        edits.addObject().put("path", "b.txt").put("operation", "create").put("new_content", "b");
        multiTool.execute(batch);

        ObjectNode params = mapper.createObjectNode();
        params.put("path", "a.txt");
        String text = text(historyTool.execute(params));

        assertTrue(text.startsWith("Session history for a.txt (2 changes):"), text);
        assertTrue(text.contains("[write] create"));
        assertTrue(text.contains("[multifile_edit] edit"));
        assertTrue(text.contains(" in txn_"));

        params.put("path", "other.txt");
        assertEquals("No session history found for: other.txt", text(historyTool.execute(params)));
    }
}
