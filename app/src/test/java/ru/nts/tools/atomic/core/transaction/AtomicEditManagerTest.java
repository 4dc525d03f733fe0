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
package ru.nts.tools.atomic.core.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.atomic.core.EditConfig;
import ru.nts.tools.atomic.core.FailingFileStore;
import ru.nts.tools.atomic.core.LocalFileStore;
import ru.nts.tools.atomic.core.PathLock;
import ru.nts.tools.atomic.core.SessionContext;
import ru.nts.tools.atomic.core.history.EditOperation;
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.TransactionGroup;
import ru.nts.tools.atomic.core.history.UndoHistory;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Тесты движка атомарных правок: валидация без побочных эффектов, откат при сбое,
 * запись в историю и повторное применение записей при undo/redo.
 */
class AtomicEditManagerTest {

    @TempDir
    Path tempDir;

    private FailingFileStore store;
    private SessionContext session;
    private AtomicEditManager manager;
    private Path a;
    private Path b;
    private Path c;

    @BeforeEach
    void setUp() throws IOException {
        store = new FailingFileStore();
        session = new SessionContext("test", EditConfig.defaults(tempDir), store);
        manager = session.edits();
        a = tempDir.resolve("a.txt");
        b = tempDir.resolve("b.txt");
        c = tempDir.resolve("c.txt");
        Files.writeString(b, "old");
        Files.writeString(c, "bye");
    }

    /**
     * create a.txt, edit b.txt old→new, delete c.txt.
     */
    private Transaction threeFileTransaction() {
        Transaction txn = manager.createTransaction("three files");
        txn.addCreate(a.toString(), "hello");
        txn.addEdit(b.toString(), "old", "new");
        txn.addDelete(c.toString(), "bye");
        return txn;
    }

    @Test
    void testCommitAppliesAllEdits() throws Exception {
        TransactionResult result = manager.commit(threeFileTransaction(), session);

        assertTrue(result.isSuccess(), "Errors: " + result.getErrors());
        assertEquals(TransactionState.COMMITTED, result.getState());
        assertEquals("hello", Files.readString(a));
        assertEquals("new", Files.readString(b));
        assertFalse(Files.exists(c));
        assertEquals(List.of(a.toString()), result.getFilesCreated());
        assertEquals(List.of(b.toString()), result.getFilesModified());
        assertEquals(List.of(c.toString()), result.getFilesDeleted());
        assertTrue(result.getSnapshotHash().startsWith("snap_test_"));

        UndoHistory history = session.getUndoHistory();
        assertEquals(1, history.getUndoCount());
        HistoryEntry top = history.getHistory(1).get(0);
        TransactionGroup group = assertInstanceOf(TransactionGroup.class, top);
        assertEquals(result.getTransactionId(), group.id());
        assertEquals(3, group.size());
        assertEquals("three files", group.description());
        assertEquals(result.getSnapshotHash(), group.snapshotHash());
        assertTrue(manager.getActiveTransactions().isEmpty());
    }

    @Test
    void testStaleContentFailsValidationWithoutTouchingFiles() throws Exception {
        Files.writeString(b, "different");

        TransactionResult result = manager.commit(threeFileTransaction(), session);

        assertFalse(result.isSuccess());
        assertEquals(TransactionState.FAILED, result.getState());
        assertFalse(result.isRolledBack());
        assertEquals(1, result.getErrors().size());
        assertEquals(1, result.getValidationErrors().size());
        assertTrue(result.getValidationErrors().get(0).contains("b.txt"));
        assertTrue(result.getValidationErrors().get(0).contains("content changed"));

        assertFalse(Files.exists(a));
        assertEquals("different", Files.readString(b));
        assertEquals("bye", Files.readString(c));
        assertFalse(session.getUndoHistory().canUndo());
        assertNull(result.getSnapshotHash(), "No snapshot is taken for a rejected transaction");
    }

    @Test
    void testApplyFailureRollsBackEarlierEdits() throws Exception {
        store.failWrites(b);

        TransactionResult result = manager.commit(threeFileTransaction(), session);

        assertFalse(result.isSuccess());
        assertTrue(result.isRolledBack());
        assertEquals(TransactionState.ROLLED_BACK, result.getState());
        assertFalse(Files.exists(a), "Created file must be removed by rollback");
        assertEquals("old", Files.readString(b));
        assertEquals("bye", Files.readString(c));
        assertEquals(1, result.getApplyErrors().size());
        assertTrue(result.getApplyErrors().get(0).startsWith(b.toString() + ": "));
        assertEquals(List.of(a.toString()), result.getRevertedFiles());
        assertTrue(result.getRollbackErrors().isEmpty());
        assertFalse(session.getUndoHistory().canUndo());
    }

    @Test
    void testLaterFailureRestoresEveryTouchedFile() throws Exception {
        Path d = tempDir.resolve("d.txt");
        Files.writeString(d, "keep");
        store.failWrites(d);

        Transaction txn = manager.createTransaction("four files");
        txn.addEdit(b.toString(), "old", "new");
        txn.addDelete(c.toString(), "bye");
        txn.addCreate(a.toString(), "hello");
        txn.addEdit(d.toString(), "keep", "changed");
        TransactionResult result = manager.commit(txn, session);

        assertTrue(result.isRolledBack());
        assertEquals("old", Files.readString(b));
        assertEquals("bye", Files.readString(c));
        assertFalse(Files.exists(a));
        assertEquals("keep", Files.readString(d));
        // Откат идет в обратном порядке применения
        assertEquals(List.of(a.toString(), c.toString(), b.toString()), result.getRevertedFiles());
    }

    @Test
    void testRollbackFailureIsReportedSeparately() throws Exception {
        store.failWrites(b).failDeletes(a);

        TransactionResult result = manager.commit(threeFileTransaction(), session);

        assertFalse(result.isSuccess());
        assertTrue(result.isRolledBack());
        assertEquals(1, result.getApplyErrors().size());
        assertEquals(1, result.getRollbackErrors().size());
        assertTrue(result.getRollbackErrors().get(0).startsWith("Rollback failed for " + a));
        assertEquals(List.of(a.toString()), result.getUnrecoverableFiles());
        assertEquals(2, result.getErrors().size());
        assertTrue(Files.exists(a), "File whose rollback failed stays as is");
    }

    @Test
    void testValidationCollectsAllErrors() throws Exception {
        Files.writeString(a, "already here");
        Transaction txn = manager.createTransaction("broken");
        txn.addCreate(a.toString(), "hello");
        txn.addDelete(tempDir.resolve("missing.txt").toString(), "");
        txn.addEdit(b.toString(), "old", "new");

        List<String> errors = manager.validate(txn);

        assertEquals(2, errors.size());
        assertTrue(errors.get(0).contains("already exists"));
        assertTrue(errors.get(1).contains("missing.txt"));
        assertEquals(TransactionState.PENDING, txn.getState(), "validate alone does not start a commit");
        assertEquals("old", Files.readString(b));
    }

    @Test
    void testDuplicatePathRejected() {
        Transaction txn = manager.createTransaction("dup");
        txn.addEdit(b.toString(), "old", "mid");
        txn.addEdit(tempDir.resolve("x").resolve("..").resolve("b.txt").toString(), "mid", "new");

        TransactionResult result = manager.commit(txn, session);

        assertFalse(result.isSuccess());
        assertTrue(result.getValidationErrors().get(0).contains("more than once"));
    }

    @Test
    void testDirectoryTargetAndBlockedParentRejected() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("dir"));
        Transaction txn = manager.createTransaction("bad targets");
        txn.addDelete(dir.toString(), "");
        txn.addCreate(c.resolve("child.txt").toString(), "x");

        List<String> errors = manager.validate(txn);

        assertEquals(2, errors.size());
        assertTrue(errors.get(0).contains("directory"));
        assertTrue(errors.get(1).contains("Parent directory cannot be created"));
        assertTrue(Files.isDirectory(dir));
    }

    @Test
    void testCreateMakesMissingParents() throws Exception {
        Path nested = tempDir.resolve("src/main/App.java");

        TransactionResult result = manager.atomicEdit(List.of(EditRequest.create(nested.toString(), "class App {}")),
                session, null);

        assertTrue(result.isSuccess());
        assertEquals("class App {}", Files.readString(nested));
        TransactionGroup group = (TransactionGroup) session.getUndoHistory().getHistory(1).get(0);
        assertEquals("Multi-file edit (1 files)", group.description());
    }

    @Test
    void testEmptyTransactionIsNotRecorded() {
        TransactionResult result = manager.commit(manager.createTransaction("nothing"), session);

        assertTrue(result.isSuccess());
        assertEquals(0, result.getAffectedCount());
        assertFalse(session.getUndoHistory().canUndo());
    }

    @Test
    void testCommitWithoutSessionSkipsHistory() throws Exception {
        TransactionResult result = manager.commit(threeFileTransaction(), null);

        assertTrue(result.isSuccess());
        assertNull(result.getSnapshotHash());
        assertFalse(session.getUndoHistory().canUndo());
    }

    @Test
    void testCommitFileEditRecordsSingleOperation() throws Exception {
        TransactionResult result = manager.commitFileEdit(b.toString(), "old", "new", OperationType.EDIT,
                "write", "Write b.txt", session);

        assertTrue(result.isSuccess());
        assertEquals("new", Files.readString(b));
        EditOperation op = assertInstanceOf(EditOperation.class, session.getUndoHistory().getHistory(1).get(0));
        assertEquals("write", op.toolName());
        assertEquals("old", op.beforeContent());
        assertEquals("new", op.afterContent());
        assertFalse(op.isPartOfTransaction());
    }

    @Test
    void testUndoAndRedoReplayWholeGroup() throws Exception {
        manager.commit(threeFileTransaction(), session);
        UndoHistory history = session.getUndoHistory();

        HistoryEntry entry = history.undo();
        TransactionResult undo = manager.replay(entry, ReplayDirection.UNDO);

        assertTrue(undo.isSuccess(), "Errors: " + undo.getErrors());
        assertFalse(Files.exists(a));
        assertEquals("old", Files.readString(b));
        assertEquals("bye", Files.readString(c));
        assertEquals(0, history.getUndoCount());
        assertEquals(1, history.getRedoCount());

        HistoryEntry redoEntry = history.redo();
        assertSame(entry, redoEntry);
        TransactionResult redo = manager.replay(redoEntry, ReplayDirection.REDO);

        assertTrue(redo.isSuccess(), "Errors: " + redo.getErrors());
        assertEquals("hello", Files.readString(a));
        assertEquals("new", Files.readString(b));
        assertFalse(Files.exists(c));
        assertEquals(1, history.getUndoCount(), "Replay itself never records history");
    }

    @Test
    void testFailedUndoLeavesGroupApplied() throws Exception {
        manager.commit(threeFileTransaction(), session);
        store.failWrites(b);

        TransactionResult undo = manager.replay(session.getUndoHistory().getHistory(1).get(0), ReplayDirection.UNDO);

        assertFalse(undo.isSuccess());
        assertTrue(undo.isRolledBack());
        // Откат восстановил состояние после commit
        assertEquals("hello", Files.readString(a));
        assertEquals("new", Files.readString(b));
        assertFalse(Files.exists(c));
    }

    @Test
    void testInTransactionCommitsBody() throws Exception {
        TransactionResult result = manager.inTransaction("scoped", session, txn -> {
            String current = Files.readString(b);
            txn.addEdit(b.toString(), current, current.toUpperCase());
        });

        assertTrue(result.isSuccess());
        assertEquals("OLD", Files.readString(b));
    }

    @Test
    void testInTransactionDiscardsOnBodyFailure() throws Exception {
        IOException thrown = assertThrows(IOException.class, () -> manager.inTransaction("scoped", session, txn -> {
            txn.addCreate(a.toString(), "hello");
            throw new IOException("body failed");
        }));

        assertEquals("body failed", thrown.getMessage());
        assertFalse(Files.exists(a));
        assertTrue(manager.getActiveTransactions().isEmpty());
        assertFalse(session.getUndoHistory().canUndo());
    }

    @Test
    void testInTransactionThrowsOnFailedCommit() {
        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> manager.inTransaction("scoped", session, txn -> txn.addEdit(b.toString(), "stale", "new")));

        assertEquals(TransactionState.FAILED, e.getResult().getState());
        assertEquals(1, e.getResult().getValidationErrors().size());
    }

    @Test
    void testActiveTransactionsTracked() {
        Transaction txn = manager.createTransaction("pending");
        assertTrue(manager.getActiveTransactions().contains(txn.getId()));
        assertTrue(txn.getId().matches("txn_[0-9a-f]{12}"));

        manager.commit(txn, session);
        assertFalse(manager.getActiveTransactions().contains(txn.getId()));
    }

    @Test
    void testConcurrentDisjointTransactions() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<TransactionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                Path file = tempDir.resolve("f" + i + ".txt");
                futures.add(pool.submit(() -> manager.atomicEdit(
                        List.of(EditRequest.create(file.toString(), "content")), session, "create " + file.getFileName())));
            }
            for (Future<TransactionResult> future : futures) {
                assertTrue(future.get().isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(32, session.getUndoHistory().getUndoCount());
        assertTrue(manager.getActiveTransactions().isEmpty());
    }

    // ==================== Symbolic links ====================

    private Path symlinkTo(Path target, String name) throws IOException {
        try {
            return Files.createSymbolicLink(tempDir.resolve(name), target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "Symbolic links are not supported here: " + e.getMessage());
            return null;
        }
    }

    @Test
    void testLinkAndTargetInOneTransactionAreDuplicates() throws Exception {
        Path link = symlinkTo(b, "link.txt");
        Transaction txn = manager.createTransaction("alias");
        txn.addEdit(b.toString(), "old", "v2");
        txn.addEdit(link.toString(), "old", "v3");

        TransactionResult result = manager.commit(txn, session);

        assertEquals(TransactionState.FAILED, result.getState());
        assertEquals(1, result.getValidationErrors().size());
        assertTrue(result.getValidationErrors().get(0).startsWith(link + ": "));
        assertTrue(result.getValidationErrors().get(0).contains("more than once"));
        assertEquals("old", Files.readString(b));
        assertTrue(Files.isSymbolicLink(link));
    }

    @Test
    void testEditThroughLinkChangesTarget() throws Exception {
        Path link = symlinkTo(b, "link.txt");

        TransactionResult result = manager.commitFileEdit(link.toString(), "old", "via link",
                OperationType.EDIT, "edit", "edit through link", session);

        assertTrue(result.isSuccess(), "Errors: " + result.getErrors());
        assertTrue(Files.isSymbolicLink(link), "The link itself must survive the write");
        assertEquals("via link", Files.readString(b));

        UndoHistory history = session.getUndoHistory();
        EditOperation op = assertInstanceOf(EditOperation.class, history.getHistory(1).get(0));
        assertEquals(b.toRealPath().toString(), op.filePath());
        assertEquals(1, history.getUndoCount(b.toString()), "History lookups agree with the lock key");

        HistoryEntry entry = history.undo(link.toString());
        assertNotNull(entry);
        assertTrue(manager.replay(entry, ReplayDirection.UNDO).isSuccess());
        assertEquals("old", Files.readString(b));
        assertTrue(Files.isSymbolicLink(link));
    }

    // ==================== Interruption ====================

    /**
     * Запускает действие в отдельном потоке, пока тест держит блокировку b.txt,
     * дожидается, пока поток встанет в ожидание, и прерывает его.
     */
    private TransactionResult interruptWhileWaitingForB(PathLock locks, Supplier<TransactionResult> action,
                                                        AtomicBoolean interruptedAfter) throws Exception {
        AtomicReference<TransactionResult> outcome = new AtomicReference<>();
        Thread worker;
        try (PathLock.Lease ignored = locks.acquire(b)) {
            worker = new Thread(() -> {
                outcome.set(action.get());
                interruptedAfter.set(Thread.currentThread().isInterrupted());
            });
            worker.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (worker.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(Thread.State.WAITING, worker.getState(), "Worker must block on the held lock");
            worker.interrupt();
            worker.join(5000);
        }
        assertFalse(worker.isAlive());
        return outcome.get();
    }

    @Test
    void testInterruptWhileWaitingForLockFailsWithoutChanges() throws Exception {
        PathLock locks = new PathLock();
        AtomicEditManager locked = new AtomicEditManager(store, locks);
        Transaction txn = locked.createTransaction("blocked");
        txn.addCreate(a.toString(), "hello");
        txn.addEdit(b.toString(), "old", "new");
        AtomicBoolean interrupted = new AtomicBoolean();

        TransactionResult result = interruptWhileWaitingForB(locks, () -> locked.commit(txn, session), interrupted);

        assertFalse(result.isSuccess());
        assertEquals(TransactionState.FAILED, result.getState());
        assertEquals(TransactionState.FAILED, txn.getState());
        assertFalse(result.isRolledBack());
        assertEquals(1, result.getValidationErrors().size());
        assertTrue(result.getValidationErrors().get(0).contains("Interrupted while waiting for a file lock"));
        assertTrue(interrupted.get(), "Interrupt flag must be restored");
        assertFalse(Files.exists(a));
        assertEquals("old", Files.readString(b));
        assertFalse(session.getUndoHistory().canUndo());
        assertTrue(locked.getActiveTransactions().isEmpty());
    }

    @Test
    void testInterruptWhileWaitingForLockDuringReplay() throws Exception {
        PathLock locks = new PathLock();
        AtomicEditManager locked = new AtomicEditManager(store, locks);
        Transaction txn = locked.createTransaction("two files");
        txn.addCreate(a.toString(), "hello");
        txn.addEdit(b.toString(), "old", "new");
        assertTrue(locked.commit(txn, session).isSuccess());
        HistoryEntry entry = session.getUndoHistory().getHistory(1).get(0);
        AtomicBoolean interrupted = new AtomicBoolean();

        TransactionResult result = interruptWhileWaitingForB(locks,
                () -> locked.replay(entry, ReplayDirection.UNDO), interrupted);

        assertEquals(TransactionState.FAILED, result.getState());
        assertTrue(result.getValidationErrors().get(0).contains("Interrupted while waiting for a file lock"));
        assertTrue(interrupted.get());
        assertEquals("hello", Files.readString(a));
        assertEquals("new", Files.readString(b));
        assertTrue(locked.getActiveTransactions().isEmpty());
    }

    @Test
    void testInterruptDuringApplyRollsBack() throws Exception {
        LocalFileStore interrupting = new LocalFileStore(StandardCharsets.UTF_8) {
            @Override
            public void write(Path path, String content) throws IOException {
                if (path.getFileName().toString().equals("b.txt")) {
                    throw new ClosedByInterruptException();
                }
                super.write(path, content);
            }
        };
        AtomicEditManager interruptedManager = new AtomicEditManager(interrupting);
        Transaction txn = interruptedManager.createTransaction("three files");
        txn.addCreate(a.toString(), "hello");
        txn.addEdit(b.toString(), "old", "new");
        txn.addDelete(c.toString(), "bye");

        TransactionResult result = interruptedManager.commit(txn, session);

        assertEquals(TransactionState.ROLLED_BACK, result.getState());
        assertTrue(result.isRolledBack());
        assertTrue(result.getRollbackErrors().isEmpty());
        assertFalse(Files.exists(a));
        assertEquals("old", Files.readString(b));
        assertEquals("bye", Files.readString(c));
        assertFalse(session.getUndoHistory().canUndo());
    }
}
