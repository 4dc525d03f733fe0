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

import ru.nts.tools.atomic.core.EditSession;
import ru.nts.tools.atomic.core.FileStore;
import ru.nts.tools.atomic.core.NtsErrorCode;
import ru.nts.tools.atomic.core.NtsException;
import ru.nts.tools.atomic.core.NtsFileException;
import ru.nts.tools.atomic.core.PathLock;
import ru.nts.tools.atomic.core.history.EditOperation;
import ru.nts.tools.atomic.core.history.FileChange;
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.UndoHistory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер атомарных правок: транзакция применяется к файлам целиком или не применяется вовсе.
 *
 * <p>Порядок commit:
 * <ol>
 *   <li>валидация всех правок; при ошибках - FAILED без блокировок и без изменений на диске;</li>
 *   <li>снапшот сессии;</li>
 *   <li>захват блокировок всех путей в отсортированном порядке ({@link PathLock#acquireAll});</li>
 *   <li>применение правок в порядке добавления;</li>
 *   <li>при успехе - запись группы в историю отмены сессии;</li>
 *   <li>при сбое - откат примененных правок в обратном порядке;</li>
 *   <li>освобождение блокировок, транзакция убирается из активных.</li>
 * </ol>
 *
 * <p>Прерывание потока во время ожидания блокировок завершает commit с FAILED: ничего не применено,
 * флаг прерывания восстанавливается. Любое исключение во время применения (включая прерывание,
 * всплывшее как {@link IOException}) запускает откат.
 *
 * <p>Экземпляр принадлежит сессии и создается явно; глобального экземпляра нет.
 */
public class AtomicEditManager {

    private final FileStore fileStore;
    private final PathLock pathLock;
    private final Map<String, Transaction> activeTransactions = new ConcurrentHashMap<>();

    public AtomicEditManager(FileStore fileStore) {
        this(fileStore, new PathLock());
    }

    /**
     * @param pathLock общий набор блокировок; передается явно, если несколько менеджеров
     *                 работают с одним деревом файлов
     */
    public AtomicEditManager(FileStore fileStore, PathLock pathLock) {
        this.fileStore = fileStore;
        this.pathLock = pathLock;
    }

    /**
     * Тело транзакции для {@link #inTransaction}.
     */
    @FunctionalInterface
    public interface TransactionBody {
        void build(Transaction txn) throws IOException;
    }

    /**
     * Способ записи зафиксированной транзакции в историю.
     */
    @FunctionalInterface
    private interface HistoryRecorder {
        void record(Transaction txn, UndoHistory history);
    }

    // ==================== Transaction lifecycle ====================

    public Transaction createTransaction(String description) {
        String id = "txn_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Transaction txn = new Transaction(id, description);
        activeTransactions.put(id, txn);
        return txn;
    }

    /**
     * Проверяет правки транзакции против текущего состояния диска. Ничего не изменяет.
     *
     * @return список ошибок вида "path: message"; пустой список означает, что транзакцию можно применять
     */
    public List<String> validate(Transaction txn) {
        List<String> errors = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (FileEdit edit : txn.getEdits()) {
            try {
                validateEdit(edit, seen);
            } catch (NtsFileException e) {
                edit.setError(e.toEditError());
                errors.add(e.toEditError());
            }
        }
        return errors;
    }

    private void validateEdit(FileEdit edit, Set<Path> seen) {
        Path path = Paths.get(edit.getPath());
        if (!seen.add(PathLock.canonicalize(path))) {
            throw new NtsFileException(NtsErrorCode.DUPLICATE_PATH, edit.getPath());
        }
        switch (edit.getOperation()) {
            case CREATE -> {
                if (fileStore.exists(path)) {
                    throw NtsFileException.alreadyExists(edit.getPath());
                }
                if (!fileStore.canCreateParent(path)) {
                    throw new NtsFileException(NtsErrorCode.PARENT_NOT_CREATABLE, edit.getPath());
                }
            }
            case EDIT, DELETE -> {
                if (!fileStore.exists(path)) {
                    throw NtsFileException.notFound(edit.getPath());
                }
                if (fileStore.isDirectory(path)) {
                    throw new NtsFileException(NtsErrorCode.FILE_IS_DIRECTORY, edit.getPath());
                }
                String current;
                try {
                    current = fileStore.read(path);
                } catch (IOException e) {
                    throw new NtsFileException(NtsErrorCode.FILE_NOT_READABLE, edit.getPath(), e);
                }
                if (!current.equals(edit.getOldContent())) {
                    throw NtsFileException.contentChanged(edit.getPath());
                }
            }
        }
    }

    /**
     * Фиксирует транзакцию. Успешная непустая транзакция попадает в историю сессии одной группой.
     *
     * @param session сессия для снапшота и истории; null - без истории
     * @throws NtsException TRANSACTION_NOT_PENDING при повторном commit
     */
    public TransactionResult commit(Transaction txn, EditSession session) {
        return execute(txn, session, (committed, history) -> {
            List<FileChange> changes = new ArrayList<>();
            for (FileEdit edit : committed.getEdits()) {
                changes.add(new FileChange(edit.getPath(), edit.getOldContent(), edit.getNewContent(), edit.getOperation()));
            }
            String description = committed.getDescription().isBlank()
                    ? "Multi-file edit (" + changes.size() + " files)"
                    : committed.getDescription();
            history.recordTransaction(committed.getId(), changes, description, committed.getSnapshotHash());
        });
    }

    /**
     * Фиксирует правку одного файла тем же конвейером, что и {@link #commit}, но записывает ее
     * в историю одиночной операцией с именем инструмента.
     */
    public TransactionResult commitFileEdit(String path, String oldContent, String newContent, OperationType operation,
                                            String toolName, String description, EditSession session) {
        Transaction txn = createTransaction(description);
        txn.addEdit(path, oldContent, newContent, operation);
        return execute(txn, session, (committed, history) -> {
            FileEdit edit = committed.getEdits().get(0);
            history.recordEdit(edit.getPath(), edit.getOldContent(), edit.getNewContent(), edit.getOperation(),
                    toolName, description, committed.getSnapshotHash());
        });
    }

    /**
     * Создает, заполняет и фиксирует транзакцию за один вызов.
     */
    public TransactionResult atomicEdit(List<EditRequest> requests, EditSession session, String description) {
        Transaction txn = createTransaction(description);
        try {
            for (EditRequest request : requests) {
                txn.addEdit(request.path(), request.oldContent(), request.newContent(), request.operation());
            }
        } catch (RuntimeException e) {
            discard(txn);
            throw e;
        }
        return commit(txn, session);
    }

    /**
     * Выполняет тело в новой транзакции и фиксирует ее.
     * Если тело бросает исключение, транзакция помечается FAILED и отбрасывается без применения.
     *
     * @throws TransactionFailedException если commit завершился неуспешно
     */
    public TransactionResult inTransaction(String description, EditSession session, TransactionBody body) throws IOException {
        Transaction txn = createTransaction(description);
        try {
            body.build(txn);
        } catch (IOException | RuntimeException e) {
            discard(txn);
            throw e;
        }
        TransactionResult result = commit(txn, session);
        if (!result.isSuccess()) {
            throw new TransactionFailedException(result);
        }
        return result;
    }

    /**
     * Id транзакций, созданных, но еще не завершенных.
     */
    public Set<String> getActiveTransactions() {
        return Collections.unmodifiableSet(new TreeSet<>(activeTransactions.keySet()));
    }

    private void discard(Transaction txn) {
        txn.setState(TransactionState.FAILED);
        activeTransactions.remove(txn.getId());
    }

    private TransactionResult execute(Transaction txn, EditSession session, HistoryRecorder recorder) {
        if (!txn.beginCommit()) {
            throw new NtsException(NtsErrorCode.TRANSACTION_NOT_PENDING,
                    Map.of("transaction", txn.getId(), "state", txn.getState().name()));
        }
        TransactionResult.Builder result = TransactionResult.builder(txn.getId());
        try {
            List<String> validationErrors = validate(txn);
            if (!validationErrors.isEmpty()) {
                txn.setState(TransactionState.FAILED);
                return result.state(TransactionState.FAILED).validationErrors(validationErrors).build();
            }

            if (session != null) {
                txn.setSnapshotHash(session.trackSnapshot());
                result.snapshotHash(txn.getSnapshotHash());
            }

            try (PathLock.Lease ignored = pathLock.acquireAll(toPaths(txn.getPaths()))) {
                txn.setState(TransactionState.APPLYING);
                if (applyAll(txn, result) && session != null && !txn.isEmpty()) {
                    recorder.record(txn, session.getUndoHistory());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                txn.setState(TransactionState.FAILED);
                result.state(TransactionState.FAILED)
                        .validationErrors(List.of(txn.getId() + ": " + NtsErrorCode.LOCK_INTERRUPTED.getMessage()));
            }
            return result.build();
        } finally {
            activeTransactions.remove(txn.getId());
        }
    }

    // ==================== Apply / Rollback ====================

    /**
     * Применяет правки по порядку; при первом сбое откатывает уже примененные.
     *
     * @return true, если применены все правки
     */
    private boolean applyAll(Transaction txn, TransactionResult.Builder result) {
        List<FileEdit> applied = new ArrayList<>();
        for (FileEdit edit : txn.getEdits()) {
            try {
                applyEdit(edit);
                edit.markApplied();
                applied.add(edit);
                result.applied(edit);
            } catch (Exception e) {
                NtsFileException failure = NtsFileException.applyFailed(edit.getPath(), e);
                edit.setError(failure.toEditError());
                result.applyError(failure.toEditError());
                System.err.println("Transaction " + txn.getId() + " failed, rolling back "
                        + applied.size() + " applied edit(s): " + failure.toLogMessage());
                rollback(applied, result);
                txn.setState(TransactionState.ROLLED_BACK);
                result.state(TransactionState.ROLLED_BACK).rolledBack(true);
                return false;
            }
        }
        txn.setState(TransactionState.COMMITTED);
        result.success(true).state(TransactionState.COMMITTED);
        return true;
    }

    private void applyEdit(FileEdit edit) throws IOException {
        Path path = Paths.get(edit.getPath());
        switch (edit.getOperation()) {
            case CREATE, EDIT -> fileStore.write(path, edit.getNewContent());
            case DELETE -> fileStore.delete(path);
        }
    }

    /**
     * Откатывает правки в обратном порядке. Сбой отката одного файла не прерывает откат остальных.
     */
    private void rollback(List<FileEdit> applied, TransactionResult.Builder result) {
        for (int i = applied.size() - 1; i >= 0; i--) {
            FileEdit edit = applied.get(i);
            try {
                revertEdit(edit);
                edit.markReverted();
                result.reverted(edit.getPath());
            } catch (Exception e) {
                NtsFileException failure = NtsFileException.rollbackFailed(edit.getPath(), e);
                System.err.println(failure.toLogMessage());
                result.rollbackError(edit.getPath(),
                        "Rollback failed for " + edit.getPath() + ": " + NtsFileException.describe(e));
            }
        }
    }

    private void revertEdit(FileEdit edit) throws IOException {
        Path path = Paths.get(edit.getPath());
        switch (edit.getOperation()) {
            case CREATE -> fileStore.deleteIfExists(path);
            case EDIT, DELETE -> fileStore.write(path, edit.getOldContent());
        }
    }

    // ==================== Undo / Redo replay ====================

    /**
     * Физически применяет отмену или повтор записи истории.
     *
     * <p>Все файлы записи блокируются вместе и восстанавливаются атомарно: при сбое уже
     * восстановленные файлы возвращаются в прежнее состояние. Целевое содержимое берется из
     * записи, текущее читается с диска под блокировкой. История не изменяется: перемещение
     * записи между стеками - забота вызывающего.
     */
    public TransactionResult replay(HistoryEntry entry, ReplayDirection direction) {
        List<EditOperation> members = new ArrayList<>(entry.edits());
        if (direction == ReplayDirection.UNDO) {
            Collections.reverse(members);
        }
        Transaction txn = new Transaction(direction.name().toLowerCase() + "_" + entry.id(),
                direction.label() + ": " + entry.description());
        TransactionResult.Builder result = TransactionResult.builder(txn.getId()).snapshotHash(entry.snapshotHash());
        activeTransactions.put(txn.getId(), txn);
        try (PathLock.Lease ignored = pathLock.acquireAll(toPaths(entry.filePaths()))) {
            List<String> planErrors = new ArrayList<>();
            for (EditOperation op : members) {
                try {
                    planReplay(txn, op, direction);
                } catch (IOException e) {
                    planErrors.add(new NtsFileException(NtsErrorCode.FILE_NOT_READABLE, op.filePath(), e).toEditError());
                }
            }
            if (!planErrors.isEmpty()) {
                txn.setState(TransactionState.FAILED);
                return result.state(TransactionState.FAILED).validationErrors(planErrors).build();
            }
            txn.setState(TransactionState.APPLYING);
            applyAll(txn, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            txn.setState(TransactionState.FAILED);
            result.state(TransactionState.FAILED)
                    .validationErrors(List.of(entry.id() + ": " + NtsErrorCode.LOCK_INTERRUPTED.getMessage()));
        } finally {
            activeTransactions.remove(txn.getId());
        }
        return result.build();
    }

    /**
     * Подбирает правку, приводящую файл из текущего состояния в целевое.
     * Отсутствие файла при целевом "файла нет" - ничего делать не нужно.
     */
    private void planReplay(Transaction txn, EditOperation op, ReplayDirection direction) throws IOException {
        String target = switch (direction) {
            case UNDO -> op.operation() == OperationType.CREATE ? null : op.beforeContent();
            case REDO -> op.operation() == OperationType.DELETE ? null : op.afterContent();
        };
        Path path = Paths.get(op.filePath());
        boolean exists = fileStore.exists(path);
        if (target == null) {
            if (exists) {
                txn.addDelete(op.filePath(), fileStore.read(path));
            }
        } else if (exists) {
            txn.addEdit(op.filePath(), fileStore.read(path), target);
        } else {
            txn.addCreate(op.filePath(), target);
        }
    }

    private static List<Path> toPaths(List<String> paths) {
        List<Path> result = new ArrayList<>(paths.size());
        for (String path : paths) {
            result.add(Paths.get(path));
        }
        return result;
    }
}
