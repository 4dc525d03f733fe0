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

import ru.nts.tools.atomic.core.PathLock;
import ru.nts.tools.atomic.core.transaction.OperationType;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * История отмены/повтора одной сессии: два стека записей ({@link EditOperation} или
 * {@link TransactionGroup}), вершина - конец списка.
 *
 * <p>История только выдает записи; применяет их к файлам вызывающий (инструмент undo/redo).
 * Если применение не удалось, вызывающий возвращает запись обратно через
 * {@link #returnToUndoStack}/{@link #returnToRedoStack}.
 *
 * <p>Любая новая запись очищает весь redo-стек: история повтора - одна линейная ветка.
 *
 * <p>Поиск по пути просматривает стек с вершины, O(размер стека); для интерактивной
 * сессии этого достаточно.
 */
public class UndoHistory {

    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("HHmmssSSSSSS");

    private final List<HistoryEntry> undoStack = new ArrayList<>();
    private final List<HistoryEntry> redoStack = new ArrayList<>();
    private final Map<String, TransactionGroup> transactions = new LinkedHashMap<>();
    private final int maxHistorySize;
    private int opCounter;

    public UndoHistory() {
        this(0);
    }

    /**
     * @param maxHistorySize предел записей в undo-стеке (старейшие отбрасываются), 0 - без предела
     */
    public UndoHistory(int maxHistorySize) {
        this.maxHistorySize = Math.max(0, maxHistorySize);
    }

    /**
     * Нормализует путь так же, как он хранится в записях: тем же способом, каким
     * {@link PathLock} вычисляет ключ блокировки, с раскрытием символических ссылок.
     */
    public static String normalizePath(String path) {
        return PathLock.canonicalize(Paths.get(path)).toString();
    }

    private String generateId() {
        opCounter++;
        return "op_" + opCounter + "_" + LocalDateTime.now().format(ID_TIME);
    }

    // ==================== Recording ====================

    public EditOperation recordEdit(String filePath, String beforeContent, String afterContent,
                                    String toolName, String description, String snapshotHash) {
        return recordEdit(filePath, beforeContent, afterContent, OperationType.EDIT, toolName, description, snapshotHash);
    }

    /**
     * Записывает одиночную правку файла и очищает redo-стек.
     */
    public synchronized EditOperation recordEdit(String filePath, String beforeContent, String afterContent,
                                                 OperationType operation, String toolName,
                                                 String description, String snapshotHash) {
        EditOperation op = new EditOperation(
                generateId(),
                normalizePath(filePath),
                beforeContent,
                afterContent,
                LocalDateTime.now(),
                toolName,
                description,
                snapshotHash,
                null,
                operation
        );
        push(op);
        return op;
    }

    /**
     * Записывает зафиксированную транзакцию одной группой и очищает redo-стек.
     *
     * @param transactionId id транзакции; становится id группы
     * @param changes       состояния файлов до/после, по одному на правку, в порядке применения
     */
    public synchronized TransactionGroup recordTransaction(String transactionId, List<FileChange> changes,
                                                           String description, String snapshotHash) {
        LocalDateTime now = LocalDateTime.now();
        List<EditOperation> members = new ArrayList<>(changes.size());
        for (FileChange change : changes) {
            members.add(new EditOperation(
                    generateId(),
                    normalizePath(change.filePath()),
                    change.beforeContent(),
                    change.afterContent(),
                    now,
                    "multifile_edit",
                    description,
                    snapshotHash,
                    transactionId,
                    change.operation()
            ));
        }
        TransactionGroup group = new TransactionGroup(transactionId, members, now, description, snapshotHash);
        transactions.put(group.id(), group);
        push(group);
        return group;
    }

    private void push(HistoryEntry entry) {
        undoStack.add(entry);
        for (HistoryEntry discarded : redoStack) {
            forget(discarded);
        }
        redoStack.clear();
        if (maxHistorySize > 0) {
            while (undoStack.size() > maxHistorySize) {
                forget(undoStack.remove(0));
            }
        }
    }

    private void forget(HistoryEntry entry) {
        if (entry instanceof TransactionGroup group) {
            transactions.remove(group.id(), group);
        }
    }

    // ==================== Undo / Redo ====================

    public boolean canUndo() {
        return canUndo(null);
    }

    public synchronized boolean canUndo(String filePath) {
        return findFromTop(undoStack, filePath) >= 0;
    }

    public boolean canRedo() {
        return canRedo(null);
    }

    public synchronized boolean canRedo(String filePath) {
        return findFromTop(redoStack, filePath) >= 0;
    }

    public HistoryEntry undo() {
        return undo(null);
    }

    /**
     * Переносит запись из undo в redo и возвращает ее (не применяя).
     * С путем - самую свежую запись, затрагивающую файл (не обязательно вершину),
     * без пути - вершину стека.
     *
     * @return запись или null, если подходящей нет
     */
    public synchronized HistoryEntry undo(String filePath) {
        return move(undoStack, redoStack, filePath);
    }

    public HistoryEntry redo() {
        return redo(null);
    }

    /**
     * Зеркально {@link #undo(String)}: переносит запись из redo обратно в undo.
     *
     * @return запись или null, если подходящей нет
     */
    public synchronized HistoryEntry redo(String filePath) {
        return move(redoStack, undoStack, filePath);
    }

    private HistoryEntry move(List<HistoryEntry> from, List<HistoryEntry> to, String filePath) {
        int idx = findFromTop(from, filePath);
        if (idx < 0) {
            return null;
        }
        HistoryEntry entry = from.remove(idx);
        to.add(entry);
        return entry;
    }

    private static int findFromTop(List<HistoryEntry> stack, String filePath) {
        if (filePath == null) {
            return stack.size() - 1;
        }
        String normalized = normalizePath(filePath);
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i).touches(normalized)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Компенсация неудачного undo: запись, выданная {@link #undo}, возвращается на вершину undo-стека.
     */
    public synchronized void returnToUndoStack(HistoryEntry entry) {
        redoStack.remove(entry);
        undoStack.add(entry);
    }

    /**
     * Компенсация неудачного redo: запись, выданная {@link #redo}, возвращается на вершину redo-стека.
     */
    public synchronized void returnToRedoStack(HistoryEntry entry) {
        undoStack.remove(entry);
        redoStack.add(entry);
    }

    // ==================== Queries ====================

    public List<HistoryEntry> getHistory(int limit) {
        return getHistory(null, limit);
    }

    /**
     * Записи undo-стека от самой свежей, с фильтром по файлу, не более limit.
     */
    public synchronized List<HistoryEntry> getHistory(String filePath, int limit) {
        List<HistoryEntry> result = new ArrayList<>();
        String normalized = filePath != null ? normalizePath(filePath) : null;
        for (int i = undoStack.size() - 1; i >= 0 && result.size() < limit; i--) {
            HistoryEntry entry = undoStack.get(i);
            if (normalized == null || entry.touches(normalized)) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Хронологическая история файла. Группы раскрываются в правки этого файла,
     * так что вызывающему не нужно знать о транзакциях.
     */
    public synchronized List<EditOperation> getFileHistory(String filePath) {
        String normalized = normalizePath(filePath);
        List<EditOperation> result = new ArrayList<>();
        for (HistoryEntry entry : undoStack) {
            for (EditOperation edit : entry.edits()) {
                if (edit.filePath().equals(normalized)) {
                    result.add(edit);
                }
            }
        }
        return result;
    }

    public int getUndoCount() {
        return getUndoCount(null);
    }

    /**
     * Число записей undo-стека, затрагивающих файл. Группа считается один раз.
     */
    public synchronized int getUndoCount(String filePath) {
        return count(undoStack, filePath);
    }

    public int getRedoCount() {
        return getRedoCount(null);
    }

    public synchronized int getRedoCount(String filePath) {
        return count(redoStack, filePath);
    }

    private static int count(List<HistoryEntry> stack, String filePath) {
        if (filePath == null) {
            return stack.size();
        }
        String normalized = normalizePath(filePath);
        int n = 0;
        for (HistoryEntry entry : stack) {
            if (entry.touches(normalized)) {
                n++;
            }
        }
        return n;
    }

    /**
     * Группа по id транзакции или null.
     */
    public synchronized TransactionGroup getTransaction(String transactionId) {
        return transactions.get(transactionId);
    }

    public synchronized void clear() {
        undoStack.clear();
        redoStack.clear();
        transactions.clear();
    }

    // ==================== Persistence support ====================

    synchronized List<HistoryEntry> undoStackSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(undoStack));
    }

    synchronized List<HistoryEntry> redoStackSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(redoStack));
    }

    synchronized Map<String, TransactionGroup> transactionsSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(transactions));
    }

    synchronized int getOpCounter() {
        return opCounter;
    }

    /**
     * Восстанавливает состояние из сохраненных стеков. Используется {@link HistoryCodec}.
     */
    synchronized void restore(List<HistoryEntry> undo, List<HistoryEntry> redo,
                              Map<String, TransactionGroup> groups, int counter) {
        undoStack.clear();
        undoStack.addAll(undo);
        redoStack.clear();
        redoStack.addAll(redo);
        transactions.clear();
        transactions.putAll(groups);
        opCounter = counter;
    }
}
