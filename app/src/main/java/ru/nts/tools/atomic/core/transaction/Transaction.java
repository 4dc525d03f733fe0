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

import ru.nts.tools.atomic.core.NtsErrorCode;
import ru.nts.tools.atomic.core.NtsException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Набор операций над файлами, которые применяются вместе или не применяются вовсе.
 *
 * <p>Принадлежит создавшему его вызову: пока транзакция в состоянии PENDING, в нее добавляются
 * правки; после commit ее правки переходят в историю отмены как одна группа, а сам объект
 * больше не используется.
 */
public class Transaction {

    private final String id;
    private final String description;
    private final LocalDateTime createdAt;
    private final List<FileEdit> edits = new ArrayList<>();
    private volatile TransactionState state = TransactionState.PENDING;
    private volatile String snapshotHash;

    public Transaction(String id, String description) {
        this(id, description, LocalDateTime.now());
    }

    public Transaction(String id, String description, LocalDateTime createdAt) {
        this.id = id;
        this.description = description != null ? description : "";
        this.createdAt = createdAt;
    }

    /**
     * Добавляет правку произвольного вида.
     *
     * @throws NtsException TRANSACTION_NOT_PENDING, если commit уже начался
     */
    public synchronized FileEdit addEdit(String path, String oldContent, String newContent, OperationType operation) {
        if (state != TransactionState.PENDING) {
            throw new NtsException(NtsErrorCode.TRANSACTION_NOT_PENDING,
                    Map.of("transaction", id, "state", state.name()));
        }
        FileEdit edit = new FileEdit(path, oldContent, newContent, operation);
        edits.add(edit);
        return edit;
    }

    public FileEdit addEdit(String path, String oldContent, String newContent) {
        return addEdit(path, oldContent, newContent, OperationType.EDIT);
    }

    public FileEdit addCreate(String path, String content) {
        return addEdit(path, "", content, OperationType.CREATE);
    }

    public FileEdit addDelete(String path, String currentContent) {
        return addEdit(path, currentContent, "", OperationType.DELETE);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized List<FileEdit> getEdits() {
        return Collections.unmodifiableList(new ArrayList<>(edits));
    }

    public synchronized List<String> getPaths() {
        List<String> paths = new ArrayList<>(edits.size());
        for (FileEdit edit : edits) {
            paths.add(edit.getPath());
        }
        return paths;
    }

    public boolean isEmpty() {
        return getEdits().isEmpty();
    }

    public TransactionState getState() {
        return state;
    }

    /**
     * Переход состояния. Вызывается менеджером транзакций под монитором транзакции,
     * чтобы addEdit не проскочил между валидацией и применением.
     */
    synchronized void setState(TransactionState state) {
        this.state = state;
    }

    /**
     * Атомарно переводит PENDING → VALIDATING.
     *
     * @return false, если транзакция уже коммитится или завершена
     */
    synchronized boolean beginCommit() {
        if (state != TransactionState.PENDING) {
            return false;
        }
        state = TransactionState.VALIDATING;
        return true;
    }

    public String getSnapshotHash() {
        return snapshotHash;
    }

    void setSnapshotHash(String snapshotHash) {
        this.snapshotHash = snapshotHash;
    }

    @Override
    public String toString() {
        return "Transaction[" + id + ", " + state + ", " + getEdits().size() + " edits]";
    }
}
