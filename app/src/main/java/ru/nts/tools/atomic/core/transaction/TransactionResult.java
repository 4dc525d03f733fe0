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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Итог одного commit. Неизменяем после построения.
 *
 * <p>Ошибки разделены на три группы, которые вызывающий не должен смешивать:
 * <ul>
 *   <li>validation - транзакция не трогала диск, нужно исправить входные данные;</li>
 *   <li>apply - часть правок не применилась, все примененное откачено
 *       (см. {@link #getRevertedFiles()});</li>
 *   <li>rollback - откат конкретного файла не удался, его состояние на диске неизвестно
 *       (см. {@link #getUnrecoverableFiles()}).</li>
 * </ul>
 */
public class TransactionResult {

    private final boolean success;
    private final String transactionId;
    private final TransactionState state;
    private final boolean rolledBack;
    private final String snapshotHash;
    private final List<String> filesCreated;
    private final List<String> filesModified;
    private final List<String> filesDeleted;
    private final List<String> validationErrors;
    private final List<String> applyErrors;
    private final List<String> rollbackErrors;
    private final List<String> revertedFiles;
    private final List<String> unrecoverableFiles;

    private TransactionResult(Builder builder) {
        this.success = builder.success;
        this.transactionId = builder.transactionId;
        this.state = builder.state;
        this.rolledBack = builder.rolledBack;
        this.snapshotHash = builder.snapshotHash;
        this.filesCreated = freeze(builder.filesCreated);
        this.filesModified = freeze(builder.filesModified);
        this.filesDeleted = freeze(builder.filesDeleted);
        this.validationErrors = freeze(builder.validationErrors);
        this.applyErrors = freeze(builder.applyErrors);
        this.rollbackErrors = freeze(builder.rollbackErrors);
        this.revertedFiles = freeze(builder.revertedFiles);
        this.unrecoverableFiles = freeze(builder.unrecoverableFiles);
    }

    private static List<String> freeze(List<String> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTransactionId() {
        return transactionId;
    }

    /**
     * Конечное состояние транзакции: COMMITTED, ROLLED_BACK или FAILED.
     */
    public TransactionState getState() {
        return state;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public String getSnapshotHash() {
        return snapshotHash;
    }

    public List<String> getFilesCreated() {
        return filesCreated;
    }

    public List<String> getFilesModified() {
        return filesModified;
    }

    public List<String> getFilesDeleted() {
        return filesDeleted;
    }

    /**
     * Все ошибки в порядке возникновения: валидация, применение, откат.
     */
    public List<String> getErrors() {
        List<String> all = new ArrayList<>(validationErrors);
        all.addAll(applyErrors);
        all.addAll(rollbackErrors);
        return Collections.unmodifiableList(all);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }

    public List<String> getApplyErrors() {
        return applyErrors;
    }

    public List<String> getRollbackErrors() {
        return rollbackErrors;
    }

    /**
     * Файлы, успешно возвращенные в исходное состояние при откате.
     */
    public List<String> getRevertedFiles() {
        return revertedFiles;
    }

    /**
     * Файлы, откат которых не удался.
     */
    public List<String> getUnrecoverableFiles() {
        return unrecoverableFiles;
    }

    public int getAffectedCount() {
        return filesCreated.size() + filesModified.size() + filesDeleted.size();
    }

    @Override
    public String toString() {
        return "TransactionResult[" + transactionId + ", " + state
                + (success ? ", success" : ", errors=" + getErrors()) + "]";
    }

    public static Builder builder(String transactionId) {
        return new Builder(transactionId);
    }

    public static class Builder {
        private final String transactionId;
        private boolean success;
        private TransactionState state = TransactionState.FAILED;
        private boolean rolledBack;
        private String snapshotHash;
        private final List<String> filesCreated = new ArrayList<>();
        private final List<String> filesModified = new ArrayList<>();
        private final List<String> filesDeleted = new ArrayList<>();
        private final List<String> validationErrors = new ArrayList<>();
        private final List<String> applyErrors = new ArrayList<>();
        private final List<String> rollbackErrors = new ArrayList<>();
        private final List<String> revertedFiles = new ArrayList<>();
        private final List<String> unrecoverableFiles = new ArrayList<>();

        private Builder(String transactionId) {
            this.transactionId = transactionId;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder state(TransactionState state) {
            this.state = state;
            return this;
        }

        public Builder rolledBack(boolean rolledBack) {
            this.rolledBack = rolledBack;
            return this;
        }

        public Builder snapshotHash(String snapshotHash) {
            this.snapshotHash = snapshotHash;
            return this;
        }

        /**
         * Классифицирует примененную правку по ее виду.
         */
        public Builder applied(FileEdit edit) {
            switch (edit.getOperation()) {
                case CREATE -> filesCreated.add(edit.getPath());
                case EDIT -> filesModified.add(edit.getPath());
                case DELETE -> filesDeleted.add(edit.getPath());
            }
            return this;
        }

        public Builder validationErrors(List<String> errors) {
            this.validationErrors.addAll(errors);
            return this;
        }

        public Builder applyError(String error) {
            this.applyErrors.add(error);
            return this;
        }

        public Builder rollbackError(String path, String error) {
            this.rollbackErrors.add(error);
            this.unrecoverableFiles.add(path);
            return this;
        }

        public Builder reverted(String path) {
            this.revertedFiles.add(path);
            return this;
        }

        public TransactionResult build() {
            return new TransactionResult(this);
        }
    }
}
