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
package ru.nts.tools.atomic.core;

import ru.nts.tools.atomic.core.history.HistoryCodec;
import ru.nts.tools.atomic.core.history.HistoryEntry;
import ru.nts.tools.atomic.core.history.UndoHistory;
import ru.nts.tools.atomic.core.transaction.AtomicEditManager;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.CRC32C;

/**
 * Контекст сессии: настройки, история отмены и менеджер транзакций.
 *
 * Создается явно и передается инструментам; глобального реестра нет,
 * у каждой сессии собственные менеджер и история.
 */
public class SessionContext implements EditSession {

    private final String sessionId;
    private final EditConfig config;
    private final FileStore fileStore;
    private final AtomicEditManager editManager;
    private final AtomicInteger snapshotCounter = new AtomicInteger();
    private final HistoryCodec historyCodec = new HistoryCodec();
    private volatile UndoHistory undoHistory;

    public SessionContext(String sessionId, EditConfig config) {
        this(sessionId, config, new LocalFileStore(config.defaultCharset()));
    }

    /**
     * @param fileStore файловая система, через которую менеджер транзакций меняет файлы
     */
    public SessionContext(String sessionId, EditConfig config, FileStore fileStore) {
        this.sessionId = sessionId == null || sessionId.isBlank() ? "default" : sessionId;
        this.config = config;
        this.undoHistory = new UndoHistory(config.maxHistorySize());
        this.fileStore = fileStore;
        this.editManager = new AtomicEditManager(fileStore);
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    public EditConfig getConfig() {
        return config;
    }

    public Path getProjectRoot() {
        return config.projectRoot();
    }

    public FileStore getFileStore() {
        return fileStore;
    }

    public AtomicEditManager edits() {
        return editManager;
    }

    @Override
    public UndoHistory getUndoHistory() {
        return undoHistory;
    }

    /**
     * Токен вида {@code snap_<session>_<n>_<crc>}, где crc - CRC32C от id записей undo-стека.
     * Два токена с одинаковым crc описывают одну и ту же точку истории.
     */
    @Override
    public String trackSnapshot() {
        CRC32C crc = new CRC32C();
        for (HistoryEntry entry : undoHistory.getHistory(Integer.MAX_VALUE)) {
            crc.update(entry.id().getBytes(StandardCharsets.UTF_8));
        }
        return String.format("snap_%s_%d_%08x", sessionId, snapshotCounter.incrementAndGet(), crc.getValue());
    }

    /**
     * Возвращает путь к директории сессии.
     * Структура: .nts/sessions/{sessionId}/
     */
    public Path getSessionDir() {
        return config.projectRoot().resolve(".nts/sessions/" + sessionId);
    }

    public Path getHistoryFile() {
        return getSessionDir().resolve("history.json");
    }

    /**
     * Сохраняет историю отмены в JSON.
     */
    public void saveHistory(Path file) throws IOException {
        String json = historyCodec.toJsonString(undoHistory);
        FileUtils.safeWrite(file, json, StandardCharsets.UTF_8);
    }

    /**
     * Загружает историю из JSON, заменяя текущую. Отсутствующий файл не меняет историю.
     *
     * @return true, если история загружена
     * @throws NtsException HISTORY_CORRUPTED для поврежденного файла
     */
    public boolean loadHistory(Path file) throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        String json = new String(FileUtils.safeReadAllBytes(file), StandardCharsets.UTF_8);
        try {
            this.undoHistory = historyCodec.fromJsonString(json, config.maxHistorySize());
        } catch (NtsException e) {
            System.err.println("Failed to load history for session " + sessionId + ": " + e.toLogMessage());
            throw new NtsException(e.getCode(), Map.of("reason", e.getContext().getOrDefault("reason", "unknown"),
                    "path", file.toString()), e);
        }
        return true;
    }

    @Override
    public String toString() {
        return "SessionContext[" + sessionId + "]";
    }
}
