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

import ru.nts.tools.atomic.core.history.UndoHistory;

/**
 * Сессия, от имени которой выполняются правки.
 * Поставляет токены снапшотов и владеет единственным экземпляром {@link UndoHistory}.
 */
public interface EditSession {

    String getSessionId();

    /**
     * Фиксирует снапшот рабочего пространства перед изменением.
     *
     * @return непрозрачный токен; ядро его только сохраняет
     */
    String trackSnapshot();

    UndoHistory getUndoHistory();
}
