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

/**
 * Вид операции над файлом внутри транзакции.
 */
public enum OperationType {
    /** Новый файл; на момент валидации файла быть не должно */
    CREATE("create"),
    /** Замена содержимого существующего файла */
    EDIT("edit"),
    /** Удаление существующего файла */
    DELETE("delete");

    private final String wireName;

    OperationType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Имя операции во внешних форматах (параметры инструментов, сохраненная история).
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException для неизвестного имени
     */
    public static OperationType fromWireName(String name) {
        for (OperationType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown operation: '" + name + "'. Expected create, edit or delete.");
    }
}
