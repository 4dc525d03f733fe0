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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Доступ к файловой системе, через который {@code AtomicEditManager} читает и изменяет файлы.
 * Весь контент рассматривается как декодированный текст.
 */
public interface FileStore {

    boolean exists(Path path);

    boolean isDirectory(Path path);

    /**
     * Проверяет, можно ли создать (при необходимости) родительскую директорию файла,
     * не изменяя файловую систему.
     */
    boolean canCreateParent(Path path);

    String read(Path path) throws IOException;

    /**
     * Записывает контент, создавая родительские директории при необходимости.
     */
    void write(Path path, String content) throws IOException;

    /**
     * Удаляет файл. Отсутствие файла - ошибка.
     */
    void delete(Path path) throws IOException;

    /**
     * Удаляет файл, если он существует.
     */
    void deleteIfExists(Path path) throws IOException;
}
