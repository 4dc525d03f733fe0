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

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Санитарная проверка путей, приходящих от агента.
 * Все операции ограничиваются корнем проекта из {@link EditConfig}.
 */
public final class PathSanitizer {

    private PathSanitizer() {
    }

    /**
     * Выполняет санитарную проверку и нормализацию пути.
     * Гарантирует, что итоговый абсолютный путь находится строго внутри корня проекта.
     *
     * @param root          Корень "песочницы".
     * @param requestedPath Путь, переданный агентом (абсолютный, относительный или содержащий '..').
     *
     * @return Абсолютный нормализованный объект {@link Path}.
     *
     * @throws IllegalArgumentException Если путь пустой.
     * @throws SecurityException        Если путь ведет за пределы корня.
     */
    public static Path sanitize(Path root, String requestedPath) {
        if (requestedPath == null || requestedPath.isBlank()) {
            throw new IllegalArgumentException("Path is empty");
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        // Предварительная нормализация разделителей для Windows
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);

        Path target;
        if (requested.isAbsolute()) {
            target = requested.normalize();
        } else {
            target = normalizedRoot.resolve(normalizedRequest).toAbsolutePath().normalize();
        }

        // Проверка Path Traversal: итоговый путь обязан начинаться с префикса корня
        if (!target.startsWith(normalizedRoot)) {
            throw new SecurityException("Access denied: path is outside of working directory: "
                    + requestedPath + " (Root: " + normalizedRoot + ")");
        }
        return target;
    }

    /**
     * Путь относительно корня для вывода пользователю; вне корня возвращается как есть.
     */
    public static String relativize(Path root, String absolutePath) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path path = Paths.get(absolutePath);
        if (path.isAbsolute() && path.startsWith(normalizedRoot)) {
            return normalizedRoot.relativize(path).toString().replace('\\', '/');
        }
        return absolutePath;
    }
}
