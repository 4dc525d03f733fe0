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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Настройки рабочего пространства.
 *
 * @param projectRoot    корень проекта; пути инструментов не могут выходить за его пределы
 * @param maxHistorySize предел записей в undo-стеке, 0 - без ограничения
 * @param defaultCharset кодировка новых файлов
 */
public record EditConfig(Path projectRoot, int maxHistorySize, Charset defaultCharset) {

    public static final String ROOT_ENV = "PROJECT_ROOT";
    public static final String ROOT_PROPERTY = "nts.project.root";
    public static final String HISTORY_ENV = "NTS_MAX_HISTORY";
    public static final String HISTORY_PROPERTY = "nts.history.max";

    public EditConfig {
        if (projectRoot == null) {
            throw new IllegalArgumentException("projectRoot is required");
        }
        if (maxHistorySize < 0) {
            throw new IllegalArgumentException("maxHistorySize must be >= 0: " + maxHistorySize);
        }
        projectRoot = projectRoot.toAbsolutePath().normalize();
        defaultCharset = defaultCharset != null ? defaultCharset : StandardCharsets.UTF_8;
    }

    /**
     * Настройки по умолчанию для указанного корня: история без ограничения, UTF-8.
     */
    public static EditConfig defaults(Path projectRoot) {
        return new EditConfig(projectRoot, 0, StandardCharsets.UTF_8);
    }

    /**
     * Читает настройки из системных свойств, затем из переменных окружения.
     * Без явного корня используется текущая директория.
     */
    public static EditConfig fromEnvironment() {
        String root = firstNonBlank(System.getProperty(ROOT_PROPERTY), System.getenv(ROOT_ENV));
        Path projectRoot;
        if (root != null) {
            projectRoot = Paths.get(root);
            System.err.println("Project root set from configuration: " + projectRoot);
        } else {
            projectRoot = Paths.get(".");
            System.err.println("No " + ROOT_ENV + " found, using CWD as root: " + projectRoot.toAbsolutePath().normalize());
        }

        int maxHistory = 0;
        String history = firstNonBlank(System.getProperty(HISTORY_PROPERTY), System.getenv(HISTORY_ENV));
        if (history != null) {
            try {
                maxHistory = Math.max(0, Integer.parseInt(history.trim()));
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid history limit '" + history + "': " + e.getMessage());
            }
        }
        return new EditConfig(projectRoot, maxHistory, StandardCharsets.UTF_8);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
