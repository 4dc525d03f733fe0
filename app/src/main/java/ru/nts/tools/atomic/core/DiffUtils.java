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

import java.util.ArrayList;
import java.util.List;

/**
 * Компактный diff для вывода результата правки агенту.
 *
 * <p>Новый файл показывается первыми строками, удаленный - еще короче; для изменений строится
 * построчный diff по LCS, короткие неизмененные участки между правками служат контекстом,
 * длинные опускаются. Вывод обрезается после {@link #MAX_CHANGED_LINES} строк.
 */
public final class DiffUtils {

    static final int MAX_CREATED_LINES = 10;
    static final int MAX_DELETED_LINES = 5;
    static final int MAX_CHANGED_LINES = 15;
    private static final int MAX_CONTEXT_RUN = 2;

    private DiffUtils() {
    }

    /**
     * @return блок ```diff ... ``` или пустая строка, если изменений нет
     */
    public static String getCompactDiff(String oldContent, String newContent) {
        String oldText = oldContent != null ? oldContent : "";
        String newText = newContent != null ? newContent : "";
        if (oldText.equals(newText)) {
            return "";
        }
        if (oldText.isEmpty()) {
            return fence(preview('+', newText, MAX_CREATED_LINES));
        }
        if (newText.isEmpty()) {
            return fence(preview('-', oldText, MAX_DELETED_LINES));
        }

        String[] oldLines = oldText.split("\n", -1);
        String[] newLines = newText.split("\n", -1);
        List<String> out = new ArrayList<>();
        int emitted = 0;
        for (Run run : diffRuns(oldLines, newLines)) {
            if (emitted > MAX_CHANGED_LINES) {
                out.add("  ...    (truncated)");
                break;
            }
            switch (run.type()) {
                case EQUAL -> {
                    if (run.oldEnd() - run.oldStart() <= MAX_CONTEXT_RUN) {
                        for (int i = run.oldStart(); i < run.oldEnd(); i++) {
                            out.add(line(' ', i, oldLines[i]));
                            emitted++;
                        }
                    }
                }
                case DELETE -> {
                    for (int i = run.oldStart(); i < run.oldEnd(); i++) {
                        out.add(line('-', i, oldLines[i]));
                        emitted++;
                    }
                }
                case INSERT -> {
                    for (int j = run.newStart(); j < run.newEnd(); j++) {
                        out.add(line('+', j, newLines[j]));
                        emitted++;
                    }
                }
            }
        }
        return out.isEmpty() ? "" : fence(out);
    }

    private static List<String> preview(char marker, String text, int limit) {
        String[] lines = text.split("\n", -1);
        List<String> out = new ArrayList<>();
        for (int i = 0; i < Math.min(lines.length, limit); i++) {
            out.add(line(marker, i, lines[i]));
        }
        if (lines.length > limit) {
            out.add("  ...    (" + (lines.length - limit) + " more lines)");
        }
        return out;
    }

    private static String line(char marker, int index, String text) {
        return String.format("%c %3d    %s", marker, index + 1, text);
    }

    private static String fence(List<String> lines) {
        return "```diff\n" + String.join("\n", lines) + "\n```";
    }

    /**
     * Разбивает пару текстов на последовательные участки: общие, удаленные и вставленные строки.
     * Удаление внутри замены идет раньше вставки.
     */
    static List<Run> diffRuns(String[] a, String[] b) {
        int[][] lcs = new int[a.length + 1][b.length + 1];
        for (int i = a.length - 1; i >= 0; i--) {
            for (int j = b.length - 1; j >= 0; j--) {
                lcs[i][j] = a[i].equals(b[j]) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<Run> runs = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < a.length || j < b.length) {
            if (i < a.length && j < b.length && a[i].equals(b[j])) {
                int si = i;
                int sj = j;
                while (i < a.length && j < b.length && a[i].equals(b[j])) {
                    i++;
                    j++;
                }
                runs.add(new Run(RunType.EQUAL, si, i, sj, j));
                continue;
            }
            int si = i;
            int sj = j;
            while (i < a.length && (j >= b.length || lcs[i + 1][j] >= lcs[i][j + 1]) && !(j < b.length && a[i].equals(b[j]))) {
                i++;
            }
            if (i > si) {
                runs.add(new Run(RunType.DELETE, si, i, sj, sj));
            }
            while (j < b.length && (i >= a.length || lcs[i][j + 1] > lcs[i + 1][j]) && !(i < a.length && a[i].equals(b[j]))) {
                j++;
            }
            if (j > sj) {
                runs.add(new Run(RunType.INSERT, i, i, sj, j));
            }
        }
        return runs;
    }

    enum RunType {EQUAL, DELETE, INSERT}

    record Run(RunType type, int oldStart, int oldEnd, int newStart, int newEnd) {
    }
}
