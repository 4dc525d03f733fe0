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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Блокировки по канонизированному пути файла.
 *
 * <p>На один путь в каждый момент приходится не более одной операции; операции над
 * непересекающимися путями идут параллельно. Ожидающие обслуживаются в порядке прихода
 * (справедливый {@link ReentrantLock}).
 *
 * <p>{@link #acquireAll(Collection)} берет набор путей в едином отсортированном порядке:
 * две транзакции с общими файлами не могут удерживать блокировки крест-накрест,
 * поэтому взаимная блокировка исключена без глобального замка и детектора дедлоков.
 *
 * <p>Запись пути удаляется из карты, как только его не держит и не ждет ни один поток.
 */
public class PathLock {

    private final Map<Path, Entry> locks = new HashMap<>();

    /**
     * Захваченная блокировка. Освобождается ровно один раз, повторный close() игнорируется.
     */
    public interface Lease extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    /**
     * Канонизирует путь: абсолютный, нормализованный, с раскрытыми символическими ссылками.
     * Для еще не существующего файла раскрывается ближайший существующий предок, остаток
     * пути дописывается как есть. Так ссылка и ее цель получают один ключ блокировки.
     */
    public static Path canonicalize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        try {
            return existing.toRealPath().resolve(existing.relativize(absolute)).normalize();
        } catch (IOException e) {
            // Путь исчез или недоступен между проверкой и раскрытием
            System.err.println("Cannot resolve real path of " + existing + ": " + e.getMessage());
            return absolute;
        }
    }

    /**
     * Порядок, в котором {@link #acquireAll(Collection)} захватывает пути:
     * канонизированные, без дубликатов, по возрастанию.
     */
    public static List<Path> lockOrder(Collection<Path> paths) {
        TreeSet<Path> sorted = new TreeSet<>();
        for (Path path : paths) {
            sorted.add(canonicalize(path));
        }
        return new ArrayList<>(sorted);
    }

    /**
     * Захватывает блокировку одного пути, дожидаясь завершения предыдущих владельцев.
     *
     * @throws InterruptedException если поток прерван во время ожидания; в этом случае
     *                              ничего не удерживается
     */
    public Lease acquire(Path path) throws InterruptedException {
        Path key = canonicalize(path);
        Entry entry;
        synchronized (locks) {
            entry = locks.computeIfAbsent(key, k -> new Entry());
            entry.users++;
        }
        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(key, entry, false);
            throw e;
        }
        return new Lease() {
            private boolean released;

            @Override
            public void close() {
                if (!released) {
                    released = true;
                    release(key, entry, true);
                }
            }
        };
    }

    /**
     * Захватывает все пути в порядке {@link #lockOrder(Collection)}.
     * Освобождение идет в обратном порядке. При прерывании уже взятые блокировки отпускаются.
     */
    public Lease acquireAll(Collection<Path> paths) throws InterruptedException {
        Deque<Lease> held = new ArrayDeque<>();
        try {
            for (Path path : lockOrder(paths)) {
                held.push(acquire(path));
            }
        } catch (InterruptedException e) {
            releaseAll(held);
            throw e;
        }
        return () -> releaseAll(held);
    }

    private static void releaseAll(Deque<Lease> held) {
        while (!held.isEmpty()) {
            held.pop().close();
        }
    }

    private void release(Path key, Entry entry, boolean locked) {
        if (locked) {
            entry.lock.unlock();
        }
        synchronized (locks) {
            entry.users--;
            if (entry.users == 0) {
                locks.remove(key, entry);
            }
        }
    }

    /**
     * Количество путей, для которых сейчас есть владелец или ожидающие.
     */
    int trackedPaths() {
        synchronized (locks) {
            return locks.size();
        }
    }
}
