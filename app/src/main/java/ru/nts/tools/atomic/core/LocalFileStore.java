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
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileStore} поверх локального диска.
 * Читает с автоопределением кодировки, пишет через Safe Swap, сохраняя кодировку существующего файла.
 * Запись и удаление через символическую ссылку применяются к ее цели.
 */
public class LocalFileStore implements FileStore {

    private final Charset defaultCharset;

    public LocalFileStore(Charset defaultCharset) {
        this.defaultCharset = defaultCharset;
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    @Override
    public boolean canCreateParent(Path path) {
        Path ancestor = path.toAbsolutePath().getParent();
        while (ancestor != null && !Files.exists(ancestor)) {
            ancestor = ancestor.getParent();
        }
        // Ближайший существующий предок должен быть директорией с правом записи
        return ancestor != null && Files.isDirectory(ancestor) && Files.isWritable(ancestor);
    }

    @Override
    public String read(Path path) throws IOException {
        return EncodingUtils.readTextFile(path).content();
    }

    @Override
    public void write(Path path, String content) throws IOException {
        // Safe Swap заменил бы саму ссылку обычным файлом, поэтому пишем в цель
        Path target = PathLock.canonicalize(path);
        Charset charset = defaultCharset;
        if (Files.isRegularFile(target)) {
            charset = EncodingUtils.readTextFile(target).charset();
        }
        FileUtils.safeWrite(target, content, charset);
    }

    @Override
    public void delete(Path path) throws IOException {
        FileUtils.safeDelete(PathLock.canonicalize(path), true);
    }

    @Override
    public void deleteIfExists(Path path) throws IOException {
        FileUtils.safeDelete(PathLock.canonicalize(path), false);
    }
}
