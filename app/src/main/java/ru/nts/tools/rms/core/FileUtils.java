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
package ru.nts.tools.rms.core;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;

/**
 * Утилиты для безопасной перезаписи скриптов.
 * Перед записью исправленного текста создаётся копия {@code <file>.bak};
 * запись идёт через временный файл и атомарную замену. Повторы обходят блокировки в Windows.
 */
public final class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    private FileUtils() {}

    /**
     * Выполняет IO-операцию с механизмом повторов.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (java.nio.file.NoSuchFileException e) {
                throw e;
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (1L << i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    public static byte[] safeReadAllBytes(Path path) throws IOException {
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    /**
     * Путь резервной копии для скрипта.
     */
    public static Path backupPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".bak");
    }

    /**
     * Записывает новое содержимое скрипта, оставляя резервную копию оригинала.
     *
     * @param path  Путь к скрипту.
     * @param bytes Новое содержимое (уже закодированное).
     * @return путь к резервной копии.
     */
    public static Path writeWithBackup(Path path, byte[] bytes) throws IOException {
        Path backupFile = backupPath(path);
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");

        executeWithRetry(() -> {
            Files.copy(path, backupFile, StandardCopyOption.REPLACE_EXISTING);
            Files.write(tempFile, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (java.nio.file.AtomicMoveNotSupportedException e) {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tempFile);
            }
            return null;
        });
        return backupFile;
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
