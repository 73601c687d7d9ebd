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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteKeepsBackup() throws Exception {
        Path file = tempDir.resolve("map.rms");
        Files.writeString(file, "old");

        Path backup = FileUtils.writeWithBackup(file, "new".getBytes());

        assertEquals(tempDir.resolve("map.rms.bak"), backup);
        assertEquals("old", Files.readString(backup));
        assertEquals("new", Files.readString(file));
        assertFalse(Files.exists(tempDir.resolve("map.rms.tmp")), "Временный файл удаляется");
    }
}
