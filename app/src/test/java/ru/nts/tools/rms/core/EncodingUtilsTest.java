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

import java.nio.charset.Charset;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Чтение скриптов в разных кодировках и обратная запись без потери исходной кодировки.
 */
class EncodingUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testAsciiIsUtf8() throws Exception {
        Path file = tempDir.resolve("plain.rms");
        Files.writeString(file, "<PLAYER_SETUP>\nrandom_placement\n");
        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);
        assertEquals(StandardCharsets.UTF_8, content.charset());
        assertFalse(content.hasBom());
    }

    @Test
    void testBomIsStrippedAndRestored() throws Exception {
        Path file = tempDir.resolve("bom.rms");
        byte[] body = "/* Карта */\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);
        Files.write(file, bytes);

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);
        assertTrue(content.hasBom());
        assertEquals("/* Карта */\n", content.content(), "BOM не должен попадать в текст");
        assertArrayEquals(bytes, EncodingUtils.encode(content, content.content()), "BOM восстанавливается при записи");
    }

    /**
     * Старые скрипты сохранены в однобайтовой кодировке Windows.
     */
    @Test
    void testLegacyEncodingRoundTrip() throws Exception {
        Path file = tempDir.resolve("legacy.rms");
        Charset legacy = EncodingUtils.LEGACY_CHARSET;
        String text = "/* Carte créée par André, très jolie */\n<PLAYER_SETUP>\nrandom_placement\n";
        Files.write(file, text.getBytes(legacy));

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);
        assertFalse(content.charset().equals(StandardCharsets.UTF_8), "Некорректный UTF-8 не читается как UTF-8");
        assertTrue(content.content().contains("<PLAYER_SETUP>\nrandom_placement"));
        assertArrayEquals(text.getBytes(legacy), EncodingUtils.encode(content, content.content()));
    }

    @Test
    void testUnmappableCharacter() {
        EncodingUtils.TextFileContent content = new EncodingUtils.TextFileContent("x", StandardCharsets.US_ASCII, false);
        assertThrows(CharacterCodingException.class, () -> EncodingUtils.encode(content, "Карта"));
    }

    @Test
    void testBinaryFileRejected() throws Exception {
        Path file = tempDir.resolve("map.zip");
        Files.write(file, new byte[]{'P', 'K', 3, 4, 0, 0, 1});
        RmsFileException e = assertThrows(RmsFileException.class, () -> EncodingUtils.readTextFile(file));
        assertEquals(RmsErrorCode.FILE_IS_BINARY, e.getCode());
    }

    @Test
    void testMissingFile() {
        RmsFileException e = assertThrows(RmsFileException.class,
                () -> EncodingUtils.readTextFile(tempDir.resolve("missing.rms")));
        assertEquals(RmsErrorCode.FILE_NOT_FOUND, e.getCode());
        assertTrue(e.toUserMessage().contains("[ERROR: FILE_NOT_FOUND]"));
    }
}
