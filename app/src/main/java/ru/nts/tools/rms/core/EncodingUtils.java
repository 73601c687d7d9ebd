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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Определение кодировки и чтение файлов скриптов.
 * Использует UniversalDetector (juniversalchardet). Скрипты карт исторически
 * сохраняются в windows-1252, поэтому при невалидном UTF-8 используется именно она.
 */
public final class EncodingUtils {

    /**
     * Кодировка по умолчанию для скриптов, не являющихся корректным UTF-8.
     */
    public static final Charset LEGACY_CHARSET = Charset.forName("windows-1252");

    private static final int BINARY_CHECK_LIMIT = 8192;

    private EncodingUtils() {}

    /**
     * Результат чтения текстового файла.
     *
     * @param content Содержимое файла без BOM.
     * @param charset Кодировка, использованная для декодирования.
     * @param hasBom  Был ли в начале файла UTF-8 BOM (сохраняется при обратной записи).
     */
    public record TextFileContent(String content, Charset charset, boolean hasBom) {
    }

    /**
     * Считывает файл с автоопределением кодировки.
     *
     * @param path Путь к скрипту.
     * @return Объект {@link TextFileContent}.
     * @throws RmsFileException если файл отсутствует, недоступен или бинарный.
     */
    public static TextFileContent readTextFile(Path path) {
        byte[] allBytes;
        try {
            allBytes = FileUtils.safeReadAllBytes(path);
        } catch (NoSuchFileException e) {
            throw RmsFileException.notFound(path);
        } catch (IOException e) {
            throw RmsFileException.notReadable(path, e);
        }
        return decode(path, allBytes);
    }

    /**
     * Декодирует уже прочитанные байты скрипта.
     */
    public static TextFileContent decode(Path path, byte[] allBytes) {
        boolean bom = hasUtf8Bom(allBytes);
        Charset charset = bom ? StandardCharsets.UTF_8 : detectCharset(allBytes);

        int offset = bom ? 3 : 0;
        int checkLimit = Math.min(allBytes.length, BINARY_CHECK_LIMIT);
        for (int i = offset; i < checkLimit; i++) {
            if (allBytes[i] == 0) {
                throw RmsFileException.binary(path);
            }
        }

        String content = new String(allBytes, offset, allBytes.length - offset, charset);
        return new TextFileContent(content, charset, bom);
    }

    /**
     * Кодирует исправленный текст обратно в исходную кодировку.
     */
    public static byte[] encode(TextFileContent original, String newContent) throws java.nio.charset.CharacterCodingException {
        java.nio.charset.CharsetEncoder encoder = original.charset().newEncoder()
                .onMalformedInput(java.nio.charset.CodingErrorAction.REPORT)
                .onUnmappableCharacter(java.nio.charset.CodingErrorAction.REPORT);
        java.nio.ByteBuffer buffer = encoder.encode(java.nio.CharBuffer.wrap(newContent));

        int prefix = original.hasBom() ? 3 : 0;
        byte[] bytes = new byte[prefix + buffer.remaining()];
        if (original.hasBom()) {
            bytes[0] = (byte) 0xEF;
            bytes[1] = (byte) 0xBB;
            bytes[2] = (byte) 0xBF;
        }
        buffer.get(bytes, prefix, bytes.length - prefix);
        return bytes;
    }

    static Charset detectCharset(byte[] bytes) {
        if (isAscii(bytes)) {
            return StandardCharsets.UTF_8;
        }

        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String encoding = detector.getDetectedCharset();
        detector.reset();

        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                RmsLog.log("Detector returned unsupported charset " + encoding + ", falling back");
            }
        }

        if (encoding == null || charset.equals(StandardCharsets.UTF_8)) {
            return isValidUtf8(bytes) ? StandardCharsets.UTF_8 : LEGACY_CHARSET;
        }
        return charset;
    }

    private static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF;
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if ((b & 0x80) != 0) return false;
        }
        return true;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    private static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue;

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
