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
package ru.nts.tools.rms.text;

import java.util.Arrays;

/**
 * Исходный текст скрипта с индексом начал строк.
 * Переводит смещения в пары строка/колонка и обратно. Неизменяемый.
 */
public final class SourceText {

    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        this.lineStarts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Позиция для смещения.
     *
     * @throws IllegalArgumentException если смещение вне {@code [0, length]}
     */
    public Position position(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " is outside the text of length " + text.length());
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return new Position(offset, lineIndex + 1, offset - lineStarts[lineIndex] + 1);
    }

    /**
     * @throws IllegalArgumentException если границы вне текста или конец раньше начала
     */
    public Span span(int startOffset, int endOffset) {
        return new Span(position(startOffset), position(endOffset));
    }

    /**
     * Смещение по номеру строки и колонки (обе с 1). Колонка прижимается к концу строки.
     */
    public int offsetOf(int line, int column) {
        if (line < 1) return 0;
        if (line > lineStarts.length) return text.length();
        int lineStart = lineStarts[line - 1];
        int lineEnd = lineEnd(line);
        return Math.min(lineStart + Math.max(column - 1, 0), lineEnd);
    }

    /**
     * Текст строки без перевода строки.
     */
    public String lineText(int line) {
        if (line < 1 || line > lineStarts.length) return "";
        return text.substring(lineStarts[line - 1], lineEnd(line));
    }

    public String slice(Span span) {
        return text.substring(span.startOffset(), span.endOffset());
    }

    public boolean contains(Span span) {
        return span.startOffset() >= 0 && span.endOffset() <= text.length();
    }

    private int lineEnd(int line) {
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > lineStarts[line - 1] && text.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }
}
