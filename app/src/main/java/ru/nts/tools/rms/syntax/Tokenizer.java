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
package ru.nts.tools.rms.syntax;

import ru.nts.tools.rms.text.Position;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Лексический анализатор.
 *
 * <p>Никогда не отбрасывает ввод: пробелы и комментарии тоже становятся токенами, поэтому
 * диапазоны токенов идут подряд без пропусков и склеиваются обратно в исходный текст.
 * Не падает на некорректном вводе: незакрытый комментарий просто доходит до конца текста.
 */
public final class Tokenizer {

    private final String text;

    private int pos;
    private int line = 1;
    private int column = 1;

    public Tokenizer(SourceText source) {
        this.text = source.text();
    }

    public static List<Token> tokenize(SourceText source) {
        return new Tokenizer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;
        line = 1;
        column = 1;
        while (pos < text.length()) {
            tokens.add(next());
        }
        return tokens;
    }

    private Token next() {
        int start = pos;
        Position startPosition = new Position(pos, line, column);
        char c = text.charAt(pos);

        TokenKind kind;
        if (Character.isWhitespace(c)) {
            int end = start;
            while (end < text.length() && Character.isWhitespace(text.charAt(end))) end++;
            kind = TokenKind.WHITESPACE;
            advanceTo(end);
        } else if (c == '{') {
            kind = TokenKind.OPEN_BRACE;
            advanceTo(pos + 1);
        } else if (c == '}') {
            kind = TokenKind.CLOSE_BRACE;
            advanceTo(pos + 1);
        } else if (text.startsWith("/*", pos)) {
            int close = text.indexOf("*/", pos + 2);
            kind = TokenKind.COMMENT;
            advanceTo(close < 0 ? text.length() : close + 2);
        } else {
            int rndEnd = scanRnd(pos);
            if (rndEnd > 0) {
                kind = TokenKind.RND_LITERAL;
                advanceTo(rndEnd);
            } else {
                int end = start;
                while (end < text.length() && !isWordBreak(text.charAt(end))) end++;
                kind = c == '#' ? TokenKind.DIRECTIVE : TokenKind.WORD;
                advanceTo(end);
            }
        }

        Span span = new Span(startPosition, new Position(pos, line, column));
        return new Token(kind, text.substring(start, pos), span);
    }

    /**
     * Ищет {@code rnd}, необязательные пробелы, {@code (}, цифры/знаки/запятые/пробелы и {@code )}.
     *
     * @return смещение сразу после {@code )} или -1.
     */
    private int scanRnd(int start) {
        if (!text.startsWith("rnd", start)) return -1;
        int i = start + 3;
        while (i < text.length() && isInlineSpace(text.charAt(i))) i++;
        if (i >= text.length() || text.charAt(i) != '(') return -1;
        i++;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == ')') return i + 1;
            if (!(Character.isDigit(c) || c == ',' || c == '-' || c == '+' || isInlineSpace(c))) return -1;
            i++;
        }
        return -1;
    }

    private static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isWordBreak(char c) {
        return Character.isWhitespace(c) || c == '{' || c == '}';
    }

    private void advanceTo(int end) {
        for (; pos < end; pos++) {
            if (text.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
    }
}
