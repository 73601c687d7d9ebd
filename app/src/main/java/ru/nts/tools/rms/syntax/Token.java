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

import ru.nts.tools.rms.text.Span;

/**
 * Токен исходного текста. Неизменяемый.
 */
public record Token(TokenKind kind, String text, Span span) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isTrivia() {
        return kind == TokenKind.WHITESPACE;
    }

    /**
     * Слово или директива: то, что может быть именем команды или аргументом.
     */
    public boolean isWordLike() {
        return kind == TokenKind.WORD || kind == TokenKind.DIRECTIVE;
    }

    public int startOffset() {
        return span.startOffset();
    }

    public int endOffset() {
        return span.endOffset();
    }

    /**
     * Целое число в диапазоне int, как его принимает игра ({@code 12}, {@code -35}).
     */
    public boolean isInteger() {
        return Numbers.isInteger(text);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.startOffset();
    }
}
