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

/**
 * Вид токена. Числа отдельным видом не выделяются: это обычные {@link #WORD},
 * решение «число или нет» принимают правила, которым оно нужно.
 */
public enum TokenKind {
    /** Непрерывная последовательность непробельных символов, кроме фигурных скобок. */
    WORD,
    /** Слово, начинающееся с {@code #}: {@code #const}, {@code #define}, {@code #include}... */
    DIRECTIVE,
    OPEN_BRACE,
    CLOSE_BRACE,
    /** От {@code /*} до первого {@code *}{@code /} или до конца текста. */
    COMMENT,
    /** {@code rnd(a,b)} целиком, включая пробелы внутри {@code rnd (1, 2)}. */
    RND_LITERAL,
    WHITESPACE
}
