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
package ru.nts.tools.rms.diagnostic;

import ru.nts.tools.rms.text.Span;

/**
 * Предложение по исправлению.
 *
 * @param span        заменяемый диапазон (пустой диапазон означает вставку).
 * @param message     описание для пользователя.
 * @param replacement текст замены; {@code null}, если механического исправления нет.
 * @param safe        можно ли применять без подтверждения пользователя.
 */
public record Suggestion(Span span, String message, String replacement, boolean safe) {

    /**
     * Механически точное исправление.
     */
    public static Suggestion safe(Span span, String message, String replacement) {
        return new Suggestion(span, message, replacement, true);
    }

    /**
     * Эвристическое исправление, применяется только с явного согласия (например нечёткое совпадение имени).
     */
    public static Suggestion unsafe(Span span, String message, String replacement) {
        return new Suggestion(span, message, replacement, false);
    }

    /**
     * Подсказка без замены.
     */
    public static Suggestion hint(Span span, String message) {
        return new Suggestion(span, message, null, false);
    }

    public boolean hasReplacement() {
        return replacement != null && !replacement.isEmpty();
    }
}
