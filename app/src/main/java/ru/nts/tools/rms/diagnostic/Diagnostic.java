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

import java.util.ArrayList;
import java.util.List;

/**
 * Одна найденная проблема.
 *
 * @param severity    важность.
 * @param code        имя правила, породившего диагностику.
 * @param message     текст.
 * @param span        основной диапазон.
 * @param suggestions упорядоченные предложения по исправлению.
 */
public record Diagnostic(Severity severity, String code, String message, Span span, List<Suggestion> suggestions) {

    public Diagnostic {
        suggestions = List.copyOf(suggestions);
    }

    public static Diagnostic error(String code, Span span, String message) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of());
    }

    public static Diagnostic warning(String code, Span span, String message) {
        return new Diagnostic(Severity.WARNING, code, message, span, List.of());
    }

    public Diagnostic suggest(Suggestion suggestion) {
        List<Suggestion> list = new ArrayList<>(suggestions);
        list.add(suggestion);
        return new Diagnostic(severity, code, message, span, list);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Есть ли исправление, которое применит {@code fix} без флага --unsafe.
     */
    public boolean hasSafeFix() {
        return suggestions.stream().anyMatch(s -> s.safe() && s.hasReplacement());
    }
}
