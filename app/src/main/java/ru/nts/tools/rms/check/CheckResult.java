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
package ru.nts.tools.rms.check;

import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;

/**
 * Результат проверки одного документа.
 *
 * @param diagnostics упорядоченный отчёт без дубликатов
 */
public record CheckResult(Script script, SymbolTable symbols, List<Diagnostic> diagnostics) {

    public CheckResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public SourceText source() {
        return script.source();
    }

    /**
     * Цель, под которой фактически выполнена проверка (с учётом директивы в файле).
     */
    public CompatibilityTarget target() {
        return symbols.target();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public long warningCount() {
        return diagnostics.size() - errorCount();
    }

    /**
     * Сколько диагностик можно исправить автоматически безопасными подсказками.
     */
    public long fixableCount() {
        return diagnostics.stream().filter(Diagnostic::hasSafeFix).count();
    }
}
