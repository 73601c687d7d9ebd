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
import ru.nts.tools.rms.fix.FixPolicy;
import ru.nts.tools.rms.fix.FixResult;
import ru.nts.tools.rms.fix.SuggestionApplier;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintEngine;
import ru.nts.tools.rms.symbols.SymbolResolver;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;

/**
 * Точка входа ядра: проверка ({@link #check}) и исправление ({@link #fix}) текста скрипта.
 *
 * <p>Конвейер: токены, структура, таблица имён, правила, сортировка отчёта.
 * Экземпляр не хранит состояния между вызовами; разные документы можно проверять одновременно.
 */
public final class RmsChecker {

    private final StructureParser parser;
    private final SymbolResolver resolver;
    private final LintEngine engine;

    public RmsChecker(StructureParser parser, SymbolResolver resolver, LintEngine engine) {
        this.parser = parser;
        this.resolver = resolver;
        this.engine = engine;
    }

    public RmsChecker() {
        this(new StructureParser(), new SymbolResolver(), new LintEngine());
    }

    public CheckResult check(String text, CheckOptions options) {
        SourceText source = new SourceText(text);
        Script script = parser.parse(source, options.cancellation());
        SymbolTable symbols = resolver.resolve(script, options.compatibility());
        LintContext context = new LintContext(script, symbols, options.builtinMap());
        List<Diagnostic> diagnostics = engine.run(context, options.cancellation(), options.parallel());
        return new CheckResult(script, symbols, diagnostics);
    }

    /**
     * Проверяет текст и применяет подсказки согласно политике.
     */
    public FixResult fix(String text, CheckOptions options, FixPolicy policy) {
        CheckResult result = check(text, options);
        return SuggestionApplier.apply(text, result.diagnostics(), policy);
    }
}
