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
package ru.nts.tools.rms.lint.rules;

import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.symbols.SymbolResolver;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Запуск одного правила на тексте скрипта.
 */
final class RuleFixture {

    private static final StructureParser PARSER = new StructureParser();
    private static final SymbolResolver RESOLVER = new SymbolResolver();

    private RuleFixture() {}

    static List<Diagnostic> run(LintRule rule, String text) {
        return run(rule, text, CompatibilityTarget.ALL, false);
    }

    static List<Diagnostic> run(LintRule rule, String text, CompatibilityTarget target) {
        return run(rule, text, target, false);
    }

    static List<Diagnostic> run(LintRule rule, String text, CompatibilityTarget target, boolean builtinMap) {
        Script script = PARSER.parse(new SourceText(text));
        SymbolTable symbols = RESOLVER.resolve(script, target);
        return rule.check(new LintContext(script, symbols, builtinMap));
    }

    static List<String> messages(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::message).collect(Collectors.toList());
    }

    /**
     * Текст, покрытый диапазоном диагностики.
     */
    static String covered(String text, Diagnostic diagnostic) {
        return text.substring(diagnostic.span().startOffset(), diagnostic.span().endOffset());
    }
}
