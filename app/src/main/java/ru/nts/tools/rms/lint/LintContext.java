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
package ru.nts.tools.rms.lint;

import ru.nts.tools.rms.grammar.CommandTable;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

/**
 * Неизменяемые входные данные одного прогона правил.
 *
 * @param builtinMap скрипт является встроенной картой игры, ему разрешены {@code #include}
 */
public record LintContext(Script script, SymbolTable symbols, CommandTable commands, boolean builtinMap) {

    public LintContext(Script script, SymbolTable symbols, boolean builtinMap) {
        this(script, symbols, CommandTable.standard(), builtinMap);
    }

    public CompatibilityTarget target() {
        return symbols.target();
    }

    public SourceText source() {
        return script.source();
    }

    /**
     * Имя команды вместе с аргументами, без тела в скобках.
     */
    public static Span headSpan(Block.Command command) {
        Span span = command.name().span();
        if (!command.args().isEmpty()) {
            span = span.to(command.args().get(command.args().size() - 1).span());
        }
        return span;
    }
}
