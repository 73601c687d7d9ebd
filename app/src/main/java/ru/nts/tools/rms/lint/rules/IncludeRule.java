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
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.grammar.Keywords;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code #include} и {@code #include_drs} работают только во встроенных картах игры.
 */
public final class IncludeRule implements LintRule {

    public static final String NAME = "include";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "#include and #include_drs are only available to builtin maps";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        if (context.builtinMap()) {
            return List.of();
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Block block : context.script().allBlocks()) {
            if (!(block instanceof Block.Command command)) continue;
            Span span = LintContext.headSpan(command);
            switch (command.spec().name()) {
                case Keywords.INCLUDE_DRS -> diagnostics.add(
                        Diagnostic.error(NAME, span, "#include_drs can only be used by builtin maps"));
                case Keywords.INCLUDE -> diagnostics.add(
                        Diagnostic.error(NAME, span, "#include can only be used by builtin maps")
                                .suggest(Suggestion.hint(span,
                                        "If you're trying to make a map pack, use a map pack generator instead.")));
                default -> {
                }
            }
        }
        return diagnostics;
    }
}
