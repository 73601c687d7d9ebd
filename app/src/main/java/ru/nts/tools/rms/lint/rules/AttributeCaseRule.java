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
import ru.nts.tools.rms.grammar.CommandKind;
import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Игра различает регистр: {@code Create_Land} для неё неизвестное слово,
 * хотя парсер проверки распознаёт его без учёта регистра.
 */
public final class AttributeCaseRule implements LintRule {

    public static final String NAME = "attribute-case";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Commands, keywords and sections must be written in their exact case";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : context.script().tokens()) {
            if (!token.isWordLike()) continue;
            CommandSpec spec = context.commands().lookup(token.text());
            if (spec == null || spec.name().equals(token.text())) continue;
            boolean section = spec.kind() == CommandKind.SECTION;
            String message = section
                    ? "Unknown section `" + token.text() + "`"
                    : "Unknown attribute `" + token.text() + "`";
            diagnostics.add(Diagnostic.error(NAME, token.span(), message)
                    .suggest(Suggestion.safe(token.span(), section ? "Convert to uppercase" : "Convert to lowercase", spec.name())));
        }
        return diagnostics;
    }
}
