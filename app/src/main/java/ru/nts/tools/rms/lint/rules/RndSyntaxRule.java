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
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Numbers;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверяет запись {@code rnd(min,max)}: без пробелов, ровно два целых числа.
 */
public final class RndSyntaxRule implements LintRule {

    public static final String NAME = "rnd-syntax";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "rnd(min,max) must not contain whitespace and must have two integer bounds";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : context.script().tokens()) {
            if (token.kind() != TokenKind.RND_LITERAL) continue;
            String text = token.text();
            String compact = Numbers.stripWhitespace(text);
            if (!compact.equals(text) && Numbers.isValidRnd(compact)) {
                diagnostics.add(Diagnostic.error(NAME, token.span(),
                                "Incorrect rnd() call: `" + text + "` must not contain whitespace")
                        .suggest(Suggestion.safe(token.span(), "Remove the whitespace", compact)));
            } else if (!Numbers.isValidRnd(compact)) {
                diagnostics.add(Diagnostic.error(NAME, token.span(),
                        "Incorrect rnd() call: expected rnd(min,max) with two integers, but got `" + text + "`"));
            }
        }
        return diagnostics;
    }
}
