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
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;
import ru.nts.tools.rms.text.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Игра разбирает {@code /*} и {@code *}{@code /} как отдельные слова, поэтому вокруг них нужны пробелы.
 */
public final class CommentSyntaxRule implements LintRule {

    public static final String NAME = "comment-syntax";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Comment markers must be separated from the comment text by whitespace";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        SourceText source = context.source();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : context.script().tokens()) {
            if (token.kind() != TokenKind.COMMENT) continue;
            String text = token.text();
            int start = token.startOffset();
            int end = token.endOffset();
            boolean closed = text.length() >= 4 && text.endsWith("*/");

            if (text.length() > 2 && !Character.isWhitespace(text.charAt(2))) {
                diagnostics.add(Diagnostic.error(NAME, source.span(start, start + 2),
                                "Incorrect comment: there must be a space after the opening /*")
                        .suggest(Suggestion.safe(source.span(start + 2, start + 2), "Add a space after the /*", " ")));
            }
            if (!closed) {
                diagnostics.add(Diagnostic.error(NAME, source.span(start, start + 2), "Unclosed comment"));
                continue;
            }
            int beforeClose = text.length() - 3;
            // в "/**/" символ перед */ принадлежит открывающему маркеру
            if (beforeClose >= 2 && !Character.isWhitespace(text.charAt(beforeClose))) {
                diagnostics.add(Diagnostic.warning(NAME, source.span(end - 2, end),
                                "Possibly unclosed comment, */ must be preceded by whitespace")
                        .suggest(Suggestion.safe(source.span(end - 2, end - 2), "Add a space before the */", " ")));
            }
        }
        return diagnostics;
    }
}
