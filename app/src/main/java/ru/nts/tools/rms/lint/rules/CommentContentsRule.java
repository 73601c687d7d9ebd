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
import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.lint.BlockWalker;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.Tokenizer;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Игра читает комментарии как обычные слова и пропускает всё до {@code *}{@code /}.
 * Отсюда две ловушки:
 * <ul>
 *   <li>команда внутри комментария, которой не хватило аргументов, «съедает» закрывающий маркер;</li>
 *   <li>в старых версиях имена констант в комментариях внутри {@code if}/{@code start_random}
 *       разбираются как код.</li>
 * </ul>
 */
public final class CommentContentsRule implements LintRule {

    public static final String NAME = "comment-contents";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Detects comment contents that the game may interpret as code";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        SymbolTable symbols = context.symbols();
        CompatibilityTarget target = symbols.target();
        SourceText source = context.source();
        List<Diagnostic> diagnostics = new ArrayList<>();

        BlockWalker.walk(context.script(), (block, scope) -> {
            if (!(block instanceof Block.Comment comment)) return;
            boolean mayBeParsed = scope.inConditional() && !target.isAtLeast(CompatibilityTarget.USERPATCH_15)
                    || scope.inRandom() && !target.isAtLeast(CompatibilityTarget.WOLOLO_KINGDOMS);
            checkComment(context, comment.token(), mayBeParsed, source, diagnostics);
        });
        return diagnostics;
    }

    private void checkComment(LintContext context, Token comment, boolean mayBeParsed,
                              SourceText source, List<Diagnostic> diagnostics) {
        String text = comment.text();
        boolean closed = text.length() >= 4 && text.endsWith("*/");
        String content = text.substring(2, closed ? text.length() - 2 : text.length());
        int base = comment.startOffset() + 2;

        Token pendingCommand = null;
        int missingArgs = 0;
        for (Token word : Tokenizer.tokenize(new SourceText(content))) {
            if (word.isTrivia()) continue;
            CommandSpec spec = word.isWordLike() ? context.commands().lookup(word.text()) : null;
            if (spec != null) {
                pendingCommand = spec.argCount() > 0 ? word : null;
                missingArgs = spec.argCount();
                continue;
            }
            if (missingArgs > 0) {
                missingArgs--;
                if (missingArgs == 0) pendingCommand = null;
                continue;
            }
            if (mayBeParsed && word.isWordLike() && isConstantName(context.symbols(), word.text())) {
                Span span = source.span(base + word.startOffset(), base + word.endOffset());
                diagnostics.add(Diagnostic.warning(NAME, span,
                                "Using constant names in comments inside `start_random` or `if` statements can be dangerous, "
                                        + "because the game may interpret them as other tokens instead.")
                        .suggest(Suggestion.unsafe(span, "Add `backticks` around the name to make the parser ignore it",
                                "`" + word.text() + "`")));
            }
        }

        if (closed && pendingCommand != null) {
            int end = comment.endOffset();
            Span commandSpan = source.span(base + pendingCommand.startOffset(), base + pendingCommand.endOffset());
            diagnostics.add(Diagnostic.warning(NAME, source.span(end - 2, end),
                            "This close comment may be ignored because a previous command is expecting more arguments")
                    .suggest(Suggestion.hint(commandSpan, "Command `" + pendingCommand.text() + "` started here")));
        }
    }

    private static boolean isConstantName(SymbolTable symbols, String name) {
        return symbols.isConst(name) || symbols.isDefine(name);
    }
}
