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
import ru.nts.tools.rms.lint.BlockWalker;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Команда вне своей секции и атрибут вне своего блока.
 */
public final class IncorrectSectionRule implements LintRule {

    public static final String NAME = "incorrect-section";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Commands must appear in their section, attributes inside their parent block";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        BlockWalker.walk(context.script(), (block, scope) -> {
            if (!(block instanceof Block.Command command)) return;
            CommandSpec spec = command.spec();
            if (spec.kind() != CommandKind.COMMAND && spec.kind() != CommandKind.ATTRIBUTE) return;
            Span span = LintContext.headSpan(command);
            String name = command.name().text();

            if (scope.isTopLevel()) {
                if (spec.section() != null) {
                    checkSection(spec, scope.section(), span, diagnostics);
                } else if (!spec.parents().isEmpty()) {
                    diagnostics.add(Diagnostic.error(NAME, span,
                            "Attribute `" + name + "` can only appear inside " + describeParents(spec) + " block"));
                }
                return;
            }
            Block.Command parent = scope.parent();
            if (spec.kind() == CommandKind.COMMAND) {
                diagnostics.add(Diagnostic.error(NAME, span, "Command `" + name + "` cannot appear inside another block"));
            } else if (parent != null && !spec.parents().isEmpty() && !spec.parents().contains(parent.spec().name())) {
                diagnostics.add(Diagnostic.error(NAME, span,
                                "Attribute `" + name + "` is invalid inside `" + parent.name().text()
                                        + "`, it can only appear inside " + describeParents(spec) + " block")
                        .suggest(Suggestion.hint(parent.name().span(), "Block started here")));
            }
        });
        return diagnostics;
    }

    private void checkSection(CommandSpec spec, Block.Section current, Span span, List<Diagnostic> diagnostics) {
        String expected = spec.section();
        if (current == null) {
            diagnostics.add(Diagnostic.error(NAME, span,
                    "Command can only appear in section " + expected + ", but no section has been started."));
            return;
        }
        String actual = current.isKnown() ? current.spec().name() : current.token().text();
        if (!actual.equals(expected)) {
            diagnostics.add(Diagnostic.error(NAME, span,
                            "Command is invalid in section " + actual + ", it can only appear in " + expected)
                    .suggest(Suggestion.hint(current.span(), "Section started here")));
        }
    }

    private static String describeParents(CommandSpec spec) {
        return spec.parents().stream().map(p -> "`" + p + "`").collect(Collectors.joining(" or a "));
    }
}
