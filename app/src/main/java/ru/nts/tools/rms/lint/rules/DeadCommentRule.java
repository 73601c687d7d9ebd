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
import ru.nts.tools.rms.lint.BlockWalker;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Старые версии игры разбирают слова внутри комментариев в группах {@code start_random}.
 */
public final class DeadCommentRule implements LintRule {

    public static final String NAME = "dead-comment";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Comments inside start_random groups may be parsed as code";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        BlockWalker.walk(context.script(), (block, scope) -> {
            if (block instanceof Block.Comment comment && scope.inRandom()) {
                diagnostics.add(Diagnostic.warning(NAME, comment.span(),
                                "Using comments inside `start_random` groups is potentially dangerous.")
                        .suggest(Suggestion.hint(comment.span(),
                                "Only #define constants in the `start_random` group, and then use `if` branches for the actual code.")));
            }
        });
        return diagnostics;
    }
}
