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
import ru.nts.tools.rms.grammar.ArgType;
import ru.nts.tools.rms.grammar.Availability;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.lint.BlockWalker;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.symbols.BuiltinDefinitions;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Команды и встроенные константы, которых нет в активной цели совместимости.
 * Под целью {@code all} сообщается всё, что недоступно хотя бы в одной цели.
 *
 * <p>Команда внутри ветки {@code if UP_EXTENSION} (или {@code if UP_AVAILABLE}) считается защищённой.
 */
public final class CompatibilityRule implements LintRule {

    public static final String NAME = "compatibility";

    private static final String UP_AVAILABLE = "UP_AVAILABLE";
    private static final String UP_EXTENSION = "UP_EXTENSION";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Reports commands and constants unavailable in the selected game version";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        SymbolTable symbols = context.symbols();
        CompatibilityTarget target = symbols.target();
        List<Diagnostic> diagnostics = new ArrayList<>();

        symbols.directive().filter(d -> !d.isRecognized()).ifPresent(directive ->
                diagnostics.add(Diagnostic.warning(NAME, directive.span(),
                                "Unknown compatibility target `" + directive.value() + "`, the directive is ignored")
                        .suggest(Suggestion.hint(directive.span(),
                                "Expected one of: " + CompatibilityTarget.knownNames()))));

        BlockWalker.walk(context.script(), (block, scope) -> {
            if (!(block instanceof Block.Command command)) return;
            Availability availability = command.spec().availability();
            if (availability != null && !availability.targets().isEmpty()
                    && !availability.supports(target)
                    && !isGuarded(scope.guards(), availability.guard())) {
                Diagnostic diagnostic = Diagnostic.warning(NAME, command.name().span(), availability.message());
                if (availability.hint() != null) {
                    diagnostic = diagnostic.suggest(Suggestion.hint(command.name().span(), availability.hint()));
                }
                diagnostics.add(diagnostic);
            }
            for (int i = 0; i < command.args().size(); i++) {
                if (command.spec().arg(i) != ArgType.TOKEN) continue;
                checkConstant(command.args().get(i), symbols, scope.guards(), diagnostics);
            }
        });
        return diagnostics;
    }

    private void checkConstant(Token arg, SymbolTable symbols, List<String> guards, List<Diagnostic> diagnostics) {
        if (arg.kind() != TokenKind.WORD) return;
        String name = arg.text();
        BuiltinDefinitions builtins = symbols.builtins();
        CompatibilityTarget target = symbols.target();
        if (symbols.isUserDefined(name) || !builtins.isBuiltinConst(name)) return;
        if (builtins.isConstAvailable(name, target)) return;
        Set<CompatibilityTarget> targets = builtins.constTargets(name);
        if (guards.contains(UP_EXTENSION) && targets.contains(CompatibilityTarget.USERPATCH_15)) return;

        String where = target == CompatibilityTarget.ALL ? "every game version" : target.displayName();
        String message = "`" + name + "` is not available in " + where
                + ", it is only defined in " + CompatibilityTarget.describe(targets);
        CompatibilityTarget suggested = targets.stream().findFirst().orElse(CompatibilityTarget.DEFINITIVE_EDITION);
        diagnostics.add(Diagnostic.warning(NAME, arg.span(), message)
                .suggest(Suggestion.hint(arg.span(),
                        "Add a /* Compatibility: " + suggested.displayName() + " */ comment at the top of the file")));
    }

    /**
     * UserPatch 1.5 подразумевает UserPatch 1.4, поэтому {@code UP_EXTENSION} защищает и команды под {@code UP_AVAILABLE}.
     */
    private static boolean isGuarded(List<String> guards, String required) {
        if (required == null) return false;
        if (guards.contains(required)) return true;
        return UP_AVAILABLE.equals(required) && guards.contains(UP_EXTENSION);
    }
}
