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
import ru.nts.tools.rms.grammar.CommandKind;
import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.lint.Fuzzy;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.symbols.BuiltinDefinitions;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Неизвестные имена: команды, секции, аргументы-константы и условия {@code if}.
 *
 * <p>Имена, встроенные под другой целью совместимости, здесь не сообщаются: ими занимается
 * {@link CompatibilityRule}. Исправление опечатки всегда небезопасно, так как меняет смысл карты.
 */
public final class UnknownTokenRule implements LintRule {

    public static final String NAME = "unknown-token";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Reports commands, sections and constants that are never defined";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        SymbolTable symbols = context.symbols();
        Set<String> commandNames = new TreeSet<>();
        Set<String> sectionNames = new TreeSet<>();
        for (CommandSpec spec : context.commands().all()) {
            (spec.kind() == CommandKind.SECTION ? sectionNames : commandNames).add(spec.name());
        }
        Set<String> constNames = symbols.constNames();
        Set<String> conditionNames = symbols.conditionNames();

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Block block : context.script().allBlocks()) {
            if (block instanceof Block.Unknown unknown) {
                Token token = unknown.token();
                if (token.kind() == TokenKind.RND_LITERAL || token.isInteger()) continue;
                diagnostics.add(withGuess(Diagnostic.warning(NAME, token.span(),
                        "Unknown command `" + token.text() + "`"), token, commandNames));
            } else if (block instanceof Block.Section section && !section.isKnown()) {
                Token token = section.token();
                diagnostics.add(withGuess(Diagnostic.warning(NAME, token.span(),
                        "Unknown section `" + token.text() + "`"), token, sectionNames));
            } else if (block instanceof Block.Command command) {
                for (int i = 0; i < command.args().size(); i++) {
                    Token arg = command.args().get(i);
                    if (command.spec().arg(i) != ArgType.TOKEN || !isName(arg)) continue;
                    String name = arg.text();
                    if (symbols.isPossiblyDefined(name) || isBuiltinElsewhere(symbols.builtins(), name)) continue;
                    diagnostics.add(withGuess(Diagnostic.warning(NAME, arg.span(),
                            "Token `" + name + "` is never defined"), arg, constNames));
                }
            } else if (block instanceof Block.Conditional conditional) {
                for (Block.Branch branch : conditional.branches()) {
                    Token guard = branch.guard();
                    if (guard == null || !isName(guard)) continue;
                    String name = guard.text();
                    if (symbols.isPossiblyDefined(name) || isBuiltinElsewhere(symbols.builtins(), name)) continue;
                    diagnostics.add(withGuess(Diagnostic.warning(NAME, guard.span(),
                            "Token `" + name + "` is never defined, this condition will always fail"), guard, conditionNames));
                }
            }
        }
        return diagnostics;
    }

    private static boolean isName(Token token) {
        return token.kind() == TokenKind.WORD && !token.isInteger();
    }

    private static boolean isBuiltinElsewhere(BuiltinDefinitions builtins, String name) {
        return !builtins.constTargets(name).isEmpty() || !builtins.defineTargets(name).isEmpty();
    }

    private static Diagnostic withGuess(Diagnostic diagnostic, Token token, Collection<String> candidates) {
        return Fuzzy.closest(token.text(), candidates)
                .map(guess -> diagnostic.suggest(Suggestion.unsafe(token.span(), "Did you mean `" + guess + "`?", guess)))
                .orElse(diagnostic);
    }
}
