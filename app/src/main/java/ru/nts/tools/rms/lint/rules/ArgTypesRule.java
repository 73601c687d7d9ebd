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
import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.grammar.Keywords;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.symbols.SymbolTable;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Numbers;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Проверяет количество и вид аргументов команд, а также допустимые диапазоны значений
 * для команд, где игра их ограничивает.
 */
public final class ArgTypesRule implements LintRule {

    public static final String NAME = "arg-types";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Checks argument count, argument kinds and value ranges";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        SymbolTable symbols = context.symbols();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Block block : context.script().allBlocks()) {
            if (block instanceof Block.Command command) {
                checkCommand(command, symbols, diagnostics);
            } else if (block instanceof Block.Conditional conditional) {
                for (Block.Branch branch : conditional.branches()) {
                    checkCondition(branch, diagnostics);
                }
            } else if (block instanceof Block.Random random) {
                for (Block.Branch branch : random.branches()) {
                    checkChance(branch, symbols, diagnostics);
                }
            }
        }
        return diagnostics;
    }

    private void checkCommand(Block.Command command, SymbolTable symbols, List<Diagnostic> diagnostics) {
        CommandSpec spec = command.spec();
        String name = command.name().text();
        for (int i = 0; i < spec.argCount(); i++) {
            ArgType type = spec.arg(i);
            Token arg = command.arg(i);
            if (arg == null) {
                if (type != ArgType.OPTIONAL_TOKEN) {
                    diagnostics.add(Diagnostic.error(NAME, LintContext.headSpan(command), "Missing arguments to " + name));
                }
                break;
            }
            switch (type) {
                case NUMBER -> checkNumber(name, arg, symbols, diagnostics);
                case WORD -> checkWord(arg, diagnostics);
                case TOKEN, OPTIONAL_TOKEN -> checkToken(arg, symbols, diagnostics);
                case FILENAME -> {
                }
            }
        }

        List<Token> args = command.args();
        switch (spec.name()) {
            case "base_elevation" -> {
                Integer n = intArg(args, 0);
                if (n != null && (n < 0 || n > 7)) {
                    diagnostics.add(Diagnostic.warning(NAME, args.get(0).span(), "Elevation value out of range (0 or 1-7)"));
                }
            }
            case "land_position" -> {
                Integer first = intArg(args, 0);
                if (first != null && (first < 0 || first > 100)) {
                    diagnostics.add(Diagnostic.warning(NAME, args.get(0).span(), "Land position out of range (0-100)"));
                }
                Integer second = intArg(args, 1);
                if (second != null && (second < 0 || second > 99)) {
                    diagnostics.add(Diagnostic.warning(NAME, args.get(1).span(), "Land position out of range (0-99)"));
                }
            }
            case "zone" -> {
                if (!args.isEmpty() && args.get(0).text().equals("99")) {
                    diagnostics.add(Diagnostic.warning(NAME, args.get(0).span(), "`zone 99` crashes the game"));
                }
            }
            case "assign_to" -> checkAssignTo(args, diagnostics);
            default -> {
            }
        }
    }

    private void checkCondition(Block.Branch branch, List<Diagnostic> diagnostics) {
        Token keyword = branch.keyword();
        String name = keyword.text().toLowerCase(Locale.ROOT);
        if (!name.equals(Keywords.IF) && !name.equals(Keywords.ELSEIF)) return;
        if (branch.guard() == null) {
            diagnostics.add(Diagnostic.error(NAME, keyword.span(), "Missing arguments to " + keyword.text()));
        } else {
            unexpectedNumber(branch.guard(), diagnostics);
        }
    }

    private void checkChance(Block.Branch branch, SymbolTable symbols, List<Diagnostic> diagnostics) {
        Token keyword = branch.keyword();
        if (keyword == null) return;
        if (branch.guard() == null) {
            diagnostics.add(Diagnostic.error(NAME, keyword.span(), "Missing arguments to " + keyword.text()));
        } else {
            checkNumber(keyword.text(), branch.guard(), symbols, diagnostics);
        }
    }

    /**
     * Число, корректный {@code rnd(a,b)} или имя {@code #const}.
     */
    private void checkNumber(String command, Token arg, SymbolTable symbols, List<Diagnostic> diagnostics) {
        if (arg.kind() == TokenKind.RND_LITERAL) return;
        String text = arg.text();
        if (Numbers.isInteger(text) || symbols.isConst(text)) return;
        String message = "Expected a number argument to " + command + ", but got " + text;
        if (Numbers.isParenthesizedPair(text)) {
            diagnostics.add(Diagnostic.warning(NAME, arg.span(), message)
                    .suggest(Suggestion.safe(arg.span(), "Did you forget the `rnd`?", "rnd" + text)));
        } else {
            diagnostics.add(Diagnostic.error(NAME, arg.span(), message));
        }
    }

    /**
     * Имя, которое определяет {@code #const}/{@code #define}.
     */
    private void checkWord(Token arg, List<Diagnostic> diagnostics) {
        if (unexpectedNumber(arg, diagnostics)) return;
        String text = arg.text();
        String upper = text.toUpperCase(Locale.ROOT);
        if (!upper.equals(text)) {
            diagnostics.add(Diagnostic.warning(NAME, arg.span(),
                            "Using lowercase for constant names may cause confusion with attribute or command names")
                    .suggest(Suggestion.unsafe(arg.span(), "Use uppercase for constants", upper)));
        }
    }

    private void checkToken(Token arg, SymbolTable symbols, List<Diagnostic> diagnostics) {
        if (unexpectedNumber(arg, diagnostics)) return;
        String text = arg.text();
        if (symbols.isDefineOnly(text)) {
            diagnostics.add(Diagnostic.warning(NAME, arg.span(),
                    "Expected a valued token (defined using #const), got a valueless token `" + text + "` (defined using #define)"));
        }
    }

    private boolean unexpectedNumber(Token arg, List<Diagnostic> diagnostics) {
        if (!arg.isInteger()) return false;
        diagnostics.add(Diagnostic.error(NAME, arg.span(), "Expected a const name, but got a number " + arg.text()));
        return true;
    }

    private void checkAssignTo(List<Token> args, List<Diagnostic> diagnostics) {
        String target = args.isEmpty() ? null : args.get(0).text();
        boolean team = "AT_TEAM".equals(target);
        boolean known = team || "AT_COLOR".equals(target) || "AT_PLAYER".equals(target);
        if (target != null && !known) {
            diagnostics.add(Diagnostic.warning(NAME, args.get(0).span(), "`assign_to` Target must be AT_COLOR, AT_PLAYER, AT_TEAM"));
        }

        Integer number = intArg(args, 1);
        if (known && number != null) {
            if (team && (number < -4 || number > 4) && number != -10) {
                diagnostics.add(Diagnostic.warning(NAME, args.get(1).span(), "`assign_to` Number must be 1-4 when targeting AT_TEAM"));
            } else if (!team && (number < 0 || number > 8)) {
                diagnostics.add(Diagnostic.warning(NAME, args.get(1).span(),
                        "`assign_to` Number must be 1-8 when targeting AT_COLOR or AT_PLAYER"));
            }
        }

        Integer mode = intArg(args, 2);
        if (known && mode != null) {
            if (team && mode != -1 && mode != 0) {
                diagnostics.add(Diagnostic.warning(NAME, args.get(2).span(),
                        "`assign_to` Mode must be 0 (random selection) or -1 (ordered selection) when targeting AT_TEAM"));
            } else if (!team && mode != 0) {
                diagnostics.add(Diagnostic.warning(NAME, args.get(2).span(),
                        "`assign_to` Mode should be 0 when targeting AT_COLOR or AT_PLAYER"));
            }
        }

        Integer flags = intArg(args, 3);
        if (flags != null && (flags & 3) != flags) {
            diagnostics.add(Diagnostic.warning(NAME, args.get(3).span(), "`assign_to` Flags must only combine flags 1 and 2"));
        }
    }

    private static Integer intArg(List<Token> args, int index) {
        return index < args.size() ? Numbers.parseInteger(args.get(index).text()) : null;
    }
}
