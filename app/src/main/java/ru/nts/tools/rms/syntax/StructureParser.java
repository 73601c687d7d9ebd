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
package ru.nts.tools.rms.syntax;

import ru.nts.tools.rms.core.CancellationToken;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.grammar.CommandKind;
import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.grammar.CommandTable;
import ru.nts.tools.rms.grammar.Keywords;
import ru.nts.tools.rms.text.SourceText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Структурный парсер: строит дерево блоков из плоской последовательности токенов.
 *
 * <p>Рекурсии нет: вложенность хранится в явном стеке фреймов, поэтому произвольно глубокий
 * или испорченный ввод не исчерпывает стек вызовов. Разбор всегда доходит до конца:
 * лишний закрывающий токен даёт ошибку и игнорируется, незакрытые фреймы в конце текста
 * дают по одной ошибке на фрейм, начиная с самого вложенного.
 *
 * <p>Экземпляр не хранит состояния между вызовами и может использоваться из нескольких потоков.
 */
public final class StructureParser {

    /** Код структурных ошибок в отчёте. */
    public static final String CODE = "structure";

    private final CommandTable table;

    public StructureParser(CommandTable table) {
        this.table = table;
    }

    public StructureParser() {
        this(CommandTable.standard());
    }

    public Script parse(SourceText source) {
        return parse(source, CancellationToken.NONE);
    }

    /**
     * @throws java.util.concurrent.CancellationException если токен отменён во время разбора
     */
    public Script parse(SourceText source, CancellationToken cancellation) {
        List<Token> tokens = Tokenizer.tokenize(source);
        Run run = new Run(tokens, cancellation);
        List<Block> blocks = run.parse();
        return new Script(source, tokens, blocks, run.diagnostics);
    }

    private enum FrameKind {
        TOP("top level"),
        CONDITIONAL(Keywords.IF),
        RANDOM(Keywords.START_RANDOM),
        BODY(Keywords.OPEN_BRACE);

        private final String opener;

        FrameKind(String opener) {
            this.opener = opener;
        }
    }

    /**
     * Открытый уровень вложенности.
     */
    private static final class Frame {
        final FrameKind kind;
        final Token opener;
        List<Block> children = new ArrayList<>();

        // CONDITIONAL / RANDOM: завершённые ветки и заголовок текущей
        final List<Block.Branch> branches = new ArrayList<>();
        Token branchKeyword;
        Token branchGuard;
        boolean sawElse;

        // BODY: куда вернуть результат
        List<Block> parentList;
        int commandIndex = -1;

        Frame(FrameKind kind, Token opener) {
            this.kind = kind;
            this.opener = opener;
        }
    }

    /**
     * Состояние одного прохода.
     */
    private final class Run {
        private final List<Token> tokens;
        private final CancellationToken cancellation;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        Run(List<Token> tokens, CancellationToken cancellation) {
            this.tokens = tokens;
            this.cancellation = cancellation;
        }

        List<Block> parse() {
            Frame root = new Frame(FrameKind.TOP, null);
            stack.push(root);
            for (int i = 0; i < tokens.size(); i++) {
                cancellation.throwIfCancelled();
                Token token = tokens.get(i);
                switch (token.kind()) {
                    case WHITESPACE -> {
                    }
                    case COMMENT -> current().add(new Block.Comment(token));
                    case OPEN_BRACE -> openBody(token);
                    case CLOSE_BRACE -> close(token, FrameKind.BODY, Keywords.CLOSE_BRACE);
                    case RND_LITERAL -> current().add(new Block.Unknown(token));
                    case WORD, DIRECTIVE -> i = word(i);
                }
            }
            while (stack.size() > 1) {
                Frame frame = stack.pop();
                diagnostics.add(unclosed(frame));
                finish(frame, null);
            }
            return root.children;
        }

        private List<Block> current() {
            return stack.peek().children;
        }

        /**
         * Обрабатывает слово с индексом {@code i}.
         *
         * @return индекс последнего поглощённого токена
         */
        private int word(int i) {
            Token token = tokens.get(i);
            String text = token.text();
            if (isSectionLike(text)) {
                CommandSpec spec = table.lookup(text);
                current().add(new Block.Section(token, spec != null && spec.kind() == CommandKind.SECTION ? spec : null));
                return i;
            }
            CommandSpec spec = table.lookup(text);
            if (spec == null) {
                current().add(new Block.Unknown(token));
                return i;
            }
            switch (spec.name()) {
                case Keywords.IF -> {
                    int guard = nextArgument(i);
                    Frame frame = new Frame(FrameKind.CONDITIONAL, token);
                    frame.branchKeyword = token;
                    frame.branchGuard = guard < 0 ? null : tokens.get(guard);
                    stack.push(frame);
                    return Math.max(i, guard);
                }
                case Keywords.ELSEIF, Keywords.ELSE -> {
                    boolean isElse = spec.name().equals(Keywords.ELSE);
                    int guard = isElse ? -1 : nextArgument(i);
                    Frame top = stack.peek();
                    if (top.kind != FrameKind.CONDITIONAL || top.sawElse) {
                        diagnostics.add(unbalanced(token, top));
                    } else {
                        finishBranch(top);
                        top.branchKeyword = token;
                        top.branchGuard = guard < 0 ? null : tokens.get(guard);
                        top.sawElse = isElse;
                    }
                    return Math.max(i, guard);
                }
                case Keywords.ENDIF -> {
                    close(token, FrameKind.CONDITIONAL, Keywords.ENDIF);
                    return i;
                }
                case Keywords.START_RANDOM -> {
                    stack.push(new Frame(FrameKind.RANDOM, token));
                    return i;
                }
                case Keywords.PERCENT_CHANCE -> {
                    int value = nextArgument(i);
                    Frame top = stack.peek();
                    if (top.kind != FrameKind.RANDOM) {
                        diagnostics.add(unbalanced(token, top));
                    } else {
                        finishBranch(top);
                        top.branchKeyword = token;
                        top.branchGuard = value < 0 ? null : tokens.get(value);
                    }
                    return Math.max(i, value);
                }
                case Keywords.END_RANDOM -> {
                    close(token, FrameKind.RANDOM, Keywords.END_RANDOM);
                    return i;
                }
                default -> {
                    return command(i, token, spec);
                }
            }
        }

        private int command(int i, Token name, CommandSpec spec) {
            List<Token> args = new ArrayList<>(spec.argCount());
            int last = i;
            for (int n = 0; n < spec.argCount(); n++) {
                int next = nextArgument(last);
                if (next < 0) break;
                args.add(tokens.get(next));
                last = next;
            }
            current().add(new Block.Command(name, spec, args, null));
            return last;
        }

        /**
         * Индекс следующего токена, пригодного в качестве аргумента, или -1.
         * Скобки, комментарии, директивы и известные команды аргументами не бывают.
         */
        private int nextArgument(int after) {
            int j = after + 1;
            while (j < tokens.size() && tokens.get(j).isTrivia()) j++;
            if (j >= tokens.size()) return -1;
            Token candidate = tokens.get(j);
            if (candidate.kind() == TokenKind.RND_LITERAL) return j;
            if (candidate.kind() != TokenKind.WORD) return -1;
            if (table.isKnown(candidate.text()) || isSectionLike(candidate.text())) return -1;
            return j;
        }

        private void openBody(Token open) {
            Frame frame = new Frame(FrameKind.BODY, open);
            List<Block> parent = current();
            frame.parentList = parent;
            for (int k = parent.size() - 1; k >= 0; k--) {
                Block previous = parent.get(k);
                if (previous instanceof Block.Comment) continue;
                if (previous instanceof Block.Command command && !command.hasBody() && !command.spec().isFlow()) {
                    frame.commandIndex = k;
                }
                break;
            }
            stack.push(frame);
        }

        /**
         * Закрывает ближайший фрейм нужного вида. Фреймы над ним считаются незакрытыми.
         * Если такого фрейма нет, токен игнорируется.
         */
        private void close(Token token, FrameKind kind, String name) {
            int depth = 0;
            boolean found = false;
            for (Iterator<Frame> it = stack.iterator(); it.hasNext(); depth++) {
                if (it.next().kind == kind) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                diagnostics.add(unbalanced(token, stack.peek()));
                return;
            }
            for (int k = 0; k < depth; k++) {
                Frame frame = stack.pop();
                diagnostics.add(unclosed(frame));
                finish(frame, null);
            }
            finish(stack.pop(), token);
        }

        private void finish(Frame frame, Token close) {
            switch (frame.kind) {
                case BODY -> {
                    Block.Body body = new Block.Body(frame.opener, frame.children, close);
                    if (frame.commandIndex >= 0) {
                        Block.Command command = (Block.Command) frame.parentList.get(frame.commandIndex);
                        frame.parentList.set(frame.commandIndex, command.withBody(body));
                    } else {
                        frame.parentList.add(body);
                    }
                }
                case CONDITIONAL -> {
                    finishBranch(frame);
                    current().add(new Block.Conditional(frame.branches, close));
                }
                case RANDOM -> {
                    finishBranch(frame);
                    current().add(new Block.Random(frame.opener, frame.branches, close));
                }
                case TOP -> throw new IllegalStateException("Top frame is never closed");
            }
        }

        private void finishBranch(Frame frame) {
            if (frame.branchKeyword != null || !frame.children.isEmpty()) {
                frame.branches.add(new Block.Branch(frame.branchKeyword, frame.branchGuard, frame.children));
            }
            frame.children = new ArrayList<>();
            frame.branchKeyword = null;
            frame.branchGuard = null;
        }

        private Diagnostic unclosed(Frame frame) {
            return Diagnostic.error(CODE, frame.opener.span(), "Unclosed `" + frame.kind.opener + "`");
        }

        private Diagnostic unbalanced(Token token, Frame innermost) {
            String message = "Unbalanced `" + token.text().toLowerCase(Locale.ROOT) + "`";
            if (innermost == null || innermost.kind == FrameKind.TOP) {
                return Diagnostic.error(CODE, token.span(), message + ", nothing is open");
            }
            String keyword = innermost.branchKeyword != null
                    ? innermost.branchKeyword.text()
                    : innermost.opener.text();
            Token matched = innermost.branchKeyword != null ? innermost.branchKeyword : innermost.opener;
            return Diagnostic.error(CODE, token.span(), message)
                    .suggest(Suggestion.hint(matched.span(), "Matches this `" + keyword + "`"));
        }
    }

    static boolean isSectionLike(String text) {
        return text.length() > 2 && text.charAt(0) == '<' && text.charAt(text.length() - 1) == '>';
    }
}
