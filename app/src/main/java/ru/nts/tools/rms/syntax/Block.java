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

import ru.nts.tools.rms.grammar.CommandSpec;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Узел структуры скрипта.
 *
 * <p>Блоки не копируют текст: они ссылаются на токены единственной последовательности,
 * построенной {@link Tokenizer}. Закрывающие токены могут отсутствовать ({@code null}),
 * если скрипт оборвался раньше, чем блок был закрыт.
 */
public sealed interface Block
        permits Block.Command, Block.Body, Block.Conditional, Block.Random,
                Block.Comment, Block.Section, Block.Unknown {

    /**
     * Полный диапазон блока: от первого до последнего принадлежащего ему токена.
     */
    Span span();

    /**
     * Известная команда или атрибут с аргументами и, возможно, телом в фигурных скобках.
     * Директивы {@code #const}, {@code #define}, {@code #include} тоже представлены так.
     */
    record Command(Token name, CommandSpec spec, List<Token> args, Body body) implements Block {
        public Command {
            args = List.copyOf(args);
        }

        public Command withBody(Body newBody) {
            return new Command(name, spec, args, newBody);
        }

        public boolean hasBody() {
            return body != null;
        }

        /**
         * Аргумент по номеру или {@code null}, если его не было в тексте.
         */
        public Token arg(int index) {
            return index < args.size() ? args.get(index) : null;
        }

        @Override
        public Span span() {
            Span span = name.span();
            if (!args.isEmpty()) span = span.to(args.get(args.size() - 1).span());
            if (body != null) span = span.to(body.span());
            return span;
        }
    }

    /**
     * Содержимое фигурных скобок. Отдельностоящие скобки (без команды перед ними)
     * тоже становятся {@code Body}.
     */
    record Body(Token open, List<Block> children, Token close) implements Block {
        public Body {
            children = List.copyOf(children);
        }

        public boolean isClosed() {
            return close != null;
        }

        @Override
        public Span span() {
            return close == null ? extend(open.span(), children) : open.span().to(close.span());
        }
    }

    /**
     * {@code if ... elseif ... else ... endif}. Первая ветка всегда открыта ключевым словом {@code if}.
     */
    record Conditional(List<Branch> branches, Token end) implements Block {
        public Conditional {
            branches = List.copyOf(branches);
        }

        @Override
        public Span span() {
            Span span = branches.get(0).span();
            for (Branch branch : branches) span = span.to(branch.span());
            return end == null ? span : span.to(end.span());
        }
    }

    /**
     * {@code start_random ... percent_chance N ... end_random}.
     *
     * <p>Команды между {@code start_random} и первым {@code percent_chance} попадают
     * в ведущую ветку без ключевого слова; если там ничего нет, ветки нет.
     */
    record Random(Token start, List<Branch> branches, Token end) implements Block {
        public Random {
            branches = List.copyOf(branches);
        }

        @Override
        public Span span() {
            Span span = start.span();
            for (Branch branch : branches) span = span.to(branch.span());
            return end == null ? span : span.to(end.span());
        }
    }

    /**
     * Ветка условного или случайного блока.
     *
     * @param keyword {@code if}/{@code elseif}/{@code else}/{@code percent_chance};
     *                {@code null} только у ведущей ветки {@code start_random}
     * @param guard   условие ({@code if}/{@code elseif}) или вес ({@code percent_chance}), может отсутствовать
     */
    record Branch(Token keyword, Token guard, List<Block> children) {
        public Branch {
            children = List.copyOf(children);
        }

        public Span span() {
            Span head = keyword != null ? keyword.span() : children.get(0).span();
            if (guard != null) head = head.to(guard.span());
            return extend(head, children);
        }
    }

    record Comment(Token token) implements Block {
        @Override
        public Span span() {
            return token.span();
        }
    }

    /**
     * Заголовок секции {@code <NAME>}. {@code spec} равен {@code null}, если такой секции нет.
     */
    record Section(Token token, CommandSpec spec) implements Block {
        @Override
        public Span span() {
            return token.span();
        }

        public boolean isKnown() {
            return spec != null;
        }
    }

    /**
     * Слово, которое не удалось распознать: неизвестная команда, лишний аргумент, число.
     */
    record Unknown(Token token) implements Block {
        @Override
        public Span span() {
            return token.span();
        }
    }

    private static Span extend(Span head, List<Block> children) {
        Span span = head;
        for (Block child : children) span = span.to(child.span());
        return span;
    }

    /**
     * Разворачивает вложенность в плоский список всех блоков (порядок обхода: сверху вниз, слева направо).
     * Обход итеративный, глубина вложенности не ограничена стеком вызовов.
     */
    static List<Block> flatten(List<Block> roots) {
        List<Block> result = new ArrayList<>();
        ArrayDeque<Block> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
        while (!stack.isEmpty()) {
            Block block = stack.pop();
            result.add(block);
            List<Block> nested = children(block);
            for (int i = nested.size() - 1; i >= 0; i--) stack.push(nested.get(i));
        }
        return result;
    }

    /**
     * Непосредственные дочерние блоки: тело команды, содержимое скобок и всех веток.
     */
    static List<Block> children(Block block) {
        if (block instanceof Command command) {
            return command.body() == null ? List.of() : List.of(command.body());
        }
        if (block instanceof Body body) {
            return body.children();
        }
        if (block instanceof Conditional conditional) {
            return branchChildren(conditional.branches());
        }
        if (block instanceof Random random) {
            return branchChildren(random.branches());
        }
        return List.of();
    }

    private static List<Block> branchChildren(List<Branch> branches) {
        List<Block> all = new ArrayList<>();
        for (Branch branch : branches) all.addAll(branch.children());
        return all;
    }
}
