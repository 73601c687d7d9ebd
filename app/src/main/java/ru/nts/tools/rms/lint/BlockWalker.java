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
package ru.nts.tools.rms.lint;

import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Script;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Обходит все блоки документа в порядке следования и сообщает каждому посетителю,
 * в каком окружении находится блок. Обход итеративный.
 */
public final class BlockWalker {

    /**
     * Окружение блока.
     *
     * @param section      последний заголовок секции до блока в тексте ({@code null}, если секций ещё не было)
     * @param parent       команда, в теле которой находится блок ({@code null} на верхнем уровне)
     * @param inBody       блок внутри фигурных скобок, в том числе отдельностоящих
     * @param guards       условия всех охватывающих веток {@code if}/{@code elseif}, от внешней к внутренней
     * @param inConditional блок внутри {@code if}
     * @param inRandom     блок внутри {@code start_random}
     */
    public record Scope(Block.Section section,
                        Block.Command parent,
                        boolean inBody,
                        List<String> guards,
                        boolean inConditional,
                        boolean inRandom) {

        static final Scope TOP = new Scope(null, null, false, List.of(), false, false);

        Scope withSection(Block.Section newSection) {
            return new Scope(newSection, parent, inBody, guards, inConditional, inRandom);
        }

        Scope enterBody(Block.Command newParent) {
            return new Scope(section, newParent, true, guards, inConditional, inRandom);
        }

        Scope enterBranch(String guard) {
            List<String> newGuards = guards;
            if (guard != null) {
                newGuards = new ArrayList<>(guards);
                newGuards.add(guard);
                newGuards = Collections.unmodifiableList(newGuards);
            }
            return new Scope(section, parent, inBody, newGuards, true, inRandom);
        }

        Scope enterRandom() {
            return new Scope(section, parent, inBody, guards, inConditional, true);
        }

        public boolean isTopLevel() {
            return !inBody;
        }
    }

    @FunctionalInterface
    public interface Visitor {
        void visit(Block block, Scope scope);
    }

    private record Item(Block block, Scope scope) {
    }

    private BlockWalker() {}

    public static void walk(Script script, Visitor visitor) {
        Deque<Item> stack = new ArrayDeque<>();
        pushAll(stack, script.blocks(), Scope.TOP);
        Block.Section section = null;
        while (!stack.isEmpty()) {
            Item item = stack.pop();
            Block block = item.block();
            if (block instanceof Block.Section header) {
                section = header;
            }
            Scope scope = item.scope().withSection(section);
            visitor.visit(block, scope);

            if (block instanceof Block.Command command && command.body() != null) {
                stack.push(new Item(command.body(), scope.enterBody(command)));
            } else if (block instanceof Block.Body body) {
                Scope inner = scope.inBody() ? scope : scope.enterBody(null);
                pushAll(stack, body.children(), inner);
            } else if (block instanceof Block.Conditional conditional) {
                List<Block.Branch> branches = conditional.branches();
                for (int i = branches.size() - 1; i >= 0; i--) {
                    Block.Branch branch = branches.get(i);
                    String guard = branch.guard() == null ? null : branch.guard().text();
                    pushAll(stack, branch.children(), scope.enterBranch(guard));
                }
            } else if (block instanceof Block.Random random) {
                List<Block.Branch> branches = random.branches();
                for (int i = branches.size() - 1; i >= 0; i--) {
                    pushAll(stack, branches.get(i).children(), scope.enterRandom());
                }
            }
        }
    }

    private static void pushAll(Deque<Item> stack, List<Block> blocks, Scope scope) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            stack.push(new Item(blocks.get(i), scope));
        }
    }
}
