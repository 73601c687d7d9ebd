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
package ru.nts.tools.rms.server;

import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Сворачиваемые области по структуре документа: фигурные скобки, ветки {@code if},
 * ветки {@code start_random} и многострочные комментарии.
 */
final class FoldingRanges {

    /**
     * @param startLine первая строка (с единицы)
     * @param endLine   последняя строка (с единицы)
     * @param comment   область является комментарием
     */
    record Range(int startLine, int endLine, boolean comment) {
    }

    private FoldingRanges() {}

    static List<Range> compute(Script script) {
        List<Range> ranges = new ArrayList<>();
        for (Block block : script.allBlocks()) {
            if (block instanceof Block.Body body) {
                add(ranges, body.span(), false);
            } else if (block instanceof Block.Comment comment) {
                add(ranges, comment.span(), true);
            } else if (block instanceof Block.Conditional conditional) {
                addBranches(ranges, conditional.branches(), conditional.end());
            } else if (block instanceof Block.Random random) {
                add(ranges, random.span(), false);
                addBranches(ranges, random.branches(), random.end());
            }
        }
        return ranges;
    }

    /**
     * Ветка сворачивается до строки перед следующей веткой (или перед закрывающим словом).
     */
    private static void addBranches(List<Range> ranges, List<Block.Branch> branches, Token end) {
        for (int i = 0; i < branches.size(); i++) {
            Block.Branch branch = branches.get(i);
            if (branch.keyword() == null) continue;
            int startLine = branch.keyword().span().start().line();
            int endLine;
            if (i + 1 < branches.size() && branches.get(i + 1).keyword() != null) {
                endLine = branches.get(i + 1).keyword().span().start().line() - 1;
            } else if (end != null) {
                endLine = end.span().start().line() - 1;
            } else {
                endLine = branch.span().end().line();
            }
            if (endLine > startLine) {
                ranges.add(new Range(startLine, endLine, false));
            }
        }
    }

    private static void add(List<Range> ranges, Span span, boolean comment) {
        if (span.end().line() > span.start().line()) {
            ranges.add(new Range(span.start().line(), span.end().line(), comment));
        }
    }
}
