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

import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;

/**
 * Результат разбора одного документа: текст, токены, структура и структурные ошибки.
 * Неизменяем и безопасен для чтения из нескольких потоков.
 */
public final class Script {

    private final SourceText source;
    private final List<Token> tokens;
    private final List<Block> blocks;
    private final List<Diagnostic> diagnostics;
    private volatile List<Block> flattened;

    public Script(SourceText source, List<Token> tokens, List<Block> blocks, List<Diagnostic> diagnostics) {
        this.source = source;
        this.tokens = List.copyOf(tokens);
        this.blocks = List.copyOf(blocks);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public SourceText source() {
        return source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    /**
     * Блоки верхнего уровня.
     */
    public List<Block> blocks() {
        return blocks;
    }

    /**
     * Все блоки документа в порядке следования, включая вложенные.
     */
    public List<Block> allBlocks() {
        List<Block> result = flattened;
        if (result == null) {
            result = List.copyOf(Block.flatten(blocks));
            flattened = result;
        }
        return result;
    }

    /**
     * Ошибки вложенности, найденные парсером.
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Block> children(Block block) {
        return Block.children(block);
    }
}
