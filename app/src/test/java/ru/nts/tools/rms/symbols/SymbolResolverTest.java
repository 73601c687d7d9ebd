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
package ru.nts.tools.rms.symbols;

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.text.SourceText;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Тесты построения таблицы имён.
 */
class SymbolResolverTest {

    private final StructureParser parser = new StructureParser();
    private final SymbolResolver resolver = new SymbolResolver();

    /**
     * Определения из всех веток объединяются: имя считается определённым, если его задаёт хоть одна ветка.
     */
    @Test
    void testDefinesFromAllBranchesAreMerged() {
        SymbolTable table = resolve("""
                start_random
                  percent_chance 50 #define WATER_MAP
                  percent_chance 50 #define LAND_MAP
                end_random
                if WATER_MAP
                  #const SHORE 5
                else
                  #const SHORE 6
                endif
                """, CompatibilityTarget.ALL);

        assertTrue(table.isDefine("WATER_MAP"));
        assertTrue(table.isDefine("LAND_MAP"));
        assertTrue(table.isConst("SHORE"));
        assertTrue(table.isDefineOnly("WATER_MAP"), "У #define нет значения");
        assertEquals(1, table.userConsts().size(), "Повторное #const одного имени даёт одну запись");
    }

    @Test
    void testFirstDefinitionWins() {
        String text = "#const SIZE 10\n#const SIZE 20\n";
        SymbolTable table = resolve(text, CompatibilityTarget.ALL);
        Symbol symbol = table.userSymbol("SIZE").orElseThrow();
        assertEquals(SymbolKind.CONST, symbol.kind());
        assertEquals(1, symbol.definition().start().line(), "Переход к определению ведёт к первому #const");
        assertEquals(0, symbol.definition().startOffset());
    }

    @Test
    void testUndefineDoesNotRemoveName() {
        SymbolTable table = resolve("#define A\n#undefine A\nif A endif", CompatibilityTarget.ALL);
        assertTrue(table.isDefine("A"));
    }

    @Test
    void testBuiltinVisibilityDependsOnTarget() {
        SymbolTable conquerors = resolve("", CompatibilityTarget.CONQUERORS);
        assertTrue(conquerors.isConst("GRASS"));
        assertFalse(conquerors.isConst("DLC_MOORLAND"), "Константы HD не видны под The Conquerors");

        SymbolTable all = resolve("", CompatibilityTarget.ALL);
        assertTrue(all.isConst("DLC_MOORLAND"), "Под All видна константа любой цели");
    }

    @Test
    void testOptionDefinesAreConditionsOnly() {
        SymbolTable table = resolve("", CompatibilityTarget.CONQUERORS);
        assertTrue(table.isPossiblyDefined("TINY_MAP"));
        assertFalse(table.isConst("TINY_MAP"));
        assertFalse(table.isDefine("REGICIDE"), "Режимы игры определяет только UserPatch");
        assertTrue(resolve("", CompatibilityTarget.USERPATCH_14).isDefine("REGICIDE"));
    }

    @Test
    void testDirectiveOverridesDefaultTarget() {
        SymbolTable table = resolve("/* Compatibility: HD Edition */\ncreate_land {}", CompatibilityTarget.ALL);
        assertEquals(CompatibilityTarget.HD_EDITION, table.target());
        assertTrue(table.directive().isPresent());
    }

    @Test
    void testUnknownDirectiveKeepsDefault() {
        SymbolTable table = resolve("/* Compatibility: Age of Mythology */", CompatibilityTarget.CONQUERORS);
        assertEquals(CompatibilityTarget.CONQUERORS, table.target());
        assertFalse(table.directive().orElseThrow().isRecognized());
    }

    private SymbolTable resolve(String text, CompatibilityTarget target) {
        Script script = parser.parse(new SourceText(text));
        return resolver.resolve(script, target);
    }
}
