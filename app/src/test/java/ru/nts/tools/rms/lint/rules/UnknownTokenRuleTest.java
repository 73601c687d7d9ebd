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

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.grammar.CompatibilityTarget;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Неизвестные имена и подсказки похожих.
 */
class UnknownTokenRuleTest {

    private final UnknownTokenRule rule = new UnknownTokenRule();

    @Test
    void testMisspelledConstant() {
        String text = "<OBJECTS_GENERATION>\ncreate_object SIEGE_WORSHOP {\n  number_of_objects 1\n}";
        List<Diagnostic> diagnostics = RuleFixture.run(rule, text);
        assertEquals(1, diagnostics.size());
        Diagnostic diagnostic = diagnostics.get(0);
        assertEquals("Token `SIEGE_WORSHOP` is never defined", diagnostic.message());
        Suggestion guess = diagnostic.suggestions().get(0);
        assertEquals("SIEGE_WORKSHOP", guess.replacement());
        assertFalse(guess.safe(), "Исправление опечатки меняет смысл карты");
    }

    @Test
    void testMisspelledAttribute() {
        String text = "<OBJECTS_GENERATION>\ncreate_object GOLD {\n  group_varience 5\n}";
        List<Diagnostic> diagnostics = RuleFixture.run(rule, text);
        assertEquals(1, diagnostics.size(), "Число после неизвестного слова не сообщается отдельно");
        assertEquals("Unknown command `group_varience`", diagnostics.get(0).message());
        assertEquals("group_variance", diagnostics.get(0).suggestions().get(0).replacement());
    }

    @Test
    void testUnknownSection() {
        List<Diagnostic> diagnostics = RuleFixture.run(rule, "<PLAYER_SETUPS>");
        assertEquals(List.of("Unknown section `<PLAYER_SETUPS>`"), RuleFixture.messages(diagnostics));
        assertEquals("<PLAYER_SETUP>", diagnostics.get(0).suggestions().get(0).replacement());
    }

    @Test
    void testConditionThatAlwaysFails() {
        String text = "#define WATER_MAP\nif WATER_MAPP\nendif";
        List<Diagnostic> diagnostics = RuleFixture.run(rule, text);
        assertEquals(List.of("Token `WATER_MAPP` is never defined, this condition will always fail"),
                RuleFixture.messages(diagnostics));
        assertEquals("WATER_MAP", diagnostics.get(0).suggestions().get(0).replacement());
    }

    @Test
    void testDefinedNamesAreAccepted() {
        String text = """
                #const MY_TERRAIN 10
                if TINY_MAP
                endif
                create_land { terrain_type MY_TERRAIN }
                """;
        assertTrue(RuleFixture.run(rule, text).isEmpty());
    }

    /**
     * Константы другой версии игры сообщает правило совместимости, а не это.
     */
    @Test
    void testBuiltinOfOtherTargetIsLeftToCompatibility() {
        String text = "<OBJECTS_GENERATION>\ncreate_object DLC_ZEBRA {}";
        assertTrue(RuleFixture.run(rule, text, CompatibilityTarget.CONQUERORS).isEmpty());
    }
}
