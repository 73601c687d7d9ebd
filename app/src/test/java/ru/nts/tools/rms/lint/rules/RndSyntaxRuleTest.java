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

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RndSyntaxRuleTest {

    private final RndSyntaxRule rule = new RndSyntaxRule();

    @Test
    void testValidRnd() {
        assertTrue(RuleFixture.run(rule, "create_land { base_size rnd(5,-3) }").isEmpty());
    }

    @Test
    void testWhitespaceInsideRnd() {
        String text = "create_land { base_size rnd( 1 , 3 ) }";
        List<Diagnostic> diagnostics = RuleFixture.run(rule, text);
        assertEquals(1, diagnostics.size());
        Diagnostic diagnostic = diagnostics.get(0);
        assertEquals("Incorrect rnd() call: `rnd( 1 , 3 )` must not contain whitespace", diagnostic.message());
        Suggestion fix = diagnostic.suggestions().get(0);
        assertTrue(fix.safe());
        assertEquals("rnd(1,3)", fix.replacement());
        assertEquals("rnd( 1 , 3 )", RuleFixture.covered(text, diagnostic));
    }

    @Test
    void testMissingBound() {
        List<Diagnostic> diagnostics = RuleFixture.run(rule, "base_size rnd(1,)");
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).suggestions().isEmpty(), "Неполный вызов не исправляется автоматически");
        assertTrue(diagnostics.get(0).isError());
    }
}
