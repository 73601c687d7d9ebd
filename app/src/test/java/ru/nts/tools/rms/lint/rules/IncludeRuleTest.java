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
import ru.nts.tools.rms.grammar.CompatibilityTarget;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncludeRuleTest {

    private final IncludeRule rule = new IncludeRule();

    @Test
    void testIncludeInUserMap() {
        List<String> messages = RuleFixture.messages(RuleFixture.run(rule, "#include_drs random_map.def 54000\n#include land.inc"));
        assertEquals(List.of("#include_drs can only be used by builtin maps", "#include can only be used by builtin maps"), messages);
    }

    @Test
    void testIncludeInBuiltinMap() {
        assertTrue(RuleFixture.run(rule, "#include_drs random_map.def 54000", CompatibilityTarget.ALL, true).isEmpty());
    }
}
