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

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Встроенные определения по слоям совместимости.
 */
class BuiltinDefinitionsTest {

    @Test
    void testLayersMapToTargets() {
        Map<BuiltinDefinitions.Layer, String> sources = new EnumMap<>(BuiltinDefinitions.Layer.class);
        sources.put(BuiltinDefinitions.Layer.AOC, "#const GRASS 0\n");
        sources.put(BuiltinDefinitions.Layer.UP, "#const SET_ATTRIBUTE 0\n#define UP_EFFECTS\n");
        sources.put(BuiltinDefinitions.Layer.HD, "#const DLC_ROCK 46\n");
        sources.put(BuiltinDefinitions.Layer.DE, "#const DLC_MUD 1005\n");
        BuiltinDefinitions definitions = new BuiltinDefinitions(sources);

        assertEquals(CompatibilityTarget.concrete(), definitions.constTargets("GRASS"));
        assertTrue(definitions.isConstAvailable("GRASS", CompatibilityTarget.ALL));

        assertTrue(definitions.isConstVisible("SET_ATTRIBUTE", CompatibilityTarget.ALL));
        assertFalse(definitions.isConstAvailable("SET_ATTRIBUTE", CompatibilityTarget.ALL),
                "Под All константа должна быть доступна во всех версиях");
        assertTrue(definitions.isConstAvailable("SET_ATTRIBUTE", CompatibilityTarget.WOLOLO_KINGDOMS));
        assertFalse(definitions.isConstVisible("SET_ATTRIBUTE", CompatibilityTarget.USERPATCH_14));

        assertTrue(definitions.isDefineVisible("UP_EFFECTS", CompatibilityTarget.USERPATCH_15));
        assertTrue(definitions.isConstVisible("DLC_ROCK", CompatibilityTarget.DEFINITIVE_EDITION));
        assertFalse(definitions.isConstVisible("DLC_MUD", CompatibilityTarget.HD_EDITION));
        assertFalse(definitions.isBuiltinConst("UNKNOWN"));
    }

    @Test
    void testStandardDefinitionsLoad() {
        BuiltinDefinitions definitions = BuiltinDefinitions.standard();
        assertTrue(definitions.isConstAvailable("SIEGE_WORKSHOP", CompatibilityTarget.CONQUERORS));
        assertTrue(definitions.constNames(CompatibilityTarget.CONQUERORS).contains("GOLD"));
        assertTrue(definitions.isBuiltinConst("DLC_MOORLAND"));
    }
}
