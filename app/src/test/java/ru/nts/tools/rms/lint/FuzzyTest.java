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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyTest {

    @Test
    void testDistance() {
        assertEquals(0, Fuzzy.distance("GOLD", "GOLD"));
        assertEquals(1, Fuzzy.distance("SIEGE_WORSHOP", "SIEGE_WORKSHOP"));
        assertEquals(3, Fuzzy.distance("kitten", "sitting"));
    }

    @Test
    void testClosestPrefersSmallerDistanceThenName() {
        assertEquals(Optional.of("STONE"), Fuzzy.closest("STONX", List.of("STONES", "STONE", "STORE")));
        assertEquals(Optional.of("ABD"), Fuzzy.closest("ABC", List.of("ABE", "ABD")),
                "При равном расстоянии выигрывает меньшее имя");
    }

    @Test
    void testNothingCloseEnough() {
        assertTrue(Fuzzy.closest("FORGE", List.of("TOWN_CENTER", "GOLD")).isEmpty());
    }
}
