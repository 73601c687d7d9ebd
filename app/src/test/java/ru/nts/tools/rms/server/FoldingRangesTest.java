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

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.text.SourceText;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class FoldingRangesTest {

    @Test
    void testRangesFromStructure() {
        String text = """
                /*
                 * Header
                 */
                <LAND_GENERATION>
                create_land {
                  terrain_type GRASS
                  if TINY_MAP
                    land_percent 10
                    base_size 5
                  else
                    land_percent 20
                  endif
                }
                start_random
                  percent_chance 50
                    #define A
                  percent_chance 50
                    #define B
                end_random
                """;
        List<FoldingRanges.Range> ranges = FoldingRanges.compute(new StructureParser().parse(new SourceText(text)));

        assertTrue(ranges.contains(new FoldingRanges.Range(1, 3, true)), "Многострочный комментарий: " + ranges);
        assertTrue(ranges.contains(new FoldingRanges.Range(5, 13, false)), "Тело create_land: " + ranges);
        assertTrue(ranges.contains(new FoldingRanges.Range(7, 9, false)), "Ветка if до else: " + ranges);
        assertTrue(ranges.contains(new FoldingRanges.Range(10, 11, false)), "Ветка else до endif: " + ranges);
        assertTrue(ranges.contains(new FoldingRanges.Range(14, 19, false)), "Весь start_random: " + ranges);
        assertTrue(ranges.contains(new FoldingRanges.Range(15, 16, false)), "Первая ветка percent_chance: " + ranges);
    }

    @Test
    void testSingleLineBlocksDoNotFold() {
        assertTrue(FoldingRanges.compute(new StructureParser().parse(new SourceText("create_land { base_size 5 } /* x */"))).isEmpty());
    }
}
