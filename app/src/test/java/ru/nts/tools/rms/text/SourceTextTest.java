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
package ru.nts.tools.rms.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceTextTest {

    private final SourceText source = new SourceText("create_land {\r\n  base_size 5\n}");

    @Test
    void testPositions() {
        assertEquals(3, source.lineCount());
        assertEquals(new Position(0, 1, 1), source.position(0));
        assertEquals(new Position(17, 2, 3), source.position(17), "Начало base_size");
        assertEquals(new Position(29, 3, 1), source.position(29));
        assertEquals(new Position(source.length(), 3, 2), source.position(source.length()), "Конец текста допустим");
    }

    @Test
    void testOffsetsOutsideTextAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> source.position(-1));
        assertThrows(IllegalArgumentException.class, () -> source.position(source.length() + 1));
        assertThrows(IllegalArgumentException.class, () -> source.span(0, 1000));
        assertThrows(IllegalArgumentException.class, () -> source.span(-2, 3));
    }

    @Test
    void testOffsetOf() {
        assertEquals(17, source.offsetOf(2, 3));
        assertEquals(13, source.offsetOf(1, 200), "Колонка прижимается к концу строки без \\r");
        assertEquals(0, source.offsetOf(0, 5));
        assertEquals(source.length(), source.offsetOf(9, 1));
    }

    @Test
    void testLinesAndSlices() {
        assertEquals("create_land {", source.lineText(1));
        assertEquals("  base_size 5", source.lineText(2));
        assertEquals("", source.lineText(4));
        assertEquals("base_size", source.slice(source.span(17, 26)));
        assertTrue(source.contains(source.span(0, source.length())));
        assertFalse(source.contains(new Span(Position.START, new Position(99, 1, 100))));
    }

    @Test
    void testSpanRelations() {
        Span word = source.span(17, 26);
        assertTrue(word.touches(26), "Курсор сразу после слова");
        assertFalse(word.touches(27));
        assertTrue(word.overlaps(source.span(25, 28)));
        assertFalse(word.overlaps(source.span(26, 28)));
        assertTrue(Span.at(source.position(17)).overlaps(Span.at(source.position(17))), "Вставки в одну точку");
        assertEquals(source.span(0, 26), word.to(source.span(0, 3)));
        assertThrows(IllegalArgumentException.class, () -> new Span(source.position(5), source.position(2)));
    }
}
