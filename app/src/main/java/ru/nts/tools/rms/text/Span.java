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

/**
 * Полуоткрытый диапазон {@code [start, end)} исходного текста.
 */
public record Span(Position start, Position end) {

    public Span {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span end " + end.offset() + " is before start " + start.offset());
        }
    }

    public static Span at(Position position) {
        return new Span(position, position);
    }

    public int startOffset() {
        return start.offset();
    }

    public int endOffset() {
        return end.offset();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Содержит ли диапазон смещение (конец включительно: курсор сразу после слова всё ещё «на слове»).
     */
    public boolean touches(int offset) {
        return offset >= start.offset() && offset <= end.offset();
    }

    /**
     * Пересекаются ли диапазоны. Две вставки в одну точку тоже считаются пересечением.
     */
    public boolean overlaps(Span other) {
        if (start.offset() == other.start.offset()) {
            return true;
        }
        return other.start.offset() < end.offset() && start.offset() < other.end.offset();
    }

    /**
     * Наименьший диапазон, покрывающий оба.
     */
    public Span to(Span other) {
        Position s = start.offset() <= other.start.offset() ? start : other.start;
        Position e = end.offset() >= other.end.offset() ? end : other.end;
        return new Span(s, e);
    }
}
