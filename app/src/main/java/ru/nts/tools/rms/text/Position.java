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
 * Позиция в исходном тексте.
 *
 * @param offset смещение в символах от начала текста (индекс UTF-16, как в {@link String}).
 * @param line   номер строки, начиная с 1.
 * @param column номер колонки, начиная с 1.
 */
public record Position(int offset, int line, int column) implements Comparable<Position> {

    public static final Position START = new Position(0, 1, 1);

    @Override
    public int compareTo(Position other) {
        return Integer.compare(offset, other.offset);
    }
}
