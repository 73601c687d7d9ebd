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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Severity;
import ru.nts.tools.rms.text.Position;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

/**
 * Преобразования между моделью проверки и JSON протокола редактора.
 * Строки и столбцы в протоколе считаются с нуля, у нас с единицы.
 */
final class LspJson {

    static final String SOURCE = "rms-check";

    private final ObjectMapper mapper;

    LspJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectNode position(Position position) {
        ObjectNode node = mapper.createObjectNode();
        node.put("line", position.line() - 1);
        node.put("character", position.column() - 1);
        return node;
    }

    ObjectNode range(Span span) {
        ObjectNode node = mapper.createObjectNode();
        node.set("start", position(span.start()));
        node.set("end", position(span.end()));
        return node;
    }

    ObjectNode location(String uri, Span span) {
        ObjectNode node = mapper.createObjectNode();
        node.put("uri", uri);
        node.set("range", range(span));
        return node;
    }

    ObjectNode diagnostic(Diagnostic diagnostic) {
        ObjectNode node = mapper.createObjectNode();
        node.set("range", range(diagnostic.span()));
        node.put("severity", diagnostic.severity() == Severity.ERROR ? 1 : 2);
        node.put("code", diagnostic.code());
        node.put("source", SOURCE);
        node.put("message", diagnostic.message());
        return node;
    }

    /**
     * Смещение в тексте по позиции протокола.
     *
     * @throws IllegalArgumentException если позиция не передана
     */
    static int offset(SourceText source, JsonNode position) {
        if (position == null || !position.has("line") || !position.has("character")) {
            throw new IllegalArgumentException("position with line and character is required");
        }
        return source.offsetOf(position.get("line").asInt() + 1, position.get("character").asInt() + 1);
    }
}
