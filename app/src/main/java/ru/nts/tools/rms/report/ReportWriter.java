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
package ru.nts.tools.rms.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.text.Position;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Машиночитаемый отчёт проверки: JSON-массив, по объекту на диагностику.
 * <pre>
 * { "severity": 1|2, "code": "...", "message": "...",
 *   "start": {"index", "line", "column"}, "end": {...},
 *   "suggestions": [ {"start", "end", "message", "replacement": string|null, "safe": bool} ] }
 * </pre>
 */
public final class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ArrayNode toJson(List<Diagnostic> diagnostics) {
        ArrayNode array = mapper.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode node = array.addObject();
            node.put("severity", diagnostic.severity().code());
            node.put("code", diagnostic.code());
            node.put("message", diagnostic.message());
            node.set("start", position(diagnostic.span().start()));
            node.set("end", position(diagnostic.span().end()));
            ArrayNode suggestions = node.putArray("suggestions");
            for (Suggestion suggestion : diagnostic.suggestions()) {
                ObjectNode s = suggestions.addObject();
                s.set("start", position(suggestion.span().start()));
                s.set("end", position(suggestion.span().end()));
                s.put("message", suggestion.message());
                if (suggestion.replacement() == null) {
                    s.putNull("replacement");
                } else {
                    s.put("replacement", suggestion.replacement());
                }
                s.put("safe", suggestion.safe());
            }
        }
        return array;
    }

    public String write(List<Diagnostic> diagnostics) {
        try {
            return mapper.writeValueAsString(toJson(diagnostics));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize check report", e);
        }
    }

    private ObjectNode position(Position position) {
        ObjectNode node = mapper.createObjectNode();
        node.put("index", position.offset());
        node.put("line", position.line());
        node.put("column", position.column());
        return node;
    }
}
