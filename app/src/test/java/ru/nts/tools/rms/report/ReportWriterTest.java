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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.check.CheckOptions;
import ru.nts.tools.rms.check.CheckResult;
import ru.nts.tools.rms.check.FixtureScripts;
import ru.nts.tools.rms.check.RmsChecker;

import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * JSON-отчёт: структура проверяется схемой из ресурсов тестов.
 */
class ReportWriterTest {

    private static JsonSchema schema;
    private final ObjectMapper mapper = new ObjectMapper();
    private final RmsChecker checker = new RmsChecker();

    @BeforeAll
    static void loadSchema() throws Exception {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream in = ReportWriterTest.class.getResourceAsStream("/schema/check-report.schema.json")) {
            schema = factory.getSchema(in);
        }
    }

    @Test
    void testReportMatchesSchema() throws Exception {
        CheckResult result = checker.check(FixtureScripts.load("fixable.rms") + "\n/* GRASS", CheckOptions.DEFAULT);
        String json = new ReportWriter().write(result.diagnostics());

        JsonNode report = mapper.readTree(json);
        Set<ValidationMessage> errors = schema.validate(report);
        assertTrue(errors.isEmpty(), "Отчёт не соответствует схеме: "
                + errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
        assertEquals(result.diagnostics().size(), report.size());
    }

    @Test
    void testPositionsAndSuggestion() throws Exception {
        String text = "create_land {\n  base_size rnd( 1 , 3 )\n}";
        CheckResult result = checker.check(text, CheckOptions.DEFAULT);
        JsonNode report = mapper.readTree(new ReportWriter().write(result.diagnostics()));

        JsonNode rnd = null;
        for (JsonNode node : report) {
            if (node.get("code").asText().equals("rnd-syntax")) rnd = node;
        }
        assertTrue(rnd != null, "Ожидалась диагностика rnd-syntax: " + report);
        assertEquals(2, rnd.get("severity").asInt(), "Ошибка кодируется числом 2");
        assertEquals(26, rnd.get("start").get("index").asInt());
        assertEquals(2, rnd.get("start").get("line").asInt());
        assertEquals(13, rnd.get("start").get("column").asInt());
        JsonNode suggestion = rnd.get("suggestions").get(0);
        assertEquals("rnd(1,3)", suggestion.get("replacement").asText());
        assertTrue(suggestion.get("safe").asBoolean());
    }

    @Test
    void testEmptyReport() throws Exception {
        JsonNode report = mapper.readTree(new ReportWriter().write(checker.check("", CheckOptions.DEFAULT).diagnostics()));
        assertTrue(report.isArray());
        assertEquals(0, report.size());
        assertTrue(schema.validate(report).isEmpty());
    }
}
