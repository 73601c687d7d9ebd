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
package ru.nts.tools.rms.diagnostic;

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Порядок и дедупликация итогового отчёта.
 */
class DiagnosticAggregatorTest {

    private final SourceText source = new SourceText("create_land { land_percent 10 }");

    @Test
    void testOrdering() {
        Span early = source.span(0, 11);
        Span late = source.span(14, 26);

        DiagnosticAggregator aggregator = new DiagnosticAggregator()
                .add(3, List.of(Diagnostic.warning("c", early, "rule 3 warning")))
                .add(1, List.of(Diagnostic.warning("a", late, "rule 1 late"),
                        Diagnostic.warning("a", early, "rule 1 first"),
                        Diagnostic.warning("a", early, "rule 1 second")))
                .add(2, List.of(Diagnostic.error("b", early, "rule 2 error")));

        List<String> messages = aggregator.build().stream().map(Diagnostic::message).collect(Collectors.toList());
        assertEquals(List.of(
                "rule 2 error",
                "rule 1 first",
                "rule 1 second",
                "rule 3 warning",
                "rule 1 late"), messages);
    }

    @Test
    void testInsertionOrderDoesNotMatter() {
        Span span = source.span(0, 11);
        Diagnostic a = Diagnostic.warning("a", span, "from a");
        Diagnostic b = Diagnostic.warning("b", span, "from b");

        List<Diagnostic> forward = new DiagnosticAggregator().add(1, List.of(a)).add(2, List.of(b)).build();
        List<Diagnostic> backward = new DiagnosticAggregator().add(2, List.of(b)).add(1, List.of(a)).build();
        assertEquals(forward, backward);
    }

    @Test
    void testExactDuplicatesAreDropped() {
        Span span = source.span(0, 11);
        List<Diagnostic> result = new DiagnosticAggregator()
                .add(1, List.of(Diagnostic.warning("a", span, "same")))
                .add(2, List.of(Diagnostic.warning("b", span, "same"), Diagnostic.error("b", span, "same")))
                .build();
        assertEquals(2, result.size(), "Отличающиеся важностью диагностики не являются дубликатами");
        assertEquals("b", result.get(0).code());
        assertEquals("a", result.get(1).code(), "Остаётся диагностика правила, зарегистрированного раньше");
    }
}
