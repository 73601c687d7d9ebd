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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Собирает диагностики всех проходов в один детерминированный отчёт.
 *
 * <p>Порядок: начало основного диапазона, затем ERROR раньше WARNING, затем порядок
 * регистрации правила, затем порядок выдачи внутри правила. Результат не зависит от того,
 * в каком порядке и в скольких потоках отработали правила. Полные дубликаты
 * (важность, текст, диапазон) отбрасываются.
 */
public final class DiagnosticAggregator {

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.diagnostic.span().startOffset())
            .thenComparing(e -> e.diagnostic.severity() == Severity.ERROR ? 0 : 1)
            .thenComparingInt(e -> e.ruleOrder)
            .thenComparingInt(e -> e.sequence);

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Добавляет результат одного прохода.
     *
     * @param ruleOrder   порядковый номер прохода в фиксированном списке регистрации.
     * @param diagnostics диагностики прохода в порядке выдачи.
     */
    public DiagnosticAggregator add(int ruleOrder, List<Diagnostic> diagnostics) {
        for (int i = 0; i < diagnostics.size(); i++) {
            entries.add(new Entry(ruleOrder, i, diagnostics.get(i)));
        }
        return this;
    }

    public List<Diagnostic> build() {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);

        Set<Key> seen = new HashSet<>();
        List<Diagnostic> result = new ArrayList<>(sorted.size());
        for (Entry entry : sorted) {
            Diagnostic d = entry.diagnostic;
            if (seen.add(new Key(d.severity(), d.message(), d.span().startOffset(), d.span().endOffset()))) {
                result.add(d);
            }
        }
        return List.copyOf(result);
    }

    private record Entry(int ruleOrder, int sequence, Diagnostic diagnostic) {
    }

    private record Key(Severity severity, String message, int start, int end) {
    }
}
