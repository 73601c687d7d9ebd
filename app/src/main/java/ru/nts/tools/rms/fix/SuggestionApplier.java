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
package ru.nts.tools.rms.fix;

import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Вклеивает подсказки в исходный текст.
 *
 * <p>От каждой диагностики берётся первая подходящая по политике подсказка с непустой заменой.
 * Подсказки сортируются по началу диапазона (устойчиво), пересекающаяся с уже принятой
 * отбрасывается. Текст собирается слева направо из неизменённых участков и замен,
 * поэтому смещения всегда относятся к исходному тексту.
 */
public final class SuggestionApplier {

    private SuggestionApplier() {}

    public static FixResult apply(String text, List<Diagnostic> diagnostics, FixPolicy policy) {
        List<Suggestion> eligible = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            for (Suggestion suggestion : diagnostic.suggestions()) {
                if (suggestion.hasReplacement() && (suggestion.safe() || policy.allowUnsafe())) {
                    eligible.add(suggestion);
                    break;
                }
            }
        }
        eligible.sort(Comparator.comparingInt(s -> s.span().startOffset()));

        StringBuilder out = new StringBuilder(text.length() + 16);
        int cursor = 0;
        Span last = null;
        int applied = 0;
        int skipped = 0;
        for (Suggestion suggestion : eligible) {
            Span span = suggestion.span();
            if (span.endOffset() > text.length() || span.startOffset() < cursor || (last != null && last.overlaps(span))) {
                skipped++;
                continue;
            }
            out.append(text, cursor, span.startOffset());
            out.append(suggestion.replacement());
            cursor = span.endOffset();
            last = span;
            applied++;
        }
        out.append(text, cursor, text.length());
        return new FixResult(out.toString(), applied, skipped, !policy.dryRun());
    }
}
