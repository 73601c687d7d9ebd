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
package ru.nts.tools.rms.symbols;

import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.syntax.TokenKind;
import ru.nts.tools.rms.text.Span;

import java.util.Locale;
import java.util.Optional;

/**
 * Комментарий вида {@code /* Compatibility: UserPatch 1.5 *}{@code /} в начале файла.
 *
 * @param value  значение как написано в файле
 * @param target распознанная цель или {@code null}, если значение неизвестно
 * @param span   комментарий, в котором найдена директива
 */
public record CompatibilityDirective(String value, CompatibilityTarget target, Span span) {

    private static final String HEADER = "compatibility";

    public boolean isRecognized() {
        return target != null;
    }

    /**
     * Ищет первую директиву среди комментариев, стоящих до первой команды.
     * Комментарии после первой команды не просматриваются.
     */
    public static Optional<CompatibilityDirective> find(Script script) {
        for (Token token : script.tokens()) {
            if (token.isTrivia()) continue;
            if (token.kind() != TokenKind.COMMENT) break;
            Optional<CompatibilityDirective> directive = parseComment(token);
            if (directive.isPresent()) return directive;
        }
        return Optional.empty();
    }

    static Optional<CompatibilityDirective> parseComment(Token comment) {
        String content = comment.text();
        content = content.substring(Math.min(2, content.length()));
        if (content.endsWith("*/")) content = content.substring(0, content.length() - 2);
        for (String rawLine : content.split("\n")) {
            String line = rawLine.trim();
            if (line.startsWith("* ")) line = line.substring(2);
            int colon = line.indexOf(": ");
            if (colon < 0) continue;
            String name = line.substring(0, colon).trim();
            if (!name.toLowerCase(Locale.ROOT).equals(HEADER)) continue;
            String value = line.substring(colon + 2).trim();
            return Optional.of(new CompatibilityDirective(value, CompatibilityTarget.fromName(value).orElse(null), comment.span()));
        }
        return Optional.empty();
    }
}
