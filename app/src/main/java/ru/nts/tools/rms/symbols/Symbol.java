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
import ru.nts.tools.rms.text.Span;

import java.util.EnumSet;
import java.util.Set;

/**
 * Определённое имя.
 *
 * @param definition директива, которая определила имя впервые; {@code null} у встроенных имён
 * @param targets    цели, под которыми имя видно
 */
public record Symbol(String name, SymbolKind kind, Span definition, boolean builtin, Set<CompatibilityTarget> targets) {

    public Symbol {
        targets = targets.isEmpty() ? EnumSet.noneOf(CompatibilityTarget.class) : EnumSet.copyOf(targets);
    }

    static Symbol user(String name, SymbolKind kind, Span definition) {
        return new Symbol(name, kind, definition, false, EnumSet.allOf(CompatibilityTarget.class));
    }

    static Symbol builtin(String name, SymbolKind kind, Set<CompatibilityTarget> targets) {
        return new Symbol(name, kind, null, true, targets);
    }
}
