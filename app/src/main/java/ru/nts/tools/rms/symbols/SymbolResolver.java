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
import ru.nts.tools.rms.grammar.Keywords;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.Token;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Строит {@link SymbolTable} по разобранному скрипту.
 *
 * <p>Ветки условий не вычисляются: определения собираются из всех веток подряд,
 * порядок веток на результат не влияет. {@code #undefine} имя не удаляет, так как
 * неизвестно, на каком пути он выполнится.
 */
public final class SymbolResolver {

    private final BuiltinDefinitions builtins;

    public SymbolResolver(BuiltinDefinitions builtins) {
        this.builtins = builtins;
    }

    public SymbolResolver() {
        this(BuiltinDefinitions.standard());
    }

    /**
     * @param defaultTarget цель, если в файле нет распознанной директивы
     */
    public SymbolTable resolve(Script script, CompatibilityTarget defaultTarget) {
        CompatibilityDirective directive = CompatibilityDirective.find(script).orElse(null);
        CompatibilityTarget target = directive != null && directive.isRecognized()
                ? directive.target()
                : defaultTarget;

        Map<String, Symbol> consts = new LinkedHashMap<>();
        Map<String, Symbol> defines = new LinkedHashMap<>();
        for (Block block : script.allBlocks()) {
            if (!(block instanceof Block.Command command)) continue;
            Token name = command.arg(0);
            if (name == null) continue;
            String directiveName = command.spec().name();
            if (Keywords.CONST.equals(directiveName)) {
                consts.putIfAbsent(name.text(), Symbol.user(name.text(), SymbolKind.CONST, command.span()));
            } else if (Keywords.DEFINE.equals(directiveName)) {
                defines.putIfAbsent(name.text(), Symbol.user(name.text(), SymbolKind.DEFINE, command.span()));
            }
        }
        return new SymbolTable(target, directive, consts, defines, builtins);
    }
}
