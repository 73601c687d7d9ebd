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

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Таблица имён одного документа под активной целью совместимости.
 *
 * <p>Пользовательские имена собраны по всем веткам всех {@code if}/{@code start_random}:
 * имя считается «возможно определённым», если его определяет хоть один путь.
 * Таблица неизменяема и читается правилами параллельно.
 */
public final class SymbolTable {

    private final CompatibilityTarget target;
    private final CompatibilityDirective directive;
    private final Map<String, Symbol> userConsts;
    private final Map<String, Symbol> userDefines;
    private final BuiltinDefinitions builtins;

    SymbolTable(CompatibilityTarget target,
                CompatibilityDirective directive,
                Map<String, Symbol> userConsts,
                Map<String, Symbol> userDefines,
                BuiltinDefinitions builtins) {
        this.target = target;
        this.directive = directive;
        this.userConsts = Collections.unmodifiableMap(userConsts);
        this.userDefines = Collections.unmodifiableMap(userDefines);
        this.builtins = builtins;
    }

    /**
     * Активная цель: из директивы в файле, иначе переданная по умолчанию.
     */
    public CompatibilityTarget target() {
        return target;
    }

    /**
     * Директива совместимости, если она есть в файле (в том числе нераспознанная).
     */
    public Optional<CompatibilityDirective> directive() {
        return Optional.ofNullable(directive);
    }

    public BuiltinDefinitions builtins() {
        return builtins;
    }

    /**
     * Имя можно использовать как значение: пользовательский {@code #const} или встроенная константа цели.
     */
    public boolean isConst(String name) {
        return userConsts.containsKey(name) || builtins.isConstVisible(name, target);
    }

    /**
     * Имя определено только через {@code #define} (значения у него нет).
     */
    public boolean isDefineOnly(String name) {
        return !isConst(name) && isDefine(name);
    }

    public boolean isDefine(String name) {
        return userDefines.containsKey(name)
                || builtins.isDefineVisible(name, target)
                || OptionDefines.isDefined(name, target);
    }

    /**
     * Может ли условие {@code if NAME} оказаться истинным.
     */
    public boolean isPossiblyDefined(String name) {
        return isDefine(name) || isConst(name);
    }

    public boolean isUserDefined(String name) {
        return userConsts.containsKey(name) || userDefines.containsKey(name);
    }

    /**
     * Пользовательское определение имени: сначала {@code #const}, затем {@code #define}.
     */
    public Optional<Symbol> userSymbol(String name) {
        Symbol symbol = userConsts.get(name);
        if (symbol == null) symbol = userDefines.get(name);
        return Optional.ofNullable(symbol);
    }

    /**
     * Видимые значения: кандидаты для исправления опечаток в аргументах.
     */
    public Set<String> constNames() {
        Set<String> names = new TreeSet<>(userConsts.keySet());
        names.addAll(builtins.constNames(target));
        return names;
    }

    /**
     * Всё, что может стоять в условии {@code if}.
     */
    public Set<String> conditionNames() {
        Set<String> names = constNames();
        names.addAll(userDefines.keySet());
        names.addAll(builtins.defineNames(target));
        names.addAll(OptionDefines.forTarget(target));
        return names;
    }

    public Map<String, Symbol> userConsts() {
        return userConsts;
    }

    public Map<String, Symbol> userDefines() {
        return userDefines;
    }
}
