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
package ru.nts.tools.rms.check;

import ru.nts.tools.rms.core.CancellationToken;
import ru.nts.tools.rms.core.RmsParamException;
import ru.nts.tools.rms.grammar.CompatibilityTarget;

import java.util.Map;

/**
 * Настройки одной проверки. Неизменяемы; передаются явно, глобального состояния нет.
 *
 * @param compatibility цель по умолчанию, если в файле нет директивы
 * @param builtinMap    скрипт входит в поставку игры (разрешает {@code #include})
 * @param parallel      выполнять правила параллельно
 * @param cancellation  сигнал отмены
 */
public record CheckOptions(CompatibilityTarget compatibility,
                           boolean builtinMap,
                           boolean parallel,
                           CancellationToken cancellation) {

    /** Переменная окружения с целью совместимости по умолчанию. */
    public static final String COMPATIBILITY_ENV = "RMS_CHECK_COMPATIBILITY";

    public static final CheckOptions DEFAULT = new CheckOptions(CompatibilityTarget.ALL, false, true, CancellationToken.NONE);

    public CheckOptions {
        if (compatibility == null) compatibility = CompatibilityTarget.ALL;
        if (cancellation == null) cancellation = CancellationToken.NONE;
    }

    public CheckOptions withCompatibility(CompatibilityTarget target) {
        return new CheckOptions(target, builtinMap, parallel, cancellation);
    }

    public CheckOptions withBuiltinMap(boolean builtin) {
        return new CheckOptions(compatibility, builtin, parallel, cancellation);
    }

    public CheckOptions withParallel(boolean parallelRules) {
        return new CheckOptions(compatibility, builtinMap, parallelRules, cancellation);
    }

    public CheckOptions withCancellation(CancellationToken token) {
        return new CheckOptions(compatibility, builtinMap, parallel, token);
    }

    /**
     * Настройки по умолчанию с учётом {@value #COMPATIBILITY_ENV}.
     *
     * @throws RmsParamException если в переменной неизвестное имя цели
     */
    public static CheckOptions fromEnvironment(Map<String, String> environment) {
        String value = environment.get(COMPATIBILITY_ENV);
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return DEFAULT.withCompatibility(parseTarget(value));
    }

    /**
     * @throws RmsParamException если имя не распознано
     */
    public static CompatibilityTarget parseTarget(String value) {
        return CompatibilityTarget.fromName(value)
                .orElseThrow(() -> RmsParamException.unknownCompatibility(value, CompatibilityTarget.knownNames()));
    }
}
