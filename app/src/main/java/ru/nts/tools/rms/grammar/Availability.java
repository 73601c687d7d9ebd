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
package ru.nts.tools.rms.grammar;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ограничение доступности команды по версиям игры.
 *
 * @param targets цели, где команда поддерживается.
 * @param guard   define, под которым команду можно использовать и в остальных целях (например UP_EXTENSION).
 * @param message текст диагностики при нарушении.
 * @param hint    подсказка без механического исправления.
 */
public record Availability(Set<CompatibilityTarget> targets, String guard, String message, String hint) {

    public Availability {
        targets = targets == null || targets.isEmpty()
                ? EnumSet.noneOf(CompatibilityTarget.class)
                : EnumSet.copyOf(targets);
    }

    /**
     * Поддерживается ли команда целью. Для {@link CompatibilityTarget#ALL} нужна поддержка во всех целях.
     */
    public boolean supports(CompatibilityTarget target) {
        if (target == CompatibilityTarget.ALL) {
            return targets.containsAll(CompatibilityTarget.concrete());
        }
        return targets.contains(target);
    }
}
