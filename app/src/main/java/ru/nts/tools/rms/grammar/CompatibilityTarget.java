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

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Версия игры/движка, под которую проверяется скрипт.
 * Порядок объявления значим: более поздние цели поддерживают больше возможностей.
 * {@link #ALL} требует совместимости со всеми конкретными целями сразу.
 */
public enum CompatibilityTarget {

    ALL("All"),
    CONQUERORS("The Conquerors"),
    HD_EDITION("HD Edition"),
    USERPATCH_14("UserPatch 1.4"),
    USERPATCH_15("UserPatch 1.5"),
    WOLOLO_KINGDOMS("WololoKingdoms"),
    DEFINITIVE_EDITION("Definitive Edition");

    private static final Map<String, CompatibilityTarget> ALIASES = new LinkedHashMap<>();

    static {
        alias(ALL, "all");
        alias(CONQUERORS, "conquerors", "aoc");
        alias(HD_EDITION, "hd edition", "hd");
        alias(USERPATCH_14, "userpatch 1.4", "up 1.4", "userpatch", "up", "up14");
        alias(USERPATCH_15, "userpatch 1.5", "up 1.5", "up15");
        alias(WOLOLO_KINGDOMS, "wololokingdoms", "wk");
        alias(DEFINITIVE_EDITION, "definitive edition", "de");
    }

    private final String displayName;

    CompatibilityTarget(String displayName) {
        this.displayName = displayName;
    }

    private static void alias(CompatibilityTarget target, String... names) {
        for (String name : names) {
            ALIASES.put(name, target);
        }
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Ищет цель по имени из директивы или флага командной строки.
     * Сравнение без учёта регистра и крайних пробелов.
     */
    public static Optional<CompatibilityTarget> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        CompatibilityTarget target = ALIASES.get(key);
        if (target == null) {
            for (CompatibilityTarget candidate : values()) {
                if (candidate.name().equalsIgnoreCase(key)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.ofNullable(target);
    }

    /**
     * Все распознаваемые имена, для сообщений об ошибках.
     */
    public static String knownNames() {
        return String.join(", ", ALIASES.keySet());
    }

    /**
     * Все конкретные цели (без {@link #ALL}).
     */
    public static Set<CompatibilityTarget> concrete() {
        return EnumSet.complementOf(EnumSet.of(ALL));
    }

    public boolean isAtLeast(CompatibilityTarget other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Человекочитаемый список целей: "HD Edition, Definitive Edition".
     */
    public static String describe(Set<CompatibilityTarget> targets) {
        return Arrays.stream(values())
                .filter(targets::contains)
                .map(CompatibilityTarget::displayName)
                .collect(Collectors.joining(", "));
    }
}
