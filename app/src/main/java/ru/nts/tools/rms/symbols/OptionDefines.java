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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Имена, которые игра определяет сама в зависимости от настроек партии:
 * размер карты, наличие UserPatch, режим игры, состав команд.
 * Их можно проверять в {@code if}, но нельзя использовать как значения.
 */
public final class OptionDefines {

    private static final List<String> BASE = List.of(
            "TINY_MAP", "SMALL_MAP", "MEDIUM_MAP", "LARGE_MAP", "HUGE_MAP", "GIGANTIC_MAP",
            "UP_AVAILABLE", "UP_EXTENSION");

    private static final Set<CompatibilityTarget> USERPATCH_TARGETS = EnumSet.of(
            CompatibilityTarget.ALL,
            CompatibilityTarget.USERPATCH_14,
            CompatibilityTarget.USERPATCH_15,
            CompatibilityTarget.WOLOLO_KINGDOMS);

    private static final Set<String> BASE_SET = Collections.unmodifiableSet(new LinkedHashSet<>(BASE));
    private static final Set<String> WITH_USERPATCH = Collections.unmodifiableSet(withUserPatch());

    private OptionDefines() {}

    public static Set<String> forTarget(CompatibilityTarget target) {
        return USERPATCH_TARGETS.contains(target) ? WITH_USERPATCH : BASE_SET;
    }

    public static boolean isDefined(String name, CompatibilityTarget target) {
        return forTarget(target).contains(name);
    }

    private static Set<String> withUserPatch() {
        List<String> list = new ArrayList<>(BASE);
        list.addAll(List.of("FIXED_POSITIONS", "AI_PLAYERS", "CAPTURE_RELIC", "DEATH_MATCH", "DEFEND_WONDER",
                "KING_OT_HILL", "RANDOM_MAP", "REGICIDE", "TURBO_RANDOM_MAP", "WONDER_RACE"));
        for (int players = 1; players <= 8; players++) {
            list.add(players + "_PLAYER_GAME");
        }
        for (int teams = 0; teams <= 4; teams++) {
            list.add(teams + "_TEAM_GAME");
        }
        for (int team = 0; team <= 4; team++) {
            for (int player = 1; player <= 8; player++) {
                list.add("PLAYER" + player + "_TEAM" + team);
            }
        }
        for (int team = 0; team <= 4; team++) {
            for (int size = 0; size <= 8; size++) {
                list.add("TEAM" + team + "_SIZE" + size);
            }
        }
        return new LinkedHashSet<>(list);
    }
}
