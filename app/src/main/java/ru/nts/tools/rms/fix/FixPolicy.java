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

/**
 * Какие подсказки применять.
 *
 * @param allowUnsafe применять и эвристические подсказки (исправления опечаток)
 * @param dryRun      только вычислить результат, не записывая его
 */
public record FixPolicy(boolean allowUnsafe, boolean dryRun) {

    public static final FixPolicy SAFE_ONLY = new FixPolicy(false, false);
    public static final FixPolicy ALLOW_UNSAFE = new FixPolicy(true, false);

    public FixPolicy asDryRun() {
        return new FixPolicy(allowUnsafe, true);
    }
}
