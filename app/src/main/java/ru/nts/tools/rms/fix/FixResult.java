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
 * Итог применения подсказок.
 *
 * @param text      исправленный текст
 * @param applied   сколько подсказок применено
 * @param skipped   сколько подходящих подсказок отброшено из-за пересечений или выхода за границы текста
 * @param committed результат предназначен для записи (не пробный прогон)
 */
public record FixResult(String text, int applied, int skipped, boolean committed) {

    public boolean changed() {
        return applied > 0;
    }
}
