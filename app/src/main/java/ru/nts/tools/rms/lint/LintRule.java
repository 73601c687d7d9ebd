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
package ru.nts.tools.rms.lint;

import ru.nts.tools.rms.diagnostic.Diagnostic;

import java.util.List;

/**
 * Правило проверки скрипта.
 *
 * <p>Правило не хранит состояния: всё нужное приходит в {@link LintContext}, результат
 * возвращается списком. Правила не зависят друг от друга и выполняются параллельно.
 */
public interface LintRule {

    /**
     * Код правила, попадает в отчёт ({@code comment-syntax}, {@code arg-types}...).
     */
    String getName();

    String getDescription();

    List<Diagnostic> check(LintContext context);
}
