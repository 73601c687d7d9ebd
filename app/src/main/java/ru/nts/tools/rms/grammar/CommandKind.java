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

/**
 * Где может встречаться слово из таблицы команд.
 */
public enum CommandKind {
    /** Управляющие конструкции и директивы: if, start_random, #const... Допустимы где угодно. */
    FLOW,
    /** Заголовок секции {@code <PLAYER_SETUP>}, только на верхнем уровне. */
    SECTION,
    /** Команда с телом в фигурных скобках. */
    COMMAND,
    /** Атрибут: внутри тела команды и/или на верхнем уровне секции. */
    ATTRIBUTE
}
