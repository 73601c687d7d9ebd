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

import java.util.List;

/**
 * Описание известного слова языка: команды, атрибута, секции или управляющей конструкции.
 *
 * @param name         каноническое написание.
 * @param kind         где слово допустимо.
 * @param section      секция, в которой допустима команда или атрибут верхнего уровня ({@code null} = любая).
 * @param parents      команды, внутри тела которых допустим атрибут.
 * @param topLevel     допустим ли атрибут вне тела команды.
 * @param args         типы аргументов по порядку (не более четырёх).
 * @param availability ограничение по версиям игры или {@code null}.
 */
public record CommandSpec(String name,
                          CommandKind kind,
                          String section,
                          List<String> parents,
                          boolean topLevel,
                          List<ArgType> args,
                          Availability availability) {

    public CommandSpec {
        parents = parents == null ? List.of() : List.copyOf(parents);
        args = args == null ? List.of() : List.copyOf(args);
        if (args.size() > 4) {
            throw new IllegalArgumentException(name + " declares " + args.size() + " arguments, at most 4 are allowed");
        }
    }

    public int argCount() {
        return args.size();
    }

    public ArgType arg(int index) {
        return args.get(index);
    }

    public boolean isFlow() {
        return kind == CommandKind.FLOW;
    }
}
