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
 * Имена управляющих конструкций и директив.
 */
public final class Keywords {

    public static final String IF = "if";
    public static final String ELSEIF = "elseif";
    public static final String ELSE = "else";
    public static final String ENDIF = "endif";

    public static final String START_RANDOM = "start_random";
    public static final String PERCENT_CHANCE = "percent_chance";
    public static final String END_RANDOM = "end_random";

    public static final String DEFINE = "#define";
    public static final String UNDEFINE = "#undefine";
    public static final String CONST = "#const";
    public static final String INCLUDE = "#include";
    public static final String INCLUDE_DRS = "#include_drs";

    public static final String OPEN_BRACE = "{";
    public static final String CLOSE_BRACE = "}";

    private Keywords() {}
}
