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
package ru.nts.tools.rms.cli;

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.check.CheckOptions;
import ru.nts.tools.rms.core.RmsParamException;
import ru.nts.tools.rms.grammar.CompatibilityTarget;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliArgumentsTest {

    @Test
    void testNoArgumentsShowsHelp() {
        assertEquals(CliArguments.Command.HELP, CliArguments.parse(List.of()).command());
        assertEquals(CliArguments.Command.HELP, CliArguments.parse(List.of("--help")).command());
    }

    @Test
    void testBareFileMeansCheck() {
        CliArguments arguments = CliArguments.parse(List.of("map.rms"));
        assertEquals(CliArguments.Command.CHECK, arguments.command());
        assertEquals("map.rms", arguments.file());
        assertTrue(arguments.compatibility().isEmpty());
        assertFalse(arguments.json());
    }

    @Test
    void testCheckWithOptions() {
        CliArguments arguments = CliArguments.parse(List.of("--compatibility", "WK", "--json", "check", "map.rms"));
        assertEquals(CliArguments.Command.CHECK, arguments.command());
        assertEquals(CompatibilityTarget.WOLOLO_KINGDOMS, arguments.compatibility().orElseThrow());
        assertTrue(arguments.json());

        CliArguments inline = CliArguments.parse(List.of("--compatibility=userpatch 1.5", "map.rms"));
        assertEquals(CompatibilityTarget.USERPATCH_15, inline.compatibility().orElseThrow());
    }

    @Test
    void testFixAliases() {
        CliArguments fix = CliArguments.parse(List.of("--fix", "map.rms"));
        assertEquals(CliArguments.Command.FIX, fix.command());
        assertFalse(fix.unsafe());

        CliArguments unsafe = CliArguments.parse(List.of("--fix-unsafe", "map.rms"));
        assertEquals(CliArguments.Command.FIX, unsafe.command());
        assertTrue(unsafe.unsafe());

        CliArguments dryRun = CliArguments.parse(List.of("--dry-run", "map.rms"));
        assertEquals(CliArguments.Command.FIX, dryRun.command());
        assertTrue(dryRun.dryRun());

        CliArguments explicit = CliArguments.parse(List.of("fix", "--unsafe", "--dry-run", "map.rms"));
        assertTrue(explicit.unsafe() && explicit.dryRun());
    }

    @Test
    void testServerTakesNoFile() {
        assertEquals(CliArguments.Command.SERVER, CliArguments.parse(List.of("server")).command());
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("server", "map.rms")));
    }

    @Test
    void testUsageErrors() {
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("check")), "Нет файла");
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("a.rms", "b.rms")));
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("--verbose", "a.rms")));
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("check", "--unsafe", "a.rms")));
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("--compatibility")));
        assertThrows(RmsParamException.class, () -> CliArguments.parse(List.of("-c", "aoe3", "a.rms")));
    }

    /**
     * Флаг важнее переменной окружения, переменная важнее значения по умолчанию.
     */
    @Test
    void testCompatibilityPrecedence() {
        Map<String, String> env = Map.of(CheckOptions.COMPATIBILITY_ENV, "hd");
        assertEquals(CompatibilityTarget.ALL, CliArguments.parse(List.of("a.rms")).options(Map.of()).compatibility());
        assertEquals(CompatibilityTarget.HD_EDITION, CliArguments.parse(List.of("a.rms")).options(env).compatibility());
        assertEquals(CompatibilityTarget.DEFINITIVE_EDITION,
                CliArguments.parse(List.of("-c", "de", "a.rms")).options(env).compatibility());
    }
}
