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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.rms.check.FixtureScripts;
import ru.nts.tools.rms.check.RmsChecker;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Подкоманды целиком: файлы во временном каталоге, вывод в буферы.
 */
class CliRunnerTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        CliRunner runner = new CliRunner(new RmsChecker(), Map.of(),
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return runner.run(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private Path script(String name, String text) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Test
    void testHelp() {
        assertEquals(CliRunner.EXIT_OK, run("help"));
        assertTrue(stdout().contains("Usage:"));
        assertTrue(stdout().contains("wololokingdoms"), "Список целей совместимости");
    }

    @Test
    void testCheckCleanScript() throws IOException {
        Path file = script("clean.rms", FixtureScripts.load("clean.rms"));
        assertEquals(CliRunner.EXIT_OK, run("check", file.toString()));
        assertTrue(stdout().contains("No issues found."), stdout());
    }

    @Test
    void testCheckWithErrors() throws IOException {
        Path file = script("broken.rms", "<LAND_GENERATION>\ncreate_land {\n  base_size rnd(1,)\n}\n");
        assertEquals(CliRunner.EXIT_ERRORS, run(file.toString()));
        assertTrue(stdout().contains("broken.rms:3:"), stdout());
    }

    @Test
    void testCheckJson() throws IOException {
        Path file = script("broken.rms", "<LAND_GENERATION>\ncreate_land {\n  base_size rnd(1,)\n}\n");
        assertEquals(CliRunner.EXIT_ERRORS, run("--json", file.toString()));
        JsonNode report = new ObjectMapper().readTree(stdout());
        assertTrue(report.isArray() && report.size() > 0, stdout());
        boolean error = false;
        for (JsonNode diagnostic : report) {
            error |= diagnostic.path("severity").asInt() == 2;
        }
        assertTrue(error, "Ошибка rnd() попадает в отчёт с кодом 2");
    }

    @Test
    void testMissingFile() {
        assertEquals(CliRunner.EXIT_USAGE, run("check", tempDir.resolve("absent.rms").toString()));
        assertFalse(err.toString(StandardCharsets.UTF_8).isBlank());
    }

    @Test
    void testUsageError() {
        assertEquals(CliRunner.EXIT_USAGE, run("--no-such-flag", "a.rms"));
        assertEquals("", stdout());
        assertFalse(err.toString(StandardCharsets.UTF_8).isBlank());
    }

    @Test
    void testFixWritesBackup() throws IOException {
        String original = FixtureScripts.load("fixable.rms");
        Path file = script("fixable.rms", original);

        assertEquals(CliRunner.EXIT_OK, run("fix", file.toString()));
        assertTrue(stdout().contains("3 fixes applied"), stdout());

        String fixed = Files.readString(file);
        assertTrue(fixed.contains("base_size rnd(5,9)"));
        assertTrue(fixed.contains("land_percent rnd(10,20)"));
        assertEquals(original, Files.readString(tempDir.resolve("fixable.rms.bak")), "Резервная копия хранит исходный текст");
    }

    @Test
    void testDryRunLeavesFileUntouched() throws IOException {
        String original = FixtureScripts.load("fixable.rms");
        Path file = script("fixable.rms", original);

        assertEquals(CliRunner.EXIT_OK, run("--dry-run", file.toString()));
        assertTrue(stdout().contains("-  base_size rnd( 5 , 9 )"), stdout());
        assertTrue(stdout().contains("+  base_size rnd(5,9)"), stdout());
        assertTrue(stdout().contains("3 fixes would be applied"), stdout());
        assertEquals(original, Files.readString(file));
        assertFalse(Files.exists(tempDir.resolve("fixable.rms.bak")));
    }

    @Test
    void testNothingToFix() throws IOException {
        Path file = script("clean.rms", FixtureScripts.load("clean.rms"));
        assertEquals(CliRunner.EXIT_OK, run("--fix", file.toString()));
        assertTrue(stdout().startsWith("No fixes applied"), stdout());
        assertFalse(Files.exists(tempDir.resolve("clean.rms.bak")));
    }
}
