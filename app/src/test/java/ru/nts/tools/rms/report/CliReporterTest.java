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
package ru.nts.tools.rms.report;

import org.junit.jupiter.api.Test;
import ru.nts.tools.rms.check.CheckOptions;
import ru.nts.tools.rms.check.CheckResult;
import ru.nts.tools.rms.check.RmsChecker;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliReporterTest {

    private final RmsChecker checker = new RmsChecker();

    @Test
    void testHumanReport() {
        String text = "create_land {\n  base_size rnd( 1 , 3 )\n}";
        String output = render("map.rms", checker.check(text, CheckOptions.DEFAULT));

        assertTrue(output.contains("map.rms:2:13: error[rnd-syntax]: Incorrect rnd() call: `rnd( 1 , 3 )` must not contain whitespace"),
                output);
        assertTrue(output.contains("      base_size rnd( 1 , 3 )"), "Должна печататься строка исходника");
        assertTrue(output.contains("                ^^^^^^^^^^^^"), "Подчёркивание под диапазоном диагностики");
        assertTrue(output.contains("  = fix: Remove the whitespace (replace with `rnd(1,3)`)"));
        assertTrue(output.contains("errors, "), output);
        assertTrue(output.contains("issues are fixable using --fix"), output);
    }

    @Test
    void testNoIssues() {
        assertEquals("No issues found." + System.lineSeparator(),
                render("empty.rms", checker.check("", CheckOptions.DEFAULT)));
    }

    private static String render(String fileName, CheckResult result) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new CliReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).report(fileName, result);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
