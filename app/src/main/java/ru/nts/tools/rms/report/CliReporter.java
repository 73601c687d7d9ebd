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

import ru.nts.tools.rms.check.CheckResult;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.text.Position;
import ru.nts.tools.rms.text.SourceText;

import java.io.PrintStream;

/**
 * Отчёт для терминала:
 * <pre>
 * map.rms:3:5: error[arg-types]: Missing arguments to create_object
 *     create_object {
 *     ^^^^^^^^^^^^^
 *   = suggestion: ...
 * </pre>
 */
public final class CliReporter {

    private final PrintStream out;

    public CliReporter(PrintStream out) {
        this.out = out;
    }

    public void report(String fileName, CheckResult result) {
        SourceText source = result.source();
        for (Diagnostic diagnostic : result.diagnostics()) {
            Position start = diagnostic.span().start();
            out.printf("%s:%d:%d: %s[%s]: %s%n", fileName, start.line(), start.column(),
                    diagnostic.severity().label(), diagnostic.code(), diagnostic.message());
            printSnippet(source, diagnostic);
            for (Suggestion suggestion : diagnostic.suggestions()) {
                out.println("  = " + describe(suggestion));
            }
        }
        summary(result);
    }

    private void printSnippet(SourceText source, Diagnostic diagnostic) {
        Position start = diagnostic.span().start();
        Position end = diagnostic.span().end();
        String line = source.lineText(start.line());
        out.println("    " + line);
        int width = end.line() == start.line() ? end.column() - start.column() : line.length() - start.column() + 1;
        StringBuilder marker = new StringBuilder("    ");
        for (int i = 1; i < start.column() && i <= line.length(); i++) {
            marker.append(line.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        marker.append("^".repeat(Math.max(1, width)));
        out.println(marker);
    }

    private static String describe(Suggestion suggestion) {
        if (!suggestion.hasReplacement()) {
            return "note: " + suggestion.message();
        }
        String kind = suggestion.safe() ? "fix" : "suggestion";
        return kind + ": " + suggestion.message() + " (replace with `" + suggestion.replacement() + "`)";
    }

    private void summary(CheckResult result) {
        if (result.diagnostics().isEmpty()) {
            out.println("No issues found.");
            return;
        }
        out.printf("%d errors, %d warnings found.%n", result.errorCount(), result.warningCount());
        long fixable = result.fixableCount();
        if (fixable > 0) {
            out.printf("%d issues are fixable using --fix%n", fixable);
        }
    }
}
