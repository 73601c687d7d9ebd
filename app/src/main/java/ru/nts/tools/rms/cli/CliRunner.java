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

import ru.nts.tools.rms.check.CheckOptions;
import ru.nts.tools.rms.check.CheckResult;
import ru.nts.tools.rms.check.RmsChecker;
import ru.nts.tools.rms.core.DiffUtils;
import ru.nts.tools.rms.core.EncodingUtils;
import ru.nts.tools.rms.core.FileUtils;
import ru.nts.tools.rms.core.RmsException;
import ru.nts.tools.rms.core.RmsFileException;
import ru.nts.tools.rms.core.RmsLog;
import ru.nts.tools.rms.fix.FixPolicy;
import ru.nts.tools.rms.fix.FixResult;
import ru.nts.tools.rms.report.CliReporter;
import ru.nts.tools.rms.report.ReportWriter;
import ru.nts.tools.rms.server.LanguageServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Выполнение подкоманд. Потоки и окружение передаются явно, чтобы команды можно было
 * запускать из тестов.
 */
public final class CliRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERRORS = 1;
    public static final int EXIT_USAGE = 2;

    private final RmsChecker checker;
    private final Map<String, String> environment;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public CliRunner(RmsChecker checker, Map<String, String> environment,
                     InputStream in, PrintStream out, PrintStream err) {
        this.checker = checker;
        this.environment = environment;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public int run(String... args) {
        try {
            CliArguments arguments = CliArguments.parse(Arrays.asList(args));
            return switch (arguments.command()) {
                case HELP -> {
                    out.print(CliArguments.USAGE);
                    yield EXIT_OK;
                }
                case CHECK -> check(arguments);
                case FIX -> fix(arguments);
                case SERVER -> new LanguageServer(in, out, checker, arguments.options(environment)).run();
            };
        } catch (RmsException e) {
            RmsLog.log(e.toLogMessage());
            err.println(e.toUserMessage());
            return EXIT_USAGE;
        }
    }

    private int check(CliArguments arguments) {
        Path path = Path.of(arguments.file());
        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(path);
        CheckResult result = checker.check(content.content(), arguments.options(environment));
        if (arguments.json()) {
            out.println(new ReportWriter().write(result.diagnostics()));
        } else {
            new CliReporter(out).report(arguments.file(), result);
        }
        return result.hasErrors() ? EXIT_ERRORS : EXIT_OK;
    }

    private int fix(CliArguments arguments) {
        Path path = Path.of(arguments.file());
        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(path);
        FixPolicy policy = arguments.unsafe() ? FixPolicy.ALLOW_UNSAFE : FixPolicy.SAFE_ONLY;
        if (arguments.dryRun()) {
            policy = policy.asDryRun();
        }
        FixResult result = checker.fix(content.content(), arguments.options(environment), policy);

        if (policy.dryRun()) {
            if (result.changed()) {
                out.println(DiffUtils.getUnifiedDiff(path.getFileName().toString(), content.content(), result.text()));
            }
            out.printf("%d fixes would be applied, %d skipped.%n", result.applied(), result.skipped());
            return EXIT_OK;
        }
        if (!result.changed()) {
            out.printf("No fixes applied, %d skipped.%n", result.skipped());
            return EXIT_OK;
        }
        byte[] bytes;
        try {
            bytes = EncodingUtils.encode(content, result.text());
        } catch (CharacterCodingException e) {
            throw RmsFileException.encoding(path, content.charset(), e);
        }
        try {
            Path backup = FileUtils.writeWithBackup(path, bytes);
            RmsLog.log("Fixed " + path + ", backup " + backup);
        } catch (IOException e) {
            throw RmsFileException.writeFailed(path, e);
        }
        out.printf("%d fixes applied, %d skipped.%n", result.applied(), result.skipped());
        return EXIT_OK;
    }
}
