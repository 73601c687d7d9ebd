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
package ru.nts.tools.rms;

import ru.nts.tools.rms.check.RmsChecker;
import ru.nts.tools.rms.cli.CliRunner;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Точка входа {@code rms-check}.
 */
public final class RmsCheckMain {

    private RmsCheckMain() {}

    public static void main(String[] args) {
        // На Windows стандартные потоки по умолчанию в системной кодировке, а отчёт и протокол идут в UTF-8.
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        return new CliRunner(new RmsChecker(), System.getenv(), System.in, out, err).run(args);
    }
}
