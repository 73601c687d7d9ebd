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
import ru.nts.tools.rms.core.RmsParamException;
import ru.nts.tools.rms.grammar.CompatibilityTarget;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Разобранная командная строка.
 *
 * @param command       подкоманда
 * @param file          путь к скрипту (для {@code check} и {@code fix})
 * @param compatibility цель из {@code --compatibility}, если задана
 * @param json          печатать отчёт в JSON
 * @param dryRun        не записывать исправления, только показать разницу
 * @param unsafe        применять и небезопасные подсказки
 */
public record CliArguments(Command command,
                           String file,
                           Optional<CompatibilityTarget> compatibility,
                           boolean json,
                           boolean dryRun,
                           boolean unsafe) {

    public enum Command {
        CHECK, FIX, SERVER, HELP
    }

    public static final String USAGE = """
            Usage:
              rms-check [--compatibility <name>] [--json] [check] <file>
              rms-check [--compatibility <name>] fix [--dry-run] [--unsafe] <file>
              rms-check [--compatibility <name>] server
              rms-check help

            Aliases: --fix (fix), --fix-unsafe (fix --unsafe), --dry-run (fix --dry-run).
            Compatibility targets: %s
            Environment: %s sets the default compatibility target.
            """.formatted(CompatibilityTarget.knownNames(), CheckOptions.COMPATIBILITY_ENV);

    /**
     * @throws RmsParamException при неизвестной подкоманде, лишних или недостающих аргументах
     */
    public static CliArguments parse(List<String> args) {
        Command command = null;
        String file = null;
        CompatibilityTarget compatibility = null;
        boolean json = false;
        boolean dryRun = false;
        boolean unsafe = false;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--compatibility", "-c" -> {
                    if (i + 1 >= args.size()) {
                        throw RmsParamException.missing("compatibility");
                    }
                    compatibility = CheckOptions.parseTarget(args.get(++i));
                }
                case "--json" -> json = true;
                case "--dry-run" -> {
                    dryRun = true;
                    command = promote(command, Command.FIX);
                }
                case "--unsafe" -> unsafe = true;
                case "--fix" -> command = promote(command, Command.FIX);
                case "--fix-unsafe" -> {
                    unsafe = true;
                    command = promote(command, Command.FIX);
                }
                case "--help", "-h" -> command = Command.HELP;
                default -> {
                    if (arg.startsWith("--compatibility=")) {
                        compatibility = CheckOptions.parseTarget(arg.substring("--compatibility=".length()));
                    } else if (arg.startsWith("-") && arg.length() > 1) {
                        throw RmsParamException.invalid("option", arg, "one of --compatibility, --json, --fix, --fix-unsafe, --dry-run, --unsafe");
                    } else if (command == null && file == null && isCommandName(arg)) {
                        command = Command.valueOf(arg.toUpperCase());
                    } else if (file == null) {
                        file = arg;
                    } else {
                        throw RmsParamException.invalid("file", arg, "a single script path");
                    }
                }
            }
        }

        if (command == null) {
            command = file == null && args.isEmpty() ? Command.HELP : Command.CHECK;
        }
        if ((command == Command.CHECK || command == Command.FIX) && file == null) {
            throw RmsParamException.missing("file");
        }
        if (command == Command.SERVER && file != null) {
            throw RmsParamException.invalid("file", file, "no file for the server command");
        }
        if ((dryRun || unsafe) && command != Command.FIX && command != Command.HELP) {
            throw RmsParamException.invalid("option", dryRun ? "--dry-run" : "--unsafe", "only with the fix command");
        }
        return new CliArguments(command, file, Optional.ofNullable(compatibility), json, dryRun, unsafe);
    }

    /**
     * Цель совместимости: флаг, затем переменная окружения, затем {@code all}.
     */
    public CheckOptions options(Map<String, String> environment) {
        CheckOptions base = CheckOptions.fromEnvironment(environment);
        return compatibility.map(base::withCompatibility).orElse(base);
    }

    private static boolean isCommandName(String arg) {
        return switch (arg.toLowerCase()) {
            case "check", "fix", "server", "help" -> true;
            default -> false;
        };
    }

    // Флаги-псевдонимы не перебивают явную подкоманду, только отсутствие её или check.
    private static Command promote(Command current, Command target) {
        return current == null || current == Command.CHECK ? target : current;
    }
}
