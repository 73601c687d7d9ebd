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
package ru.nts.tools.rms.core;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Минимальный журнал отладки.
 *
 * stdout занят протоколом (режим server) или отчётом (режим check), поэтому журнал
 * пишется только в файл из RMS_CHECK_LOG_FILE и, при RMS_CHECK_DEBUG=true, дублируется в stderr.
 */
public final class RmsLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("RMS_CHECK_DEBUG"));

    private static final String LOG_FILE = System.getenv("RMS_CHECK_LOG_FILE");
    private static final PrintWriter logWriter = openLogWriter();

    private RmsLog() {}

    private static PrintWriter openLogWriter() {
        if (LOG_FILE == null || LOG_FILE.isBlank()) {
            return null;
        }
        try {
            return new PrintWriter(new FileWriter(LOG_FILE, true), true);
        } catch (IOException e) {
            System.err.println("rms-check: cannot open log file " + LOG_FILE + ": " + e.getMessage());
            return null;
        }
    }

    public static boolean isDebug() {
        return DEBUG;
    }

    /**
     * Записывает сообщение в лог-файл (если настроен).
     */
    public static void log(String message) {
        if (logWriter != null) {
            synchronized (logWriter) {
                logWriter.println("[" + LocalDateTime.now() + "] " + message);
            }
        }
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Записывает сообщение вместе со стеком исключения.
     */
    public static void log(String message, Throwable error) {
        log(message + ": " + error.getClass().getName() + ": " + error.getMessage());
        if (logWriter != null) {
            synchronized (logWriter) {
                error.printStackTrace(logWriter);
            }
        }
    }
}
