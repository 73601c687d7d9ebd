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
package ru.nts.tools.rms.server;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Кадрирование сообщений протокола редактора: заголовки {@code Content-Length: N},
 * пустая строка и ровно N байт тела в UTF-8.
 */
public final class MessageTransport {

    private static final String CONTENT_LENGTH = "content-length";

    private final InputStream in;
    private final OutputStream out;

    public MessageTransport(InputStream in, OutputStream out) {
        this.in = new BufferedInputStream(in);
        this.out = out;
    }

    /**
     * Читает следующее сообщение.
     *
     * @return тело сообщения или {@code null}, если поток закончился между сообщениями
     * @throws IOException при обрыве посреди сообщения или некорректных заголовках
     */
    public String read() throws IOException {
        int length = -1;
        boolean sawHeader = false;
        while (true) {
            String line = readHeaderLine();
            if (line == null) {
                if (sawHeader) throw new EOFException("Stream ended inside message headers");
                return null;
            }
            if (line.isEmpty()) {
                if (!sawHeader) continue;
                break;
            }
            sawHeader = true;
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().toLowerCase(Locale.ROOT).equals(CONTENT_LENGTH)) {
                try {
                    length = Integer.parseInt(line.substring(colon + 1).trim());
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid Content-Length header: " + line, e);
                }
            }
        }
        if (length < 0) {
            throw new IOException("Message without Content-Length header");
        }
        byte[] body = in.readNBytes(length);
        if (body.length < length) {
            throw new EOFException("Stream ended inside message body");
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return строка заголовка без {@code \r\n} или {@code null} в конце потока
     */
    private String readHeaderLine() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                String line = buffer.toString(StandardCharsets.US_ASCII);
                return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            }
            buffer.write(b);
        }
        return buffer.size() == 0 ? null : buffer.toString(StandardCharsets.US_ASCII);
    }

    /**
     * Синхронизированная отправка: ответы и уведомления пишутся из разных потоков.
     */
    public synchronized void write(String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        out.write(("Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }
}
