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
package ru.nts.tools.rms.syntax;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор числовых форм: целые числа и вызовы {@code rnd(min,max)}.
 */
public final class Numbers {

    private static final Pattern RND = Pattern.compile("rnd\\((-?\\d+),(-?\\d+)\\)");
    private static final Pattern PAIR = Pattern.compile("\\((-?\\d+),(-?\\d+)\\)");

    private Numbers() {}

    public static boolean isInteger(String text) {
        return parseInteger(text) != null;
    }

    /**
     * @return значение или {@code null}, если это не целое число в диапазоне int.
     */
    public static Integer parseInteger(String text) {
        if (text == null || text.isEmpty()) return null;
        int start = text.charAt(0) == '-' || text.charAt(0) == '+' ? 1 : 0;
        if (start == text.length()) return null;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            // больше int: игра такое число не примет
            return null;
        }
    }

    /**
     * Корректный {@code rnd(a,b)} без пробелов.
     */
    public static boolean isValidRnd(String text) {
        Matcher m = RND.matcher(text);
        return m.matches() && isInteger(m.group(1)) && isInteger(m.group(2));
    }

    /**
     * Пара в скобках без {@code rnd}: {@code (0,5)}.
     */
    public static boolean isParenthesizedPair(String text) {
        Matcher m = PAIR.matcher(text);
        return m.matches() && isInteger(m.group(1)) && isInteger(m.group(2));
    }

    public static String stripWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) sb.append(c);
        }
        return sb.toString();
    }
}
