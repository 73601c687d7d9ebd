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
package ru.nts.tools.rms.grammar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Таблица известных слов языка, загружаемая из ресурса {@code rms/commands.json}.
 * Загружается один раз на процесс и далее только читается, поэтому безопасна для
 * параллельных проверок.
 */
public final class CommandTable {

    private static final String RESOURCE = "/rms/commands.json";

    private final Map<String, CommandSpec> byLowerName;

    CommandTable(List<CommandSpec> specs) {
        Map<String, CommandSpec> map = new LinkedHashMap<>();
        for (CommandSpec spec : specs) {
            CommandSpec previous = map.put(spec.name().toLowerCase(Locale.ROOT), spec);
            if (previous != null) {
                throw new IllegalStateException("Duplicate command in table: " + spec.name());
            }
        }
        this.byLowerName = Collections.unmodifiableMap(map);
    }

    /**
     * Встроенная таблица.
     */
    public static CommandTable standard() {
        return Holder.INSTANCE;
    }

    /**
     * Поиск без учёта регистра: парсер распознаёт {@code Land_Percent}, а регистр проверяет отдельное правило.
     */
    public CommandSpec lookup(String word) {
        return byLowerName.get(word.toLowerCase(Locale.ROOT));
    }

    public boolean isKnown(String word) {
        return lookup(word) != null;
    }

    public Collection<CommandSpec> all() {
        return byLowerName.values();
    }

    static CommandTable load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        List<CommandSpec> specs = mapper.readValue(in, new TypeReference<List<CommandSpec>>() {});
        return new CommandTable(specs);
    }

    private static final class Holder {
        static final CommandTable INSTANCE = loadStandard();

        private static CommandTable loadStandard() {
            try (InputStream in = CommandTable.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + RESOURCE);
                }
                return load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot load " + RESOURCE, e);
            }
        }
    }
}
