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
package ru.nts.tools.rms.symbols;

import ru.nts.tools.rms.grammar.CompatibilityTarget;
import ru.nts.tools.rms.grammar.Keywords;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.text.SourceText;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Встроенные {@code #const}/{@code #define} игры по целям совместимости.
 *
 * <p>Определения хранятся ресурсами {@code rms/definitions/*.rms} в синтаксисе самих скриптов
 * и разбираются тем же парсером. Каждый слой добавляет имена к набору целей; имя видно под
 * целью, если его определяет хотя бы один слой этой цели. Загружаются один раз, далее только чтение.
 */
public final class BuiltinDefinitions {

    /**
     * Слой определений и цели, к которым он относится.
     */
    enum Layer {
        AOC("aoc.rms", CompatibilityTarget.concrete()),
        UP("up.rms", EnumSet.of(CompatibilityTarget.USERPATCH_15, CompatibilityTarget.WOLOLO_KINGDOMS)),
        HD("hd.rms", EnumSet.of(CompatibilityTarget.HD_EDITION, CompatibilityTarget.WOLOLO_KINGDOMS,
                CompatibilityTarget.DEFINITIVE_EDITION)),
        DE("de.rms", EnumSet.of(CompatibilityTarget.DEFINITIVE_EDITION));

        final String resource;
        final Set<CompatibilityTarget> targets;

        Layer(String resource, Set<CompatibilityTarget> targets) {
            this.resource = "/rms/definitions/" + resource;
            this.targets = targets;
        }
    }

    private final Map<String, Set<CompatibilityTarget>> consts;
    private final Map<String, Set<CompatibilityTarget>> defines;

    BuiltinDefinitions(Map<Layer, String> sources) {
        Map<String, Set<CompatibilityTarget>> constMap = new LinkedHashMap<>();
        Map<String, Set<CompatibilityTarget>> defineMap = new LinkedHashMap<>();
        StructureParser parser = new StructureParser();
        sources.forEach((layer, text) -> {
            Script script = parser.parse(new SourceText(text));
            for (Block block : script.allBlocks()) {
                if (!(block instanceof Block.Command command)) continue;
                Token name = command.arg(0);
                if (name == null) continue;
                Map<String, Set<CompatibilityTarget>> target = switch (command.spec().name()) {
                    case Keywords.CONST -> constMap;
                    case Keywords.DEFINE -> defineMap;
                    default -> null;
                };
                if (target != null) {
                    target.computeIfAbsent(name.text(), k -> EnumSet.noneOf(CompatibilityTarget.class))
                            .addAll(layer.targets);
                }
            }
        });
        this.consts = Collections.unmodifiableMap(constMap);
        this.defines = Collections.unmodifiableMap(defineMap);
    }

    public static BuiltinDefinitions standard() {
        return Holder.INSTANCE;
    }

    /**
     * Цели, в которых имя является встроенной константой (пустое множество, если нигде).
     */
    public Set<CompatibilityTarget> constTargets(String name) {
        return consts.getOrDefault(name, Set.of());
    }

    public Set<CompatibilityTarget> defineTargets(String name) {
        return defines.getOrDefault(name, Set.of());
    }

    /**
     * Видна ли константа под целью. Под {@link CompatibilityTarget#ALL} достаточно любой цели.
     */
    public boolean isConstVisible(String name, CompatibilityTarget target) {
        return visible(constTargets(name), target);
    }

    public boolean isDefineVisible(String name, CompatibilityTarget target) {
        return visible(defineTargets(name), target);
    }

    /**
     * Доступна ли константа под целью. Под {@link CompatibilityTarget#ALL} нужна каждая цель.
     */
    public boolean isConstAvailable(String name, CompatibilityTarget target) {
        Set<CompatibilityTarget> targets = constTargets(name);
        if (target == CompatibilityTarget.ALL) {
            return targets.containsAll(CompatibilityTarget.concrete());
        }
        return targets.contains(target);
    }

    public boolean isBuiltinConst(String name) {
        return consts.containsKey(name);
    }

    public Set<String> constNames(CompatibilityTarget target) {
        Set<String> names = new TreeSet<>();
        consts.forEach((name, targets) -> {
            if (visible(targets, target)) names.add(name);
        });
        return names;
    }

    public Set<String> defineNames(CompatibilityTarget target) {
        Set<String> names = new TreeSet<>();
        defines.forEach((name, targets) -> {
            if (visible(targets, target)) names.add(name);
        });
        return names;
    }

    private static boolean visible(Set<CompatibilityTarget> targets, CompatibilityTarget target) {
        return target == CompatibilityTarget.ALL ? !targets.isEmpty() : targets.contains(target);
    }

    private static final class Holder {
        static final BuiltinDefinitions INSTANCE = load();

        private static BuiltinDefinitions load() {
            Map<Layer, String> sources = new EnumMap<>(Layer.class);
            for (Layer layer : Layer.values()) {
                try (InputStream in = BuiltinDefinitions.class.getResourceAsStream(layer.resource)) {
                    if (in == null) {
                        throw new IllegalStateException("Missing resource " + layer.resource);
                    }
                    sources.put(layer, new String(in.readAllBytes(), StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot load " + layer.resource, e);
                }
            }
            return new BuiltinDefinitions(sources);
        }
    }
}
