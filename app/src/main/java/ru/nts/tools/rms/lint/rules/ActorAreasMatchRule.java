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
package ru.nts.tools.rms.lint.rules;

import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.lint.LintContext;
import ru.nts.tools.rms.lint.LintRule;
import ru.nts.tools.rms.syntax.Block;
import ru.nts.tools.rms.syntax.Numbers;
import ru.nts.tools.rms.syntax.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ссылка на зону актёров, которую ни один {@code actor_area} не создаёт.
 * Порядок объектов в файле не учитывается: зона может быть создана в любой ветке.
 */
public final class ActorAreasMatchRule implements LintRule {

    public static final String NAME = "actor-areas-match";

    private static final String ACTOR_AREA = "actor_area";
    private static final Set<String> REFERENCES = Set.of("actor_area_to_place_in", "avoid_actor_area");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Actor areas that are referenced must be created somewhere";
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        Set<Integer> defined = new HashSet<>();
        List<Token> references = new ArrayList<>();
        for (Block block : context.script().allBlocks()) {
            if (!(block instanceof Block.Command command) || command.args().isEmpty()) continue;
            String name = command.spec().name();
            if (ACTOR_AREA.equals(name)) {
                Integer area = Numbers.parseInteger(command.args().get(0).text());
                if (area != null) defined.add(area);
            } else if (REFERENCES.contains(name)) {
                references.add(command.args().get(0));
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token reference : references) {
            Integer area = Numbers.parseInteger(reference.text());
            if (area != null && !defined.contains(area)) {
                diagnostics.add(Diagnostic.warning(NAME, reference.span(), "Actor area " + area + " is never defined"));
            }
        }
        return diagnostics;
    }
}
