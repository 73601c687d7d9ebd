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
package ru.nts.tools.rms.lint;

import ru.nts.tools.rms.core.CancellationToken;
import ru.nts.tools.rms.core.RmsLog;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.DiagnosticAggregator;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.lint.rules.ActorAreasMatchRule;
import ru.nts.tools.rms.lint.rules.ArgTypesRule;
import ru.nts.tools.rms.lint.rules.AttributeCaseRule;
import ru.nts.tools.rms.lint.rules.CommentContentsRule;
import ru.nts.tools.rms.lint.rules.CommentSyntaxRule;
import ru.nts.tools.rms.lint.rules.CompatibilityRule;
import ru.nts.tools.rms.lint.rules.DeadCommentRule;
import ru.nts.tools.rms.lint.rules.IncludeRule;
import ru.nts.tools.rms.lint.rules.IncorrectSectionRule;
import ru.nts.tools.rms.lint.rules.RndSyntaxRule;
import ru.nts.tools.rms.lint.rules.UnknownTokenRule;
import ru.nts.tools.rms.text.Position;
import ru.nts.tools.rms.text.SourceText;
import ru.nts.tools.rms.text.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Запускает правила и собирает их результаты в один упорядоченный отчёт.
 *
 * <p>Правила выполняются на общем пуле потоков, каждое пишет в собственный список.
 * Порядок регистрации правил фиксирован и участвует в сортировке отчёта, поэтому
 * результат не зависит от того, в каком порядке правила фактически завершились.
 * Ошибка внутри правила не роняет проверку: она превращается в одну диагностику {@link #INTERNAL_ERROR}.
 */
public final class LintEngine {

    public static final String INTERNAL_ERROR = "internal-error";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService POOL = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()),
            task -> {
                Thread thread = new Thread(task, "rms-lint-" + THREAD_COUNTER.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });

    private final List<LintRule> rules;

    public LintEngine(List<LintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public LintEngine() {
        this(defaultRules());
    }

    /**
     * Все правила в порядке регистрации.
     */
    public static List<LintRule> defaultRules() {
        return List.of(
                new CommentSyntaxRule(),
                new RndSyntaxRule(),
                new ArgTypesRule(),
                new UnknownTokenRule(),
                new CompatibilityRule(),
                new AttributeCaseRule(),
                new IncorrectSectionRule(),
                new IncludeRule(),
                new ActorAreasMatchRule(),
                new DeadCommentRule(),
                new CommentContentsRule());
    }

    public List<LintRule> rules() {
        return rules;
    }

    /**
     * Выполняет все правила и возвращает отсортированный отчёт без дубликатов,
     * включая структурные ошибки парсера.
     *
     * @throws CancellationException если проверка отменена; частичный отчёт не возвращается
     */
    public List<Diagnostic> run(LintContext context, CancellationToken cancellation, boolean parallel) {
        DiagnosticAggregator aggregator = new DiagnosticAggregator();
        aggregator.add(0, context.script().diagnostics());

        if (parallel) {
            List<CompletableFuture<List<Diagnostic>>> futures = new ArrayList<>(rules.size());
            for (LintRule rule : rules) {
                futures.add(CompletableFuture.supplyAsync(() -> runRule(rule, context, cancellation), POOL));
            }
            for (int i = 0; i < futures.size(); i++) {
                aggregator.add(i + 1, join(futures.get(i)));
            }
        } else {
            for (int i = 0; i < rules.size(); i++) {
                aggregator.add(i + 1, runRule(rules.get(i), context, cancellation));
            }
        }
        cancellation.throwIfCancelled();
        return aggregator.build();
    }

    private static List<Diagnostic> join(CompletableFuture<List<Diagnostic>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException cancelled) {
                throw cancelled;
            }
            throw e;
        }
    }

    private static List<Diagnostic> runRule(LintRule rule, LintContext context, CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        List<Diagnostic> produced;
        try {
            produced = rule.check(context);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            RmsLog.log("Rule " + rule.getName() + " failed", e);
            return List.of(internalError(rule, e.toString()));
        }
        return validate(rule, context.source(), produced);
    }

    /**
     * Диагностика или подсказка за пределами документа считается ошибкой правила.
     */
    private static List<Diagnostic> validate(LintRule rule, SourceText source, List<Diagnostic> produced) {
        List<Diagnostic> result = new ArrayList<>(produced.size());
        for (Diagnostic diagnostic : produced) {
            boolean inBounds = source.contains(diagnostic.span());
            for (Suggestion suggestion : diagnostic.suggestions()) {
                inBounds &= source.contains(suggestion.span());
            }
            if (inBounds) {
                result.add(diagnostic);
            } else {
                RmsLog.log("Rule " + rule.getName() + " produced a span outside the document: " + diagnostic);
                result.add(internalError(rule, "span outside the document for `" + diagnostic.message() + "`"));
            }
        }
        return result;
    }

    private static Diagnostic internalError(LintRule rule, String detail) {
        return Diagnostic.error(INTERNAL_ERROR, Span.at(Position.START),
                "Internal error in rule " + rule.getName() + ": " + detail);
    }
}
