package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.graph.DependencyGraph;
import com.vtb.supplychain.models.AnalysisReport;
import com.vtb.supplychain.models.DegradationLevel;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.PackageIdentity;
import com.vtb.supplychain.models.SkipReason;
import com.vtb.supplychain.models.StageResult;
import com.vtb.supplychain.models.StageStatus;
import com.vtb.supplychain.models.SynthesisResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Последовательно выполняет этапы анализа с общим дедлайном и таймаутом на каждый этап.
 *
 * Этап перед запуском проверяет условие пропуска и остаток бюджета. Ошибка или таймаут
 * исполнителя приводят к одному повтору, если бюджета хватает на задержку и минимальный
 * запас этапа. Попытка, превысившая таймаут, отменяется, ее результат отбрасывается.
 * Если этап синтеза не дал корректного результата, итоги формирует
 * {@link FallbackSynthesizer}. Сбои этапов не выходят за пределы {@link #run}: они
 * отражаются в статусах {@link StageResult} и флаге деградации отчета.
 */
@Slf4j
public class StageOrchestrator {

    public enum State {
        IDLE,
        RUNNING,
        COMPLETED
    }

    static final String BUDGET_EXHAUSTED = "budget exhausted";

    private final SynthesisValidator validator;
    private final FallbackSynthesizer fallbackSynthesizer;
    private volatile State state = State.IDLE;

    public StageOrchestrator() {
        this(new SynthesisValidator(), new FallbackSynthesizer());
    }

    public StageOrchestrator(SynthesisValidator validator, FallbackSynthesizer fallbackSynthesizer) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.fallbackSynthesizer = Objects.requireNonNull(fallbackSynthesizer, "fallbackSynthesizer");
    }

    public State getState() {
        return state;
    }

    public AnalysisReport run(Set<PackageIdentity> packages,
                              List<StageDescriptor> pipeline,
                              Duration globalBudget) {
        return run(packages, List.of(), pipeline, globalBudget, null);
    }

    /**
     * @param packages        пакеты для анализа
     * @param initialFindings находки rule-based детекторов, известные до запуска
     * @param pipeline        этапы в порядке выполнения; синтез последний
     * @param globalBudget    общее время на весь прогон
     * @param graph           граф зависимостей, может быть null
     * @return отчет; возвращается всегда, даже если все этапы завершились неудачно
     */
    public synchronized AnalysisReport run(Set<PackageIdentity> packages,
                                           List<Finding> initialFindings,
                                           List<StageDescriptor> pipeline,
                                           Duration globalBudget,
                                           DependencyGraph graph) {
        Objects.requireNonNull(packages, "packages");
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(globalBudget, "globalBudget");
        validatePipeline(pipeline);

        Set<PackageIdentity> packageView = new LinkedHashSet<>();
        for (PackageIdentity pkg : packages) {
            if (pkg != null) {
                packageView.add(pkg);
            }
        }

        state = State.RUNNING;
        Instant startedAt = Instant.now();
        ExecutorService workers = Executors.newCachedThreadPool(new StageThreadFactory());
        Run run = new Run(
            Collections.unmodifiableSet(packageView),
            graph != null ? graph : DependencyGraph.empty(),
            Deadline.after(globalBudget),
            workers);
        run.accumulator.merge(initialFindings);

        log.info("Запуск конвейера: {} этапов, {} пакетов, {} исходных находок, бюджет {} мс",
            pipeline.size(), packageView.size(), run.accumulator.size(), globalBudget.toMillis());
        try {
            for (StageDescriptor descriptor : pipeline) {
                StageResult result;
                try {
                    result = run.execute(descriptor);
                } catch (RuntimeException e) {
                    log.error("Непредвиденная ошибка этапа {}: {}", descriptor.getName(), e.getMessage(), e);
                    result = StageResult.builder()
                        .stageName(descriptor.getName())
                        .status(StageStatus.FAILED)
                        .error(describe(e))
                        .build();
                    if (descriptor.isSynthesis()) {
                        run.applyFallback(result);
                    }
                }
                run.results.add(result);
            }
            if (run.synthesis == null) {
                run.synthesis = fallbackSynthesizer.synthesize(run.accumulator.snapshot(), run.packages);
            }
        } finally {
            workers.shutdownNow();
        }

        AnalysisReport report = buildReport(run, startedAt);
        state = State.COMPLETED;
        log.info("Конвейер завершен за {} мс: {} находок, уровень {}{}",
            report.getTotalDurationMs(), report.getFindings().size(), report.getDegradationLevel(),
            report.isDegraded() ? " (деградация)" : "");
        return report;
    }

    private AnalysisReport buildReport(Run run, Instant startedAt) {
        boolean degraded = false;
        int attempted = 0;
        int succeeded = 0;
        for (StageResult result : run.results) {
            if (result.getStatus() == StageStatus.FAILED
                || result.getStatus() == StageStatus.TIMED_OUT
                || result.isBudgetSkip()
                || result.isFallbackUsed()) {
                degraded = true;
            }
            if (!result.isPredicateSkip()) {
                attempted++;
                if (result.isSuccess()) {
                    succeeded++;
                }
            }
        }
        DegradationLevel level = attempted == 0
            ? DegradationLevel.MINIMAL
            : DegradationLevel.fromSuccessRate((double) succeeded / attempted);

        return AnalysisReport.builder()
            .packagesAnalyzed(run.packages.size())
            .findings(run.accumulator.snapshot())
            .stageResults(run.results)
            .degraded(degraded)
            .degradationLevel(level)
            .confidence(level.getConfidence())
            .dependencyGraphSummary(run.graph.summary())
            .synthesis(run.synthesis)
            .startedAt(startedAt)
            .completedAt(Instant.now())
            .totalDurationMs(run.deadline.elapsedMs())
            .build();
    }

    static void validatePipeline(List<StageDescriptor> pipeline) {
        if (pipeline.isEmpty()) {
            throw new IllegalArgumentException("Конвейер не содержит этапов");
        }
        Set<String> names = new HashSet<>();
        int synthesisStages = 0;
        for (StageDescriptor descriptor : pipeline) {
            if (descriptor == null) {
                throw new IllegalArgumentException("Конвейер содержит пустой этап");
            }
            String name = descriptor.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Этап без имени");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Повторяющееся имя этапа: " + name);
            }
            if (descriptor.getExecutor() == null) {
                throw new IllegalArgumentException("Не задан исполнитель этапа " + name);
            }
            Duration timeout = descriptor.getTimeout();
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("Некорректный таймаут этапа " + name + ": " + timeout);
            }
            if (descriptor.isSynthesis()) {
                synthesisStages++;
            }
        }
        if (synthesisStages != 1) {
            throw new IllegalArgumentException("Конвейер должен содержать ровно один этап синтеза, найдено: "
                + synthesisStages);
        }
        if (!pipeline.get(pipeline.size() - 1).isSynthesis()) {
            throw new IllegalArgumentException("Этап синтеза должен быть последним");
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        return message != null && !message.isBlank() ? type + ": " + message : type;
    }

    /**
     * Состояние одного прогона. Живет только на управляющем потоке.
     */
    private final class Run {
        final Set<PackageIdentity> packages;
        final DependencyGraph graph;
        final Deadline deadline;
        final ExecutorService workers;
        final FindingAccumulator accumulator = new FindingAccumulator();
        final List<StageResult> results = new ArrayList<>();
        SynthesisResult synthesis;

        Run(Set<PackageIdentity> packages, DependencyGraph graph, Deadline deadline, ExecutorService workers) {
            this.packages = packages;
            this.graph = graph;
            this.deadline = deadline;
            this.workers = workers;
        }

        StageResult execute(StageDescriptor descriptor) {
            String name = descriptor.getName();
            // синтез выполняется всегда
            if (!descriptor.isSynthesis() && shouldSkip(descriptor)) {
                log.info("Этап {} пропущен: по накопленным находкам запуск не требуется", name);
                return StageResult.builder()
                    .stageName(name)
                    .status(StageStatus.SKIPPED)
                    .skipReason(SkipReason.PREDICATE)
                    .build();
            }

            Duration remaining = deadline.remaining();
            if (remaining.isZero() || remaining.compareTo(descriptor.getMinimumBudget()) < 0) {
                log.warn("Этап {} пропущен: остаток бюджета {} мс меньше необходимого {} мс",
                    name, remaining.toMillis(), descriptor.getMinimumBudget().toMillis());
                StageResult result = StageResult.builder()
                    .stageName(name)
                    .status(StageStatus.SKIPPED)
                    .skipReason(SkipReason.BUDGET_EXHAUSTED)
                    .error(BUDGET_EXHAUSTED)
                    .build();
                if (descriptor.isSynthesis()) {
                    applyFallback(result);
                }
                return result;
            }

            long startNanos = System.nanoTime();
            int attempts = 0;
            StageAttempt attempt;
            while (true) {
                attempts++;
                attempt = invoke(descriptor);
                if (descriptor.isSynthesis() && attempt.kind() == StageAttempt.Kind.SUCCESS) {
                    attempt = validateSynthesis(name, attempt);
                }
                if (!attempt.isRetryable() || attempts > descriptor.effectiveRetries()) {
                    break;
                }
                if (!awaitRetry(descriptor, attempt)) {
                    break;
                }
            }
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return complete(descriptor, attempt, attempts, durationMs);
        }

        private boolean shouldSkip(StageDescriptor descriptor) {
            SkipPredicate predicate = descriptor.getSkipPredicate();
            if (predicate == null) {
                return false;
            }
            try {
                return predicate.shouldSkip(Collections.unmodifiableList(accumulator.snapshot()));
            } catch (RuntimeException e) {
                log.warn("Ошибка условия пропуска этапа {}, этап будет выполнен: {}",
                    descriptor.getName(), e.getMessage(), e);
                return false;
            }
        }

        private StageAttempt invoke(StageDescriptor descriptor) {
            Duration timeout = deadline.cap(descriptor.getTimeout());
            if (timeout.isZero()) {
                return StageAttempt.timeout("глобальный бюджет исчерпан до запуска попытки");
            }
            StageInput input = StageInput.builder()
                .packages(packages)
                .findings(Collections.unmodifiableList(accumulator.snapshot()))
                .graph(graph)
                .previousResults(List.copyOf(results))
                .build();
            StageExecutor executor = descriptor.getExecutor();
            Future<StageOutput> future = workers.submit(() -> executor.execute(input, timeout));
            try {
                StageOutput output = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
                if (output == null) {
                    return StageAttempt.error("исполнитель вернул пустой результат");
                }
                return StageAttempt.success(output);
            } catch (TimeoutException e) {
                future.cancel(true);
                return StageAttempt.timeout("таймаут " + timeout.toMillis() + " мс");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.debug("Исполнитель этапа {} завершился ошибкой", descriptor.getName(), cause);
                return StageAttempt.error(describe(cause));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return StageAttempt.error("поток оркестратора прерван");
            }
        }

        private StageAttempt validateSynthesis(String name, StageAttempt attempt) {
            try {
                validator.validate(attempt.output().getSynthesis());
                return attempt;
            } catch (SynthesisValidationException e) {
                log.warn("Результат этапа {} отклонен: {}", name, e.getMessage());
                return StageAttempt.invalid("SynthesisValidation: " + e.getMessage());
            }
        }

        private boolean awaitRetry(StageDescriptor descriptor, StageAttempt failed) {
            Duration delay = descriptor.getRetryDelay() != null ? descriptor.getRetryDelay() : Duration.ZERO;
            Duration remaining = deadline.remaining();
            if (remaining.isZero() || remaining.compareTo(delay.plus(descriptor.getMinimumBudget())) < 0) {
                log.warn("Этап {} не повторяется: остатка бюджета {} мс недостаточно",
                    descriptor.getName(), remaining.toMillis());
                return false;
            }
            log.info("Повтор этапа {} через {} мс после сбоя: {}",
                descriptor.getName(), delay.toMillis(), failed.error());
            long sleepMs = deadline.cap(delay).toMillis();
            if (sleepMs <= 0) {
                return true;
            }
            try {
                Thread.sleep(sleepMs);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Ожидание повтора этапа {} прервано", descriptor.getName());
                return false;
            }
        }

        private StageResult complete(StageDescriptor descriptor, StageAttempt attempt, int attempts, long durationMs) {
            String name = descriptor.getName();
            StageResult result = StageResult.builder()
                .stageName(name)
                .durationMs(durationMs)
                .attempts(attempts)
                .build();

            switch (attempt.kind()) {
                case SUCCESS -> {
                    List<Finding> produced = new ArrayList<>();
                    List<Finding> returned = attempt.output().getFindings();
                    if (returned != null) {
                        for (Finding finding : returned) {
                            if (finding != null) {
                                produced.add(finding.copy());
                            }
                        }
                    }
                    int added = accumulator.merge(produced);
                    result.setStatus(StageStatus.SUCCESS);
                    result.setProducedFindings(produced);
                    if (descriptor.isSynthesis()) {
                        synthesis = attempt.output().getSynthesis();
                    }
                    log.info("Этап {} завершен за {} мс: находок {}, новых {}", name, durationMs, produced.size(), added);
                }
                case TIMEOUT -> {
                    result.setStatus(StageStatus.TIMED_OUT);
                    result.setError(attempt.error());
                    log.warn("Этап {} прерван по таймауту: {}", name, attempt.error());
                }
                default -> {
                    result.setStatus(StageStatus.FAILED);
                    result.setError(attempt.error());
                    log.warn("Этап {} завершился ошибкой после {} попыток: {}", name, attempts, attempt.error());
                }
            }

            if (descriptor.isSynthesis() && attempt.kind() != StageAttempt.Kind.SUCCESS) {
                applyFallback(result);
            }
            return result;
        }

        void applyFallback(StageResult result) {
            synthesis = fallbackSynthesizer.synthesize(accumulator.snapshot(), packages);
            result.setFallbackUsed(true);
            log.warn("Итоги сформированы локально: этап {} завершился со статусом {}",
                result.getStageName(), result.getStatus());
        }
    }

    private static final class StageThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "stage-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
