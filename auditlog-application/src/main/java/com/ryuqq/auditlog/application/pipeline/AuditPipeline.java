package com.ryuqq.auditlog.application.pipeline;

import com.ryuqq.auditlog.application.async.AsyncDescribedComputation;
import com.ryuqq.auditlog.core.computation.DescribedComputation;
import com.ryuqq.auditlog.core.label.Labels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 이름 붙은 단계들의 감사 파이프라인.
 *
 * <p>단계들을 순서대로 bind하여 실행하고, 전체 트리를 파이프라인 이름으로 감쌉니다.
 * 실패한 단계 이후의 단계는 호출되지 않으며 트리에도 나타나지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 값을 pure 계산으로 시작</li>
 *   <li>각 단계를 bind (labelStages 설정 시 단계 이름으로 labelBlock)</li>
 *   <li>실패가 관찰되면 남은 단계 생략</li>
 *   <li>전체 트리를 파이프라인 이름으로 labelBlock</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AuditPipeline&lt;String, Order, Receipt&gt; pipeline = AuditPipeline.&lt;String, Order&gt;named("process order")
 *     .then("validate", validator::validate)
 *     .then("charge", payments::charge)
 *     .then("book", ledger::book);
 *
 * DescribedComputation&lt;String, Receipt&gt; result = pipeline.run(order);
 * </pre>
 *
 * <p>인스턴스는 불변이며 thread-safe합니다. {@link #then}은 새 파이프라인을 반환합니다.</p>
 *
 * <p>비동기 실행이 제한 시간을 넘기면 아직 시작하지 않은 단계는 실행되지 않습니다.
 * 이미 실행 중인 단계는 중단되지 않습니다.</p>
 *
 * @param <E> 실패 사유 타입
 * @param <I> 입력 타입
 * @param <O> 최종 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class AuditPipeline<E, I, O> {

    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);

    private final String name;
    private final PipelineConfig config;
    private final List<String> stageNames;
    private final BiFunction<I, RunContext, DescribedComputation<E, O>> chain;
    private final AsyncChain<E, I, O> asyncChain;

    /**
     * 비동기 실행 체인.
     */
    @FunctionalInterface
    private interface AsyncChain<E, I, O> {
        AsyncDescribedComputation<E, O> start(I input, RunContext context, Executor executor);
    }

    /**
     * 한 번의 실행 상태 (실행된 단계 수, 타임아웃 여부).
     */
    private static final class RunContext {
        private final AtomicInteger executed = new AtomicInteger();
        private volatile boolean cancelled;

        int executed() {
            return executed.get();
        }

        void stageStarted() {
            executed.incrementAndGet();
        }

        boolean isCancelled() {
            return cancelled;
        }

        void cancel() {
            cancelled = true;
        }
    }

    private AuditPipeline(
        String name,
        PipelineConfig config,
        List<String> stageNames,
        BiFunction<I, RunContext, DescribedComputation<E, O>> chain,
        AsyncChain<E, I, O> asyncChain
    ) {
        this.name = name;
        this.config = config;
        this.stageNames = List.copyOf(stageNames);
        this.chain = chain;
        this.asyncChain = asyncChain;
    }

    /**
     * 기본 설정으로 빈 파이프라인 생성.
     *
     * @param name 파이프라인 이름 (루트 설명)
     * @param <E> 실패 사유 타입
     * @param <I> 입력 타입
     * @return 단계가 없는 파이프라인
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public static <E, I> AuditPipeline<E, I, I> named(String name) {
        return named(name, new PipelineConfig());
    }

    /**
     * 빈 파이프라인 생성.
     *
     * @param name 파이프라인 이름 (루트 설명)
     * @param config 설정
     * @param <E> 실패 사유 타입
     * @param <I> 입력 타입
     * @return 단계가 없는 파이프라인
     * @throws IllegalArgumentException name이 null/blank이거나 config가 null인 경우
     */
    public static <E, I> AuditPipeline<E, I, I> named(String name, PipelineConfig config) {
        requireName(name, "name");
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        BiFunction<I, RunContext, DescribedComputation<E, I>> start =
            (input, context) -> DescribedComputation.pure(input);
        AsyncChain<E, I, I> asyncStart =
            (input, context, executor) -> AsyncDescribedComputation.completed(DescribedComputation.pure(input));
        return new AuditPipeline<E, I, I>(name, config, List.of(), start, asyncStart);
    }

    /**
     * 단계를 추가한 새 파이프라인 생성.
     *
     * @param stageName 단계 이름
     * @param stage 단계
     * @param <N> 새로운 최종 값 타입
     * @return 단계가 추가된 파이프라인
     * @throws IllegalArgumentException stageName이 null/blank이거나 stage가 null인 경우
     */
    public <N> AuditPipeline<E, I, N> then(String stageName, Stage<E, ? super O, N> stage) {
        requireName(stageName, "stageName");
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        List<String> names = new ArrayList<>(stageNames);
        names.add(stageName);

        BiFunction<I, RunContext, DescribedComputation<E, O>> previous = chain;
        AsyncChain<E, I, O> previousAsync = asyncChain;

        BiFunction<I, RunContext, DescribedComputation<E, N>> extended = (input, context) ->
            previous.apply(input, context)
                .bind(value -> execute(stageName, context, () -> stage.apply(value)));
        AsyncChain<E, I, N> extendedAsync = (input, context, executor) ->
            previousAsync.start(input, context, executor)
                .bind(value -> AsyncDescribedComputation.<E, N>supplyAsync(
                    () -> execute(stageName, context, () -> stage.apply(value)), executor));

        return new AuditPipeline<E, I, N>(name, config, names, extended, extendedAsync);
    }

    /**
     * 현재 스레드에서 동기 실행.
     *
     * @param input 입력 값 (null 허용)
     * @return 파이프라인 이름을 루트로 가진 계산
     * @throws RuntimeException 단계가 예외를 던진 경우 그대로 전파
     * @throws IllegalStateException 단계가 null을 반환한 경우
     */
    public DescribedComputation<E, O> run(I input) {
        log.debug("Pipeline '{}' started with {} stages", name, stageNames.size());
        RunContext context = new RunContext();

        DescribedComputation<E, O> finished = Labels.labelBlock(chain.apply(input, context), name);
        logCompletion(finished, context.executed());
        return finished;
    }

    /**
     * executor에서 단계별로 비동기 실행.
     *
     * <p>각 단계는 이전 단계가 완료된 뒤에 executor에 제출됩니다.
     * 전체 실행은 {@link PipelineConfig#timeoutMs()} 안에 끝나야 하며,
     * 시간이 초과되면 남은 단계는 호출되지 않습니다.</p>
     *
     * @param input 입력 값 (null 허용)
     * @param executor 단계 실행 executor
     * @return 실행 중인 계산
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public AsyncDescribedComputation<E, O> runAsync(I input, Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        log.debug("Pipeline '{}' submitted with {} stages", name, stageNames.size());
        RunContext context = new RunContext();

        CompletableFuture<DescribedComputation<E, O>> finished = asyncChain.start(input, context, executor)
            .labelBlock(name)
            .orTimeout(config.timeoutMs(), TimeUnit.MILLISECONDS)
            .toCompletableFuture()
            .whenComplete((result, error) -> {
                if (error != null) {
                    context.cancel();
                    log.error("Pipeline '{}' did not complete after {} stages", name, context.executed(), error);
                } else {
                    logCompletion(result, context.executed());
                }
            });
        return AsyncDescribedComputation.of(finished);
    }

    /**
     * 파이프라인 이름 조회.
     *
     * @return 파이프라인 이름
     */
    public String name() {
        return name;
    }

    /**
     * 단계 이름 목록 조회.
     *
     * @return 실행 순서의 단계 이름
     */
    public List<String> stageNames() {
        return stageNames;
    }

    /**
     * 설정 조회.
     *
     * @return 파이프라인 설정
     */
    public PipelineConfig config() {
        return config;
    }

    private <B> DescribedComputation<E, B> execute(
        String stageName,
        RunContext context,
        Supplier<DescribedComputation<E, B>> body
    ) {
        if (context.isCancelled()) {
            log.debug("Stage '{}' of pipeline '{}' skipped after timeout", stageName, name);
            throw new CancellationException("Pipeline '" + name + "' timed out before stage '" + stageName + "'");
        }
        context.stageStarted();
        log.debug("Stage '{}' of pipeline '{}' started", stageName, name);

        DescribedComputation<E, B> result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            log.error("Stage '{}' of pipeline '{}' threw an exception", stageName, name, e);
            throw e;
        }
        if (result == null) {
            throw new IllegalStateException("Stage '" + stageName + "' of pipeline '" + name + "' returned null");
        }

        log.debug("Stage '{}' of pipeline '{}' finished: success={}", stageName, name, result.isSuccess());
        return config.labelStages() ? Labels.labelBlock(result, stageName) : result;
    }

    private void logCompletion(DescribedComputation<E, O> finished, int executed) {
        if (finished.isSuccess()) {
            log.info("Pipeline '{}' completed: {} of {} stages executed", name, executed, stageNames.size());
        } else {
            String failedStage = executed > 0 ? stageNames.get(executed - 1) : name;
            String reason = finished.outcome().fold(value -> "", failure -> String.valueOf(failure));
            log.warn("Pipeline '{}' stopped at stage '{}' ({} of {} stages executed): {}",
                name, failedStage, executed, stageNames.size(), reason);
        }
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }
}
