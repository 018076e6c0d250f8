package com.ryuqq.auditlog.application.async;

import com.ryuqq.auditlog.core.computation.DescribedComputation;
import com.ryuqq.auditlog.core.label.Labels;
import com.ryuqq.auditlog.core.outcome.Failure;
import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.outcome.Success;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 비동기 환경의 DescribedComputation.
 *
 * <p>{@link CompletableFuture}로 실행되는 계산에도 동기 버전과 같은 순차 실행 규칙을 적용합니다.</p>
 *
 * <p><strong>순서 보장:</strong></p>
 * <ul>
 *   <li>{@link #bind(Function)}는 {@code thenCompose}로 연결되어 이전 단계가 끝난 뒤에만 다음 함수를 호출</li>
 *   <li>실패가 관찰되면 다음 함수를 호출하지 않음 (트리와 사유 유지)</li>
 *   <li>함수가 던진 예외는 Failure가 아니라 future의 예외 완료로 전파</li>
 * </ul>
 *
 * <p>취소와 타임아웃은 감싸고 있는 future의 관심사이며, 트리/결과 대수는 관여하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AsyncDescribedComputation&lt;String, Quote&gt; quote = AsyncDescribedComputation
 *     .supplyAsync(() -&gt; fetchQuote(symbol), ioExecutor)
 *     .bind(q -&gt; AsyncDescribedComputation.supplyAsync(() -&gt; checkLimits(q), ioExecutor));
 *
 * DescribedComputation&lt;String, Quote&gt; finished = quote.join(2, TimeUnit.SECONDS);
 * </pre>
 *
 * @param <E> 실패 사유 타입
 * @param <V> 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class AsyncDescribedComputation<E, V> {

    private final CompletableFuture<DescribedComputation<E, V>> future;

    private AsyncDescribedComputation(CompletableFuture<DescribedComputation<E, V>> future) {
        this.future = future;
    }

    /**
     * 이미 완료된 계산을 감싸기.
     *
     * @param computation 완료된 계산
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return 완료 상태의 AsyncDescribedComputation
     * @throws IllegalArgumentException computation이 null인 경우
     */
    public static <E, V> AsyncDescribedComputation<E, V> completed(DescribedComputation<E, V> computation) {
        if (computation == null) {
            throw new IllegalArgumentException("computation cannot be null");
        }
        return new AsyncDescribedComputation<>(CompletableFuture.completedFuture(computation));
    }

    /**
     * CompletionStage를 감싸기.
     *
     * @param stage 계산을 완료할 stage
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return AsyncDescribedComputation
     * @throws IllegalArgumentException stage가 null인 경우
     */
    public static <E, V> AsyncDescribedComputation<E, V> of(CompletionStage<DescribedComputation<E, V>> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return new AsyncDescribedComputation<>(stage.toCompletableFuture());
    }

    /**
     * executor에서 계산 실행.
     *
     * @param supplier 계산 공급자
     * @param executor 실행할 executor
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return 실행 중인 AsyncDescribedComputation
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <E, V> AsyncDescribedComputation<E, V> supplyAsync(
        Supplier<DescribedComputation<E, V>> supplier,
        Executor executor
    ) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return new AsyncDescribedComputation<>(CompletableFuture.supplyAsync(supplier, executor));
    }

    /**
     * 비동기 순차 실행.
     *
     * @param next 다음 단계 함수 (이전 단계 완료 후, 성공일 때만 호출)
     * @param <B> 다음 값 타입
     * @return 순차 실행 결과
     * @throws IllegalArgumentException next가 null인 경우
     */
    public <B> AsyncDescribedComputation<E, B> bind(Function<? super V, AsyncDescribedComputation<E, B>> next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        CompletableFuture<DescribedComputation<E, B>> chained = future.thenCompose(current -> sequence(current, next));
        return new AsyncDescribedComputation<>(chained);
    }

    /**
     * 동기 단계로 순차 실행.
     *
     * @param next 다음 단계 함수
     * @param <B> 다음 값 타입
     * @return 순차 실행 결과
     */
    public <B> AsyncDescribedComputation<E, B> bindSync(Function<? super V, DescribedComputation<E, B>> next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        CompletableFuture<DescribedComputation<E, B>> chained = future.thenApply(current -> current.bind(next));
        return new AsyncDescribedComputation<>(chained);
    }

    /**
     * 설명 없이 값만 변환.
     *
     * @param mapper 값 변환 함수
     * @param <B> 새로운 값 타입
     * @return 변환된 계산
     */
    public <B> AsyncDescribedComputation<E, B> map(Function<? super V, ? extends B> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        CompletableFuture<DescribedComputation<E, B>> mapped = future.thenApply(current -> current.map(mapper));
        return new AsyncDescribedComputation<>(mapped);
    }

    /**
     * 완료 시 전체 블록에 설명 부여.
     *
     * @param description 블록 설명
     * @return 라벨이 붙은 계산
     * @see Labels#labelBlock(DescribedComputation, String)
     */
    public AsyncDescribedComputation<E, V> labelBlock(String description) {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        CompletableFuture<DescribedComputation<E, V>> labeled =
            future.thenApply(current -> Labels.labelBlock(current, description));
        return new AsyncDescribedComputation<>(labeled);
    }

    /**
     * 제한 시간 지정.
     *
     * <p>시간 내 완료되지 않으면 {@link TimeoutException}으로 예외 완료됩니다.
     * 제한 시간은 반환된 계산에만 적용되며 이 계산은 영향을 받지 않습니다.</p>
     *
     * @param timeout 제한 시간
     * @param unit 시간 단위
     * @return 제한 시간이 적용된 계산
     */
    public AsyncDescribedComputation<E, V> orTimeout(long timeout, TimeUnit unit) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        return new AsyncDescribedComputation<>(future.copy().orTimeout(timeout, unit));
    }

    /**
     * 완료까지 대기.
     *
     * <p>인터럽트 발생 시 인터럽트 플래그를 복원하고 {@link IllegalStateException}으로 래핑합니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 완료된 계산
     * @throws IllegalStateException 인터럽트, 타임아웃, 또는 단계에서 예외가 발생한 경우
     */
    public DescribedComputation<E, V> join(long timeout, TimeUnit unit) {
        try {
            return future.get(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Waiting for computation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Computation step threw an exception", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Computation did not complete within " + timeout + " " + unit, e);
        }
    }

    private static <E, V, B> CompletionStage<DescribedComputation<E, B>> sequence(
        DescribedComputation<E, V> current,
        Function<? super V, AsyncDescribedComputation<E, B>> next
    ) {
        if (current.outcome() instanceof Failure<E, V> failure) {
            Outcome<E, B> stopped = Outcome.failure(failure.reason());
            return CompletableFuture.completedFuture(DescribedComputation.of(current.tree(), stopped));
        }
        V value = ((Success<E, V>) current.outcome()).value();
        AsyncDescribedComputation<E, B> following = next.apply(value);
        if (following == null) {
            throw new IllegalArgumentException("next returned null for value: " + value);
        }
        return following.future.thenApply(result -> current.bind(ignored -> result));
    }

    /**
     * 완료 결과를 따르는 future 조회.
     *
     * <p>반환된 future를 완료시키거나 취소해도 이 계산에는 영향이 없습니다.</p>
     *
     * @return 이 계산과 함께 완료되는 새 future
     */
    public CompletableFuture<DescribedComputation<E, V>> toCompletableFuture() {
        return future.copy();
    }
}
