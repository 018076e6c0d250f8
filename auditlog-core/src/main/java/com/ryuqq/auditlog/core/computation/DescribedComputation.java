package com.ryuqq.auditlog.core.computation;

import com.ryuqq.auditlog.core.outcome.Failure;
import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.outcome.Success;
import com.ryuqq.auditlog.core.tree.LogTree;
import com.ryuqq.auditlog.core.tree.TreeCombiner;
import com.ryuqq.auditlog.core.tree.Undescribed;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 감사 트리와 결과의 쌍.
 *
 * <p>계산이 실제로 수행한 모든 단계의 로그 트리와 최종 결과(Outcome)를 함께 담습니다.
 * 모든 연산은 새 인스턴스를 생성하며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>순차 실행 규칙 ({@link #bind(Function)}):</strong></p>
 * <ul>
 *   <li>실패 상태: 다음 함수를 호출하지 않고 지금까지의 트리와 실패 사유를 그대로 유지</li>
 *   <li>성공 상태: 다음 함수 결과의 트리를 오른쪽에 결합하고 그 결과를 채택</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DescribedComputation&lt;String, Integer&gt; product =
 *     DescribedComputation.&lt;String, Integer&gt;leaf(3, "Got a 3")
 *         .bind(foo -&gt; DescribedComputation.&lt;String, Integer&gt;leaf(5, "Got a 5")
 *             .map(bar -&gt; foo * bar));
 *
 * product.outcome(); // Success(15)
 * product.tree();    // Undescribed([Described("Got a 3"), Described("Got a 5")])
 * </pre>
 *
 * @param <E> 실패 사유 타입
 * @param <V> 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class DescribedComputation<E, V> {

    private static final Undescribed EMPTY_GROUP = new Undescribed(List.of());

    private final LogTree tree;
    private final Outcome<E, V> outcome;

    private DescribedComputation(LogTree tree, Outcome<E, V> outcome) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        this.tree = tree;
        this.outcome = outcome;
    }

    /**
     * 성공 리프 생성.
     *
     * @param value 값
     * @param description 설명
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return tree = Described(description, []), outcome = Success(value)
     * @throws IllegalArgumentException description이 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> leaf(V value, String description) {
        return new DescribedComputation<>(LogTree.leaf(description), Outcome.success(value));
    }

    /**
     * 실패 리프 생성.
     *
     * @param reason 실패 사유
     * @param description 설명
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return tree = Described(description, []) (실패 표시), outcome = Failure(reason)
     * @throws IllegalArgumentException reason 또는 description이 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> failureLeaf(E reason, String description) {
        return new DescribedComputation<>(LogTree.failedLeaf(description), Outcome.failure(reason));
    }

    /**
     * 로그 없이 값만 가진 계산 생성.
     *
     * <p>순차 실행의 항등원으로, 그 자체로는 감사 항목을 남기지 않습니다.</p>
     *
     * @param value 값
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return tree = Empty, outcome = Success(value)
     */
    public static <E, V> DescribedComputation<E, V> pure(V value) {
        return new DescribedComputation<>(LogTree.empty(), Outcome.success(value));
    }

    /**
     * 트리와 결과로부터 계산 생성.
     *
     * <p>실패한 계산의 트리에 대체 계산의 트리를 결합하는 등, 애플리케이션이 직접 복구를 구성할 때 사용합니다.
     * 자식이 없는 Undescribed 그룹은 Empty로 저장됩니다.</p>
     *
     * @param tree 로그 트리
     * @param outcome 결과
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return DescribedComputation 인스턴스
     * @throws IllegalArgumentException tree 또는 outcome이 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> of(LogTree tree, Outcome<E, V> outcome) {
        if (tree instanceof Undescribed group && group.children().isEmpty()) {
            return new DescribedComputation<>(LogTree.empty(), outcome);
        }
        return new DescribedComputation<>(tree, outcome);
    }

    /**
     * 순차 실행 (monadic bind).
     *
     * <p>실패 상태이면 {@code next}를 호출하지 않습니다. 성공 상태이면
     * {@code next(value)}의 트리를 현재 트리 오른쪽에 결합합니다.</p>
     *
     * @param next 다음 단계 함수
     * @param <B> 다음 값 타입
     * @return 순차 실행 결과
     * @throws IllegalArgumentException next가 null이거나 null을 반환한 경우
     */
    public <B> DescribedComputation<E, B> bind(Function<? super V, DescribedComputation<E, B>> next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (outcome instanceof Failure<E, V> failure) {
            return new DescribedComputation<>(tree, Outcome.failure(failure.reason()));
        }
        V value = ((Success<E, V>) outcome).value();
        DescribedComputation<E, B> following = next.apply(value);
        if (following == null) {
            throw new IllegalArgumentException("next returned null for value: " + value);
        }
        return new DescribedComputation<>(TreeCombiner.combine(tree, following.tree), following.outcome);
    }

    /**
     * 설명 없이 값만 변환.
     *
     * <p>{@code bind(v -> pure(mapper.apply(v)))}와 같습니다.</p>
     *
     * @param mapper 값 변환 함수
     * @param <B> 새로운 값 타입
     * @return 변환된 계산 (트리 동일)
     */
    public <B> DescribedComputation<E, B> map(Function<? super V, ? extends B> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return bind(value -> pure(mapper.apply(value)));
    }

    /**
     * 실패 시 대체 계산으로 복구.
     *
     * <p>실패한 단계의 트리는 그대로 남고 대체 계산의 트리가 오른쪽에 결합됩니다.
     * 대체 계산이 {@link #pure(Object)}처럼 아무것도 기록하지 않았다면 트리는 변하지 않습니다.
     * {@link #tree()}를 직접 결합하면 기록 없는 계산이 자식 없는 Undescribed 그룹으로 남으므로
     * 복구는 이 메서드로 구성합니다.</p>
     *
     * @param fallback 실패 사유 → 대체 계산 함수 (실패일 때만 호출)
     * @return 성공이면 이 계산, 실패이면 결합된 트리와 대체 계산의 결과
     * @throws IllegalArgumentException fallback이 null이거나 null을 반환한 경우
     */
    public DescribedComputation<E, V> recover(Function<? super E, DescribedComputation<E, V>> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (outcome instanceof Failure<E, V> failure) {
            DescribedComputation<E, V> alternative = fallback.apply(failure.reason());
            if (alternative == null) {
                throw new IllegalArgumentException("fallback returned null for reason: " + failure.reason());
            }
            return new DescribedComputation<>(TreeCombiner.combine(tree, alternative.tree), alternative.outcome);
        }
        return this;
    }

    /**
     * 완성된 로그 트리 조회.
     *
     * <p>반환되는 트리는 Empty가 아닙니다. 아무 단계도 기록되지 않았다면 자식 없는 Undescribed 그룹을 반환합니다.</p>
     *
     * @return 로그 트리 (Described 또는 Undescribed)
     */
    public LogTree tree() {
        return tree.isEmpty() ? EMPTY_GROUP : tree;
    }

    /**
     * 결과 조회.
     *
     * @return 결과 (Success 또는 Failure)
     */
    public Outcome<E, V> outcome() {
        return outcome;
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * 기록된 단계가 하나도 없는지 확인.
     *
     * @return {@link #pure(Object)}처럼 트리가 비어 있으면 true
     */
    public boolean isUnrecorded() {
        return tree.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DescribedComputation<?, ?> that = (DescribedComputation<?, ?>) o;
        return tree.equals(that.tree) && outcome.equals(that.outcome);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tree, outcome);
    }

    @Override
    public String toString() {
        return "DescribedComputation{tree=" + tree + ", outcome=" + outcome + '}';
    }
}
