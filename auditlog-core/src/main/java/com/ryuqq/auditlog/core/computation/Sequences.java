package com.ryuqq.auditlog.core.computation;

import com.ryuqq.auditlog.core.outcome.Failure;
import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.outcome.Success;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 목록 단위 순차 실행.
 *
 * <p>여러 단계를 하나의 Described 노드 아래에 모읍니다. 각 단계의 트리는
 * 그 노드의 직계 자식이 됩니다 (평가 순서 유지).</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DescribedComputation&lt;String, List&lt;Integer&gt;&gt; sizes = Sequences.traverse(
 *     "Measure parts", parts,
 *     part -&gt; DescribedComputation.leaf(part.size(), "Measured " + part.name()));
 * // Described("Measure parts", [Described("Measured a"), Described("Measured b"), ...])
 * </pre>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class Sequences {

    // Utility class - prevent instantiation
    private Sequences() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 각 항목에 단계를 순서대로 적용 (첫 실패에서 중단).
     *
     * @param description 묶음 설명
     * @param items 입력 항목
     * @param step 항목 → 계산 함수
     * @param <E> 실패 사유 타입
     * @param <A> 입력 타입
     * @param <B> 값 타입
     * @return 성공 시 값 목록, 실패 시 첫 실패 사유. 트리에는 실행된 단계만 포함
     * @throws IllegalArgumentException 인자가 null이거나 step이 null을 반환한 경우
     */
    public static <E, A, B> DescribedComputation<E, List<B>> traverse(
        String description,
        List<? extends A> items,
        Function<? super A, DescribedComputation<E, B>> step
    ) {
        requireArguments(description, items);
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }

        List<LogTree> children = new ArrayList<>();
        List<B> values = new ArrayList<>();
        for (A item : items) {
            DescribedComputation<E, B> result = step.apply(item);
            if (result == null) {
                throw new IllegalArgumentException("step returned null for item: " + item);
            }
            addRecorded(result, children);
            if (result.outcome() instanceof Failure<E, B> failure) {
                return collected(description, children, Outcome.failure(failure.reason()));
            }
            values.add(((Success<E, B>) result.outcome()).value());
        }
        return collected(description, children, Outcome.success(Collections.unmodifiableList(values)));
    }

    /**
     * 이미 평가된 계산 목록을 하나로 묶기.
     *
     * <p>모든 계산이 실행되었으므로 모든 트리가 자식으로 남습니다.
     * 결과는 목록 순서상 첫 번째 실패, 없으면 값 목록입니다.</p>
     *
     * @param description 묶음 설명
     * @param computations 평가된 계산 목록
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return 묶인 계산
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <E, V> DescribedComputation<E, List<V>> sequence(
        String description,
        List<DescribedComputation<E, V>> computations
    ) {
        requireArguments(description, computations);

        List<LogTree> children = new ArrayList<>();
        List<V> values = new ArrayList<>();
        Outcome<E, List<V>> firstFailure = null;
        for (DescribedComputation<E, V> computation : computations) {
            if (computation == null) {
                throw new IllegalArgumentException("computations cannot contain null");
            }
            addRecorded(computation, children);
            Outcome<E, V> outcome = computation.outcome();
            if (outcome instanceof Failure<E, V> failure) {
                if (firstFailure == null) {
                    firstFailure = Outcome.failure(failure.reason());
                }
            } else {
                values.add(((Success<E, V>) outcome).value());
            }
        }
        Outcome<E, List<V>> outcome = firstFailure != null ? firstFailure : Outcome.success(Collections.unmodifiableList(values));
        return collected(description, children, outcome);
    }

    private static void addRecorded(DescribedComputation<?, ?> computation, List<LogTree> children) {
        if (!computation.isUnrecorded()) {
            children.add(computation.tree());
        }
    }

    private static <E, V> DescribedComputation<E, V> collected(
        String description,
        List<LogTree> children,
        Outcome<E, V> outcome
    ) {
        return DescribedComputation.of(new Described(description, outcome.isSuccess(), children), outcome);
    }

    private static void requireArguments(String description, List<?> items) {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
    }
}
