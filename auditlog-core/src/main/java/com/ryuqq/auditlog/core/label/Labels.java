package com.ryuqq.auditlog.core.label;

import com.ryuqq.auditlog.core.computation.DescribedComputation;
import com.ryuqq.auditlog.core.outcome.Outcome;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;

import java.util.List;
import java.util.function.Function;

/**
 * 계산에 설명을 붙이는 라벨링 연산.
 *
 * <p>기존 계산의 트리를 새 Described 노드의 유일한 자식으로 감쌉니다.</p>
 *
 * <p><strong>세 가지 형태:</strong></p>
 * <ul>
 *   <li>{@link #labelValue}: 성공 값으로부터 설명 생성 - 실패 시 트리를 그대로 통과</li>
 *   <li>{@link #labelOutcome}: 성공/실패 양쪽 모두 설명 생성</li>
 *   <li>{@link #labelBlock}: 결과와 관계없이 전체 블록에 고정 설명 부여</li>
 * </ul>
 *
 * <p>기록된 단계가 없는 계산(예: pure)을 감싸면 자식 없는 Described 노드가 됩니다.</p>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class Labels {

    // Utility class - prevent instantiation
    private Labels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 성공 값에 따라 설명 부여.
     *
     * <p>실패한 계산에는 설명할 값이 없으므로 아무 노드도 추가하지 않습니다.
     * 실패는 그 실패를 만든 리프가 설명합니다.</p>
     *
     * @param computation 대상 계산
     * @param describe 값 → 설명 함수
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return 성공 시 Described(describe(value), [tree]), 실패 시 원본과 동일한 계산
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> labelValue(
        DescribedComputation<E, V> computation,
        Function<? super V, String> describe
    ) {
        requireComputation(computation);
        if (describe == null) {
            throw new IllegalArgumentException("describe cannot be null");
        }
        Outcome<E, V> outcome = computation.outcome();
        if (outcome.isFailure()) {
            return computation;
        }
        String description = outcome.fold(describe, reason -> null);
        return wrap(computation, description, true);
    }

    /**
     * 성공/실패 양쪽에 설명 부여.
     *
     * @param computation 대상 계산
     * @param describeSuccess 값 → 설명 함수
     * @param describeFailure 실패 사유 → 설명 함수
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return Described(설명, [tree]) 루트를 가진 계산 (결과 동일)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> labelOutcome(
        DescribedComputation<E, V> computation,
        Function<? super V, String> describeSuccess,
        Function<? super E, String> describeFailure
    ) {
        requireComputation(computation);
        if (describeSuccess == null || describeFailure == null) {
            throw new IllegalArgumentException("describeSuccess and describeFailure cannot be null");
        }
        String description = computation.outcome().fold(describeSuccess, describeFailure);
        return wrap(computation, description, computation.isSuccess());
    }

    /**
     * 결과와 관계없이 전체 블록에 설명 부여.
     *
     * @param computation 대상 계산
     * @param description 블록 설명
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return Described(description, [tree]) 루트를 가진 계산 (결과 동일)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <E, V> DescribedComputation<E, V> labelBlock(
        DescribedComputation<E, V> computation,
        String description
    ) {
        requireComputation(computation);
        return wrap(computation, description, computation.isSuccess());
    }

    private static <E, V> DescribedComputation<E, V> wrap(
        DescribedComputation<E, V> computation,
        String description,
        boolean success
    ) {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        List<LogTree> children = computation.isUnrecorded() ? List.of() : List.of(computation.tree());
        return DescribedComputation.of(new Described(description, success, children), computation.outcome());
    }

    private static void requireComputation(DescribedComputation<?, ?> computation) {
        if (computation == null) {
            throw new IllegalArgumentException("computation cannot be null");
        }
    }
}
