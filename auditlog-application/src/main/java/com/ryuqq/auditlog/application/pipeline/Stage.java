package com.ryuqq.auditlog.application.pipeline;

import com.ryuqq.auditlog.core.computation.DescribedComputation;

/**
 * 파이프라인의 한 단계.
 *
 * <p>입력 값을 받아 감사 트리와 결과를 가진 계산을 반환합니다.
 * 도메인 실패는 예외가 아니라 {@code DescribedComputation.failureLeaf}로 표현해야 합니다.</p>
 *
 * @param <E> 실패 사유 타입
 * @param <A> 입력 타입
 * @param <B> 출력 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Stage<E, A, B> {

    /**
     * 단계 실행.
     *
     * @param input 이전 단계의 값
     * @return 이 단계의 계산 (null 불가)
     */
    DescribedComputation<E, B> apply(A input);
}
