package com.ryuqq.auditlog.core.outcome;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>순차 실행 체인에서 실패가 관찰되면 이후 단계는 실행되지 않고
 * 이 사유가 체인 끝까지 그대로 전파됩니다.</p>
 *
 * @param reason 실패 사유 (애플리케이션 정의 타입)
 * @param <E> 실패 사유 타입
 * @param <V> 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public record Failure<E, V>(E reason) implements Outcome<E, V> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public Failure {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    @Override
    public <R> R fold(Function<? super V, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        return onFailure.apply(reason);
    }
}
