package com.ryuqq.auditlog.core.outcome;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 생성된 값 (null 허용 - 값이 없는 단계)
 * @param <E> 실패 사유 타입
 * @param <V> 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public record Success<E, V>(V value) implements Outcome<E, V> {

    @Override
    public <R> R fold(Function<? super V, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        return onSuccess.apply(value);
    }
}
