package com.ryuqq.auditlog.core.outcome;

import java.util.Optional;
import java.util.function.Function;

/**
 * 계산 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 값을 생성함</li>
 *   <li>{@link Failure}: 실패 사유를 가짐</li>
 * </ul>
 *
 * <p>실패 사유 타입 {@code E}는 애플리케이션이 정의합니다 (문자열, 오류 코드 record 등).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String message = outcome.fold(
 *     value -&gt; "Success: " + value,
 *     reason -&gt; "Failed: " + reason
 * );
 * </pre>
 *
 * @param <E> 실패 사유 타입
 * @param <V> 값 타입
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public sealed interface Outcome<E, V> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 값 (null 허용)
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return Success 인스턴스
     */
    static <E, V> Outcome<E, V> success(V value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param reason 실패 사유
     * @param <E> 실패 사유 타입
     * @param <V> 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException reason이 null인 경우
     */
    static <E, V> Outcome<E, V> failure(E reason) {
        return new Failure<>(reason);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 두 분기를 하나의 값으로 접기.
     *
     * @param onSuccess 성공 값 변환 함수
     * @param onFailure 실패 사유 변환 함수
     * @param <R> 결과 타입
     * @return 해당 분기 함수의 결과
     */
    <R> R fold(Function<? super V, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure);

    /**
     * 성공 값 변환. 실패는 그대로 전파됩니다.
     *
     * @param mapper 값 변환 함수
     * @param <B> 새로운 값 타입
     * @return 변환된 Outcome
     */
    default <B> Outcome<E, B> map(Function<? super V, ? extends B> mapper) {
        return fold(value -> Outcome.<E, B>success(mapper.apply(value)), reason -> Outcome.<E, B>failure(reason));
    }

    /**
     * 성공 값을 Optional로 조회.
     *
     * @return 성공 시 값 (null 값이면 empty), 실패 시 empty
     */
    default Optional<V> toOptional() {
        return fold(Optional::ofNullable, reason -> Optional.<V>empty());
    }
}
