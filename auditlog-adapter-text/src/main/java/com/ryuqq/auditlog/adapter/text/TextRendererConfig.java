package com.ryuqq.auditlog.adapter.text;

/**
 * 텍스트 렌더러 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>indent: 깊이 한 단계당 들여쓰기 문자열 (기본 두 칸 공백)</li>
 *   <li>failurePrefix: 실패한 단계 앞에 붙는 표시 (기본 "Failed: ")</li>
 * </ul>
 *
 * @author AuditLog Team
 * @since 1.0.0
 * @param indent 들여쓰기 단위 (null 불가, 빈 문자열 허용)
 * @param failurePrefix 실패 표시 (null 불가, 빈 문자열 허용)
 */
public record TextRendererConfig(String indent, String failurePrefix) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: indent="  ", failurePrefix="Failed: "</p>
     */
    public TextRendererConfig() {
        this("  ", "Failed: ");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TextRendererConfig {
        if (indent == null) {
            throw new IllegalArgumentException("indent cannot be null");
        }
        if (failurePrefix == null) {
            throw new IllegalArgumentException("failurePrefix cannot be null");
        }
    }

    /**
     * indent만 변경한 새 인스턴스 생성.
     *
     * @param indent 새로운 들여쓰기 단위
     * @return 새 TextRendererConfig 인스턴스
     */
    public TextRendererConfig withIndent(String indent) {
        return new TextRendererConfig(indent, this.failurePrefix);
    }

    /**
     * failurePrefix만 변경한 새 인스턴스 생성.
     *
     * @param failurePrefix 새로운 실패 표시
     * @return 새 TextRendererConfig 인스턴스
     */
    public TextRendererConfig withFailurePrefix(String failurePrefix) {
        return new TextRendererConfig(this.indent, failurePrefix);
    }
}
