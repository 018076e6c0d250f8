package com.ryuqq.auditlog.application.pipeline;

/**
 * AuditPipeline 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>labelStages: 각 단계의 트리를 단계 이름으로 감쌀지 여부 (기본 true)</li>
 *   <li>timeoutMs: 비동기 실행 전체 제한 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author AuditLog Team
 * @since 1.0.0
 * @param labelStages 단계 이름 라벨 여부
 * @param timeoutMs 비동기 실행 제한 시간 (밀리초, 양수여야 함)
 */
public record PipelineConfig(boolean labelStages, long timeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: labelStages=true, timeoutMs=30000ms</p>
     */
    public PipelineConfig() {
        this(true, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PipelineConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * labelStages만 변경한 새 인스턴스 생성.
     *
     * @param labelStages 새로운 라벨 여부
     * @return 새 PipelineConfig 인스턴스
     */
    public PipelineConfig withLabelStages(boolean labelStages) {
        return new PipelineConfig(labelStages, this.timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param timeoutMs 새로운 제한 시간 (밀리초)
     * @return 새 PipelineConfig 인스턴스
     */
    public PipelineConfig withTimeoutMs(long timeoutMs) {
        return new PipelineConfig(this.labelStages, timeoutMs);
    }
}
