package com.ryuqq.auditlog.core.tree;

import java.util.List;

/**
 * 설명이 붙은 노드.
 *
 * <p>하나의 의미 있는 단계("이 단계 전체")를 나타냅니다.
 * 결합 시 다른 Described 노드의 자식으로 병합되지 않으며,
 * 자식 목록은 이 노드를 직접 대상으로 하는 라벨링 연산으로만 만들어집니다.</p>
 *
 * @param description 설명
 * @param success 이 단계의 성공 여부
 * @param children 자식 트리 (순서 = 평가 순서, 빈 목록 허용)
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public record Described(
    String description,
    boolean success,
    List<LogTree> children
) implements LogTree {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException description 또는 children이 null이거나, children에 Empty가 포함된 경우
     */
    public Described {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        children = Undescribed.requireNonEmptyChildren(children);
    }

    @Override
    public boolean isSuccess() {
        return success;
    }

    /**
     * 자식 목록을 교체한 새 인스턴스 생성.
     *
     * @param children 새로운 자식 목록
     * @return 새 Described 인스턴스
     */
    public Described withChildren(List<LogTree> children) {
        return new Described(this.description, this.success, children);
    }
}
