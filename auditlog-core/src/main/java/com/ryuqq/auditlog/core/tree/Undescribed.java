package com.ryuqq.auditlog.core.tree;

import java.util.List;

/**
 * 설명 없는 그룹 노드.
 *
 * <p>순수하게 구조적인 노드로, 형제 트리를 자유롭게 흡수할 수 있습니다.
 * 성공 여부는 자식들로부터 파생됩니다.</p>
 *
 * @param children 자식 트리 (순서 = 평가 순서)
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public record Undescribed(List<LogTree> children) implements LogTree {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException children이 null이거나 Empty를 포함하는 경우
     */
    public Undescribed {
        children = requireNonEmptyChildren(children);
    }

    @Override
    public boolean isSuccess() {
        for (LogTree child : children) {
            if (!child.isSuccess()) {
                return false;
            }
        }
        return true;
    }

    static List<LogTree> requireNonEmptyChildren(List<LogTree> children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        for (LogTree child : children) {
            if (child == null) {
                throw new IllegalArgumentException("children cannot contain null");
            }
            if (child.isEmpty()) {
                throw new IllegalArgumentException("children cannot contain the Empty tree");
            }
        }
        return List.copyOf(children);
    }
}
