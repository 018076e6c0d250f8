package com.ryuqq.auditlog.core.tree;

import java.util.List;

/**
 * 결합 항등원.
 *
 * <p>{@link TreeCombiner#combine(LogTree, LogTree)}에서 양쪽 항등원으로 동작하며
 * 결합 과정에서 사라집니다. 다른 노드의 자식이 될 수 없습니다.</p>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class Empty implements LogTree {

    static final Empty INSTANCE = new Empty();

    private Empty() {
    }

    @Override
    public boolean isSuccess() {
        return true;
    }

    @Override
    public List<LogTree> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "Empty";
    }
}
