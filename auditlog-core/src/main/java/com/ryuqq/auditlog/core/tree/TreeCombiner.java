package com.ryuqq.auditlog.core.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * LogTree 결합 연산 (모노이드).
 *
 * <p>두 트리를 형태별 규칙에 따라 하나로 결합합니다. 결합은 결합법칙을 만족하며
 * {@link Empty}는 양쪽 항등원입니다.</p>
 *
 * <p><strong>결합 규칙:</strong></p>
 * <ul>
 *   <li>Empty + t → t, t + Empty → t</li>
 *   <li>Undescribed(c1) + Undescribed(c2) → Undescribed(c1 ++ c2)</li>
 *   <li>Undescribed(c1) + Described(d) → Undescribed(c1 ++ [d])</li>
 *   <li>Described(d) + Undescribed(c2) → Undescribed([d] ++ c2)</li>
 *   <li>Described(d1) + Described(d2) → Undescribed([d1, d2])</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Described 노드의 자식 목록은 결합으로 확장되지 않음</li>
 *   <li>결과 트리의 형제 순서는 왼쪽 → 오른쪽 (평가 순서)</li>
 *   <li>입력 트리는 변경되지 않음 (항상 새 인스턴스 생성)</li>
 * </ul>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class TreeCombiner {

    // Utility class - prevent instantiation
    private TreeCombiner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 트리 결합.
     *
     * @param left 왼쪽 트리 (먼저 평가된 쪽)
     * @param right 오른쪽 트리
     * @return 결합된 트리
     * @throws IllegalArgumentException left 또는 right가 null인 경우
     */
    public static LogTree combine(LogTree left, LogTree right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Trees cannot be null (left: " + left + ", right: " + right + ")");
        }

        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }

        // Undescribed는 형제를 흡수하고, Described는 하나의 자식으로만 들어간다
        List<LogTree> merged = new ArrayList<>();
        addAsSiblings(left, merged);
        addAsSiblings(right, merged);
        return new Undescribed(merged);
    }

    /**
     * 여러 트리를 왼쪽부터 순서대로 결합.
     *
     * @param trees 결합할 트리 목록
     * @return 결합된 트리 (빈 목록이면 Empty)
     * @throws IllegalArgumentException trees가 null인 경우
     */
    public static LogTree combineAll(List<? extends LogTree> trees) {
        if (trees == null) {
            throw new IllegalArgumentException("trees cannot be null");
        }
        LogTree result = LogTree.empty();
        for (LogTree tree : trees) {
            result = combine(result, tree);
        }
        return result;
    }

    private static void addAsSiblings(LogTree tree, List<LogTree> sink) {
        if (tree instanceof Undescribed undescribed) {
            sink.addAll(undescribed.children());
        } else {
            sink.add(tree);
        }
    }
}
