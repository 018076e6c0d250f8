package com.ryuqq.auditlog.core.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 감사 로그 트리.
 *
 * <p>LogTree는 세 가지 형태를 가집니다:</p>
 * <ul>
 *   <li>{@link Described}: 설명(label)과 자식 목록을 가진 노드 - 사용자에게 보이는 하나의 단계</li>
 *   <li>{@link Undescribed}: 설명 없이 자식들을 묶기만 하는 구조 노드</li>
 *   <li>{@link Empty}: 결합 연산의 항등원 (완성된 트리 안에는 나타나지 않음)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 {@link TreeCombiner}가 모든 형태 조합을 처리하도록 보장합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LogTree first = LogTree.leaf("Got a 3");
 * LogTree second = LogTree.leaf("Got a 5");
 *
 * LogTree combined = TreeCombiner.combine(first, second);
 * // Undescribed([Described("Got a 3"), Described("Got a 5")])
 * </pre>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public sealed interface LogTree permits Described, Undescribed, Empty {

    /**
     * 결합 항등원 반환.
     *
     * @return Empty 인스턴스
     */
    static LogTree empty() {
        return Empty.INSTANCE;
    }

    /**
     * 성공한 단일 단계(자식 없음) 생성.
     *
     * @param description 설명
     * @return Described 리프
     * @throws IllegalArgumentException description이 null인 경우
     */
    static Described leaf(String description) {
        return new Described(description, true, List.of());
    }

    /**
     * 실패한 단일 단계(자식 없음) 생성.
     *
     * @param description 설명
     * @return 실패로 표시된 Described 리프
     * @throws IllegalArgumentException description이 null인 경우
     */
    static Described failedLeaf(String description) {
        return new Described(description, false, List.of());
    }

    /**
     * 성공한 Described 노드 생성.
     *
     * @param description 설명
     * @param children 자식 트리
     * @return Described 노드
     */
    static Described described(String description, LogTree... children) {
        return new Described(description, true, Arrays.asList(children));
    }

    /**
     * Undescribed 그룹 생성.
     *
     * @param children 자식 트리 (Empty 불가)
     * @return Undescribed 노드
     */
    static Undescribed group(LogTree... children) {
        return new Undescribed(Arrays.asList(children));
    }

    /**
     * 이 트리를 오른쪽 트리와 결합.
     *
     * @param right 오른쪽 트리
     * @return 결합된 트리
     * @see TreeCombiner#combine(LogTree, LogTree)
     */
    default LogTree append(LogTree right) {
        return TreeCombiner.combine(this, right);
    }

    /**
     * 항등원(Empty)인지 확인.
     *
     * @return Empty 여부
     */
    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /**
     * 이 트리가 기록한 단계가 모두 성공했는지 확인.
     *
     * @return 성공 여부
     */
    boolean isSuccess();

    /**
     * 자식 트리 목록 (불변).
     *
     * @return 자식 목록
     */
    List<LogTree> children();

    /**
     * 전위 순회 순서로 모든 설명을 수집.
     *
     * @return 설명 목록 (평가 순서)
     */
    default List<String> descriptions() {
        List<String> result = new ArrayList<>();
        collectDescriptions(this, result);
        return List.copyOf(result);
    }

    private static void collectDescriptions(LogTree tree, List<String> sink) {
        if (tree instanceof Described described) {
            sink.add(described.description());
        }
        for (LogTree child : tree.children()) {
            collectDescriptions(child, sink);
        }
    }
}
