package com.ryuqq.auditlog.adapter.text;

import com.ryuqq.auditlog.core.spi.LogTreeRenderer;
import com.ryuqq.auditlog.core.tree.Described;
import com.ryuqq.auditlog.core.tree.LogTree;

import java.util.ArrayList;
import java.util.List;

/**
 * 들여쓰기 기반 텍스트 렌더러.
 *
 * <p>Described 노드 하나당 한 줄을 출력하고, 자식은 한 단계 더 들여씁니다.</p>
 *
 * <p><strong>렌더링 규칙:</strong></p>
 * <ul>
 *   <li>Described: {@code indent * depth + (실패 시 failurePrefix) + description}</li>
 *   <li>Undescribed: 자체 줄 없음, 자식은 같은 깊이에 출력</li>
 *   <li>Empty: 출력 없음</li>
 *   <li>줄 구분자: {@code \n} (마지막 줄 뒤에는 없음)</li>
 * </ul>
 *
 * <p><strong>출력 예시:</strong></p>
 * <pre>
 * compute foo*bar
 *   Got a 3
 *   Failed: Could not get bar
 * </pre>
 *
 * <p>상태를 갖지 않으므로 thread-safe합니다.</p>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public final class IndentedTextRenderer implements LogTreeRenderer {

    private final TextRendererConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public IndentedTextRenderer() {
        this(new TextRendererConfig());
    }

    /**
     * 생성자.
     *
     * @param config 렌더러 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public IndentedTextRenderer(TextRendererConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public String render(LogTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        List<String> lines = new ArrayList<>();
        renderNode(tree, 0, lines);
        return String.join("\n", lines);
    }

    private void renderNode(LogTree tree, int depth, List<String> lines) {
        int childDepth = depth;
        if (tree instanceof Described described) {
            String marker = described.success() ? "" : config.failurePrefix();
            lines.add(config.indent().repeat(depth) + marker + described.description());
            childDepth = depth + 1;
        }
        for (LogTree child : tree.children()) {
            renderNode(child, childDepth, lines);
        }
    }
}
