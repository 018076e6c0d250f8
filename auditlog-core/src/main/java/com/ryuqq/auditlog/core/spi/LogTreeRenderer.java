package com.ryuqq.auditlog.core.spi;

import com.ryuqq.auditlog.core.tree.LogTree;

/**
 * Renderer SPI for finished audit trees.
 *
 * <p>This interface turns a {@link LogTree} into human-readable text
 * (e.g. indented nesting of descriptions). The core never renders on its own.</p>
 *
 * <p><strong>Guarantees given to implementations:</strong></p>
 * <ul>
 *   <li>Trees obtained from {@code DescribedComputation.tree()} never contain the Empty tree</li>
 *   <li>Sibling order is evaluation order</li>
 *   <li>Every Described node carries its success flag</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: trees are immutable, so renderers should hold no per-call state</li>
 *   <li>Total: every tree shape must render without throwing</li>
 * </ul>
 *
 * @author AuditLog Team
 * @since 1.0.0
 */
public interface LogTreeRenderer {

    /**
     * Renders a tree to text.
     *
     * @param tree the tree to render (must not be null)
     * @return rendered text, never null
     * @throws IllegalArgumentException if tree is null
     */
    String render(LogTree tree);
}
