/**
 * Audit log tree package.
 *
 * <p>This package defines the recursive tree that records nested, labeled or unlabeled
 * groups of audit steps, and its associative combination operation.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.core.tree.LogTree} - Sealed interface (permits Described, Undescribed, Empty)</li>
 * </ul>
 *
 * <h2>Tree Shapes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.core.tree.Described} - A labeled, user-visible step</li>
 *   <li>{@link com.ryuqq.auditlog.core.tree.Undescribed} - A purely structural group</li>
 *   <li>{@link com.ryuqq.auditlog.core.tree.Empty} - Combination identity, never part of a finished tree</li>
 * </ul>
 *
 * <h2>Combination</h2>
 * <p>{@link com.ryuqq.auditlog.core.tree.TreeCombiner} implements the monoid:
 * an Undescribed node absorbs its siblings, a Described node is always kept as one child.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.core.tree;
