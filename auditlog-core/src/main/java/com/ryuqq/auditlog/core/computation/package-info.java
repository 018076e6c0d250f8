/**
 * Described computation package.
 *
 * <p>This package pairs a {@link com.ryuqq.auditlog.core.tree.LogTree} with an
 * {@link com.ryuqq.auditlog.core.outcome.Outcome} and defines how such pairs sequence.</p>
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.core.computation.DescribedComputation} - Immutable (tree, outcome) pair with leaf, failureLeaf, pure, bind and map</li>
 *   <li>{@link com.ryuqq.auditlog.core.computation.Sequences} - Collects a list of steps under one described node</li>
 * </ul>
 *
 * <h2>Sequencing Contract</h2>
 * <ul>
 *   <li><strong>Short-circuit:</strong> once a failure is observed no further function is invoked and no node is added</li>
 *   <li><strong>Evaluation order:</strong> sibling order in the tree is left-to-right evaluation order</li>
 *   <li><strong>Identity:</strong> {@code pure} is a left and right identity of {@code bind}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.core.computation;
