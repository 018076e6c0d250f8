/**
 * Labeling operations package.
 *
 * <p>{@link com.ryuqq.auditlog.core.label.Labels} attaches descriptions to existing
 * computations. Infix or DSL style sugar belongs to callers and builds on these operations.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.core.label;
