/**
 * Law test support for audit trees and computations.
 *
 * <p>Extend {@link com.ryuqq.auditlog.testkit.contract.AbstractLogTreeLawTest} to check custom
 * steps or renderers against the combine and sequencing laws with seeded random samples.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.testkit.contract;
