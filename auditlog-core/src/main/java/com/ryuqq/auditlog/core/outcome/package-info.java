/**
 * Computation outcome package.
 *
 * <p>This package defines the sealed success/failure result that travels alongside
 * every audit tree.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.core.outcome.Success} - A produced value</li>
 *   <li>{@link com.ryuqq.auditlog.core.outcome.Failure} - An application-defined failure reason</li>
 * </ul>
 *
 * <p>Failure is an ordinary value: there is no exception-based control flow for domain failures.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.core.outcome;
