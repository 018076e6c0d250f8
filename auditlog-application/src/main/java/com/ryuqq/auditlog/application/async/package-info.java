/**
 * Asynchronous sequencing of described computations.
 *
 * <p>{@link com.ryuqq.auditlog.application.async.AsyncDescribedComputation} keeps the
 * sequencing contract of the core (short-circuit on failure, left-to-right evaluation order)
 * when steps complete on other threads.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.application.async;
