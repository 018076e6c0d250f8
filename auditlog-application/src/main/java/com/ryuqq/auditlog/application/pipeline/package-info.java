/**
 * Audit pipeline package.
 *
 * <p>Runs a fixed sequence of named {@link com.ryuqq.auditlog.application.pipeline.Stage stages}
 * through the core sequencing rule, synchronously or on an executor, and logs progress through SLF4J.</p>
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.application.pipeline.AuditPipeline} - Immutable pipeline builder and runner</li>
 *   <li>{@link com.ryuqq.auditlog.application.pipeline.Stage} - One step producing a described computation</li>
 *   <li>{@link com.ryuqq.auditlog.application.pipeline.PipelineConfig} - Stage labeling and async time budget</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.application.pipeline;
