/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by adapters
 * to provide concrete functionality around the Core SDK.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.auditlog.core.spi.LogTreeRenderer} - Audit tree to text rendering</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., auditlog-adapter-text) are responsible for providing concrete
 * implementations of these SPIs. Persistence and transport of finished trees are left to
 * the embedding application.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.core.spi;
