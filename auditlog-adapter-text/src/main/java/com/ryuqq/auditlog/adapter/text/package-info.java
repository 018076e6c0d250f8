/**
 * Plain-text adapter for the renderer SPI.
 *
 * <p>Provides {@link com.ryuqq.auditlog.adapter.text.IndentedTextRenderer}, an implementation of
 * {@link com.ryuqq.auditlog.core.spi.LogTreeRenderer} that prints one line per described step,
 * configured through {@link com.ryuqq.auditlog.adapter.text.TextRendererConfig}.</p>
 *
 * @since 1.0.0
 * @author AuditLog Team
 */
package com.ryuqq.auditlog.adapter.text;
