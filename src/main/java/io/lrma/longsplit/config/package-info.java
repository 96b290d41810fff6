/**
 * <strong>Purpose:</strong> Configuration records, defaults, YAML loading, array models, and the composition root.
 * <p><strong>Precedence:</strong> CLI key/value arguments override YAML ({@code common} then command section),
 * which overrides {@link io.lrma.longsplit.config.DefaultsForMode}.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.config;
