/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code longsplit} dispatcher and its
 * {@code segment} and {@code models} subcommands.
 * <p><strong>Conventions:</strong> Options are {@code key=value} pairs; flags start with {@code --}.
 * Reports go to stdout through {@link io.lrma.longsplit.api.CliPrinter}; logs go to stderr.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.api;
