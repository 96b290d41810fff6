/**
 * Executor helpers providing named, non-daemon pipeline threads.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.infrastructure.exec;
