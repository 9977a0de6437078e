/**
 * Call-site idioms layered over {@link com.ryuqq.status.core.Status}.
 *
 * <p>The status value never logs or throws on its own. This package holds the conventions
 * calling code uses around it.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.status.support.StatusPropagation} - Early return of the first failure, context prepending</li>
 *   <li>{@link com.ryuqq.status.support.StatusChecks} - Warn-and-continue, log-and-return, check-or-throw (SLF4J)</li>
 *   <li>{@link com.ryuqq.status.support.StatusLoggingConfig} - Log level and prefix settings</li>
 *   <li>{@link com.ryuqq.status.support.StatusException} - Thrown when a required status is not OK</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Status Team
 */
package com.ryuqq.status.support;
