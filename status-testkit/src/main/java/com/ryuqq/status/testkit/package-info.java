/**
 * AssertJ assertions for {@link com.ryuqq.status.core.Status}.
 *
 * <p>Shipped in main scope so downstream modules can depend on it with test scope.</p>
 *
 * @since 1.0.0
 * @author Status Team
 */
package com.ryuqq.status.testkit;
