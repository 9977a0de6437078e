/**
 * Operation result value package.
 *
 * <p>This package defines the sealed {@link com.ryuqq.status.core.Status} hierarchy used as the
 * uniform return value for operations that may fail, without exceptions.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.status.core.Status} - Sealed interface (permits Ok, Failure)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.status.core.Ok} - Success, a single shared instance with no payload</li>
 *   <li>{@link com.ryuqq.status.core.Failure} - Categorized failure with message and optional POSIX code</li>
 * </ul>
 *
 * <h2>Codes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.status.core.StatusCode} - Closed classification with fixed wire numbers</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Status s = Status.ioError("write failed", path, 28);
 * s.isIoError();     // true
 * s.message();       // "write failed: /data/wal"
 * s.toString();      // "IO error: write failed: /data/wal (error 28)"
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Zero-cost success:</strong> {@code Status.ok()} never allocates</li>
 *   <li><strong>Immutability:</strong> Sharing a reference is equivalent to a deep copy</li>
 *   <li><strong>No side effects:</strong> The value never logs, throws or retries on its own</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Status Team
 */
package com.ryuqq.status.core;
