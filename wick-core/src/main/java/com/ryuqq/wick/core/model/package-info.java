/**
 * Operator-algebra value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wick.core.model.Operator} - creation/annihilation token bound to an index</li>
 *   <li>{@link com.ryuqq.wick.core.model.TensorLabel} - symbolic coefficient array reference</li>
 *   <li>{@link com.ryuqq.wick.core.model.Term} - coefficient, tensors, operator string, normal-product flag</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> all value objects are immutable</li>
 *   <li><strong>Validation:</strong> constructors reject null and malformed fields</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.model;
