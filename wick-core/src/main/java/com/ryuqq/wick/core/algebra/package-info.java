/**
 * Expression algebra.
 *
 * <p>{@link com.ryuqq.wick.core.algebra.Expression} merges terms by canonical key and supports
 * addition, scalar multiplication, operator products, commutators, dot product and norm.
 * {@link com.ryuqq.wick.core.algebra.AlgebraContext} carries the registry, limits, contraction rule
 * and expansion runtime shared by expressions.</p>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.algebra;
