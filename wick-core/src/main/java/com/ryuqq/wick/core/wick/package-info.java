/**
 * Generalized Wick theorem.
 *
 * <p>{@link com.ryuqq.wick.core.wick.WickEngine} expands products of normal-ordered blocks into sums of
 * normal-ordered terms. Contraction values are supplied by a
 * {@link com.ryuqq.wick.core.wick.ContractionRule}.</p>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.wick;
