/**
 * Exact rational arithmetic.
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.number;
