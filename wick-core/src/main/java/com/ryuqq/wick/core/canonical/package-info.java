/**
 * Canonical form of terms.
 *
 * <p>{@link com.ryuqq.wick.core.canonical.Canonicalizer} reduces a term to a
 * {@link com.ryuqq.wick.core.canonical.TermKey} and a sign; two terms merge iff their keys match.</p>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.canonical;
