/**
 * Exception hierarchy of the Wick SDK.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.ryuqq.wick.core.error.WickException}, which carries a stable error code.</p>
 *
 * @since 1.0.0
 * @author Wick Team
 */
package com.ryuqq.wick.core.error;
