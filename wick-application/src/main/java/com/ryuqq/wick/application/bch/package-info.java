/**
 * BCH 급수 전개.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.wick.application.bch.BchExpander} - 중첩 교환자 급수의 절단 전개</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.wick.application.bch;
