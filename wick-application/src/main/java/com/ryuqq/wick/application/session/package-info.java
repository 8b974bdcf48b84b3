/**
 * 세션 facade (공개 API).
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.wick.application.session.AlgebraSession} - 공간 설정, 식 생성, BCH, 정규화 진입점</li>
 *   <li>{@link com.ryuqq.wick.application.session.DefaultAlgebraSession} - 기본 구현</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.wick.application.session;
