/**
 * 연산자 패턴 빌더.
 *
 * <p>{@link com.ryuqq.wick.application.builder.OperatorExpressionBuilder}는 "v+ v+ o o" 형태의
 * 공간 패턴을 텐서 × 정규곱 Term으로 변환합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.wick.application.builder;
