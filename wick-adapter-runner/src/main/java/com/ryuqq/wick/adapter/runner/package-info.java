/**
 * Runner Adapter Layer - 병렬 전개 runtime.
 *
 * <p>core의 {@link com.ryuqq.wick.core.spi.ExpansionRuntime} SPI 구현체를 제공합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wick.adapter.runner.ParallelExpansionRuntime} - 고정 크기 worker pool 전개</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ParallelExpansionRuntime)
 *   ↓ implements
 * core/spi (ExpansionRuntime)
 *   ↓ used by
 * core/algebra (Expression.multiply → 단일 집계 지점)
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
package com.ryuqq.wick.adapter.runner;
