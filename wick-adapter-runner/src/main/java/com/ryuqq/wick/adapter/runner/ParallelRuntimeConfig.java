package com.ryuqq.wick.adapter.runner;

/**
 * ParallelExpansionRuntime 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 전개 worker 스레드 수 (기본 4)</li>
 *   <li>sequentialThreshold: 곱 개수가 이 값 이하이면 호출 스레드에서 순차 전개 (기본 4)</li>
 *   <li>timeoutMs: 한 번의 expandAll 호출 전체 대기 시간 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>고차 BCH: concurrency를 코어 수에 맞춤</li>
 *   <li>작은 Expression이 많은 경우: sequentialThreshold 증가 (스레드 전환 비용 회피)</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 * @param concurrency worker 스레드 수 (1 이상)
 * @param sequentialThreshold 순차 전개 임계값 (0 이상)
 * @param timeoutMs 전체 대기 시간 (밀리초, 양수)
 */
public record ParallelRuntimeConfig(
    int concurrency,
    int sequentialThreshold,
    long timeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, sequentialThreshold=4, timeoutMs=300000ms</p>
     */
    public ParallelRuntimeConfig() {
        this(4, 4, 300_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelRuntimeConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (sequentialThreshold < 0) {
            throw new IllegalArgumentException(
                "sequentialThreshold must be non-negative (current: " + sequentialThreshold + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
    }

    public ParallelRuntimeConfig withConcurrency(int concurrency) {
        return new ParallelRuntimeConfig(concurrency, sequentialThreshold, timeoutMs);
    }

    public ParallelRuntimeConfig withSequentialThreshold(int sequentialThreshold) {
        return new ParallelRuntimeConfig(concurrency, sequentialThreshold, timeoutMs);
    }

    public ParallelRuntimeConfig withTimeoutMs(long timeoutMs) {
        return new ParallelRuntimeConfig(concurrency, sequentialThreshold, timeoutMs);
    }
}
