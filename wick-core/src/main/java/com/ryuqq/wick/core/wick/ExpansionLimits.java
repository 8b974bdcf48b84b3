package com.ryuqq.wick.core.wick;

/**
 * 조합적 전개 상한 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxTerms: Wick 전개 1회당 작업 큐 + 결과 Term 최대 개수 (기본 200000)</li>
 *   <li>maxCanonicalCandidates: 정규형 탐색 1회당 최대 후보 수 (기본 100000)</li>
 * </ul>
 *
 * <p>상한 초과 시 {@link com.ryuqq.wick.core.error.ResourceLimitException}이 발생합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 * @param maxTerms Wick 전개 상한 (양수)
 * @param maxCanonicalCandidates 정규형 후보 상한 (양수)
 */
public record ExpansionLimits(int maxTerms, int maxCanonicalCandidates) {

    /**
     * 기본 설정 생성자.
     */
    public ExpansionLimits() {
        this(200_000, 100_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExpansionLimits {
        if (maxTerms <= 0) {
            throw new IllegalArgumentException(
                "maxTerms must be positive (current: " + maxTerms + ")"
            );
        }
        if (maxCanonicalCandidates <= 0) {
            throw new IllegalArgumentException(
                "maxCanonicalCandidates must be positive (current: " + maxCanonicalCandidates + ")"
            );
        }
    }

    /**
     * maxTerms만 변경한 새 인스턴스 생성.
     */
    public ExpansionLimits withMaxTerms(int maxTerms) {
        return new ExpansionLimits(maxTerms, maxCanonicalCandidates);
    }

    /**
     * maxCanonicalCandidates만 변경한 새 인스턴스 생성.
     */
    public ExpansionLimits withMaxCanonicalCandidates(int maxCanonicalCandidates) {
        return new ExpansionLimits(maxTerms, maxCanonicalCandidates);
    }
}
