package com.ryuqq.wick.core.canonical;

import com.ryuqq.wick.core.model.Term;

/**
 * 정규화 결과: 키, 부호, 정규형 Term.
 *
 * <p>원래 Term 본문(계수 제외) = sign × canonical 관계가 성립합니다.
 * 대칭성 또는 배타 원리로 소멸하는 Term은 {@link #zero()}입니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class CanonicalForm {

    private static final CanonicalForm ZERO = new CanonicalForm(null, 0, null);

    private final TermKey key;
    private final int sign;
    private final Term canonical;

    private CanonicalForm(TermKey key, int sign, Term canonical) {
        this.key = key;
        this.sign = sign;
        this.canonical = canonical;
    }

    static CanonicalForm of(TermKey key, int sign, Term canonical) {
        if (sign != 1 && sign != -1) {
            throw new IllegalArgumentException("sign must be +1 or -1 (current: " + sign + ")");
        }
        return new CanonicalForm(key, sign, canonical);
    }

    public static CanonicalForm zero() {
        return ZERO;
    }

    public boolean isZero() {
        return key == null;
    }

    /**
     * 정규형 키.
     *
     * @return TermKey
     * @throws IllegalStateException 소멸하는 Term인 경우
     */
    public TermKey getKey() {
        requireNonZero();
        return key;
    }

    /**
     * 원래 Term과 정규형 사이의 부호.
     *
     * @return +1 또는 -1 (소멸 Term은 0)
     */
    public int getSign() {
        return sign;
    }

    /**
     * 계수 1인 정규형 Term.
     *
     * @return 정규형 Term
     * @throws IllegalStateException 소멸하는 Term인 경우
     */
    public Term getCanonical() {
        requireNonZero();
        return canonical;
    }

    private void requireNonZero() {
        if (isZero()) {
            throw new IllegalStateException("Vanishing term has no canonical form");
        }
    }

    @Override
    public String toString() {
        return isZero() ? "CanonicalForm{zero}" : "CanonicalForm{sign=" + sign + ", canonical=" + canonical + '}';
    }
}
