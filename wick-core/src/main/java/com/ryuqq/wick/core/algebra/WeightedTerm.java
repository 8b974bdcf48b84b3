package com.ryuqq.wick.core.algebra;

import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;

/**
 * Expression 순회 항목: 계수 1인 Term 본문과 그 계수.
 *
 * @param term 계수가 1인 Term
 * @param coefficient 계수 (0이 아님)
 *
 * @author Wick Team
 * @since 1.0.0
 */
public record WeightedTerm(Term term, RationalNumber coefficient) {

    public WeightedTerm {
        if (term == null) {
            throw new IllegalArgumentException("term cannot be null");
        }
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient cannot be null");
        }
    }

    /**
     * 계수를 포함한 Term.
     *
     * @return coefficient × term
     */
    public Term toTerm() {
        return term.withCoefficient(coefficient);
    }
}
