package com.ryuqq.wick.application.bch;

import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.number.RationalNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baker–Campbell–Hausdorff 급수 전개기.
 *
 * <p>절단 차수 k에 대해 다음을 계산합니다.</p>
 * <pre>
 * C + [C,D] + 1/2! [[C,D],D] + ... + 1/k! [...[C,D]...,D]
 * </pre>
 *
 * <p><strong>반복 구조:</strong></p>
 * <pre>
 * result ← C
 * nested ← C
 * for n = 1..k:
 *   nested ← [nested, D] / n      (누적하면 1/n! 계수)
 *   nested가 0이면 중단 (이후 모든 차수도 0)
 *   result ← result + nested
 * </pre>
 *
 * <p>각 교환자는 컨텍스트의 Wick 엔진과 전개 runtime으로 계산되며, 차수가 올라갈수록
 * Term 수가 조합적으로 증가합니다. 입력 Expression은 변경되지 않습니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class BchExpander {

    private static final Logger log = LoggerFactory.getLogger(BchExpander.class);

    /**
     * 절단된 BCH 급수.
     *
     * @param base C
     * @param generator D
     * @param order 절단 차수 (0 이상)
     * @return 새 Expression
     * @throws IllegalArgumentException order가 음수이거나 인자가 null인 경우
     * @throws com.ryuqq.wick.core.error.ResourceLimitException 전개 상한 초과 시
     */
    public Expression bchSeries(Expression base, Expression generator, int order) {
        if (base == null || generator == null) {
            throw new IllegalArgumentException("base and generator cannot be null");
        }
        if (order < 0) {
            throw new IllegalArgumentException("order must be non-negative (current: " + order + ")");
        }

        Expression result = base.copy();
        Expression nested = base.copy();
        for (int n = 1; n <= order; n++) {
            nested = nested.commutator(generator).scalarMultiply(RationalNumber.of(1, n));
            log.debug("BCH order {}: nested commutator has {} terms", n, nested.size());
            if (nested.isZero()) {
                log.debug("BCH series terminated at order {} (nested commutator vanished)", n);
                break;
            }
            result.add(nested);
        }
        log.debug("BCH series up to order {} has {} terms", order, result.size());
        return result;
    }
}
