package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.space.Space;

/**
 * 진공(true vacuum) 대비 정규 순서 규칙.
 *
 * <p>점유 분류와 무관하게 {@code ⟨a-(p) a+(q)⟩ = δ(p,q)}만 0이 아닙니다.
 * 결과 정규곱에서는 모든 생성 연산자가 소멸 연산자 왼쪽에 옵니다.</p>
 *
 * <p>{@code onlySameIndexContractions}가 true면 서로 다른 index는 서로 다른
 * spin orbital로 간주하여 같은 index끼리만 축약합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class TrueVacuumContractionRule implements ContractionRule {

    private final boolean onlySameIndexContractions;

    public TrueVacuumContractionRule() {
        this(false);
    }

    public TrueVacuumContractionRule(boolean onlySameIndexContractions) {
        this.onlySameIndexContractions = onlySameIndexContractions;
    }

    @Override
    public Contraction contract(Operator left, Operator right, Space space) {
        if (left.isCreation() || !right.isCreation()) {
            return Contraction.zero();
        }
        if (onlySameIndexContractions && !left.index().equals(right.index())) {
            return Contraction.zero();
        }
        return Contraction.kronecker();
    }

    public boolean isOnlySameIndexContractions() {
        return onlySameIndexContractions;
    }
}
