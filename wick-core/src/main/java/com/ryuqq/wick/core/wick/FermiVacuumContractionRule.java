package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.space.Space;

import java.util.List;

/**
 * 단일 기준 상태(Fermi vacuum) 대비 축약 규칙.
 *
 * <p><strong>축약 표:</strong></p>
 * <pre>
 *                 ⟨a+(p) a-(q)⟩          ⟨a-(p) a+(q)⟩
 * OCCUPIED        δ(p,q)                 0
 * UNOCCUPIED      0                      δ(p,q)
 * GENERAL         gamma1^{p}_{q}         eta1^{q}_{p}
 * </pre>
 *
 * <p>GENERAL 공간의 축약은 값으로 강제하지 않고 기호 텐서로 전파됩니다.
 * 기호 텐서의 위 첨자는 생성 연산자의 index입니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class FermiVacuumContractionRule implements ContractionRule {

    public static final String ONE_BODY_DENSITY = "gamma1";
    public static final String ONE_HOLE_DENSITY = "eta1";

    @Override
    public Contraction contract(Operator left, Operator right, Space space) {
        if (left.kind() == right.kind()) {
            return Contraction.zero();
        }
        if (left.isCreation()) {
            return switch (space.occupation()) {
                case OCCUPIED -> Contraction.kronecker();
                case UNOCCUPIED -> Contraction.zero();
                case GENERAL -> Contraction.symbolic(TensorLabel.of(ONE_BODY_DENSITY,
                    List.of(left.index()), List.of(right.index()), Symmetry.NONE));
            };
        }
        return switch (space.occupation()) {
            case OCCUPIED -> Contraction.zero();
            case UNOCCUPIED -> Contraction.kronecker();
            case GENERAL -> Contraction.symbolic(TensorLabel.of(ONE_HOLE_DENSITY,
                List.of(right.index()), List.of(left.index()), Symmetry.NONE));
        };
    }
}
