package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.space.Space;

/**
 * 같은 공간에 속한 두 연산자의 축약 값을 결정하는 규칙.
 *
 * <p>Wick 엔진은 서로 다른 공간의 연산자 쌍에 대해서는 이 규칙을 호출하지 않습니다
 * (항상 0).</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link FermiVacuumContractionRule}: 단일 기준 상태 대비 (기본값)</li>
 *   <li>{@link TrueVacuumContractionRule}: 진공 대비 정규 순서</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public interface ContractionRule {

    /**
     * 축약 값 {@code ⟨left right⟩} 계산 (left가 왼쪽).
     *
     * @param left 왼쪽 연산자
     * @param right 오른쪽 연산자
     * @param space 두 연산자의 공통 공간
     * @return 축약 값 (0 가능)
     */
    Contraction contract(Operator left, Operator right, Space space);
}
