package com.ryuqq.wick.core.spi;

import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.wick.OperatorProduct;
import com.ryuqq.wick.core.wick.WickEngine;

import java.util.List;

/**
 * Wick 전개 실행 SPI.
 *
 * <p>각 곱의 전개는 서로 독립이므로 병렬로 수행할 수 있습니다. 병합은 호출자 쪽
 * 단일 집계 지점(Expression)에서만 이루어집니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>결과 순서: 입력 곱 순서대로, 각 곱의 전개 결과를 이어 붙인 목록</li>
 *   <li>예외 전파: 전개 중 발생한 {@link com.ryuqq.wick.core.error.WickException}은 원래 타입 그대로 전파</li>
 *   <li>registry 변경 금지: 전개 단계 동안 SpaceRegistry는 읽기 전용</li>
 * </ul>
 *
 * <p>기본 구현은 {@link SequentialExpansionRuntime}이며, 병렬 구현은 adapter 모듈이 제공합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public interface ExpansionRuntime {

    /**
     * 곱 목록 전개.
     *
     * @param engine Wick 엔진
     * @param products 전개할 곱 목록
     * @return 정규곱 Term 목록 (입력 순서)
     */
    List<Term> expandAll(WickEngine engine, List<OperatorProduct> products);
}
