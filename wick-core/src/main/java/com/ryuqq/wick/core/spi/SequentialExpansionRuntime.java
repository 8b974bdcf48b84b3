package com.ryuqq.wick.core.spi;

import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.wick.OperatorProduct;
import com.ryuqq.wick.core.wick.WickEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * 호출 스레드에서 순서대로 전개하는 기본 구현.
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class SequentialExpansionRuntime implements ExpansionRuntime {

    @Override
    public List<Term> expandAll(WickEngine engine, List<OperatorProduct> products) {
        if (engine == null || products == null) {
            throw new IllegalArgumentException("engine and products cannot be null");
        }
        List<Term> results = new ArrayList<>();
        for (OperatorProduct product : products) {
            results.addAll(engine.expand(product));
        }
        return results;
    }
}
