package com.ryuqq.wick.core.model;

import com.ryuqq.wick.core.space.Index;

import java.util.Map;

/**
 * Index에 묶인 단일 생성/소멸 연산자.
 *
 * <p>출력 형식: {@code a+(v0)}, {@code a-(o0)}</p>
 *
 * @param kind 연산자 종류
 * @param index 연산자가 작용하는 index
 *
 * @author Wick Team
 * @since 1.0.0
 */
public record Operator(OperatorKind kind, Index index) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 index가 null인 경우
     */
    public Operator {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
    }

    public static Operator creation(Index index) {
        return new Operator(OperatorKind.CREATION, index);
    }

    public static Operator annihilation(Index index) {
        return new Operator(OperatorKind.ANNIHILATION, index);
    }

    public boolean isCreation() {
        return kind == OperatorKind.CREATION;
    }

    public Operator adjoint() {
        return new Operator(kind.adjoint(), index);
    }

    /**
     * index 치환.
     *
     * @param substitution index 치환 맵 (없는 index는 유지)
     * @return 치환된 Operator
     */
    public Operator substitute(Map<Index, Index> substitution) {
        Index replaced = substitution.get(index);
        return replaced == null ? this : new Operator(kind, replaced);
    }

    @Override
    public String toString() {
        return kind.symbol() + "(" + index + ")";
    }
}
