package com.ryuqq.wick.core.model;

/**
 * 2차 양자화 연산자 종류.
 *
 * @author Wick Team
 * @since 1.0.0
 */
public enum OperatorKind {

    /**
     * 생성 연산자 (a+).
     */
    CREATION("a+"),

    /**
     * 소멸 연산자 (a-).
     */
    ANNIHILATION("a-");

    private final String symbol;

    OperatorKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public OperatorKind adjoint() {
        return this == CREATION ? ANNIHILATION : CREATION;
    }
}
