package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.model.TensorLabel;

/**
 * 두 연산자 축약의 값.
 *
 * <ul>
 *   <li>{@link Type#ZERO}: 축약 소멸</li>
 *   <li>{@link Type#KRONECKER}: δ(p,q). 같은 index면 1, 아니면 합산 index 치환 또는 delta 인자</li>
 *   <li>{@link Type#SYMBOLIC}: 해석되지 않은 기호 텐서 (general 공간의 밀도 행렬)</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class Contraction {

    /**
     * 축약 값의 종류.
     */
    public enum Type {
        ZERO,
        KRONECKER,
        SYMBOLIC
    }

    private static final Contraction ZERO = new Contraction(Type.ZERO, null);
    private static final Contraction KRONECKER = new Contraction(Type.KRONECKER, null);

    private final Type type;
    private final TensorLabel symbol;

    private Contraction(Type type, TensorLabel symbol) {
        this.type = type;
        this.symbol = symbol;
    }

    public static Contraction zero() {
        return ZERO;
    }

    public static Contraction kronecker() {
        return KRONECKER;
    }

    /**
     * 기호 축약 생성.
     *
     * @param symbol 축약을 나타내는 텐서
     * @return Contraction
     * @throws IllegalArgumentException symbol이 null인 경우
     */
    public static Contraction symbolic(TensorLabel symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null for a symbolic contraction");
        }
        return new Contraction(Type.SYMBOLIC, symbol);
    }

    public Type getType() {
        return type;
    }

    /**
     * 기호 텐서 조회.
     *
     * @return SYMBOLIC일 때만 non-null
     */
    public TensorLabel getSymbolOrNull() {
        return symbol;
    }

    public boolean isZero() {
        return type == Type.ZERO;
    }

    @Override
    public String toString() {
        return type == Type.SYMBOLIC ? "Contraction{" + symbol + '}' : "Contraction{" + type + '}';
    }
}
