package com.ryuqq.wick.core.model;

/**
 * 텐서 슬롯 그룹(위 첨자 그룹, 아래 첨자 그룹) 내부 순열에 대한 대칭성.
 *
 * @author Wick Team
 * @since 1.0.0
 */
public enum Symmetry {

    /**
     * 슬롯 순열 불가.
     */
    NONE,

    /**
     * 순열 시 부호 불변.
     */
    SYMMETRIC,

    /**
     * 전치 1회당 부호 -1.
     */
    ANTISYMMETRIC;

    public boolean permitsSlotPermutation() {
        return this != NONE;
    }

    /**
     * 주어진 parity의 순열에 대한 부호.
     *
     * @param oddPermutation 홀순열 여부
     * @return 1 또는 -1
     */
    public int permutationSign(boolean oddPermutation) {
        return this == ANTISYMMETRIC && oddPermutation ? -1 : 1;
    }
}
