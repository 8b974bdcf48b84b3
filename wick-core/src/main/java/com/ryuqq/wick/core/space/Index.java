package com.ryuqq.wick.core.space;

/**
 * 공간 안의 index 슬롯.
 *
 * <p>(space label, ordinal) 쌍으로 동일성이 결정됩니다. epoch는 index를 발급한
 * {@link SpaceRegistry}의 세대 표식이며, reset 이후 재사용을 검출하는 데만 쓰입니다
 * (equals/hashCode에 포함되지 않음).</p>
 *
 * <p><strong>출력 형식:</strong> "o0" (축약형), 입력 형식은 "o_0"도 허용</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class Index implements Comparable<Index> {

    private final String label;
    private final int ordinal;
    private final long epoch;

    Index(String label, int ordinal, long epoch) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Index label cannot be null or blank");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("Index ordinal must be non-negative (current: " + ordinal + ")");
        }
        this.label = label;
        this.ordinal = ordinal;
        this.epoch = epoch;
    }

    public String getLabel() {
        return label;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public long getEpoch() {
        return epoch;
    }

    /**
     * 같은 공간, 다른 ordinal의 index 생성 (같은 epoch 유지).
     *
     * @param newOrdinal 새 ordinal
     * @return Index
     */
    public Index withOrdinal(int newOrdinal) {
        return newOrdinal == ordinal ? this : new Index(label, newOrdinal, epoch);
    }

    public boolean sameSpace(Index other) {
        return label.equals(other.label);
    }

    /**
     * 입력 문법 형식 ("o_0").
     *
     * @return 입력 형식 문자열
     */
    public String toInputForm() {
        return label + "_" + ordinal;
    }

    @Override
    public int compareTo(Index other) {
        int byLabel = label.compareTo(other.label);
        return byLabel != 0 ? byLabel : Integer.compare(ordinal, other.ordinal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Index index = (Index) o;
        return ordinal == index.ordinal && label.equals(index.label);
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + ordinal;
    }

    @Override
    public String toString() {
        return label + ordinal;
    }
}
