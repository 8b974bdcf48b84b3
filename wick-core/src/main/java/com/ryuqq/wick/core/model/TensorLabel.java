package com.ryuqq.wick.core.model;

import com.ryuqq.wick.core.space.Index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 기호 계수 배열 참조 (평가되지 않음).
 *
 * <p>출력 형식: {@code T^{o0,o1}_{v0,v1}}. 위 첨자 그룹과 아래 첨자 그룹은 각각
 * {@link Symmetry}에 따라 내부 순열이 허용됩니다.</p>
 *
 * @param name 텐서 이름 (영숫자, 영문자로 시작)
 * @param upper 위 첨자 index (순서 유지)
 * @param lower 아래 첨자 index (순서 유지)
 * @param symmetry 슬롯 대칭성
 *
 * @author Wick Team
 * @since 1.0.0
 */
public record TensorLabel(
    String name,
    List<Index> upper,
    List<Index> lower,
    Symmetry symmetry
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 이름이 잘못된 경우
     */
    public TensorLabel {
        if (name == null || !name.matches("^[A-Za-z][A-Za-z0-9]*$")) {
            throw new IllegalArgumentException("Tensor name must be alphanumeric and start with a letter (current: " + name + ")");
        }
        if (upper == null || lower == null) {
            throw new IllegalArgumentException("Tensor index lists cannot be null");
        }
        if (symmetry == null) {
            throw new IllegalArgumentException("symmetry cannot be null");
        }
        upper = List.copyOf(upper);
        lower = List.copyOf(lower);
    }

    public static TensorLabel of(String name, List<Index> upper, List<Index> lower, Symmetry symmetry) {
        return new TensorLabel(name, upper, lower, symmetry);
    }

    public int rank() {
        return upper.size() + lower.size();
    }

    /**
     * 모든 index (위 첨자 다음 아래 첨자).
     *
     * @return index 목록
     */
    public List<Index> indices() {
        List<Index> all = new ArrayList<>(upper);
        all.addAll(lower);
        return all;
    }

    public TensorLabel substitute(Map<Index, Index> substitution) {
        return new TensorLabel(name, replace(upper, substitution), replace(lower, substitution), symmetry);
    }

    /**
     * Hermitian adjoint (위/아래 첨자 교환).
     *
     * @return adjoint 텐서
     */
    public TensorLabel adjoint() {
        return new TensorLabel(name, lower, upper, symmetry);
    }

    /**
     * 대칭성 선언 비교용 식별자 (이름 + 슬롯 개수).
     *
     * @return 예: "T(2,2)"
     */
    public String signature() {
        return name + "(" + upper.size() + "," + lower.size() + ")";
    }

    @Override
    public String toString() {
        return name + "^{" + join(upper) + "}_{" + join(lower) + "}";
    }

    private static String join(List<Index> indices) {
        return indices.stream().map(Index::toString).collect(Collectors.joining(","));
    }

    private static List<Index> replace(List<Index> indices, Map<Index, Index> substitution) {
        List<Index> replaced = new ArrayList<>(indices.size());
        for (Index index : indices) {
            replaced.add(substitution.getOrDefault(index, index));
        }
        return replaced;
    }
}
