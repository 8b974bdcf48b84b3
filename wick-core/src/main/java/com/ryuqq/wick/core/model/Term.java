package com.ryuqq.wick.core.model;

import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.text.ExpressionPrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 유리수 계수 × 텐서 인자 × 연산자 열.
 *
 * <p>{@code normalOrdered == true}인 Term은 정규곱 {@code { ... }}을 나타냅니다.
 * 중괄호 표기 자체가 정규곱 연산이므로 내부 연산자 순서는 부호를 제외하면 자유롭습니다.
 * 일반 곱(중괄호 없음)을 정규곱들의 합으로 바꾸는 것은 Wick 엔진만 수행합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>불변 객체 (연산자·텐서 목록은 방어적 복사)</li>
 *   <li>연산자가 없는 Term은 normalOrdered == false</li>
 *   <li>두 번 이상 등장하는 index는 합산(dummy) index로 간주</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Term term = Term.builder()
 *     .coefficient(RationalNumber.of(1, 2))
 *     .tensor(TensorLabel.of("t", List.of(a1), List.of(o0), Symmetry.ANTISYMMETRIC))
 *     .operator(Operator.creation(a1))
 *     .operator(Operator.annihilation(o0))
 *     .build();
 * // 1/2 t^{a1}_{o0} a+(a1) a-(o0)
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class Term {

    private final RationalNumber coefficient;
    private final List<Operator> operators;
    private final List<TensorLabel> tensors;
    private final boolean normalOrdered;

    private Term(RationalNumber coefficient, List<Operator> operators, List<TensorLabel> tensors,
                 boolean normalOrdered) {
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient cannot be null");
        }
        this.coefficient = coefficient;
        this.operators = List.copyOf(operators);
        this.tensors = List.copyOf(tensors);
        this.normalOrdered = normalOrdered && !operators.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 계수만 있는 스칼라 Term.
     *
     * @param coefficient 계수
     * @return Term
     */
    public static Term scalar(RationalNumber coefficient) {
        return new Term(coefficient, List.of(), List.of(), false);
    }

    public RationalNumber getCoefficient() {
        return coefficient;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public List<TensorLabel> getTensors() {
        return tensors;
    }

    public boolean isNormalOrdered() {
        return normalOrdered;
    }

    public boolean hasOperators() {
        return !operators.isEmpty();
    }

    /**
     * 계수를 제외한 본문이 비어 있는지 (순수 스칼라).
     *
     * @return 연산자와 텐서가 모두 없으면 true
     */
    public boolean isScalar() {
        return operators.isEmpty() && tensors.isEmpty();
    }

    public Term withCoefficient(RationalNumber newCoefficient) {
        return new Term(newCoefficient, operators, tensors, normalOrdered);
    }

    public Term multiply(RationalNumber factor) {
        return withCoefficient(coefficient.multiply(factor));
    }

    /**
     * index 등장 횟수 (텐서 슬롯과 연산자 모두 포함, 최초 등장 순서).
     *
     * @return index → 등장 횟수
     */
    public Map<Index, Integer> indexOccurrences() {
        Map<Index, Integer> counts = new LinkedHashMap<>();
        for (TensorLabel tensor : tensors) {
            for (Index index : tensor.indices()) {
                counts.merge(index, 1, Integer::sum);
            }
        }
        for (Operator operator : operators) {
            counts.merge(operator.index(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * 합산(dummy) index: 두 번 이상 등장하는 index.
     *
     * @return dummy index 집합 (최초 등장 순서)
     */
    public Set<Index> summedIndices() {
        Set<Index> summed = new LinkedHashSet<>();
        indexOccurrences().forEach((index, count) -> {
            if (count >= 2) {
                summed.add(index);
            }
        });
        return summed;
    }

    public Set<Index> indices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(indexOccurrences().keySet()));
    }

    /**
     * index 치환.
     *
     * @param substitution 치환 맵
     * @return 치환된 Term
     */
    public Term substitute(Map<Index, Index> substitution) {
        if (substitution.isEmpty()) {
            return this;
        }
        List<Operator> replacedOperators = new ArrayList<>(operators.size());
        for (Operator operator : operators) {
            replacedOperators.add(operator.substitute(substitution));
        }
        List<TensorLabel> replacedTensors = new ArrayList<>(tensors.size());
        for (TensorLabel tensor : tensors) {
            replacedTensors.add(tensor.substitute(substitution));
        }
        return new Term(coefficient, replacedOperators, replacedTensors, normalOrdered);
    }

    /**
     * Hermitian adjoint.
     *
     * <p>연산자 순서를 뒤집고 생성/소멸을 교환하며, 텐서의 위/아래 첨자를 교환합니다.
     * 계수는 실수로 간주합니다.</p>
     *
     * @return adjoint Term
     */
    public Term adjoint() {
        List<Operator> reversed = new ArrayList<>(operators.size());
        for (int i = operators.size() - 1; i >= 0; i--) {
            reversed.add(operators.get(i).adjoint());
        }
        List<TensorLabel> adjointTensors = new ArrayList<>(tensors.size());
        for (TensorLabel tensor : tensors) {
            adjointTensors.add(tensor.adjoint());
        }
        return new Term(coefficient, reversed, adjointTensors, normalOrdered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Term term = (Term) o;
        return normalOrdered == term.normalOrdered
            && coefficient.equals(term.coefficient)
            && operators.equals(term.operators)
            && tensors.equals(term.tensors);
    }

    @Override
    public int hashCode() {
        int result = coefficient.hashCode();
        result = 31 * result + operators.hashCode();
        result = 31 * result + tensors.hashCode();
        result = 31 * result + (normalOrdered ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return ExpressionPrinter.formatTerm(this);
    }

    /**
     * Term 빌더.
     */
    public static final class Builder {

        private RationalNumber coefficient = RationalNumber.ONE;
        private final List<Operator> operators = new ArrayList<>();
        private final List<TensorLabel> tensors = new ArrayList<>();
        private boolean normalOrdered;

        private Builder() {
        }

        public Builder coefficient(RationalNumber coefficient) {
            this.coefficient = coefficient;
            return this;
        }

        public Builder operator(Operator operator) {
            if (operator == null) {
                throw new IllegalArgumentException("operator cannot be null");
            }
            operators.add(operator);
            return this;
        }

        public Builder operators(List<Operator> operators) {
            operators.forEach(this::operator);
            return this;
        }

        public Builder tensor(TensorLabel tensor) {
            if (tensor == null) {
                throw new IllegalArgumentException("tensor cannot be null");
            }
            tensors.add(tensor);
            return this;
        }

        public Builder tensors(List<TensorLabel> tensors) {
            tensors.forEach(this::tensor);
            return this;
        }

        /**
         * 정규곱 {@code { ... }} 표기 여부.
         *
         * @param normalOrdered true면 중괄호 정규곱
         * @return this
         */
        public Builder normalOrdered(boolean normalOrdered) {
            this.normalOrdered = normalOrdered;
            return this;
        }

        public Term build() {
            return new Term(coefficient, operators, tensors, normalOrdered);
        }
    }
}
