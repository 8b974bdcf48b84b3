package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wick 엔진 입력: 정규곱 블록들의 곱.
 *
 * <p>중괄호 Term은 블록 하나, 중괄호 없는 Term은 연산자마다 블록 하나가 됩니다.
 * 같은 블록 안의 연산자끼리는 축약하지 않습니다.</p>
 *
 * <pre>
 * {a+(o0) a-(o1)} × {a+(v0) a-(v1)}   → blocks [[a+(o0), a-(o1)], [a+(v0), a-(v1)]]
 * a+(a1) a-(o0)                       → blocks [[a+(a1)], [a-(o0)]]
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class OperatorProduct {

    private final RationalNumber coefficient;
    private final List<TensorLabel> tensors;
    private final List<List<Operator>> blocks;

    private OperatorProduct(RationalNumber coefficient, List<TensorLabel> tensors, List<List<Operator>> blocks) {
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient cannot be null");
        }
        this.coefficient = coefficient;
        this.tensors = List.copyOf(tensors);
        List<List<Operator>> copied = new ArrayList<>(blocks.size());
        for (List<Operator> block : blocks) {
            if (!block.isEmpty()) {
                copied.add(List.copyOf(block));
            }
        }
        this.blocks = List.copyOf(copied);
    }

    /**
     * 단일 Term을 블록 곱으로 변환.
     *
     * @param term 변환할 Term
     * @return OperatorProduct
     */
    public static OperatorProduct of(Term term) {
        if (term == null) {
            throw new IllegalArgumentException("term cannot be null");
        }
        return new OperatorProduct(term.getCoefficient(), term.getTensors(), blocksOf(term));
    }

    /**
     * 두 Term의 곱 (오른쪽 Term의 합산 index를 왼쪽과 겹치지 않도록 재명명).
     *
     * <p>자유 index(한 번만 등장)는 외부 label이므로 재명명하지 않습니다.</p>
     *
     * @param left 왼쪽 Term
     * @param right 오른쪽 Term
     * @return left × right
     */
    public static OperatorProduct product(Term left, Term right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Product operands cannot be null");
        }
        Term renamed = right.substitute(renameApart(left, right));

        List<TensorLabel> tensors = new ArrayList<>(left.getTensors());
        tensors.addAll(renamed.getTensors());
        List<List<Operator>> blocks = new ArrayList<>(blocksOf(left));
        blocks.addAll(blocksOf(renamed));
        return new OperatorProduct(left.getCoefficient().multiply(renamed.getCoefficient()), tensors, blocks);
    }

    public RationalNumber getCoefficient() {
        return coefficient;
    }

    public List<TensorLabel> getTensors() {
        return tensors;
    }

    public List<List<Operator>> getBlocks() {
        return blocks;
    }

    /**
     * 전체 연산자 개수.
     *
     * @return 모든 블록의 연산자 수 합
     */
    public int size() {
        int size = 0;
        for (List<Operator> block : blocks) {
            size += block.size();
        }
        return size;
    }

    /**
     * 곱 전체에서 두 번 이상 등장하는 index.
     *
     * @return 합산 index 집합
     */
    public Set<Index> summedIndices() {
        Term.Builder flat = Term.builder().tensors(tensors);
        for (List<Operator> block : blocks) {
            flat.operators(block);
        }
        return flat.build().summedIndices();
    }

    private static List<List<Operator>> blocksOf(Term term) {
        List<List<Operator>> blocks = new ArrayList<>();
        if (term.isNormalOrdered()) {
            blocks.add(term.getOperators());
        } else {
            for (Operator operator : term.getOperators()) {
                blocks.add(List.of(operator));
            }
        }
        return blocks;
    }

    private static Map<Index, Index> renameApart(Term left, Term right) {
        Set<Index> taken = left.indices();
        Map<String, Integer> nextOrdinal = new HashMap<>();
        for (Index index : taken) {
            nextOrdinal.merge(index.getLabel(), index.getOrdinal() + 1, Math::max);
        }
        for (Index index : right.indices()) {
            nextOrdinal.merge(index.getLabel(), index.getOrdinal() + 1, Math::max);
        }

        Map<Index, Index> renaming = new HashMap<>();
        for (Index summed : right.summedIndices()) {
            if (taken.contains(summed)) {
                int ordinal = nextOrdinal.merge(summed.getLabel(), 1, Integer::sum) - 1;
                renaming.put(summed, summed.withOrdinal(ordinal));
            }
        }
        return renaming;
    }

    @Override
    public String toString() {
        return "OperatorProduct{coefficient=" + coefficient + ", tensors=" + tensors + ", blocks=" + blocks + '}';
    }
}
