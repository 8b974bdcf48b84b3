package com.ryuqq.wick.core.wick;

import com.ryuqq.wick.core.error.ResourceLimitException;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.Space;
import com.ryuqq.wick.core.space.SpaceRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 일반화된 Wick 정리에 의한 정규 순서화 엔진.
 *
 * <p>정규곱 블록들의 곱을 정규곱 Term들의 합으로 전개합니다. 입력과 출력은 값이 같습니다.</p>
 *
 * <p><strong>알고리즘 (명시적 작업 큐):</strong></p>
 * <pre>
 * queue ← [초기 상태: 누적 정규곱 = 빈 열]
 * while queue 비어 있지 않음:
 *   state ← poll
 *   모든 연산자를 소비했으면 → 결과 Term 생성 (δ 해소, 배타 원리 검사)
 *   y ← 다음 연산자
 *   1. 축약하지 않는 분기: 누적 정규곱 끝에 y 추가
 *   2. 다른 블록에서 온 누적 연산자 x마다:
 *      ⟨x y⟩ ≠ 0 이면 x를 제거한 분기 추가
 *      부호 = (-1)^(x와 y 사이 페르미온 연산자 수)
 * </pre>
 *
 * <p><strong>종료성:</strong> 각 단계에서 남은 연산자 수가 정확히 1 감소합니다.
 * 상태 수는 입력 길이에 대해 지수적으로 증가할 수 있으며,
 * {@link ExpansionLimits#maxTerms()}를 넘으면 {@link ResourceLimitException}을 던집니다.</p>
 *
 * <p><strong>δ 해소:</strong> 같은 index의 δ는 1입니다. 서로 다른 index면 곱에서 두 번 이상
 * 등장하는(합산) index를 치환하고, 둘 다 자유 index면 {@code delta^{p}_{q}} 인자를 남깁니다.</p>
 *
 * <p><strong>동시성:</strong> 상태를 갖지 않으므로 여러 스레드에서 동시에 호출할 수 있습니다.
 * 단, registry는 freeze 상태여야 합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class WickEngine {

    public static final String KRONECKER_DELTA = "delta";

    private final SpaceRegistry registry;
    private final ContractionRule rule;
    private final ExpansionLimits limits;

    /**
     * 생성자 (Fermi vacuum 규칙, 기본 상한).
     *
     * @param registry 공간 registry
     */
    public WickEngine(SpaceRegistry registry) {
        this(registry, new FermiVacuumContractionRule(), new ExpansionLimits());
    }

    /**
     * 생성자.
     *
     * @param registry 공간 registry
     * @param rule 축약 규칙
     * @param limits 전개 상한
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WickEngine(SpaceRegistry registry, ContractionRule rule, ExpansionLimits limits) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        this.registry = registry;
        this.rule = rule;
        this.limits = limits;
    }

    /**
     * 같은 registry와 상한을 쓰는 다른 규칙의 엔진.
     *
     * @param otherRule 축약 규칙
     * @return 새 WickEngine
     */
    public WickEngine withRule(ContractionRule otherRule) {
        return new WickEngine(registry, otherRule, limits);
    }

    public SpaceRegistry getRegistry() {
        return registry;
    }

    public ContractionRule getRule() {
        return rule;
    }

    public ExpansionLimits getLimits() {
        return limits;
    }

    /**
     * 단일 Term 정규 순서화.
     *
     * <p>이미 정규곱인 Term(블록 하나)은 그대로 반환됩니다 (배타 원리로 0이 되는 경우 제외).</p>
     *
     * @param term 입력 Term
     * @return 정규곱 Term 목록 (합이 입력과 같음)
     */
    public List<Term> normalOrder(Term term) {
        return expand(OperatorProduct.of(term));
    }

    /**
     * 블록 곱 전개.
     *
     * @param product 입력 곱
     * @return 정규곱 Term 목록 (BFS 순서: 축약 없는 Term이 먼저)
     * @throws ResourceLimitException 작업량이 상한을 넘는 경우
     * @throws com.ryuqq.wick.core.error.ConfigurationException 이전 epoch의 index를 포함한 경우
     */
    public List<Term> expand(OperatorProduct product) {
        if (product == null) {
            throw new IllegalArgumentException("product cannot be null");
        }
        if (product.getCoefficient().isZero()) {
            return List.of();
        }

        List<Slot> slots = flatten(product);
        Set<Index> summed = product.summedIndices();

        List<Term> results = new ArrayList<>();
        ArrayDeque<WickState> queue = new ArrayDeque<>();
        queue.add(WickState.initial(product.getCoefficient()));

        while (!queue.isEmpty()) {
            WickState state = queue.poll();
            if (state.next == slots.size()) {
                Term term = finish(state, slots, product.getTensors(), summed);
                if (term != null) {
                    results.add(term);
                }
                continue;
            }

            Slot incoming = slots.get(state.next);
            queue.add(state.append(state.next));

            for (int i = 0; i < state.normal.size(); i++) {
                Slot candidate = slots.get(state.normal.get(i));
                if (candidate.block == incoming.block
                    || !candidate.operator.index().sameSpace(incoming.operator.index())) {
                    continue;
                }
                Contraction contraction = rule.contract(candidate.operator, incoming.operator, incoming.space);
                if (contraction.isZero()) {
                    continue;
                }
                int sign = incoming.space.isFermionic() ? crossingSign(state, slots, i) : 1;
                queue.add(state.contract(i, new ContractedPair(candidate, incoming, contraction), sign));
            }

            if (queue.size() + results.size() > limits.maxTerms()) {
                throw new ResourceLimitException(
                    "Wick expansion of " + slots.size() + " operators exceeded the term limit", limits.maxTerms());
            }
        }
        return results;
    }

    private List<Slot> flatten(OperatorProduct product) {
        List<Slot> slots = new ArrayList<>(product.size());
        List<List<Operator>> blocks = product.getBlocks();
        for (int block = 0; block < blocks.size(); block++) {
            for (Operator operator : blocks.get(block)) {
                slots.add(new Slot(operator, block, registry.spaceOf(operator.index())));
            }
        }
        for (TensorLabel tensor : product.getTensors()) {
            for (Index index : tensor.indices()) {
                registry.requireCurrent(index);
            }
        }
        return slots;
    }

    private static int crossingSign(WickState state, List<Slot> slots, int position) {
        int crossed = 0;
        for (int j = position + 1; j < state.normal.size(); j++) {
            if (slots.get(state.normal.get(j)).space.isFermionic()) {
                crossed++;
            }
        }
        return crossed % 2 == 0 ? 1 : -1;
    }

    /**
     * 완료된 상태를 결과 Term으로 변환. 배타 원리로 소멸하면 null.
     */
    private Term finish(WickState state, List<Slot> slots, List<TensorLabel> tensors, Set<Index> summed) {
        Map<Index, Index> substitution = new HashMap<>();
        List<TensorLabel> extraTensors = new ArrayList<>();
        List<Index[]> freeDeltas = new ArrayList<>();

        for (ContractedPair pair : state.contractions) {
            switch (pair.contraction.getType()) {
                case SYMBOLIC -> extraTensors.add(pair.contraction.getSymbolOrNull());
                case KRONECKER -> {
                    Index p = chase(substitution, pair.left.operator.index());
                    Index q = chase(substitution, pair.right.operator.index());
                    if (p.equals(q)) {
                        break;
                    }
                    if (summed.contains(q)) {
                        substitution.put(q, p);
                    } else if (summed.contains(p)) {
                        substitution.put(p, q);
                    } else {
                        freeDeltas.add(new Index[]{p, q});
                    }
                }
                case ZERO -> {
                    return null;
                }
            }
        }

        Map<Index, Index> resolved = new HashMap<>();
        for (Index key : substitution.keySet()) {
            resolved.put(key, chase(substitution, key));
        }

        List<Operator> operators = new ArrayList<>(state.normal.size());
        Set<Operator> seenFermions = new HashSet<>();
        for (int position : state.normal) {
            Slot slot = slots.get(position);
            Operator operator = slot.operator.substitute(resolved);
            if (slot.space.isFermionic() && !seenFermions.add(operator)) {
                return null;
            }
            operators.add(operator);
        }

        Term.Builder builder = Term.builder()
            .coefficient(state.coefficient)
            .normalOrdered(true);
        for (TensorLabel tensor : tensors) {
            builder.tensor(tensor.substitute(resolved));
        }
        for (TensorLabel symbol : extraTensors) {
            builder.tensor(symbol.substitute(resolved));
        }
        for (Index[] delta : freeDeltas) {
            Index p = resolved.getOrDefault(delta[0], delta[0]);
            Index q = resolved.getOrDefault(delta[1], delta[1]);
            if (!p.equals(q)) {
                builder.tensor(TensorLabel.of(KRONECKER_DELTA, List.of(p), List.of(q), Symmetry.NONE));
            }
        }
        return builder.operators(operators).build();
    }

    private static Index chase(Map<Index, Index> substitution, Index index) {
        Index current = index;
        Index next = substitution.get(current);
        while (next != null) {
            current = next;
            next = substitution.get(current);
        }
        return current;
    }

    private record Slot(Operator operator, int block, Space space) {
    }

    private record ContractedPair(Slot left, Slot right, Contraction contraction) {
    }

    /**
     * 작업 큐 상태: 누적 계수, 누적 정규곱(slot 위치), 축약 목록, 다음 연산자 위치.
     */
    private static final class WickState {

        private final RationalNumber coefficient;
        private final List<Integer> normal;
        private final List<ContractedPair> contractions;
        private final int next;

        private WickState(RationalNumber coefficient, List<Integer> normal,
                          List<ContractedPair> contractions, int next) {
            this.coefficient = coefficient;
            this.normal = normal;
            this.contractions = contractions;
            this.next = next;
        }

        static WickState initial(RationalNumber coefficient) {
            return new WickState(coefficient, List.of(), List.of(), 0);
        }

        WickState append(int position) {
            List<Integer> extended = new ArrayList<>(normal);
            extended.add(position);
            return new WickState(coefficient, extended, contractions, next + 1);
        }

        WickState contract(int normalPosition, ContractedPair pair, int sign) {
            List<Integer> reduced = new ArrayList<>(normal);
            reduced.remove(normalPosition);
            List<ContractedPair> extended = new ArrayList<>(contractions);
            extended.add(pair);
            RationalNumber signed = sign < 0 ? coefficient.negate() : coefficient;
            return new WickState(signed, reduced, extended, next + 1);
        }
    }
}
