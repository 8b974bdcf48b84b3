package com.ryuqq.wick.core.canonical;

import com.ryuqq.wick.core.error.ResourceLimitException;
import com.ryuqq.wick.core.error.SymmetryException;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.wick.ExpansionLimits;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Term 정규형 계산기.
 *
 * <p>허용된 모든 재배열(텐서 인자 교환, (반)대칭 슬롯 순열, 정규곱 내부 연산자 재배열,
 * 합산 index 재명명) 중 사전식 최소 키를 갖는 대표를 찾고, 원래 Term과의 부호를 보고합니다.</p>
 *
 * <p><strong>절차:</strong></p>
 * <ol>
 *   <li>대칭성 선언 검사 (같은 이름·차수, 다른 대칭성 → {@link SymmetryException})</li>
 *   <li>소멸 검사: 반대칭 텐서의 같은 그룹 내 중복 index, 정규곱 내 중복 페르미온 연산자</li>
 *   <li>텐서를 (이름, 위 차수, 아래 차수, 대칭성)으로 분류하고, 같은 분류 내 순서와
 *       슬롯 순열을 백트래킹으로 탐색 (접두부가 현재 최솟값보다 크면 가지치기)</li>
 *   <li>합산 index는 처음 등장하는 순서대로 자유 index가 쓰지 않는 가장 작은 ordinal로 재명명</li>
 *   <li>정규곱 내부 연산자 정렬: 생성 연산자 오름차순, 소멸 연산자 내림차순 (페르미온 전치당 -1)</li>
 *   <li>같은 최소 키에 서로 다른 부호로 도달하면 Term은 0</li>
 * </ol>
 *
 * <p>탐색 후보 수가 {@link ExpansionLimits#maxCanonicalCandidates()}를 넘으면
 * {@link ResourceLimitException}을 던집니다. 상태를 갖지 않으므로 스레드 안전합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class Canonicalizer {

    private static final Comparator<TensorLabel> TENSOR_CLASS_ORDER = Comparator
        .comparing(TensorLabel::name)
        .thenComparingInt(tensor -> tensor.upper().size())
        .thenComparingInt(tensor -> tensor.lower().size())
        .thenComparing(TensorLabel::symmetry);

    private static final Comparator<Operator> NORMAL_ORDER = (left, right) -> {
        if (left.isCreation() != right.isCreation()) {
            return left.isCreation() ? -1 : 1;
        }
        int byIndex = left.index().compareTo(right.index());
        return left.isCreation() ? byIndex : -byIndex;
    };

    private final SpaceRegistry registry;
    private final ExpansionLimits limits;

    public Canonicalizer(SpaceRegistry registry) {
        this(registry, new ExpansionLimits());
    }

    public Canonicalizer(SpaceRegistry registry, ExpansionLimits limits) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        this.registry = registry;
        this.limits = limits;
    }

    /**
     * 정규형 계산 (계수는 무시).
     *
     * @param term 입력 Term
     * @return 정규형 또는 {@link CanonicalForm#zero()}
     * @throws SymmetryException 한 Term 안에서 대칭성 선언이 모순되는 경우
     * @throws ResourceLimitException 후보 수 상한 초과 시
     * @throws com.ryuqq.wick.core.error.ConfigurationException 이전 epoch의 index인 경우
     */
    public CanonicalForm canonicalize(Term term) {
        if (term == null) {
            throw new IllegalArgumentException("term cannot be null");
        }
        Term body = term.withCoefficient(RationalNumber.ONE);
        declareSymmetries(body, new HashMap<>());
        for (Index index : body.indices()) {
            registry.requireCurrent(index);
        }
        if (hasRepeatedAntisymmetricSlot(body) || hasRepeatedFermion(body)) {
            return CanonicalForm.zero();
        }

        Search search = new Search(body);
        search.run();
        if (search.vanishes) {
            return CanonicalForm.zero();
        }
        return CanonicalForm.of(TermKey.ofTokens(search.bestTokens), search.bestSign, search.bestTerm);
    }

    /**
     * Term의 텐서 대칭성 선언을 누적 맵과 대조하고 등록합니다.
     *
     * <p>여러 Term에 걸친 일관성 검사(Expression)에도 사용됩니다. 맵은 "이름(위,아래)" → 대칭성입니다.</p>
     *
     * @param term 검사할 Term
     * @param declared 누적 선언 (갱신됨)
     * @throws SymmetryException 같은 이름·차수에 다른 대칭성이 선언된 경우
     */
    public static void declareSymmetries(Term term, Map<String, Symmetry> declared) {
        for (TensorLabel tensor : term.getTensors()) {
            Symmetry previous = declared.putIfAbsent(tensor.signature(), tensor.symmetry());
            if (previous != null && previous != tensor.symmetry()) {
                throw new SymmetryException("Tensor " + tensor.signature() + " declared both "
                    + previous + " and " + tensor.symmetry());
            }
        }
    }

    private static boolean hasRepeatedAntisymmetricSlot(Term body) {
        for (TensorLabel tensor : body.getTensors()) {
            if (tensor.symmetry() == Symmetry.ANTISYMMETRIC
                && (hasDuplicate(tensor.upper()) || hasDuplicate(tensor.lower()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDuplicate(List<Index> indices) {
        return new HashSet<>(indices).size() != indices.size();
    }

    private boolean hasRepeatedFermion(Term body) {
        if (!body.isNormalOrdered()) {
            return false;
        }
        Set<Operator> seen = new HashSet<>();
        for (Operator operator : body.getOperators()) {
            if (registry.spaceOf(operator.index()).isFermionic() && !seen.add(operator)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 모든 순열과 parity (사전식 순서로 생성).
     */
    static List<int[]> permutations(int size) {
        List<int[]> result = new ArrayList<>();
        permute(new int[size], new boolean[size], 0, result);
        return result;
    }

    private static void permute(int[] current, boolean[] used, int position, List<int[]> result) {
        if (position == current.length) {
            result.add(current.clone());
            return;
        }
        for (int i = 0; i < current.length; i++) {
            if (!used[i]) {
                used[i] = true;
                current[position] = i;
                permute(current, used, position + 1, result);
                used[i] = false;
            }
        }
    }

    static boolean isOdd(int[] permutation) {
        int inversions = 0;
        for (int i = 0; i < permutation.length; i++) {
            for (int j = i + 1; j < permutation.length; j++) {
                if (permutation[i] > permutation[j]) {
                    inversions++;
                }
            }
        }
        return inversions % 2 == 1;
    }

    /**
     * 합산 index 재명명 상태.
     */
    private static final class Naming {

        private final Set<Index> summed;
        private final Map<String, Set<Integer>> freeOrdinals;
        private final Map<Index, Index> renamed;
        private final Map<String, Integer> cursors;

        Naming(Set<Index> summed, Map<String, Set<Integer>> freeOrdinals) {
            this(summed, freeOrdinals, new HashMap<>(), new HashMap<>());
        }

        private Naming(Set<Index> summed, Map<String, Set<Integer>> freeOrdinals,
                       Map<Index, Index> renamed, Map<String, Integer> cursors) {
            this.summed = summed;
            this.freeOrdinals = freeOrdinals;
            this.renamed = renamed;
            this.cursors = cursors;
        }

        Naming copy() {
            return new Naming(summed, freeOrdinals, new HashMap<>(renamed), new HashMap<>(cursors));
        }

        boolean isNamed(Index index) {
            return !summed.contains(index) || renamed.containsKey(index);
        }

        Index name(Index index) {
            if (!summed.contains(index)) {
                return index;
            }
            Index existing = renamed.get(index);
            if (existing != null) {
                return existing;
            }
            Set<Integer> taken = freeOrdinals.getOrDefault(index.getLabel(), Set.of());
            int ordinal = cursors.getOrDefault(index.getLabel(), 0);
            while (taken.contains(ordinal)) {
                ordinal++;
            }
            cursors.put(index.getLabel(), ordinal + 1);
            Index fresh = index.withOrdinal(ordinal);
            renamed.put(index, fresh);
            return fresh;
        }

        List<Index> name(List<Index> indices, int[] permutation) {
            List<Index> named = new ArrayList<>(indices.size());
            for (int slot : permutation) {
                named.add(name(indices.get(slot)));
            }
            return named;
        }
    }

    /**
     * 텐서 배치 백트래킹 탐색.
     */
    private final class Search {

        private final Term body;
        private final List<TensorLabel> sorted;
        private final Set<Index> summed;
        private final Map<String, Set<Integer>> freeOrdinals = new HashMap<>();
        private final Map<Integer, List<int[]>> permutationCache = new HashMap<>();

        private List<TermKey.Token> bestTokens;
        private Term bestTerm;
        private int bestSign;
        private boolean vanishes;
        private long candidates;

        Search(Term body) {
            this.body = body;
            this.sorted = new ArrayList<>(body.getTensors());
            this.sorted.sort(TENSOR_CLASS_ORDER);
            this.summed = body.summedIndices();
            for (Index index : body.indices()) {
                if (!summed.contains(index)) {
                    freeOrdinals.computeIfAbsent(index.getLabel(), label -> new HashSet<>()).add(index.getOrdinal());
                }
            }
        }

        void run() {
            place(0, new boolean[sorted.size()], new Naming(summed, freeOrdinals), 1,
                new ArrayList<>(), new ArrayList<>());
        }

        private void place(int position, boolean[] used, Naming naming, int sign,
                           List<TensorLabel> placed, List<TermKey.Token> tokens) {
            if (position == sorted.size()) {
                finish(naming, sign, placed, tokens);
                return;
            }
            TensorLabel slotClass = sorted.get(position);
            List<TensorLabel> tried = new ArrayList<>();
            for (int j = 0; j < sorted.size(); j++) {
                TensorLabel candidate = sorted.get(j);
                if (used[j] || TENSOR_CLASS_ORDER.compare(candidate, slotClass) != 0 || tried.contains(candidate)) {
                    continue;
                }
                tried.add(candidate);
                used[j] = true;
                for (int[] upperPerm : permutationsFor(candidate, candidate.upper().size())) {
                    for (int[] lowerPerm : permutationsFor(candidate, candidate.lower().size())) {
                        if (++candidates > limits.maxCanonicalCandidates()) {
                            throw new ResourceLimitException(
                                "Canonical form search for " + body + " exceeded the candidate limit",
                                limits.maxCanonicalCandidates());
                        }
                        Naming next = naming.copy();
                        TensorLabel arranged = TensorLabel.of(candidate.name(),
                            next.name(candidate.upper(), upperPerm),
                            next.name(candidate.lower(), lowerPerm),
                            candidate.symmetry());
                        List<TermKey.Token> extended = new ArrayList<>(tokens);
                        TermKey.appendTensor(extended, arranged);
                        if (bestTokens != null && TermKey.comparePrefix(extended, bestTokens) > 0) {
                            continue;
                        }
                        int slotSign = candidate.symmetry().permutationSign(isOdd(upperPerm) != isOdd(lowerPerm));
                        List<TensorLabel> nextPlaced = new ArrayList<>(placed);
                        nextPlaced.add(arranged);
                        place(position + 1, used, next, sign * slotSign, nextPlaced, extended);
                    }
                }
                used[j] = false;
            }
        }

        private List<int[]> permutationsFor(TensorLabel tensor, int size) {
            if (!tensor.symmetry().permitsSlotPermutation()) {
                int[] identity = new int[size];
                for (int i = 0; i < size; i++) {
                    identity[i] = i;
                }
                return List.<int[]>of(identity);
            }
            return permutationCache.computeIfAbsent(size, Canonicalizer::permutations);
        }

        private void finish(Naming naming, int sign, List<TensorLabel> placed, List<TermKey.Token> tokens) {
            if (body.isNormalOrdered()) {
                List<Operator> provisional = new ArrayList<>(body.getOperators());
                provisional.sort(provisionalOrder(naming));
                for (Operator operator : provisional) {
                    naming.name(operator.index());
                }
            }
            List<Operator> named = new ArrayList<>(body.getOperators().size());
            for (Operator operator : body.getOperators()) {
                named.add(new Operator(operator.kind(), naming.name(operator.index())));
            }

            int operatorSign = 1;
            if (body.isNormalOrdered()) {
                operatorSign = sortWithSign(named);
            }

            List<TermKey.Token> complete = new ArrayList<>(tokens);
            TermKey.appendOperators(complete, named, body.isNormalOrdered());
            int totalSign = sign * operatorSign;

            int cmp = bestTokens == null ? -1 : compareFull(complete, bestTokens);
            if (cmp < 0) {
                bestTokens = complete;
                bestSign = totalSign;
                bestTerm = Term.builder()
                    .tensors(placed)
                    .operators(named)
                    .normalOrdered(body.isNormalOrdered())
                    .build();
                vanishes = false;
            } else if (cmp == 0 && totalSign != bestSign) {
                vanishes = true;
            }
        }

        /**
         * 재명명 전 임시 순서: 생성 연산자 먼저, 이름이 정해진 index는 정규 순서, 미정 dummy는 뒤로.
         */
        private Comparator<Operator> provisionalOrder(Naming naming) {
            return (left, right) -> {
                if (left.isCreation() != right.isCreation()) {
                    return left.isCreation() ? -1 : 1;
                }
                boolean leftNamed = naming.isNamed(left.index());
                boolean rightNamed = naming.isNamed(right.index());
                if (leftNamed != rightNamed) {
                    return leftNamed ? -1 : 1;
                }
                if (!leftNamed) {
                    return 0;
                }
                Operator l = new Operator(left.kind(), naming.name(left.index()));
                Operator r = new Operator(right.kind(), naming.name(right.index()));
                return NORMAL_ORDER.compare(l, r);
            };
        }

        /**
         * 정규 순서로 삽입 정렬하며 페르미온 전치 부호를 계산합니다.
         */
        private int sortWithSign(List<Operator> operators) {
            int sign = 1;
            for (int i = 1; i < operators.size(); i++) {
                int j = i;
                while (j > 0 && NORMAL_ORDER.compare(operators.get(j - 1), operators.get(j)) > 0) {
                    Operator moved = operators.get(j);
                    Operator passed = operators.get(j - 1);
                    if (isFermionic(moved) && isFermionic(passed)) {
                        sign = -sign;
                    }
                    operators.set(j - 1, moved);
                    operators.set(j, passed);
                    j--;
                }
            }
            return sign;
        }

        private boolean isFermionic(Operator operator) {
            return registry.spaceOf(operator.index()).isFermionic();
        }

        private int compareFull(List<TermKey.Token> left, List<TermKey.Token> right) {
            int cmp = TermKey.comparePrefix(left, right);
            return cmp != 0 ? cmp : Integer.compare(left.size(), right.size());
        }
    }
}
