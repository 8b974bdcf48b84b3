package com.ryuqq.wick.core.algebra;

import com.ryuqq.wick.core.canonical.CanonicalForm;
import com.ryuqq.wick.core.canonical.Canonicalizer;
import com.ryuqq.wick.core.canonical.TermKey;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.text.ExpressionPrinter;
import com.ryuqq.wick.core.wick.OperatorProduct;
import com.ryuqq.wick.core.wick.TrueVacuumContractionRule;
import com.ryuqq.wick.core.wick.WickEngine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 정규형 키로 병합되는 Term들의 합.
 *
 * <p>키마다 처음 병합된 Term의 표시 형태와, 정규형 기준 계수를 보관합니다.
 * 계수가 0이 된 항목은 즉시 제거됩니다.</p>
 *
 * <p><strong>변경 연산:</strong> {@code add}, {@code subtract}, {@code scalarMultiply}, {@code reindex}는 receiver를 변경하고
 * {@code this}를 반환합니다. 각 호출은 원자적이며, 모든 Term의 정규화와 대칭성 검사가 끝난 뒤에만
 * 병합합니다. 실패하면 receiver는 변경되지 않습니다.</p>
 *
 * <p><strong>비변경 연산:</strong> {@code multiply}, {@code commutator}, {@code adjoint},
 * {@code normalOrdered}, {@code canonicalize}, {@code copy}는 새 Expression을 반환하고,
 * {@code dot}, {@code norm}, {@code toString}은 receiver를 읽기만 합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 단일 스레드 전용입니다.</p>
 *
 * <pre>
 * Expression e = new Expression(context)
 *     .add(vo)                          // { a+(v0) a-(o0) }
 *     .add(a0, RationalNumber.of(1, 2)); // 1/2 { a+(a0) }
 * e.toString();  // "1/2 { a+(a0) }\n+{ a+(v0) a-(o0) }"
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class Expression implements Iterable<WeightedTerm> {

    private final AlgebraContext context;
    private final LinkedHashMap<TermKey, Entry> entries = new LinkedHashMap<>();
    private final Map<String, Symmetry> declarations = new HashMap<>();

    public Expression(AlgebraContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * 단일 Term Expression.
     *
     * @param context 컨텍스트
     * @param term Term (계수 포함)
     * @return Expression
     */
    public static Expression of(AlgebraContext context, Term term) {
        return new Expression(context).add(term);
    }

    public AlgebraContext getContext() {
        return context;
    }

    // ========================================
    // 변경 연산
    // ========================================

    public Expression add(Term term) {
        return add(term, RationalNumber.ONE);
    }

    /**
     * factor × term 추가.
     *
     * @param term Term (계수 포함)
     * @param factor 추가 배율
     * @return this
     * @throws com.ryuqq.wick.core.error.SymmetryException 대칭성 선언이 기존 Term과 모순되는 경우
     */
    public Expression add(Term term, RationalNumber factor) {
        if (term == null || factor == null) {
            throw new IllegalArgumentException("term and factor cannot be null");
        }
        return merge(List.of(term.multiply(factor)));
    }

    public Expression add(Expression other) {
        return add(other, RationalNumber.ONE);
    }

    /**
     * factor × other 추가.
     *
     * @param other 더할 Expression
     * @param factor 배율
     * @return this
     */
    public Expression add(Expression other, RationalNumber factor) {
        if (other == null || factor == null) {
            throw new IllegalArgumentException("other and factor cannot be null");
        }
        requireSameRegistry(other);
        List<Term> terms = new ArrayList<>(other.entries.size());
        for (WeightedTerm weighted : other) {
            terms.add(weighted.term().withCoefficient(weighted.coefficient().multiply(factor)));
        }
        return merge(terms);
    }

    public Expression subtract(Term term) {
        return add(term, RationalNumber.MINUS_ONE);
    }

    public Expression subtract(Term term, RationalNumber factor) {
        return add(term, factor.negate());
    }

    public Expression subtract(Expression other) {
        return add(other, RationalNumber.MINUS_ONE);
    }

    public Expression subtract(Expression other, RationalNumber factor) {
        return add(other, factor.negate());
    }

    /**
     * 모든 계수에 factor를 곱합니다. factor가 0이면 Expression은 비게 됩니다.
     *
     * @param factor 배율
     * @return this
     */
    public Expression scalarMultiply(RationalNumber factor) {
        if (factor == null) {
            throw new IllegalArgumentException("factor cannot be null");
        }
        if (factor.isZero()) {
            entries.clear();
            return this;
        }
        for (Entry entry : entries.values()) {
            entry.coefficient = entry.coefficient.multiply(factor);
        }
        return this;
    }

    /**
     * 모든 Term의 index를 동시에 치환합니다 (예: {@code o0 → o1, o1 → o0}).
     *
     * <p>치환 후 같은 정규형이 된 Term은 병합되고, 배타 원리로 0이 된 Term은 제거됩니다.
     * 치환 결과의 index는 registry에 예약됩니다. 실패하면 receiver는 변경되지 않습니다.</p>
     *
     * @param substitution 이전 index → 새 index
     * @return this
     * @throws com.ryuqq.wick.core.error.ConfigurationException 이전 epoch의 index가 포함된 경우
     */
    public Expression reindex(Map<Index, Index> substitution) {
        if (substitution == null) {
            throw new IllegalArgumentException("substitution cannot be null");
        }
        SpaceRegistry registry = context.getRegistry();
        for (Map.Entry<Index, Index> mapping : substitution.entrySet()) {
            if (mapping.getKey() == null || mapping.getValue() == null) {
                throw new IllegalArgumentException("substitution cannot contain null indices");
            }
            registry.requireCurrent(mapping.getKey());
            registry.requireCurrent(mapping.getValue());
        }
        List<Term> substituted = new ArrayList<>(entries.size());
        for (WeightedTerm weighted : this) {
            substituted.add(weighted.toTerm().substitute(substitution));
        }
        Expression reindexed = new Expression(context).merge(substituted);
        registry.reserve(substitution.values());

        entries.clear();
        entries.putAll(reindexed.entries);
        return this;
    }

    private Expression merge(List<Term> terms) {
        Canonicalizer canonicalizer = context.getCanonicalizer();
        Map<String, Symmetry> pendingDeclarations = new HashMap<>(declarations);
        List<Pending> pending = new ArrayList<>(terms.size());
        for (Term term : terms) {
            Canonicalizer.declareSymmetries(term, pendingDeclarations);
            if (term.getCoefficient().isZero()) {
                continue;
            }
            CanonicalForm form = canonicalizer.canonicalize(term);
            if (!form.isZero()) {
                pending.add(new Pending(term, form));
            }
        }

        declarations.putAll(pendingDeclarations);
        context.recordSymmetries(pendingDeclarations);
        for (Pending item : pending) {
            RationalNumber contribution = item.term.getCoefficient().multiply(item.form.getSign());
            Entry entry = entries.get(item.form.getKey());
            if (entry == null) {
                entries.put(item.form.getKey(),
                    new Entry(item.term.withCoefficient(RationalNumber.ONE), item.form.getSign(), contribution));
                continue;
            }
            entry.coefficient = entry.coefficient.add(contribution);
            if (entry.coefficient.isZero()) {
                entries.remove(item.form.getKey());
            }
        }
        return this;
    }

    // ========================================
    // 조회
    // ========================================

    public int size() {
        return entries.size();
    }

    public boolean isZero() {
        return entries.isEmpty();
    }

    /**
     * 참 진공 기준 정규 순서 여부: 모든 Term에서 생성 연산자가 소멸 연산자보다 앞에 옵니다.
     *
     * <p>중괄호 여부와 무관하게 연산자 배열만 봅니다. 영 Expression은 true입니다.</p>
     *
     * @return 모든 Term이 참 진공 정규 순서면 true
     */
    public boolean isVacuumNormalOrdered() {
        for (Entry entry : entries.values()) {
            boolean annihilatorSeen = false;
            for (Operator operator : entry.display.getOperators()) {
                if (!operator.isCreation()) {
                    annihilatorSeen = true;
                } else if (annihilatorSeen) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 처음 병합된 순서의 (Term, 계수) 목록. 매 호출마다 새 목록을 반환합니다.
     *
     * @return 순회 항목 목록
     */
    public List<WeightedTerm> terms() {
        List<WeightedTerm> terms = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            terms.add(entry.weighted());
        }
        return terms;
    }

    /**
     * 정규형 키 순서의 (Term, 계수) 목록 (출력 순서).
     *
     * @return 정렬된 순회 항목 목록
     */
    public List<WeightedTerm> sortedTerms() {
        List<Map.Entry<TermKey, Entry>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));
        List<WeightedTerm> terms = new ArrayList<>(sorted.size());
        for (Map.Entry<TermKey, Entry> entry : sorted) {
            terms.add(entry.getValue().weighted());
        }
        return terms;
    }

    @Override
    public Iterator<WeightedTerm> iterator() {
        return terms().iterator();
    }

    /**
     * term의 정규형과 같은 키를 갖는 항목의 계수 (term 본문 기준).
     *
     * @param term 조회할 Term (계수 무시)
     * @return 계수, 없으면 0
     */
    public RationalNumber coefficientOf(Term term) {
        CanonicalForm form = context.getCanonicalizer().canonicalize(term);
        if (form.isZero()) {
            return RationalNumber.ZERO;
        }
        Entry entry = entries.get(form.getKey());
        return entry == null ? RationalNumber.ZERO : entry.coefficient.multiply(form.getSign());
    }

    /**
     * 내적: 양쪽에 공통으로 있는 정규형 Term에 대해 계수 곱의 합 (정규직교 기저 가정).
     *
     * @param other 다른 Expression
     * @return 내적
     */
    public RationalNumber dot(Expression other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        requireSameRegistry(other);
        RationalNumber sum = RationalNumber.ZERO;
        for (Map.Entry<TermKey, Entry> entry : entries.entrySet()) {
            Entry match = other.entries.get(entry.getKey());
            if (match != null) {
                sum = sum.add(entry.getValue().coefficient.multiply(match.coefficient));
            }
        }
        return sum;
    }

    /**
     * 노름 {@code sqrt(dot(this, this))}.
     *
     * @return 0 이상, 영 Expression일 때만 0
     */
    public double norm() {
        return Math.sqrt(dot(this).toDouble());
    }

    // ========================================
    // 새 Expression을 반환하는 연산
    // ========================================

    public Expression copy() {
        Expression copy = new Expression(context);
        copy.declarations.putAll(declarations);
        for (Map.Entry<TermKey, Entry> entry : entries.entrySet()) {
            Entry source = entry.getValue();
            copy.entries.put(entry.getKey(), new Entry(source.display, source.displaySign, source.coefficient));
        }
        return copy;
    }

    /**
     * 모든 표시 형태를 정규형으로 바꾼 Expression. 두 번 적용해도 결과가 같습니다.
     *
     * @return 정규화된 새 Expression
     */
    public Expression canonicalize() {
        Expression result = new Expression(context);
        result.declarations.putAll(declarations);
        for (Map.Entry<TermKey, Entry> entry : entries.entrySet()) {
            Term canonical = context.getCanonicalizer().canonicalize(entry.getValue().display).getCanonical();
            result.entries.put(entry.getKey(), new Entry(canonical, 1, entry.getValue().coefficient));
        }
        return result;
    }

    /**
     * 연산자 곱 {@code this × other} (Wick 엔진으로 정규곱 전개).
     *
     * <p>오른쪽 Term의 합산 index는 왼쪽 Term의 index와 겹치지 않도록 재명명됩니다.</p>
     *
     * @param other 오른쪽 인자
     * @return 새 Expression
     */
    public Expression multiply(Expression other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        requireSameRegistry(other);
        List<OperatorProduct> products = new ArrayList<>(entries.size() * other.entries.size());
        for (WeightedTerm left : this) {
            for (WeightedTerm right : other) {
                products.add(OperatorProduct.product(left.toTerm(), right.toTerm()));
            }
        }
        return collect(context.getEngine(), products);
    }

    /**
     * 교환자 {@code [this, other] = this·other − other·this}.
     *
     * @param other 오른쪽 인자
     * @return 새 Expression
     */
    public Expression commutator(Expression other) {
        return multiply(other).subtract(other.multiply(this));
    }

    /**
     * Hermitian adjoint (계수는 실수로 간주).
     *
     * @return 새 Expression
     */
    public Expression adjoint() {
        Expression result = new Expression(context);
        for (WeightedTerm weighted : this) {
            result.add(weighted.toTerm().adjoint());
        }
        return result;
    }

    /**
     * 컨텍스트의 축약 규칙(기본: Fermi vacuum)에 대한 정규 순서화.
     *
     * @return 정규곱 Term들의 새 Expression
     */
    public Expression normalOrdered() {
        return normalOrdered(context.getEngine());
    }

    /**
     * 참 진공(true vacuum)에 대한 정규 순서화: 소멸 연산자를 생성 연산자 오른쪽으로 옮깁니다.
     *
     * <p>결과 Term은 정규형 표시(생성 연산자가 먼저)로 반환되므로 {@link #isVacuumNormalOrdered()}가 true입니다.</p>
     *
     * <p>입력은 중괄호 없는 연산자 곱이어야 의미가 있습니다. 중괄호 Term은 이미 정규곱인 하나의 블록으로
     * 취급되어 축약 없이 부호와 함께 재배열만 됩니다. Fermi vacuum 기준 정규곱을 참 진공 기준으로 다시
     * 전개하지는 않습니다.</p>
     *
     * @return 정규곱 Term들의 새 Expression
     */
    public Expression vacuumNormalOrdered() {
        return vacuumNormalOrdered(false);
    }

    /**
     * 참 진공 정규 순서화.
     *
     * @param onlySameIndexContractions true면 같은 index끼리만 축약 (서로 다른 index는 다른 spin orbital)
     * @return 정규곱 Term들의 새 Expression
     */
    public Expression vacuumNormalOrdered(boolean onlySameIndexContractions) {
        return normalOrdered(context.getEngine().withRule(new TrueVacuumContractionRule(onlySameIndexContractions)))
            .canonicalize();
    }

    private Expression normalOrdered(WickEngine engine) {
        List<OperatorProduct> products = new ArrayList<>(entries.size());
        for (WeightedTerm weighted : this) {
            products.add(OperatorProduct.of(weighted.toTerm()));
        }
        return collect(engine, products);
    }

    private Expression collect(WickEngine engine, List<OperatorProduct> products) {
        Expression result = new Expression(context);
        result.merge(context.getRuntime().expandAll(engine, products));
        return result;
    }

    private void requireSameRegistry(Expression other) {
        if (other.context.getRegistry() != context.getRegistry()) {
            throw new IllegalArgumentException("Expressions built on different space registries cannot be combined");
        }
    }

    // ========================================
    // Object
    // ========================================

    /**
     * 값 동등성: 같은 정규형 키 집합과 같은 계수.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Expression that = (Expression) o;
        if (entries.size() != that.entries.size()) {
            return false;
        }
        for (Map.Entry<TermKey, Entry> entry : entries.entrySet()) {
            Entry match = that.entries.get(entry.getKey());
            if (match == null || !match.coefficient.equals(entry.getValue().coefficient)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<TermKey, Entry> entry : entries.entrySet()) {
            hash += Objects.hash(entry.getKey(), entry.getValue().coefficient);
        }
        return hash;
    }

    /**
     * 출력 문법 형식 (정규형 키 순서, 영 Expression은 빈 문자열).
     */
    @Override
    public String toString() {
        return ExpressionPrinter.format(this);
    }

    private record Pending(Term term, CanonicalForm form) {
    }

    /**
     * 키별 항목: 표시 Term(계수 1), 표시 부호(display = displaySign × canonical), 정규형 기준 계수.
     */
    private static final class Entry {

        private final Term display;
        private final int displaySign;
        private RationalNumber coefficient;

        Entry(Term display, int displaySign, RationalNumber coefficient) {
            this.display = display;
            this.displaySign = displaySign;
            this.coefficient = coefficient;
        }

        WeightedTerm weighted() {
            return new WeightedTerm(display, coefficient.multiply(displaySign));
        }
    }
}
