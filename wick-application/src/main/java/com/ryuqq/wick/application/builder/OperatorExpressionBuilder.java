package com.ryuqq.wick.application.builder;

import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 공간 패턴으로부터 텐서 × 정규곱 연산자 Expression 생성.
 *
 * <p>패턴의 각 토큰은 공간 label이며, {@code +}가 붙으면 생성 연산자, 없으면 소멸 연산자입니다.</p>
 *
 * <p><strong>index 배정 규칙 (구성 요소마다 공간별 ordinal 0부터):</strong></p>
 * <ol>
 *   <li>생성 연산자: 왼쪽에서 오른쪽으로</li>
 *   <li>소멸 연산자: 오른쪽에서 왼쪽으로 (생성 연산자 다음 ordinal부터)</li>
 *   <li>텐서 위 첨자: 소멸 연산자 index (배정 순서), 아래 첨자: 생성 연산자 index</li>
 * </ol>
 *
 * <pre>
 * "v+ v+ o o"  → T^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }
 * "v+ a+ a o"  → T^{o0,a1}_{v0,a0} { a+(v0) a+(a0) a-(a1) a-(o0) }
 * </pre>
 *
 * <p>antisymmetrize가 true면 텐서는 반대칭, 아니면 대칭성 없음으로 선언됩니다.
 * index는 registry 상태를 바꾸지 않고 만든 뒤, 생성이 끝나면 한꺼번에 예약합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class OperatorExpressionBuilder {

    private static final String CREATION_SUFFIX = "+";

    private final AlgebraContext context;

    public OperatorExpressionBuilder(AlgebraContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * 구성 요소마다 Term 하나를 갖는 Expression 생성 (중괄호 정규곱, 계수 1).
     *
     * @param name 텐서 이름
     * @param components 공간 패턴 목록 (예: "v+ v+ o o")
     * @param antisymmetrize 반대칭 텐서 여부
     * @return Expression
     * @throws IllegalArgumentException 패턴이 비었거나 잘못된 경우
     * @throws com.ryuqq.wick.core.error.ConfigurationException 등록되지 않은 공간 label인 경우
     */
    public Expression build(String name, List<String> components, boolean antisymmetrize) {
        return build(name, components, true, antisymmetrize ? Symmetry.ANTISYMMETRIC : Symmetry.NONE,
            RationalNumber.ONE);
    }

    /**
     * 구성 요소마다 Term 하나를 갖는 Expression 생성.
     *
     * <p>모든 구성 요소가 성공한 뒤에만 사용된 index를 registry에 예약합니다.
     * 실패하면 registry는 바뀌지 않습니다.</p>
     *
     * @param name 텐서 이름
     * @param components 공간 패턴 목록
     * @param normalOrdered true면 중괄호 정규곱, false면 단순 연산자 곱
     * @param symmetry 텐서 대칭성
     * @param coefficient 모든 Term에 곱할 계수
     * @return Expression
     * @throws IllegalArgumentException 인자가 null이거나 패턴이 잘못된 경우
     * @throws com.ryuqq.wick.core.error.ConfigurationException 등록되지 않은 공간 label인 경우
     */
    public Expression build(String name, List<String> components, boolean normalOrdered, Symmetry symmetry,
                            RationalNumber coefficient) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("components cannot be null or empty");
        }
        if (symmetry == null || coefficient == null) {
            throw new IllegalArgumentException("symmetry and coefficient cannot be null");
        }
        List<Term> terms = new ArrayList<>(components.size());
        List<Index> drafted = new ArrayList<>();
        for (String component : components) {
            Term term = draftTerm(name, component, normalOrdered, symmetry, drafted);
            terms.add(term.withCoefficient(coefficient));
        }
        Expression expression = new Expression(context);
        for (Term term : terms) {
            expression.add(term);
        }
        context.getRegistry().reserve(drafted);
        return expression;
    }

    /**
     * 단일 패턴의 Term 생성 (정규화하지 않음).
     *
     * @param name 텐서 이름
     * @param component 공간 패턴
     * @param antisymmetrize 반대칭 텐서 여부
     * @return 중괄호 Term
     */
    public Term buildTerm(String name, String component, boolean antisymmetrize) {
        List<Index> drafted = new ArrayList<>();
        Term term = draftTerm(name, component, true,
            antisymmetrize ? Symmetry.ANTISYMMETRIC : Symmetry.NONE, drafted);
        context.getRegistry().reserve(drafted);
        return term;
    }

    private Term draftTerm(String name, String component, boolean normalOrdered, Symmetry symmetry,
                           List<Index> drafted) {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Operator pattern cannot be null or blank");
        }
        SpaceRegistry registry = context.getRegistry();
        String[] tokens = component.trim().split("\\s+");
        boolean[] creation = new boolean[tokens.length];
        String[] labels = new String[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            creation[i] = tokens[i].endsWith(CREATION_SUFFIX);
            labels[i] = creation[i] ? tokens[i].substring(0, tokens[i].length() - 1) : tokens[i];
            if (labels[i].isEmpty()) {
                throw new IllegalArgumentException("Malformed operator pattern token: '" + tokens[i] + "'");
            }
            registry.space(labels[i]);
        }

        Map<String, Integer> counters = new HashMap<>();
        Index[] assigned = new Index[tokens.length];
        List<Index> lower = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            if (creation[i]) {
                assigned[i] = next(registry, counters, labels[i]);
                lower.add(assigned[i]);
            }
        }
        List<Index> upper = new ArrayList<>();
        for (int i = tokens.length - 1; i >= 0; i--) {
            if (!creation[i]) {
                assigned[i] = next(registry, counters, labels[i]);
                upper.add(assigned[i]);
            }
        }

        Term.Builder builder = Term.builder()
            .tensor(TensorLabel.of(name, upper, lower, symmetry))
            .normalOrdered(normalOrdered);
        for (int i = 0; i < tokens.length; i++) {
            builder.operator(creation[i] ? Operator.creation(assigned[i]) : Operator.annihilation(assigned[i]));
        }
        Term term = builder.build();
        drafted.addAll(List.of(assigned));
        return term;
    }

    private static Index next(SpaceRegistry registry, Map<String, Integer> counters, String label) {
        int ordinal = counters.merge(label, 1, Integer::sum) - 1;
        return registry.draftIndex(label, ordinal);
    }
}
