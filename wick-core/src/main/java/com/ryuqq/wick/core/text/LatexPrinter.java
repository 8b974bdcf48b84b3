package com.ryuqq.wick.core.text;

import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.algebra.WeightedTerm;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * LaTeX 출력기.
 *
 * <p>index는 공간의 stem 이름으로 표기합니다 (o0 → i, o1 → j, stem이 모자라면 i', j', ...).</p>
 *
 * <pre>
 * + \frac{1}{2} {T}^{i j}_{a b} \{ \hat{a}^\dagger_{a} \hat{a}^\dagger_{b} \hat{a}_{j} \hat{a}_{i} \}
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class LatexPrinter {

    public static final String DEFAULT_SEPARATOR = " \\\\ \n";

    private final SpaceRegistry registry;

    public LatexPrinter(SpaceRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    public String format(Expression expression) {
        return format(expression, DEFAULT_SEPARATOR);
    }

    /**
     * Expression을 LaTeX로 출력 (정규형 키 순서).
     *
     * @param expression 출력할 Expression
     * @param separator Term 사이 구분자
     * @return LaTeX 문자열
     */
    public String format(Expression expression, String separator) {
        List<String> lines = new ArrayList<>();
        for (WeightedTerm weighted : expression.sortedTerms()) {
            lines.add(formatTerm(weighted.toTerm()));
        }
        return String.join(separator, lines);
    }

    public String formatTerm(Term term) {
        RationalNumber coefficient = term.getCoefficient();
        StringBuilder sb = new StringBuilder(coefficient.signum() < 0 ? "-" : "+");
        RationalNumber magnitude = coefficient.abs();
        boolean bare = term.isScalar();
        if (!magnitude.isOne() || bare) {
            sb.append(' ').append(magnitude.isInteger()
                ? magnitude.getNumerator().toString()
                : "\\frac{" + magnitude.getNumerator() + "}{" + magnitude.getDenominator() + "}");
        }
        for (TensorLabel tensor : term.getTensors()) {
            sb.append(" {").append(tensor.name()).append("}^{").append(stems(tensor.upper()))
                .append("}_{").append(stems(tensor.lower())).append('}');
        }
        if (term.hasOperators()) {
            List<String> operators = new ArrayList<>();
            for (Operator operator : term.getOperators()) {
                String stem = stem(operator.index());
                operators.add(operator.isCreation() ? "\\hat{a}^\\dagger_{" + stem + "}" : "\\hat{a}_{" + stem + "}");
            }
            String joined = String.join(" ", operators);
            sb.append(' ').append(term.isNormalOrdered() ? "\\{ " + joined + " \\}" : joined);
        }
        return sb.toString();
    }

    private String stems(List<Index> indices) {
        List<String> names = new ArrayList<>(indices.size());
        for (Index index : indices) {
            names.add(stem(index));
        }
        return String.join(" ", names);
    }

    private String stem(Index index) {
        return registry.spaceOf(index).stemName(index.getOrdinal());
    }
}
