package com.ryuqq.wick.core.text;

import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.algebra.WeightedTerm;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;

import java.util.ArrayList;
import java.util.List;

/**
 * 텍스트 문법 출력기.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * 1/2 { a+(a0) }           첫 줄: 부호 없이 (음수면 "-")
 * +{ a+(v0) a-(o0) }       이후 줄: "\n" + 부호
 * -t^{a1}_{o0} a+(a1) a-(o0)
 * </pre>
 *
 * <ul>
 *   <li>계수 ±1은 생략 ("-"만 남음), 그 외 계수 뒤에는 공백</li>
 *   <li>연산자도 텐서도 없는 Term은 계수만 출력 ("1", "-1", "3/2")</li>
 *   <li>정규곱은 {@code { ... }}, 일반 곱은 공백으로 연결 (중괄호 추가 없음)</li>
 *   <li>영 Expression은 빈 문자열</li>
 * </ul>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {
    }

    /**
     * Expression 출력 (정규형 키 순서).
     *
     * @param expression 출력할 Expression
     * @return 텍스트 (영 Expression은 "")
     */
    public static String format(Expression expression) {
        StringBuilder sb = new StringBuilder();
        for (WeightedTerm weighted : expression.sortedTerms()) {
            String line = formatTerm(weighted.toTerm());
            if (sb.length() > 0) {
                sb.append('\n');
                if (weighted.coefficient().signum() > 0) {
                    sb.append('+');
                }
            }
            sb.append(line);
        }
        return sb.toString();
    }

    /**
     * 단일 Term 출력 (첫 줄 형식).
     *
     * @param term 출력할 Term
     * @return 텍스트
     */
    public static String formatTerm(Term term) {
        RationalNumber coefficient = term.getCoefficient();
        String body = formatBody(term);
        if (body.isEmpty()) {
            return coefficient.toString();
        }
        if (coefficient.isOne()) {
            return body;
        }
        if (coefficient.equals(RationalNumber.MINUS_ONE)) {
            return "-" + body;
        }
        return coefficient + " " + body;
    }

    /**
     * 계수를 제외한 본문 (텐서, 연산자).
     *
     * @param term Term
     * @return 본문 텍스트
     */
    public static String formatBody(Term term) {
        List<String> parts = new ArrayList<>();
        for (TensorLabel tensor : term.getTensors()) {
            parts.add(tensor.toString());
        }
        if (term.hasOperators()) {
            List<String> operators = new ArrayList<>(term.getOperators().size());
            for (Operator operator : term.getOperators()) {
                operators.add(operator.toString());
            }
            String joined = String.join(" ", operators);
            parts.add(term.isNormalOrdered() ? "{ " + joined + " }" : joined);
        }
        return String.join(" ", parts);
    }
}
