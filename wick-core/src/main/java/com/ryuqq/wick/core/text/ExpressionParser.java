package com.ryuqq.wick.core.text;

import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.error.ExpressionParseException;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.OperatorKind;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.Index;
import com.ryuqq.wick.core.space.SpaceRegistry;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 텍스트 문법 파서 (재귀 하강).
 *
 * <pre>
 * expression    := term (sign term)*
 * term          := [sign] [rational] tensor* [operator_block]
 * rational      := integer ["/" integer]
 * tensor        := name "^{" [index ("," index)*] "}" "_{" [index ("," index)*] "}"
 * operator_block:= "{" op+ "}" | op+
 * op            := ("a+" | "a-") "(" index ")"
 * index         := label ["_"] ordinal      (예: o_0, o0)
 * </pre>
 *
 * <p>중괄호는 정규곱을 나타내며 그대로 보존됩니다. 빈 텍스트는 영 Expression입니다.
 * 텐서 대칭성은 텍스트로 표현되지 않으므로 {@link AlgebraContext#resolveSymmetry(String, int, int)}
 * (기록된 선언, 예약 이름, 기본 대칭성 순) 또는 호출 인자를 따릅니다. 따라서 엔진이 만든
 * {@code delta}, {@code gamma1}, {@code eta1}과 빌더가 만든 텐서는 출력 후 다시 파싱해도 같은 Expression이 됩니다.</p>
 *
 * <p>파싱 중에는 registry를 바꾸지 않습니다. 입력 전체가 성공한 뒤에만 사용된 index를
 * {@link SpaceRegistry#reserve(java.util.Collection)}로 예약(및 freeze)합니다.</p>
 *
 * <p>파서 인스턴스는 호출마다 새 상태를 쓰므로 재사용할 수 있습니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class ExpressionParser {

    private final AlgebraContext context;

    public ExpressionParser(AlgebraContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    /**
     * 기본 텐서 대칭성으로 파싱.
     *
     * @param text 입력 텍스트
     * @return Expression
     * @throws ExpressionParseException 잘못된 입력, 등록되지 않은 공간, 0 분모
     */
    public Expression parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return parse(new Cursor(text, context, null));
    }

    /**
     * 지정 텐서 대칭성으로 파싱.
     *
     * @param text 입력 텍스트
     * @param symmetry 예약 이름을 제외한 모든 텐서 인자에 적용할 대칭성 (기록된 선언보다 우선)
     * @return Expression
     * @throws ExpressionParseException 잘못된 입력, 등록되지 않은 공간, 0 분모
     */
    public Expression parse(String text, Symmetry symmetry) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (symmetry == null) {
            throw new IllegalArgumentException("symmetry cannot be null");
        }
        return parse(new Cursor(text, context, symmetry));
    }

    private Expression parse(Cursor cursor) {
        List<Term> terms = cursor.terms();
        Expression expression = new Expression(context);
        for (Term term : terms) {
            expression.add(term);
        }
        context.getRegistry().reserve(cursor.drafted);
        return expression;
    }

    /**
     * 단일 Term 파싱.
     *
     * @param text 입력 텍스트 (Term 하나)
     * @return Term
     * @throws ExpressionParseException 잘못된 입력이거나 Term이 하나가 아닌 경우
     */
    public Term parseTerm(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        Cursor cursor = new Cursor(text, context, null);
        List<Term> terms = cursor.terms();
        if (terms.size() != 1) {
            throw new ExpressionParseException("Expected exactly one term but found " + terms.size(), 0);
        }
        context.getRegistry().reserve(cursor.drafted);
        return terms.get(0);
    }

    /**
     * index 명세 파싱 ("o_0" 또는 "o0").
     *
     * @param text index 텍스트
     * @return Index
     * @throws ExpressionParseException 형식이 잘못되었거나 등록되지 않은 공간인 경우
     */
    public Index parseIndex(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        Cursor cursor = new Cursor(text.trim(), context, null);
        Index index = cursor.singleIndex();
        context.getRegistry().reserve(cursor.drafted);
        return index;
    }

    /**
     * 입력 위치 커서. 만든 index는 예약하지 않고 {@code drafted}에 모읍니다.
     */
    private static final class Cursor {

        private final String text;
        private final AlgebraContext context;
        private final SpaceRegistry registry;
        private final Symmetry forcedSymmetry;
        private final List<Index> drafted = new ArrayList<>();
        private int pos;

        Cursor(String text, AlgebraContext context, Symmetry forcedSymmetry) {
            this.text = text;
            this.context = context;
            this.registry = context.getRegistry();
            this.forcedSymmetry = forcedSymmetry;
        }

        List<Term> terms() {
            List<Term> terms = new ArrayList<>();
            skipWhitespace();
            while (!atEnd()) {
                terms.add(term(terms.isEmpty()));
                skipWhitespace();
            }
            return terms;
        }

        Index singleIndex() {
            Index index = index();
            if (!atEnd()) {
                throw error("Unexpected input after index");
            }
            return index;
        }

        private Term term(boolean first) {
            int start = pos;
            RationalNumber sign = RationalNumber.ONE;
            if (peek() == '+' || peek() == '-') {
                sign = next() == '-' ? RationalNumber.MINUS_ONE : RationalNumber.ONE;
                skipWhitespace();
            } else if (!first) {
                throw error("Expected '+' or '-' before term");
            }

            Term.Builder builder = Term.builder();
            boolean empty = true;
            RationalNumber coefficient = sign;
            if (!atEnd() && Character.isDigit(peek())) {
                coefficient = coefficient.multiply(rational());
                empty = false;
            }

            boolean operatorsSeen = false;
            while (true) {
                skipWhitespace();
                if (atEnd() || peek() == '+' || peek() == '-') {
                    break;
                }
                if (operatorsSeen) {
                    throw error("Unexpected input after operator block");
                }
                if (startsOperator()) {
                    builder.operators(operatorRun());
                    operatorsSeen = true;
                } else if (peek() == '{') {
                    builder.operators(bracedBlock()).normalOrdered(true);
                    operatorsSeen = true;
                } else if (Character.isLetter(peek())) {
                    builder.tensor(tensor());
                } else {
                    throw error("Unexpected character '" + peek() + "'");
                }
                empty = false;
            }
            if (empty) {
                pos = start;
                throw error("Empty term");
            }
            return builder.coefficient(coefficient).build();
        }

        private RationalNumber rational() {
            int start = pos;
            BigInteger numerator = integer();
            BigInteger denominator = BigInteger.ONE;
            if (!atEnd() && peek() == '/') {
                pos++;
                denominator = integer();
            }
            try {
                return RationalNumber.of(numerator, denominator);
            } catch (ArithmeticException e) {
                throw new ExpressionParseException("Zero denominator in coefficient", start, e);
            }
        }

        private BigInteger integer() {
            int start = pos;
            while (!atEnd() && Character.isDigit(peek())) {
                pos++;
            }
            if (start == pos) {
                throw error("Expected digits");
            }
            return new BigInteger(text.substring(start, pos));
        }

        private List<Operator> operatorRun() {
            List<Operator> operators = new ArrayList<>();
            while (true) {
                operators.add(operator());
                skipWhitespace();
                if (atEnd() || !startsOperator()) {
                    return operators;
                }
            }
        }

        private List<Operator> bracedBlock() {
            expect('{');
            skipWhitespace();
            List<Operator> operators = new ArrayList<>();
            while (!atEnd() && peek() != '}') {
                if (!startsOperator()) {
                    throw error("Only operators are allowed inside '{ }'");
                }
                operators.add(operator());
                skipWhitespace();
            }
            expect('}');
            if (operators.isEmpty()) {
                throw error("Empty operator block");
            }
            return operators;
        }

        private boolean startsOperator() {
            return text.startsWith("a+(", pos) || text.startsWith("a-(", pos);
        }

        private Operator operator() {
            OperatorKind kind = text.charAt(pos + 1) == '+' ? OperatorKind.CREATION : OperatorKind.ANNIHILATION;
            pos += 3;
            skipWhitespace();
            Index index = index();
            skipWhitespace();
            expect(')');
            return new Operator(kind, index);
        }

        private TensorLabel tensor() {
            int start = pos;
            while (!atEnd() && Character.isLetterOrDigit(peek())) {
                pos++;
            }
            String name = text.substring(start, pos);
            expect('^');
            List<Index> upper = indexGroup();
            expect('_');
            List<Index> lower = indexGroup();
            return TensorLabel.of(name, upper, lower, symmetryOf(name, upper.size(), lower.size()));
        }

        private Symmetry symmetryOf(String name, int upperCount, int lowerCount) {
            if (forcedSymmetry == null) {
                return context.resolveSymmetry(name, upperCount, lowerCount);
            }
            return AlgebraContext.isReservedName(name) ? Symmetry.NONE : forcedSymmetry;
        }

        private List<Index> indexGroup() {
            expect('{');
            skipWhitespace();
            List<Index> indices = new ArrayList<>();
            if (!atEnd() && peek() == '}') {
                pos++;
                return indices;
            }
            while (true) {
                indices.add(index());
                skipWhitespace();
                if (!atEnd() && peek() == ',') {
                    pos++;
                    skipWhitespace();
                    continue;
                }
                expect('}');
                return indices;
            }
        }

        private Index index() {
            int start = pos;
            while (!atEnd() && Character.isLetter(peek())) {
                pos++;
            }
            String label = text.substring(start, pos);
            if (label.isEmpty()) {
                throw error("Expected index");
            }
            if (!registry.hasSpace(label)) {
                pos = start;
                throw error("Unknown space label '" + label + "'");
            }
            if (!atEnd() && peek() == '_') {
                pos++;
            }
            int ordinalStart = pos;
            BigInteger ordinal = integer();
            if (ordinal.bitLength() > 31) {
                pos = ordinalStart;
                throw error("Index ordinal out of range");
            }
            Index index = registry.draftIndex(label, ordinal.intValue());
            drafted.add(index);
            return index;
        }

        private void expect(char expected) {
            if (atEnd() || peek() != expected) {
                throw error("Expected '" + expected + "'");
            }
            pos++;
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private char peek() {
            return text.charAt(pos);
        }

        private char next() {
            return text.charAt(pos++);
        }

        private ExpressionParseException error(String message) {
            return new ExpressionParseException(message, pos);
        }
    }
}
