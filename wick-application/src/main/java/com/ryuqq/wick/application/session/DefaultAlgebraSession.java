package com.ryuqq.wick.application.session;

import com.ryuqq.wick.application.bch.BchExpander;
import com.ryuqq.wick.application.builder.OperatorExpressionBuilder;
import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.canonical.CanonicalForm;
import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.OperatorKind;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.OccupationClass;
import com.ryuqq.wick.core.space.Space;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.space.Statistics;
import com.ryuqq.wick.core.text.ExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * AlgebraSession 기본 구현.
 *
 * <p>단일 스레드 사용을 전제로 합니다. 병렬 전개가 필요하면 병렬 runtime을 가진
 * {@link AlgebraContext}로 생성합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class DefaultAlgebraSession implements AlgebraSession {

    private static final Logger log = LoggerFactory.getLogger(DefaultAlgebraSession.class);

    private final AlgebraContext context;
    private final ExpressionParser parser;
    private final OperatorExpressionBuilder builder;
    private final BchExpander bchExpander;

    public DefaultAlgebraSession() {
        this(new AlgebraContext(new SpaceRegistry()));
    }

    public DefaultAlgebraSession(AlgebraContext context) {
        this(context, new BchExpander());
    }

    /**
     * 생성자.
     *
     * @param context 대수 컨텍스트
     * @param bchExpander BCH 전개기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultAlgebraSession(AlgebraContext context, BchExpander bchExpander) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (bchExpander == null) {
            throw new IllegalArgumentException("bchExpander cannot be null");
        }
        this.context = context;
        this.parser = new ExpressionParser(context);
        this.builder = new OperatorExpressionBuilder(context);
        this.bchExpander = bchExpander;
    }

    @Override
    public Space addSpace(String label, String statistics, String occupation, List<String> stems) {
        return addSpace(label, Statistics.fromLabel(statistics), OccupationClass.fromLabel(occupation), stems);
    }

    @Override
    public Space addSpace(String label, Statistics statistics, OccupationClass occupation, List<String> stems) {
        return addSpace(label, statistics, occupation, stems, List.of());
    }

    @Override
    public Space addSpace(String label, Statistics statistics, OccupationClass occupation, List<String> stems,
                          List<String> elementarySpaces) {
        Space space = context.getRegistry().addSpace(label, statistics, occupation, stems, elementarySpaces);
        log.info("Space added: label={}, statistics={}, occupation={}, stems={}, elementary={}",
            space.label(), space.statistics(), space.occupation(), space.stems(), space.elementarySpaces());
        return space;
    }

    @Override
    public void resetRegistry() {
        context.getRegistry().reset();
        log.info("Space registry reset (epoch {})", context.getRegistry().epoch());
    }

    @Override
    public SpaceRegistry registry() {
        return context.getRegistry();
    }

    @Override
    public AlgebraContext context() {
        return context;
    }

    @Override
    public Operator buildOperator(OperatorKind kind, String indexSpec) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return new Operator(kind, parser.parseIndex(indexSpec));
    }

    @Override
    public Expression buildExpression(String text) {
        Expression expression = parser.parse(text);
        log.debug("Parsed expression with {} terms", expression.size());
        return expression;
    }

    @Override
    public Expression buildOperatorExpr(String tensorName, List<String> components, boolean antisymmetrize) {
        return builder.build(tensorName, components, antisymmetrize);
    }

    @Override
    public Expression buildOperatorExpr(String tensorName, List<String> components, boolean normalOrdered,
                                        Symmetry symmetry, RationalNumber coefficient) {
        return builder.build(tensorName, components, normalOrdered, symmetry, coefficient);
    }

    @Override
    public Expression bchSeries(Expression base, Expression generator, int order) {
        return bchExpander.bchSeries(base, generator, order);
    }

    @Override
    public CanonicalForm canonicalize(Term term) {
        return context.getCanonicalizer().canonicalize(term);
    }

    @Override
    public Expression canonicalize(Expression expression) {
        return expression.canonicalize();
    }

    @Override
    public Expression normalOrder(Term term) {
        return Expression.of(context, term).normalOrdered();
    }

    @Override
    public RationalNumber dot(Expression left, Expression right) {
        return left.dot(right);
    }

    @Override
    public double norm(Expression expression) {
        return expression.norm();
    }
}
