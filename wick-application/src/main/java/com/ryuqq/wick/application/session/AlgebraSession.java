package com.ryuqq.wick.application.session;

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

import java.util.List;

/**
 * 연산자 대수 세션 (공개 API).
 *
 * <p>하나의 SpaceRegistry와 AlgebraContext를 소유하며, 공간 설정 → 식 생성 → 정규 순서화 →
 * 정규화 → 대수 연산의 흐름을 하나의 진입점으로 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AlgebraSession session = new DefaultAlgebraSession();
 * session.addSpace("o", "fermion", "occupied", List.of("i", "j", "k"));
 * session.addSpace("v", "fermion", "unoccupied", List.of("a", "b", "c"));
 *
 * Expression t = session.buildOperatorExpr("T", List.of("v+ v+ o o"), true);
 * Expression f = session.buildExpression("f^{v_0}_{v_1} { a+(v_0) a-(v_1) }");
 * Expression hbar = session.bchSeries(f, t, 2);
 * </pre>
 *
 * <p><strong>수명 주기:</strong> 첫 index 생성 시 registry가 freeze됩니다.
 * {@link #resetRegistry()} 이후에는 이전에 만든 Index/Term/Expression을 사용할 수 없습니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public interface AlgebraSession {

    /**
     * 공간 추가 (문자열 설정).
     *
     * @param label 공간 label
     * @param statistics "fermion" 또는 "boson"
     * @param occupation "occupied", "unoccupied", "general"
     * @param stems index stem 목록
     * @return 등록된 Space
     * @throws com.ryuqq.wick.core.error.ConfigurationException 잘못된 설정 또는 freeze 상태
     */
    Space addSpace(String label, String statistics, String occupation, List<String> stems);

    Space addSpace(String label, Statistics statistics, OccupationClass occupation, List<String> stems);

    /**
     * 합성 공간 추가.
     *
     * @param elementarySpaces 이미 등록된 구성 기본 공간 label 목록
     * @throws com.ryuqq.wick.core.error.ConfigurationException 구성 공간이 없거나 통계가 다른 경우
     */
    Space addSpace(String label, Statistics statistics, OccupationClass occupation, List<String> stems,
                   List<String> elementarySpaces);

    /**
     * registry 초기화 (새 epoch).
     */
    void resetRegistry();

    SpaceRegistry registry();

    AlgebraContext context();

    /**
     * 단일 연산자 생성.
     *
     * @param kind 연산자 종류
     * @param indexSpec index 명세 ("o_0" 또는 "o0")
     * @return Operator
     * @throws com.ryuqq.wick.core.error.ExpressionParseException 잘못된 index 명세
     */
    Operator buildOperator(OperatorKind kind, String indexSpec);

    /**
     * 텍스트로부터 Expression 생성.
     *
     * @param text 입력 문법 텍스트
     * @return Expression
     * @throws com.ryuqq.wick.core.error.ExpressionParseException 잘못된 입력
     */
    Expression buildExpression(String text);

    /**
     * 공간 패턴으로부터 연산자 Expression 생성.
     *
     * @param tensorName 텐서 이름
     * @param components 공간 패턴 목록 (예: "v+ v+ o o")
     * @param antisymmetrize 반대칭 텐서 여부
     * @return Expression
     */
    Expression buildOperatorExpr(String tensorName, List<String> components, boolean antisymmetrize);

    /**
     * 공간 패턴으로부터 연산자 Expression 생성 (정규곱 여부, 대칭성, 계수 지정).
     *
     * @param tensorName 텐서 이름
     * @param components 공간 패턴 목록
     * @param normalOrdered true면 중괄호 정규곱
     * @param symmetry 텐서 대칭성
     * @param coefficient 모든 Term의 계수
     * @return Expression
     */
    Expression buildOperatorExpr(String tensorName, List<String> components, boolean normalOrdered,
                                 Symmetry symmetry, RationalNumber coefficient);

    /**
     * 절단된 BCH 급수.
     *
     * @param base C
     * @param generator D
     * @param order 절단 차수 (0 이상)
     * @return C + [C,D] + 1/2! [[C,D],D] + ...
     */
    Expression bchSeries(Expression base, Expression generator, int order);

    CanonicalForm canonicalize(Term term);

    /**
     * 정규형 표시로 바꾼 새 Expression (멱등).
     *
     * @param expression 입력
     * @return 정규화된 Expression
     */
    Expression canonicalize(Expression expression);

    /**
     * 단일 Term의 정규 순서화.
     *
     * @param term 입력 Term
     * @return 정규곱 Term들의 Expression
     */
    Expression normalOrder(Term term);

    RationalNumber dot(Expression left, Expression right);

    double norm(Expression expression);
}
