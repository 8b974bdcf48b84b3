package com.ryuqq.wick.application.builder;

import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.algebra.Expression;
import com.ryuqq.wick.core.algebra.WeightedTerm;
import com.ryuqq.wick.core.error.ConfigurationException;
import com.ryuqq.wick.core.model.Symmetry;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.number.RationalNumber;
import com.ryuqq.wick.core.space.OccupationClass;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.space.Statistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OperatorExpressionBuilder 유닛 테스트.
 *
 * @author Wick Team
 * @since 1.0.0
 */
class OperatorExpressionBuilderTest {

    private SpaceRegistry registry;
    private OperatorExpressionBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new SpaceRegistry();
        registry.addSpace("o", Statistics.FERMION, OccupationClass.OCCUPIED, List.of("i", "j", "k", "l"));
        registry.addSpace("a", Statistics.FERMION, OccupationClass.GENERAL, List.of("u", "v", "w", "x"));
        registry.addSpace("v", Statistics.FERMION, OccupationClass.UNOCCUPIED, List.of("a", "b", "c", "d"));
        builder = new OperatorExpressionBuilder(new AlgebraContext(registry));
    }

    @Test
    void 이중_여기_패턴() {
        // when
        Expression t2 = builder.build("T", List.of("v+ v+ o o"), true);

        // then
        assertThat(t2.size()).isEqualTo(1);
        assertThat(t2.toString()).isEqualTo("T^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }");
    }

    @Test
    void 단일_여기와_탈여기_패턴() {
        // when
        Expression t1 = builder.build("T", List.of("v+ o"), true);
        Expression l1 = builder.build("L", List.of("o+ v"), true);

        // then
        assertThat(t1.toString()).isEqualTo("T^{o0}_{v0} { a+(v0) a-(o0) }");
        assertThat(l1.toString()).isEqualTo("L^{v0}_{o0} { a+(o0) a-(v0) }");
    }

    @Test
    void 소멸_연산자는_오른쪽부터_배정() {
        // when
        Term term = builder.buildTerm("T", "v+ a+ a o", true);

        // then
        assertThat(term.toString()).isEqualTo("T^{o0,a1}_{v0,a0} { a+(v0) a+(a0) a-(a1) a-(o0) }");
    }

    @Test
    void 구성_요소마다_Term_하나() {
        // when
        Expression t = builder.build("T", List.of("v+ o", "v+ v+ o o"), true);

        // then
        assertThat(t.size()).isEqualTo(2);
        List<Integer> ranks = new ArrayList<>();
        for (WeightedTerm weighted : t) {
            ranks.add(weighted.term().getOperators().size());
        }
        assertThat(ranks).containsExactly(2, 4);
    }

    @Test
    void 반대칭화하지_않으면_대칭성_없음() {
        // when
        Term antisymmetric = builder.buildTerm("T", "v+ v+ o o", true);
        Term plain = builder.buildTerm("U", "v+ v+ o o", false);

        // then
        assertThat(antisymmetric.getTensors().get(0).symmetry()).isEqualTo(Symmetry.ANTISYMMETRIC);
        assertThat(plain.getTensors().get(0).symmetry()).isEqualTo(Symmetry.NONE);
        assertThat(plain.isNormalOrdered()).isTrue();
    }

    @Test
    void 계수와_대칭성과_정규곱_여부를_지정() {
        // when
        Expression h = builder.build("h", List.of("a+ a"), false, Symmetry.SYMMETRIC, RationalNumber.of(1, 2));

        // then
        Term term = h.terms().get(0).term();
        assertThat(h.toString()).isEqualTo("1/2 h^{a1}_{a0} a+(a0) a-(a1)");
        assertThat(term.isNormalOrdered()).isFalse();
        assertThat(term.getTensors().get(0).symmetry()).isEqualTo(Symmetry.SYMMETRIC);
    }

    @Test
    void 생성에_성공하면_사용한_ordinal이_예약됨() {
        // when
        builder.build("T", List.of("v+ v+ o o"), true);

        // then
        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry.freshIndex("o").getOrdinal()).isEqualTo(2);
        assertThat(registry.freshIndex("a").getOrdinal()).isZero();
    }

    @Test
    void 일부_구성_요소가_실패하면_registry는_변경되지_않음() {
        // when
        assertThatThrownBy(() -> builder.build("T", List.of("v+ o", "x+ o"), true))
            .isInstanceOf(ConfigurationException.class);

        // then
        assertThat(registry.isFrozen()).isFalse();
        assertThat(registry.freshIndex("v").getOrdinal()).isZero();
    }

    @Test
    void 등록되지_않은_공간은_예외() {
        assertThatThrownBy(() -> builder.build("T", List.of("x+ o"), true))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void 빈_패턴은_예외() {
        assertThatThrownBy(() -> builder.build("T", List.of(), true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.buildTerm("T", "  ", true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.buildTerm("T", "+ o", true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }
}
