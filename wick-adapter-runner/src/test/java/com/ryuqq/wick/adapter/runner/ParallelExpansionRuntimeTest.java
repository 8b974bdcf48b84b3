package com.ryuqq.wick.adapter.runner;

import com.ryuqq.wick.core.algebra.AlgebraContext;
import com.ryuqq.wick.core.error.ResourceLimitException;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.space.OccupationClass;
import com.ryuqq.wick.core.space.SpaceRegistry;
import com.ryuqq.wick.core.space.Statistics;
import com.ryuqq.wick.core.spi.SequentialExpansionRuntime;
import com.ryuqq.wick.core.text.ExpressionParser;
import com.ryuqq.wick.core.wick.OperatorProduct;
import com.ryuqq.wick.core.wick.WickEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * ParallelExpansionRuntime 유닛 테스트.
 *
 * @author Wick Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ParallelExpansionRuntimeTest {

    @Mock
    private WickEngine failingEngine;

    private SpaceRegistry registry;
    private WickEngine engine;
    private ExpressionParser parser;
    private ParallelExpansionRuntime runtime;

    @BeforeEach
    void setUp() {
        registry = new SpaceRegistry();
        registry.addSpace("o", Statistics.FERMION, OccupationClass.OCCUPIED, List.of("i", "j", "k", "l"));
        registry.addSpace("a", Statistics.FERMION, OccupationClass.GENERAL, List.of("u", "v", "w", "x"));
        registry.addSpace("v", Statistics.FERMION, OccupationClass.UNOCCUPIED, List.of("a", "b", "c", "d"));
        engine = new WickEngine(registry);
        parser = new ExpressionParser(new AlgebraContext(registry));
        runtime = new ParallelExpansionRuntime(new ParallelRuntimeConfig(3, 0, 30_000));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runtime.shutdown();
    }

    private List<OperatorProduct> products() {
        List<Term> left = List.of(
            parser.parseTerm("f^{a_0}_{a_1} { a+(a_0) a-(a_1) }"),
            parser.parseTerm("{ a+(o_0) a-(v_0) }"),
            parser.parseTerm("t^{o_0}_{v_0} { a+(v_0) a-(o_0) }"));
        List<Term> right = List.of(
            parser.parseTerm("{ a+(v_1) a-(o_1) }"),
            parser.parseTerm("g^{a_2}_{a_3} { a+(a_2) a-(a_3) }"));
        List<OperatorProduct> products = new ArrayList<>();
        for (Term l : left) {
            for (Term r : right) {
                products.add(OperatorProduct.product(l, r));
            }
        }
        return products;
    }

    // ========== 결과 ==========

    @Test
    void 순차_runtime과_같은_결과를_같은_순서로_반환() {
        // given
        List<OperatorProduct> products = products();

        // when
        List<Term> parallel = runtime.expandAll(engine, products);
        List<Term> sequential = new SequentialExpansionRuntime().expandAll(engine, products);

        // then
        assertThat(parallel).isNotEmpty();
        assertThat(parallel).containsExactlyElementsOf(sequential);
    }

    @Test
    void 임계값_이하는_호출_스레드에서_순차_전개() {
        // given
        ParallelExpansionRuntime inline = new ParallelExpansionRuntime(new ParallelRuntimeConfig(2, 100, 30_000));
        List<OperatorProduct> products = products();

        try {
            // when
            List<Term> results = inline.expandAll(engine, products);

            // then
            assertThat(results).containsExactlyElementsOf(new SequentialExpansionRuntime().expandAll(engine, products));
        } finally {
            try {
                inline.shutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Test
    void 빈_목록은_빈_결과() {
        assertThat(runtime.expandAll(engine, List.of())).isEmpty();
    }

    @Test
    void 전개_전에_registry를_freeze() {
        // given
        SpaceRegistry fresh = new SpaceRegistry();
        fresh.addSpace("o", Statistics.FERMION, OccupationClass.OCCUPIED, List.of("i"));

        // when
        runtime.expandAll(new WickEngine(fresh), List.of());

        // then
        assertThat(fresh.isFrozen()).isTrue();
    }

    // ========== 예외 ==========

    @Test
    void 전개_예외는_원래_타입으로_전파() {
        // given
        when(failingEngine.getRegistry()).thenReturn(registry);
        when(failingEngine.expand(any())).thenThrow(new ResourceLimitException("too many terms", 10));

        // when & then
        assertThatThrownBy(() -> runtime.expandAll(failingEngine, products()))
            .isInstanceOf(ResourceLimitException.class)
            .hasMessageContaining("too many terms");
    }

    @Test
    void shutdown_이후_호출은_IllegalStateException() throws InterruptedException {
        // given
        runtime.shutdown();

        // when & then
        assertThat(runtime.isShutdown()).isTrue();
        assertThatThrownBy(() -> runtime.expandAll(engine, products()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }

    @Test
    void null_인자는_예외() {
        assertThatThrownBy(() -> runtime.expandAll(null, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> runtime.expandAll(engine, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParallelExpansionRuntime(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
